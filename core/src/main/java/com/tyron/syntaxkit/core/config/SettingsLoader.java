package com.tyron.syntaxkit.core.config;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads {@link SyntaxKitSettings} from YAML.
 * <p>
 * The classpath resource {@value #RESOURCE} is read first, then the file named by the system
 * property {@value #CONFIG_PROPERTY}, if set, is overlaid on it. Unknown keys are ignored. A file
 * that cannot be read or parsed is skipped with a warning.
 * <pre>
 * diagnostics:
 *   contextRadius: 1
 *   positionCorrection: true
 *   correctionSearchLines: 5
 * mutation:
 *   docLinePrefix: "/// "
 * </pre>
 */
public final class SettingsLoader {

    private static final Logger LOG = Logger.getLogger(SettingsLoader.class.getName());

    public static final String RESOURCE = "syntaxkit.yaml";
    public static final String CONFIG_PROPERTY = "syntaxkit.config";

    private SettingsLoader() {
    }

    public static SyntaxKitSettings load() {
        SyntaxKitSettings settings = SyntaxKitSettings.DEFAULTS;

        try (InputStream in = SettingsLoader.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                settings = overlay(settings, in, RESOURCE);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to read " + RESOURCE + " from the classpath", e);
        }

        String external = System.getProperty(CONFIG_PROPERTY);
        if (external != null && !external.isBlank()) {
            Path path = Path.of(external.trim());
            try (InputStream in = Files.newInputStream(path)) {
                settings = overlay(settings, in, path.toString());
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Failed to read settings file " + path, e);
            }
        }
        return settings;
    }

    /**
     * Applies the keys present in the YAML document to {@code base}.
     */
    public static SyntaxKitSettings overlay(SyntaxKitSettings base, InputStream in, String sourceName) {
        Object doc;
        try {
            doc = new Yaml().load(in);
        } catch (YAMLException e) {
            LOG.log(Level.WARNING, "Malformed settings in " + sourceName + ", keeping previous values", e);
            return base;
        }
        if (!(doc instanceof Map<?, ?> map)) {
            return base;
        }

        SyntaxKitSettings result = base;
        try {
            if (map.get("diagnostics") instanceof Map<?, ?> diagnostics) {
                Object radius = diagnostics.get("contextRadius");
                if (radius != null) {
                    result = result.withContextRadius(toInt(radius));
                }
                Object correction = diagnostics.get("positionCorrection");
                if (correction != null) {
                    result = result.withPositionCorrection(Boolean.parseBoolean(String.valueOf(correction)));
                }
                Object searchLines = diagnostics.get("correctionSearchLines");
                if (searchLines != null) {
                    result = result.withCorrectionSearchLines(toInt(searchLines));
                }
            }
            if (map.get("mutation") instanceof Map<?, ?> mutation) {
                Object prefix = mutation.get("docLinePrefix");
                if (prefix != null) {
                    result = result.withDocLinePrefix(String.valueOf(prefix));
                }
            }
        } catch (IllegalArgumentException e) {
            LOG.log(Level.WARNING, "Invalid settings value in " + sourceName + ", keeping previous values", e);
            return base;
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Loaded settings from " + sourceName + ": " + result);
        }
        return result;
    }

    private static int toInt(Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        return Integer.parseInt(String.valueOf(value).trim());
    }
}

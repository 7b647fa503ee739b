package com.tyron.syntaxkit.core.service;

import com.tyron.syntaxkit.api.diagnostics.DiagnosticExtractor;
import com.tyron.syntaxkit.api.diagnostics.SyntaxAnalysisService;
import com.tyron.syntaxkit.api.language.LanguageSupport;
import com.tyron.syntaxkit.api.mutation.SyntaxMutator;
import com.tyron.syntaxkit.api.path.PathResolver;
import com.tyron.syntaxkit.api.service.ServiceAccessHolder;
import com.tyron.syntaxkit.core.analysis.SyntaxAnalysisServiceImpl;
import com.tyron.syntaxkit.core.config.SettingsLoader;
import com.tyron.syntaxkit.core.config.SyntaxKitSettings;
import com.tyron.syntaxkit.core.diagnostics.DiagnosticExtractorImpl;
import com.tyron.syntaxkit.core.mutation.SyntaxMutationEngine;
import com.tyron.syntaxkit.core.path.TreePathResolver;

import java.util.ServiceLoader;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Installed via {@link Class#forName(String)} from {@code :api} when needed.
 */
public final class ServiceAccessBootstrap {

    private static final Logger LOG = Logger.getLogger(ServiceAccessBootstrap.class.getName());

    static {
        ServiceAccessHolder.set(new CoreServiceAccess());

        installDefaultApplicationBindings();
    }

    /**
     * Re-installs application-scoped default bindings.
     * <p>
     * Tests may call {@link ApplicationServiceManager#disposeApplication()} which clears bindings.
     */
    public static void installDefaultApplicationBindings() {
        ApplicationServiceManager.registerBindingIfAbsent(PathResolver.class, TreePathResolver.class);
        ApplicationServiceManager.registerBindingIfAbsent(DiagnosticExtractor.class, DiagnosticExtractorImpl.class);
        ApplicationServiceManager.registerBindingIfAbsent(SyntaxMutator.class, SyntaxMutationEngine.class);
        ApplicationServiceManager.registerBindingIfAbsent(SyntaxAnalysisService.class, SyntaxAnalysisServiceImpl.class);
        ApplicationServiceManager.registerInstance(SyntaxKitSettings.class, SettingsLoader.load());

        ClassLoader loader = ServiceAccessBootstrap.class.getClassLoader();
        for (ServiceLoader.Provider<LanguageSupport> provider : ServiceLoader.load(LanguageSupport.class, loader).stream().toList()) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Registering language support " + provider.type().getName());
            }
            ApplicationServiceManager.registerExtension(LanguageSupport.class, provider.type());
        }
    }

    private ServiceAccessBootstrap() {
    }
}

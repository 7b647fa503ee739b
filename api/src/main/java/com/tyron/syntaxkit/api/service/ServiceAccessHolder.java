package com.tyron.syntaxkit.api.service;

/**
 * Static entry point from api types to the service container of the core module.
 * <p>
 * The first {@link #get()} loads the core bootstrap by name, which installs the container together
 * with the default resolver, extractor, mutator and analysis service.
 */
public final class ServiceAccessHolder {

    static final String BOOTSTRAP_CLASS = "com.tyron.syntaxkit.core.service.ServiceAccessBootstrap";

    private static volatile ServiceAccess access;

    private ServiceAccessHolder() {
    }

    public static void set(ServiceAccess serviceAccess) {
        if (serviceAccess == null) throw new IllegalArgumentException("serviceAccess == null");
        access = serviceAccess;
    }

    public static ServiceAccess get() {
        ServiceAccess current = access;
        if (current == null) {
            current = bootstrap();
        }
        return current;
    }

    private static synchronized ServiceAccess bootstrap() {
        if (access == null) {
            try {
                Class.forName(BOOTSTRAP_CLASS, true, ServiceAccessHolder.class.getClassLoader());
            } catch (ClassNotFoundException e) {
                throw new IllegalStateException(
                        "syntaxkit-core is not on the classpath; it provides the services behind getInstance()", e);
            }
            if (access == null) {
                throw new IllegalStateException(BOOTSTRAP_CLASS + " did not install a ServiceAccess");
            }
        }
        return access;
    }
}

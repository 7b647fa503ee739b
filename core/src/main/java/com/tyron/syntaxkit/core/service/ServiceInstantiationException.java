package com.tyron.syntaxkit.core.service;

import org.jetbrains.annotations.Nullable;

/**
 * A bound service, the settings instance or a language support could not be created.
 */
public class ServiceInstantiationException extends RuntimeException {

    private final Class<?> serviceClass;

    ServiceInstantiationException(Class<?> serviceClass, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.serviceClass = serviceClass;
    }

    static ServiceInstantiationException unbound(Class<?> serviceClass) {
        String hint = serviceClass.getName().startsWith("com.tyron.syntaxkit.")
                ? " (defaults are installed by ServiceAccessBootstrap; was the container disposed without reinstalling them?)"
                : "";
        return new ServiceInstantiationException(serviceClass,
                "No implementation bound to " + serviceClass.getSimpleName() + hint, null);
    }

    static ServiceInstantiationException cyclic(Class<?> serviceClass) {
        return new ServiceInstantiationException(serviceClass,
                serviceClass.getSimpleName() + " depends on itself while being created", null);
    }

    /**
     * The interface or extension point whose implementation failed.
     */
    public Class<?> getServiceClass() {
        return serviceClass;
    }
}

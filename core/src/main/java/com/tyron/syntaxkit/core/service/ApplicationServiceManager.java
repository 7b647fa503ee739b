package com.tyron.syntaxkit.core.service;

import com.tyron.syntaxkit.api.language.LanguageSupport;

import java.util.List;

/**
 * The process-wide container behind every {@code getInstance()} of the api module.
 */
public final class ApplicationServiceManager {

    private static final ServiceContainer CONTAINER = new DefaultServiceContainer();

    private ApplicationServiceManager() {
    }

    public static <T> T getService(Class<T> serviceClass) {
        return CONTAINER.getService(serviceClass);
    }

    public static <T, I extends T> void registerBindingIfAbsent(Class<T> interfaceClass, Class<I> implementationClass) {
        CONTAINER.registerBindingIfAbsent(interfaceClass, implementationClass);
    }

    /**
     * Replaces the service, e.g. a {@code SyntaxKitSettings} value a test wants to use.
     */
    public static <T> void registerInstance(Class<T> serviceClass, T instance) {
        CONTAINER.registerInstance(serviceClass, instance);
    }

    public static <E, I extends E> void registerExtension(Class<E> extensionPoint, Class<I> extensionImpl) {
        CONTAINER.registerExtension(extensionPoint, extensionImpl);
    }

    public static <E> List<E> getExtensions(Class<E> extensionPoint) {
        return CONTAINER.getExtensions(extensionPoint);
    }

    /**
     * Registered language supports in registration order; the first one that can handle a document
     * parses it.
     */
    public static List<LanguageSupport> getLanguageSupports() {
        return CONTAINER.getExtensions(LanguageSupport.class);
    }

    /**
     * Forgets every service, binding and language support, then installs the defaults again.
     */
    public static void disposeApplication() {
        CONTAINER.disposeAll();
        // the bootstrap's static initializer has already run
        ServiceAccessBootstrap.installDefaultApplicationBindings();
    }
}

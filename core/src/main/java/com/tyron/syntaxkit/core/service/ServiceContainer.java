package com.tyron.syntaxkit.core.service;

import java.util.List;

/**
 * A service container: interface-to-implementation bindings, pre-built instances and extension
 * points. Services are created lazily and cached.
 */
public interface ServiceContainer {

    <T> T getService(Class<T> serviceClass);

    <T, I extends T> void registerBinding(Class<T> interfaceClass, Class<I> implementationClass);

    <T, I extends T> void registerBindingIfAbsent(Class<T> interfaceClass, Class<I> implementationClass);

    <T> void registerInstance(Class<T> serviceClass, T instance);

    <E, I extends E> void registerExtension(Class<E> extensionPoint, Class<I> extensionImpl);

    <E> List<E> getExtensions(Class<E> extensionPoint);

    /**
     * Drops all cached services, bindings and extensions in this container.
     */
    void disposeAll();
}

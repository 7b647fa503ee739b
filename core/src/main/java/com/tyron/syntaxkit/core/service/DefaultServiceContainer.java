package com.tyron.syntaxkit.core.service;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ServiceContainer} backed by concurrent maps.
 * <p>
 * Reads of already created services take no lock. Creation runs under one container-wide lock,
 * which is reentrant, so a service may look up other services from its constructor. A service
 * that reaches itself that way fails instead of recursing. Implementations need a public no-arg
 * constructor.
 */
public class DefaultServiceContainer implements ServiceContainer {

    private static final Logger LOG = Logger.getLogger(DefaultServiceContainer.class.getName());

    private final Object creationLock = new Object();

    private final Map<Class<?>, Object> instances = new ConcurrentHashMap<>();
    private final Map<Class<?>, Class<?>> bindings = new ConcurrentHashMap<>();
    private final Map<Class<?>, Set<Class<?>>> extensionTypes = new ConcurrentHashMap<>();
    private final Map<Class<?>, List<?>> extensions = new ConcurrentHashMap<>();

    // guarded by creationLock
    private final Set<Class<?>> underConstruction = new HashSet<>();

    @Override
    public <T> T getService(Class<T> serviceClass) {
        Object existing = instances.get(serviceClass);
        if (existing != null) {
            return serviceClass.cast(existing);
        }
        synchronized (creationLock) {
            existing = instances.get(serviceClass);
            if (existing != null) {
                return serviceClass.cast(existing);
            }
            if (!underConstruction.add(serviceClass)) {
                throw ServiceInstantiationException.cyclic(serviceClass);
            }
            try {
                Class<?> implementation = bindings.getOrDefault(serviceClass, serviceClass);
                if (implementation.isInterface()) {
                    throw ServiceInstantiationException.unbound(serviceClass);
                }
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Creating " + serviceClass.getSimpleName() + " as " + implementation.getName());
                }
                T created = serviceClass.cast(newInstance(serviceClass, implementation));
                instances.put(serviceClass, created);
                return created;
            } finally {
                underConstruction.remove(serviceClass);
            }
        }
    }

    @Override
    public <T, I extends T> void registerBinding(Class<T> interfaceClass, Class<I> implementationClass) {
        synchronized (creationLock) {
            if (instances.containsKey(interfaceClass)) {
                throw new IllegalStateException(interfaceClass.getSimpleName() + " is already in use and cannot be rebound");
            }
            bindings.put(interfaceClass, implementationClass);
        }
    }

    @Override
    public <T, I extends T> void registerBindingIfAbsent(Class<T> interfaceClass, Class<I> implementationClass) {
        synchronized (creationLock) {
            if (!instances.containsKey(interfaceClass)) {
                bindings.putIfAbsent(interfaceClass, implementationClass);
            }
        }
    }

    @Override
    public <T> void registerInstance(Class<T> serviceClass, T instance) {
        if (instance == null) throw new IllegalArgumentException("instance == null");
        instances.put(serviceClass, instance);
    }

    @Override
    public <E, I extends E> void registerExtension(Class<E> extensionPoint, Class<I> extensionImpl) {
        synchronized (creationLock) {
            if (extensionTypes.computeIfAbsent(extensionPoint, k -> new LinkedHashSet<>()).add(extensionImpl)) {
                extensions.remove(extensionPoint);
            }
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <E> List<E> getExtensions(Class<E> extensionPoint) {
        List<?> cached = extensions.get(extensionPoint);
        if (cached != null) {
            return (List<E>) cached;
        }
        synchronized (creationLock) {
            cached = extensions.get(extensionPoint);
            if (cached != null) {
                return (List<E>) cached;
            }
            List<E> created = new ArrayList<>();
            for (Class<?> type : extensionTypes.getOrDefault(extensionPoint, Set.of())) {
                created.add(extensionPoint.cast(newInstance(extensionPoint, type)));
            }
            List<E> result = List.copyOf(created);
            extensions.put(extensionPoint, result);
            return result;
        }
    }

    private static Object newInstance(Class<?> serviceClass, Class<?> type) {
        try {
            return type.getConstructor().newInstance();
        } catch (NoSuchMethodException e) {
            throw new ServiceInstantiationException(serviceClass,
                    type.getName() + " needs a public no-arg constructor to serve as " + serviceClass.getSimpleName(), e);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof ServiceInstantiationException nested) {
                throw nested;
            }
            throw new ServiceInstantiationException(serviceClass,
                    type.getName() + " failed while being created as " + serviceClass.getSimpleName(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new ServiceInstantiationException(serviceClass, "Cannot instantiate " + type.getName(), e);
        }
    }

    @Override
    public void disposeAll() {
        synchronized (creationLock) {
            instances.clear();
            bindings.clear();
            extensionTypes.clear();
            extensions.clear();
        }
    }
}

package com.tyron.syntaxkit.api.service;

/**
 * Looks up the implementations behind {@code getInstance()} methods such as
 * {@code PathResolver.getInstance()}. The core module provides the container.
 */
public interface ServiceAccess {

    <T> T getApplicationService(Class<T> serviceClass);
}

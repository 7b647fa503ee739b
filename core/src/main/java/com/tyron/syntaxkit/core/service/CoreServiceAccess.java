package com.tyron.syntaxkit.core.service;

import com.tyron.syntaxkit.api.service.ServiceAccess;

public final class CoreServiceAccess implements ServiceAccess {

    @Override
    public <T> T getApplicationService(Class<T> serviceClass) {
        return ApplicationServiceManager.getService(serviceClass);
    }
}

package com.warden.guard.testing;

import com.warden.guard.RequestContext;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link RequestContext} backed by a map of type to instance, for tests.
 */
public final class MapRequestContext implements RequestContext {

    private final Map<Class<?>, Object> services = new LinkedHashMap<>();

    /** Creates an empty context. */
    public static MapRequestContext empty() {
        return new MapRequestContext();
    }

    /** Registers an instance under its type. */
    public <S> MapRequestContext with(Class<S> serviceType, S instance) {
        if (serviceType == null || instance == null) {
            throw new IllegalArgumentException("serviceType and instance must not be null");
        }
        services.put(serviceType, instance);
        return this;
    }

    @Override
    public <S> S resolve(Class<S> serviceType) {
        Object instance = services.get(serviceType);
        if (instance == null) {
            throw new IllegalStateException("No service registered for " + serviceType.getName());
        }
        return serviceType.cast(instance);
    }
}

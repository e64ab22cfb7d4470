package com.warden.guard;

/**
 * Per-request service lookup handed to registered ownership checks, so that a check can
 * materialise a request-scoped data source.
 */
public interface RequestContext {

    /**
     * Resolves a collaborator for the current request.
     *
     * @param serviceType the type to resolve
     * @return the resolved instance, never null
     * @throws IllegalStateException if no instance of the type is available
     */
    <S> S resolve(Class<S> serviceType);
}

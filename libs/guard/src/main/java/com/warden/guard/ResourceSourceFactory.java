package com.warden.guard;

/**
 * Produces a fresh {@link ResourceSource} for the current request.
 *
 * @param <T> resource type
 */
@FunctionalInterface
public interface ResourceSourceFactory<T> {

    ResourceSource<T> open(RequestContext context);
}

package com.warden.guard;

import java.util.Optional;
import java.util.Set;

/**
 * Registry of ownership descriptors, one per resource type.
 * <p>
 * Populate it once during startup; after that it is read concurrently by every in-flight
 * request. Entries are never replaced or removed, and registering a type twice fails with
 * {@link DuplicateDescriptorRegistrationException}.
 */
public interface OwnershipDescriptorRegistry {

    /**
     * Registers an owner-only descriptor for a resource with a string identifier.
     *
     * @param resourceType  the resource class, used as the registry key
     * @param sourceFactory opens the data source for the current request
     * @param idField       the resource's identifier field
     * @param ownerField    the resource's owner field
     * @throws DuplicateDescriptorRegistrationException if the type is already registered
     */
    <T> void register(
            Class<T> resourceType,
            ResourceSourceFactory<T> sourceFactory,
            ResourceField<T, String> idField,
            ResourceField<T, String> ownerField);

    /**
     * Registers owner-only and owner-and-tenant descriptors for a resource with a string
     * identifier.
     *
     * @throws DuplicateDescriptorRegistrationException if the type is already registered
     */
    <T> void register(
            Class<T> resourceType,
            ResourceSourceFactory<T> sourceFactory,
            ResourceField<T, String> idField,
            ResourceField<T, String> ownerField,
            ResourceField<T, String> tenantField);

    /**
     * Registers an owner-only descriptor for a resource with a typed key. The raw route value is
     * parsed with {@code keyParser}; a value that does not parse yields
     * {@link Disposition#INVALID_ID} without touching the data source.
     *
     * @throws DuplicateDescriptorRegistrationException if the type is already registered
     */
    <T, K> void registerKeyed(
            Class<T> resourceType,
            KeyParser<K> keyParser,
            ResourceSourceFactory<T> sourceFactory,
            ResourceField<T, K> idField,
            ResourceField<T, String> ownerField);

    /**
     * Registers a typed-key descriptor with an optional tenant field. When {@code tenantField} is
     * null only the owner-only check is registered.
     *
     * @throws DuplicateDescriptorRegistrationException if the type is already registered
     */
    <T, K> void registerKeyed(
            Class<T> resourceType,
            KeyParser<K> keyParser,
            ResourceSourceFactory<T> sourceFactory,
            ResourceField<T, K> idField,
            ResourceField<T, String> ownerField,
            ResourceField<T, String> tenantField);

    /** Looks up the owner-only check without throwing. */
    Optional<OwnershipCheckExecutor> findExecutor(Class<?> resourceType);

    /**
     * Looks up the owner-and-tenant check without throwing. Empty when the type was registered
     * without a tenant field, which tells callers that no tenant claim is needed.
     */
    Optional<TenantOwnershipCheckExecutor> findTenantExecutor(Class<?> resourceType);

    /**
     * @throws OwnershipDescriptorNotRegisteredException if the type is not registered
     */
    OwnershipCheckExecutor getExecutor(Class<?> resourceType);

    /**
     * @throws OwnershipDescriptorNotRegisteredException if no tenant-aware descriptor is registered
     */
    TenantOwnershipCheckExecutor getTenantExecutor(Class<?> resourceType);

    /** Whether any descriptor is registered for the type. */
    boolean isRegistered(Class<?> resourceType);

    /** Snapshot of the registered resource types. */
    Set<Class<?>> registeredTypes();
}

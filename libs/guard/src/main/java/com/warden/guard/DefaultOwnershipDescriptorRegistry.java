package com.warden.guard;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link OwnershipDescriptorRegistry} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Each entry holds lambdas that close over the type's strongly typed fields, while the map
 * itself is keyed by {@code Class<?>}. Both checks of a type are published as one entry via
 * {@code putIfAbsent}, so a racing duplicate registration fails instead of overwriting.
 */
public final class DefaultOwnershipDescriptorRegistry implements OwnershipDescriptorRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultOwnershipDescriptorRegistry.class);

    private final ConcurrentMap<Class<?>, Descriptor> descriptors = new ConcurrentHashMap<>();

    @Override
    public <T> void register(
            Class<T> resourceType,
            ResourceSourceFactory<T> sourceFactory,
            ResourceField<T, String> idField,
            ResourceField<T, String> ownerField) {
        registerKeyed(resourceType, KeyParsers.strings(), sourceFactory, idField, ownerField, null);
    }

    @Override
    public <T> void register(
            Class<T> resourceType,
            ResourceSourceFactory<T> sourceFactory,
            ResourceField<T, String> idField,
            ResourceField<T, String> ownerField,
            ResourceField<T, String> tenantField) {
        requireNonNull(tenantField, "tenantField");
        registerKeyed(resourceType, KeyParsers.strings(), sourceFactory, idField, ownerField, tenantField);
    }

    @Override
    public <T, K> void registerKeyed(
            Class<T> resourceType,
            KeyParser<K> keyParser,
            ResourceSourceFactory<T> sourceFactory,
            ResourceField<T, K> idField,
            ResourceField<T, String> ownerField) {
        registerKeyed(resourceType, keyParser, sourceFactory, idField, ownerField, null);
    }

    @Override
    public <T, K> void registerKeyed(
            Class<T> resourceType,
            KeyParser<K> keyParser,
            ResourceSourceFactory<T> sourceFactory,
            ResourceField<T, K> idField,
            ResourceField<T, String> ownerField,
            ResourceField<T, String> tenantField) {
        requireNonNull(resourceType, "resourceType");
        requireNonNull(keyParser, "keyParser");
        requireNonNull(sourceFactory, "sourceFactory");
        requireNonNull(idField, "idField");
        requireNonNull(ownerField, "ownerField");

        OwnershipCheckExecutor executor = (guard, context, rawId, userId, signal) ->
                keyParser.tryParse(rawId)
                        .map(key -> guard.requireOwner(
                                sourceFactory.open(context), key, userId, idField, ownerField, signal))
                        .orElseGet(DefaultOwnershipDescriptorRegistry::invalidId);

        TenantOwnershipCheckExecutor tenantExecutor = null;
        if (tenantField != null) {
            tenantExecutor = (guard, context, rawId, userId, tenantId, signal) ->
                    keyParser.tryParse(rawId)
                            .map(key -> guard.requireOwnerAndTenant(
                                    sourceFactory.open(context), key, userId, tenantId,
                                    idField, ownerField, tenantField, signal))
                            .orElseGet(DefaultOwnershipDescriptorRegistry::invalidId);
        }

        add(new Descriptor(executor, tenantExecutor), resourceType);
    }

    @Override
    public Optional<OwnershipCheckExecutor> findExecutor(Class<?> resourceType) {
        if (resourceType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(descriptors.get(resourceType)).map(Descriptor::executor);
    }

    @Override
    public Optional<TenantOwnershipCheckExecutor> findTenantExecutor(Class<?> resourceType) {
        if (resourceType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(descriptors.get(resourceType)).map(Descriptor::tenantExecutor);
    }

    @Override
    public OwnershipCheckExecutor getExecutor(Class<?> resourceType) {
        requireNonNull(resourceType, "resourceType");
        return findExecutor(resourceType)
                .orElseThrow(() -> new OwnershipDescriptorNotRegisteredException(resourceType, false));
    }

    @Override
    public TenantOwnershipCheckExecutor getTenantExecutor(Class<?> resourceType) {
        requireNonNull(resourceType, "resourceType");
        return findTenantExecutor(resourceType)
                .orElseThrow(() -> new OwnershipDescriptorNotRegisteredException(resourceType, true));
    }

    @Override
    public boolean isRegistered(Class<?> resourceType) {
        return resourceType != null && descriptors.containsKey(resourceType);
    }

    @Override
    public Set<Class<?>> registeredTypes() {
        return Set.copyOf(descriptors.keySet());
    }

    private void add(Descriptor descriptor, Class<?> resourceType) {
        if (descriptors.putIfAbsent(resourceType, descriptor) != null) {
            throw new DuplicateDescriptorRegistrationException(resourceType);
        }
        log.info("Registered ownership descriptor for {} (tenantAware={})",
                resourceType.getName(), descriptor.tenantExecutor() != null);
    }

    private static CompletableFuture<Disposition> invalidId() {
        return CompletableFuture.completedFuture(Disposition.INVALID_ID);
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
    }

    /** Both checks of one resource type; {@code tenantExecutor} is null for owner-only types. */
    private record Descriptor(OwnershipCheckExecutor executor, TenantOwnershipCheckExecutor tenantExecutor) {}
}

package com.warden.guard;

import java.util.concurrent.CompletableFuture;

/**
 * Performs ownership and tenant checks that prevent insecure direct object references.
 * <p>
 * Every decision issues at most one read-only probe against the backing source and completes
 * with a {@link Disposition}. Argument errors are thrown synchronously as
 * {@link IllegalArgumentException}; store faults and cancellation complete the returned future
 * exceptionally.
 * <p>
 * Resource identifiers may be plain strings or typed keys ({@code UUID}, {@code Long}, ...); the
 * identifier field is compared in its native type.
 */
public interface AccessGuard {

    /**
     * Checks whether the user owns the resource.
     *
     * @return a future completing with true only when the decision is {@link Disposition#SUCCESS}
     */
    <T, K> CompletableFuture<Boolean> isOwner(
            ResourceSource<T> source,
            K resourceId,
            String userId,
            ResourceField<T, K> idField,
            ResourceField<T, String> ownerField,
            CancellationSignal signal);

    /**
     * Requires that the user owns the resource identified by {@code resourceId}.
     * <p>
     * A resource that does not exist yields {@link Disposition#NOT_FOUND}; one that exists but is
     * owned by someone else yields {@link Disposition#FORBIDDEN}, or {@link Disposition#NOT_FOUND}
     * when existence hiding is enabled.
     *
     * @param source     backing data source for the resource type
     * @param resourceId identifier value, compared in its native type
     * @param userId     caller's user id
     * @param idField    the resource's identifier field
     * @param ownerField the resource's owner field
     * @param signal     cancellation signal of the originating request
     */
    <T, K> CompletableFuture<Disposition> requireOwner(
            ResourceSource<T> source,
            K resourceId,
            String userId,
            ResourceField<T, K> idField,
            ResourceField<T, String> ownerField,
            CancellationSignal signal);

    /**
     * Requires that the user owns the resource and that it belongs to {@code tenantId}. An owner
     * mismatch and a tenant mismatch produce the same disposition.
     */
    <T, K> CompletableFuture<Disposition> requireOwnerAndTenant(
            ResourceSource<T> source,
            K resourceId,
            String userId,
            String tenantId,
            ResourceField<T, K> idField,
            ResourceField<T, String> ownerField,
            ResourceField<T, String> tenantField,
            CancellationSignal signal);

    /**
     * Requires that the user owns the resource of a registered type. Resolves the owner-only
     * check from the registry and runs it against a source opened from {@code context}.
     *
     * @param resourceType type registered with {@link OwnershipDescriptorRegistry}
     * @param resourceId   raw identifier from the route
     * @param userId       caller's user id
     * @param context      per-request context used to open the data source
     * @param signal       cancellation signal of the originating request
     * @throws OwnershipDescriptorNotRegisteredException if the type is not registered
     */
    CompletableFuture<Disposition> requireOwner(
            Class<?> resourceType,
            String resourceId,
            String userId,
            RequestContext context,
            CancellationSignal signal);

    /**
     * Requires that the user owns the resource of a registered type and shares its tenant.
     *
     * @throws OwnershipDescriptorNotRegisteredException if no tenant-aware descriptor is registered
     */
    CompletableFuture<Disposition> requireOwnerAndTenant(
            Class<?> resourceType,
            String resourceId,
            String userId,
            String tenantId,
            RequestContext context,
            CancellationSignal signal);
}

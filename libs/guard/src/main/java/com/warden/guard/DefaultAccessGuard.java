package com.warden.guard;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link AccessGuard}. Holds only immutable configuration and the registry, so a single
 * instance can serve every request.
 */
public final class DefaultAccessGuard implements AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(DefaultAccessGuard.class);

    private final OwnershipGuardOptions options;
    private final OwnershipDescriptorRegistry registry;

    public DefaultAccessGuard(OwnershipGuardOptions options, OwnershipDescriptorRegistry registry) {
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.options = options;
        this.registry = registry;
    }

    @Override
    public <T, K> CompletableFuture<Boolean> isOwner(
            ResourceSource<T> source,
            K resourceId,
            String userId,
            ResourceField<T, K> idField,
            ResourceField<T, String> ownerField,
            CancellationSignal signal) {
        return requireOwner(source, resourceId, userId, idField, ownerField, signal)
                .thenApply(Disposition::isAllowed);
    }

    @Override
    public <T, K> CompletableFuture<Disposition> requireOwner(
            ResourceSource<T> source,
            K resourceId,
            String userId,
            ResourceField<T, K> idField,
            ResourceField<T, String> ownerField,
            CancellationSignal signal) {
        requireNonNull(source, "source");
        requireNonNull(idField, "idField");
        requireNonNull(ownerField, "ownerField");
        requireNonNull(signal, "signal");
        requireResourceId(resourceId);
        requireText(userId, "userId");

        var probe = new OwnershipProbe<>(
                FieldMatch.of(idField, resourceId),
                List.of(FieldMatch.of(ownerField, userId)));
        return probe(source, probe, signal);
    }

    @Override
    public <T, K> CompletableFuture<Disposition> requireOwnerAndTenant(
            ResourceSource<T> source,
            K resourceId,
            String userId,
            String tenantId,
            ResourceField<T, K> idField,
            ResourceField<T, String> ownerField,
            ResourceField<T, String> tenantField,
            CancellationSignal signal) {
        requireNonNull(source, "source");
        requireNonNull(idField, "idField");
        requireNonNull(ownerField, "ownerField");
        requireNonNull(tenantField, "tenantField");
        requireNonNull(signal, "signal");
        requireResourceId(resourceId);
        requireText(userId, "userId");
        requireText(tenantId, "tenantId");

        var probe = new OwnershipProbe<>(
                FieldMatch.of(idField, resourceId),
                List.of(FieldMatch.of(ownerField, userId), FieldMatch.of(tenantField, tenantId)));
        return probe(source, probe, signal);
    }

    @Override
    public CompletableFuture<Disposition> requireOwner(
            Class<?> resourceType,
            String resourceId,
            String userId,
            RequestContext context,
            CancellationSignal signal) {
        requireNonNull(resourceType, "resourceType");
        requireNonNull(context, "context");
        requireNonNull(signal, "signal");
        requireText(resourceId, "resourceId");
        requireText(userId, "userId");

        OwnershipCheckExecutor executor = registry.getExecutor(resourceType);
        return executor.execute(this, context, resourceId, userId, signal)
                .thenApply(disposition -> logged(resourceType, false, disposition));
    }

    @Override
    public CompletableFuture<Disposition> requireOwnerAndTenant(
            Class<?> resourceType,
            String resourceId,
            String userId,
            String tenantId,
            RequestContext context,
            CancellationSignal signal) {
        requireNonNull(resourceType, "resourceType");
        requireNonNull(context, "context");
        requireNonNull(signal, "signal");
        requireText(resourceId, "resourceId");
        requireText(userId, "userId");
        requireText(tenantId, "tenantId");

        TenantOwnershipCheckExecutor executor = registry.getTenantExecutor(resourceType);
        return executor.execute(this, context, resourceId, userId, tenantId, signal)
                .thenApply(disposition -> logged(resourceType, true, disposition));
    }

    /** The options this guard decides with. */
    public OwnershipGuardOptions options() {
        return options;
    }

    private <T> CompletableFuture<Disposition> probe(
            ResourceSource<T> source, OwnershipProbe<T> probe, CancellationSignal signal) {
        if (signal.isCancellationRequested()) {
            return CompletableFuture.failedFuture(
                    new CancellationException("Ownership check cancelled before querying"));
        }
        CompletableFuture<ProbeOutcome> outcome = source.probe(probe, signal);
        if (outcome == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("ResourceSource returned no result future"));
        }
        return outcome.thenApply(this::reduce);
    }

    private Disposition reduce(ProbeOutcome outcome) {
        if (outcome == null) {
            throw new IllegalStateException("ResourceSource completed without an outcome");
        }
        return switch (outcome) {
            case ABSENT -> Disposition.NOT_FOUND;
            case MATCHED -> Disposition.SUCCESS;
            case MISMATCHED -> options.hideExistenceWhenForbidden()
                    ? Disposition.NOT_FOUND
                    : Disposition.FORBIDDEN;
        };
    }

    private static Disposition logged(Class<?> resourceType, boolean tenantAware, Disposition disposition) {
        if (log.isDebugEnabled()) {
            log.debug("Ownership decision for {} (tenantAware={}): {}",
                    resourceType.getSimpleName(), tenantAware, disposition);
        }
        return disposition;
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be null or empty");
        }
    }

    private static void requireResourceId(Object resourceId) {
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId must not be null");
        }
        if (resourceId instanceof String text && text.isEmpty()) {
            throw new IllegalArgumentException("resourceId must not be null or empty");
        }
    }
}

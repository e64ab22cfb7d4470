package com.warden.guard;

import java.util.concurrent.CompletableFuture;

/**
 * Owner-only check registered for one resource type. Captures the type's data source factory and
 * field accessors; the registry stores it behind this type-erased signature.
 */
@FunctionalInterface
public interface OwnershipCheckExecutor {

    CompletableFuture<Disposition> execute(
            AccessGuard guard,
            RequestContext context,
            String resourceId,
            String userId,
            CancellationSignal signal);
}

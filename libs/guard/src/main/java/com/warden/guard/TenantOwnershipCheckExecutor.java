package com.warden.guard;

import java.util.concurrent.CompletableFuture;

/**
 * Owner-and-tenant check registered for one resource type. Only present for types registered
 * with a tenant field.
 */
@FunctionalInterface
public interface TenantOwnershipCheckExecutor {

    CompletableFuture<Disposition> execute(
            AccessGuard guard,
            RequestContext context,
            String resourceId,
            String userId,
            String tenantId,
            CancellationSignal signal);
}

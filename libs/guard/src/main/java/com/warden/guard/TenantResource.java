package com.warden.guard;

/**
 * Marks an entity as belonging to a tenant.
 */
public interface TenantResource {

    /** Identifier of the tenant this resource belongs to. */
    String tenantId();
}

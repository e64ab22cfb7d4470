package com.warden.guard;

/**
 * Thrown when a check is dispatched for a resource type that has no registered descriptor.
 * <p>
 * This is a setup error, not a client error: callers log it and answer with a server fault.
 */
public class OwnershipDescriptorNotRegisteredException extends IllegalStateException {

    private final Class<?> resourceType;
    private final boolean tenantAware;

    public OwnershipDescriptorNotRegisteredException(Class<?> resourceType, boolean tenantAware) {
        super(messageFor(resourceType, tenantAware));
        if (resourceType == null) {
            throw new IllegalArgumentException("resourceType must not be null");
        }
        this.resourceType = resourceType;
        this.tenantAware = tenantAware;
    }

    /** The resource type that was looked up. */
    public Class<?> resourceType() {
        return resourceType;
    }

    /** Whether an owner-and-tenant descriptor was sought. */
    public boolean tenantAware() {
        return tenantAware;
    }

    private static String messageFor(Class<?> resourceType, boolean tenantAware) {
        String typeName = resourceType == null ? "<unknown>" : resourceType.getName();
        return tenantAware
                ? "Tenant ownership descriptor not registered for resource type: %s.".formatted(typeName)
                : "Ownership descriptor not registered for resource type: %s.".formatted(typeName);
    }
}

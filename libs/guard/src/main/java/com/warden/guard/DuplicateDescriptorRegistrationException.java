package com.warden.guard;

/**
 * Thrown when a resource type is registered twice. The first registration stays in effect.
 */
public class DuplicateDescriptorRegistrationException extends IllegalStateException {

    private final Class<?> resourceType;

    public DuplicateDescriptorRegistrationException(Class<?> resourceType) {
        super("Ownership descriptor already registered for resource type: %s."
                .formatted(resourceType.getName()));
        this.resourceType = resourceType;
    }

    public Class<?> resourceType() {
        return resourceType;
    }
}

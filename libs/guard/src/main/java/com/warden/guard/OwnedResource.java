package com.warden.guard;

/**
 * Marks an entity as owned by a user.
 */
public interface OwnedResource {

    /** Identifier of the user who owns this resource. */
    String ownerId();
}

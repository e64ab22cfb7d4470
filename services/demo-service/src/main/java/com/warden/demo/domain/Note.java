package com.warden.demo.domain;

import com.warden.guard.OwnedResource;
import com.warden.guard.ResourceField;
import java.util.UUID;

/** A note owned by one user, not scoped to a tenant. */
public record Note(UUID id, String ownerId, String title) implements OwnedResource {

    public static final ResourceField<Note, UUID> ID = ResourceField.of("id", Note::id);
    public static final ResourceField<Note, String> OWNER = ResourceField.of("owner_id", Note::ownerId);
}

package com.warden.demo.domain;

import com.warden.guard.OwnedResource;
import com.warden.guard.ResourceField;
import com.warden.guard.TenantResource;
import java.util.UUID;

/**
 * A document owned by one user inside one tenant.
 */
public record Document(UUID id, String ownerId, String tenantId, String title, String content)
        implements OwnedResource, TenantResource {

    public static final ResourceField<Document, UUID> ID = ResourceField.of("id", Document::id);
    public static final ResourceField<Document, String> OWNER = ResourceField.of("owner_id", Document::ownerId);
    public static final ResourceField<Document, String> TENANT = ResourceField.of("tenant_id", Document::tenantId);

    /** Applies the non-null values of an update. */
    public Document apply(DocumentUpdate update) {
        return new Document(
                id,
                ownerId,
                tenantId,
                update.title() != null ? update.title() : title,
                update.content() != null ? update.content() : content);
    }
}

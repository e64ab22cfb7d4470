package com.warden.guard;

import java.util.function.Predicate;

/**
 * Scoping predicates for in-process collections, so list endpoints filter by owner or tenant
 * with the same field accessors used for registration.
 *
 * <pre>{@code
 * documents.stream()
 *         .filter(OwnershipPredicates.ownedBy(userId, DocumentFields.OWNER))
 *         .filter(OwnershipPredicates.inTenant(tenantId, DocumentFields.TENANT))
 *         .toList();
 * }</pre>
 */
public final class OwnershipPredicates {

    private OwnershipPredicates() {
        // utility class
    }

    /** Matches resources whose owner field equals {@code userId}. */
    public static <T> Predicate<T> ownedBy(String userId, ResourceField<T, String> ownerField) {
        return matching(userId, ownerField, "userId", "ownerField");
    }

    /** Matches resources whose tenant field equals {@code tenantId}. */
    public static <T> Predicate<T> inTenant(String tenantId, ResourceField<T, String> tenantField) {
        return matching(tenantId, tenantField, "tenantId", "tenantField");
    }

    private static <T> Predicate<T> matching(
            String value, ResourceField<T, String> field, String valueName, String fieldName) {
        if (field == null) {
            throw new IllegalArgumentException(fieldName + " must not be null");
        }
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(valueName + " must not be null or empty");
        }
        return FieldMatch.of(field, value)::test;
    }
}

package com.warden.guard;

/**
 * Guard configuration.
 *
 * @param userIdClaim               claim key holding the caller's user id
 * @param tenantIdClaim             claim key holding the caller's tenant id
 * @param hideExistenceWhenForbidden answer {@link Disposition#NOT_FOUND} instead of
 *                                   {@link Disposition#FORBIDDEN} for existing resources the
 *                                   caller may not access
 * @param useProblemDetails         whether HTTP integrations render RFC 7807 bodies or bare
 *                                   status codes
 */
public record OwnershipGuardOptions(
        String userIdClaim,
        String tenantIdClaim,
        boolean hideExistenceWhenForbidden,
        boolean useProblemDetails) {

    /** Default claim key for the user id. */
    public static final String DEFAULT_USER_ID_CLAIM = "sub";

    /** Default claim key for the tenant id. */
    public static final String DEFAULT_TENANT_ID_CLAIM = "tenant_id";

    /**
     * Compact constructor: blank claim keys fall back to the defaults.
     */
    public OwnershipGuardOptions {
        if (userIdClaim == null || userIdClaim.isBlank()) {
            userIdClaim = DEFAULT_USER_ID_CLAIM;
        }
        if (tenantIdClaim == null || tenantIdClaim.isBlank()) {
            tenantIdClaim = DEFAULT_TENANT_ID_CLAIM;
        }
    }

    /**
     * Default options: {@code sub} / {@code tenant_id} claims, existence not hidden, problem
     * details enabled.
     */
    public static OwnershipGuardOptions defaults() {
        return new OwnershipGuardOptions(DEFAULT_USER_ID_CLAIM, DEFAULT_TENANT_ID_CLAIM, false, true);
    }

    /** Returns a copy with existence hiding switched on or off. */
    public OwnershipGuardOptions withHideExistenceWhenForbidden(boolean hide) {
        return new OwnershipGuardOptions(userIdClaim, tenantIdClaim, hide, useProblemDetails);
    }
}

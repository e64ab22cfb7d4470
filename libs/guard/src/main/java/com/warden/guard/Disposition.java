package com.warden.guard;

/**
 * Outcome of a single ownership decision.
 * <p>
 * Dispositions are return values, never exceptions. Mapping them to HTTP status codes is the
 * caller's concern; the conventional mapping is listed on each constant.
 */
public enum Disposition {

    /** The identity owns the resource (and shares its tenant, when checked). Proceed. */
    SUCCESS,

    /** The resource exists but the identity fails the owner or tenant constraint. HTTP 403. */
    FORBIDDEN,

    /**
     * The resource does not exist, or it exists but the identity is not allowed and existence
     * hiding is enabled. HTTP 404.
     */
    NOT_FOUND,

    /** The route identifier could not be parsed into the resource's key type. HTTP 400. */
    INVALID_ID;

    /** Returns true only for {@link #SUCCESS}. */
    public boolean isAllowed() {
        return this == SUCCESS;
    }
}

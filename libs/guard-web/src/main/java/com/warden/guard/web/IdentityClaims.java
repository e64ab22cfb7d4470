package com.warden.guard.web;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.Optional;

/**
 * Claims of the authenticated caller, placed on the request by an upstream authentication filter
 * under {@link #REQUEST_ATTRIBUTE}.
 *
 * @param claims claim type to claim value
 */
public record IdentityClaims(Map<String, String> claims) {

    /** Request attribute under which the claims are stored. */
    public static final String REQUEST_ATTRIBUTE = IdentityClaims.class.getName();

    public IdentityClaims {
        if (claims == null) {
            throw new IllegalArgumentException("claims must not be null");
        }
        claims = Map.copyOf(claims);
    }

    public static IdentityClaims of(Map<String, String> claims) {
        return new IdentityClaims(claims);
    }

    /** Returns the value of a claim, empty when absent or empty. */
    public Optional<String> claim(String claimType) {
        String value = claims.get(claimType);
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    /** Stores these claims on the request. */
    public void attachTo(HttpServletRequest request) {
        request.setAttribute(REQUEST_ATTRIBUTE, this);
    }

    /** Reads the claims stored on the request, if any. */
    public static Optional<IdentityClaims> from(HttpServletRequest request) {
        Object value = request.getAttribute(REQUEST_ATTRIBUTE);
        return value instanceof IdentityClaims claims ? Optional.of(claims) : Optional.empty();
    }
}

package com.warden.guard.web;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

/**
 * Resolves a claim of the caller of the current request.
 * <p>
 * Provide a bean of this type to read identities from another source, such as a Spring Security
 * {@code Authentication}.
 */
@FunctionalInterface
public interface ClaimsResolver {

    /**
     * @param request   the current request
     * @param claimType the claim key, e.g. {@code sub} or {@code tenant_id}
     * @return the non-empty claim value, or empty when the caller has none
     */
    Optional<String> resolve(HttpServletRequest request, String claimType);
}

package com.warden.guard.web;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

/** Reads claims from the {@link IdentityClaims} request attribute. */
public class RequestAttributeClaimsResolver implements ClaimsResolver {

    @Override
    public Optional<String> resolve(HttpServletRequest request, String claimType) {
        return IdentityClaims.from(request).flatMap(claims -> claims.claim(claimType));
    }
}

package com.warden.demo.infrastructure.web;

import com.warden.demo.config.DemoServiceProperties;
import com.warden.guard.web.IdentityClaims;
import com.warden.guard.web.OwnershipGuardProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Demo authentication: turns the {@code X-User} and {@code X-Tenant} headers into
 * {@link IdentityClaims} on the request. Use real authentication in production.
 *
 * <p>Without {@code X-User} the caller is {@code user1}. Without {@code X-Tenant} the tenant is
 * {@code tenant2} for {@code user2} and {@code tenant1} for everyone else. Claims are emitted
 * under the claim types the ownership guard is configured to read; the tenant claim is left out
 * when {@code warden.demo.emit-tenant-claim} is false.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class DemoIdentityFilter extends OncePerRequestFilter {

    public static final String USER_HEADER = "X-User";
    public static final String TENANT_HEADER = "X-Tenant";

    static final String DEFAULT_USER_ID = "user1";
    static final String DEFAULT_TENANT_FOR_USER2 = "tenant2";
    static final String DEFAULT_TENANT = "tenant1";

    /** MDC key holding the caller's user id. */
    public static final String MDC_USER = "user.id";

    private final OwnershipGuardProperties guardProperties;
    private final boolean emitTenantClaim;

    public DemoIdentityFilter(OwnershipGuardProperties guardProperties, DemoServiceProperties demoProperties) {
        this.guardProperties = guardProperties;
        this.emitTenantClaim = demoProperties.emitTenantClaim();
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String userId = request.getHeader(USER_HEADER);
        if (userId == null || userId.isBlank()) {
            userId = DEFAULT_USER_ID;
        }
        String tenantId = request.getHeader(TENANT_HEADER);
        if (tenantId == null || tenantId.isBlank()) {
            tenantId = "user2".equalsIgnoreCase(userId) ? DEFAULT_TENANT_FOR_USER2 : DEFAULT_TENANT;
        }

        Map<String, String> claims = new HashMap<>();
        claims.put(guardProperties.userIdClaim(), userId);
        if (emitTenantClaim) {
            claims.put(guardProperties.tenantIdClaim(), tenantId);
        }
        IdentityClaims.of(claims).attachTo(request);

        MDC.put(MDC_USER, userId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_USER);
        }
    }
}

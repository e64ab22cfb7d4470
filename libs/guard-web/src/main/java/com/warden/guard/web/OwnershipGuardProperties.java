package com.warden.guard.web;

import com.warden.guard.OwnershipGuardOptions;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration of the ownership guard, bound from the {@code warden.ownership.*} prefix.
 *
 * <pre>
 * warden:
 *   ownership:
 *     user-id-claim: sub
 *     tenant-id-claim: tenant_id
 *     hide-existence-when-forbidden: false
 *     use-problem-details: true
 *     decision-timeout: 5s
 * </pre>
 *
 * @param userIdClaim                claim holding the caller's user id (default {@code sub})
 * @param tenantIdClaim              claim holding the caller's tenant id (default {@code tenant_id})
 * @param hideExistenceWhenForbidden answer 404 instead of 403 when the caller is not the owner
 * @param useProblemDetails          write RFC 7807 bodies on denial (default true)
 * @param decisionTimeout            longest wait for a decision before answering 503 (default 5s)
 * @param enabled                    whether the guard is installed at all (default true)
 */
@ConfigurationProperties(prefix = "warden.ownership")
@Validated
public record OwnershipGuardProperties(
        @NotBlank String userIdClaim,
        @NotBlank String tenantIdClaim,
        boolean hideExistenceWhenForbidden,
        @NotNull Boolean useProblemDetails,
        @NotNull Duration decisionTimeout,
        @NotNull Boolean enabled) {

    public static final Duration DEFAULT_DECISION_TIMEOUT = Duration.ofSeconds(5);

    public OwnershipGuardProperties {
        if (userIdClaim == null || userIdClaim.isBlank()) {
            userIdClaim = OwnershipGuardOptions.DEFAULT_USER_ID_CLAIM;
        }
        if (tenantIdClaim == null || tenantIdClaim.isBlank()) {
            tenantIdClaim = OwnershipGuardOptions.DEFAULT_TENANT_ID_CLAIM;
        }
        if (useProblemDetails == null) {
            useProblemDetails = Boolean.TRUE;
        }
        if (decisionTimeout == null) {
            decisionTimeout = DEFAULT_DECISION_TIMEOUT;
        }
        if (decisionTimeout.isZero() || decisionTimeout.isNegative()) {
            throw new IllegalArgumentException("decisionTimeout must be positive but was: " + decisionTimeout);
        }
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
    }

    /** Properties with every default applied. */
    public static OwnershipGuardProperties defaults() {
        return new OwnershipGuardProperties(null, null, false, null, null, null);
    }

    /** Converts to the options the core guard decides with. */
    public OwnershipGuardOptions toOptions() {
        return new OwnershipGuardOptions(userIdClaim, tenantIdClaim, hideExistenceWhenForbidden, useProblemDetails);
    }
}

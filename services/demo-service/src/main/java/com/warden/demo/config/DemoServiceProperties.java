package com.warden.demo.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Demo service settings, bound from the {@code warden.demo.*} prefix.
 *
 * <pre>
 * warden:
 *   demo:
 *     name: demo-service
 *     environment: development
 *     probe-threads: 4
 *     emit-tenant-claim: true
 * </pre>
 *
 * @param name         service name used in logs
 * @param environment  deployment environment (default {@code development})
 * @param probeThreads threads running ownership queries (default 4)
 * @param emitTenantClaim whether the demo identity filter sets a tenant claim (default true)
 */
@ConfigurationProperties(prefix = "warden.demo")
@Validated
public record DemoServiceProperties(
        @NotBlank String name, String environment, int probeThreads, Boolean emitTenantClaim) {

    public DemoServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (probeThreads <= 0) {
            probeThreads = 4;
        }
        if (emitTenantClaim == null) {
            emitTenantClaim = Boolean.TRUE;
        }
    }
}

package com.warden.demo;

import com.warden.demo.config.DemoServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Demo service: documents and notes whose endpoints are protected by the ownership guard.
 *
 * <p>Callers identify themselves with the {@code X-User} and {@code X-Tenant} headers (see
 * {@link com.warden.demo.infrastructure.web.DemoIdentityFilter}). Documents are checked for owner
 * and tenant, notes for owner only.
 */
@SpringBootApplication
@EnableConfigurationProperties(DemoServiceProperties.class)
public class DemoApplication {

    private static final Logger log = LoggerFactory.getLogger(DemoApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(DemoApplication.class, args);
        log.info("Warden demo service started");
    }
}

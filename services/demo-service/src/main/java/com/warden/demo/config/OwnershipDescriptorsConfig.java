package com.warden.demo.config;

import com.warden.demo.domain.Document;
import com.warden.demo.domain.Note;
import com.warden.guard.KeyParsers;
import com.warden.guard.jdbc.JdbcResourceSource;
import com.warden.guard.web.OwnershipDescriptorRegistrar;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Registers the demo's resource types with the ownership guard. Both are keyed by UUID and probed
 * with one SQL query on a dedicated executor.
 */
@Configuration
public class OwnershipDescriptorsConfig {

    @Bean
    public ThreadPoolTaskExecutor ownershipProbeExecutor(DemoServiceProperties properties) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.probeThreads());
        executor.setMaxPoolSize(properties.probeThreads());
        executor.setThreadNamePrefix("ownership-probe-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean
    public OwnershipDescriptorRegistrar demoDescriptors(ThreadPoolTaskExecutor ownershipProbeExecutor) {
        return registry -> {
            registry.registerKeyed(
                    Document.class,
                    KeyParsers.uuids(),
                    ctx -> new JdbcResourceSource<>(ctx.resolve(JdbcTemplate.class), "documents", ownershipProbeExecutor),
                    Document.ID,
                    Document.OWNER,
                    Document.TENANT);
            registry.registerKeyed(
                    Note.class,
                    KeyParsers.uuids(),
                    ctx -> new JdbcResourceSource<>(ctx.resolve(JdbcTemplate.class), "notes", ownershipProbeExecutor),
                    Note.ID,
                    Note.OWNER);
        };
    }
}

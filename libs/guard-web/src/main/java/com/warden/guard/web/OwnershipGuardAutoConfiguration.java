package com.warden.guard.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.guard.AccessGuard;
import com.warden.guard.DefaultAccessGuard;
import com.warden.guard.DefaultOwnershipDescriptorRegistry;
import com.warden.guard.OwnershipDescriptorRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.DispatcherServlet;

/**
 * Boot 3 auto-configuration for the ownership guard.
 * <p>
 * Creates the descriptor registry (populated by every {@link OwnershipDescriptorRegistrar} bean),
 * the {@link AccessGuard}, and an {@link OwnershipHandlerInterceptor} installed on Spring MVC.
 * Each bean backs off when the application defines its own. Disabled with
 * {@code warden.ownership.enabled=false}.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(OwnershipGuardProperties.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnClass({DispatcherServlet.class, AccessGuard.class})
@ConditionalOnProperty(prefix = "warden.ownership", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OwnershipGuardAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OwnershipGuardAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public OwnershipDescriptorRegistry ownershipDescriptorRegistry(
            ObjectProvider<OwnershipDescriptorRegistrar> registrars) {
        var registry = new DefaultOwnershipDescriptorRegistry();
        registrars.orderedStream().forEach(registrar -> registrar.registerDescriptors(registry));
        log.info("Ownership descriptors registered for {} resource type(s)", registry.registeredTypes().size());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessGuard accessGuard(OwnershipGuardProperties properties, OwnershipDescriptorRegistry registry) {
        return new DefaultAccessGuard(properties.toOptions(), registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public ClaimsResolver claimsResolver() {
        return new RequestAttributeClaimsResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public OwnershipResponseWriter ownershipResponseWriter(
            OwnershipGuardProperties properties, ObjectProvider<ObjectMapper> objectMapper) {
        return new OwnershipResponseWriter(objectMapper.getIfAvailable(ObjectMapper::new), properties.useProblemDetails());
    }

    @Bean
    @ConditionalOnMissingBean
    public OwnershipDecisionMetrics ownershipDecisionMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new OwnershipDecisionMetrics(meterRegistry.getIfAvailable(() -> Metrics.globalRegistry));
    }

    @Bean
    @ConditionalOnMissingBean
    public OwnershipHandlerInterceptor ownershipHandlerInterceptor(
            AccessGuard guard,
            OwnershipDescriptorRegistry registry,
            ClaimsResolver claimsResolver,
            OwnershipGuardProperties properties,
            OwnershipResponseWriter responseWriter,
            OwnershipDecisionMetrics metrics,
            BeanFactory beanFactory) {
        return new OwnershipHandlerInterceptor(
                guard,
                registry,
                claimsResolver,
                new BeanFactoryRequestContext(beanFactory),
                properties.toOptions(),
                properties.decisionTimeout(),
                responseWriter,
                metrics);
    }

    @Bean
    public OwnershipWebMvcConfigurer ownershipWebMvcConfigurer(OwnershipHandlerInterceptor interceptor) {
        return new OwnershipWebMvcConfigurer(interceptor);
    }
}

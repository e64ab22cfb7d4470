package com.warden.guard.web;

import com.warden.guard.OwnershipDescriptorRegistry;

/**
 * Callback for beans that register ownership descriptors. Every registrar in the application
 * context runs once, in {@link org.springframework.core.annotation.Order} order, when the registry
 * bean is created.
 *
 * <pre>{@code
 * @Bean
 * OwnershipDescriptorRegistrar documents() {
 *     return registry -> registry.registerKeyed(Document.class, KeyParsers.uuids(),
 *             ctx -> documentSource(ctx), DocumentFields.ID, DocumentFields.OWNER, DocumentFields.TENANT);
 * }
 * }</pre>
 */
@FunctionalInterface
public interface OwnershipDescriptorRegistrar {

    void registerDescriptors(OwnershipDescriptorRegistry registry);
}

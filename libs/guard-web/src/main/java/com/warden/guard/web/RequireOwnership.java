package com.warden.guard.web;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Enforces ownership (and tenant membership, when the resource type registered a tenant field)
 * before a handler runs.
 * <p>
 * Place it on a controller class to protect every handler method, or on a single method. A
 * method-level annotation takes precedence over the class-level one.
 *
 * <pre>{@code
 * @RestController
 * @RequestMapping("/documents")
 * @RequireOwnership(resource = Document.class)
 * class DocumentController { ... }
 * }</pre>
 *
 * @see OwnershipHandlerInterceptor
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
public @interface RequireOwnership {

    /** Name of the URI template variable holding the resource id. */
    String routeParam() default "id";

    /** Resource type registered with the {@link com.warden.guard.OwnershipDescriptorRegistry}. */
    Class<?> resource();
}

/**
 * Spring MVC integration for the ownership guard.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.warden.guard.web.RequireOwnership}: marks handlers whose route id must be owned
 *       by the caller
 *   <li>{@link com.warden.guard.web.OwnershipHandlerInterceptor}: enforces the annotation and maps
 *       decisions to HTTP statuses
 *   <li>{@link com.warden.guard.web.OwnershipGuardProperties}: {@code warden.ownership.*} settings
 *   <li>{@link com.warden.guard.web.OwnershipGuardAutoConfiguration}: Spring Boot
 *       auto-configuration wiring the registry, guard, metrics and interceptor
 * </ul>
 */
package com.warden.guard.web;

/**
 * Ownership and tenant access checks.
 *
 * <p>Resource types are registered once in an {@link com.warden.guard.OwnershipDescriptorRegistry}
 * with the fields holding their id, owner and (optionally) tenant. The
 * {@link com.warden.guard.AccessGuard} then answers "may this user touch this resource?" either
 * inline, given a {@link com.warden.guard.ResourceSource} and fields, or by dispatching on the
 * resource type with a raw id string.
 *
 * <ul>
 *   <li>{@link com.warden.guard.Disposition}: the decision: success, invalid id, forbidden or not
 *       found
 *   <li>{@link com.warden.guard.OwnershipProbe}: the single lookup a source must answer
 *   <li>{@link com.warden.guard.KeyParsers}: typed id parsing for keyed registrations
 *   <li>{@link com.warden.guard.CancellationSource}: cooperative cancellation of in-flight lookups
 * </ul>
 */
package com.warden.guard;

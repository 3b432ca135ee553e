/**
 * Multi-tenant authentication and authorization core.
 *
 * <ul>
 *   <li>{@code token}: encrypted, tamper-evident session cookies
 *   <li>{@code store}: generation indices, login events, identity registry and tenant context
 *   <li>{@code auth}: {@link com.bastion.security.auth.AuthenticationSession}, the per-request
 *       authentication state machine
 *   <li>{@code authz}: policy rules and {@link com.bastion.security.authz.PermissionResolver}
 *   <li>{@code identity}: roles and the request-scoped identity slot
 * </ul>
 */
package com.bastion.security;

package com.bastion.authgateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the authentication core, bound from {@code bastion.security.*}.
 *
 * <pre>
 * bastion:
 *   security:
 *     token-secret: ${BASTION_TOKEN_SECRET}
 *     token-lifetime: 30d
 *     cookie-name: bastion_auth
 *     tenant-header: X-Tenant-ID
 *     default-tenant-id: 0
 *     standalone: false
 *     directory-login-tenants: [1, 4]
 *     policy-location: classpath:policy/default-policy.json
 * </pre>
 *
 * @param tokenSecret Base64 AES-256 key sealing session cookies. Required.
 * @param tokenLifetime lifetime of minted tokens; zero mints tokens that never expire.
 * @param cookieName name of the session cookie.
 * @param tenantHeader request header carrying the tenant id.
 * @param defaultTenantId tenant used when the header is absent.
 * @param standalone single-installation mode; every plan feature is licensed.
 * @param directoryLoginTenants tenants whose plan includes directory login (ignored when
 *     standalone).
 * @param policyLocation JSON policy document.
 * @param users users seeded into the in-memory registry at startup.
 */
@ConfigurationProperties(prefix = "bastion.security")
@Validated
public record BastionSecurityProperties(
        @NotBlank String tokenSecret,
        Duration tokenLifetime,
        String cookieName,
        String tenantHeader,
        int defaultTenantId,
        boolean standalone,
        List<Integer> directoryLoginTenants,
        String policyLocation,
        @Valid List<SeedUser> users) {

    public BastionSecurityProperties {
        if (tokenLifetime == null) {
            tokenLifetime = Duration.ofDays(30);
        }
        if (tokenLifetime.isNegative()) {
            throw new IllegalArgumentException("bastion.security.token-lifetime must not be negative");
        }
        if (cookieName == null || cookieName.isBlank()) {
            cookieName = "bastion_auth";
        }
        if (tenantHeader == null || tenantHeader.isBlank()) {
            tenantHeader = "X-Tenant-ID";
        }
        directoryLoginTenants = directoryLoginTenants == null ? List.of() : List.copyOf(directoryLoginTenants);
        if (policyLocation == null || policyLocation.isBlank()) {
            policyLocation = "classpath:policy/default-policy.json";
        }
        users = users == null ? List.of() : List.copyOf(users);
    }

    /**
     * A user provisioned from configuration.
     *
     * @param id user id
     * @param tenantId owning tenant
     * @param login login name
     * @param displayName shown name; defaults to the login
     * @param passwordHash stored password hash
     * @param directorySid directory security identifier, or null for local users
     * @param administrator whether the user joins the admin group
     */
    public record SeedUser(
            @NotNull UUID id,
            int tenantId,
            @NotBlank String login,
            String displayName,
            @NotBlank String passwordHash,
            String directorySid,
            boolean administrator) {}
}

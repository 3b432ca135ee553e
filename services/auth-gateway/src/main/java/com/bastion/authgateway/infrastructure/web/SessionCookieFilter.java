package com.bastion.authgateway.infrastructure.web;

import com.bastion.authgateway.config.BastionSecurityProperties;
import com.bastion.observability.CorrelationContextHolder;
import com.bastion.security.auth.AuthenticationSession;
import com.bastion.security.store.ThreadLocalTenantContext;
import com.bastion.security.token.TokenExtractor;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Opens the authentication scope of a request: binds the tenant, authenticates the session cookie
 * and, once the chain returns, logs out and unbinds the tenant again.
 *
 * <p>A failed authentication leaves the request anonymous; endpoints decide whether that is
 * enough.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class SessionCookieFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(SessionCookieFilter.class);

    private final AuthenticationSession session;
    private final ThreadLocalTenantContext tenantContext;
    private final BastionSecurityProperties properties;

    public SessionCookieFilter(
            AuthenticationSession session,
            ThreadLocalTenantContext tenantContext,
            BastionSecurityProperties properties) {
        this.session = session;
        this.tenantContext = tenantContext;
        this.properties = properties;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        Optional<Integer> tenantId = resolveTenant(request);
        if (tenantId.isEmpty()) {
            response.sendError(HttpServletResponse.SC_BAD_REQUEST, "Invalid tenant header");
            return;
        }

        tenantContext.set(tenantId.get());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> CorrelationContextHolder.set(ctx.withTenant(String.valueOf(tenantId.get()))));
        try {
            TokenExtractor.sessionToken(
                            sessionCookie(request, properties.cookieName()),
                            request.getHeader(HttpHeaders.AUTHORIZATION))
                    .ifPresent(session::authenticateByToken);
            filterChain.doFilter(request, response);
        } finally {
            session.logout();
            tenantContext.clear();
        }
    }

    /**
     * @return the tenant from the header, the default tenant when the header is absent, or empty
     *     when the header is not a number
     */
    private Optional<Integer> resolveTenant(HttpServletRequest request) {
        String header = request.getHeader(properties.tenantHeader());
        if (header == null || header.isBlank()) {
            return Optional.of(properties.defaultTenantId());
        }
        try {
            return Optional.of(Integer.parseInt(header.strip()));
        } catch (NumberFormatException e) {
            log.warn("Rejecting request with malformed {} header", properties.tenantHeader());
            return Optional.empty();
        }
    }

    /** Value of the named cookie, or null. */
    public static String sessionCookie(HttpServletRequest request, String cookieName) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (cookieName.equals(cookie.getName())) {
                return cookie.getValue();
            }
        }
        return null;
    }
}

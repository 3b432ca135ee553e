package com.bastion.authgateway.api;

import com.bastion.authgateway.config.BastionSecurityProperties;
import com.bastion.authgateway.infrastructure.web.SessionCookieFilter;
import com.bastion.security.auth.AuthenticationSession;
import com.bastion.security.auth.InvalidCredentialException;
import com.bastion.security.auth.LoginEventFactory;
import com.bastion.security.authz.Action;
import com.bastion.security.identity.Identity;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session endpoints: login, current identity, logout, password change and permission checks.
 *
 * <p>The session cookie has already been authenticated by {@link SessionCookieFilter} when these
 * handlers run.
 */
@RestController
@RequestMapping("/api/v1/session")
public class SessionController {

    private final AuthenticationSession session;
    private final LoginEventFactory loginEventFactory;
    private final BastionSecurityProperties properties;

    public SessionController(
            AuthenticationSession session,
            LoginEventFactory loginEventFactory,
            BastionSecurityProperties properties) {
        this.session = session;
        this.loginEventFactory = loginEventFactory;
        this.properties = properties;
    }

    @PostMapping
    public ResponseEntity<SessionResponse> login(@Valid @RequestBody LoginRequest request) {
        String token =
                session.authenticateByCredential(
                        request.login(), request.passwordHash(), loginEventFactory);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookie(token).toString())
                .body(SessionResponse.of(session.currentIdentity(), session.state()));
    }

    @GetMapping
    public SessionResponse current() {
        return SessionResponse.of(session.currentIdentity(), session.state());
    }

    @DeleteMapping
    public ResponseEntity<Void> logout(HttpServletRequest request) {
        session.signOut(SessionCookieFilter.sessionCookie(request, properties.cookieName()));
        return ResponseEntity.noContent()
                .header(HttpHeaders.SET_COOKIE, expiredCookie().toString())
                .build();
    }

    /** Revokes every session of the current user, including this one. */
    @DeleteMapping("/all")
    public ResponseEntity<Void> logoutEverywhere() {
        UUID userId = requireAuthenticated().accountId();
        session.logoutEverywhere(userId);
        session.logout();
        return ResponseEntity.noContent()
                .header(HttpHeaders.SET_COOKIE, expiredCookie().toString())
                .build();
    }

    /**
     * Changes the password of the current user. Every other session of the user is revoked; the
     * caller receives a fresh cookie.
     */
    @PutMapping("/password")
    public ResponseEntity<Void> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
        UUID userId = requireAuthenticated().accountId();
        session.changePasswordHash(userId, request.newPasswordHash());
        String token = session.authenticateByUserId(userId, loginEventFactory);
        return ResponseEntity.noContent()
                .header(HttpHeaders.SET_COOKIE, sessionCookie(token).toString())
                .build();
    }

    @GetMapping("/permissions")
    public PermissionCheckResponse checkPermissions(@RequestParam("action") List<String> actions) {
        Action[] requested = actions.stream().map(Action::of).toArray(Action[]::new);
        return new PermissionCheckResponse(actions, session.checkPermissions(requested));
    }

    private Identity requireAuthenticated() {
        Identity identity = session.currentIdentity();
        if (!identity.isAuthenticated()) {
            throw new InvalidCredentialException();
        }
        return identity;
    }

    private ResponseCookie sessionCookie(String token) {
        ResponseCookie.ResponseCookieBuilder cookie =
                ResponseCookie.from(properties.cookieName(), token)
                        .httpOnly(true)
                        .secure(true)
                        .sameSite("Strict")
                        .path("/");
        Duration lifetime = properties.tokenLifetime();
        if (!lifetime.isZero()) {
            cookie.maxAge(lifetime);
        }
        return cookie.build();
    }

    private ResponseCookie expiredCookie() {
        return ResponseCookie.from(properties.cookieName(), "")
                .httpOnly(true)
                .secure(true)
                .sameSite("Strict")
                .path("/")
                .maxAge(0)
                .build();
    }
}

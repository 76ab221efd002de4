package io.github.drompincen.devgateway.gateway.auth;

import io.github.drompincen.devgateway.gateway.config.GatewayProperties;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Decides whether a request carries the shared secret, either as the auth cookie or as an
 * {@code Authorization: Bearer} header. WebSocket upgrades may also pass it as a query
 * parameter. With no secret configured every request is authorized.
 */
@Component
public class SharedSecretAuthenticator {

    private static final String BEARER_PREFIX = "Bearer ";

    private final GatewayProperties.Auth auth;

    public SharedSecretAuthenticator(GatewayProperties properties) {
        this.auth = properties.getAuth();
    }

    public boolean isEnabled() {
        return auth.getSecret() != null && !auth.getSecret().isEmpty();
    }

    public boolean isAuthorized(HttpServletRequest request) {
        return isAuthorized(request, false);
    }

    public boolean isAuthorizedUpgrade(HttpServletRequest request) {
        return isAuthorized(request, true);
    }

    private boolean isAuthorized(HttpServletRequest request, boolean allowQueryParam) {
        if (!isEnabled()) return true;

        Cookie[] cookies = request.getCookies();
        if (cookies != null) {
            for (Cookie cookie : cookies) {
                if (auth.getCookieName().equals(cookie.getName()) && matches(cookie.getValue())) {
                    return true;
                }
            }
        }

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)
                && matches(header.substring(BEARER_PREFIX.length()).trim())) {
            return true;
        }

        return allowQueryParam && matches(request.getParameter(auth.getQueryParam()));
    }

    boolean matches(String candidate) {
        if (candidate == null) return false;
        return MessageDigest.isEqual(
                candidate.getBytes(StandardCharsets.UTF_8),
                auth.getSecret().getBytes(StandardCharsets.UTF_8));
    }
}

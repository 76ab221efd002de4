package io.github.drompincen.devgateway.gateway.auth;

import io.github.drompincen.devgateway.gateway.config.GatewayProperties;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class SharedSecretAuthenticatorTest {

    private GatewayProperties properties;
    private SharedSecretAuthenticator authenticator;
    private MockHttpServletRequest request;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getAuth().setSecret("s3cret");
        authenticator = new SharedSecretAuthenticator(properties);
        request = new MockHttpServletRequest("GET", "/api/vnc/status");
    }

    @Test
    void emptySecretAuthorizesEverything() {
        properties.getAuth().setSecret("");

        assertThat(authenticator.isEnabled()).isFalse();
        assertThat(authenticator.isAuthorized(request)).isTrue();
    }

    @Test
    void requestWithoutCredentialsIsRejected() {
        assertThat(authenticator.isEnabled()).isTrue();
        assertThat(authenticator.isAuthorized(request)).isFalse();
    }

    @Test
    void acceptsAuthCookie() {
        request.setCookies(new Cookie("other", "x"), new Cookie("gateway_auth", "s3cret"));

        assertThat(authenticator.isAuthorized(request)).isTrue();
    }

    @Test
    void rejectsWrongCookieValue() {
        request.setCookies(new Cookie("gateway_auth", "guess"));

        assertThat(authenticator.isAuthorized(request)).isFalse();
    }

    @Test
    void honoursConfiguredCookieName() {
        properties.getAuth().setCookieName("session_key");
        request.setCookies(new Cookie("session_key", "s3cret"));

        assertThat(authenticator.isAuthorized(request)).isTrue();
    }

    @Test
    void acceptsBearerHeader() {
        request.addHeader("Authorization", "Bearer s3cret");

        assertThat(authenticator.isAuthorized(request)).isTrue();
    }

    @Test
    void rejectsOtherAuthorizationSchemes() {
        request.addHeader("Authorization", "Basic s3cret");

        assertThat(authenticator.isAuthorized(request)).isFalse();
    }

    @Test
    void queryTokenOnlyCountsForUpgrades() {
        request.setParameter("token", "s3cret");

        assertThat(authenticator.isAuthorized(request)).isFalse();
        assertThat(authenticator.isAuthorizedUpgrade(request)).isTrue();
    }

    @Test
    void secretComparisonIsExact() {
        assertThat(authenticator.matches("s3cret")).isTrue();
        assertThat(authenticator.matches("s3cre")).isFalse();
        assertThat(authenticator.matches("s3cret ")).isFalse();
        assertThat(authenticator.matches(null)).isFalse();
    }
}

package io.github.drompincen.devgateway.gateway.auth;

import io.github.drompincen.devgateway.gateway.config.GatewayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class AuthFilterTest {

    private AuthFilter filter;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.getAuth().setSecret("s3cret");
        filter = new AuthFilter(new SharedSecretAuthenticator(properties));
    }

    @Test
    void unauthorizedApiRequestGets401Json() throws Exception {
        var request = new MockHttpServletRequest("GET", "/api/vnc/status");
        var response = new MockHttpServletResponse();
        var chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString()).isEqualTo("{\"error\":\"Unauthorized\"}");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void authorizedApiRequestPassesThrough() throws Exception {
        var request = new MockHttpServletRequest("POST", "/api/vnc/start");
        request.addHeader("Authorization", "Bearer s3cret");
        var response = new MockHttpServletResponse();
        var chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    void healthIsPublic() throws Exception {
        var request = new MockHttpServletRequest("GET", "/health");
        var response = new MockHttpServletResponse();
        var chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
    }
}

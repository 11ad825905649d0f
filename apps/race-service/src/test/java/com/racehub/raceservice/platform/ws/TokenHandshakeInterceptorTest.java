package com.racehub.raceservice.platform.ws;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TokenHandshakeInterceptorTest {

    private JwtDecoder jwtDecoder;
    private TokenHandshakeInterceptor interceptor;

    @BeforeEach
    void setUp() {
        jwtDecoder = mock(JwtDecoder.class);
        interceptor = new TokenHandshakeInterceptor(jwtDecoder);
    }

    private static Jwt jwt(String subject, String name) {
        Jwt.Builder builder = Jwt.withTokenValue("token")
                .header("alg", "RS256")
                .subject(subject)
                .claim("preferred_username", "alice");
        if (name != null) {
            builder.claim("name", name);
        }
        return builder.build();
    }

    private Map<String, Object> handshake(MockHttpServletRequest raw) {
        Map<String, Object> attributes = new HashMap<>();
        boolean proceed = interceptor.beforeHandshake(new ServletServerHttpRequest(raw),
                new ServletServerHttpResponse(new MockHttpServletResponse()), null, attributes);
        assertThat(proceed).isTrue();
        return attributes;
    }

    @Test
    void queryTokenIdentifiesUser() {
        when(jwtDecoder.decode("abc")).thenReturn(jwt("u1", "爱丽丝 -"));
        MockHttpServletRequest raw = new MockHttpServletRequest("GET", "/ws/race");
        raw.setQueryString("token=abc");

        Map<String, Object> attributes = handshake(raw);

        assertThat(attributes)
                .containsEntry(TokenHandshakeInterceptor.ATTR_USER_ID, "u1")
                .containsEntry(TokenHandshakeInterceptor.ATTR_USERNAME, "爱丽丝")
                .doesNotContainKey(TokenHandshakeInterceptor.ATTR_AUTH_ERROR);
    }

    @Test
    void bearerHeaderIsAcceptedWhenQueryMissing() {
        when(jwtDecoder.decode("xyz")).thenReturn(jwt("u2", null));
        MockHttpServletRequest raw = new MockHttpServletRequest("GET", "/ws/race");
        raw.addHeader(HttpHeaders.AUTHORIZATION, "Bearer xyz");

        Map<String, Object> attributes = handshake(raw);

        assertThat(attributes)
                .containsEntry(TokenHandshakeInterceptor.ATTR_USER_ID, "u2")
                .containsEntry(TokenHandshakeInterceptor.ATTR_USERNAME, "alice");
    }

    @Test
    void missingTokenMarksAuthError() {
        Map<String, Object> attributes = handshake(new MockHttpServletRequest("GET", "/ws/race"));

        assertThat(attributes).containsEntry(TokenHandshakeInterceptor.ATTR_AUTH_ERROR, Boolean.TRUE)
                .doesNotContainKey(TokenHandshakeInterceptor.ATTR_USER_ID);
    }

    @Test
    void rejectedTokenMarksAuthError() {
        when(jwtDecoder.decode("expired")).thenThrow(new BadJwtException("expired"));
        MockHttpServletRequest raw = new MockHttpServletRequest("GET", "/ws/race");
        raw.setQueryString("token=expired");

        Map<String, Object> attributes = handshake(raw);

        assertThat(attributes).containsEntry(TokenHandshakeInterceptor.ATTR_AUTH_ERROR, Boolean.TRUE);
    }
}

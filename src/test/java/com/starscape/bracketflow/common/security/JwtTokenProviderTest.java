package com.starscape.bracketflow.common.security;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JwtTokenProviderTest {

    private static final String SECRET = "unit-test-secret-that-is-at-least-32-bytes-long";

    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET, 60_000L, "bracketflow");

    @Test
    void authenticate_validToken_resolvesPrincipalWithScopeAuthorities() {
        String token = provider.generateToken("usr_1", "owner@example.com", List.of("jobs", "credits"));

        UserPrincipal principal = provider.authenticate(token).orElseThrow();

        assertThat(principal.getUserId()).isEqualTo("usr_1");
        assertThat(principal.getName()).isEqualTo("usr_1");
        assertThat(principal.getEmail()).isEqualTo("owner@example.com");
        assertThat(principal.getAuthorities())
            .extracting(Object::toString)
            .containsExactly("SCOPE_jobs", "SCOPE_credits");
    }

    @Test
    void authenticate_tokenFromOtherIssuer_isEmpty() {
        JwtTokenProvider other = new JwtTokenProvider(SECRET, 60_000L, "someone-else");
        String token = other.generateToken("usr_1", null, List.of());

        assertThat(provider.authenticate(token)).isEmpty();
    }

    @Test
    void authenticate_garbage_isEmpty() {
        assertThat(provider.authenticate("not-a-jwt")).isEmpty();
    }
}

package com.racehub.web.common;

import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.Jwt;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CurrentUserHelperTest {

    private static Jwt.Builder jwt() {
        return Jwt.withTokenValue("token")
                .header("alg", "none")
                .issuedAt(Instant.now())
                .expiresAt(Instant.now().plusSeconds(60));
    }

    @Test
    void usesNicknameWithPlaceholderRemoved() {
        CurrentUserInfo user = CurrentUserHelper.from(jwt()
                .subject("u-1")
                .claim("preferred_username", "alice")
                .claim("name", "Alice -")
                .build());

        assertThat(user.userId()).isEqualTo("u-1");
        assertThat(user.username()).isEqualTo("alice");
        assertThat(user.getDisplayName()).isEqualTo("Alice");
    }

    @Test
    void fallsBackToSubjectWhenNoUsername() {
        CurrentUserInfo user = CurrentUserHelper.from(jwt().subject("u-2").build());

        assertThat(user.username()).isEqualTo("u-2");
        assertThat(user.getDisplayName()).isEqualTo("u-2");
    }

    @Test
    void keepsInnerDashes() {
        assertThat(CurrentUserHelper.cleanName("张-三-")).isEqualTo("张-三");
        assertThat(CurrentUserHelper.cleanName("张三 -")).isEqualTo("张三");
    }

    @Test
    void nullJwtGivesNull() {
        assertThat(CurrentUserHelper.from(null)).isNull();
    }
}

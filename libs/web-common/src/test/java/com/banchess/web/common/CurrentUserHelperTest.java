package com.banchess.web.common;

import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CurrentUserHelperTest {

    private static Jwt.Builder jwt() {
        return Jwt.withTokenValue("token").header("alg", "HS256").subject("u-1");
    }

    @Test
    void from_prefersNicknameForDisplay() {
        CurrentUserInfo info = CurrentUserHelper.from(jwt()
                .claim("preferred_username", "alice")
                .claim("name", "Alice -")
                .claim("realm_access", Map.of("roles", List.of("player")))
                .build());
        assertEquals("u-1", info.userId());
        assertEquals("alice", info.username());
        assertEquals("Alice", info.getDisplayName());
        assertTrue(info.hasRealmRole("player"));
    }

    @Test
    void from_fallsBackToSubject() {
        CurrentUserInfo info = CurrentUserHelper.from(jwt().build());
        assertEquals("u-1", info.username());
        assertEquals("u-1", info.getDisplayName());
        assertTrue(info.realmRoles().isEmpty());
    }

    @Test
    void from_nullJwtReturnsNull() {
        assertNull(CurrentUserHelper.from(null));
    }

    @Test
    void cleanName_keepsInnerDash() {
        assertEquals("张-三", CurrentUserHelper.cleanName("张-三 -"));
        assertEquals("张三", CurrentUserHelper.cleanName("张三-"));
    }
}

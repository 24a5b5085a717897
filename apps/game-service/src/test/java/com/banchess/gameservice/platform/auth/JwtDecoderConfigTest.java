package com.banchess.gameservice.platform.auth;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class JwtDecoderConfigTest {

    @Test
    void shortSecret_isRefused() {
        assertThrows(IllegalStateException.class, () -> JwtDecoderConfig.secretBytes("too-short"));
    }

    @Test
    void configuredSecret_isUsedAsIs() {
        String secret = "0123456789abcdef0123456789abcdef";
        assertArrayEquals(secret.getBytes(StandardCharsets.UTF_8), JwtDecoderConfig.secretBytes(secret));
    }

    @Test
    void blankSecret_fallsBackToRandomKey() {
        byte[] first = JwtDecoderConfig.secretBytes(null);
        byte[] second = JwtDecoderConfig.secretBytes("  ");

        assertEquals(32, first.length);
        assertEquals(32, second.length);
        assertFalse(Arrays.equals(first, second));
    }
}

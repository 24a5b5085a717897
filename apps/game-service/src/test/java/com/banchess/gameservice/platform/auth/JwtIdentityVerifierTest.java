package com.banchess.gameservice.platform.auth;

import com.banchess.gameservice.common.ErrorCode;
import com.banchess.gameservice.common.GameException;
import com.banchess.gameservice.games.banchess.domain.model.Identity;
import com.banchess.gameservice.platform.config.BanChessProperties;
import com.nimbusds.jose.jwk.source.ImmutableSecret;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JwtIdentityVerifierTest {

    private static final String SECRET = "verifier-test-secret-0123456789-abcdef";

    private BanChessProperties properties;
    private JwtIdentityVerifier verifier;

    @BeforeEach
    void setUp() {
        properties = new BanChessProperties();
        properties.getAuth().setJwtSecret(SECRET);
        verifier = new JwtIdentityVerifier(new JwtDecoderConfig().jwtDecoder(properties), properties);
    }

    private static String sign(String secret, String subject, String username, String name, Instant expiresAt) {
        SecretKeySpec key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        JwtEncoder encoder = new NimbusJwtEncoder(new ImmutableSecret<>(key));
        JwtClaimsSet.Builder claims = JwtClaimsSet.builder()
                .subject(subject)
                .issuedAt(expiresAt.minusSeconds(3600))
                .expiresAt(expiresAt);
        if (username != null) {
            claims.claim("preferred_username", username);
        }
        if (name != null) {
            claims.claim("name", name);
        }
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        return encoder.encode(JwtEncoderParameters.from(header, claims.build())).getTokenValue();
    }

    private static String validToken(String subject, String username, String name) {
        return sign(SECRET, subject, username, name, Instant.now().plusSeconds(3600));
    }

    @Test
    void validToken_yieldsIdentity() {
        Identity identity = verifier.verify(new Credentials(validToken("user-1", "alice", "Alice -"), null, null));

        assertEquals("user-1", identity.userId());
        assertEquals("Alice", identity.displayName());
    }

    @Test
    void bearerPrefix_isAccepted() {
        String token = "Bearer " + validToken("user-2", "bob", null);

        Identity identity = verifier.verify(new Credentials(token, null, null));

        assertEquals("user-2", identity.userId());
        assertEquals("bob", identity.displayName());
    }

    @Test
    void tokenWinsOverClaimedIdentity() {
        properties.getAuth().setTrustClientIdentity(true);
        Identity identity = verifier.verify(new Credentials(validToken("user-3", null, null), "someone-else", "Mallory"));

        assertEquals("user-3", identity.userId());
    }

    @Test
    void tokenSignedWithOtherKey_isRejected() {
        String forged = sign("another-secret-0123456789-0123456789-xyz", "user-1", "alice", null,
                Instant.now().plusSeconds(3600));

        GameException ex = assertThrows(GameException.class,
                () -> verifier.verify(new Credentials(forged, null, null)));
        assertEquals(ErrorCode.AUTH_FAILED, ex.getCode());
    }

    @Test
    void expiredToken_isRejected() {
        String expired = sign(SECRET, "user-1", "alice", null, Instant.now().minusSeconds(600));

        GameException ex = assertThrows(GameException.class,
                () -> verifier.verify(new Credentials(expired, null, null)));
        assertEquals(ErrorCode.AUTH_FAILED, ex.getCode());
    }

    @Test
    void garbageToken_isRejected() {
        GameException ex = assertThrows(GameException.class,
                () -> verifier.verify(new Credentials("not.a.jwt", null, null)));
        assertEquals(ErrorCode.AUTH_FAILED, ex.getCode());
    }

    @Test
    void claimedIdentity_requiresTrustMode() {
        Credentials claimed = new Credentials(null, " guest-7 ", " Guest ");

        GameException ex = assertThrows(GameException.class, () -> verifier.verify(claimed));
        assertEquals(ErrorCode.AUTH_FAILED, ex.getCode());

        properties.getAuth().setTrustClientIdentity(true);
        Identity identity = verifier.verify(claimed);
        assertEquals("guest-7", identity.userId());
        assertEquals("Guest", identity.displayName());
    }

    @Test
    void missingCredentials_areRejected() {
        properties.getAuth().setTrustClientIdentity(true);

        assertEquals(ErrorCode.AUTH_FAILED,
                assertThrows(GameException.class, () -> verifier.verify(null)).getCode());
        assertEquals(ErrorCode.AUTH_FAILED,
                assertThrows(GameException.class, () -> verifier.verify(new Credentials(" ", " ", null))).getCode());
    }
}

package com.banchess.gameservice.platform.auth;

import com.banchess.gameservice.platform.config.BanChessProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

/**
 * JWT 解码器：HMAC-SHA256 共享密钥（banchess.auth.jwt-secret）。
 * REST 资源服务器与 WebSocket 认证共用这一个 Bean。
 */
@Slf4j
@Configuration
public class JwtDecoderConfig {

    private static final int MIN_SECRET_BYTES = 32;

    @Bean
    public JwtDecoder jwtDecoder(BanChessProperties properties) {
        byte[] secret = secretBytes(properties.getAuth().getJwtSecret());
        SecretKeySpec key = new SecretKeySpec(secret, "HmacSHA256");
        return NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
    }

    static byte[] secretBytes(String configured) {
        if (StringUtils.isBlank(configured)) {
            // 未配置密钥时生成随机密钥：所有 token 都会校验失败，只能使用信任模式
            log.warn("未配置 banchess.auth.jwt-secret，已生成随机密钥，token 认证将全部失败");
            byte[] random = new byte[MIN_SECRET_BYTES];
            new SecureRandom().nextBytes(random);
            return random;
        }
        byte[] bytes = configured.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("banchess.auth.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        return bytes;
    }
}

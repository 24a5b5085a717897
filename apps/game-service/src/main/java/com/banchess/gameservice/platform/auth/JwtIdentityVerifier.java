package com.banchess.gameservice.platform.auth;

import com.banchess.gameservice.common.ErrorCode;
import com.banchess.gameservice.common.GameException;
import com.banchess.gameservice.games.banchess.domain.constants.GameMessages;
import com.banchess.gameservice.games.banchess.domain.model.Identity;
import com.banchess.gameservice.platform.config.BanChessProperties;
import com.banchess.web.common.CurrentUserHelper;
import com.banchess.web.common.CurrentUserInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;

/**
 * 基于 JWT 的身份校验。
 * <ul>
 *   <li>带 token：用 {@link JwtDecoder} 验签并取 subject / 展示名；</li>
 *   <li>不带 token：仅在 banchess.auth.trust-client-identity=true 时接受客户端自报身份（开发/访客）。</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtIdentityVerifier implements IdentityVerifier {

    private final JwtDecoder jwtDecoder;
    private final BanChessProperties properties;

    @Override
    public Identity verify(Credentials credentials) {
        if (credentials == null) {
            throw new GameException(ErrorCode.AUTH_FAILED, GameMessages.AUTH_FAILED);
        }
        if (credentials.hasToken()) {
            String token = StringUtils.removeStartIgnoreCase(credentials.token().trim(), "Bearer ").trim();
            try {
                return fromJwt(jwtDecoder.decode(token));
            } catch (JwtException e) {
                log.info("token 校验失败: {}", e.getMessage());
                throw new GameException(ErrorCode.AUTH_FAILED, GameMessages.AUTH_FAILED);
            }
        }
        if (properties.getAuth().isTrustClientIdentity() && StringUtils.isNotBlank(credentials.userId())) {
            return new Identity(credentials.userId().trim(), StringUtils.trimToNull(credentials.username()));
        }
        throw new GameException(ErrorCode.AUTH_FAILED, GameMessages.AUTH_FAILED);
    }

    /**
     * 从已验签的 JWT 构造身份（STOMP CONNECT 预认证也走这里）。
     */
    public static Identity fromJwt(Jwt jwt) {
        CurrentUserInfo user = CurrentUserHelper.from(jwt);
        if (user == null || StringUtils.isBlank(user.userId())) {
            throw new GameException(ErrorCode.AUTH_FAILED, GameMessages.AUTH_FAILED);
        }
        return new Identity(user.userId(), user.getDisplayName());
    }
}

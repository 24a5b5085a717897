package com.banchess.gameservice.platform.auth;

/**
 * authenticate 消息携带的凭证：token，或（信任模式下）客户端自报的 userId + username。
 */
public record Credentials(String token, String userId, String username) {

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }
}

package com.banchess.gameservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.security.oauth2.server.resource.authentication.JwtGrantedAuthoritiesConverter;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * WebSocket STOMP 认证拦截器
 *
 * 在 STOMP CONNECT 阶段验证 JWT token 并设置用户身份（预认证）。
 * 没有 token 或验证失败时不设置用户，连接仍然建立，
 * 客户端需要随后发送 authenticate 消息完成认证。
 */
@Slf4j
@Component
public class WebSocketAuthChannelInterceptor implements ChannelInterceptor {

    private final JwtDecoder jwtDecoder;
    private final JwtGrantedAuthoritiesConverter authoritiesConverter = new JwtGrantedAuthoritiesConverter();

    public WebSocketAuthChannelInterceptor(JwtDecoder jwtDecoder) {
        this.jwtDecoder = jwtDecoder;
    }

    /**
     * 拦截入站消息，在 CONNECT 阶段进行认证
     */
    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || !StompCommand.CONNECT.equals(accessor.getCommand())) {
            return message;
        }
        // 从 header 提取 token（支持 Authorization 或 access_token）
        String auth = firstHeader(accessor, "Authorization");
        if (auth == null) auth = firstHeader(accessor, "authorization");
        if (auth == null) {
            String tokenOnly = firstHeader(accessor, "access_token");
            if (tokenOnly != null && !tokenOnly.isBlank()) auth = "Bearer " + tokenOnly.trim();
        }
        if (auth != null && auth.toLowerCase().startsWith("bearer ")) {
            String token = auth.substring(7).trim();
            try {
                Jwt jwt = jwtDecoder.decode(token);
                Collection<GrantedAuthority> authorities = authoritiesConverter.convert(jwt);
                // 以 subject 作为 Principal 名称：与 userId 一致
                accessor.setUser(new JwtAuthenticationToken(jwt, authorities, jwt.getSubject()));
            } catch (JwtException e) {
                log.info("STOMP CONNECT token 校验失败，连接以未认证状态建立: session={}, err={}",
                        accessor.getSessionId(), e.getMessage());
            }
        }
        return message;
    }

    /**
     * 从 STOMP header 中提取指定 key 的第一个值
     */
    private static String firstHeader(StompHeaderAccessor accessor, String key) {
        List<String> vals = accessor.getNativeHeader(key);
        return (vals == null || vals.isEmpty()) ? null : vals.get(0);
    }
}

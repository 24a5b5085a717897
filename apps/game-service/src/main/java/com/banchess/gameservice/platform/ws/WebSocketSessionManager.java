package com.banchess.gameservice.platform.ws;

import com.banchess.gameservice.common.GameException;
import com.banchess.gameservice.games.banchess.domain.model.Identity;
import com.banchess.gameservice.games.banchess.service.BanChessService;
import com.banchess.gameservice.platform.auth.JwtIdentityVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;
import org.springframework.web.socket.messaging.SessionSubscribeEvent;

import java.security.Principal;

/**
 * 监听 STOMP 连接/订阅/断开事件，把传输层生命周期转交给服务层。
 *
 * 断开检测基于 TCP 连接关闭（关闭页签、网络中断、进程崩溃都会触发），
 * 比浏览器端事件更可靠；断开不是错误，只触发离开对局与重连宽限期。
 */
@Slf4j
@Component
public class WebSocketSessionManager {

    static final String PERSONAL_QUEUE = "/user/queue/banchess";

    private final BanChessService banChessService;

    public WebSocketSessionManager(BanChessService banChessService) {
        this.banChessService = banChessService;
    }

    /**
     * 连接建立：登记连接；CONNECT 阶段已带合法 token 的连接直接绑定身份。
     */
    @EventListener
    public void handleSessionConnect(SessionConnectEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        String sessionId = accessor.getSessionId();
        if (sessionId == null) {
            log.warn("SessionConnectEvent 缺少 sessionId");
            return;
        }
        banChessService.connectionOpened(sessionId, identityOf(accessor.getUser()));
    }

    /**
     * 订阅个人队列：预认证连接此时才能收到 authenticated。
     */
    @EventListener
    public void handleSessionSubscribe(SessionSubscribeEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        if (PERSONAL_QUEUE.equals(accessor.getDestination()) && accessor.getSessionId() != null) {
            banChessService.connectionReady(accessor.getSessionId());
        }
    }

    /**
     * 连接断开：离开对局，必要时开始重连宽限期。
     */
    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        if (sessionId == null) {
            log.warn("【WebSocket断开检测】收到 SessionDisconnectEvent 但缺少 sessionId");
            return;
        }
        log.info("【WebSocket断开检测】检测到断开: sessionId={}, closeStatus={}", sessionId, event.getCloseStatus());
        banChessService.connectionClosed(sessionId);
    }

    private static Identity identityOf(Principal principal) {
        if (principal instanceof JwtAuthenticationToken jwtAuth) {
            try {
                return JwtIdentityVerifier.fromJwt(jwtAuth.getToken());
            } catch (GameException e) {
                log.info("CONNECT 携带的 token 缺少用户信息，按未认证处理: {}", e.getMessage());
            }
        }
        return null;
    }
}

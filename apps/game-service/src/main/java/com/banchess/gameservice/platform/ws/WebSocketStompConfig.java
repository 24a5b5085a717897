package com.banchess.gameservice.platform.ws;

import com.banchess.gameservice.platform.config.BanChessProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketTransportRegistration;

/**
 * WebSocket + STOMP 配置类
 * ----------------------------------------
 * 客户端通过 /ws 端点连接，使用 /app 前缀发送指令，
 * 订阅 /user/queue/banchess 接收发给本连接的全部消息（快照、事件、错误）。
 *
 * 用途：
 *   - /app/banchess.* : 客户端发送（如 /app/banchess.action）
 *   - /user/queue/banchess : 服务端按连接投递
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketStompConfig implements WebSocketMessageBrokerConfigurer {

    private final WebSocketAuthChannelInterceptor authInterceptor;
    private final BanChessProperties properties;

    public WebSocketStompConfig(WebSocketAuthChannelInterceptor authInterceptor, BanChessProperties properties) {
        this.authInterceptor = authInterceptor;
        this.properties = properties;
    }

    /**
     * 配置 TaskScheduler 用于 WebSocket 心跳。
     * 注意：使用不同的 bean 名称避免与 Spring 自动配置冲突。
     */
    @Bean(name = "wsHeartbeatTaskScheduler")
    public TaskScheduler wsHeartbeatTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("ws-heartbeat-");
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * 注册 WebSocket STOMP 端点（原生 WebSocket + SockJS 回退）
     */
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns("*"); // 开发时用 *，生产建议限制域名
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns("*")
                .withSockJS();
        registry.setPreserveReceiveOrder(true);
    }

    /**
     * 消息路由：
     *   - enableSimpleBroker("/queue")：内存代理，只用于按连接投递；
     *   - 心跳 5 秒；
     *   - 同一连接的入站/出站消息保持顺序。
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/queue")
                .setHeartbeatValue(new long[]{5000, 5000})
                .setTaskScheduler(wsHeartbeatTaskScheduler());
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
        registry.setPreservePublishOrder(true);
    }

    /**
     * 出站缓冲上限：慢连接超过发送时间或缓冲大小时由框架关闭该连接，不影响其它连接。
     */
    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registration) {
        BanChessProperties.Outbound outbound = properties.getOutbound();
        registration.setSendBufferSizeLimit(outbound.getSendBufferSizeLimit())
                .setSendTimeLimit(outbound.getSendTimeLimitMs())
                .setMessageSizeLimit(outbound.getMessageSizeLimit());
    }

    /**
     * 入站通道拦截器：CONNECT 阶段的 token 预认证。
     */
    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(authInterceptor);
    }
}

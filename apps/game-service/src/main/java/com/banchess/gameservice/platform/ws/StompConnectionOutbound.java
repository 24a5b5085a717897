package com.banchess.gameservice.platform.ws;

import com.banchess.gameservice.platform.connection.ConnectionOutbound;
import com.banchess.gameservice.platform.transport.ServerEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Component;

/**
 * 基于 STOMP 的连接出站实现。
 * 通过 sessionId 头精确投递到单条连接的 /user/queue/banchess，
 * 实际写 socket 发生在 clientOutboundChannel 的线程池上，调用方不会被慢连接阻塞。
 */
@Slf4j
@Component
public class StompConnectionOutbound implements ConnectionOutbound {

    static final String DESTINATION = "/queue/banchess";

    private final SimpMessagingTemplate messagingTemplate;
    /** 客户端入站通道：投递 DISCONNECT 帧即可让框架关闭连接 */
    private final MessageChannel clientInboundChannel;

    public StompConnectionOutbound(SimpMessagingTemplate messagingTemplate,
                                   @Qualifier("clientInboundChannel") MessageChannel clientInboundChannel) {
        this.messagingTemplate = messagingTemplate;
        this.clientInboundChannel = clientInboundChannel;
    }

    /**
     * 以连接ID作为“用户名”投递：用户目的地解析器在用户名等于 sessionId 时直接定位该连接，
     * 与连接是否在 CONNECT 阶段带了 Principal 无关，也不会扩散到同一用户的其它连接。
     */
    @Override
    public void send(String connectionId, ServerEvent event) {
        SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headerAccessor.setSessionId(connectionId);
        headerAccessor.setLeaveMutable(true);
        messagingTemplate.convertAndSendToUser(connectionId, DESTINATION, event, headerAccessor.getMessageHeaders());
    }

    @Override
    public void close(String connectionId) {
        StompHeaderAccessor header = StompHeaderAccessor.create(StompCommand.DISCONNECT);
        header.setSessionId(connectionId);
        header.setLeaveMutable(true);
        boolean sent = clientInboundChannel.send(MessageBuilder.createMessage(new byte[0], header.getMessageHeaders()));
        if (!sent) {
            log.warn("断开连接的 DISCONNECT 帧未被接收: connectionId={}", connectionId);
        }
    }
}

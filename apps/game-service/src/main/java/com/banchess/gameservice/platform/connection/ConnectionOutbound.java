package com.banchess.gameservice.platform.connection;

import com.banchess.gameservice.platform.transport.ServerEvent;

/**
 * 连接出站通道（传输层抽象）。
 * 实现必须是非阻塞的：慢连接只影响自己，缓冲溢出时由传输层关闭该连接。
 */
public interface ConnectionOutbound {

    /**
     * 投递一条消息到指定连接。
     * @param connectionId 连接ID（STOMP sessionId）
     */
    void send(String connectionId, ServerEvent event);

    /** 关闭连接 */
    void close(String connectionId);
}

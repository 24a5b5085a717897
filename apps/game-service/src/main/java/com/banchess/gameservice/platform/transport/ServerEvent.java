package com.banchess.gameservice.platform.transport;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 服务端 → 客户端的统一消息外壳：{type, sessionId?, payload}。
 * 通过 /user/queue/banchess 投递到单个连接。
 *
 * 用法示例：
 *   ServerEvent.state(sessionId, snapshot);
 *   ServerEvent.error("ILLEGAL_ACTION", "move e2e5 is not legal");
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerEvent(String type, String sessionId, Object payload) {

    public static final String AUTHENTICATED = "authenticated";
    public static final String GAME_CREATED = "game-created";
    public static final String QUEUE_POSITION = "queue-position";
    public static final String QUEUE_LEFT = "queue-left";
    public static final String MATCHED = "matched";
    public static final String STATE = "state";
    public static final String GAME_EVENT = "game-event";
    public static final String ERROR = "error";

    public static ServerEvent of(String type, String sessionId, Object payload) {
        return new ServerEvent(type, sessionId, payload);
    }

    /** 完整快照 */
    public static ServerEvent state(String sessionId, Object snapshot) {
        return new ServerEvent(STATE, sessionId, snapshot);
    }

    /** 错误通知：payload = {code, message} */
    public static ServerEvent error(String code, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("code", code);
        payload.put("message", message == null ? "" : message);
        return new ServerEvent(ERROR, null, payload);
    }
}

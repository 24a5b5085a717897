package com.banchess.gameservice.games.banchess.domain.model;

/**
 * 对局中的提示性事件（送时间、提和、断线/重连），不影响局面。
 *
 * @param type      事件类型，见 {@link #TIME_GIVEN} 等常量
 * @param color     相关一方（"white" / "black"），可为空
 * @param message   展示文本
 * @param timestamp 服务端时间戳（毫秒）
 */
public record GameEvent(String type, String color, String message, long timestamp) {

    public static final String TIME_GIVEN = "time-given";
    public static final String DRAW_OFFERED = "draw-offered";
    public static final String DRAW_DECLINED = "draw-declined";
    public static final String PLAYER_DISCONNECTED = "player-disconnected";
    public static final String PLAYER_RECONNECTED = "player-reconnected";
}

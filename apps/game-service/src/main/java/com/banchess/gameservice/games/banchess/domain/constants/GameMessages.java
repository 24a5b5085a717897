package com.banchess.gameservice.games.banchess.domain.constants;

/**
 * Ban Chess 相关的消息常量
 * 统一管理所有回给客户端的提示文本，避免硬编码
 *
 * 使用示例：
 *   throw new GameException(ErrorCode.WRONG_ROLE, GameMessages.formatNotYourTurn("white"));
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 对局状态 ==========

    public static final String GAME_NOT_STARTED = "对局尚未开始";

    public static final String GAME_ALREADY_OVER = "对局已结束";

    public static final String NOT_WAITING = "对局不在等待状态（当前为 %s）";

    public static String formatNotWaiting(String status) {
        return String.format(NOT_WAITING, status);
    }

    // ========== 动作校验 ==========

    public static final String ACTION_REQUIRED = "缺少 ban 或 move 载荷";

    /** 未轮到该方行动 */
    public static final String NOT_YOUR_TURN = "未轮到该方行动（当前应为 %s）";

    public static String formatNotYourTurn(String expected) {
        return String.format(NOT_YOUR_TURN, expected);
    }

    /** 阶段不符 */
    public static final String WRONG_PHASE = "当前阶段应提交 %s";

    public static String formatWrongPhase(String phase) {
        return String.format(WRONG_PHASE, phase);
    }

    public static final String SPECTATOR_CANNOT_ACT = "观战者不能执行该操作";

    // ========== 提和 / 送时间 ==========

    public static final String DRAW_NOT_IN_SOLO = "单人对局不支持提和";

    public static final String DRAW_OFFERED = "%s 提出和棋";

    public static String formatDrawOffered(String name) {
        return String.format(DRAW_OFFERED, name);
    }

    public static final String DRAW_DECLINED = "%s 拒绝和棋";

    public static String formatDrawDeclined(String name) {
        return String.format(DRAW_DECLINED, name);
    }

    public static final String GIVE_TIME_NOT_IN_SOLO = "单人对局不支持送时间";

    public static final String GIVE_TIME_UNTIMED = "不计时对局不支持送时间";

    public static final String GIVE_TIME_RANGE = "送时间需在 1~300 秒之间";

    public static final String TIME_GIVEN = "%s 给 %s 加了 %d 秒";

    public static String formatTimeGiven(String giver, int seconds, String recipient) {
        return String.format(TIME_GIVEN, giver, recipient, seconds);
    }

    // ========== 连接 / 附着 ==========

    public static final String AUTH_REQUIRED = "请先完成认证";

    public static final String AUTH_FAILED = "认证失败";

    public static final String SESSION_NOT_FOUND = "对局不存在: %s";

    public static String formatSessionNotFound(String sessionId) {
        return String.format(SESSION_NOT_FOUND, sessionId);
    }

    public static final String SEAT_TAKEN = "该座位已有在线连接";

    public static final String NOT_ATTACHED = "当前连接未加入该对局";

    public static final String PLAYER_DISCONNECTED = "%s 断开连接";

    public static String formatDisconnected(String name) {
        return String.format(PLAYER_DISCONNECTED, name);
    }

    public static final String PLAYER_RECONNECTED = "%s 已重新连接";

    public static String formatReconnected(String name) {
        return String.format(PLAYER_RECONNECTED, name);
    }

    // ========== 匹配 ==========

    public static final String ALREADY_IN_GAME = "你已有进行中的对局: %s";

    public static String formatAlreadyInGame(String sessionId) {
        return String.format(ALREADY_IN_GAME, sessionId);
    }

    public static final String SPECTATORS_DISABLED = "该服务器不允许观战";

    public static final String SERVER_SHUTTING_DOWN = "服务器正在关闭";
}

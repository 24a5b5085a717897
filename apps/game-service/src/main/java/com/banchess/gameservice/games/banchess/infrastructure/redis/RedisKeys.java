package com.banchess.gameservice.games.banchess.infrastructure.redis;

/**
 * Ban Chess 相关的 Redis 键名。
 */
public final class RedisKeys {

    private static final String PREFIX = "banchess:";

    private RedisKeys() {
    }

    /** 进行中对局检查点（String，TTL） */
    public static String checkpoint(String sessionId) {
        return PREFIX + "checkpoint:" + sessionId;
    }

    /** 终局记录（String） */
    public static String finishedGame(String sessionId) {
        return PREFIX + "game:" + sessionId;
    }

    /** 用户历史对局索引（ZSET，score=结束时间） */
    public static String userGames(String userId) {
        return PREFIX + "user:" + userId + ":games";
    }

    /** 用户进行中对局提示（String，TTL） */
    public static String userOngoing(String userId) {
        return PREFIX + "user:" + userId + ":ongoing";
    }
}

package com.banchess.gameservice.games.banchess.application.matchmaking;

/**
 * 入队结果：要么仍在等待（position 从 1 开始），要么已配对成功。
 */
public record EnqueueResult(int position, MatchResult match) {

    public static EnqueueResult waiting(int position) {
        return new EnqueueResult(position, null);
    }

    public static EnqueueResult matched(MatchResult match) {
        return new EnqueueResult(0, match);
    }

    public boolean isMatched() {
        return match != null;
    }
}

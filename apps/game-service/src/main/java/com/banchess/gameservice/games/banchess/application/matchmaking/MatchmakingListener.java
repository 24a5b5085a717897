package com.banchess.gameservice.games.banchess.application.matchmaking;

import java.util.Map;

/**
 * 匹配结果通知（由服务层实现，负责推送 matched / queue-position）。
 * 回调发生在匹配锁之外。
 */
public interface MatchmakingListener {

    void onMatched(MatchResult match);

    /**
     * 队列位置变化。
     * @param positions userId → 新位置（从 1 开始）
     */
    void onQueuePositions(Map<String, Integer> positions);
}

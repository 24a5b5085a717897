package com.banchess.gameservice.games.banchess.application.matchmaking;

import com.banchess.gameservice.games.banchess.domain.model.Identity;

/**
 * 匹配队列条目（只在内存中，不持久化）。
 */
public record QueueEntry(Identity identity, long enqueuedAt, MatchPreferences preferences) {
}

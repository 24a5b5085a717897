package com.banchess.gameservice.games.banchess.infrastructure.redis.repo;

import com.banchess.gameservice.games.banchess.domain.dto.GameRecord;
import com.banchess.gameservice.games.banchess.domain.repository.GameRecordRepository;
import com.banchess.gameservice.games.banchess.infrastructure.redis.RedisKeys;
import com.banchess.gameservice.infrastructure.redis.RedisOps;
import com.banchess.gameservice.platform.config.BanChessProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * 基于 Redis 的对局记录仓储。
 *
 * 键空间：
 *  - banchess:checkpoint:{id}      进行中检查点，带 TTL
 *  - banchess:game:{id}            终局记录
 *  - banchess:user:{uid}:games     用户历史对局索引（ZSET）
 */
@Repository
@RequiredArgsConstructor
public class RedisGameRecordRepository implements GameRecordRepository {

    /** 每个用户索引中保留的对局数 */
    private static final int USER_INDEX_KEEP = 200;

    private final RedisOps redisOps;
    private final BanChessProperties properties;

    @Override
    public void saveCheckpoint(GameRecord record) {
        redisOps.setEx(RedisKeys.checkpoint(record.getSessionId()), record,
                properties.getSession().getCheckpointTtl());
    }

    @Override
    public Optional<GameRecord> findCheckpoint(String sessionId) {
        return Optional.ofNullable(redisOps.get(RedisKeys.checkpoint(sessionId), GameRecord.class));
    }

    @Override
    public void deleteCheckpoint(String sessionId) {
        redisOps.del(RedisKeys.checkpoint(sessionId));
    }

    @Override
    public void saveFinished(GameRecord record) {
        redisOps.set(RedisKeys.finishedGame(record.getSessionId()), record);
        index(record.getWhitePlayerId(), record);
        if (!record.getBlackPlayerId().equals(record.getWhitePlayerId())) {
            index(record.getBlackPlayerId(), record);
        }
    }

    @Override
    public Optional<GameRecord> findFinished(String sessionId) {
        return Optional.ofNullable(redisOps.get(RedisKeys.finishedGame(sessionId), GameRecord.class));
    }

    @Override
    public List<String> recentFinishedIds(String userId, int limit) {
        return redisOps.zRevRange(RedisKeys.userGames(userId), limit);
    }

    private void index(String userId, GameRecord record) {
        String key = RedisKeys.userGames(userId);
        redisOps.zAdd(key, record.getSessionId(), record.getEndedAt());
        redisOps.zTrim(key, USER_INDEX_KEEP);
    }
}

package com.banchess.gameservice.games.banchess.domain.repository;

import com.banchess.gameservice.games.banchess.domain.dto.GameRecord;

import java.util.List;
import java.util.Optional;

/**
 * 对局记录仓储（持久化出口）。
 * 对局进行中只写检查点；只有恢复对局时才会读取检查点。
 */
public interface GameRecordRepository {

    /** 写入/覆盖进行中对局的检查点 */
    void saveCheckpoint(GameRecord record);

    Optional<GameRecord> findCheckpoint(String sessionId);

    void deleteCheckpoint(String sessionId);

    /** 写入终局记录，并登记到双方的历史对局索引 */
    void saveFinished(GameRecord record);

    Optional<GameRecord> findFinished(String sessionId);

    /** 某用户最近的终局对局ID（按结束时间倒序） */
    List<String> recentFinishedIds(String userId, int limit);
}

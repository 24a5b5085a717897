package com.banchess.gameservice.games.banchess.domain.dto;

import com.banchess.gameservice.games.banchess.domain.model.HistoryEntry;
import com.banchess.gameservice.games.banchess.domain.model.SessionView;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 对局持久化记录（检查点 / 终局记录共用）。
 * ---------------------------------------
 * 足以从初始局面确定性地重放整局：参与者 + BCN 动作序列 + 结果 + 时间戳。
 * 检查点额外带上双方剩余时间，用于恢复计时。
 */
@Data
@NoArgsConstructor
public class GameRecord {

    private String sessionId;
    private String mode;              // solo / online
    private String status;            // active / finished

    private String whitePlayerId;
    private String whitePlayerName;
    private String blackPlayerId;
    private String blackPlayerName;

    /** BCN 动作序列，如 ["b:e2e4", "m:d2d4"] */
    private List<String> bcn = new ArrayList<>();
    /** 每个动作的耗时（毫秒），与 bcn 一一对应 */
    private List<Long> moveTimes = new ArrayList<>();

    private String winner;            // white / black / draw；未结束为 null
    private String reason;            // checkmate / resignation / ...
    private String timeControl;       // 如 300+0；不计时为 null
    private Long whiteRemainingMs;
    private Long blackRemainingMs;

    private long createdAt;
    private long startedAt;
    private long endedAt;

    /**
     * 由对局视图生成记录。
     */
    public static GameRecord from(SessionView view) {
        GameRecord rec = new GameRecord();
        rec.setSessionId(view.sessionId());
        rec.setMode(view.mode().wireName());
        rec.setStatus(view.status().wireName());
        rec.setWhitePlayerId(view.white().userId());
        rec.setWhitePlayerName(view.white().displayName());
        rec.setBlackPlayerId(view.black().userId());
        rec.setBlackPlayerName(view.black().displayName());
        for (HistoryEntry e : view.history()) {
            rec.getBcn().add(e.bcn());
            rec.getMoveTimes().add(e.elapsedMs());
        }
        if (view.result() != null) {
            rec.setWinner(view.result().winnerName());
            rec.setReason(view.result().reason().wireName());
        }
        rec.setTimeControl(view.timeControl());
        if (view.clock() != null) {
            rec.setWhiteRemainingMs(view.clock().whiteMs());
            rec.setBlackRemainingMs(view.clock().blackMs());
        }
        rec.setCreatedAt(view.createdAt());
        rec.setStartedAt(view.startedAt());
        rec.setEndedAt(view.endedAt());
        return rec;
    }
}

package com.banchess.gameservice.games.banchess.domain.model;

import com.banchess.gameservice.games.banchess.domain.enums.GameMode;
import com.banchess.gameservice.games.banchess.domain.enums.SeatRole;
import com.banchess.gameservice.games.banchess.domain.enums.SessionStatus;
import com.banchess.rules.ActionType;
import com.banchess.rules.Color;

import java.util.List;

/**
 * 对局的不可变全量视图。
 * ---------------------------------------
 * 由对局工作线程在每次状态变更后生成，随后可被任意线程安全读取
 * （广播、REST 查询、附着时的快照）。按角色裁剪由 SnapshotAssembler 完成。
 *
 * @param legalActions 当前行动方（actor）的合法动作；非进行中为空
 * @param actor        当前应行动方；终局后为 null
 * @param revision     每次状态变更 +1，用于判断快照新旧
 */
public record SessionView(String sessionId,
                          GameMode mode,
                          SessionStatus status,
                          Identity white,
                          Identity black,
                          String fen,
                          ActionType phase,
                          Color actor,
                          String bannedMove,
                          boolean inCheck,
                          List<HistoryEntry> history,
                          List<String> legalActions,
                          GameResult result,
                          String timeControl,
                          ClockView clock,
                          List<GameEvent> events,
                          Color drawOfferFrom,
                          long revision,
                          long createdAt,
                          long startedAt,
                          long endedAt) {

    public boolean isFinished() {
        return status == SessionStatus.FINISHED;
    }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    /** 根据用户ID推导其在本局中的角色 */
    public SeatRole roleOf(String userId) {
        if (userId == null) {
            return SeatRole.SPECTATOR;
        }
        boolean isWhite = white.userId().equals(userId);
        boolean isBlack = black.userId().equals(userId);
        if (isWhite && isBlack) {
            return SeatRole.BOTH;
        }
        if (isWhite) {
            return SeatRole.WHITE;
        }
        if (isBlack) {
            return SeatRole.BLACK;
        }
        return SeatRole.SPECTATOR;
    }

    public Identity participant(Color color) {
        return color == Color.WHITE ? white : black;
    }
}

package com.banchess.gameservice.games.banchess.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * state 消息载荷：按接收方角色裁剪后的完整快照。
 * ---------------------------------------
 * 客户端渲染只依赖这一份快照，不需要任何增量拼接；
 * legalActions 只对“轮到自己行动的玩家”非空，对手和观战者看到的是空列表。
 */
@Data
@Builder
public class StateSnapshot {
    private String sessionId;
    private String mode;            // solo / online
    private String status;          // waiting / active / finished
    private String yourRole;        // white / black / both / spectator
    private PlayerView white;
    private PlayerView black;
    private String fen;
    private String nextAction;      // ban / move；终局后为 null
    private String actor;           // 当前应行动方；终局后为 null
    private String bannedMove;      // 当前生效的禁着（MOVE 阶段）
    private boolean inCheck;
    private List<HistoryEntry> history;
    private List<String> legalActions;
    private ResultView result;
    private String timeControl;     // 如 300+0；无计时为 null
    private ClockView clock;
    private List<GameEvent> events;
    private String drawOffer;       // 已提和的一方
    private long revision;

    /** 参与者展示信息 */
    public record PlayerView(String userId, String displayName) {
        public static PlayerView of(Identity identity) {
            return new PlayerView(identity.userId(), identity.displayName());
        }
    }

    /** 结果展示：winner 为 white / black / null */
    public record ResultView(String winner, String reason) {
        public static ResultView of(GameResult result) {
            if (result == null) {
                return null;
            }
            return new ResultView(result.winner() == null ? null : result.winner().wireName(),
                    result.reason().wireName());
        }
    }
}

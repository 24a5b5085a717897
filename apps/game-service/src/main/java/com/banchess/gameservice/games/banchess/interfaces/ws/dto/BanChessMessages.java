package com.banchess.gameservice.games.banchess.interfaces.ws.dto;

import com.banchess.gameservice.common.ErrorCode;
import com.banchess.gameservice.common.GameException;
import com.banchess.rules.Action;
import com.banchess.rules.Bcn;
import lombok.Data;

/**
 * WebSocket 消息对象定义（DTO）
 * ----------------------------------------
 * 客户端 → 服务端的指令，发送到 /app/banchess.{type}。
 * 服务端 → 客户端统一使用 {@link com.banchess.gameservice.platform.transport.ServerEvent}。
 */
public class BanChessMessages {

    /**
     * 认证（客户端 → 服务端）
     * 字段：
     *   - token   ：身份提供方签发的 JWT（可带 "Bearer " 前缀）；
     *   - userId / username：仅在服务端开启信任模式时使用（开发/访客）。
     */
    @Data
    public static class AuthenticateCmd {
        private String token;
        private String userId;
        private String username;
    }

    /**
     * 创建单人自对弈。timeControl 如 "300+0"，"none" 表示不计时，缺省使用服务端默认值。
     */
    @Data
    public static class CreateSoloCmd {
        private String timeControl;
    }

    /**
     * 加入匹配队列。preferences 目前只有时间控制。
     */
    @Data
    public static class JoinQueueCmd {
        private Preferences preferences;

        public String timeControl() {
            return preferences == null ? null : preferences.getTimeControl();
        }
    }

    @Data
    public static class Preferences {
        private String timeControl;
    }

    /**
     * 只带对局ID的指令：attach / resign / offer-draw。
     */
    @Data
    public static class SessionCmd {
        private String sessionId;
    }

    /**
     * 送时间。amount 为秒数，缺省使用服务端默认值。
     */
    @Data
    public static class GiveTimeCmd {
        private String sessionId;
        private Integer amount;
    }

    /**
     * 禁着/走子（客户端 → 服务端）
     * ---------------------------------------------
     * ban、move、bcn 三选一：
     *   - ban ：{from:"e2", to:"e4"}
     *   - move：{from:"e7", to:"e8", promotion:"q"}
     *   - bcn ："b:e2e4" / "m:e7e8q"
     */
    @Data
    public static class ActionCmd {
        private String sessionId;
        private SquarePair ban;
        private SquarePair move;
        private String bcn;

        /**
         * 转成规则引擎的动作。
         * @throws GameException PROTOCOL 载荷缺失、重复或坐标不合法
         */
        public Action toAction() {
            int given = (ban != null ? 1 : 0) + (move != null ? 1 : 0) + (bcn != null ? 1 : 0);
            if (given != 1) {
                throw new GameException(ErrorCode.PROTOCOL, "exactly one of ban, move, bcn is required");
            }
            try {
                if (ban != null) {
                    return Action.ban(ban.getFrom(), ban.getTo());
                }
                if (move != null) {
                    return Action.move(move.getFrom(), move.getTo(), move.getPromotion());
                }
                return Bcn.decode(bcn);
            } catch (IllegalArgumentException e) {
                throw new GameException(ErrorCode.PROTOCOL, e.getMessage());
            }
        }
    }

    @Data
    public static class SquarePair {
        private String from;
        private String to;
        private String promotion;
    }
}

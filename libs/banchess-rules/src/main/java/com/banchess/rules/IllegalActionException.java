package com.banchess.rules;

/**
 * 动作被规则引擎拒绝。输入局面保持不变。
 */
public class IllegalActionException extends RuntimeException {

    public enum Reason {
        /** 禁着阶段提交了走子，或反之 */
        WRONG_PHASE,
        /** 不在合法动作集合内 */
        ILLEGAL,
        /** 走子命中当前禁着 */
        BANNED,
        /** 局面已终局 */
        GAME_OVER
    }

    private final Reason reason;

    public IllegalActionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}

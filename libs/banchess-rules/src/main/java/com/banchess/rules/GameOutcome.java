package com.banchess.rules;

/**
 * 规则层面的终局判定结果。
 *
 * @param termination 终局类型（ONGOING 表示未结束）
 * @param winner      胜方；和棋或未结束时为 null
 */
public record GameOutcome(Termination termination, Color winner) {

    public static final GameOutcome ONGOING = new GameOutcome(Termination.ONGOING, null);

    public enum Termination {
        ONGOING,
        CHECKMATE,
        STALEMATE,
        INSUFFICIENT_MATERIAL
    }

    public boolean isTerminal() {
        return termination != Termination.ONGOING;
    }

    public static GameOutcome checkmate(Color winner) {
        return new GameOutcome(Termination.CHECKMATE, winner);
    }

    public static GameOutcome draw(Termination termination) {
        return new GameOutcome(termination, null);
    }
}

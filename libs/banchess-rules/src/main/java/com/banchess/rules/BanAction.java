package com.banchess.rules;

/**
 * 禁着：禁止对手下一步走 from→to。
 */
public record BanAction(int from, int to) implements Action {

    public BanAction {
        if (from < 0 || from > 63 || to < 0 || to > 63) {
            throw new IllegalArgumentException("square out of range");
        }
    }

    @Override
    public ActionType type() {
        return ActionType.BAN;
    }

    @Override
    public String uci() {
        return Square.name(from) + Square.name(to);
    }

    /** 该禁着是否命中某个着法（忽略升变类型） */
    public boolean matches(ChessMove move) {
        return move.sameSquares(from, to);
    }

    @Override
    public String toString() {
        return "ban " + uci();
    }
}

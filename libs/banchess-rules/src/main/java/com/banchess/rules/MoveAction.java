package com.banchess.rules;

/**
 * 走子动作。promotion 为 null 表示非升变。
 */
public record MoveAction(int from, int to, PieceType promotion) implements Action {

    public MoveAction {
        if (from < 0 || from > 63 || to < 0 || to > 63) {
            throw new IllegalArgumentException("square out of range");
        }
        if (promotion != null && !promotion.isPromotionTarget()) {
            throw new IllegalArgumentException("illegal promotion piece: " + promotion);
        }
    }

    public static MoveAction of(ChessMove move) {
        return new MoveAction(move.from(), move.to(), move.promotion());
    }

    public ChessMove toChessMove() {
        return new ChessMove(from, to, promotion);
    }

    @Override
    public ActionType type() {
        return ActionType.MOVE;
    }

    @Override
    public String uci() {
        return toChessMove().uci();
    }

    @Override
    public String toString() {
        return "move " + uci();
    }
}

package com.banchess.rules;

/**
 * 普通国际象棋着法（不含禁着语义）。
 * promotion 为 null 表示非升变。
 */
public record ChessMove(int from, int to, PieceType promotion) {

    public ChessMove {
        if (from < 0 || from > 63 || to < 0 || to > 63) {
            throw new IllegalArgumentException("square out of range");
        }
        if (promotion != null && !promotion.isPromotionTarget()) {
            throw new IllegalArgumentException("illegal promotion piece: " + promotion);
        }
    }

    public static ChessMove of(int from, int to) {
        return new ChessMove(from, to, null);
    }

    /** UCI 文本，例如 e2e4、e7e8q */
    public String uci() {
        String s = Square.name(from) + Square.name(to);
        return promotion == null ? s : s + promotion.fenChar();
    }

    public boolean sameSquares(int otherFrom, int otherTo) {
        return from == otherFrom && to == otherTo;
    }

    @Override
    public String toString() {
        return uci();
    }
}

package com.banchess.rules;

/**
 * 棋子类型，fenChar 为小写 FEN 字母。
 */
public enum PieceType {
    PAWN('p'),
    KNIGHT('n'),
    BISHOP('b'),
    ROOK('r'),
    QUEEN('q'),
    KING('k');

    private final char fenChar;

    PieceType(char fenChar) {
        this.fenChar = fenChar;
    }

    public char fenChar() {
        return fenChar;
    }

    /** 兵升变可选的目标类型 */
    public boolean isPromotionTarget() {
        return this == KNIGHT || this == BISHOP || this == ROOK || this == QUEEN;
    }

    public static PieceType fromFenChar(char c) {
        char lower = Character.toLowerCase(c);
        for (PieceType t : values()) {
            if (t.fenChar == lower) {
                return t;
            }
        }
        throw new IllegalArgumentException("unknown piece: " + c);
    }
}

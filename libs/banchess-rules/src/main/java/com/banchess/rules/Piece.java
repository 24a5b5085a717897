package com.banchess.rules;

/**
 * 棋盘上的一个棋子（颜色 + 类型）。
 */
public record Piece(Color color, PieceType type) {

    public char fenChar() {
        char c = type.fenChar();
        return color == Color.WHITE ? Character.toUpperCase(c) : c;
    }

    public static Piece fromFenChar(char c) {
        Color color = Character.isUpperCase(c) ? Color.WHITE : Color.BLACK;
        return new Piece(color, PieceType.fromFenChar(c));
    }
}

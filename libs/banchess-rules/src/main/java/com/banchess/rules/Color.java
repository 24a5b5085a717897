package com.banchess.rules;

/**
 * 棋子颜色 / 座位。
 * wire 上统一使用小写名称（"white" / "black"）。
 */
public enum Color {
    WHITE("white", 'w'),
    BLACK("black", 'b');

    private final String wireName;
    private final char fenChar;

    Color(String wireName, char fenChar) {
        this.wireName = wireName;
        this.fenChar = fenChar;
    }

    public String wireName() {
        return wireName;
    }

    public char fenChar() {
        return fenChar;
    }

    public Color opposite() {
        return this == WHITE ? BLACK : WHITE;
    }

    /** 兵前进方向：白方向上（+1 rank），黑方向下 */
    int pawnDirection() {
        return this == WHITE ? 1 : -1;
    }

    public static Color fromWire(String s) {
        if (s == null) {
            throw new IllegalArgumentException("color is null");
        }
        switch (s.trim().toLowerCase()) {
            case "white":
            case "w":
                return WHITE;
            case "black":
            case "b":
                return BLACK;
            default:
                throw new IllegalArgumentException("unknown color: " + s);
        }
    }
}

package com.banchess.rules;

/**
 * 格子坐标工具。
 * 索引布局：a1=0, b1=1 ... h1=7, a2=8 ... h8=63。
 */
public final class Square {

    public static final int NONE = -1;

    private Square() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static int of(int file, int rank) {
        return rank * 8 + file;
    }

    public static int file(int square) {
        return square & 7;
    }

    public static int rank(int square) {
        return square >> 3;
    }

    public static boolean onBoard(int file, int rank) {
        return file >= 0 && file < 8 && rank >= 0 && rank < 8;
    }

    /** 浅色格判断（a1 为深色） */
    public static boolean isLight(int square) {
        return ((file(square) + rank(square)) & 1) == 1;
    }

    /**
     * 解析代数坐标，如 "e4"。
     * @throws IllegalArgumentException 格式不合法
     */
    public static int parse(String name) {
        if (name == null || name.length() != 2) {
            throw new IllegalArgumentException("bad square: " + name);
        }
        int file = Character.toLowerCase(name.charAt(0)) - 'a';
        int rank = name.charAt(1) - '1';
        if (!onBoard(file, rank)) {
            throw new IllegalArgumentException("bad square: " + name);
        }
        return of(file, rank);
    }

    public static String name(int square) {
        if (square < 0 || square > 63) {
            throw new IllegalArgumentException("bad square index: " + square);
        }
        return "" + (char) ('a' + file(square)) + (char) ('1' + rank(square));
    }
}

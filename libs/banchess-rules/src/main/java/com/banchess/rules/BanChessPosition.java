package com.banchess.rules;

/**
 * Ban Chess 局面 = 国际象棋局面 + 当前阶段 + 当前生效的禁着。
 * <p>
 * 阶段为 BAN 时，由“非轮走方”对轮走方的着法进行禁着；
 * 阶段为 MOVE 时，轮走方在排除禁着后走子。
 *
 * @param board       棋盘（轮走方即下一步走子方）
 * @param phase       当前阶段
 * @param bannedMove  MOVE 阶段下生效的禁着；BAN 阶段恒为 null
 */
public record BanChessPosition(Board board, ActionType phase, BanAction bannedMove) {

    public BanChessPosition {
        if (board == null || phase == null) {
            throw new IllegalArgumentException("board and phase are required");
        }
        if (phase == ActionType.BAN && bannedMove != null) {
            throw new IllegalArgumentException("ban phase cannot carry a banned move");
        }
    }

    /** 初始局面：标准开局，黑方先禁着 */
    public static BanChessPosition initial() {
        return new BanChessPosition(Board.initial(), ActionType.BAN, null);
    }

    /** 从一个普通 FEN 构造处于 BAN 阶段的局面（测试、残局研究用） */
    public static BanChessPosition fromFen(String fen) {
        return new BanChessPosition(Board.fromFen(fen), ActionType.BAN, null);
    }

    /** 当前应行动的一方 */
    public Color actor() {
        return phase == ActionType.BAN ? board.sideToMove().opposite() : board.sideToMove();
    }

    public String fen() {
        return board.toFen();
    }
}

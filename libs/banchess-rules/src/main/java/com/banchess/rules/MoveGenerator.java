package com.banchess.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * 标准国际象棋合法着法生成。
 * 先生成伪合法着法，再逐一试走并排除走后己方王被将军的着法。
 */
public final class MoveGenerator {

    private static final int[][] KNIGHT_DELTAS = {
            {1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}
    };
    private static final int[][] KING_DELTAS = {
            {1, 0}, {1, 1}, {0, 1}, {-1, 1}, {-1, 0}, {-1, -1}, {0, -1}, {1, -1}
    };
    private static final int[][] ROOK_DIRS = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};
    private static final int[][] BISHOP_DIRS = {{1, 1}, {1, -1}, {-1, 1}, {-1, -1}};
    private static final PieceType[] PROMOTIONS = {
            PieceType.QUEEN, PieceType.ROOK, PieceType.BISHOP, PieceType.KNIGHT
    };

    private MoveGenerator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 轮走方的全部合法着法。
     */
    public static List<ChessMove> legalMoves(Board board) {
        Color us = board.sideToMove();
        List<ChessMove> pseudo = pseudoLegalMoves(board);
        List<ChessMove> legal = new ArrayList<>(pseudo.size());
        for (ChessMove m : pseudo) {
            Board after = board.play(m);
            int king = after.kingSquare(us);
            if (king == Square.NONE || !isAttacked(after, king, us.opposite())) {
                legal.add(m);
            }
        }
        return legal;
    }

    /** 指定颜色的王当前是否被将军 */
    public static boolean inCheck(Board board, Color color) {
        int king = board.kingSquare(color);
        return king != Square.NONE && isAttacked(board, king, color.opposite());
    }

    /**
     * 判断 square 是否被 by 方攻击。
     */
    public static boolean isAttacked(Board board, int square, Color by) {
        int file = Square.file(square);
        int rank = Square.rank(square);

        // 兵：攻击方的兵位于目标格“身后”斜对角
        int pawnRank = rank - by.pawnDirection();
        for (int df = -1; df <= 1; df += 2) {
            if (pieceIs(board, file + df, pawnRank, by, PieceType.PAWN)) {
                return true;
            }
        }
        for (int[] d : KNIGHT_DELTAS) {
            if (pieceIs(board, file + d[0], rank + d[1], by, PieceType.KNIGHT)) {
                return true;
            }
        }
        for (int[] d : KING_DELTAS) {
            if (pieceIs(board, file + d[0], rank + d[1], by, PieceType.KING)) {
                return true;
            }
        }
        return rayHits(board, file, rank, by, ROOK_DIRS, PieceType.ROOK)
                || rayHits(board, file, rank, by, BISHOP_DIRS, PieceType.BISHOP);
    }

    private static boolean rayHits(Board board, int file, int rank, Color by, int[][] dirs, PieceType slider) {
        for (int[] d : dirs) {
            int f = file + d[0];
            int r = rank + d[1];
            while (Square.onBoard(f, r)) {
                Piece p = board.pieceAt(Square.of(f, r));
                if (p != null) {
                    if (p.color() == by && (p.type() == slider || p.type() == PieceType.QUEEN)) {
                        return true;
                    }
                    break;
                }
                f += d[0];
                r += d[1];
            }
        }
        return false;
    }

    private static boolean pieceIs(Board board, int file, int rank, Color color, PieceType type) {
        if (!Square.onBoard(file, rank)) {
            return false;
        }
        Piece p = board.pieceAt(Square.of(file, rank));
        return p != null && p.color() == color && p.type() == type;
    }

    // ---------------------------------------------------------------- 伪合法着法

    static List<ChessMove> pseudoLegalMoves(Board board) {
        List<ChessMove> out = new ArrayList<>(48);
        Color us = board.sideToMove();
        for (int sq = 0; sq < 64; sq++) {
            Piece p = board.pieceAt(sq);
            if (p == null || p.color() != us) {
                continue;
            }
            switch (p.type()) {
                case PAWN:
                    pawnMoves(board, sq, us, out);
                    break;
                case KNIGHT:
                    stepMoves(board, sq, us, KNIGHT_DELTAS, out);
                    break;
                case BISHOP:
                    slideMoves(board, sq, us, BISHOP_DIRS, out);
                    break;
                case ROOK:
                    slideMoves(board, sq, us, ROOK_DIRS, out);
                    break;
                case QUEEN:
                    slideMoves(board, sq, us, ROOK_DIRS, out);
                    slideMoves(board, sq, us, BISHOP_DIRS, out);
                    break;
                case KING:
                    stepMoves(board, sq, us, KING_DELTAS, out);
                    castlingMoves(board, sq, us, out);
                    break;
                default:
                    break;
            }
        }
        return out;
    }

    private static void pawnMoves(Board board, int from, Color us, List<ChessMove> out) {
        int dir = us.pawnDirection();
        int file = Square.file(from);
        int rank = Square.rank(from);
        int startRank = us == Color.WHITE ? 1 : 6;
        int lastRank = us == Color.WHITE ? 7 : 0;

        int oneRank = rank + dir;
        if (!Square.onBoard(file, oneRank)) {
            return;
        }
        int one = Square.of(file, oneRank);
        if (board.pieceAt(one) == null) {
            addPawnMove(from, one, oneRank == lastRank, out);
            if (rank == startRank) {
                int two = Square.of(file, rank + 2 * dir);
                if (board.pieceAt(two) == null) {
                    out.add(ChessMove.of(from, two));
                }
            }
        }
        for (int df = -1; df <= 1; df += 2) {
            int f = file + df;
            if (!Square.onBoard(f, oneRank)) {
                continue;
            }
            int target = Square.of(f, oneRank);
            Piece victim = board.pieceAt(target);
            if (victim != null && victim.color() != us) {
                addPawnMove(from, target, oneRank == lastRank, out);
            } else if (victim == null && target == board.epSquare()) {
                out.add(ChessMove.of(from, target));
            }
        }
    }

    private static void addPawnMove(int from, int to, boolean promotes, List<ChessMove> out) {
        if (!promotes) {
            out.add(ChessMove.of(from, to));
            return;
        }
        for (PieceType t : PROMOTIONS) {
            out.add(new ChessMove(from, to, t));
        }
    }

    private static void stepMoves(Board board, int from, Color us, int[][] deltas, List<ChessMove> out) {
        int file = Square.file(from);
        int rank = Square.rank(from);
        for (int[] d : deltas) {
            int f = file + d[0];
            int r = rank + d[1];
            if (!Square.onBoard(f, r)) {
                continue;
            }
            int to = Square.of(f, r);
            Piece p = board.pieceAt(to);
            if (p == null || p.color() != us) {
                out.add(ChessMove.of(from, to));
            }
        }
    }

    private static void slideMoves(Board board, int from, Color us, int[][] dirs, List<ChessMove> out) {
        int file = Square.file(from);
        int rank = Square.rank(from);
        for (int[] d : dirs) {
            int f = file + d[0];
            int r = rank + d[1];
            while (Square.onBoard(f, r)) {
                int to = Square.of(f, r);
                Piece p = board.pieceAt(to);
                if (p == null) {
                    out.add(ChessMove.of(from, to));
                } else {
                    if (p.color() != us) {
                        out.add(ChessMove.of(from, to));
                    }
                    break;
                }
                f += d[0];
                r += d[1];
            }
        }
    }

    // 易位：王未受将、经过格与落点不受攻击、中间格为空、车在原位
    private static void castlingMoves(Board board, int from, Color us, List<ChessMove> out) {
        int homeRank = us == Color.WHITE ? 0 : 7;
        if (from != Square.of(4, homeRank)) {
            return;
        }
        Color them = us.opposite();
        int kingSideFlag = us == Color.WHITE ? Board.WHITE_KING_SIDE : Board.BLACK_KING_SIDE;
        int queenSideFlag = us == Color.WHITE ? Board.WHITE_QUEEN_SIDE : Board.BLACK_QUEEN_SIDE;
        boolean canKing = board.hasCastling(kingSideFlag) && rookAt(board, Square.of(7, homeRank), us);
        boolean canQueen = board.hasCastling(queenSideFlag) && rookAt(board, Square.of(0, homeRank), us);
        if (!canKing && !canQueen) {
            return;
        }
        if (isAttacked(board, from, them)) {
            return;
        }
        if (canKing
                && board.pieceAt(Square.of(5, homeRank)) == null
                && board.pieceAt(Square.of(6, homeRank)) == null
                && !isAttacked(board, Square.of(5, homeRank), them)
                && !isAttacked(board, Square.of(6, homeRank), them)) {
            out.add(ChessMove.of(from, Square.of(6, homeRank)));
        }
        if (canQueen
                && board.pieceAt(Square.of(3, homeRank)) == null
                && board.pieceAt(Square.of(2, homeRank)) == null
                && board.pieceAt(Square.of(1, homeRank)) == null
                && !isAttacked(board, Square.of(3, homeRank), them)
                && !isAttacked(board, Square.of(2, homeRank), them)) {
            out.add(ChessMove.of(from, Square.of(2, homeRank)));
        }
    }

    private static boolean rookAt(Board board, int square, Color color) {
        Piece p = board.pieceAt(square);
        return p != null && p.color() == color && p.type() == PieceType.ROOK;
    }
}

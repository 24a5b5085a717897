package com.banchess.rules;

import java.util.Arrays;

/**
 * 不可变的国际象棋局面。
 * ---------------------------------------
 * 包含：64 格棋子布局、轮走方、易位权、吃过路兵格、半回合计数、回合数。
 * 每次 {@link #play(ChessMove)} 都返回新的 Board，原对象保持不变。
 *
 * 本类不校验着法合法性，合法性由 {@link MoveGenerator} 负责。
 */
public final class Board {

    public static final String START_FEN = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    // 易位权位掩码
    static final int WHITE_KING_SIDE = 1;
    static final int WHITE_QUEEN_SIDE = 2;
    static final int BLACK_KING_SIDE = 4;
    static final int BLACK_QUEEN_SIDE = 8;

    private final Piece[] squares;
    private final Color sideToMove;
    private final int castling;
    private final int epSquare;
    private final int halfmoveClock;
    private final int fullmoveNumber;

    private Board(Piece[] squares, Color sideToMove, int castling, int epSquare,
                  int halfmoveClock, int fullmoveNumber) {
        this.squares = squares;
        this.sideToMove = sideToMove;
        this.castling = castling;
        this.epSquare = epSquare;
        this.halfmoveClock = halfmoveClock;
        this.fullmoveNumber = fullmoveNumber;
    }

    public static Board initial() {
        return fromFen(START_FEN);
    }

    public Piece pieceAt(int square) {
        return squares[square];
    }

    public Color sideToMove() {
        return sideToMove;
    }

    public int epSquare() {
        return epSquare;
    }

    public int halfmoveClock() {
        return halfmoveClock;
    }

    public int fullmoveNumber() {
        return fullmoveNumber;
    }

    boolean hasCastling(int flag) {
        return (castling & flag) != 0;
    }

    /** 查找指定颜色王所在格；不存在时返回 {@link Square#NONE} */
    public int kingSquare(Color color) {
        for (int sq = 0; sq < 64; sq++) {
            Piece p = squares[sq];
            if (p != null && p.type() == PieceType.KING && p.color() == color) {
                return sq;
            }
        }
        return Square.NONE;
    }

    /**
     * 执行一步着法（不做合法性校验），返回新局面。
     * 处理：吃过路兵、王车易位、升变、易位权与过路兵格更新、计数器。
     */
    public Board play(ChessMove move) {
        Piece moving = squares[move.from()];
        if (moving == null) {
            throw new IllegalArgumentException("no piece on " + Square.name(move.from()));
        }
        Piece[] next = Arrays.copyOf(squares, 64);
        Piece captured = next[move.to()];
        boolean pawnMove = moving.type() == PieceType.PAWN;

        // 吃过路兵：兵斜走到空的过路兵格
        if (pawnMove && move.to() == epSquare && captured == null
                && Square.file(move.from()) != Square.file(move.to())) {
            int victim = move.to() - 8 * moving.color().pawnDirection();
            captured = next[victim];
            next[victim] = null;
        }

        next[move.from()] = null;
        next[move.to()] = move.promotion() != null
                ? new Piece(moving.color(), move.promotion())
                : moving;

        // 王车易位：王横移两格，同时移动车
        if (moving.type() == PieceType.KING && Math.abs(move.to() - move.from()) == 2) {
            int rank = Square.rank(move.from());
            boolean kingSide = move.to() > move.from();
            int rookFrom = Square.of(kingSide ? 7 : 0, rank);
            int rookTo = Square.of(kingSide ? 5 : 3, rank);
            next[rookTo] = next[rookFrom];
            next[rookFrom] = null;
        }

        int nextCastling = castling;
        if (moving.type() == PieceType.KING) {
            nextCastling &= moving.color() == Color.WHITE
                    ? ~(WHITE_KING_SIDE | WHITE_QUEEN_SIDE)
                    : ~(BLACK_KING_SIDE | BLACK_QUEEN_SIDE);
        }
        nextCastling &= ~cornerRight(move.from());
        nextCastling &= ~cornerRight(move.to());

        int nextEp = Square.NONE;
        if (pawnMove && Math.abs(move.to() - move.from()) == 16) {
            nextEp = (move.from() + move.to()) / 2;
        }

        int nextHalfmove = (pawnMove || captured != null) ? 0 : halfmoveClock + 1;
        int nextFullmove = sideToMove == Color.BLACK ? fullmoveNumber + 1 : fullmoveNumber;

        return new Board(next, sideToMove.opposite(), nextCastling, nextEp, nextHalfmove, nextFullmove);
    }

    // 角格对应的易位权（车离开或被吃时失效）
    private static int cornerRight(int square) {
        switch (square) {
            case 0:
                return WHITE_QUEEN_SIDE;
            case 7:
                return WHITE_KING_SIDE;
            case 56:
                return BLACK_QUEEN_SIDE;
            case 63:
                return BLACK_KING_SIDE;
            default:
                return 0;
        }
    }

    // ---------------------------------------------------------------- FEN

    /**
     * 解析 FEN。半回合数与回合数缺省时分别按 0 / 1 处理。
     * @throws IllegalArgumentException FEN 不合法
     */
    public static Board fromFen(String fen) {
        if (fen == null || fen.isBlank()) {
            throw new IllegalArgumentException("fen is blank");
        }
        String[] parts = fen.trim().split("\\s+");
        if (parts.length < 4) {
            throw new IllegalArgumentException("fen needs at least 4 fields: " + fen);
        }
        Piece[] squares = new Piece[64];
        String[] ranks = parts[0].split("/");
        if (ranks.length != 8) {
            throw new IllegalArgumentException("fen needs 8 ranks: " + fen);
        }
        for (int i = 0; i < 8; i++) {
            int rank = 7 - i;
            int file = 0;
            for (char c : ranks[i].toCharArray()) {
                if (Character.isDigit(c)) {
                    file += c - '0';
                } else {
                    if (file > 7) {
                        throw new IllegalArgumentException("rank overflow in fen: " + fen);
                    }
                    squares[Square.of(file, rank)] = Piece.fromFenChar(c);
                    file++;
                }
            }
            if (file != 8) {
                throw new IllegalArgumentException("rank " + (rank + 1) + " has " + file + " files: " + fen);
            }
        }
        Color side = Color.fromWire(parts[1]);

        int castling = 0;
        if (!"-".equals(parts[2])) {
            for (char c : parts[2].toCharArray()) {
                switch (c) {
                    case 'K':
                        castling |= WHITE_KING_SIDE;
                        break;
                    case 'Q':
                        castling |= WHITE_QUEEN_SIDE;
                        break;
                    case 'k':
                        castling |= BLACK_KING_SIDE;
                        break;
                    case 'q':
                        castling |= BLACK_QUEEN_SIDE;
                        break;
                    default:
                        throw new IllegalArgumentException("bad castling field: " + parts[2]);
                }
            }
        }
        int ep = "-".equals(parts[3]) ? Square.NONE : Square.parse(parts[3]);
        int halfmove = parts.length > 4 ? Integer.parseInt(parts[4]) : 0;
        int fullmove = parts.length > 5 ? Integer.parseInt(parts[5]) : 1;
        return new Board(squares, side, castling, ep, halfmove, fullmove);
    }

    public String toFen() {
        StringBuilder sb = new StringBuilder(90);
        for (int rank = 7; rank >= 0; rank--) {
            int empty = 0;
            for (int file = 0; file < 8; file++) {
                Piece p = squares[Square.of(file, rank)];
                if (p == null) {
                    empty++;
                    continue;
                }
                if (empty > 0) {
                    sb.append(empty);
                    empty = 0;
                }
                sb.append(p.fenChar());
            }
            if (empty > 0) {
                sb.append(empty);
            }
            if (rank > 0) {
                sb.append('/');
            }
        }
        sb.append(' ').append(sideToMove.fenChar()).append(' ');
        if (castling == 0) {
            sb.append('-');
        } else {
            if (hasCastling(WHITE_KING_SIDE)) sb.append('K');
            if (hasCastling(WHITE_QUEEN_SIDE)) sb.append('Q');
            if (hasCastling(BLACK_KING_SIDE)) sb.append('k');
            if (hasCastling(BLACK_QUEEN_SIDE)) sb.append('q');
        }
        sb.append(' ').append(epSquare == Square.NONE ? "-" : Square.name(epSquare));
        sb.append(' ').append(halfmoveClock).append(' ').append(fullmoveNumber);
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Board other)) return false;
        return castling == other.castling
                && epSquare == other.epSquare
                && halfmoveClock == other.halfmoveClock
                && fullmoveNumber == other.fullmoveNumber
                && sideToMove == other.sideToMove
                && Arrays.equals(squares, other.squares);
    }

    @Override
    public int hashCode() {
        int h = Arrays.hashCode(squares);
        h = 31 * h + sideToMove.hashCode();
        h = 31 * h + castling;
        h = 31 * h + epSquare;
        return h;
    }

    @Override
    public String toString() {
        return toFen();
    }
}

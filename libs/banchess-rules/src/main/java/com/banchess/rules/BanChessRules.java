package com.banchess.rules;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ban Chess 规则的默认实现。
 * ---------------------------------------
 * 回合顺序：黑禁 → 白走 → 白禁 → 黑走 → 黑禁 → …
 *
 * 终局判定：
 *  - 刚走完一步（BAN 阶段）：轮走方合法着法数 ≤ 1 时，对手必然禁掉唯一着法，
 *    被将军判将杀，否则判逼和；
 *  - 刚禁完一步（MOVE 阶段）：轮走方没有未被禁的合法着法，同上；
 *  - 子力不足（K 对 K、K+轻子 对 K、同色格象）判和。
 */
public class BanChessRules implements RulesEngine {

    @Override
    public List<Action> legalActions(BanChessPosition position) {
        if (evaluate(position).isTerminal()) {
            return List.of();
        }
        return candidateActions(position);
    }

    private List<Action> candidateActions(BanChessPosition position) {
        List<ChessMove> moves = MoveGenerator.legalMoves(position.board());
        if (position.phase() == ActionType.BAN) {
            // 升变的多个变体折叠成一个禁着
            Set<BanAction> bans = new LinkedHashSet<>();
            for (ChessMove m : moves) {
                bans.add(new BanAction(m.from(), m.to()));
            }
            return new ArrayList<>(bans);
        }
        BanAction banned = position.bannedMove();
        List<Action> out = new ArrayList<>(moves.size());
        for (ChessMove m : moves) {
            if (banned == null || !banned.matches(m)) {
                out.add(MoveAction.of(m));
            }
        }
        return out;
    }

    @Override
    public BanChessPosition apply(BanChessPosition position, Action action) {
        if (action == null) {
            throw new IllegalActionException(IllegalActionException.Reason.ILLEGAL, "action is null");
        }
        if (action.type() != position.phase()) {
            throw new IllegalActionException(IllegalActionException.Reason.WRONG_PHASE,
                    "expected " + position.phase().wireName() + " but got " + action.type().wireName());
        }
        if (evaluate(position).isTerminal()) {
            throw new IllegalActionException(IllegalActionException.Reason.GAME_OVER, "game is over");
        }
        if (action instanceof BanAction ban) {
            List<ChessMove> moves = MoveGenerator.legalMoves(position.board());
            boolean found = false;
            for (ChessMove m : moves) {
                if (ban.matches(m)) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                throw new IllegalActionException(IllegalActionException.Reason.ILLEGAL,
                        "ban " + ban.uci() + " is not a legal move of the opponent");
            }
            return new BanChessPosition(position.board(), ActionType.MOVE, ban);
        }

        MoveAction move = (MoveAction) action;
        BanAction banned = position.bannedMove();
        if (banned != null && banned.from() == move.from() && banned.to() == move.to()) {
            throw new IllegalActionException(IllegalActionException.Reason.BANNED,
                    "move " + move.uci() + " is banned");
        }
        ChessMove chessMove = move.toChessMove();
        if (!MoveGenerator.legalMoves(position.board()).contains(chessMove)) {
            throw new IllegalActionException(IllegalActionException.Reason.ILLEGAL,
                    "move " + move.uci() + " is not legal");
        }
        return new BanChessPosition(position.board().play(chessMove), ActionType.BAN, null);
    }

    @Override
    public GameOutcome evaluate(BanChessPosition position) {
        Board board = position.board();
        Color toMove = board.sideToMove();
        int available;
        if (position.phase() == ActionType.BAN) {
            // 刚走完一步：只剩一个可禁的 from/to 时一定会被禁掉（升变的四个变体算一个）
            available = distinctBans(MoveGenerator.legalMoves(board)) <= 1 ? 0 : 1;
        } else {
            available = candidateActions(position).isEmpty() ? 0 : 1;
        }
        if (available == 0) {
            if (MoveGenerator.inCheck(board, toMove)) {
                return GameOutcome.checkmate(toMove.opposite());
            }
            return GameOutcome.draw(GameOutcome.Termination.STALEMATE);
        }
        if (insufficientMaterial(board)) {
            return GameOutcome.draw(GameOutcome.Termination.INSUFFICIENT_MATERIAL);
        }
        return GameOutcome.ONGOING;
    }

    private static int distinctBans(List<ChessMove> moves) {
        Set<BanAction> bans = new LinkedHashSet<>();
        for (ChessMove m : moves) {
            bans.add(new BanAction(m.from(), m.to()));
            if (bans.size() > 1) {
                break;
            }
        }
        return bans.size();
    }

    @Override
    public boolean inCheck(BanChessPosition position) {
        Board board = position.board();
        return MoveGenerator.inCheck(board, board.sideToMove());
    }

    /**
     * 子力不足：无兵、无车、无后，且
     * 轻子总数 ≤ 1，或者剩余轻子全部是同色格的象。
     */
    static boolean insufficientMaterial(Board board) {
        int minors = 0;
        int knights = 0;
        int lightBishops = 0;
        int darkBishops = 0;
        for (int sq = 0; sq < 64; sq++) {
            Piece p = board.pieceAt(sq);
            if (p == null) {
                continue;
            }
            switch (p.type()) {
                case PAWN:
                case ROOK:
                case QUEEN:
                    return false;
                case KNIGHT:
                    knights++;
                    minors++;
                    break;
                case BISHOP:
                    minors++;
                    if (Square.isLight(sq)) {
                        lightBishops++;
                    } else {
                        darkBishops++;
                    }
                    break;
                default:
                    break;
            }
        }
        if (minors <= 1) {
            return true;
        }
        return knights == 0 && (lightBishops == 0 || darkBishops == 0);
    }
}

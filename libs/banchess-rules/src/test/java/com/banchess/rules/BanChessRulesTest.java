package com.banchess.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BanChessRulesTest {

    private BanChessRules rules;

    @BeforeEach
    void setUp() {
        rules = new BanChessRules();
    }

    @Test
    void initial_blackBansFirstAmongWhiteMoves() {
        BanChessPosition start = BanChessPosition.initial();
        assertEquals(ActionType.BAN, start.phase());
        assertEquals(Color.BLACK, start.actor());
        List<Action> actions = rules.legalActions(start);
        assertEquals(20, actions.size());
        assertTrue(actions.stream().allMatch(a -> a instanceof BanAction));
    }

    @Test
    void ban_removesMoveForNextTurnOnly() {
        BanChessPosition afterBan = rules.apply(BanChessPosition.initial(), Action.ban("e2", "e4"));
        assertEquals(ActionType.MOVE, afterBan.phase());
        assertEquals(Color.WHITE, afterBan.actor());
        assertEquals(19, rules.legalActions(afterBan).size());

        IllegalActionException ex = assertThrows(IllegalActionException.class,
                () -> rules.apply(afterBan, Action.move("e2", "e4")));
        assertEquals(IllegalActionException.Reason.BANNED, ex.getReason());

        BanChessPosition afterMove = rules.apply(afterBan, Action.move("d2", "d4"));
        assertEquals(ActionType.BAN, afterMove.phase());
        assertEquals(Color.WHITE, afterMove.actor());
        assertNull(afterMove.bannedMove());
    }

    @Test
    void apply_rejectsWrongPhaseAndIllegalActions() {
        BanChessPosition start = BanChessPosition.initial();
        IllegalActionException phase = assertThrows(IllegalActionException.class,
                () -> rules.apply(start, Action.move("e2", "e4")));
        assertEquals(IllegalActionException.Reason.WRONG_PHASE, phase.getReason());

        IllegalActionException illegal = assertThrows(IllegalActionException.class,
                () -> rules.apply(start, Action.ban("e2", "e5")));
        assertEquals(IllegalActionException.Reason.ILLEGAL, illegal.getReason());
    }

    @Test
    void promotionBans_collapseToSingleBan() {
        BanChessPosition pos = BanChessPosition.fromFen("7k/P7/8/8/8/8/8/4K3 w - - 0 1");
        List<Action> bans = rules.legalActions(pos);
        assertEquals(6, bans.size());
        assertEquals(9, MoveGenerator.legalMoves(pos.board()).size());

        BanChessPosition banned = rules.apply(pos, Action.ban("a7", "a8"));
        List<Action> moves = rules.legalActions(banned);
        assertEquals(5, moves.size());
        assertTrue(moves.stream().noneMatch(a -> a.uci().startsWith("a7a8")));
    }

    @Test
    void checkmatingMove_isTerminalImmediately() {
        BanChessPosition pos = BanChessPosition.fromFen("7k/6pp/8/8/8/8/8/R5K1 w - - 0 1");
        pos = rules.apply(pos, Action.ban("g1", "f1"));
        pos = rules.apply(pos, Action.move("a1", "a8"));

        GameOutcome outcome = rules.evaluate(pos);
        assertEquals(GameOutcome.Termination.CHECKMATE, outcome.termination());
        assertEquals(Color.WHITE, outcome.winner());
        assertTrue(rules.legalActions(pos).isEmpty());
        BanChessPosition finalPos = pos;
        IllegalActionException ex = assertThrows(IllegalActionException.class,
                () -> rules.apply(finalPos, Action.ban("h8", "g8")));
        assertEquals(IllegalActionException.Reason.GAME_OVER, ex.getReason());
    }

    @Test
    void checkWithSingleEscape_isCheckmateBecauseEscapeGetsBanned() {
        BanChessPosition pos = BanChessPosition.fromFen("7k/7p/8/8/8/8/8/R5K1 w - - 0 1");
        pos = rules.apply(pos, Action.ban("g1", "f1"));
        pos = rules.apply(pos, Action.move("a1", "a8"));

        assertTrue(rules.inCheck(pos));
        assertEquals(1, MoveGenerator.legalMoves(pos.board()).size());
        assertEquals(GameOutcome.checkmate(Color.WHITE), rules.evaluate(pos));
    }

    @Test
    void checkWithOnlyPromotionEscape_isCheckmateOnTheMove() {
        BanChessPosition pos = BanChessPosition.fromFen("8/8/8/8/8/1K6/1p5R/k7 w - - 0 1");
        pos = rules.apply(pos, Action.ban("b3", "c3"));
        pos = rules.apply(pos, Action.move("h2", "h1"));

        assertTrue(rules.inCheck(pos));
        assertEquals(4, MoveGenerator.legalMoves(pos.board()).size());
        assertEquals(GameOutcome.checkmate(Color.WHITE), rules.evaluate(pos));
        assertTrue(rules.legalActions(pos).isEmpty());
    }

    @Test
    void onlyPromotionLeft_withoutCheck_isStalemate() {
        BanChessPosition pos = BanChessPosition.fromFen("8/8/8/8/8/1K6/1p6/k6R b - - 0 1");
        assertEquals(GameOutcome.checkmate(Color.WHITE), rules.evaluate(pos));

        BanChessPosition quiet = BanChessPosition.fromFen("8/8/8/8/8/K7/1p1N4/k7 b - - 0 1");
        assertFalse(rules.inCheck(quiet));
        assertEquals(GameOutcome.Termination.STALEMATE, rules.evaluate(quiet).termination());
    }

    @Test
    void noMovesWithoutCheck_isStalemate() {
        BanChessPosition pos = BanChessPosition.fromFen("k7/2K5/8/8/8/8/8/1Q6 w - - 0 1");
        pos = rules.apply(pos, Action.ban("c7", "d6"));
        pos = rules.apply(pos, Action.move("b1", "b6"));

        GameOutcome outcome = rules.evaluate(pos);
        assertEquals(GameOutcome.Termination.STALEMATE, outcome.termination());
        assertNull(outcome.winner());
    }

    @Test
    void loneMinorPiece_isInsufficientMaterial() {
        BanChessPosition pos = BanChessPosition.fromFen("8/8/8/4k3/8/8/8/4K2N w - - 0 1");
        assertEquals(GameOutcome.Termination.INSUFFICIENT_MATERIAL, rules.evaluate(pos).termination());

        BanChessPosition withRook = BanChessPosition.fromFen("8/8/8/4k3/8/8/8/4K2R w - - 0 1");
        assertFalse(rules.evaluate(withRook).isTerminal());
    }

    @Test
    void replay_isDeterministic() {
        List<Action> game = Bcn.decodeAll(List.of(
                "b:e2e4", "m:d2d4", "b:d7d5", "m:e7e5", "b:d4e5", "m:g1f3", "b:e5d4", "m:b8c6"));
        BanChessPosition first = rules.replay(game);
        BanChessPosition second = rules.replay(game);
        assertEquals(first, second);
        assertEquals(first.fen(), second.fen());
        assertEquals(ActionType.BAN, first.phase());
        assertEquals(Color.BLACK, first.actor());
    }

    @Test
    void replay_failsOnIllegalHistory() {
        List<Action> broken = Bcn.decodeAll(List.of("b:e2e4", "m:e2e4"));
        assertThrows(IllegalActionException.class, () -> rules.replay(broken));
    }
}

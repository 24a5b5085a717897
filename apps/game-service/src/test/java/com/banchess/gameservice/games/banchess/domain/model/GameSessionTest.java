package com.banchess.gameservice.games.banchess.domain.model;

import com.banchess.gameservice.common.ErrorCode;
import com.banchess.gameservice.common.GameException;
import com.banchess.gameservice.games.banchess.domain.enums.GameMode;
import com.banchess.gameservice.games.banchess.domain.enums.SessionStatus;
import com.banchess.gameservice.games.banchess.domain.enums.TerminationReason;
import com.banchess.gameservice.support.MutableClock;
import com.banchess.rules.Action;
import com.banchess.rules.ActionType;
import com.banchess.rules.BanChessRules;
import com.banchess.rules.Bcn;
import com.banchess.rules.Color;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GameSessionTest {

    private static final Identity ALICE = new Identity("u-alice", "Alice");
    private static final Identity BOB = new Identity("u-bob", "Bob");

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000);
    }

    private GameSession online(TimeControl tc) {
        GameSession s = new GameSession("s-1", GameMode.ONLINE, ALICE, BOB, tc, new BanChessRules(), clock);
        s.activate();
        return s;
    }

    private GameSession solo() {
        GameSession s = new GameSession("s-solo", GameMode.SOLO, ALICE, ALICE, TimeControl.DEFAULT,
                new BanChessRules(), clock);
        s.activate();
        return s;
    }

    private static void play(GameSession s, String... bcn) {
        for (String token : bcn) {
            Color actor = s.position().actor();
            s.submitAction(actor, Bcn.decode(token));
        }
    }

    @Test
    void beforeActivate_actionsAreRejected() {
        GameSession s = new GameSession("s-1", GameMode.ONLINE, ALICE, BOB, null, new BanChessRules(), clock);
        GameException ex = assertThrows(GameException.class,
                () -> s.submitAction(Color.BLACK, Action.ban("e2", "e4")));
        assertEquals(ErrorCode.NOT_ACTIVE, ex.getCode());
        assertEquals(SessionStatus.WAITING, s.status());
    }

    @Test
    void activate_blackBansFirst() {
        GameSession s = online(null);
        SessionView view = s.view();
        assertEquals(SessionStatus.ACTIVE, view.status());
        assertEquals(ActionType.BAN, view.phase());
        assertEquals(Color.BLACK, view.actor());
        assertEquals(20, view.legalActions().size());

        GameException again = assertThrows(GameException.class, s::activate);
        assertEquals(ErrorCode.NOT_ACTIVE, again.getCode());
    }

    @Test
    void turnOrder_alternatesBanAndMove() {
        GameSession s = online(null);
        play(s, "b:e2e4", "m:d2d4", "b:e7e5", "m:d7d5");

        List<HistoryEntry> history = s.history();
        assertEquals(List.of("black", "white", "white", "black"),
                history.stream().map(HistoryEntry::color).toList());
        assertEquals(List.of("ban", "move", "ban", "move"),
                history.stream().map(HistoryEntry::type).toList());
        assertEquals(List.of(1, 2, 3, 4), history.stream().map(HistoryEntry::ply).toList());

        SessionView view = s.view();
        assertEquals(ActionType.BAN, view.phase());
        assertEquals(Color.BLACK, view.actor());
    }

    @Test
    void rejectedActions_leaveStateUntouched() {
        GameSession s = online(null);
        play(s, "b:e2e4");
        long revision = s.revision();
        String fen = s.view().fen();

        assertCode(ErrorCode.WRONG_ROLE, () -> s.submitAction(Color.BLACK, Action.move("e7", "e5")));
        assertCode(ErrorCode.WRONG_PHASE, () -> s.submitAction(Color.WHITE, Action.ban("e7", "e5")));
        assertCode(ErrorCode.ILLEGAL_ACTION, () -> s.submitAction(Color.WHITE, Action.move("e2", "e4")));
        assertCode(ErrorCode.ILLEGAL_ACTION, () -> s.submitAction(Color.WHITE, Action.move("e2", "e5")));
        assertCode(ErrorCode.PROTOCOL, () -> s.submitAction(Color.WHITE, null));

        assertEquals(revision, s.revision());
        assertEquals(fen, s.view().fen());
        assertEquals(1, s.history().size());
        assertEquals("e2e4", s.view().bannedMove());
    }

    @Test
    void checkmatingMove_finishesInSameTransition() {
        GameSession s = online(null);
        play(s, "b:a2a3", "m:f2f3", "b:a7a6", "m:e7e5", "b:a2a3", "m:g2g4", "b:a7a6", "m:d8h4");

        assertEquals(SessionStatus.FINISHED, s.status());
        assertEquals(Color.BLACK, s.result().winner());
        assertEquals(TerminationReason.CHECKMATE, s.result().reason());
        SessionView view = s.view();
        assertNull(view.actor());
        assertTrue(view.legalActions().isEmpty());
        assertTrue(view.inCheck());

        assertCode(ErrorCode.NOT_ACTIVE, () -> s.submitAction(Color.BLACK, Action.ban("a2", "a3")));
    }

    @Test
    void clock_incrementOnlyWhenActiveColorChanges() {
        GameSession s = online(new TimeControl(60, 2));

        clock.advance(3_000);
        play(s, "b:e2e4");           // 黑 → 白，黑方加秒
        clock.advance(1_000);
        play(s, "m:d2d4");           // 白 → 白，不加秒
        clock.advance(1_000);
        play(s, "b:e7e5");           // 白 → 黑，白方加秒

        ClockView view = s.view().clock();
        assertEquals(59_000, view.blackMs());
        assertEquals(60_000, view.whiteMs());
        assertEquals("black", view.active());
    }

    @Test
    void timeout_staleRevisionIsIgnored() {
        GameSession s = online(new TimeControl(60, 0));
        long armedAt = s.revision();
        play(s, "b:e2e4");

        assertFalse(s.timeout(Color.WHITE, armedAt));
        assertFalse(s.timeout(Color.BLACK, s.revision()));
        assertEquals(SessionStatus.ACTIVE, s.status());

        assertTrue(s.timeout(Color.WHITE, s.revision()));
        assertEquals(Color.BLACK, s.result().winner());
        assertEquals(TerminationReason.TIMEOUT, s.result().reason());
        assertFalse(s.timeout(Color.WHITE, s.revision()));
    }

    @Test
    void untimedSession_hasNoClockAndNoGiveTime() {
        GameSession s = online(null);
        assertNull(s.view().clock());
        assertFalse(s.timeout(Color.BLACK, s.revision()));
        assertCode(ErrorCode.UNSUPPORTED, () -> s.giveTime(Color.WHITE, 15));
    }

    @Test
    void drawAgreement_needsBothSides() {
        GameSession s = online(null);

        assertFalse(s.offerDraw(Color.WHITE));
        assertEquals(Color.WHITE, s.view().drawOfferFrom());
        List<GameEvent> events = s.drainNewEvents();
        assertEquals(1, events.size());
        assertEquals(GameEvent.DRAW_OFFERED, events.get(0).type());

        long revision = s.revision();
        assertFalse(s.offerDraw(Color.WHITE));
        assertEquals(revision, s.revision());

        assertTrue(s.offerDraw(Color.BLACK));
        assertEquals(SessionStatus.FINISHED, s.status());
        assertNull(s.result().winner());
        assertEquals(TerminationReason.DRAW_AGREEMENT, s.result().reason());
    }

    @Test
    void opponentMove_declinesPendingDrawOffer() {
        GameSession s = online(null);
        s.offerDraw(Color.BLACK);
        s.drainNewEvents();

        play(s, "b:e2e4");
        assertEquals(Color.BLACK, s.view().drawOfferFrom());

        play(s, "m:d2d4");
        assertNull(s.view().drawOfferFrom());
        List<GameEvent> events = s.drainNewEvents();
        assertEquals(1, events.size());
        assertEquals(GameEvent.DRAW_DECLINED, events.get(0).type());
        assertEquals("white", events.get(0).color());
    }

    @Test
    void events_keepOnlyRecentOnes() {
        GameSession s = online(null);
        for (int i = 0; i < 25; i++) {
            s.recordEvent(GameEvent.PLAYER_DISCONNECTED, Color.WHITE, "m" + i);
        }

        List<GameEvent> recent = s.view().events();
        assertEquals(10, recent.size());
        assertEquals("m15", recent.get(0).message());
        assertEquals("m24", recent.get(9).message());
        assertEquals(25, s.drainNewEvents().size());
    }

    @Test
    void giveTime_addsToOpponentWithinLimits() {
        GameSession s = online(new TimeControl(60, 0));

        assertCode(ErrorCode.PROTOCOL, () -> s.giveTime(Color.WHITE, 0));
        assertCode(ErrorCode.PROTOCOL, () -> s.giveTime(Color.WHITE, 301));

        s.giveTime(Color.WHITE, 15);
        assertEquals(75_000, s.view().clock().blackMs());
        assertEquals(60_000, s.view().clock().whiteMs());
        assertEquals(GameEvent.TIME_GIVEN, s.drainNewEvents().get(0).type());
    }

    @Test
    void soloSession_rejectsDrawAndGiveTime() {
        GameSession s = solo();
        assertCode(ErrorCode.UNSUPPORTED, () -> s.offerDraw(Color.WHITE));
        assertCode(ErrorCode.UNSUPPORTED, () -> s.giveTime(Color.WHITE, 15));
    }

    @Test
    void forfeit_onlineAwardsOpponentOnce() {
        GameSession s = online(null);
        assertTrue(s.forfeit(Color.WHITE));
        assertEquals(Color.BLACK, s.result().winner());
        assertEquals(TerminationReason.TIMEOUT_FORFEIT, s.result().reason());
        long revision = s.revision();

        assertFalse(s.forfeit(Color.WHITE));
        assertEquals(revision, s.revision());
    }

    @Test
    void forfeit_soloIsAbandonmentWithoutWinner() {
        GameSession s = solo();
        assertTrue(s.forfeit(Color.WHITE));
        assertNull(s.result().winner());
        assertEquals(TerminationReason.ABANDONMENT, s.result().reason());
    }

    @Test
    void resign_awardsOpponent() {
        GameSession s = online(null);
        s.resign(Color.BLACK);
        assertEquals(Color.WHITE, s.result().winner());
        assertEquals(TerminationReason.RESIGNATION, s.result().reason());
        assertCode(ErrorCode.NOT_ACTIVE, () -> s.resign(Color.WHITE));
    }

    @Test
    void abort_finishesWithError() {
        GameSession s = online(null);
        s.abort();
        assertEquals(TerminationReason.ERROR, s.result().reason());
        assertNull(s.result().winner());
    }

    @Test
    void restore_replaysHistoryAndClock() {
        GameSession s = new GameSession("s-1", GameMode.ONLINE, ALICE, BOB, new TimeControl(60, 0),
                new BanChessRules(), clock);
        s.restore(Bcn.decodeAll(List.of("b:e2e4", "m:d2d4")), List.of(2_000L, 3_000L), 500L, 55_000L, 58_000L);

        assertEquals(SessionStatus.ACTIVE, s.status());
        assertEquals(2, s.history().size());
        assertEquals(2_500L, s.history().get(0).timestamp());
        SessionView view = s.view();
        assertEquals(Color.WHITE, view.actor());
        assertEquals(ActionType.BAN, view.phase());
        assertEquals(55_000, view.clock().whiteMs());
        assertEquals(58_000, view.clock().blackMs());
    }

    private static void assertCode(ErrorCode expected, org.junit.jupiter.api.function.Executable call) {
        GameException ex = assertThrows(GameException.class, call);
        assertEquals(expected, ex.getCode());
    }
}

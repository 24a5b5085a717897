package com.banchess.gameservice.games.banchess.application;

import com.banchess.gameservice.common.ErrorCode;
import com.banchess.gameservice.common.GameException;
import com.banchess.gameservice.games.banchess.domain.dto.GameRecord;
import com.banchess.gameservice.games.banchess.domain.enums.GameMode;
import com.banchess.gameservice.games.banchess.domain.enums.SessionStatus;
import com.banchess.gameservice.games.banchess.domain.model.Identity;
import com.banchess.gameservice.games.banchess.domain.model.SessionView;
import com.banchess.gameservice.games.banchess.domain.model.TimeControl;
import com.banchess.gameservice.support.TestEngine;
import com.banchess.gameservice.support.Waits;
import com.banchess.rules.ActionType;
import com.banchess.rules.Color;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionRegistryTest {

    private static final Identity ALICE = new Identity("u-alice", "Alice");
    private static final Identity BOB = new Identity("u-bob", "Bob");

    private TestEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    @Test
    void soloSession_isActivatedOnCreate() throws Exception {
        engine = new TestEngine();
        LiveSession live = engine.registry.create(ALICE, ALICE, GameMode.SOLO, null);

        SessionView view = live.republish().get(2, TimeUnit.SECONDS);

        assertEquals(SessionStatus.ACTIVE, view.status());
        assertEquals(Color.BLACK, view.actor());
        assertEquals(ActionType.BAN, view.phase());
        assertNull(view.clock());
    }

    @Test
    void onlineSession_waitsForActivation() throws Exception {
        engine = new TestEngine();
        LiveSession live = engine.registry.create(ALICE, BOB, GameMode.ONLINE, TimeControl.DEFAULT);

        assertEquals(SessionStatus.WAITING, live.view().status());
        verify(engine.repository, never()).saveCheckpoint(any());

        SessionView active = engine.registry.activate(live.id()).get(2, TimeUnit.SECONDS);
        assertEquals(SessionStatus.ACTIVE, active.status());
        assertEquals(300_000L, active.clock().blackMs(), 1_000L);
        verify(engine.repository).saveCheckpoint(argThat(r -> live.id().equals(r.getSessionId())));
    }

    @Test
    void unknownSession_isNotFound() {
        engine = new TestEngine();
        GameException ex = assertThrows(GameException.class, () -> engine.registry.require("missing"));
        assertEquals(ErrorCode.SESSION_NOT_FOUND, ex.getCode());
        assertTrue(engine.registry.get(null).isEmpty());
    }

    @Test
    void finishedSession_isArchivedOnceAndRemovedAfterGrace() throws Exception {
        engine = new TestEngine(p -> p.getSession().setRetireGrace(Duration.ofMillis(100)));
        LiveSession live = engine.registry.create(ALICE, BOB, GameMode.ONLINE, null);
        engine.registry.activate(live.id()).get(2, TimeUnit.SECONDS);

        live.submit(s -> {
            s.resign(Color.BLACK);
            return null;
        }).get(2, TimeUnit.SECONDS);
        engine.registry.retire(live.id());

        verify(engine.repository, times(1)).saveFinished(argThat(r ->
                "white".equals(r.getWinner()) && "resignation".equals(r.getReason())));
        verify(engine.repository).deleteCheckpoint(live.id());
        assertTrue(engine.registry.findOngoingFor(ALICE.userId()).isEmpty());
        Waits.until(() -> engine.registry.get(live.id()).isEmpty(), "session removed");
    }

    @Test
    void findOngoingFor_prefersOnlineSession() throws Exception {
        engine = new TestEngine();
        LiveSession solo = engine.registry.create(ALICE, ALICE, GameMode.SOLO, null);
        assertEquals(solo.id(), engine.registry.findOngoingFor(ALICE.userId()).orElseThrow().id());

        LiveSession online = engine.registry.create(ALICE, BOB, GameMode.ONLINE, null);

        assertEquals(online.id(), engine.registry.findOngoingFor(ALICE.userId()).orElseThrow().id());
        assertEquals(online.id(), engine.registry.findOngoingFor(BOB.userId()).orElseThrow().id());
        assertTrue(engine.registry.findOngoingFor("nobody").isEmpty());
    }

    @Test
    void listActive_excludesFinishedSessions() throws Exception {
        engine = new TestEngine();
        LiveSession first = engine.registry.create(ALICE, BOB, GameMode.ONLINE, null);
        engine.registry.activate(first.id()).get(2, TimeUnit.SECONDS);
        LiveSession second = engine.registry.create(BOB, BOB, GameMode.SOLO, null);
        second.submit(s -> {
            s.resign(Color.WHITE);
            return null;
        }).get(2, TimeUnit.SECONDS);

        List<SessionView> active = engine.registry.listActive();

        assertEquals(1, active.size());
        assertEquals(first.id(), active.get(0).sessionId());
    }

    @Test
    void restore_replaysCheckpoint() throws Exception {
        engine = new TestEngine();
        GameRecord rec = checkpoint("restored-1", List.of("b:e2e4", "m:d2d4"));
        when(engine.repository.findCheckpoint("restored-1")).thenReturn(Optional.of(rec));

        LiveSession live = engine.registry.findOrRestore("restored-1").orElseThrow();
        SessionView view = live.republish().get(2, TimeUnit.SECONDS);

        assertEquals(SessionStatus.ACTIVE, view.status());
        assertEquals(2, view.history().size());
        assertEquals(Color.WHITE, view.actor());
        assertEquals(ActionType.BAN, view.phase());
        assertEquals(250_000L, view.clock().blackMs());
        assertTrue(view.clock().whiteMs() <= 200_000L);
        assertEquals("Alice", view.white().displayName());
        assertSame(live, engine.registry.findOrRestore("restored-1").orElseThrow());
        assertEquals("restored-1", engine.registry.findOngoingFor(BOB.userId()).orElseThrow().id());
    }

    @Test
    void restore_ignoresCheckpointThatDoesNotReplay() {
        engine = new TestEngine();
        when(engine.repository.findCheckpoint("broken"))
                .thenReturn(Optional.of(checkpoint("broken", List.of("m:e2e4"))));

        assertTrue(engine.registry.findOrRestore("broken").isEmpty());
        assertTrue(engine.registry.get("broken").isEmpty());
    }

    @Test
    void restore_survivesRepositoryFailure() {
        engine = new TestEngine();
        when(engine.repository.findCheckpoint("any")).thenThrow(new IllegalStateException("redis down"));

        assertTrue(engine.registry.restore("any").isEmpty());
    }

    @Test
    void checkpointFailure_doesNotStopTheGame() throws Exception {
        engine = new TestEngine();
        doThrow(new IllegalStateException("redis down"))
                .when(engine.repository).saveCheckpoint(any());
        LiveSession live = engine.registry.create(ALICE, BOB, GameMode.ONLINE, null);

        SessionView view = engine.registry.activate(live.id()).get(2, TimeUnit.SECONDS);

        assertEquals(SessionStatus.ACTIVE, view.status());
        verify(engine.repository, timeout(1000)).saveCheckpoint(any());
    }

    private static GameRecord checkpoint(String id, List<String> bcn) {
        GameRecord rec = new GameRecord();
        rec.setSessionId(id);
        rec.setMode("online");
        rec.setStatus("active");
        rec.setWhitePlayerId(ALICE.userId());
        rec.setWhitePlayerName(ALICE.displayName());
        rec.setBlackPlayerId(BOB.userId());
        rec.setBlackPlayerName(BOB.displayName());
        rec.getBcn().addAll(bcn);
        for (int i = 0; i < bcn.size(); i++) {
            rec.getMoveTimes().add(1_000L);
        }
        rec.setTimeControl("300+0");
        rec.setWhiteRemainingMs(200_000L);
        rec.setBlackRemainingMs(250_000L);
        rec.setCreatedAt(1_000L);
        rec.setStartedAt(2_000L);
        return rec;
    }
}

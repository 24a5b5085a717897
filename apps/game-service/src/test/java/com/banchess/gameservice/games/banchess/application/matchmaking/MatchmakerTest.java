package com.banchess.gameservice.games.banchess.application.matchmaking;

import com.banchess.gameservice.common.ErrorCode;
import com.banchess.gameservice.common.GameException;
import com.banchess.gameservice.games.banchess.application.LiveSession;
import com.banchess.gameservice.games.banchess.domain.enums.GameMode;
import com.banchess.gameservice.games.banchess.domain.enums.SessionStatus;
import com.banchess.gameservice.games.banchess.domain.model.Identity;
import com.banchess.gameservice.games.banchess.domain.model.TimeControl;
import com.banchess.gameservice.support.MutableClock;
import com.banchess.gameservice.support.TestEngine;
import com.banchess.gameservice.support.Waits;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class MatchmakerTest {

    private static final MatchPreferences BLITZ = new MatchPreferences(new TimeControl(180, 2));
    private static final MatchPreferences RAPID = new MatchPreferences(new TimeControl(600, 0));

    private TestEngine engine;
    private MutableClock clock;
    private Matchmaker matchmaker;
    private final List<MatchResult> matches = new CopyOnWriteArrayList<>();
    private final List<Map<String, Integer>> positionUpdates = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        engine = new TestEngine();
        clock = new MutableClock(1_000_000L);
        matchmaker = new Matchmaker(engine.registry, engine.properties, clock);
        matchmaker.setListener(new MatchmakingListener() {
            @Override
            public void onMatched(MatchResult match) {
                matches.add(match);
            }

            @Override
            public void onQueuePositions(Map<String, Integer> positions) {
                positionUpdates.add(positions);
            }
        });
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static Identity user(String id) {
        return new Identity(id, id.toUpperCase());
    }

    @Test
    void emptiedPreferenceClasses_areDropped() {
        matchmaker.enqueue(user("a"), RAPID);
        matchmaker.enqueue(user("b"), BLITZ);
        assertEquals(2, matchmaker.preferenceClassCount());

        assertEquals(LeaveResult.LEFT, matchmaker.leave("a"));
        assertEquals(1, matchmaker.preferenceClassCount());

        assertTrue(matchmaker.enqueue(user("c"), BLITZ).isMatched());
        assertEquals(0, matchmaker.preferenceClassCount());

        assertEquals(1, matchmaker.enqueue(user("d"), RAPID).position());
        assertEquals(1, matchmaker.preferenceClassCount());
    }

    @Test
    void firstQueuedPlaysWhite() {
        assertEquals(1, matchmaker.enqueue(user("a"), BLITZ).position());

        EnqueueResult result = matchmaker.enqueue(user("b"), BLITZ);

        assertTrue(result.isMatched());
        MatchResult match = result.match();
        assertEquals("a", match.white().userId());
        assertEquals("b", match.black().userId());
        assertEquals("180+2", match.timeControl());
        assertEquals(List.of(match), matches);
        assertEquals(0, matchmaker.queuedCount());
        assertTrue(positionUpdates.isEmpty());

        LiveSession live = engine.registry.require(match.sessionId());
        assertEquals(GameMode.ONLINE, live.view().mode());
        Waits.until(() -> live.view().status() == SessionStatus.ACTIVE, "match activated");
    }

    @Test
    void oldestWaiterInClass_isPairedFirst() {
        matchmaker.enqueue(user("a"), RAPID);
        matchmaker.enqueue(user("b"), BLITZ);

        MatchResult match = matchmaker.enqueue(user("c"), RAPID).match();

        assertNotNull(match);
        assertEquals("a", match.white().userId());
        assertEquals("c", match.black().userId());
        assertEquals(1, matchmaker.positionOf("b").getAsInt());
        assertTrue(matchmaker.positionOf("a").isEmpty());
    }

    @Test
    void differentTimeControls_areNotPaired() {
        matchmaker.enqueue(user("a"), BLITZ);
        EnqueueResult result = matchmaker.enqueue(user("b"), RAPID);

        assertFalse(result.isMatched());
        assertEquals(1, result.position());
        assertEquals(2, matchmaker.queuedCount());
        assertTrue(matches.isEmpty());
    }

    @Test
    void reEnqueue_returnsExistingPosition() {
        matchmaker.enqueue(user("a"), RAPID);
        matchmaker.enqueue(user("b"), BLITZ);

        EnqueueResult again = matchmaker.enqueue(user("a"), RAPID);

        assertFalse(again.isMatched());
        assertEquals(1, again.position());
        assertEquals(2, matchmaker.queuedCount());
        assertTrue(matches.isEmpty());
    }

    @Test
    void reEnqueueWithOtherPreferences_keepsOriginalEntry() {
        matchmaker.enqueue(user("a"), RAPID);

        assertFalse(matchmaker.enqueue(user("a"), BLITZ).isMatched());
        // b 选 BLITZ，不会与仍在 RAPID 队列里的 a 配对
        assertFalse(matchmaker.enqueue(user("b"), BLITZ).isMatched());
        assertEquals(2, matchmaker.queuedCount());
    }

    @Test
    void leave_removesEntry() {
        matchmaker.enqueue(user("a"), BLITZ);

        assertEquals(LeaveResult.LEFT, matchmaker.leave("a"));
        assertEquals(LeaveResult.NOT_QUEUED, matchmaker.leave("a"));
        assertEquals(0, matchmaker.queuedCount());
        // a 离开后 b 入队只能等待
        assertFalse(matchmaker.enqueue(user("b"), BLITZ).isMatched());
        assertTrue(matches.isEmpty());
    }

    @Test
    void leaveAfterMatch_reportsAlreadyMatchedUntilExpiry() {
        matchmaker.enqueue(user("a"), BLITZ);
        matchmaker.enqueue(user("b"), BLITZ);

        assertEquals(LeaveResult.ALREADY_MATCHED, matchmaker.leave("a"));
        clock.advance(engine.properties.getMatchmaking().getRecentlyMatchedTtl().toMillis() + 1);
        assertEquals(LeaveResult.NOT_QUEUED, matchmaker.leave("a"));
    }

    @Test
    void playerWithOngoingOnlineGame_cannotQueue() {
        matchmaker.enqueue(user("a"), BLITZ);
        matchmaker.enqueue(user("b"), BLITZ);

        GameException ex = assertThrows(GameException.class, () -> matchmaker.enqueue(user("a"), BLITZ));
        assertEquals(ErrorCode.ALREADY_IN_GAME, ex.getCode());
    }

    @Test
    void soloGame_doesNotBlockQueueing() {
        matchmaker.createSolo(user("a"), null);
        assertEquals(1, matchmaker.enqueue(user("a"), BLITZ).position());
    }

    @Test
    void concurrentEnqueues_pairEveryPlayerExactlyOnce() throws Exception {
        int players = 20;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<EnqueueResult>> futures = new CopyOnWriteArrayList<>();
            for (int i = 0; i < players; i++) {
                Identity id = user("p" + i);
                futures.add(pool.submit(() -> {
                    start.await();
                    return matchmaker.enqueue(id, BLITZ);
                }));
            }
            start.countDown();
            for (Future<EnqueueResult> f : futures) {
                f.get(3, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(players / 2, matches.size());
        assertEquals(0, matchmaker.queuedCount());
        long distinct = matches.stream()
                .flatMap(m -> Stream.of(m.white().userId(), m.black().userId()))
                .distinct()
                .count();
        assertEquals(players, distinct);
    }
}

package com.banchess.gameservice.clock.scheduler;

import com.banchess.gameservice.support.Waits;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledThreadPoolExecutor;

import static org.junit.jupiter.api.Assertions.*;

class CountdownSchedulerImplTest {

    private ScheduledThreadPoolExecutor executor;
    private CountdownSchedulerImpl scheduler;
    private final List<String> fired = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        executor = new ScheduledThreadPoolExecutor(2);
        scheduler = new CountdownSchedulerImpl(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private CountdownScheduler.TimeoutHandler record() {
        return (key, owner, version) -> fired.add(key + "/" + owner + "/" + version);
    }

    @Test
    void firesOnceAtDeadline() throws Exception {
        scheduler.startOrResume("clock:s1", "white", System.currentTimeMillis() + 50, "7", record());
        assertTrue(scheduler.isScheduled("clock:s1"));

        Waits.until(() -> !fired.isEmpty(), "timeout fired");
        Thread.sleep(100);

        assertEquals(List.of("clock:s1/white/7"), fired);
        assertFalse(scheduler.isScheduled("clock:s1"));
    }

    @Test
    void pastDeadline_firesImmediately() {
        scheduler.startOrResume("k", "black", System.currentTimeMillis() - 1_000, "1", record());
        Waits.until(() -> fired.size() == 1, "immediate timeout");
    }

    @Test
    void stop_preventsFiring() throws Exception {
        scheduler.startOrResume("k", "white", System.currentTimeMillis() + 100, "1", record());

        assertTrue(scheduler.stop("k"));
        assertFalse(scheduler.stop("k"));
        Thread.sleep(200);

        assertTrue(fired.isEmpty());
        assertFalse(scheduler.isScheduled("k"));
    }

    @Test
    void restart_replacesPreviousTask() throws Exception {
        scheduler.startOrResume("k", "white", System.currentTimeMillis() + 80, "1", record());
        scheduler.startOrResume("k", "black", System.currentTimeMillis() + 120, "2", record());

        Waits.until(() -> !fired.isEmpty(), "replacement fired");
        Thread.sleep(150);

        assertEquals(List.of("k/black/2"), fired);
    }

    @Test
    void failingHandler_doesNotBreakScheduler() {
        scheduler.startOrResume("bad", "white", System.currentTimeMillis(), "1", (k, o, v) -> {
            throw new IllegalStateException("boom");
        });
        scheduler.startOrResume("good", "white", System.currentTimeMillis() + 20, "1", record());

        Waits.until(() -> fired.contains("good/white/1"), "second timeout fired");
    }

    @Test
    void keysAreIndependent() {
        scheduler.startOrResume("clock:s1", "white", System.currentTimeMillis() + 10_000, "1", record());
        scheduler.startOrResume("grace:s1:white", "white", System.currentTimeMillis() + 10_000, "0", record());

        scheduler.stop("clock:s1");

        assertFalse(scheduler.isScheduled("clock:s1"));
        assertTrue(scheduler.isScheduled("grace:s1:white"));
    }
}

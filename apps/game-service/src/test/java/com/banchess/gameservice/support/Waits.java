package com.banchess.gameservice.support;

import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * 异步断言：轮询直到条件成立或超时。
 */
public final class Waits {

    private static final long DEFAULT_TIMEOUT_MS = 3_000;

    private Waits() {
    }

    public static void until(BooleanSupplier condition, String what) {
        until(condition, what, DEFAULT_TIMEOUT_MS);
    }

    public static void until(BooleanSupplier condition, String what, long timeoutMs) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("timed out waiting for " + what);
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("interrupted waiting for " + what);
            }
        }
    }
}

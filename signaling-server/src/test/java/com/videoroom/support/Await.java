package com.videoroom.support;

import static org.junit.jupiter.api.Assertions.fail;

import java.util.function.BooleanSupplier;

/**
 * 비동기 mailbox 처리가 끝나기를 기다리는 테스트 도우미.
 */
public final class Await {

    private static final long TIMEOUT_MS = 3_000;

    private Await() {
    }

    public static void until(String description, BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + TIMEOUT_MS;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for " + description);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting for " + description);
            }
        }
    }
}

package com.infomedia.abacox.callorchestrator.support;

import java.time.Duration;
import java.util.function.BooleanSupplier;

public final class Eventually {

    private Eventually() {
    }

    public static void eventually(BooleanSupplier condition) {
        eventually(condition, Duration.ofSeconds(5));
    }

    public static void eventually(BooleanSupplier condition, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within " + timeout.toMillis() + " ms");
            }
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting", e);
            }
        }
    }
}

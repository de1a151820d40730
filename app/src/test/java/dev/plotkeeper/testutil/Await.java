package dev.plotkeeper.testutil;

import java.time.Duration;
import java.util.function.BooleanSupplier;

public final class Await {
    private Await() {}

    public static void until(BooleanSupplier condition, Duration timeout, String description)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Timed out after " + timeout.toMillis() + " ms waiting for " + description);
            }
            Thread.sleep(10);
        }
    }
}

package org.javai.retry.backoff;

import java.time.Duration;

/**
 * Blocks the calling thread for a duration. Replaceable so tests can record
 * waits instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    /**
     * A sleeper backed by {@link Thread#sleep(long, int)}.
     */
    static Sleeper threadSleep() {
        return duration -> {
            if (duration.isZero() || duration.isNegative()) {
                return;
            }
            Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
        };
    }
}

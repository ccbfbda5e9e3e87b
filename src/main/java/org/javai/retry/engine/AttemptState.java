package org.javai.retry.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * Mutable state of one invocation of the attempt loop. Created when the invocation
 * starts and dropped when it returns or rethrows; never shared between invocations
 * or threads.
 */
final class AttemptState {

    private final int maxAttempts;
    private int attemptIndex;
    private Duration delay;
    private boolean resolved;

    AttemptState(int maxAttempts, Duration initialDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.attemptIndex = 1;
        this.delay = Objects.requireNonNull(initialDelay, "initialDelay must not be null");
    }

    int attemptIndex() {
        return attemptIndex;
    }

    int maxAttempts() {
        return maxAttempts;
    }

    boolean isLastAttempt() {
        return attemptIndex >= maxAttempts;
    }

    /**
     * The un-jittered delay for the next delayed retry.
     */
    Duration delay() {
        return delay;
    }

    void delay(Duration next) {
        this.delay = Objects.requireNonNull(next, "delay must not be null");
    }

    boolean isResolved() {
        return resolved;
    }

    /**
     * Marks the invocation as finished with a value or an accepted failure.
     */
    void resolve() {
        resolved = true;
    }

    void advance() {
        if (resolved) {
            throw new IllegalStateException("invocation already resolved");
        }
        if (isLastAttempt()) {
            throw new IllegalStateException("no attempts remain after attempt " + attemptIndex);
        }
        attemptIndex++;
    }
}

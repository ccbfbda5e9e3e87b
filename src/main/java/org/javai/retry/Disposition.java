package org.javai.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * The decision reached by evaluating a handler chain against one failure.
 */
public sealed interface Disposition permits Disposition.Propagate, Disposition.Suppress, Disposition.Continue {

    /**
     * Why a failure is being propagated.
     */
    enum Reason {
        /** No handler matched. */
        UNMATCHED,
        /** A retry handler matched on the last permitted attempt. */
        EXHAUSTED,
        /** The backoff wait was interrupted. */
        INTERRUPTED
    }

    /**
     * Rethrow the failure unchanged.
     */
    record Propagate(Exception failure, Reason reason) implements Disposition {
        public Propagate {
            Objects.requireNonNull(failure, "failure must not be null");
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }

    /**
     * Stop and return {@link Outcome.Suppressed}.
     */
    record Suppress(Exception failure, String handler) implements Disposition {
        public Suppress {
            Objects.requireNonNull(failure, "failure must not be null");
            Objects.requireNonNull(handler, "handler must not be null");
        }
    }

    /**
     * Run another attempt. {@code delay} is the wait already applied, zero for an
     * immediate retry.
     */
    record Continue(String handler, Duration delay) implements Disposition {
        public Continue {
            Objects.requireNonNull(handler, "handler must not be null");
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }

        public static Continue immediate(String handler) {
            return new Continue(handler, Duration.ZERO);
        }
    }
}

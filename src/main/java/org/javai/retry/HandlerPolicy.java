package org.javai.retry;

/**
 * What happens when a {@link Handler}'s predicate matches a failure.
 */
public enum HandlerPolicy {

    /**
     * Accept the failure. No further attempt runs and the caller receives
     * {@link Outcome.Suppressed}.
     */
    IGNORE,

    /**
     * Attempt the operation again immediately, if attempts remain.
     */
    RETRY,

    /**
     * Wait for the current backoff delay, then attempt again, if attempts remain.
     */
    DELAYED_RETRY;

    /**
     * Whether this policy asks for another attempt.
     */
    public boolean retries() {
        return this != IGNORE;
    }

    /**
     * Lower-case label used as the default handler name in reports.
     */
    public String label() {
        return name().toLowerCase().replace('_', '-');
    }
}

package org.javai.retry.engine;

import org.javai.retry.Disposition;
import org.javai.retry.Outcome;
import org.javai.retry.ThrowingSupplier;
import org.javai.retry.backoff.Backoff;
import org.javai.retry.ops.RetryReporter;

import java.util.Objects;

/**
 * Drives attempts 1..maxAttempts of an operation, consulting the handler chain after
 * each failure.
 *
 * <p>A failure that is not suppressed or retried is rethrown as the same instance the
 * operation threw: it is never wrapped, and nothing is added to it.</p>
 */
final class AttemptLoop {

    private final String operation;
    private final int maxAttempts;
    private final HandlerChain chain;
    private final Backoff backoff;
    private final RetryReporter reporter;

    AttemptLoop(String operation, int maxAttempts, HandlerChain chain, Backoff backoff, RetryReporter reporter) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be > 0, was: " + maxAttempts);
        }
        this.operation = Objects.requireNonNull(operation, "operation must not be null");
        this.maxAttempts = maxAttempts;
        this.chain = Objects.requireNonNull(chain, "chain must not be null");
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    int maxAttempts() {
        return maxAttempts;
    }

    <T, E extends Exception> Outcome<T> run(ThrowingSupplier<T, E> work) throws E {
        Objects.requireNonNull(work, "work must not be null");
        AttemptState state = new AttemptState(maxAttempts, backoff.initialDelay());

        while (true) {
            Exception failure;
            try {
                T value = work.get();
                state.resolve();
                return Outcome.ok(value, state.attemptIndex());
            } catch (Exception e) {
                failure = e;
            }

            Disposition disposition = chain.evaluate(failure, state);

            if (disposition instanceof Disposition.Continue next) {
                reporter.reportRetry(operation, failure, state.attemptIndex(), next.handler(), next.delay());
                state.advance();
                continue;
            }

            if (disposition instanceof Disposition.Suppress suppress) {
                reporter.reportSuppressed(operation, failure, state.attemptIndex(), suppress.handler());
                return Outcome.suppressed(failure, state.attemptIndex(), suppress.handler());
            }

            Disposition.Propagate propagate = (Disposition.Propagate) disposition;
            reporter.reportPropagated(operation, failure, state.attemptIndex(), propagate.reason());
            throw AttemptLoop.<E>propagate(propagate.failure());
        }
    }

    /**
     * Rethrows the failure unchanged. Unchecked failures are thrown directly; a checked
     * failure can only have come from {@code work.get()}, so it is an {@code E}.
     */
    @SuppressWarnings("unchecked")
    private static <E extends Exception> E propagate(Exception failure) {
        if (failure instanceof RuntimeException runtime) {
            throw runtime;
        }
        return (E) failure;
    }
}

package org.javai.retry.ops;

import org.javai.retry.Disposition;

import java.time.Duration;

/**
 * Receives the decisions made while executing an operation, for logging or metrics.
 * All methods default to no-op; successful classification is silent unless a
 * reporter is configured.
 *
 * <p>Reporters are called synchronously from the attempt loop. Exceptions thrown by a
 * reporter are caught and logged by the engine; they never change the outcome of an
 * invocation.</p>
 */
public interface RetryReporter {

    /**
     * A retry handler matched and another attempt will run.
     *
     * @param operation the operation name given to the executor
     * @param failure the failure that triggered the retry
     * @param attemptNumber the attempt that failed (1-based)
     * @param handler name of the matching handler
     * @param delay the wait applied before the next attempt, zero for an immediate retry
     */
    default void reportRetry(String operation, Exception failure, int attemptNumber, String handler, Duration delay) {
        // Default: no-op. Implementations may override.
    }

    /**
     * An ignore handler matched; the invocation returns without a value.
     *
     * @param operation the operation name given to the executor
     * @param failure the failure that was ignored
     * @param attemptNumber the attempt that failed (1-based)
     * @param handler name of the matching handler
     */
    default void reportSuppressed(String operation, Exception failure, int attemptNumber, String handler) {
        // Default: no-op. Implementations may override.
    }

    /**
     * The failure is about to be rethrown to the caller.
     *
     * @param operation the operation name given to the executor
     * @param failure the failure being rethrown
     * @param attemptNumber the attempt that failed (1-based)
     * @param reason why no further attempt runs
     */
    default void reportPropagated(String operation, Exception failure, int attemptNumber, Disposition.Reason reason) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A predicate threw while classifying a failure and was treated as not matching.
     *
     * @param operation the operation name given to the executor
     * @param failure the failure being classified
     * @param handler name of the handler whose predicate threw
     * @param predicateError what the predicate threw
     */
    default void reportPredicateFailure(String operation, Exception failure, String handler, Throwable predicateError) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing.
     */
    static RetryReporter noOp() {
        return new RetryReporter() {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static RetryReporter composite(RetryReporter... reporters) {
        return CompositeRetryReporter.of(reporters);
    }
}

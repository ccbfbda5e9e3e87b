package org.javai.retry.engine;

import org.javai.retry.FailureAction;
import org.javai.retry.FailurePredicate;
import org.javai.retry.Handler;
import org.javai.retry.Outcome;
import org.javai.retry.ThrowingSupplier;
import org.javai.retry.backoff.Backoff;
import org.javai.retry.backoff.BackoffSettings;
import org.javai.retry.ops.CompositeRetryReporter;
import org.javai.retry.ops.RetryReporter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Runs an operation up to {@code maxAttempts} times, classifying each failure with an
 * ordered chain of handlers.
 *
 * <p>On each failure the first handler whose predicate matches decides what happens:
 * <ul>
 *   <li>{@code ignore}: stop and return {@link Outcome.Suppressed}</li>
 *   <li>{@code retry}: attempt again immediately</li>
 *   <li>{@code delayedRetry}: wait for the backoff delay, then attempt again</li>
 * </ul>
 * On the last attempt retry handlers no longer loop: the failure is rethrown. A failure
 * that no handler matches is rethrown straight away. Rethrown failures are the original
 * exception instances.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryExecutor executor = RetryExecutor.builder()
 *     .name("S3.get")
 *     .maxAttempts(4)
 *     .retryIf(FailurePredicates.instanceOf(SocketTimeoutException.class))
 *     .delayedRetryIf(FailurePredicates.codeIn("SlowDown", "ServiceUnavailable"))
 *     .ignoreIf(FailurePredicates.codeEquals("NoSuchKey"))
 *     .reporter(new Log4jRetryReporter())
 *     .build();
 *
 * Outcome<byte[]> object = executor.execute(() -> s3.get(bucket, key));
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads; each call to
 * {@link #execute(ThrowingSupplier)} keeps its own attempt counter and delay.</p>
 */
public final class RetryExecutor {

    static final String DEFAULT_NAME = "retry";

    private final AttemptLoop loop;
    private final HandlerChain chain;

    private RetryExecutor(String name, int maxAttempts, List<Handler> handlers, Backoff backoff, RetryReporter reporter) {
        RetryReporter safeReporter = CompositeRetryReporter.of(reporter);
        this.chain = new HandlerChain(name, handlers, backoff, safeReporter);
        this.loop = new AttemptLoop(name, maxAttempts, chain, backoff, safeReporter);
    }

    /**
     * Creates a builder for configuring a RetryExecutor instance.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs {@code work} with the given handlers, default backoff and no reporting.
     *
     * @param maxAttempts maximum number of attempts (must be > 0)
     * @param work the operation to attempt
     * @param handlers the handler chain, in evaluation order
     * @return the value, or {@link Outcome.Suppressed} if an ignore handler matched
     * @throws E the operation's failure, unchanged, when it is not suppressed
     * @throws IllegalArgumentException if maxAttempts is not positive
     */
    public static <T, E extends Exception> Outcome<T> run(
            int maxAttempts,
            ThrowingSupplier<T, E> work,
            Handler... handlers
    ) throws E {
        return builder()
                .maxAttempts(maxAttempts)
                .handlers(Arrays.asList(handlers))
                .build()
                .execute(work);
    }

    /**
     * Attempts the operation until it succeeds, a failure is suppressed, or a failure
     * propagates.
     *
     * @param work the operation to attempt
     * @return the value, or {@link Outcome.Suppressed} if an ignore handler matched
     * @throws E the operation's failure, unchanged, when it is not suppressed
     */
    public <T, E extends Exception> Outcome<T> execute(ThrowingSupplier<T, E> work) throws E {
        return loop.run(work);
    }

    public int maxAttempts() {
        return loop.maxAttempts();
    }

    public List<Handler> handlers() {
        return chain.handlers();
    }

    /**
     * Builder for configuring a RetryExecutor instance. Handlers are evaluated in the
     * order they are added.
     */
    public static final class Builder {
        private String name = DEFAULT_NAME;
        private int maxAttempts;
        private final List<Handler> handlers = new ArrayList<>();
        private Backoff backoff = Backoff.defaults();
        private RetryReporter reporter = RetryReporter.noOp();

        private Builder() {}

        /**
         * Sets the operation name used in reports (optional, defaults to "retry").
         */
        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        /**
         * Sets the maximum number of attempts (required).
         *
         * @throws IllegalArgumentException if maxAttempts is not positive
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("maxAttempts must be > 0, was: " + maxAttempts);
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder handler(Handler handler) {
            handlers.add(Objects.requireNonNull(handler, "handler must not be null"));
            return this;
        }

        public Builder handlers(List<Handler> handlers) {
            Objects.requireNonNull(handlers, "handlers must not be null");
            handlers.forEach(this::handler);
            return this;
        }

        public Builder ignoreIf(FailurePredicate predicate) {
            return handler(Handler.ignoreIf(predicate));
        }

        public Builder ignoreIf(FailurePredicate predicate, FailureAction action) {
            return handler(Handler.ignoreIf(predicate, action));
        }

        public Builder retryIf(FailurePredicate predicate) {
            return handler(Handler.retryIf(predicate));
        }

        public Builder retryIf(FailurePredicate predicate, FailureAction action) {
            return handler(Handler.retryIf(predicate, action));
        }

        public Builder delayedRetryIf(FailurePredicate predicate) {
            return handler(Handler.delayedRetryIf(predicate));
        }

        public Builder delayedRetryIf(FailurePredicate predicate, FailureAction action) {
            return handler(Handler.delayedRetryIf(predicate, action));
        }

        /**
         * Sets the backoff schedule for delayed retries (optional, defaults to
         * {@link BackoffSettings#defaults()}).
         */
        public Builder backoff(BackoffSettings settings) {
            this.backoff = Backoff.of(Objects.requireNonNull(settings, "settings must not be null"));
            return this;
        }

        /**
         * Sets the backoff, including its sleeper and jitter source.
         */
        public Builder backoff(Backoff backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry decisions (optional, defaults to no-op).
         */
        public Builder reporter(RetryReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Builds the RetryExecutor instance.
         *
         * @throws IllegalStateException if maxAttempts has not been set
         */
        public RetryExecutor build() {
            if (maxAttempts == 0) {
                throw new IllegalStateException("maxAttempts must be set");
            }
            return new RetryExecutor(name, maxAttempts, handlers, backoff, reporter);
        }
    }
}

package org.javai.retry.engine;

import org.javai.retry.FailureAction;
import org.javai.retry.FailurePredicate;
import org.javai.retry.Handler;
import org.javai.retry.HandlerPolicy;
import org.javai.retry.Outcome;
import org.javai.retry.ThrowingSupplier;
import org.javai.retry.backoff.Backoff;
import org.javai.retry.ops.CompositeRetryReporter;
import org.javai.retry.ops.RetryReporter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Runs an operation once, ignoring only the failures an ignore handler matches and
 * rethrowing everything else unchanged.
 *
 * <pre>{@code
 * Outcome<byte[]> object = Protected.run(
 *     () -> s3.get(bucket, key),
 *     Handler.ignoreIf(FailurePredicates.codeIn("NoSuchKey", "AccessDenied")));
 *
 * byte[] body = object.getOrElse(new byte[0]);
 * }</pre>
 *
 * <p>This is the attempt loop with a single attempt and a chain restricted to
 * {@link HandlerPolicy#IGNORE} handlers.</p>
 */
public final class Protected {

    static final String DEFAULT_NAME = "protected";

    private final AttemptLoop loop;
    private final HandlerChain chain;

    private Protected(String name, List<Handler> handlers, RetryReporter reporter) {
        RetryReporter safeReporter = CompositeRetryReporter.of(reporter);
        Backoff noBackoff = Backoff.defaults();
        this.chain = new HandlerChain(name, handlers, noBackoff, safeReporter);
        this.loop = new AttemptLoop(name, 1, chain, noBackoff, safeReporter);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs {@code work} once with the given ignore handlers and no reporting.
     *
     * @param work the operation
     * @param handlers ignore handlers, in evaluation order
     * @return the value, or {@link Outcome.Suppressed} if an ignore handler matched
     * @throws E the operation's failure, unchanged, when no handler matched
     * @throws IllegalArgumentException if a handler's policy is not IGNORE
     */
    public static <T, E extends Exception> Outcome<T> run(ThrowingSupplier<T, E> work, Handler... handlers) throws E {
        return builder()
                .handlers(Arrays.asList(handlers))
                .build()
                .execute(work);
    }

    public <T, E extends Exception> Outcome<T> execute(ThrowingSupplier<T, E> work) throws E {
        return loop.run(work);
    }

    public List<Handler> handlers() {
        return chain.handlers();
    }

    public static final class Builder {
        private String name = DEFAULT_NAME;
        private final List<Handler> handlers = new ArrayList<>();
        private RetryReporter reporter = RetryReporter.noOp();

        private Builder() {}

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        /**
         * Adds an ignore handler.
         *
         * @throws IllegalArgumentException if the handler's policy is not IGNORE
         */
        public Builder handler(Handler handler) {
            Objects.requireNonNull(handler, "handler must not be null");
            if (handler.policy().retries()) {
                throw new IllegalArgumentException(
                        "protected execution runs once and only accepts ignore handlers, got: " + handler.policy());
            }
            handlers.add(handler);
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

        public Builder reporter(RetryReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Protected build() {
            return new Protected(name, handlers, reporter);
        }
    }
}

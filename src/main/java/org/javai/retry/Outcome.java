package org.javai.retry;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The result of a protected or repeated execution that did not propagate a failure.
 * Either {@link Ok} containing the operation's value, or {@link Suppressed} when an
 * ignore handler accepted the failure.
 *
 * <p>Propagated failures are not represented here: they are rethrown to the caller
 * as the original exception.</p>
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Suppressed {

    /**
     * The operation returned a value.
     *
     * @param value the value returned by the operation, possibly null
     * @param attempts how many attempts ran, including the successful one
     */
    record Ok<T>(T value, int attempts) implements Outcome<T> {

        public Ok {
            requirePositive(attempts);
        }

        public Ok(T value) {
            this(value, 1);
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.ofNullable(value);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value), attempts);
        }
    }

    /**
     * An ignore handler matched; the operation produced no value.
     *
     * @param failure the failure that was ignored
     * @param attempts how many attempts ran, including the one that failed
     * @param handler name of the handler that matched
     */
    record Suppressed<T>(Exception failure, int attempts, String handler) implements Outcome<T> {

        public Suppressed {
            Objects.requireNonNull(failure, "failure must not be null");
            Objects.requireNonNull(handler, "handler must not be null");
            requirePositive(attempts);
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.empty();
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Suppressed<>(failure, attempts, handler);
        }
    }

    boolean isOk();

    default boolean isSuppressed() {
        return !isOk();
    }

    int attempts();

    /**
     * Returns the value, or empty when the failure was suppressed.
     * A successful operation that returned null also yields empty; use
     * {@link #isOk()} to tell the two apart.
     */
    Optional<T> toOptional();

    T getOrElse(T defaultValue);

    T getOrElseGet(Supplier<? extends T> supplier);

    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);

    static <T> Outcome<T> ok(T value, int attempts) {
        return new Ok<>(value, attempts);
    }

    static <T> Outcome<T> suppressed(Exception failure, int attempts, String handler) {
        return new Suppressed<>(failure, attempts, handler);
    }

    private static void requirePositive(int attempts) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1, was: " + attempts);
        }
    }
}

package org.javai.retry;

/**
 * An operation that produces a value and may throw a checked exception.
 * This is the unit of work attempted by {@link org.javai.retry.engine.RetryExecutor}
 * and {@link org.javai.retry.engine.Protected}.
 *
 * @param <T> The type of value produced
 * @param <E> The type of checked exception the operation may throw
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}

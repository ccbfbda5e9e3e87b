package org.javai.retry;

/**
 * Side effect run when a {@link Handler} matches, before its policy is applied.
 * Typical uses are cleanup before a retry, or adjusting request state.
 *
 * <p>Unlike predicates, actions are not fail-safe: whatever an action throws
 * propagates to the caller unchanged and ends the attempt loop. Actions that
 * call code throwing checked exceptions must wrap them, for example in
 * {@link java.io.UncheckedIOException}.</p>
 */
@FunctionalInterface
public interface FailureAction {

    void accept(Exception failure);

    /**
     * An action that does nothing.
     */
    static FailureAction none() {
        return failure -> {};
    }

    default FailureAction andThen(FailureAction next) {
        return failure -> {
            accept(failure);
            next.accept(failure);
        };
    }
}

package org.javai.retry;

import java.util.Objects;

/**
 * One classification rule in a handler chain: a predicate, the policy applied when it
 * matches, and an optional action run before the policy.
 *
 * <p>Handlers are evaluated in declaration order and the first match wins.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Handler notFound = Handler.ignoreIf(FailurePredicates.codeIn("NoSuchKey", "AccessDenied"));
 * Handler throttled = Handler.delayedRetryIf(FailurePredicates.codeEquals("Throttling"))
 *     .named("throttled");
 * }</pre>
 *
 * @param name label used when reporting decisions
 * @param predicate decides whether this handler applies to a failure
 * @param policy what happens when the predicate matches
 * @param action side effect run on match, before the policy
 */
public record Handler(
        String name,
        FailurePredicate predicate,
        HandlerPolicy policy,
        FailureAction action
) {
    public Handler {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(predicate, "predicate must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(action, "action must not be null");
    }

    public Handler(FailurePredicate predicate, HandlerPolicy policy, FailureAction action) {
        this(policy.label(), predicate, policy, action);
    }

    public Handler(FailurePredicate predicate, HandlerPolicy policy) {
        this(predicate, policy, FailureAction.none());
    }

    public static Handler ignoreIf(FailurePredicate predicate) {
        return new Handler(predicate, HandlerPolicy.IGNORE);
    }

    public static Handler ignoreIf(FailurePredicate predicate, FailureAction action) {
        return new Handler(predicate, HandlerPolicy.IGNORE, action);
    }

    public static Handler retryIf(FailurePredicate predicate) {
        return new Handler(predicate, HandlerPolicy.RETRY);
    }

    public static Handler retryIf(FailurePredicate predicate, FailureAction action) {
        return new Handler(predicate, HandlerPolicy.RETRY, action);
    }

    public static Handler delayedRetryIf(FailurePredicate predicate) {
        return new Handler(predicate, HandlerPolicy.DELAYED_RETRY);
    }

    public static Handler delayedRetryIf(FailurePredicate predicate, FailureAction action) {
        return new Handler(predicate, HandlerPolicy.DELAYED_RETRY, action);
    }

    /**
     * Returns a copy of this handler with a different report label.
     */
    public Handler named(String name) {
        return new Handler(name, predicate, policy, action);
    }

    /**
     * Returns a copy of this handler that runs {@code next} after the current action.
     */
    public Handler onMatch(FailureAction next) {
        Objects.requireNonNull(next, "action must not be null");
        return new Handler(name, predicate, policy, action.andThen(next));
    }
}

package org.javai.retry;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Common {@link FailurePredicate}s.
 *
 * <pre>{@code
 * RetryExecutor executor = RetryExecutor.builder()
 *     .maxAttempts(4)
 *     .retryIf(FailurePredicates.instanceOf(SocketTimeoutException.class))
 *     .ignoreIf(FailurePredicates.codeEquals("203"))
 *     .build();
 * }</pre>
 */
public final class FailurePredicates {

    private FailurePredicates() {
        // Utility class
    }

    /**
     * Matches failures that are instances of any of the given types.
     */
    @SafeVarargs
    public static FailurePredicate instanceOf(Class<? extends Throwable>... types) {
        List<Class<? extends Throwable>> accepted = List.of(types);
        return failure -> accepted.stream().anyMatch(type -> type.isInstance(failure));
    }

    /**
     * Matches failures whose exact runtime type is {@code type}, excluding subclasses.
     */
    public static FailurePredicate exactType(Class<? extends Throwable> type) {
        Objects.requireNonNull(type, "type must not be null");
        return failure -> failure.getClass() == type;
    }

    /**
     * Matches failures whose {@link Failures#code(Throwable) code} equals {@code code}.
     */
    public static FailurePredicate codeEquals(String code) {
        Objects.requireNonNull(code, "code must not be null");
        return failure -> Failures.code(failure).map(code::equals).orElse(false);
    }

    /**
     * Matches failures whose {@link Failures#code(Throwable) code} is one of {@code codes}.
     */
    public static FailurePredicate codeIn(String... codes) {
        Set<String> accepted = Set.copyOf(Arrays.asList(codes));
        return failure -> Failures.code(failure).map(accepted::contains).orElse(false);
    }

    /**
     * Matches when any of the given predicates matches. Evaluation stops at the first
     * match; a predicate that throws ends evaluation, which the handler chain treats
     * as no match.
     */
    public static FailurePredicate any(FailurePredicate... predicates) {
        List<FailurePredicate> all = List.of(predicates);
        return failure -> {
            for (FailurePredicate predicate : all) {
                if (predicate.test(failure)) {
                    return true;
                }
            }
            return false;
        };
    }

    public static FailurePredicate not(FailurePredicate predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        return predicate.negate();
    }
}

package org.javai.retry;

/**
 * Classifies a failure. Predicates may throw: a predicate that throws while being
 * evaluated is treated as "no match", so a predicate can read fields that only
 * some failures carry without guarding every access.
 *
 * <p>This covers {@link Error}s as well ({@code AssertionError},
 * {@code NoClassDefFoundError}, {@code ExceptionInInitializerError}). Only a
 * {@link VirtualMachineError} such as {@code OutOfMemoryError} escapes evaluation.</p>
 */
@FunctionalInterface
public interface FailurePredicate {

    /**
     * @param failure the exception thrown by the attempted operation
     * @return true if the failure belongs to this handler
     * @throws Exception any error while inspecting the failure; treated as no match
     */
    boolean test(Exception failure) throws Exception;

    /**
     * A predicate matching every failure.
     */
    static FailurePredicate always() {
        return failure -> true;
    }

    default FailurePredicate and(FailurePredicate other) {
        return failure -> test(failure) && other.test(failure);
    }

    default FailurePredicate or(FailurePredicate other) {
        return failure -> test(failure) || other.test(failure);
    }

    default FailurePredicate negate() {
        return failure -> !test(failure);
    }
}

package org.javai.retry.engine;

import org.javai.retry.Disposition;
import org.javai.retry.Handler;
import org.javai.retry.backoff.Backoff;
import org.javai.retry.ops.RetryReporter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates an ordered list of handlers against one failure.
 *
 * <p>Predicates are evaluated in declaration order and the first match wins. A predicate
 * that throws counts as no match and what it threw is only reported, {@link Error}s
 * included; only a {@link VirtualMachineError} escapes. The matching
 * handler's action is not guarded: whatever it throws escapes to the caller.</p>
 */
final class HandlerChain {

    private final String operation;
    private final List<Handler> handlers;
    private final Backoff backoff;
    private final RetryReporter reporter;

    HandlerChain(String operation, List<Handler> handlers, Backoff backoff, RetryReporter reporter) {
        this.operation = Objects.requireNonNull(operation, "operation must not be null");
        this.handlers = List.copyOf(handlers);
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    List<Handler> handlers() {
        return handlers;
    }

    Disposition evaluate(Exception failure, AttemptState state) {
        for (Handler handler : handlers) {
            if (!matches(handler, failure)) {
                continue;
            }
            handler.action().accept(failure);
            return apply(handler, failure, state);
        }
        return new Disposition.Propagate(failure, Disposition.Reason.UNMATCHED);
    }

    private boolean matches(Handler handler, Exception failure) {
        try {
            return handler.predicate().test(failure);
        } catch (VirtualMachineError fatal) {
            throw fatal;
        } catch (Throwable predicateError) {
            if (predicateError instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            reporter.reportPredicateFailure(operation, failure, handler.name(), predicateError);
            return false;
        }
    }

    private Disposition apply(Handler handler, Exception failure, AttemptState state) {
        return switch (handler.policy()) {
            case IGNORE -> {
                state.resolve();
                yield new Disposition.Suppress(failure, handler.name());
            }
            case RETRY -> state.isLastAttempt()
                    ? new Disposition.Propagate(failure, Disposition.Reason.EXHAUSTED)
                    : Disposition.Continue.immediate(handler.name());
            case DELAYED_RETRY -> state.isLastAttempt()
                    ? new Disposition.Propagate(failure, Disposition.Reason.EXHAUSTED)
                    : delayedRetry(handler, failure, state);
        };
    }

    private Disposition delayedRetry(Handler handler, Exception failure, AttemptState state) {
        Duration delay = state.delay();
        try {
            Duration waited = backoff.pause(delay);
            state.delay(backoff.next(delay));
            return new Disposition.Continue(handler.name(), waited);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Disposition.Propagate(failure, Disposition.Reason.INTERRUPTED);
        }
    }
}

package org.javai.retry.examples;

import org.javai.retry.Disposition;
import org.javai.retry.FailurePredicates;
import org.javai.retry.Handler;
import org.javai.retry.Outcome;
import org.javai.retry.ServiceException;
import org.javai.retry.backoff.BackoffSettings;
import org.javai.retry.engine.RetryExecutor;
import org.javai.retry.ops.RetryReporter;
import org.javai.retry.ops.log4j.Log4jRetryReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpConnectTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Demonstrates classified retry in a realistic network interaction scenario.
 */
public class NetworkInteractionTest {

    private static final BackoffSettings FAST_BACKOFF = BackoffSettings.defaults().withBaseDelay(Duration.ofMillis(1));

    private List<String> events;
    private RetryReporter reporter;

    @BeforeEach
    void setUp() {
        events = new ArrayList<>();
        RetryReporter recording = new RetryReporter() {
            @Override
            public void reportRetry(String operation, Exception failure, int attemptNumber, String handler, Duration delay) {
                events.add("retry:" + handler + "#" + attemptNumber);
            }

            @Override
            public void reportSuppressed(String operation, Exception failure, int attemptNumber, String handler) {
                events.add("suppressed:" + handler + "#" + attemptNumber);
            }

            @Override
            public void reportPropagated(String operation, Exception failure, int attemptNumber, Disposition.Reason reason) {
                events.add("propagated:" + reason + "#" + attemptNumber);
            }
        };
        reporter = RetryReporter.composite(recording, new Log4jRetryReporter());
    }

    private RetryExecutor userApi() {
        return RetryExecutor.builder()
                .name("UserApi.fetchUser")
                .maxAttempts(4)
                .handler(Handler.ignoreIf(FailurePredicates.codeEquals("UserNotFound")).named("not-found"))
                .handler(Handler.delayedRetryIf(FailurePredicates.instanceOf(HttpConnectTimeoutException.class)).named("connect-timeout"))
                .handler(Handler.retryIf(FailurePredicates.codeEquals("Throttled")).named("throttled"))
                .backoff(FAST_BACKOFF)
                .reporter(reporter)
                .build();
    }

    private static <T> T next(Iterator<Object> responses) throws IOException {
        Object response = responses.next();
        if (response instanceof IOException failure) {
            throw failure;
        }
        if (response instanceof RuntimeException failure) {
            throw failure;
        }
        @SuppressWarnings("unchecked")
        T value = (T) response;
        return value;
    }

    @Test
    void successfulNetworkCall_returnsOk() throws IOException {
        Iterator<Object> responses = List.<Object>of("{\"id\": 123, \"name\": \"Alice\"}").iterator();

        Outcome<String> outcome = userApi().execute(() -> next(responses));

        assertThat(outcome.toOptional()).contains("{\"id\": 123, \"name\": \"Alice\"}");
        assertThat(events).isEmpty();
    }

    @Test
    void transientFailures_areRetriedUntilSuccess() throws IOException {
        Iterator<Object> responses = List.<Object>of(
                new HttpConnectTimeoutException("connect timed out"),
                new ServiceException("Throttled", "slow down"),
                "{\"id\": 123}").iterator();

        Outcome<String> outcome = userApi().execute(() -> next(responses));

        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(events).containsExactly("retry:connect-timeout#1", "retry:throttled#2");
    }

    @Test
    void missingUser_isSuppressedWithoutRetry() throws IOException {
        Iterator<Object> responses = List.<Object>of(new ServiceException("UserNotFound", "no user 123")).iterator();

        Outcome<String> outcome = userApi().execute(() -> next(responses));

        assertThat(outcome.getOrElse("{}")).isEqualTo("{}");
        assertThat(events).containsExactly("suppressed:not-found#1");
    }

    @Test
    void persistentTimeout_propagatesAfterAllAttempts() {
        HttpConnectTimeoutException last = new HttpConnectTimeoutException("connect timed out (4)");
        Iterator<Object> responses = List.<Object>of(
                new HttpConnectTimeoutException("connect timed out (1)"),
                new HttpConnectTimeoutException("connect timed out (2)"),
                new HttpConnectTimeoutException("connect timed out (3)"),
                last).iterator();

        assertThatThrownBy(() -> userApi().execute(() -> next(responses))).isSameAs(last);
        assertThat(events).containsExactly(
                "retry:connect-timeout#1",
                "retry:connect-timeout#2",
                "retry:connect-timeout#3",
                "propagated:EXHAUSTED#4");
    }

    @Test
    void unclassifiedFailure_propagatesImmediately() {
        IOException refused = new IOException("connection refused");
        Iterator<Object> responses = List.<Object>of(refused, "never reached").iterator();

        assertThatThrownBy(() -> userApi().execute(() -> next(responses))).isSameAs(refused);
        assertThat(events).containsExactly("propagated:UNMATCHED#1");
    }
}

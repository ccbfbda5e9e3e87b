package org.javai.retry.ops.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.retry.CodedException;
import org.javai.retry.Disposition;
import org.javai.retry.ServiceException;
import org.javai.retry.engine.RetryExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.helpers.AbstractLogger;
import org.slf4j.helpers.MessageFormatter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MetricsRetryReporterTest {

	private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-01-20T10:30:00Z"), ZoneOffset.UTC);

	private final ObjectMapper objectMapper = new ObjectMapper();
	private List<String> capturedMessages;
	private CapturingLogger capturingLogger;
	private MetricsRetryReporter reporter;

	@BeforeEach
	void setUp() {
		capturedMessages = new ArrayList<>();
		capturingLogger = new CapturingLogger(capturedMessages);
		reporter = new MetricsRetryReporter(null, capturingLogger, FIXED_CLOCK);
	}

	private JsonNode onlyEvent() throws IOException {
		assertThat(capturedMessages).hasSize(1);
		return objectMapper.readTree(capturedMessages.get(0));
	}

	@Test
	void reportRetry_emitsRetryEventAsJsonLine() throws IOException {
		reporter.reportRetry("UserApi.fetch", new CodedException(503), 2, "throttled", Duration.ofMillis(47));

		JsonNode event = onlyEvent();
		assertThat(event.get("eventType").asText()).isEqualTo("retry");
		assertThat(event.get("timestamp").asText()).isEqualTo("2024-01-20T10:30:00Z");
		assertThat(event.get("trackingKey").asText()).isEqualTo("UserApi.fetch");
		assertThat(event.get("attemptNumber").asText()).isEqualTo("2");
		assertThat(event.get("handler").asText()).isEqualTo("throttled");
		assertThat(event.get("delayMs").asText()).isEqualTo("47");
		assertThat(event.get("failureType").asText()).isEqualTo(CodedException.class.getName());
		assertThat(event.get("code").asText()).isEqualTo("503");
	}

	@Test
	void reportSuppressed_emitsSuppressedEvent() throws IOException {
		reporter.reportSuppressed("S3.get", new ServiceException("NoSuchKey", "missing"), 1, "missing-key");

		JsonNode event = onlyEvent();
		assertThat(event.get("eventType").asText()).isEqualTo("suppressed");
		assertThat(event.get("handler").asText()).isEqualTo("missing-key");
		assertThat(event.get("code").asText()).isEqualTo("NoSuchKey");
	}

	@Test
	void reportPropagated_includesReason() throws IOException {
		reporter.reportPropagated("S3.get", new IOException("reset"), 4, Disposition.Reason.EXHAUSTED);

		JsonNode event = onlyEvent();
		assertThat(event.get("eventType").asText()).isEqualTo("propagated");
		assertThat(event.get("reason").asText()).isEqualTo("EXHAUSTED");
		assertThat(event.get("attemptNumber").asText()).isEqualTo("4");
		assertThat(event.has("code")).isFalse();
	}

	@Test
	void reportPredicateFailure_namesPredicateError() throws IOException {
		reporter.reportPredicateFailure("S3.get", new IOException("reset"), "by-code", new ClassCastException());

		JsonNode event = onlyEvent();
		assertThat(event.get("eventType").asText()).isEqualTo("predicate_failure");
		assertThat(event.get("predicateError").asText()).isEqualTo(ClassCastException.class.getName());
	}

	@Test
	void namespace_isPrependedToTrackingKey() throws IOException {
		MetricsRetryReporter namespaced = new MetricsRetryReporter(" myapp ", capturingLogger, FIXED_CLOCK);

		namespaced.reportRetry("order.fetch", new CodedException(1), 1, "retry", Duration.ZERO);

		assertThat(onlyEvent().get("trackingKey").asText()).isEqualTo("myapp.order.fetch");
	}

	@Test
	void blankNamespace_usesOperationOnly() {
		MetricsRetryReporter blank = new MetricsRetryReporter("  ", capturingLogger, FIXED_CLOCK);

		assertThat(blank.buildTrackingKey("order.fetch")).isEqualTo("order.fetch");
	}

	@Test
	void specialCharacters_areEscaped() throws IOException {
		reporter.reportSuppressed("op \"quoted\"\n", new CodedException("tab\there"), 1, "back\\slash");

		JsonNode event = onlyEvent();
		assertThat(event.get("trackingKey").asText()).isEqualTo("op \"quoted\"\n");
		assertThat(event.get("code").asText()).isEqualTo("tab\there");
		assertThat(event.get("handler").asText()).isEqualTo("back\\slash");
	}

	@Test
	void escapeJson_handlesNull() {
		assertThat(MetricsRetryReporter.escapeJson(null)).isEmpty();
	}

	@Test
	void failingLogger_doesNotPropagate() {
		MetricsRetryReporter failing = new MetricsRetryReporter(null, new ThrowingLogger(), FIXED_CLOCK);

		assertThatCode(() -> failing.reportRetry("op", new CodedException(1), 1, "retry", Duration.ZERO))
			.doesNotThrowAnyException();
	}

	@Test
	void executorEvents_formOneJsonLinePerDecision() throws Exception {
		RetryExecutor executor = RetryExecutor.builder()
			.name("Inventory.reserve")
			.maxAttempts(3)
			.retryIf(failure -> failure instanceof CodedException)
			.reporter(reporter)
			.build();

		assertThatThrownBy(() -> executor.execute(() -> {
			throw new CodedException(409);
		})).isInstanceOf(CodedException.class);

		assertThat(capturedMessages).hasSize(3);
		List<String> eventTypes = new ArrayList<>();
		for (String line : capturedMessages) {
			JsonNode event = objectMapper.readTree(line);
			assertThat(event.get("trackingKey").asText()).isEqualTo("Inventory.reserve");
			eventTypes.add(event.get("eventType").asText());
		}
		assertThat(eventTypes).containsExactly("retry", "retry", "propagated");
	}

	/**
	 * Collects formatted INFO messages.
	 */
	private static class CapturingLogger extends AbstractLogger {

		private final List<String> messages;

		CapturingLogger(List<String> messages) {
			this.name = "capturing";
			this.messages = messages;
		}

		@Override
		protected String getFullyQualifiedCallerName() {
			return null;
		}

		@Override
		protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
				Object[] arguments, Throwable throwable) {
			messages.add(MessageFormatter.arrayFormat(messagePattern, arguments).getMessage());
		}

		@Override
		public boolean isTraceEnabled() { return false; }

		@Override
		public boolean isTraceEnabled(Marker marker) { return false; }

		@Override
		public boolean isDebugEnabled() { return false; }

		@Override
		public boolean isDebugEnabled(Marker marker) { return false; }

		@Override
		public boolean isInfoEnabled() { return true; }

		@Override
		public boolean isInfoEnabled(Marker marker) { return true; }

		@Override
		public boolean isWarnEnabled() { return false; }

		@Override
		public boolean isWarnEnabled(Marker marker) { return false; }

		@Override
		public boolean isErrorEnabled() { return false; }

		@Override
		public boolean isErrorEnabled(Marker marker) { return false; }
	}

	/**
	 * A logger that throws exceptions for testing exception handling.
	 */
	private static class ThrowingLogger extends CapturingLogger {
		ThrowingLogger() {
			super(new ArrayList<>());
		}

		@Override
		protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
				Object[] arguments, Throwable throwable) {
			throw new RuntimeException("Simulated logging failure");
		}
	}
}

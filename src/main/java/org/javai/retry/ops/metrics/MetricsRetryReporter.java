package org.javai.retry.ops.metrics;

import org.javai.retry.Disposition;
import org.javai.retry.Failures;
import org.javai.retry.ops.RetryReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.function.Supplier;

/**
 * Reports retry decisions as JSON-lines metrics via SLF4J.
 *
 * <p>Outputs one JSON object per event, suitable for metrics aggregation. The
 * {@code trackingKey} is the operation name, prefixed with a configurable namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.UserApi.fetch","attemptNumber":"1","handler":"throttled","delayMs":"47","failureType":"java.net.SocketTimeoutException"}
 * }</pre>
 *
 * <p>Reporting never breaks the caller: serialization or logging errors are dropped.</p>
 */
public class MetricsRetryReporter implements RetryReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.retry.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a MetricsRetryReporter with no namespace and the default logger.
	 */
	public MetricsRetryReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsRetryReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsRetryReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsRetryReporter with the specified namespace and custom logger name.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsRetryReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsRetryReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void reportRetry(String operation, Exception failure, int attemptNumber, String handler, Duration delay) {
		emit(() -> {
			StringBuilder sb = start("retry", operation);
			appendField(sb, "attemptNumber", String.valueOf(attemptNumber));
			appendField(sb, "handler", handler);
			appendField(sb, "delayMs", String.valueOf(delay.toMillis()));
			return finish(sb, failure);
		});
	}

	@Override
	public void reportSuppressed(String operation, Exception failure, int attemptNumber, String handler) {
		emit(() -> {
			StringBuilder sb = start("suppressed", operation);
			appendField(sb, "attemptNumber", String.valueOf(attemptNumber));
			appendField(sb, "handler", handler);
			return finish(sb, failure);
		});
	}

	@Override
	public void reportPropagated(String operation, Exception failure, int attemptNumber, Disposition.Reason reason) {
		emit(() -> {
			StringBuilder sb = start("propagated", operation);
			appendField(sb, "attemptNumber", String.valueOf(attemptNumber));
			appendField(sb, "reason", reason.name());
			return finish(sb, failure);
		});
	}

	@Override
	public void reportPredicateFailure(String operation, Exception failure, String handler, Throwable predicateError) {
		emit(() -> {
			StringBuilder sb = start("predicate_failure", operation);
			appendField(sb, "handler", handler);
			appendField(sb, "predicateError", predicateError.getClass().getName());
			return finish(sb, failure);
		});
	}

	String buildTrackingKey(String operation) {
		if (namespace == null || namespace.isEmpty()) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private void emit(Supplier<String> event) {
		try {
			logger.info(event.get());
		} catch (Exception e) {
			// Reporting should not break the application
		}
	}

	private StringBuilder start(String eventType, String operation) {
		StringBuilder sb = new StringBuilder("{");
		sb.append("\"eventType\":\"").append(escapeJson(eventType)).append("\"");
		appendField(sb, "timestamp", ISO_FORMATTER.format(clock.instant()));
		appendField(sb, "trackingKey", buildTrackingKey(operation));
		return sb;
	}

	private String finish(StringBuilder sb, Exception failure) {
		appendField(sb, "failureType", failure.getClass().getName());
		Failures.code(failure).ifPresent(code -> appendField(sb, "code", code));
		return sb.append("}").toString();
	}

	private static void appendField(StringBuilder sb, String key, String value) {
		sb.append(",\"").append(key).append("\":\"").append(escapeJson(value)).append("\"");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	static String escapeJson(String s) {
		if (s == null) {
			return "";
		}
		return s.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("\n", "\\n")
				.replace("\r", "\\r")
				.replace("\t", "\\t");
	}
}

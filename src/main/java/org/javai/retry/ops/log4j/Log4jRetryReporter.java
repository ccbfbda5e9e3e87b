package org.javai.retry.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.retry.Disposition;
import org.javai.retry.Failures;
import org.javai.retry.config.ConfigSupport;
import org.javai.retry.ops.RetryReporter;

import java.time.Duration;

/**
 * Reports retry decisions using Log4j2 logging.
 *
 * <p>Events are logged with a marker per decision and a level reflecting how much
 * attention the event deserves:
 * <ul>
 *   <li>retry, suppressed → INFO</li>
 *   <li>propagated after exhausting attempts or on interruption → WARN</li>
 *   <li>propagated because no handler matched → DEBUG (the caller receives the exception)</li>
 *   <li>predicate failure → DEBUG, with the predicate's exception attached</li>
 * </ul>
 */
public class Log4jRetryReporter implements RetryReporter {

	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker SUPPRESSED_MARKER = MarkerManager.getMarker("SUPPRESSED");
	static final Marker PROPAGATED_MARKER = MarkerManager.getMarker("PROPAGATED");
	static final Marker PREDICATE_FAILURE_MARKER = MarkerManager.getMarker("PREDICATE_FAILURE");

	private final Logger logger;

	/**
	 * Creates a Log4jRetryReporter using the default logger name.
	 */
	public Log4jRetryReporter() {
		this(LogManager.getLogger("org.javai.retry.RetryReporter"));
	}

	/**
	 * Creates a Log4jRetryReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jRetryReporter(String loggerName) {
		this(LogManager.getLogger(ConfigSupport.requireNonEmpty(loggerName, "loggerName")));
	}

	/**
	 * Creates a Log4jRetryReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jRetryReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportRetry(String operation, Exception failure, int attemptNumber, String handler, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Attempt {} of operation [{}] failed, retrying via handler [{}] after {} ms. {}",
				attemptNumber,
				operation,
				handler,
				delay.toMillis(),
				describe(failure));
	}

	@Override
	public void reportSuppressed(String operation, Exception failure, int attemptNumber, String handler) {
		logger.atInfo()
			.withMarker(SUPPRESSED_MARKER)
			.log("Attempt {} of operation [{}] failed, ignored via handler [{}]. {}",
				attemptNumber,
				operation,
				handler,
				describe(failure));
	}

	@Override
	public void reportPropagated(String operation, Exception failure, int attemptNumber, Disposition.Reason reason) {
		logger.atLevel(levelFor(reason))
			.withMarker(PROPAGATED_MARKER)
			.log("Attempt {} of operation [{}] failed, propagating ({}). {}",
				attemptNumber,
				operation,
				reason,
				describe(failure));
	}

	@Override
	public void reportPredicateFailure(String operation, Exception failure, String handler, Throwable predicateError) {
		logger.atDebug()
			.withMarker(PREDICATE_FAILURE_MARKER)
			.withThrowable(predicateError)
			.log("Predicate of handler [{}] in operation [{}] threw while classifying {}; treated as no match",
				handler,
				operation,
				failure.getClass().getName());
	}

	static String describe(Exception failure) {
		StringBuilder sb = new StringBuilder("Failure: ").append(failure.getClass().getName());
		Failures.code(failure).ifPresent(code -> sb.append(", code=").append(code));
		if (failure.getMessage() != null) {
			sb.append(", message=").append(failure.getMessage());
		}
		return sb.toString();
	}

	private static Level levelFor(Disposition.Reason reason) {
		return switch (reason) {
			case EXHAUSTED, INTERRUPTED -> Level.WARN;
			case UNMATCHED -> Level.DEBUG;
		};
	}
}

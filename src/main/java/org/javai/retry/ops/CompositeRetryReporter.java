package org.javai.retry.ops;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.retry.Disposition;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * A {@link RetryReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is caught and logged, allowing remaining reporters to execute.
 *
 * <p>Example usage:
 * <pre>{@code
 * RetryReporter reporter = CompositeRetryReporter.of(
 *     new Log4jRetryReporter(),
 *     new MetricsRetryReporter("orders")
 * );
 *
 * // Or using the builder for more control:
 * RetryReporter reporter = CompositeRetryReporter.builder()
 *     .add(new Log4jRetryReporter())
 *     .addIf(metricsEnabled, new MetricsRetryReporter("orders"))
 *     .build();
 * }</pre>
 */
public final class CompositeRetryReporter implements RetryReporter {

	private static final Logger LOGGER = LogManager.getLogger(CompositeRetryReporter.class);

	private final List<RetryReporter> reporters;

	private CompositeRetryReporter(List<RetryReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeRetryReporter of(RetryReporter... reporters) {
		return new CompositeRetryReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeRetryReporter of(Collection<? extends RetryReporter> reporters) {
		return new CompositeRetryReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void reportRetry(String operation, Exception failure, int attemptNumber, String handler, Duration delay) {
		fanOut("reportRetry", reporter -> reporter.reportRetry(operation, failure, attemptNumber, handler, delay));
	}

	@Override
	public void reportSuppressed(String operation, Exception failure, int attemptNumber, String handler) {
		fanOut("reportSuppressed", reporter -> reporter.reportSuppressed(operation, failure, attemptNumber, handler));
	}

	@Override
	public void reportPropagated(String operation, Exception failure, int attemptNumber, Disposition.Reason reason) {
		fanOut("reportPropagated", reporter -> reporter.reportPropagated(operation, failure, attemptNumber, reason));
	}

	@Override
	public void reportPredicateFailure(String operation, Exception failure, String handler, Throwable predicateError) {
		fanOut("reportPredicateFailure", reporter -> reporter.reportPredicateFailure(operation, failure, handler, predicateError));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<RetryReporter> call) {
		for (RetryReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (RuntimeException e) {
				LOGGER.warn("RetryReporter.{} failed for {}", method, reporter.getClass().getName(), e);
			}
		}
	}

	/**
	 * Builder for creating a {@link CompositeRetryReporter}.
	 */
	public static final class Builder {
		private final List<RetryReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter to the composite. Null is ignored.
		 */
		public Builder add(RetryReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		public Builder addAll(Collection<? extends RetryReporter> reporters) {
			for (RetryReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Conditionally adds a reporter based on a flag.
		 */
		public Builder addIf(boolean condition, RetryReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeRetryReporter build() {
			return new CompositeRetryReporter(reporters);
		}
	}
}

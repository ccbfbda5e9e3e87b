package org.javai.retry.config;

import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves configuration from system properties, falling back to environment variables.
 */
public final class ConfigSupport {

	private ConfigSupport() {
		// Utility class
	}

	/**
	 * Resolves a value that may be absent. Blank values count as absent.
	 */
	public static Optional<String> resolveOptional(String sysProp, String envVar) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(value.trim());
	}

	/**
	 * Resolves and converts a value that may be absent.
	 *
	 * @throws IllegalStateException if the value is present but cannot be converted
	 */
	public static <T> Optional<T> resolveOptional(String sysProp, String envVar, Function<String, T> parser) {
		return resolveOptional(sysProp, envVar).map(raw -> {
			try {
				return parser.apply(raw);
			} catch (RuntimeException e) {
				throw new IllegalStateException(
					"Invalid value '" + raw + "' for system property '" + sysProp +
					"' or environment variable '" + envVar + "'", e);
			}
		});
	}

	/**
	 * Validates that a value is not null or blank.
	 *
	 * @param value the value to check
	 * @param name the name of the parameter (for error messages)
	 * @return the value if valid
	 * @throws IllegalArgumentException if value is null or blank
	 */
	public static String requireNonEmpty(String value, String name) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException(name + " must not be null or empty");
		}
		return value;
	}
}

package org.javai.retry.backoff;

import org.javai.retry.config.ConfigSupport;

import java.time.Duration;
import java.util.Objects;

/**
 * Parameters of the delayed-retry schedule.
 *
 * <p>Before each delayed retry the engine waits {@code delay × jitter}, with jitter drawn
 * uniformly from {@code [jitterMin, jitterMax)}, then multiplies {@code delay} by
 * {@code multiplier} for the next delayed retry. {@code delay} starts at
 * {@code baseDelay} for every invocation.</p>
 *
 * <p>Defaults: 50 ms base delay, multiplier 10, jitter {@code [0.8, 1.2)}, no cap.</p>
 *
 * @param baseDelay delay before the first delayed retry, at most {@link #MAX_REPRESENTABLE_DELAY}
 * @param multiplier growth factor applied after each delayed retry (must be >= 1)
 * @param jitterMin lower bound of the jitter factor, inclusive
 * @param jitterMax upper bound of the jitter factor, exclusive unless equal to jitterMin
 * @param maxDelay cap on the un-jittered delay, or null for no cap
 */
public record BackoffSettings(
        Duration baseDelay,
        double multiplier,
        double jitterMin,
        double jitterMax,
        Duration maxDelay
) {
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(50);
    public static final double DEFAULT_MULTIPLIER = 10.0;
    public static final double DEFAULT_JITTER_MIN = 0.8;
    public static final double DEFAULT_JITTER_MAX = 1.2;

    /**
     * Longest delay the schedule can represent, {@code Long.MAX_VALUE} nanoseconds (about 292 years).
     */
    public static final Duration MAX_REPRESENTABLE_DELAY = Duration.ofNanos(Long.MAX_VALUE);

    static final String BASE_DELAY_PROPERTY = "javai.retry.backoff.base-delay-ms";
    static final String BASE_DELAY_ENV = "JAVAI_RETRY_BACKOFF_BASE_DELAY_MS";
    static final String MULTIPLIER_PROPERTY = "javai.retry.backoff.multiplier";
    static final String MULTIPLIER_ENV = "JAVAI_RETRY_BACKOFF_MULTIPLIER";
    static final String JITTER_MIN_PROPERTY = "javai.retry.backoff.jitter-min";
    static final String JITTER_MIN_ENV = "JAVAI_RETRY_BACKOFF_JITTER_MIN";
    static final String JITTER_MAX_PROPERTY = "javai.retry.backoff.jitter-max";
    static final String JITTER_MAX_ENV = "JAVAI_RETRY_BACKOFF_JITTER_MAX";
    static final String MAX_DELAY_PROPERTY = "javai.retry.backoff.max-delay-ms";
    static final String MAX_DELAY_ENV = "JAVAI_RETRY_BACKOFF_MAX_DELAY_MS";

    private static final BackoffSettings DEFAULTS = new BackoffSettings(
            DEFAULT_BASE_DELAY, DEFAULT_MULTIPLIER, DEFAULT_JITTER_MIN, DEFAULT_JITTER_MAX, null);

    public BackoffSettings {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative, was: " + baseDelay);
        }
        if (baseDelay.compareTo(MAX_REPRESENTABLE_DELAY) > 0) {
            throw new IllegalArgumentException(
                    "baseDelay must not exceed " + MAX_REPRESENTABLE_DELAY + ", was: " + baseDelay);
        }
        if (!(multiplier >= 1.0) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("multiplier must be a finite value >= 1, was: " + multiplier);
        }
        if (!(jitterMin >= 0.0) || !(jitterMax >= jitterMin) || Double.isInfinite(jitterMax)) {
            throw new IllegalArgumentException(
                    "jitter range must satisfy 0 <= jitterMin <= jitterMax, was: [" + jitterMin + ", " + jitterMax + ")");
        }
        if (maxDelay != null && maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must not be negative, was: " + maxDelay);
        }
        if (maxDelay != null && maxDelay.compareTo(MAX_REPRESENTABLE_DELAY) > 0) {
            throw new IllegalArgumentException(
                    "maxDelay must not exceed " + MAX_REPRESENTABLE_DELAY + ", was: " + maxDelay);
        }
    }

    public static BackoffSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Builds settings from system properties or environment variables, using the
     * defaults for anything not set.
     *
     * <ul>
     *   <li>{@code javai.retry.backoff.base-delay-ms} / {@code JAVAI_RETRY_BACKOFF_BASE_DELAY_MS}</li>
     *   <li>{@code javai.retry.backoff.multiplier} / {@code JAVAI_RETRY_BACKOFF_MULTIPLIER}</li>
     *   <li>{@code javai.retry.backoff.jitter-min} / {@code JAVAI_RETRY_BACKOFF_JITTER_MIN}</li>
     *   <li>{@code javai.retry.backoff.jitter-max} / {@code JAVAI_RETRY_BACKOFF_JITTER_MAX}</li>
     *   <li>{@code javai.retry.backoff.max-delay-ms} / {@code JAVAI_RETRY_BACKOFF_MAX_DELAY_MS}</li>
     * </ul>
     *
     * @throws IllegalStateException if a configured value cannot be parsed
     * @throws IllegalArgumentException if the configured values are inconsistent
     */
    public static BackoffSettings fromEnvironment() {
        return new BackoffSettings(
                ConfigSupport.resolveOptional(BASE_DELAY_PROPERTY, BASE_DELAY_ENV, BackoffSettings::millis)
                        .orElse(DEFAULT_BASE_DELAY),
                ConfigSupport.resolveOptional(MULTIPLIER_PROPERTY, MULTIPLIER_ENV, Double::parseDouble)
                        .orElse(DEFAULT_MULTIPLIER),
                ConfigSupport.resolveOptional(JITTER_MIN_PROPERTY, JITTER_MIN_ENV, Double::parseDouble)
                        .orElse(DEFAULT_JITTER_MIN),
                ConfigSupport.resolveOptional(JITTER_MAX_PROPERTY, JITTER_MAX_ENV, Double::parseDouble)
                        .orElse(DEFAULT_JITTER_MAX),
                ConfigSupport.resolveOptional(MAX_DELAY_PROPERTY, MAX_DELAY_ENV, BackoffSettings::millis)
                        .orElse(null)
        );
    }

    public BackoffSettings withBaseDelay(Duration baseDelay) {
        return new BackoffSettings(baseDelay, multiplier, jitterMin, jitterMax, maxDelay);
    }

    public BackoffSettings withMultiplier(double multiplier) {
        return new BackoffSettings(baseDelay, multiplier, jitterMin, jitterMax, maxDelay);
    }

    public BackoffSettings withJitter(double jitterMin, double jitterMax) {
        return new BackoffSettings(baseDelay, multiplier, jitterMin, jitterMax, maxDelay);
    }

    public BackoffSettings withMaxDelay(Duration maxDelay) {
        return new BackoffSettings(baseDelay, multiplier, jitterMin, jitterMax, maxDelay);
    }

    /**
     * Longest possible wait before the {@code n}th delayed retry (1-based).
     */
    public Duration worstCaseWait(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be >= 1, was: " + n);
        }
        Duration delay = baseDelay;
        for (int i = 1; i < n; i++) {
            delay = Backoff.scale(delay, multiplier, maxDelay);
        }
        return Backoff.scale(delay, jitterMax, null);
    }

    private static Duration millis(String raw) {
        return Duration.ofMillis(Long.parseLong(raw));
    }
}

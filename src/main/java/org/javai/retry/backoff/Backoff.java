package org.javai.retry.backoff;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Computes and applies the wait before a delayed retry.
 *
 * <p>Stateless: the current delay lives in the caller's per-invocation state and is
 * passed in, so one instance can serve concurrent invocations.</p>
 */
public final class Backoff {

    private final BackoffSettings settings;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    /**
     * @param settings the schedule parameters
     * @param sleeper how to wait
     * @param random uniform source of values in {@code [0, 1)}
     */
    public Backoff(BackoffSettings settings, Sleeper sleeper, DoubleSupplier random) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public static Backoff of(BackoffSettings settings) {
        return new Backoff(settings, Sleeper.threadSleep(), () -> ThreadLocalRandom.current().nextDouble());
    }

    public static Backoff defaults() {
        return of(BackoffSettings.defaults());
    }

    /**
     * The delay every invocation starts from.
     */
    public Duration initialDelay() {
        return settings.baseDelay();
    }

    /**
     * Waits {@code delay × jitter}.
     *
     * @param delay the current un-jittered delay
     * @return the duration actually requested from the sleeper
     * @throws InterruptedException if the wait is interrupted
     */
    public Duration pause(Duration delay) throws InterruptedException {
        Duration wait = jittered(delay);
        sleeper.sleep(wait);
        return wait;
    }

    /**
     * The delay to use for the delayed retry after one that used {@code delay}.
     */
    public Duration next(Duration delay) {
        return scale(delay, settings.multiplier(), settings.maxDelay());
    }

    Duration jittered(Duration delay) {
        double span = settings.jitterMax() - settings.jitterMin();
        double jitter = settings.jitterMin() + span * random.getAsDouble();
        return scale(delay, jitter, null);
    }

    static Duration scale(Duration delay, double factor, Duration cap) {
        double nanos = delay.toNanos() * factor;
        Duration scaled = nanos >= Long.MAX_VALUE ? Duration.ofNanos(Long.MAX_VALUE) : Duration.ofNanos(Math.round(nanos));
        if (cap != null && scaled.compareTo(cap) > 0) {
            return cap;
        }
        return scaled;
    }
}

package io.horde.core.wait;

import io.horde.api.ConfigurationException;
import io.horde.api.profile.WaitTime;

import java.time.Duration;
import java.util.random.RandomGenerator;

/**
 * Draws the pause a virtual user takes between two tasks, uniformly in {@code [min, max]}.
 * <p>
 * Each virtual user owns its provider; the generator is not shared between threads.
 */
public final class WaitTimeProvider {

    private final RandomGenerator random;

    public WaitTimeProvider(RandomGenerator random) {
        this.random = random;
    }

    public Duration next(WaitTime waitTime) {
        return next(waitTime.min(), waitTime.max());
    }

    /**
     * @return a duration uniformly distributed in {@code [min, max]} at millisecond resolution
     * @throws ConfigurationException if the bounds are negative or inverted
     */
    public Duration next(Duration min, Duration max) {
        if (min == null || max == null || min.isNegative() || max.isNegative()) {
            throw new ConfigurationException("Wait bounds must not be negative");
        }
        if (min.compareTo(max) > 0) {
            throw new ConfigurationException("Wait min " + min + " exceeds max " + max);
        }
        long minMs = min.toMillis();
        long maxMs = max.toMillis();
        if (minMs == maxMs) {
            return Duration.ofMillis(minMs);
        }
        return Duration.ofMillis(random.nextLong(minMs, maxMs + 1));
    }
}

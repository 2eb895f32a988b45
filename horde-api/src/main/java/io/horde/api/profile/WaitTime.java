package io.horde.api.profile;

import io.horde.api.ConfigurationException;

import java.time.Duration;

/**
 * Bounds of the randomized pause a virtual user takes between two tasks.
 * Without pauses, users loop at maximum speed which doesn't reflect real traffic.
 */
public record WaitTime(Duration min, Duration max) {

    public WaitTime {
        if (min == null || max == null) {
            throw new ConfigurationException("Wait time bounds must not be null");
        }
        if (min.isNegative()) {
            throw new ConfigurationException("Wait time must not be negative");
        }
        if (min.compareTo(max) > 0) {
            throw new ConfigurationException("min must be <= max");
        }
    }

    /**
     * Random pause between min and max (uniform distribution).
     */
    public static WaitTime between(Duration min, Duration max) {
        return new WaitTime(min, max);
    }

    public static WaitTime constant(Duration value) {
        return new WaitTime(value, value);
    }

    public static WaitTime none() {
        return new WaitTime(Duration.ZERO, Duration.ZERO);
    }

    public boolean isNone() {
        return max.isZero();
    }
}

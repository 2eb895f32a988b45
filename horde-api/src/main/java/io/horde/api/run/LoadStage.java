package io.horde.api.run;

import io.horde.api.ConfigurationException;

import java.time.Duration;

/**
 * One step of a load shape: ramp linearly to {@code target} users over {@code duration}.
 * A stage whose target equals the current population holds it for the duration.
 */
public record LoadStage(Duration duration, int target) {

    public LoadStage {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new ConfigurationException("Stage duration must be positive");
        }
        if (target < 0) {
            throw new ConfigurationException("Stage target must not be negative");
        }
    }

    public static LoadStage of(Duration duration, int target) {
        return new LoadStage(duration, target);
    }
}

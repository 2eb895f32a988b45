package io.horde.api.stats;

import io.horde.api.ConfigurationException;

import java.time.Duration;

/**
 * Pass/fail criterion evaluated against a snapshot at the end of a run.
 * A {@code null} category means the aggregated total.
 */
public sealed interface Threshold {

    String category();

    /**
     * @return the same threshold applied to a single category
     */
    Threshold forCategory(String category);

    static Threshold p95Below(Duration limit) {
        return new P95Below(null, limit);
    }

    static Threshold failureRateBelow(double maxRate) {
        return new FailureRateBelow(null, maxRate);
    }

    /**
     * 95% of requests must complete faster than the limit.
     */
    record P95Below(String category, Duration limit) implements Threshold {
        public P95Below {
            if (limit == null || limit.isNegative() || limit.isZero()) {
                throw new ConfigurationException("p95 limit must be positive");
            }
        }

        @Override
        public Threshold forCategory(String category) {
            return new P95Below(category, limit);
        }

        @Override
        public String toString() {
            return "p(95)<" + limit.toMillis() + "ms" + (category == null ? "" : " [" + category + "]");
        }
    }

    /**
     * The failure rate must stay below the given fraction.
     */
    record FailureRateBelow(String category, double maxRate) implements Threshold {
        public FailureRateBelow {
            if (maxRate <= 0.0 || maxRate > 1.0) {
                throw new ConfigurationException("Failure rate limit must be in (0, 1]");
            }
        }

        @Override
        public Threshold forCategory(String category) {
            return new FailureRateBelow(category, maxRate);
        }

        @Override
        public String toString() {
            return "rate<" + maxRate + (category == null ? "" : " [" + category + "]");
        }
    }
}

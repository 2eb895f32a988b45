package io.horde.api.stats;

/**
 * Point-in-time rollup of one statistics category.
 * {@code count} includes every recorded outcome, cancelled ones too;
 * {@code failureRate} is {@code failureCount / count}.
 */
public record CategoryStats(
        String name,
        long count,
        long successCount,
        long failureCount,
        long expectedFailureCount,
        long cancelledCount,
        double failureRate,
        double avgLatencyMs,
        double minLatencyMs,
        double maxLatencyMs,
        double p50LatencyMs,
        double p95LatencyMs,
        double p99LatencyMs,
        double throughputPerSec
) {

    public static CategoryStats empty(String name) {
        return new CategoryStats(name, 0, 0, 0, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
    }
}

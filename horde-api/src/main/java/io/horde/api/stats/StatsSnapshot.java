package io.horde.api.stats;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Copy of the statistics at a point in time: one rollup per category plus the aggregated total.
 */
public record StatsSnapshot(
        Instant timestamp,
        Duration elapsed,
        int activeUsers,
        Map<String, CategoryStats> categories,
        CategoryStats total
) {

    public static final String TOTAL = "Aggregated";

    public StatsSnapshot {
        categories = Map.copyOf(categories);
    }

    public static StatsSnapshot empty(Instant timestamp) {
        return new StatsSnapshot(timestamp, Duration.ZERO, 0, Map.of(), CategoryStats.empty(TOTAL));
    }

    public Optional<CategoryStats> category(String name) {
        return Optional.ofNullable(categories.get(name));
    }

    public long totalCount() {
        return total.count();
    }
}

package io.horde.api.run;

import io.horde.api.stats.StatsSnapshot;
import io.horde.api.stats.ThresholdResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Complete result of a load test run.
 */
public record RunResult(
        Instant startTime,
        Instant endTime,
        Duration totalDuration,
        int configuredUsers,
        StatsSnapshot finalSnapshot,
        List<StatsSnapshot> timeSeriesSnapshots,
        List<ThresholdResult> thresholdResults,
        List<PartialRampException> rampFailures
) {

    public RunResult {
        timeSeriesSnapshots = List.copyOf(timeSeriesSnapshots);
        thresholdResults = List.copyOf(thresholdResults);
        rampFailures = List.copyOf(rampFailures);
    }

    public boolean thresholdsPassed() {
        return thresholdResults.stream().allMatch(ThresholdResult::passed);
    }
}

package io.horde.core.stats;

import io.horde.api.stats.CategoryStats;
import io.horde.api.stats.StatsSnapshot;
import io.horde.api.stats.Threshold;
import io.horde.api.stats.ThresholdResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates pass/fail thresholds against a statistics snapshot.
 * A threshold on a category that recorded nothing passes.
 */
public final class ThresholdEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ThresholdEvaluator.class);

    public List<ThresholdResult> evaluate(List<Threshold> thresholds, StatsSnapshot snapshot) {
        List<ThresholdResult> results = new ArrayList<>(thresholds.size());
        for (Threshold threshold : thresholds) {
            ThresholdResult result = evaluate(threshold, snapshot);
            if (result.passed()) {
                log.info("Threshold {} passed (observed {})", threshold, result.observed());
            } else {
                log.warn("Threshold {} crossed (observed {})", threshold, result.observed());
            }
            results.add(result);
        }
        return results;
    }

    public ThresholdResult evaluate(Threshold threshold, StatsSnapshot snapshot) {
        CategoryStats stats = threshold.category() == null
                ? snapshot.total()
                : snapshot.category(threshold.category()).orElseGet(() -> CategoryStats.empty(threshold.category()));

        if (threshold instanceof Threshold.P95Below p95) {
            double observed = stats.p95LatencyMs();
            return new ThresholdResult(threshold, observed, observed < p95.limit().toMillis());
        }
        if (threshold instanceof Threshold.FailureRateBelow rate) {
            double observed = stats.failureRate();
            return new ThresholdResult(threshold, observed, stats.count() == 0 || observed < rate.maxRate());
        }
        throw new IllegalArgumentException("Unsupported threshold: " + threshold);
    }
}

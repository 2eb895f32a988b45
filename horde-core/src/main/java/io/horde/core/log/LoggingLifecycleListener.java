package io.horde.core.log;

import io.horde.api.run.LifecycleListener;
import io.horde.api.stats.CategoryStats;
import io.horde.api.stats.StatsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Locale;

/**
 * Logs the start of a run and a summary of the final statistics.
 */
public class LoggingLifecycleListener implements LifecycleListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingLifecycleListener.class);

    @Override
    public void onTestStart(String targetHost, Instant timestamp) {
        log.info("Load test starting against {} at {}", targetHost, timestamp);
    }

    @Override
    public void onTestStop(StatsSnapshot finalSnapshot) {
        CategoryStats total = finalSnapshot.total();
        log.info("Load test finished after {}s", finalSnapshot.elapsed().toSeconds());
        log.info("Total requests: {}", total.count());
        log.info("Total failures: {}", total.failureCount());
        log.info("Average response time: {} ms", String.format(Locale.ROOT, "%.2f", total.avgLatencyMs()));
        log.info("Requests per second: {}", String.format(Locale.ROOT, "%.2f", total.throughputPerSec()));
        if (log.isDebugEnabled()) {
            finalSnapshot.categories().values().forEach(stats ->
                    log.debug("{}: {} requests, {} failures, p95 {} ms",
                            stats.name(), stats.count(), stats.failureCount(), stats.p95LatencyMs()));
        }
    }

    @Override
    public String toString() {
        return "LoggingLifecycleListener";
    }
}

package io.horde.api.stats;

import io.horde.api.classify.Classification;
import io.horde.api.outcome.RequestOutcome;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * The single aggregation point for request statistics of a run.
 * Must be safe under concurrent calls from all virtual users.
 */
public interface StatsAggregator {

    /**
     * Record one classified outcome under its category.
     *
     * @param outcome        the request outcome
     * @param classification the verdict for that outcome
     */
    void record(RequestOutcome outcome, Classification classification);

    /**
     * Record the current number of running virtual users of a profile.
     */
    void recordActiveUsers(String profileName, int count);

    /**
     * Take a point-in-time copy of all categories without blocking writers.
     */
    StatsSnapshot snapshot();

    /**
     * Clear all state. Called at run start: a new run starts from zero.
     */
    void reset();

    /**
     * Register a listener that receives snapshots at the configured interval.
     */
    void onSnapshot(Consumer<StatsSnapshot> listener);

    /**
     * Start periodic snapshots.
     */
    void start(Duration interval);

    /**
     * Stop periodic snapshots.
     */
    void stop();
}

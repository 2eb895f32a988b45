package io.horde.api.run;

import io.horde.api.stats.StatsSnapshot;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Handle to a running load test. Allows monitoring status and stopping the test.
 */
public interface LoadTestRun {

    /**
     * @return true while the run is ramping or running
     */
    boolean isRunning();

    /**
     * Stop the test: stop every pool, take the final snapshot and notify listeners.
     *
     * @return the final snapshot
     */
    StatsSnapshot stop();

    /**
     * @return future that completes when the test finishes
     */
    CompletableFuture<RunResult> result();

    /**
     * @return current number of running virtual users
     */
    int activeUsers();

    RunPhase phase();

    RunState runState();

    /**
     * @return the current statistics, without waiting for the end of the run
     */
    StatsSnapshot snapshot();

    /**
     * @return pools that could not reach their target population
     */
    List<PartialRampException> rampFailures();
}

package io.horde.api.run;

import io.horde.api.stats.StatsAggregator;
import io.horde.api.stats.StatsSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * The Orchestrator starts the load test, ramps every profile's pool to its
 * population, and owns the run state and the statistics of the run.
 * <p>
 * Only one run is active at a time; a new run starts from empty statistics.
 */
public interface Orchestrator {

    /**
     * Validate the loads, reset statistics, notify listeners and start ramping.
     *
     * @param loads  one entry per profile
     * @param target the service under test
     * @return a handle to monitor and control the running test
     * @throws io.horde.api.ConfigurationException if a profile, load or the target is invalid
     */
    LoadTestRun start(List<ProfileLoad> loads, TargetDescriptor target);

    /**
     * Stop the current run.
     *
     * @return the final snapshot
     */
    StatsSnapshot stop();

    /**
     * @return the current (or last) run, if any was started
     */
    Optional<LoadTestRun> currentRun();

    void addListener(LifecycleListener listener);

    RunConfig config();

    StatsAggregator stats();
}

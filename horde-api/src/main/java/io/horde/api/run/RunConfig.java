package io.horde.api.run;

import io.horde.api.ConfigurationException;
import io.horde.api.stats.Threshold;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadFactory;

/**
 * Configuration for a load test run.
 * Controls stop behavior, run duration, tag filtering, seeding and the threading model.
 */
public final class RunConfig {

    private StopMode stopMode = StopMode.GRACEFUL;
    private Duration runDuration = null; // null = run until stopped
    private Duration stopGracePeriod = Duration.ofSeconds(10);
    private final Set<String> tagFilter = new LinkedHashSet<>();
    private Long seed = null; // null = unseeded
    private long maxIterationsPerUser = 0; // 0 = unlimited
    private int spawnRetryLimit = 3;
    private Duration metricsInterval = Duration.ofSeconds(1);
    private ThreadFactory threadFactory = null;
    private final List<Threshold> thresholds = new ArrayList<>();

    private RunConfig() {}

    public static RunConfig create() {
        return new RunConfig();
    }

    public RunConfig stopMode(StopMode stopMode) {
        if (stopMode == null) {
            throw new ConfigurationException("Stop mode must not be null");
        }
        this.stopMode = stopMode;
        return this;
    }

    /**
     * Stop the run automatically after this duration. Reaching it takes the same path as an explicit stop.
     */
    public RunConfig runDuration(Duration runDuration) {
        if (runDuration != null && (runDuration.isNegative() || runDuration.isZero())) {
            throw new ConfigurationException("Run duration must be positive");
        }
        this.runDuration = runDuration;
        return this;
    }

    /**
     * Time allowed for users to stop before they are force-terminated.
     */
    public RunConfig stopGracePeriod(Duration stopGracePeriod) {
        if (stopGracePeriod == null || stopGracePeriod.isNegative()) {
            throw new ConfigurationException("Stop grace period must not be negative");
        }
        this.stopGracePeriod = stopGracePeriod;
        return this;
    }

    /**
     * Only run tasks carrying one of these tags (untagged tasks always run).
     */
    public RunConfig tags(String... tags) {
        this.tagFilter.addAll(List.of(tags));
        return this;
    }

    /**
     * Seed all per-user random generators for a reproducible run.
     */
    public RunConfig seed(long seed) {
        this.seed = seed;
        return this;
    }

    public RunConfig maxIterationsPerUser(long maxIterationsPerUser) {
        if (maxIterationsPerUser < 0) {
            throw new ConfigurationException("Iteration cap must not be negative");
        }
        this.maxIterationsPerUser = maxIterationsPerUser;
        return this;
    }

    /**
     * Number of consecutive failed spawns a pool tolerates before it reports a partial ramp.
     */
    public RunConfig spawnRetryLimit(int spawnRetryLimit) {
        if (spawnRetryLimit < 0) {
            throw new ConfigurationException("Spawn retry limit must not be negative");
        }
        this.spawnRetryLimit = spawnRetryLimit;
        return this;
    }

    public RunConfig metricsInterval(Duration metricsInterval) {
        if (metricsInterval == null || metricsInterval.isNegative() || metricsInterval.isZero()) {
            throw new ConfigurationException("Metrics interval must be positive");
        }
        this.metricsInterval = metricsInterval;
        return this;
    }

    /**
     * Provide a custom thread factory for virtual user threads.
     */
    public RunConfig threadFactory(ThreadFactory threadFactory) {
        this.threadFactory = threadFactory;
        return this;
    }

    public RunConfig thresholds(Threshold... thresholds) {
        this.thresholds.addAll(List.of(thresholds));
        return this;
    }


    public StopMode stopMode() { return stopMode; }
    public Duration runDuration() { return runDuration; }
    public Duration stopGracePeriod() { return stopGracePeriod; }
    public Set<String> tagFilter() { return Collections.unmodifiableSet(tagFilter); }
    public Long seed() { return seed; }
    public long maxIterationsPerUser() { return maxIterationsPerUser; }
    public int spawnRetryLimit() { return spawnRetryLimit; }
    public Duration metricsInterval() { return metricsInterval; }
    public ThreadFactory threadFactory() { return threadFactory; }
    public List<Threshold> thresholds() { return Collections.unmodifiableList(thresholds); }
}

package io.horde.core.runtime;

import io.horde.api.executor.RequestExecutor;
import io.horde.api.run.LifecycleListener;
import io.horde.api.run.LoadStage;
import io.horde.api.run.LoadTestRun;
import io.horde.api.run.PartialRampException;
import io.horde.api.run.ProfileLoad;
import io.horde.api.run.RunConfig;
import io.horde.api.run.RunPhase;
import io.horde.api.run.RunResult;
import io.horde.api.run.RunState;
import io.horde.api.run.TargetDescriptor;
import io.horde.api.stats.StatsAggregator;
import io.horde.api.stats.StatsSnapshot;
import io.horde.api.stats.ThresholdResult;
import io.horde.core.pool.PoolManager;
import io.horde.core.pool.UserPool;
import io.horde.core.stats.ThresholdEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * The runtime engine that executes one load test.
 * <p>
 * Ramps one pool per profile, moves the run to RUNNING once every pool settled at its target,
 * applies load stages, records a statistics time series and stops either on request or when
 * the configured run duration is reached. Both ways take the same stop path.
 */
public class LoadTestRuntime implements LoadTestRun {

    private static final Logger log = LoggerFactory.getLogger(LoadTestRuntime.class);

    private final RunConfig config;
    private final List<ProfileLoad> loads;
    private final TargetDescriptor target;
    private final PoolManager poolManager;
    private final StatsAggregator stats;
    private final RequestExecutor executor;
    private final RunState runState;
    private final List<LifecycleListener> listeners;
    private final ThresholdEvaluator thresholdEvaluator = new ThresholdEvaluator();

    private final CompletableFuture<RunResult> resultFuture = new CompletableFuture<>();
    private final List<StatsSnapshot> allSnapshots = new CopyOnWriteArrayList<>();
    private final List<PartialRampException> rampFailures = new CopyOnWriteArrayList<>();
    private final Object stopLock = new Object();

    private ScheduledThreadPoolExecutor scheduler;
    private Instant startTime;
    private volatile StatsSnapshot finalSnapshot;

    public LoadTestRuntime(RunConfig config, List<ProfileLoad> loads, TargetDescriptor target,
                           PoolManager poolManager, StatsAggregator stats, RequestExecutor executor,
                           List<LifecycleListener> listeners) {
        this.config = config;
        this.loads = List.copyOf(loads);
        this.target = target;
        this.poolManager = poolManager;
        this.stats = stats;
        this.executor = executor;
        this.listeners = List.copyOf(listeners);
        this.runState = new RunState(target.host(), loads.stream().mapToInt(ProfileLoad::users).sum());
    }

    /**
     * Start the load test execution. Returns once every pool started ramping.
     */
    public void execute() {
        if (!runState.transition(RunPhase.IDLE, RunPhase.RAMPING)) {
            throw new IllegalStateException("Run already started: " + runState);
        }
        startTime = runState.startedAt();
        log.info("Starting load test against {}: {} users over {} profiles, duration: {}",
                target.host(), runState.totalUsersTarget(), loads.size(),
                config.runDuration() == null ? "until stopped" : config.runDuration().toSeconds() + "s");

        notifyStart();

        poolManager.initialize(loads, executor, stats, runState);
        stats.start(config.metricsInterval());

        // Scheduler for stages, the time series and the duration stop
        scheduler = new ScheduledThreadPoolExecutor(2, r -> {
            Thread t = new Thread(r, "horde-scheduler");
            t.setDaemon(true);
            return t;
        });
        scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);

        startRamp();
        scheduleStages();
        scheduleTimeSeries();
        scheduleRunCompletion();
    }

    private void startRamp() {
        List<CompletableFuture<Void>> ramps = new ArrayList<>();
        for (ProfileLoad load : loads) {
            UserPool pool = poolManager.pool(load.profile().name());
            ramps.add(pool.ramp(load.users(), load.spawnRate())
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            recordRampFailure(error);
                        }
                    }));
        }
        CompletableFuture.allOf(ramps.toArray(CompletableFuture[]::new))
                .whenComplete((ignored, error) -> {
                    if (runState.transition(RunPhase.RAMPING, RunPhase.RUNNING)) {
                        log.info("Ramp finished, load test running with {} users", activeUsers());
                    }
                });
    }

    private void recordRampFailure(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof PartialRampException partial) {
            rampFailures.add(partial);
            log.warn("Partial ramp: {}. The run continues with the reduced population.", partial.getMessage());
        } else {
            log.error("Ramp failed", cause);
        }
    }

    /**
     * Each stage starts after the initial ramp plus all previous stages and
     * ramps linearly from the previous target to its own.
     */
    private void scheduleStages() {
        for (ProfileLoad load : loads) {
            UserPool pool = poolManager.pool(load.profile().name());
            long offsetMs = load.initialRampMillis();
            int previous = load.users();
            for (LoadStage stage : load.stages()) {
                int delta = Math.abs(stage.target() - previous);
                double seconds = stage.duration().toMillis() / 1000.0;
                double rate = delta == 0 ? 1.0 : delta / seconds;
                scheduler.schedule(() -> applyStage(pool, stage, rate), offsetMs, TimeUnit.MILLISECONDS);
                offsetMs += stage.duration().toMillis();
                previous = stage.target();
            }
        }
    }

    private void applyStage(UserPool pool, LoadStage stage, double rate) {
        if (!isRunning()) {
            return;
        }
        try {
            log.info("Stage for '{}': {} users over {}s", pool.profileName(), stage.target(), stage.duration().toSeconds());
            pool.ramp(stage.target(), rate).whenComplete((ignored, error) -> {
                if (error != null) {
                    recordRampFailure(error);
                }
            });
        } catch (IllegalStateException e) {
            log.debug("Pool '{}' stopped before its stage started", pool.profileName());
        }
    }

    private void scheduleTimeSeries() {
        long interval = config.metricsInterval().toMillis();
        scheduler.scheduleAtFixedRate(() -> {
            try {
                allSnapshots.add(stats.snapshot());
            } catch (Exception e) {
                log.error("Error recording statistics time series", e);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
    }

    private void scheduleRunCompletion() {
        if (config.runDuration() == null) {
            return;
        }
        scheduler.schedule(() -> {
            log.info("Run duration reached, stopping...");
            stop();
        }, config.runDuration().toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public boolean isRunning() {
        return runState.isActive();
    }

    @Override
    public StatsSnapshot stop() {
        synchronized (stopLock) {
            if (finalSnapshot != null) {
                return finalSnapshot;
            }
            if (!runState.transition(RunPhase.RAMPING, RunPhase.STOPPING)
                    && !runState.transition(RunPhase.RUNNING, RunPhase.STOPPING)) {
                return stats.snapshot();
            }

            log.info("Stopping load test...");
            // shutdown, not shutdownNow: the duration stop may be running on this scheduler
            scheduler.shutdown();
            poolManager.shutdown(config.stopMode(), config.stopGracePeriod());
            stats.stop();

            StatsSnapshot snapshot = stats.snapshot();
            allSnapshots.add(snapshot);
            runState.transition(RunPhase.STOPPING, RunPhase.STOPPED);
            finalSnapshot = snapshot;

            List<ThresholdResult> thresholds = thresholdEvaluator.evaluate(config.thresholds(), snapshot);
            notifyStop(snapshot);
            executor.close();

            Instant endTime = Instant.now();
            resultFuture.complete(new RunResult(
                    startTime,
                    endTime,
                    Duration.between(startTime, endTime),
                    runState.totalUsersTarget(),
                    snapshot,
                    allSnapshots,
                    thresholds,
                    rampFailures));

            log.info("Load test completed. Duration: {}s, requests: {}",
                    Duration.between(startTime, endTime).toSeconds(), snapshot.totalCount());
            return snapshot;
        }
    }

    private void notifyStart() {
        for (LifecycleListener listener : listeners) {
            try {
                listener.onTestStart(target.host(), startTime);
            } catch (RuntimeException e) {
                log.warn("Lifecycle listener {} failed on test start", listener, e);
            }
        }
    }

    private void notifyStop(StatsSnapshot snapshot) {
        for (LifecycleListener listener : listeners) {
            try {
                listener.onTestStop(snapshot);
            } catch (RuntimeException e) {
                log.warn("Lifecycle listener {} failed on test stop", listener, e);
            }
        }
    }

    @Override
    public CompletableFuture<RunResult> result() {
        return resultFuture;
    }

    @Override
    public int activeUsers() {
        return poolManager.runningUsers();
    }

    @Override
    public RunPhase phase() {
        return runState.phase();
    }

    @Override
    public RunState runState() {
        return runState;
    }

    @Override
    public StatsSnapshot snapshot() {
        return finalSnapshot != null ? finalSnapshot : stats.snapshot();
    }

    @Override
    public List<PartialRampException> rampFailures() {
        return List.copyOf(rampFailures);
    }

    public PoolManager poolManager() {
        return poolManager;
    }
}

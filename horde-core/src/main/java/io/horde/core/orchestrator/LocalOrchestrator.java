package io.horde.core.orchestrator;

import io.horde.api.ConfigurationException;
import io.horde.api.executor.RequestExecutor;
import io.horde.api.executor.RequestExecutorFactory;
import io.horde.api.run.LifecycleListener;
import io.horde.api.run.LoadTestRun;
import io.horde.api.run.Orchestrator;
import io.horde.api.run.ProfileLoad;
import io.horde.api.run.RunConfig;
import io.horde.api.run.TargetDescriptor;
import io.horde.api.stats.StatsAggregator;
import io.horde.api.stats.StatsSnapshot;
import io.horde.core.executor.HttpClientRequestExecutor;
import io.horde.core.log.LoggingLifecycleListener;
import io.horde.core.pool.PoolManager;
import io.horde.core.runtime.LoadTestRuntime;
import io.horde.core.select.TaskSelector;
import io.horde.core.stats.MicrometerStatsAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Orchestrator running load tests in the local JVM.
 * <p>
 * Usage:
 * <pre>{@code
 * BehaviorProfile profile = BehaviorProfile.named("health-checker")
 *     .task("health", 1, session -> RequestSpec.get("/api/health"))
 *     .build();
 *
 * var config = RunConfig.create()
 *     .runDuration(Duration.ofMinutes(1))
 *     .thresholds(Threshold.p95Below(Duration.ofSeconds(5)));
 *
 * var orchestrator = new LocalOrchestrator(config);
 * LoadTestRun run = orchestrator.start(
 *     List.of(ProfileLoad.of(profile, 100, 10)),
 *     TargetDescriptor.of("http://localhost:3000"));
 *
 * // Wait for completion
 * RunResult result = run.result().get();
 * }</pre>
 */
public class LocalOrchestrator implements Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(LocalOrchestrator.class);

    private final RunConfig config;
    private final StatsAggregator stats;
    private final RequestExecutorFactory executorFactory;
    private final List<LifecycleListener> listeners = new CopyOnWriteArrayList<>();
    private volatile LoadTestRuntime currentRuntime;

    public LocalOrchestrator(RunConfig config) {
        this(config, new MicrometerStatsAggregator(), HttpClientRequestExecutor::new);
    }

    public LocalOrchestrator(RunConfig config, StatsAggregator stats) {
        this(config, stats, HttpClientRequestExecutor::new);
    }

    public LocalOrchestrator(RunConfig config, StatsAggregator stats, RequestExecutorFactory executorFactory) {
        this.config = config;
        this.stats = stats;
        this.executorFactory = executorFactory;
        this.listeners.add(new LoggingLifecycleListener());
    }

    @Override
    public synchronized LoadTestRun start(List<ProfileLoad> loads, TargetDescriptor target) {
        if (currentRuntime != null && currentRuntime.isRunning()) {
            throw new IllegalStateException("A load test is already running against " + currentRuntime.runState().targetHost());
        }
        validate(loads, target);
        log.info("Starting local load test environment");

        stats.reset();
        RequestExecutor executor = executorFactory.create(target);
        PoolManager poolManager = new PoolManager(config);

        currentRuntime = new LoadTestRuntime(config, loads, target, poolManager, stats, executor, listeners);
        currentRuntime.execute();
        return currentRuntime;
    }

    private void validate(List<ProfileLoad> loads, TargetDescriptor target) {
        if (target == null) {
            throw new ConfigurationException("Target must not be null");
        }
        if (loads == null || loads.isEmpty()) {
            throw new ConfigurationException("At least one profile load is required");
        }
        Set<String> names = new HashSet<>();
        for (ProfileLoad load : loads) {
            if (load == null) {
                throw new ConfigurationException("Profile load must not be null");
            }
            if (!names.add(load.profile().name())) {
                throw new ConfigurationException("Profile '" + load.profile().name() + "' is loaded twice");
            }
            // fail before any user starts when the tag filter leaves nothing to run
            TaskSelector.of(load.profile(), config.tagFilter()).requireEligible();
        }
    }

    @Override
    public StatsSnapshot stop() {
        LoadTestRuntime runtime = currentRuntime;
        if (runtime == null) {
            return stats.snapshot();
        }
        StatsSnapshot snapshot = runtime.stop();
        log.info("Local environment shut down");
        return snapshot;
    }

    @Override
    public Optional<LoadTestRun> currentRun() {
        return Optional.ofNullable(currentRuntime);
    }

    @Override
    public void addListener(LifecycleListener listener) {
        listeners.add(listener);
    }

    @Override
    public RunConfig config() {
        return config;
    }

    @Override
    public StatsAggregator stats() {
        return stats;
    }
}

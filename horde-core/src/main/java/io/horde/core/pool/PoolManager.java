package io.horde.core.pool;

import io.horde.api.executor.RequestExecutor;
import io.horde.api.run.ProfileLoad;
import io.horde.api.run.RunConfig;
import io.horde.api.run.RunState;
import io.horde.api.run.StopMode;
import io.horde.api.stats.StatsAggregator;
import io.horde.core.classify.ResponseClassifier;
import io.horde.core.select.TaskSelector;
import io.horde.core.user.UserContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Manages one user pool per behavior profile.
 * Pools are created from the run configuration (thread factory, seed, stop mode, iteration cap).
 */
public class PoolManager {

    private static final Logger log = LoggerFactory.getLogger(PoolManager.class);

    private final Map<String, UserPool> pools = Collections.synchronizedMap(new LinkedHashMap<>());
    private final RunConfig config;
    private final ResponseClassifier classifier = new ResponseClassifier();

    public PoolManager(RunConfig config) {
        this.config = config;
    }

    /**
     * Initialize one pool per profile load.
     * Per-user random generators descend from {@code seed + index} when a seed is configured.
     */
    public void initialize(List<ProfileLoad> loads, RequestExecutor executor, StatsAggregator stats, RunState runState) {
        for (int i = 0; i < loads.size(); i++) {
            ProfileLoad load = loads.get(i);
            UserContext context = new UserContext(
                    load.profile(),
                    TaskSelector.of(load.profile(), config.tagFilter()),
                    executor,
                    classifier,
                    stats,
                    config.stopMode(),
                    config.maxIterationsPerUser());
            SplittableRandom random = config.seed() != null
                    ? new SplittableRandom(config.seed() + i)
                    : new SplittableRandom();
            pools.put(load.profile().name(),
                    new UserPool(context, config.threadFactory(), config.spawnRetryLimit(), runState, random));
        }
    }

    /**
     * Get the pool for a specific profile.
     */
    public UserPool pool(String profileName) {
        UserPool pool = pools.get(profileName);
        if (pool == null) {
            throw new IllegalArgumentException("No pool for profile: " + profileName);
        }
        return pool;
    }

    /**
     * @return all pools (for ramp tracking and metrics)
     */
    public Collection<UserPool> allPools() {
        synchronized (pools) {
            return List.copyOf(pools.values());
        }
    }

    public int runningUsers() {
        return allPools().stream().mapToInt(UserPool::runningCount).sum();
    }

    /**
     * Stop all pools side by side so grace periods don't add up.
     */
    public void shutdown(StopMode mode, Duration gracePeriod) {
        Collection<UserPool> toStop = allPools();
        if (toStop.isEmpty()) {
            return;
        }
        ExecutorService stopper = Executors.newFixedThreadPool(toStop.size(), r -> {
            Thread t = new Thread(r, "horde-pool-stopper");
            t.setDaemon(true);
            return t;
        });
        try {
            CompletableFuture.allOf(toStop.stream()
                            .map(pool -> CompletableFuture.runAsync(() -> pool.stop(mode, gracePeriod), stopper))
                            .toArray(CompletableFuture[]::new))
                    .join();
        } finally {
            stopper.shutdown();
        }
        log.info("All {} pools stopped", toStop.size());
    }
}

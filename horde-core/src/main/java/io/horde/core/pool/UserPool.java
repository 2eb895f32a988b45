package io.horde.core.pool;

import io.horde.api.ConfigurationException;
import io.horde.api.run.PartialRampException;
import io.horde.api.run.RunState;
import io.horde.api.run.StopMode;
import io.horde.core.user.UserContext;
import io.horde.core.user.UserState;
import io.horde.core.user.VirtualUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Population of virtual users of one behavior profile.
 * <p>
 * A ramp scheduler ticks every {@value #TICK_MS}ms and computes how many users should exist
 * at that point of the ramp ({@code spawnRate} per second, never the whole population at once),
 * then spawns the deficit or stops the most recently spawned users. Each user runs on its own
 * thread. A user whose start hook fails is replaced on the next tick; after more than
 * {@code spawnRetryLimit} consecutive failures the ramp gives up with a
 * {@link PartialRampException} and the users already running carry on.
 */
public class UserPool {

    private static final Logger log = LoggerFactory.getLogger(UserPool.class);

    static final long TICK_MS = 100;
    private static final Duration FORCE_STOP_WAIT = Duration.ofSeconds(5);

    private final String profileName;
    private final UserContext context;
    private final ThreadFactory threadFactory;
    private final int spawnRetryLimit;
    private final RunState runState;
    private final SplittableRandom random;
    private final ScheduledExecutorService scheduler;

    private final Deque<VirtualUser> users = new ConcurrentLinkedDeque<>();
    private final Set<VirtualUser> running = ConcurrentHashMap.newKeySet();
    // ramped down, still finishing their last iteration
    private final Set<VirtualUser> retiring = ConcurrentHashMap.newKeySet();
    private final AtomicInteger sequence = new AtomicInteger();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final VirtualUser.Listener userListener = new UserListener();

    private volatile int target;
    private volatile double spawnRate;
    private volatile int rampBase;
    private volatile long rampStartNanos;
    private volatile boolean halted;
    private volatile boolean stopped;
    private volatile CompletableFuture<Void> rampDone = CompletableFuture.completedFuture(null);
    private ScheduledFuture<?> rampTask;

    public UserPool(UserContext context, ThreadFactory threadFactory, int spawnRetryLimit,
                    RunState runState, SplittableRandom random) {
        this.profileName = context.profile().name();
        this.context = context;
        this.threadFactory = threadFactory != null ? threadFactory : userThreadFactory(profileName);
        this.spawnRetryLimit = spawnRetryLimit;
        this.runState = runState;
        this.random = random;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "horde-ramp-" + profileName);
            t.setDaemon(true);
            return t;
        });
        log.info("Created user pool for profile '{}'", profileName);
    }

    /**
     * Move the population towards {@code targetCount} at {@code spawnRatePerSecond}.
     * Calling it again while a ramp is in progress retargets that ramp.
     *
     * @return future completed once the population settles at the target, or completed
     * exceptionally with a {@link PartialRampException}
     */
    public synchronized CompletableFuture<Void> ramp(int targetCount, double spawnRatePerSecond) {
        if (targetCount < 0) {
            throw new ConfigurationException("Target user count must not be negative: " + targetCount);
        }
        if (!(spawnRatePerSecond > 0) || Double.isInfinite(spawnRatePerSecond)) {
            throw new ConfigurationException("Spawn rate must be positive: " + spawnRatePerSecond);
        }
        if (stopped) {
            throw new IllegalStateException("Pool '" + profileName + "' is stopped");
        }

        this.target = targetCount;
        this.spawnRate = spawnRatePerSecond;
        this.rampBase = users.size();
        this.rampStartNanos = System.nanoTime();
        this.halted = false;
        consecutiveFailures.set(0);
        if (rampDone.isDone()) {
            rampDone = new CompletableFuture<>();
        }
        if (rampTask == null) {
            rampTask = scheduler.scheduleAtFixedRate(this::tick, TICK_MS, TICK_MS, TimeUnit.MILLISECONDS);
        }

        log.info("Pool '{}' ramping from {} to {} users at {}/s", profileName, rampBase, targetCount, spawnRatePerSecond);
        return rampDone;
    }

    private void tick() {
        try {
            if (stopped || halted) {
                return;
            }
            double elapsedSeconds = (System.nanoTime() - rampStartNanos) / 1_000_000_000.0;
            long allowed = (long) Math.floor(spawnRate * elapsedSeconds) + 1;
            int current = users.size();
            int goal = target;

            if (current < goal) {
                int desired = (int) Math.min(goal, rampBase + allowed);
                for (int i = current; i < desired && !stopped; i++) {
                    spawnUser();
                }
            } else if (current > goal) {
                int desired = (int) Math.max(goal, rampBase - allowed);
                for (int i = current; i > desired; i--) {
                    retireYoungest();
                }
            }
            checkRampComplete();
        } catch (Exception e) {
            log.error("Error in ramp scheduler of pool '{}'", profileName, e);
        }
    }

    private void spawnUser() {
        String id = profileName + "-" + sequence.incrementAndGet();
        VirtualUser user = new VirtualUser(id, context, random.split(), userListener);
        users.addLast(user);
        threadFactory.newThread(user).start();
    }

    private void retireYoungest() {
        VirtualUser user = users.pollLast();
        if (user != null) {
            log.debug("Pool '{}' retiring user {}", profileName, user.id());
            retiring.add(user);
            if (!user.isAlive()) {
                // exited on its own before it was retired
                retiring.remove(user);
            }
            user.requestStop();
        }
    }

    private void checkRampComplete() {
        if (rampDone.isDone() || users.size() != target) {
            return;
        }
        boolean settled = users.stream()
                .noneMatch(u -> u.state() == UserState.STARTING || u.startFailure() != null);
        if (settled) {
            log.info("Pool '{}' reached {} users", profileName, target);
            rampDone.complete(null);
        }
    }

    private void onSpawnFailure(VirtualUser user) {
        users.remove(user);
        int failures = consecutiveFailures.incrementAndGet();
        if (failures > spawnRetryLimit && !halted) {
            halted = true;
            PartialRampException failure = new PartialRampException(profileName, running.size(), target, user.startFailure());
            log.warn("{} after {} consecutive spawn failures", failure.getMessage(), failures);
            rampDone.completeExceptionally(failure);
        }
    }

    /**
     * Wait until the current ramp settles.
     *
     * @return false if the timeout elapsed first
     * @throws PartialRampException if the ramp gave up
     */
    public boolean awaitRamp(Duration timeout) throws InterruptedException {
        try {
            rampDone.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof PartialRampException partial) {
                throw partial;
            }
            throw new IllegalStateException("Ramp of pool '" + profileName + "' failed", e.getCause());
        }
    }

    /**
     * Signal every user to stop, wait up to the grace period, then interrupt whoever is left.
     * Interrupted requests are recorded as cancelled by their users.
     */
    public void stop(StopMode mode, Duration gracePeriod) {
        synchronized (this) {
            if (stopped) {
                return;
            }
            stopped = true;
            if (rampTask != null) {
                rampTask.cancel(false);
            }
        }
        scheduler.shutdown();
        List<VirtualUser> snapshot = owned();
        try {
            if (!scheduler.awaitTermination(1, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            // a tick that was running may have spawned or retired more
            snapshot = owned();
            log.info("Stopping pool '{}' ({} users, {})", profileName, snapshot.size(), mode);
            snapshot.forEach(u -> u.requestStop(mode));

            long deadline = System.nanoTime() + gracePeriod.toNanos();
            List<VirtualUser> lingering = new ArrayList<>();
            for (VirtualUser user : snapshot) {
                Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
                if (!user.awaitStopped(remaining)) {
                    lingering.add(user);
                }
            }
            if (!lingering.isEmpty()) {
                log.warn("Pool '{}': {} users still busy after the {}ms grace period, interrupting",
                        profileName, lingering.size(), gracePeriod.toMillis());
                lingering.forEach(VirtualUser::forceStop);
                for (VirtualUser user : lingering) {
                    if (!user.awaitStopped(FORCE_STOP_WAIT)) {
                        log.warn("User {} did not stop after interrupt", user.id());
                    }
                }
            }
        } catch (InterruptedException e) {
            snapshot.forEach(VirtualUser::forceStop);
            Thread.currentThread().interrupt();
        }
        rampDone.complete(null);
        context.stats().recordActiveUsers(profileName, running.size());
        log.info("Pool '{}' stopped. Users spawned: {}", profileName, sequence.get());
    }

    /**
     * @return current and retiring users
     */
    private List<VirtualUser> owned() {
        List<VirtualUser> owned = new ArrayList<>(users);
        owned.addAll(retiring);
        return owned;
    }

    public boolean isRampComplete() {
        return rampDone.isDone() && !rampDone.isCompletedExceptionally();
    }

    public CompletableFuture<Void> rampFuture() {
        return rampDone;
    }

    /**
     * @return the users this pool counts towards its target, including those that hit the iteration cap
     */
    public int population() {
        return users.size();
    }

    public int runningCount() {
        return running.size();
    }

    /**
     * @return users ramped down that have not finished yet
     */
    public int retiringCount() {
        return retiring.size();
    }

    public List<VirtualUser> users() {
        return List.copyOf(users);
    }

    public int target() {
        return target;
    }

    public String profileName() {
        return profileName;
    }

    public boolean isStopped() {
        return stopped;
    }

    public Optional<PartialRampException> partialRamp() {
        if (!rampDone.isCompletedExceptionally()) {
            return Optional.empty();
        }
        try {
            rampDone.getNow(null);
            return Optional.empty();
        } catch (CompletionException e) {
            return e.getCause() instanceof PartialRampException partial ? Optional.of(partial) : Optional.empty();
        }
    }

    private static ThreadFactory userThreadFactory(String profileName) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "horde-user-" + profileName + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private final class UserListener implements VirtualUser.Listener {

        @Override
        public void onRunning(VirtualUser user) {
            consecutiveFailures.set(0);
            running.add(user);
            if (runState != null) {
                runState.userStarted();
            }
            context.stats().recordActiveUsers(profileName, running.size());
        }

        @Override
        public void onExit(VirtualUser user) {
            retiring.remove(user);
            if (user.startFailure() != null) {
                onSpawnFailure(user);
                return;
            }
            if (running.remove(user)) {
                if (runState != null) {
                    runState.userStopped();
                }
                context.stats().recordActiveUsers(profileName, running.size());
            }
        }
    }
}

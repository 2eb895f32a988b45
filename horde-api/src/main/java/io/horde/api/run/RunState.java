package io.horde.api.run;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State of one run, owned by the orchestrator and referenced by its pools.
 * Phase transitions are atomic so every pool observes the same phase.
 */
public final class RunState {

    private final String targetHost;
    private final int totalUsersTarget;
    private final AtomicReference<RunPhase> phase = new AtomicReference<>(RunPhase.IDLE);
    private final AtomicInteger currentUserCount = new AtomicInteger(0);
    private volatile Instant startedAt;

    public RunState(String targetHost, int totalUsersTarget) {
        this.targetHost = targetHost;
        this.totalUsersTarget = totalUsersTarget;
    }

    public RunPhase phase() {
        return phase.get();
    }

    /**
     * Move from {@code expected} to {@code next}.
     *
     * @return false when the run was not in the expected phase
     */
    public boolean transition(RunPhase expected, RunPhase next) {
        boolean moved = phase.compareAndSet(expected, next);
        if (moved && next == RunPhase.RAMPING) {
            startedAt = Instant.now();
        }
        return moved;
    }

    public boolean isActive() {
        return phase.get().isActive();
    }

    public Instant startedAt() {
        return startedAt;
    }

    public String targetHost() {
        return targetHost;
    }

    public int totalUsersTarget() {
        return totalUsersTarget;
    }

    public int currentUserCount() {
        return currentUserCount.get();
    }

    public void userStarted() {
        currentUserCount.incrementAndGet();
    }

    public void userStopped() {
        currentUserCount.decrementAndGet();
    }

    @Override
    public String toString() {
        return "RunState[phase=" + phase.get() + ", target=" + targetHost
                + ", users=" + currentUserCount.get() + "/" + totalUsersTarget + "]";
    }
}

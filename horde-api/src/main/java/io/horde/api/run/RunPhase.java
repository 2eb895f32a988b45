package io.horde.api.run;

/**
 * Lifecycle of a load test run.
 */
public enum RunPhase {
    IDLE,
    RAMPING,
    RUNNING,
    STOPPING,
    STOPPED;

    public boolean isActive() {
        return this == RAMPING || this == RUNNING;
    }
}

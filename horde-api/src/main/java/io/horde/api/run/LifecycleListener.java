package io.horde.api.run;

import io.horde.api.stats.StatsSnapshot;

import java.time.Instant;

/**
 * Receives run lifecycle notifications, synchronously, before start or stop returns.
 * This is the extension point for external reporting and logging.
 */
public interface LifecycleListener {

    default void onTestStart(String targetHost, Instant timestamp) {}

    default void onTestStop(StatsSnapshot finalSnapshot) {}
}

package io.horde.core.user;

import io.horde.api.executor.RequestExecutor;
import io.horde.api.profile.BehaviorProfile;
import io.horde.api.run.StopMode;
import io.horde.api.stats.StatsAggregator;
import io.horde.core.classify.ResponseClassifier;
import io.horde.core.select.TaskSelector;

/**
 * Collaborators shared by all virtual users of one profile.
 *
 * @param maxIterations iteration cap per user, 0 for unlimited
 */
public record UserContext(
        BehaviorProfile profile,
        TaskSelector selector,
        RequestExecutor executor,
        ResponseClassifier classifier,
        StatsAggregator stats,
        StopMode stopMode,
        long maxIterations
) {

    public UserContext {
        if (profile == null || selector == null || executor == null || classifier == null || stats == null) {
            throw new IllegalArgumentException("User context is incomplete");
        }
        stopMode = stopMode == null ? StopMode.GRACEFUL : stopMode;
        if (maxIterations < 0) {
            throw new IllegalArgumentException("Iteration cap must not be negative");
        }
    }
}

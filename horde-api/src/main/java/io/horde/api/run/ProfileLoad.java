package io.horde.api.run;

import io.horde.api.ConfigurationException;
import io.horde.api.profile.BehaviorProfile;

import java.util.List;

/**
 * Target population of one profile: how many users, how fast they are spawned,
 * and optional stages that reshape the population after the initial ramp.
 */
public record ProfileLoad(BehaviorProfile profile, int users, double spawnRate, List<LoadStage> stages) {

    public ProfileLoad {
        if (profile == null) {
            throw new ConfigurationException("Profile must not be null");
        }
        if (users <= 0) {
            throw new ConfigurationException("Number of users must be positive for profile '" + profile.name() + "'");
        }
        if (!(spawnRate > 0.0) || Double.isInfinite(spawnRate)) {
            throw new ConfigurationException("Spawn rate must be positive for profile '" + profile.name() + "'");
        }
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    public static ProfileLoad of(BehaviorProfile profile, int users, double spawnRate) {
        return new ProfileLoad(profile, users, spawnRate, List.of());
    }

    public ProfileLoad stages(LoadStage... stages) {
        return new ProfileLoad(profile, users, spawnRate, List.of(stages));
    }

    /**
     * @return nominal time needed to spawn the initial population, in milliseconds
     */
    public long initialRampMillis() {
        return (long) Math.ceil(users / spawnRate * 1000.0);
    }
}

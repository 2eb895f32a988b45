package io.horde.core.select;

import io.horde.api.ConfigurationException;
import io.horde.api.profile.BehaviorProfile;
import io.horde.api.task.NoEligibleTaskException;
import io.horde.api.task.TaskDefinition;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * Weighted-random task selection over the tasks eligible under a tag filter.
 * <p>
 * Selection draws one uniform value in {@code [0, totalWeight)} and binary searches the
 * cumulative weights, so it is deterministic for a given draw. Instances are immutable and
 * can be shared; the random generator is supplied per call by the owning virtual user.
 */
public final class TaskSelector {

    private final String profileName;
    private final Set<String> tagFilter;
    private final List<TaskDefinition> eligible;
    private final long[] cumulativeWeights;
    private final long totalWeight;

    private TaskSelector(String profileName, List<TaskDefinition> eligible, Set<String> tagFilter) {
        this.profileName = profileName;
        this.tagFilter = Set.copyOf(tagFilter);
        this.eligible = List.copyOf(eligible);
        this.cumulativeWeights = new long[eligible.size()];
        long running = 0;
        for (int i = 0; i < eligible.size(); i++) {
            running += eligible.get(i).weight();
            cumulativeWeights[i] = running;
        }
        this.totalWeight = running;
    }

    public static TaskSelector of(BehaviorProfile profile, Set<String> tagFilter) {
        return of(profile.name(), profile.tasks(), tagFilter);
    }

    /**
     * Build a selector over the tasks whose tags match the filter.
     * An empty eligible set is allowed here; {@link #select} reports it.
     */
    public static TaskSelector of(String profileName, List<TaskDefinition> tasks, Set<String> tagFilter) {
        Set<String> filter = tagFilter == null ? Set.of() : tagFilter;
        List<TaskDefinition> eligible = tasks.stream()
                .filter(task -> task.eligibleFor(filter))
                .toList();
        return new TaskSelector(profileName, eligible, filter);
    }

    /**
     * One-shot selection without keeping the selector around.
     */
    public static TaskDefinition select(List<TaskDefinition> tasks, Set<String> tagFilter, RandomGenerator random) {
        return of("anonymous", tasks, tagFilter).select(random);
    }

    /**
     * @throws NoEligibleTaskException if the tag filter eliminated every task
     */
    public TaskDefinition select(RandomGenerator random) {
        requireEligible();
        return pick(random.nextLong(totalWeight));
    }

    /**
     * Map a draw in {@code [0, totalWeight)} to its task.
     */
    public TaskDefinition pick(long draw) {
        requireEligible();
        if (draw < 0 || draw >= totalWeight) {
            throw new IllegalArgumentException("Draw " + draw + " outside [0, " + totalWeight + ")");
        }
        // first index whose cumulative weight exceeds the draw
        int idx = Arrays.binarySearch(cumulativeWeights, draw);
        int slot = idx >= 0 ? idx + 1 : -idx - 1;
        return eligible.get(slot);
    }

    /**
     * Fail fast when the tag filter leaves nothing to run.
     */
    public void requireEligible() {
        if (eligible.isEmpty()) {
            throw new NoEligibleTaskException(profileName, tagFilter);
        }
        if (totalWeight <= 0) {
            throw new ConfigurationException("Profile '" + profileName + "' has zero total weight");
        }
    }

    public boolean isEmpty() {
        return eligible.isEmpty();
    }

    public List<TaskDefinition> eligibleTasks() {
        return eligible;
    }

    public long totalWeight() {
        return totalWeight;
    }
}

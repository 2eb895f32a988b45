package io.horde.api.task;

import io.horde.api.ConfigurationException;
import io.horde.api.classify.ClassificationPolicy;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Declarative descriptor of a weighted task inside a behavior profile.
 *
 * @param name    descriptive name, used in logs and as category for task errors
 * @param weight  relative selection weight, must be positive
 * @param tags    tags matched against the run's tag filter; empty means always eligible
 * @param task    the request builder
 * @param policy  how outcomes of this task are classified
 * @param timeout per-task request timeout, or {@code null} for the target default
 */
public record TaskDefinition(
        String name,
        int weight,
        Set<String> tags,
        Task task,
        ClassificationPolicy policy,
        Duration timeout
) {

    public TaskDefinition {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Task name must not be blank");
        }
        if (weight <= 0) {
            throw new ConfigurationException("Task '" + name + "' must have a positive weight, got " + weight);
        }
        if (task == null) {
            throw new ConfigurationException("Task '" + name + "' must not be null");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new ConfigurationException("Task '" + name + "' timeout must be positive");
        }
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        policy = policy == null ? ClassificationPolicy.defaults() : policy;
    }

    public static Builder builder(String name, Task task) {
        return new Builder(name, task);
    }

    /**
     * A task is eligible when no filter is active, when it carries no tags,
     * or when one of its tags is in the filter.
     */
    public boolean eligibleFor(Set<String> tagFilter) {
        if (tagFilter == null || tagFilter.isEmpty() || tags.isEmpty()) {
            return true;
        }
        return !Collections.disjoint(tags, tagFilter);
    }

    public static final class Builder {
        private final String name;
        private final Task task;
        private int weight = 1;
        private final Set<String> tags = new LinkedHashSet<>();
        private ClassificationPolicy policy = ClassificationPolicy.defaults();
        private Duration timeout;

        private Builder(String name, Task task) {
            this.name = name;
            this.task = task;
        }

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        public Builder tags(String... tags) {
            this.tags.addAll(List.of(tags));
            return this;
        }

        public Builder policy(ClassificationPolicy policy) {
            this.policy = policy;
            return this;
        }

        /**
         * Use a longer (or shorter) timeout than the target default, e.g. for heavy requests.
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public TaskDefinition build() {
            return new TaskDefinition(name, weight, tags, task, policy, timeout);
        }
    }
}

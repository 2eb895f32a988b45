package io.horde.api.profile;

import io.horde.api.ConfigurationException;
import io.horde.api.session.SessionHook;
import io.horde.api.task.Task;
import io.horde.api.task.TaskDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fluent DSL for building the behavior of one kind of virtual user.
 * <p>
 * A profile is a named, weighted set of tasks plus lifecycle hooks and wait-time bounds.
 * It is immutable once built and can be shared by any number of virtual users.
 * <p>
 * Usage:
 * <pre>{@code
 * BehaviorProfile profile = BehaviorProfile.named("chat-user")
 *     .waitTime(WaitTime.between(Duration.ofSeconds(1), Duration.ofSeconds(5)))
 *     .onStart(session -> session.put("messages", new ArrayList<>()))
 *     .task("chat", 10, session -> RequestSpec.post("/api/chat", payload))
 *     .task(TaskDefinition.builder("health", session -> RequestSpec.get("/api/health"))
 *         .tags("monitoring")
 *         .build())
 *     .build();
 * }</pre>
 */
public final class BehaviorProfile {

    private final String name;
    private final List<TaskDefinition> tasks;
    private final SessionHook onStart;
    private final SessionHook onStop;
    private final WaitTime waitTime;

    private BehaviorProfile(Builder builder) {
        this.name = builder.name;
        this.tasks = Collections.unmodifiableList(new ArrayList<>(builder.tasks));
        this.onStart = builder.onStart;
        this.onStop = builder.onStop;
        this.waitTime = builder.waitTime;
    }

    /**
     * Start building a named profile.
     */
    public static Builder named(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Profile name must not be blank");
        }
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<TaskDefinition> tasks() {
        return tasks;
    }

    public SessionHook onStart() {
        return onStart;
    }

    public SessionHook onStop() {
        return onStop;
    }

    public WaitTime waitTime() {
        return waitTime;
    }

    /**
     * @return the tasks that may be selected under the given tag filter
     */
    public List<TaskDefinition> eligibleTasks(Set<String> tagFilter) {
        return tasks.stream()
                .filter(task -> task.eligibleFor(tagFilter))
                .collect(Collectors.toUnmodifiableList());
    }

    public long totalWeight() {
        return tasks.stream().mapToLong(TaskDefinition::weight).sum();
    }

    @Override
    public String toString() {
        return "BehaviorProfile[" + name + ", tasks=" + tasks.size() + ", waitTime=" + waitTime + "]";
    }

    public static final class Builder {
        private final String name;
        private final List<TaskDefinition> tasks = new ArrayList<>();
        private SessionHook onStart = SessionHook.NONE;
        private SessionHook onStop = SessionHook.NONE;
        private WaitTime waitTime = WaitTime.none();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Add a task with default classification and timeout.
         */
        public Builder task(String name, int weight, Task task) {
            return task(TaskDefinition.builder(name, task).weight(weight).build());
        }

        public Builder task(TaskDefinition definition) {
            tasks.add(definition);
            return this;
        }

        /**
         * Called once per virtual user before its first task, e.g. to create a synthetic session id.
         */
        public Builder onStart(SessionHook hook) {
            this.onStart = hook == null ? SessionHook.NONE : hook;
            return this;
        }

        public Builder onStop(SessionHook hook) {
            this.onStop = hook == null ? SessionHook.NONE : hook;
            return this;
        }

        public Builder waitTime(WaitTime waitTime) {
            if (waitTime == null) {
                throw new ConfigurationException("Wait time must not be null");
            }
            this.waitTime = waitTime;
            return this;
        }

        public BehaviorProfile build() {
            if (tasks.isEmpty()) {
                throw new ConfigurationException("Profile '" + name + "' must contain at least one task");
            }
            Set<String> names = new HashSet<>();
            for (TaskDefinition task : tasks) {
                if (!names.add(task.name())) {
                    throw new ConfigurationException("Profile '" + name + "' declares task '" + task.name() + "' twice");
                }
            }
            return new BehaviorProfile(this);
        }
    }
}

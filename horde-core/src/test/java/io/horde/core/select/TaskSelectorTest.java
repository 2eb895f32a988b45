package io.horde.core.select;

import io.horde.api.profile.BehaviorProfile;
import io.horde.api.task.NoEligibleTaskException;
import io.horde.api.task.RequestSpec;
import io.horde.api.task.TaskDefinition;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TaskSelectorTest {

    private static final int DRAWS = 20_000;

    private final BehaviorProfile chatProfile = BehaviorProfile.named("chat-user")
            .task("chat_simple", 10, session -> RequestSpec.get("/api/chat"))
            .task("chat_conversation", 5, session -> RequestSpec.get("/api/chat"))
            .task("tool_endpoint", 3, session -> RequestSpec.get("/api/tools"))
            .task("check_health", 1, session -> RequestSpec.get("/api/health"))
            .task("view_homepage", 1, session -> RequestSpec.get("/"))
            .build();

    // --- Proportions ---

    @Test
    void shouldConvergeToWeightProportions() {
        TaskSelector selector = TaskSelector.of(chatProfile, Set.of());
        SplittableRandom random = new SplittableRandom(1234);

        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < DRAWS; i++) {
            counts.merge(selector.select(random).name(), 1, Integer::sum);
        }

        for (TaskDefinition task : chatProfile.tasks()) {
            double expected = (double) task.weight() / chatProfile.totalWeight();
            double observed = (double) counts.getOrDefault(task.name(), 0) / DRAWS;
            assertThat(observed).as(task.name()).isCloseTo(expected, within(0.015));
        }
    }

    @Test
    void shouldBeDeterministicForAFixedSeed() {
        TaskSelector selector = TaskSelector.of(chatProfile, Set.of());
        SplittableRandom first = new SplittableRandom(99);
        SplittableRandom second = new SplittableRandom(99);

        for (int i = 0; i < 500; i++) {
            assertThat(selector.select(first).name()).isEqualTo(selector.select(second).name());
        }
    }

    // --- Cumulative weight search ---

    @Test
    void shouldMapDrawsToCumulativeWeightBuckets() {
        TaskSelector selector = TaskSelector.of(chatProfile, Set.of());

        assertThat(selector.totalWeight()).isEqualTo(20);
        assertThat(selector.pick(0).name()).isEqualTo("chat_simple");
        assertThat(selector.pick(9).name()).isEqualTo("chat_simple");
        assertThat(selector.pick(10).name()).isEqualTo("chat_conversation");
        assertThat(selector.pick(14).name()).isEqualTo("chat_conversation");
        assertThat(selector.pick(15).name()).isEqualTo("tool_endpoint");
        assertThat(selector.pick(18).name()).isEqualTo("check_health");
        assertThat(selector.pick(19).name()).isEqualTo("view_homepage");
    }

    @Test
    void shouldRejectDrawsOutsideTheRange() {
        TaskSelector selector = TaskSelector.of(chatProfile, Set.of());

        assertThatThrownBy(() -> selector.pick(20)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> selector.pick(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    // --- Tag filter ---

    @Test
    void shouldOnlySelectTasksMatchingTheFilter() {
        BehaviorProfile tagged = BehaviorProfile.named("endpoint-user")
                .task(TaskDefinition.builder("chat", session -> RequestSpec.get("/chat")).weight(5).tags("chat").build())
                .task(TaskDefinition.builder("health", session -> RequestSpec.get("/health")).tags("monitoring").build())
                .task(TaskDefinition.builder("metrics", session -> RequestSpec.get("/metrics")).tags("monitoring").build())
                .build();
        TaskSelector selector = TaskSelector.of(tagged, Set.of("monitoring"));
        SplittableRandom random = new SplittableRandom(5);

        for (int i = 0; i < 1_000; i++) {
            assertThat(selector.select(random).tags()).contains("monitoring");
        }
    }

    @Test
    void shouldFailWhenFilterEliminatesEveryTask() {
        BehaviorProfile tagged = BehaviorProfile.named("endpoint-user")
                .task(TaskDefinition.builder("chat", session -> RequestSpec.get("/chat")).tags("chat").build())
                .build();
        TaskSelector selector = TaskSelector.of(tagged, Set.of("monitoring"));

        assertThat(selector.isEmpty()).isTrue();
        assertThatThrownBy(() -> selector.select(new SplittableRandom()))
                .isInstanceOf(NoEligibleTaskException.class)
                .hasMessageContaining("endpoint-user")
                .hasMessageContaining("monitoring");
    }
}

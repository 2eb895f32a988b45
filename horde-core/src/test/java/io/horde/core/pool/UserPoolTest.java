package io.horde.core.pool;

import io.horde.api.ConfigurationException;
import io.horde.api.profile.BehaviorProfile;
import io.horde.api.run.PartialRampException;
import io.horde.api.run.RunState;
import io.horde.api.run.StopMode;
import io.horde.api.task.RequestSpec;
import io.horde.core.classify.ResponseClassifier;
import io.horde.core.select.TaskSelector;
import io.horde.core.stats.MicrometerStatsAggregator;
import io.horde.core.support.Profiles;
import io.horde.core.support.RecordingExecutor;
import io.horde.core.user.UserContext;
import io.horde.core.user.UserState;
import io.horde.core.user.VirtualUser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class UserPoolTest {

    private final MicrometerStatsAggregator stats = new MicrometerStatsAggregator();
    private UserPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.stop(StopMode.IMMEDIATE, Duration.ofMillis(100));
        }
    }

    private UserPool pool(BehaviorProfile profile, RecordingExecutor executor, RunState runState) {
        UserContext context = new UserContext(profile, TaskSelector.of(profile, Set.of()), executor,
                new ResponseClassifier(), stats, StopMode.GRACEFUL, 0);
        pool = new UserPool(context, null, 3, runState, new SplittableRandom(42));
        return pool;
    }

    // --- Ramp up ---

    @Test
    void shouldSpawnGraduallyAtSpawnRate() throws InterruptedException {
        pool(Profiles.health(), new RecordingExecutor(200, Duration.ofMillis(20)), null);

        pool.ramp(20, 10.0);

        Thread.sleep(500);
        assertThat(pool.population()).isBetween(1, 9);
        assertThat(pool.awaitRamp(Duration.ofSeconds(5))).isTrue();
        assertThat(pool.population()).isEqualTo(20);
        await().atMost(Duration.ofSeconds(1)).until(() -> pool.runningCount() == 20);
        assertThat(pool.isRampComplete()).isTrue();
    }

    @Test
    void shouldTrackUsersInRunState() throws InterruptedException {
        RunState runState = new RunState("localhost", 5);
        pool(Profiles.health(), new RecordingExecutor(200, Duration.ofMillis(20)), runState);

        pool.ramp(5, 100.0);

        assertThat(pool.awaitRamp(Duration.ofSeconds(5))).isTrue();
        await().atMost(Duration.ofSeconds(1)).until(() -> runState.currentUserCount() == 5);
        await().atMost(Duration.ofSeconds(1)).until(() -> stats.snapshot().activeUsers() == 5);
    }

    @Test
    void shouldCompleteImmediatelyForZeroTarget() throws InterruptedException {
        pool(Profiles.health(), new RecordingExecutor(200), null);

        pool.ramp(0, 1.0);

        assertThat(pool.awaitRamp(Duration.ofSeconds(1))).isTrue();
        assertThat(pool.population()).isZero();
    }

    @Test
    void shouldRejectInvalidRampArguments() {
        pool(Profiles.health(), new RecordingExecutor(200), null);

        assertThatThrownBy(() -> pool.ramp(-1, 1.0)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> pool.ramp(5, 0.0)).isInstanceOf(ConfigurationException.class);
    }

    // --- Ramp down ---

    @Test
    void shouldRetireYoungestUsersOnRampDown() throws InterruptedException {
        pool(Profiles.health(), new RecordingExecutor(200, Duration.ofMillis(20)), null);
        pool.ramp(8, 100.0);
        assertThat(pool.awaitRamp(Duration.ofSeconds(5))).isTrue();
        var oldest = pool.users().get(0);

        pool.ramp(3, 100.0);

        assertThat(pool.awaitRamp(Duration.ofSeconds(5))).isTrue();
        assertThat(pool.population()).isEqualTo(3);
        assertThat(pool.users()).contains(oldest);
        await().atMost(Duration.ofSeconds(3)).until(() -> pool.runningCount() == 3);
    }

    @Test
    void shouldStopRetiringUsersTogetherWithThePool() throws InterruptedException {
        var executor = new RecordingExecutor(200, Duration.ofSeconds(3));
        pool(Profiles.health(), executor, null);
        pool.ramp(2, 100.0);
        assertThat(pool.awaitRamp(Duration.ofSeconds(5))).isTrue();
        await().atMost(Duration.ofSeconds(2)).until(() -> executor.requests().size() == 2);
        List<VirtualUser> retired = pool.users();

        pool.ramp(0, 100.0);
        assertThat(pool.awaitRamp(Duration.ofSeconds(2))).isTrue();
        assertThat(pool.population()).isZero();
        assertThat(pool.retiringCount()).isEqualTo(2);

        pool.stop(StopMode.IMMEDIATE, Duration.ofMillis(100));

        assertThat(retired).extracting(VirtualUser::state).containsOnly(UserState.STOPPED);
        assertThat(pool.retiringCount()).isZero();
        var health = stats.snapshot().category("GET /api/health").orElseThrow();
        assertThat(health.cancelledCount()).isEqualTo(2);
        assertThat(health.successCount()).isZero();
    }

    // --- Spawn failures ---

    @Test
    void shouldGiveUpAfterRepeatedStartFailures() {
        var profile = BehaviorProfile.named("unlucky")
                .onStart(session -> {
                    throw new IllegalStateException("auth down");
                })
                .task("ping", 1, session -> RequestSpec.get("/ping"))
                .build();
        pool(profile, new RecordingExecutor(200), null);

        pool.ramp(5, 100.0);

        assertThatThrownBy(() -> pool.awaitRamp(Duration.ofSeconds(5)))
                .isInstanceOfSatisfying(PartialRampException.class, partial -> {
                    assertThat(partial.reached()).isZero();
                    assertThat(partial.target()).isEqualTo(5);
                    assertThat(partial.getCause()).hasMessage("auth down");
                });
        assertThat(pool.partialRamp()).isPresent();
        assertThat(pool.isRampComplete()).isFalse();
    }

    // --- Stop ---

    @Test
    void shouldInterruptUsersLeftAfterGracePeriod() throws InterruptedException {
        var executor = new RecordingExecutor(200, Duration.ofSeconds(30));
        pool(Profiles.health(), executor, null);
        pool.ramp(4, 100.0);
        assertThat(pool.awaitRamp(Duration.ofSeconds(5))).isTrue();
        await().atMost(Duration.ofSeconds(2)).until(() -> executor.requests().size() == 4);

        long started = System.nanoTime();
        pool.stop(StopMode.GRACEFUL, Duration.ofMillis(200));

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
        assertThat(pool.users()).extracting(VirtualUser::state).containsOnly(UserState.STOPPED);
        assertThat(pool.runningCount()).isZero();
        assertThat(stats.snapshot().category("GET /api/health").orElseThrow().cancelledCount()).isEqualTo(4);
        assertThat(pool.isStopped()).isTrue();
        assertThatThrownBy(() -> pool.ramp(1, 1.0)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldUseConfiguredThreadFactory() throws InterruptedException {
        var profile = Profiles.health();
        UserContext context = new UserContext(profile, TaskSelector.of(profile, Set.of()),
                new RecordingExecutor(200, Duration.ofMillis(20)), new ResponseClassifier(), stats, StopMode.GRACEFUL, 0);
        Set<String> names = ConcurrentHashMap.newKeySet();
        pool = new UserPool(context, r -> {
            Thread t = new Thread(r, "custom-" + names.size());
            names.add(t.getName());
            t.setDaemon(true);
            return t;
        }, 3, null, new SplittableRandom(1));

        pool.ramp(2, 100.0);

        assertThat(pool.awaitRamp(Duration.ofSeconds(5))).isTrue();
        assertThat(names).allMatch(name -> name.startsWith("custom-"));
        assertThat(names).hasSize(2);
    }
}

package io.horde.core.user;

import io.horde.api.classify.ClassificationPolicy;
import io.horde.api.profile.BehaviorProfile;
import io.horde.api.profile.WaitTime;
import io.horde.api.run.StopMode;
import io.horde.api.stats.CategoryStats;
import io.horde.api.task.RequestSpec;
import io.horde.api.task.TaskDefinition;
import io.horde.core.classify.ResponseClassifier;
import io.horde.core.select.TaskSelector;
import io.horde.core.stats.MicrometerStatsAggregator;
import io.horde.core.support.Profiles;
import io.horde.core.support.RecordingExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class VirtualUserTest {

    private final MicrometerStatsAggregator stats = new MicrometerStatsAggregator();
    private Thread thread;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (thread != null) {
            thread.interrupt();
            thread.join(2000);
        }
    }

    private UserContext context(BehaviorProfile profile, RecordingExecutor executor, StopMode mode, long cap) {
        return new UserContext(profile, TaskSelector.of(profile, Set.of()), executor,
                new ResponseClassifier(), stats, mode, cap);
    }

    private VirtualUser launch(VirtualUser user) {
        thread = new Thread(user, "test-" + user.id());
        thread.setDaemon(true);
        thread.start();
        return user;
    }

    // --- Loop ---

    @Test
    void shouldStopAfterIterationCap() throws InterruptedException {
        var executor = new RecordingExecutor(200);
        var user = launch(new VirtualUser("u-1", context(Profiles.health(), executor, StopMode.GRACEFUL, 5),
                new SplittableRandom(1)));

        assertThat(user.awaitStopped(Duration.ofSeconds(5))).isTrue();
        assertThat(user.iterations()).isEqualTo(5);
        assertThat(user.state()).isEqualTo(UserState.STOPPED);
        assertThat(executor.requests()).hasSize(5);
        assertThat(stats.snapshot().category("GET /api/health").orElseThrow().successCount()).isEqualTo(5);
    }

    @Test
    void shouldRunHooksAroundTheLoop() throws InterruptedException {
        List<String> calls = new CopyOnWriteArrayList<>();
        var profile = BehaviorProfile.named("hooked")
                .onStart(session -> calls.add("start:" + session.sessionId()))
                .onStop(session -> calls.add("stop"))
                .task("ping", 1, session -> RequestSpec.get("/ping"))
                .build();
        var user = launch(new VirtualUser("u-2", context(profile, new RecordingExecutor(200), StopMode.GRACEFUL, 2),
                new SplittableRandom(2)));

        assertThat(user.awaitStopped(Duration.ofSeconds(5))).isTrue();
        assertThat(calls).containsExactly("start:u-2", "stop");
    }

    @Test
    void shouldLetTasksMutateTheSession() throws InterruptedException {
        var profile = BehaviorProfile.named("counter")
                .task("count", 1, session -> {
                    int n = session.get("n", Integer.class).orElse(0);
                    session.put("n", n + 1);
                    return RequestSpec.get("/count");
                })
                .build();
        var user = launch(new VirtualUser("u-3", context(profile, new RecordingExecutor(200), StopMode.GRACEFUL, 4),
                new SplittableRandom(3)));

        assertThat(user.awaitStopped(Duration.ofSeconds(5))).isTrue();
        assertThat(user.session().get("n", Integer.class)).contains(4);
    }

    // --- Failures ---

    @Test
    void shouldNeverRunWhenStartHookFails() throws InterruptedException {
        AtomicBoolean stopHook = new AtomicBoolean();
        var profile = BehaviorProfile.named("broken")
                .onStart(session -> {
                    throw new IllegalStateException("login refused");
                })
                .onStop(session -> stopHook.set(true))
                .task("ping", 1, session -> RequestSpec.get("/ping"))
                .build();
        var executor = new RecordingExecutor(200);
        var user = launch(new VirtualUser("u-4", context(profile, executor, StopMode.GRACEFUL, 0),
                new SplittableRandom(4)));

        assertThat(user.awaitStopped(Duration.ofSeconds(5))).isTrue();
        assertThat(user.startFailure()).hasMessage("login refused");
        assertThat(user.iterations()).isZero();
        assertThat(executor.requests()).isEmpty();
        assertThat(stopHook).isFalse();
    }

    @Test
    void shouldRecordTaskBuildErrorsAsFailures() throws InterruptedException {
        var profile = BehaviorProfile.named("faulty")
                .task("explode", 1, session -> {
                    throw new IllegalStateException("no prompt");
                })
                .build();
        var executor = new RecordingExecutor(200);
        var user = launch(new VirtualUser("u-5", context(profile, executor, StopMode.GRACEFUL, 3),
                new SplittableRandom(5)));

        assertThat(user.awaitStopped(Duration.ofSeconds(5))).isTrue();
        CategoryStats failed = stats.snapshot().category("explode").orElseThrow();
        assertThat(failed.failureCount()).isEqualTo(3);
        assertThat(executor.requests()).isEmpty();
    }

    @Test
    void shouldApplyTaskPolicy() throws InterruptedException {
        var profile = BehaviorProfile.named("throttled")
                .task(TaskDefinition.builder("burst", session -> RequestSpec.get("/burst"))
                        .policy(ClassificationPolicy.defaults().tolerating(429))
                        .build())
                .build();
        var user = launch(new VirtualUser("u-6", context(profile, new RecordingExecutor(429), StopMode.GRACEFUL, 3),
                new SplittableRandom(6)));

        assertThat(user.awaitStopped(Duration.ofSeconds(5))).isTrue();
        CategoryStats burst = stats.snapshot().category("GET /burst").orElseThrow();
        assertThat(burst.expectedFailureCount()).isEqualTo(3);
        assertThat(burst.failureCount()).isZero();
    }

    // --- Stop ---

    @Test
    void shouldCutWaitShortOnStop() throws InterruptedException {
        var profile = BehaviorProfile.named("sleepy")
                .waitTime(WaitTime.constant(Duration.ofMinutes(5)))
                .task("ping", 1, session -> RequestSpec.get("/ping"))
                .build();
        var executor = new RecordingExecutor(200);
        var user = launch(new VirtualUser("u-7", context(profile, executor, StopMode.GRACEFUL, 0),
                new SplittableRandom(7)));
        await().atMost(Duration.ofSeconds(2)).until(() -> user.iterations() == 1);

        long started = System.nanoTime();
        user.requestStop();

        assertThat(user.awaitStopped(Duration.ofSeconds(2))).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(1));
        assertThat(executor.requests()).hasSize(1);
    }

    @Test
    void shouldFinishInFlightRequestOnGracefulStop() throws InterruptedException {
        var executor = new RecordingExecutor(200, Duration.ofMillis(500));
        var user = launch(new VirtualUser("u-8", context(Profiles.health(), executor, StopMode.GRACEFUL, 0),
                new SplittableRandom(8)));
        await().atMost(Duration.ofSeconds(2)).until(() -> !executor.requests().isEmpty());

        user.requestStop(StopMode.GRACEFUL);

        assertThat(user.awaitStopped(Duration.ofSeconds(3))).isTrue();
        CategoryStats health = stats.snapshot().category("GET /api/health").orElseThrow();
        assertThat(health.successCount()).isEqualTo(1);
        assertThat(health.cancelledCount()).isZero();
    }

    @Test
    void shouldCancelInFlightRequestOnImmediateStop() throws InterruptedException {
        var executor = new RecordingExecutor(200, Duration.ofSeconds(30));
        AtomicInteger stopHooks = new AtomicInteger();
        var profile = BehaviorProfile.named("slow")
                .onStop(session -> stopHooks.incrementAndGet())
                .task("slow", 1, session -> RequestSpec.get("/slow"))
                .build();
        var user = launch(new VirtualUser("u-9", context(profile, executor, StopMode.IMMEDIATE, 0),
                new SplittableRandom(9)));
        await().atMost(Duration.ofSeconds(2)).until(() -> !executor.requests().isEmpty());

        user.requestStop();

        assertThat(user.awaitStopped(Duration.ofSeconds(2))).isTrue();
        CategoryStats slow = stats.snapshot().category("GET /slow").orElseThrow();
        assertThat(slow.cancelledCount()).isEqualTo(1);
        assertThat(slow.failureCount()).isZero();
        assertThat(stopHooks).hasValue(1);
    }

    @Test
    void shouldNotStartWhenStoppedBeforeRunning() throws InterruptedException {
        var executor = new RecordingExecutor(200);
        var user = new VirtualUser("u-10", context(Profiles.health(), executor, StopMode.GRACEFUL, 0),
                new SplittableRandom(10));
        user.requestStop();

        launch(user);

        assertThat(user.awaitStopped(Duration.ofSeconds(2))).isTrue();
        assertThat(executor.requests()).isEmpty();
    }

    @Test
    void shouldNotifyListener() throws InterruptedException {
        List<String> events = new CopyOnWriteArrayList<>();
        var user = launch(new VirtualUser("u-11", context(Profiles.health(), new RecordingExecutor(200), StopMode.GRACEFUL, 1),
                new SplittableRandom(11), new VirtualUser.Listener() {
                    @Override
                    public void onRunning(VirtualUser u) {
                        events.add("running");
                    }

                    @Override
                    public void onExit(VirtualUser u) {
                        events.add("exit");
                    }
                }));

        assertThat(user.awaitStopped(Duration.ofSeconds(2))).isTrue();
        await().atMost(Duration.ofSeconds(1)).until(() -> events.size() == 2);
        assertThat(events).containsExactly("running", "exit");
    }
}

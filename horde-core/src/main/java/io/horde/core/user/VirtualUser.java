package io.horde.core.user;

import io.horde.api.classify.Classification;
import io.horde.api.outcome.ErrorKind;
import io.horde.api.outcome.RequestOutcome;
import io.horde.api.run.StopMode;
import io.horde.api.session.Session;
import io.horde.api.task.RequestSpec;
import io.horde.api.task.TaskDefinition;
import io.horde.core.session.DefaultSession;
import io.horde.core.wait.WaitTimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.SplittableRandom;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One simulated client executing a behavior profile on its own thread.
 * <p>
 * The loop is strictly sequential: select a task, build its request, execute, classify,
 * record, then wait. Only the wait and the in-flight request are suspension points, and
 * both react to a stop signal: the wait ends at once; the request finishes (graceful) or
 * is interrupted and recorded as cancelled (immediate).
 */
public class VirtualUser implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(VirtualUser.class);

    /**
     * Callbacks used by the owning pool.
     */
    public interface Listener {
        default void onRunning(VirtualUser user) {}

        default void onExit(VirtualUser user) {}
    }

    private static final Listener NO_LISTENER = new Listener() {};

    private final String id;
    private final UserContext context;
    private final Listener listener;
    private final Session session;
    private final SplittableRandom selectionRandom;
    private final WaitTimeProvider waitTimes;

    private final AtomicReference<UserState> state = new AtomicReference<>(UserState.STARTING);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicLong iterations = new AtomicLong();
    private volatile Thread runner;
    private volatile Throwable startFailure;

    public VirtualUser(String id, UserContext context, SplittableRandom random) {
        this(id, context, random, NO_LISTENER);
    }

    public VirtualUser(String id, UserContext context, SplittableRandom random, Listener listener) {
        this.id = id;
        this.context = context;
        this.listener = listener == null ? NO_LISTENER : listener;
        this.session = new DefaultSession(id);
        // independent streams so wait draws don't shift task selection
        this.selectionRandom = random.split();
        this.waitTimes = new WaitTimeProvider(random.split());
    }

    @Override
    public void run() {
        runner = Thread.currentThread();
        try {
            if (start()) {
                loop();
            }
        } catch (RuntimeException e) {
            log.error("User {} aborted", id, e);
        } finally {
            finish();
        }
    }

    private boolean start() {
        if (stopRequested()) {
            return false;
        }
        try {
            context.profile().onStart().run(session);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            startFailure = e;
            log.warn("User {} failed to start: {}", id, e.toString());
            return false;
        }
        if (!state.compareAndSet(UserState.STARTING, UserState.RUNNING)) {
            return false;
        }
        listener.onRunning(this);
        return true;
    }

    private void loop() {
        long cap = context.maxIterations();
        while (!stopRequested()) {
            iterate();
            long done = iterations.incrementAndGet();
            if (cap > 0 && done >= cap) {
                log.debug("User {} reached its iteration cap of {}", id, cap);
                break;
            }
            // graceful stop skips the wait
            if (stopRequested()) {
                break;
            }
            Duration pause = waitTimes.next(context.profile().waitTime());
            if (!pause.isZero() && pauseInterrupted(pause)) {
                break;
            }
        }
    }

    /**
     * @return true if the stop signal ended the pause
     */
    private boolean pauseInterrupted(Duration pause) {
        try {
            return stopSignal.await(pause.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    /**
     * One select / build / execute / classify / record cycle.
     */
    void iterate() {
        TaskDefinition task = context.selector().select(selectionRandom);
        RequestOutcome outcome = execute(task);
        Classification classification = context.classifier().classify(outcome, task.policy());
        context.stats().record(outcome, classification);
        if (log.isDebugEnabled() && !classification.verdict().isSuccessful()) {
            log.debug("User {} task '{}' -> {} ({})", id, task.name(), classification.verdict(), classification.reason());
        }
    }

    private RequestOutcome execute(TaskDefinition task) {
        RequestSpec spec;
        try {
            spec = task.task().build(session);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RequestOutcome.error(task.name(), ErrorKind.CANCELLED, Duration.ZERO, "cancelled", Instant.now());
        } catch (Exception e) {
            log.debug("Task '{}' of user {} could not build its request: {}", task.name(), id, e.toString());
            return RequestOutcome.error(task.name(), ErrorKind.TASK, Duration.ZERO, e.toString(), Instant.now());
        }

        Duration timeout = spec.timeout() != null ? spec.timeout() : task.timeout();
        Instant started = Instant.now();
        try {
            return context.executor().execute(spec, timeout);
        } catch (RuntimeException e) {
            log.debug("Executor failed for {} of user {}: {}", spec.category(), id, e.toString());
            return RequestOutcome.error(spec.category(), ErrorKind.TRANSPORT,
                    Duration.between(started, Instant.now()), e.toString(), started);
        }
    }

    private void finish() {
        // clear a stop interrupt so the stop hook can do its own I/O
        boolean interrupted = Thread.interrupted();
        if (startFailure == null && state.get() != UserState.STARTING) {
            state.set(UserState.STOPPING);
            runStopHook();
        }
        state.set(UserState.STOPPED);
        if (interrupted) {
            log.debug("User {} stopped by interrupt after {} iterations", id, iterations.get());
        }
        try {
            listener.onExit(this);
        } finally {
            stopped.countDown();
        }
    }

    private void runStopHook() {
        try {
            context.profile().onStop().run(session);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Stop hook of user {} interrupted", id);
        } catch (Exception e) {
            log.warn("Stop hook of user {} failed: {}", id, e.toString());
        }
    }

    private boolean stopRequested() {
        return stopSignal.getCount() == 0 || Thread.currentThread().isInterrupted();
    }

    /**
     * Signal the user to stop. In immediate mode the in-flight request is interrupted.
     */
    public void requestStop(StopMode mode) {
        stopSignal.countDown();
        state.compareAndSet(UserState.RUNNING, UserState.STOPPING);
        if (mode == StopMode.IMMEDIATE) {
            interrupt();
        }
    }

    public void requestStop() {
        requestStop(context.stopMode());
    }

    /**
     * Interrupt the user's thread regardless of stop mode; used after the grace period.
     */
    public void forceStop() {
        stopSignal.countDown();
        interrupt();
    }

    private void interrupt() {
        Thread t = runner;
        if (t != null && state.get() != UserState.STOPPED) {
            t.interrupt();
        }
    }

    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public String id() {
        return id;
    }

    public UserState state() {
        return state.get();
    }

    public boolean isAlive() {
        return state.get() != UserState.STOPPED;
    }

    public long iterations() {
        return iterations.get();
    }

    public Throwable startFailure() {
        return startFailure;
    }

    public Session session() {
        return session;
    }

    @Override
    public String toString() {
        return "VirtualUser[" + id + ", " + state.get() + ", iterations=" + iterations.get() + "]";
    }
}

package io.horde.core.stats;

import io.horde.api.classify.Classification;
import io.horde.api.classify.Verdict;
import io.horde.api.outcome.RequestOutcome;
import io.horde.api.stats.CategoryStats;
import io.horde.api.stats.StatsAggregator;
import io.horde.api.stats.StatsSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.distribution.HistogramSnapshot;
import io.micrometer.core.instrument.distribution.ValueAtPercentile;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.function.Consumer;

/**
 * Default statistics aggregator using Micrometer.
 * <p>
 * Each category gets its own latency timer and verdict counters, created lazily in a
 * {@link ConcurrentHashMap}, so writers of different categories never contend and writers
 * of the same category only touch lock-free meters. Every outcome is also recorded under
 * the {@value StatsSnapshot#TOTAL} row.
 * <p>
 * Cancelled outcomes are counted but not timed: their latency says nothing about the target.
 */
public class MicrometerStatsAggregator implements StatsAggregator {

    private static final Logger log = LoggerFactory.getLogger(MicrometerStatsAggregator.class);

    static final String LATENCY = "horde.request.latency";
    static final String SUCCESS = "horde.requests.success";
    static final String FAILURE = "horde.requests.failure";
    static final String EXPECTED_FAILURE = "horde.requests.expected_failure";
    static final String CANCELLED = "horde.requests.cancelled";
    static final String ACTIVE_USERS = "horde.users.active";

    // the total row gets its own scope so a category named like it cannot share its meters
    static final String SCOPE_CATEGORY = "category";
    static final String SCOPE_TOTAL = "total";

    private final MeterRegistry registry;
    private final Map<String, StatEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, AtomicLongHolder> activeUsers = new ConcurrentHashMap<>();
    private final List<Meter> gauges = new CopyOnWriteArrayList<>();
    private final List<Consumer<StatsSnapshot>> listeners = new CopyOnWriteArrayList<>();
    private final List<StatsSnapshot> historicalSnapshots = new CopyOnWriteArrayList<>();
    private volatile StatEntry total;
    private volatile long startNanos = System.nanoTime();
    private ScheduledExecutorService scheduler;

    public MicrometerStatsAggregator() {
        this(new SimpleMeterRegistry());
    }

    public MicrometerStatsAggregator(MeterRegistry registry) {
        this.registry = registry;
        this.total = new StatEntry(StatsSnapshot.TOTAL, SCOPE_TOTAL);
    }

    @Override
    public void record(RequestOutcome outcome, Classification classification) {
        entry(outcome.category()).record(outcome, classification);
        total.record(outcome, classification);
    }

    @Override
    public void recordActiveUsers(String profileName, int count) {
        activeUsers.computeIfAbsent(profileName, name -> {
            var holder = new AtomicLongHolder();
            gauges.add(Gauge.builder(ACTIVE_USERS, holder, AtomicLongHolder::get)
                    .tag("profile", name)
                    .register(registry));
            return holder;
        }).set(count);
    }

    @Override
    public StatsSnapshot snapshot() {
        Instant now = Instant.now();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

        Map<String, CategoryStats> categories = new LinkedHashMap<>();
        for (StatEntry entry : entries.values()) {
            categories.put(entry.name, entry.rollup(elapsed));
        }
        int active = (int) activeUsers.values().stream().mapToDouble(AtomicLongHolder::get).sum();
        return new StatsSnapshot(now, elapsed, active, categories, total.rollup(elapsed));
    }

    @Override
    public void reset() {
        entries.values().forEach(StatEntry::remove);
        entries.clear();
        total.remove();
        total = new StatEntry(StatsSnapshot.TOTAL, SCOPE_TOTAL);
        gauges.forEach(registry::remove);
        gauges.clear();
        activeUsers.clear();
        historicalSnapshots.clear();
        startNanos = System.nanoTime();
        log.debug("Statistics reset");
    }

    @Override
    public void onSnapshot(Consumer<StatsSnapshot> listener) {
        listeners.add(listener);
    }

    @Override
    public synchronized void start(Duration interval) {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "horde-stats-collector");
            t.setDaemon(true);
            return t;
        });

        scheduler.scheduleAtFixedRate(() -> {
            try {
                StatsSnapshot snap = snapshot();
                historicalSnapshots.add(snap);
                listeners.forEach(l -> l.accept(snap));
            } catch (Exception e) {
                log.error("Error collecting statistics snapshot", e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);

        log.info("Statistics collection started with interval: {}ms", interval.toMillis());
    }

    @Override
    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdown();
            scheduler = null;
            log.info("Statistics collection stopped");
        }
    }

    public MeterRegistry registry() {
        return registry;
    }

    public List<StatsSnapshot> historicalSnapshots() {
        return Collections.unmodifiableList(new ArrayList<>(historicalSnapshots));
    }

    private StatEntry entry(String category) {
        return entries.computeIfAbsent(category, name -> new StatEntry(name, SCOPE_CATEGORY));
    }

    /**
     * Meters of one category.
     */
    private final class StatEntry {
        private final String name;
        private final Tags tags;
        private final Timer latency;
        private final Counter success;
        private final Counter failure;
        private final Counter expectedFailure;
        private final Counter cancelled;
        private final LongAccumulator minNanos = new LongAccumulator(Math::min, Long.MAX_VALUE);
        private final LongAccumulator maxNanos = new LongAccumulator(Math::max, 0L);

        StatEntry(String name, String scope) {
            this.name = name;
            this.tags = Tags.of("category", name, "scope", scope);
            this.latency = Timer.builder(LATENCY)
                    .tags(tags)
                    .publishPercentiles(0.5, 0.95, 0.99)
                    .percentilePrecision(2)
                    .distributionStatisticExpiry(Duration.ofDays(1))
                    .register(registry);
            this.success = counter(SUCCESS);
            this.failure = counter(FAILURE);
            this.expectedFailure = counter(EXPECTED_FAILURE);
            this.cancelled = counter(CANCELLED);
        }

        private Counter counter(String meterName) {
            return Counter.builder(meterName).tags(tags).register(registry);
        }

        /**
         * Timer first, verdict counters second; {@link #rollup} reads them in reverse order.
         */
        void record(RequestOutcome outcome, Classification classification) {
            if (classification.verdict() == Verdict.CANCELLED) {
                cancelled.increment();
                return;
            }
            long nanos = outcome.latency().toNanos();
            minNanos.accumulate(nanos);
            maxNanos.accumulate(nanos);
            latency.record(nanos, TimeUnit.NANOSECONDS);
            switch (classification.verdict()) {
                case SUCCESS -> success.increment();
                case EXPECTED_FAILURE -> expectedFailure.increment();
                case FAILURE -> failure.increment();
                default -> throw new IllegalStateException("Unexpected verdict: " + classification.verdict());
            }
        }

        CategoryStats rollup(Duration elapsed) {
            // counters before the timer, so no verdict count can exceed the timed count
            long successes = (long) success.count();
            long failures = (long) failure.count();
            long expectedFailures = (long) expectedFailure.count();
            long cancelledCount = (long) cancelled.count();
            HistogramSnapshot hist = latency.takeSnapshot();
            long timed = hist.count();
            long count = timed + cancelledCount;
            double seconds = elapsed.toNanos() / 1_000_000_000.0;

            return new CategoryStats(
                    name,
                    count,
                    successes,
                    failures,
                    expectedFailures,
                    cancelledCount,
                    count > 0 ? (double) failures / count : 0.0,
                    timed > 0 ? hist.mean(TimeUnit.MILLISECONDS) : 0.0,
                    timed > 0 ? minNanos.get() / 1_000_000.0 : 0.0,
                    timed > 0 ? maxNanos.get() / 1_000_000.0 : 0.0,
                    percentile(hist, 0.5),
                    percentile(hist, 0.95),
                    percentile(hist, 0.99),
                    seconds > 0 ? count / seconds : 0.0
            );
        }

        void remove() {
            registry.remove(latency);
            registry.remove(success);
            registry.remove(failure);
            registry.remove(expectedFailure);
            registry.remove(cancelled);
        }
    }

    private static double percentile(HistogramSnapshot hist, double percentile) {
        if (hist.count() == 0) {
            return 0.0;
        }
        for (ValueAtPercentile value : hist.percentileValues()) {
            if (Math.abs(value.percentile() - percentile) < 1e-9) {
                return value.value(TimeUnit.MILLISECONDS);
            }
        }
        return 0.0;
    }

    /**
     * Mutable holder for gauge values.
     */
    private static class AtomicLongHolder {
        private volatile long value;

        void set(long value) { this.value = value; }
        double get() { return value; }
    }
}

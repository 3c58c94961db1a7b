package org.neuralchilli.gantt.monitoring;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters and timings for the scheduling engine.
 *
 * Tracks metrics for:
 * - dependency edges added and refused by the cycle guard
 * - cascades computed, applied and confirmed against a stale preview
 * - sort key renormalizations
 */
@ApplicationScoped
public class SchedulingMonitor {

    private static final Logger log = LoggerFactory.getLogger(SchedulingMonitor.class);

    // Dependency metrics
    private final LongAdder dependenciesAdded = new LongAdder();
    private final LongAdder cycleRejections = new LongAdder();

    // Cascade metrics
    private final LongAdder cascadesComputed = new LongAdder();
    private final LongAdder cascadesApplied = new LongAdder();
    private final LongAdder tasksShifted = new LongAdder();
    private final LongAdder stalePreviews = new LongAdder();
    private final LongAdder cascadesRejected = new LongAdder();

    // Sequencer metrics
    private final LongAdder reorders = new LongAdder();
    private final LongAdder renormalizations = new LongAdder();

    // Timing metrics
    private final Map<String, TimingStats> timingStats = new ConcurrentHashMap<>();

    public void recordDependencyAdded() {
        dependenciesAdded.increment();
    }

    /**
     * Record an edge refused because it would close a cycle.
     */
    public void recordCycleRejected() {
        cycleRejections.increment();
    }

    /**
     * Get the share of edge insertions refused by the cycle guard.
     */
    public double getCycleRejectionRate() {
        long rejected = cycleRejections.sum();
        long total = rejected + dependenciesAdded.sum();
        return total > 0 ? (rejected * 100.0) / total : 0.0;
    }

    public void recordCascadeComputed() {
        cascadesComputed.increment();
    }

    /**
     * Record a cascade written to the store.
     *
     * @param affectedTasks number of dependents shifted
     */
    public void recordCascadeApplied(int affectedTasks) {
        cascadesApplied.increment();
        tasksShifted.add(affectedTasks);
    }

    public void recordStalePreview() {
        stalePreviews.increment();
    }

    /**
     * Record a date change refused by validation (nothing written).
     */
    public void recordCascadeRejected() {
        cascadesRejected.increment();
    }

    /**
     * Get average number of dependents shifted per applied cascade.
     */
    public double getAverageCascadeSize() {
        long applied = cascadesApplied.sum();
        return applied > 0 ? (double) tasksShifted.sum() / applied : 0.0;
    }

    public void recordReorder() {
        reorders.increment();
    }

    public void recordRenormalization() {
        renormalizations.increment();
    }

    /**
     * Start timing an operation.
     *
     * @param operation Operation name
     * @return Timer handle to stop timing
     */
    public Timer startTimer(String operation) {
        return new Timer(operation, Instant.now());
    }

    /**
     * Timer handle for operation timing.
     */
    public class Timer {
        private final String operation;
        private final Instant start;

        private Timer(String operation, Instant start) {
            this.operation = operation;
            this.start = start;
        }

        /**
         * Stop timing and record duration.
         */
        public void stop() {
            recordTiming(operation, Duration.between(start, Instant.now()));
        }
    }

    private void recordTiming(String operation, Duration duration) {
        timingStats.compute(operation, (key, stats) -> {
            if (stats == null) {
                stats = new TimingStats();
            }
            stats.record(duration);
            return stats;
        });
    }

    public TimingStats getTimingStats(String operation) {
        return timingStats.getOrDefault(operation, new TimingStats());
    }

    /**
     * Statistics for operation timing.
     */
    public static class TimingStats {
        private final LongAdder count = new LongAdder();
        private final LongAdder totalNanos = new LongAdder();
        private final AtomicLong minNanos = new AtomicLong(Long.MAX_VALUE);
        private final AtomicLong maxNanos = new AtomicLong(0);

        void record(Duration duration) {
            long nanos = duration.toNanos();
            count.increment();
            totalNanos.add(nanos);
            minNanos.updateAndGet(current -> Math.min(current, nanos));
            maxNanos.updateAndGet(current -> Math.max(current, nanos));
        }

        public long getCount() {
            return count.sum();
        }

        public Duration getAverage() {
            long cnt = count.sum();
            return cnt > 0 ? Duration.ofNanos(totalNanos.sum() / cnt) : Duration.ZERO;
        }

        public Duration getMin() {
            long min = minNanos.get();
            return min < Long.MAX_VALUE ? Duration.ofNanos(min) : Duration.ZERO;
        }

        public Duration getMax() {
            return Duration.ofNanos(maxNanos.get());
        }

        @Override
        public String toString() {
            return String.format(
                    "TimingStats[count=%d, avg=%dus, min=%dus, max=%dus]",
                    getCount(),
                    getAverage().toNanos() / 1000,
                    getMin().toNanos() / 1000,
                    getMax().toNanos() / 1000
            );
        }
    }

    public SchedulingReport getReport() {
        return new SchedulingReport(
                dependenciesAdded.sum(),
                cycleRejections.sum(),
                getCycleRejectionRate(),
                cascadesComputed.sum(),
                cascadesApplied.sum(),
                getAverageCascadeSize(),
                stalePreviews.sum(),
                cascadesRejected.sum(),
                reorders.sum(),
                renormalizations.sum()
        );
    }

    /**
     * Scheduling report snapshot.
     */
    public record SchedulingReport(
            long dependenciesAdded,
            long cycleRejections,
            double cycleRejectionRate,
            long cascadesComputed,
            long cascadesApplied,
            double avgCascadeSize,
            long stalePreviews,
            long cascadesRejected,
            long reorders,
            long renormalizations
    ) {
        @Override
        public String toString() {
            return String.format("""
                Scheduling Report:
                ==================
                Dependencies:
                  Added: %d, Refused (cycle): %d (%.1f%%)

                Cascades:
                  Computed: %d, Applied: %d
                  Avg Tasks Shifted: %.1f
                  Stale Previews: %d, Rejected: %d

                Sequencer:
                  Reorders: %d, Renormalizations: %d
                """,
                    dependenciesAdded, cycleRejections, cycleRejectionRate,
                    cascadesComputed, cascadesApplied,
                    avgCascadeSize,
                    stalePreviews, cascadesRejected,
                    reorders, renormalizations
            );
        }
    }

    /**
     * Reset all metrics (useful for testing).
     */
    public void reset() {
        dependenciesAdded.reset();
        cycleRejections.reset();
        cascadesComputed.reset();
        cascadesApplied.reset();
        tasksShifted.reset();
        stalePreviews.reset();
        cascadesRejected.reset();
        reorders.reset();
        renormalizations.reset();
        timingStats.clear();
        log.info("Scheduling metrics reset");
    }

    public void logReport() {
        log.info("\n{}", getReport());
    }
}

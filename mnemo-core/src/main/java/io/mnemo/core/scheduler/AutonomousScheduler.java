package io.mnemo.core.scheduler;

import io.mnemo.core.config.model.StorageConfig;
import io.mnemo.core.memory.MemoryRecord;
import io.mnemo.core.optimize.CapacityStatus;
import io.mnemo.core.optimize.OptimizationResult;
import io.mnemo.core.optimize.StorageOptimizer;
import io.mnemo.core.optimize.StorageReport;
import io.mnemo.core.purge.PurgeStrategy;
import io.mnemo.core.time.TimeSource;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides when the optimizer runs. At most one run is in flight per instance; a caller that
 * arrives during a run gets {@link SchedulerResult.Outcome#SKIPPED_IN_FLIGHT} immediately.
 */
public final class AutonomousScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(AutonomousScheduler.class);
    private static final double CRITICAL_TARGET_CAP = 0.2;
    private static final double WARNING_TARGET_CAP = 0.1;
    private static final double POOR_FEEDBACK = 0.3;
    private static final double GOOD_FEEDBACK = 0.8;
    private static final double MIN_PURGE_PERCENT = 0.05;
    private static final double MAX_PURGE_PERCENT = 0.3;
    private static final int ANALYTICS_HISTORY = 10;

    private final StorageOptimizer optimizer;
    private final TimeSource timeSource;
    private final boolean learningEnabled;
    private final int historyLimit;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.IDLE);

    private final Deque<OptimizationHistoryRecord> history = new ArrayDeque<>();
    private AutonomousSettings settings;
    private PerformanceTracking tracking = PerformanceTracking.initial();
    private Instant lastOptimization;

    public AutonomousScheduler(StorageConfig config, StorageOptimizer optimizer, TimeSource timeSource) {
        StorageConfig validated = Objects.requireNonNull(config, "config must not be null").validate();
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer must not be null");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
        this.learningEnabled = validated.learningEnabled();
        this.historyLimit = validated.historyLimit();
        this.settings = AutonomousSettings.from(validated);
    }

    public SchedulerResult monitorAndOptimize(Collection<MemoryRecord> memories) {
        return monitorAndOptimize(memories, false);
    }

    public SchedulerResult monitorAndOptimize(Collection<MemoryRecord> memories, boolean force) {
        if (!inFlight.compareAndSet(false, true)) {
            LOG.debug("Optimization already in flight, skipping");
            return SchedulerResult.skipped();
        }
        try {
            state.set(SchedulerState.EVALUATING);
            List<MemoryRecord> snapshot = memories == null ? List.of() : List.copyOf(
                memories.stream().filter(Objects::nonNull).toList()
            );
            StorageReport report = optimizer.assess(snapshot);
            AutonomousSettings current = settings();
            TriggerReason trigger = trigger(report.status(), current, force);
            if (trigger == null) {
                LOG.debug("No optimization due (status {})", report.status());
                return SchedulerResult.notDue(report);
            }

            state.set(SchedulerState.OPTIMIZING);
            PurgeStrategy strategy = strategyFor(trigger);
            double target = targetFor(trigger, current);
            OptimizationResult result = optimizer.optimize(snapshot, strategy, target);
            OptimizationHistoryRecord record = complete(trigger, result);
            LOG.info(
                "Autonomous optimization ({}) with {} removed {} memories: {}",
                trigger.wireName(),
                strategy.wireName(),
                result.memoriesRemoved(),
                result.status().wireName()
            );
            return new SchedulerResult(SchedulerResult.Outcome.OPTIMIZED, trigger, report, result, record.id());
        } finally {
            state.set(SchedulerState.IDLE);
            inFlight.set(false);
        }
    }

    public SchedulerState state() {
        return state.get();
    }

    public synchronized void provideFeedback(String optimizationId, double satisfaction) {
        if (!(satisfaction >= 0.0 && satisfaction <= 1.0)) {
            throw new IllegalArgumentException("satisfaction must be in [0, 1]");
        }
        tracking = tracking.withFeedback(satisfaction);
        if (learningEnabled) {
            double percent = settings.maxAutoPurgePercent();
            if (satisfaction < POOR_FEEDBACK) {
                percent = Math.max(percent * 0.8, MIN_PURGE_PERCENT);
            } else if (satisfaction > GOOD_FEEDBACK) {
                percent = Math.min(percent * 1.1, MAX_PURGE_PERCENT);
            }
            settings = settings.withMaxAutoPurgePercent(percent);
        }
        LOG.info("Feedback for optimization {}: {}", optimizationId, satisfaction);
    }

    public synchronized void setAutonomousMode(boolean enabled) {
        settings = settings.withAutoOptimizeEnabled(enabled);
        LOG.info("Autonomous optimization {}", enabled ? "enabled" : "disabled");
    }

    public synchronized void resetLearningData() {
        history.clear();
        tracking = PerformanceTracking.initial();
        LOG.info("Scheduler learning data reset");
    }

    public synchronized AutonomousSettings settings() {
        return settings;
    }

    public synchronized PerformanceTracking performance() {
        return tracking;
    }

    public synchronized List<OptimizationHistoryRecord> history() {
        return List.copyOf(history);
    }

    public synchronized Instant lastOptimization() {
        return lastOptimization;
    }

    public synchronized OptimizationAnalytics analytics() {
        List<OptimizationHistoryRecord> all = new ArrayList<>(history);
        List<OptimizationHistoryRecord> recent = all.subList(Math.max(0, all.size() - ANALYTICS_HISTORY), all.size());
        return new OptimizationAnalytics(settings, tracking, recent, learningEnabled, lastOptimization);
    }

    private synchronized TriggerReason trigger(CapacityStatus status, AutonomousSettings current, boolean force) {
        if (status == CapacityStatus.CRITICAL) {
            return TriggerReason.CRITICAL_CAPACITY;
        }
        if (status == CapacityStatus.WARNING && current.autoOptimizeEnabled()) {
            return TriggerReason.WARNING_CAPACITY;
        }
        if (current.autoOptimizeEnabled() && intervalElapsed(current)) {
            return TriggerReason.SCHEDULED_INTERVAL;
        }
        return force ? TriggerReason.FORCED : null;
    }

    private boolean intervalElapsed(AutonomousSettings current) {
        if (lastOptimization == null) {
            return true;
        }
        long intervalSeconds = (long) (current.optimizationIntervalHours() * 3600);
        return timeSource.ageOf(lastOptimization).compareTo(Duration.ofSeconds(intervalSeconds)) >= 0;
    }

    private synchronized OptimizationHistoryRecord complete(TriggerReason trigger, OptimizationResult result) {
        Instant now = timeSource.now();
        OptimizationHistoryRecord record = new OptimizationHistoryRecord(
            UUID.randomUUID().toString(),
            now,
            trigger,
            result.strategyUsed(),
            result.status(),
            result.memoriesRemoved(),
            result.sizeSavedMb()
        );
        history.addLast(record);
        while (history.size() > historyLimit) {
            history.removeFirst();
        }
        if (learningEnabled) {
            tracking = tracking.afterRun(result.memoriesRemoved(), result.sizeSavedMb());
        }
        lastOptimization = now;
        return record;
    }

    private static PurgeStrategy strategyFor(TriggerReason trigger) {
        return switch (trigger) {
            case CRITICAL_CAPACITY -> PurgeStrategy.HYBRID;
            case WARNING_CAPACITY -> PurgeStrategy.PRIORITY_BASED;
            case SCHEDULED_INTERVAL, FORCED -> PurgeStrategy.CONTEXT_AWARE;
        };
    }

    private static double targetFor(TriggerReason trigger, AutonomousSettings current) {
        return switch (trigger) {
            case CRITICAL_CAPACITY -> Math.min(current.maxAutoPurgePercent(), CRITICAL_TARGET_CAP);
            case WARNING_CAPACITY -> Math.min(current.maxAutoPurgePercent(), WARNING_TARGET_CAP);
            case SCHEDULED_INTERVAL, FORCED -> 0.0;
        };
    }
}

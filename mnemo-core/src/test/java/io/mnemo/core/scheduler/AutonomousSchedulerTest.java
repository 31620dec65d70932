package io.mnemo.core.scheduler;

import static io.mnemo.core.TestMemories.memory;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.mnemo.core.MutableClock;
import io.mnemo.core.TestMemories;
import io.mnemo.core.config.model.StorageConfig;
import io.mnemo.core.memory.MemoryRecord;
import io.mnemo.core.optimize.OptimizationResult;
import io.mnemo.core.optimize.PolicyStorageOptimizer;
import io.mnemo.core.optimize.Recommendation;
import io.mnemo.core.optimize.StorageOptimizer;
import io.mnemo.core.optimize.StorageReport;
import io.mnemo.core.purge.PurgeStrategy;
import io.mnemo.core.time.TimeSource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class AutonomousSchedulerTest {

    private final MutableClock clock = new MutableClock(TestMemories.NOW);
    private final TimeSource timeSource = new TimeSource(clock);
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldRunOnColdStartAndThenWaitForInterval() {
        AutonomousScheduler scheduler = scheduler(StorageConfig.defaults());
        List<MemoryRecord> memories = memories(3);

        SchedulerResult first = scheduler.monitorAndOptimize(memories);

        assertThat(first.optimizationPerformed()).isTrue();
        assertThat(first.trigger()).isEqualTo(TriggerReason.SCHEDULED_INTERVAL);
        assertThat(first.optimization().strategyUsed()).isEqualTo(PurgeStrategy.CONTEXT_AWARE);
        assertThat(scheduler.lastOptimization()).isEqualTo(TestMemories.NOW);
        assertThat(scheduler.history()).hasSize(1);
        assertThat(scheduler.history().get(0).id()).isEqualTo(first.historyId());

        assertThat(scheduler.monitorAndOptimize(memories).outcome()).isEqualTo(SchedulerResult.Outcome.NOT_DUE);
        clock.advance(Duration.ofHours(23));
        assertThat(scheduler.monitorAndOptimize(memories).optimizationPerformed()).isFalse();
        assertThat(scheduler.history()).hasSize(1);

        clock.advance(Duration.ofHours(1));
        SchedulerResult due = scheduler.monitorAndOptimize(memories);
        assertThat(due.trigger()).isEqualTo(TriggerReason.SCHEDULED_INTERVAL);
        assertThat(scheduler.history()).hasSize(2);
        assertThat(scheduler.lastOptimization()).isEqualTo(TestMemories.NOW.plus(Duration.ofHours(24)));
    }

    @Test
    void shouldOnlyRunWhenForcedWhileAutonomousModeIsOff() {
        AutonomousScheduler scheduler = scheduler(TestMemories.config(10_000, 100, false, true, 100));
        List<MemoryRecord> memories = memories(3);

        SchedulerResult idle = scheduler.monitorAndOptimize(memories);
        SchedulerResult forced = scheduler.monitorAndOptimize(memories, true);

        assertThat(idle.outcome()).isEqualTo(SchedulerResult.Outcome.NOT_DUE);
        assertThat(idle.report().totalMemories()).isEqualTo(3);
        assertThat(forced.trigger()).isEqualTo(TriggerReason.FORCED);
        assertThat(forced.optimization().strategyUsed()).isEqualTo(PurgeStrategy.CONTEXT_AWARE);
        assertThat(scheduler.history()).hasSize(1);
    }

    @Test
    void shouldUsePriorityStrategyWithModerateTargetAtWarningCapacity() {
        AutonomousScheduler scheduler = scheduler(TestMemories.config(10, 100));

        SchedulerResult result = scheduler.monitorAndOptimize(memories(8));

        assertThat(result.trigger()).isEqualTo(TriggerReason.WARNING_CAPACITY);
        assertThat(result.optimization().strategyUsed()).isEqualTo(PurgeStrategy.PRIORITY_BASED);
        assertThat(result.optimization().memoriesRemoved()).isEqualTo(1);
        assertThat(result.report().recommendations()).extracting(Recommendation::action).contains("optimize_storage");
    }

    @Test
    void shouldIgnoreWarningCapacityWhenAutonomousModeIsOff() {
        AutonomousScheduler scheduler = scheduler(TestMemories.config(10, 100, false, true, 100));

        assertThat(scheduler.monitorAndOptimize(memories(8)).outcome()).isEqualTo(SchedulerResult.Outcome.NOT_DUE);
    }

    @Test
    void shouldAlwaysActOnCriticalCapacityWithHybridStrategy() {
        AutonomousScheduler scheduler = scheduler(TestMemories.config(10, 100, false, true, 100));

        SchedulerResult result = scheduler.monitorAndOptimize(memories(10));

        assertThat(result.trigger()).isEqualTo(TriggerReason.CRITICAL_CAPACITY);
        assertThat(result.optimization().strategyUsed()).isEqualTo(PurgeStrategy.HYBRID);
        assertThat(result.optimization().memoriesRemoved()).isEqualTo(2);
        assertThat(scheduler.performance().optimizationsPerformed()).isEqualTo(1);
        assertThat(scheduler.performance().totalMemoriesPurged()).isEqualTo(2);
    }

    @Test
    void shouldKeepHistoryBoundedToConfiguredLimit() {
        AutonomousScheduler scheduler = scheduler(TestMemories.config(10_000, 100, false, true, 3));
        List<MemoryRecord> memories = memories(3);
        List<String> runIds = new ArrayList<>();

        for (int i = 0; i < 5; i++) {
            clock.advance(Duration.ofMinutes(1));
            runIds.add(scheduler.monitorAndOptimize(memories, true).historyId());
        }

        assertThat(scheduler.history()).extracting(OptimizationHistoryRecord::id).containsExactlyElementsOf(runIds.subList(2, 5));
        assertThat(scheduler.performance().optimizationsPerformed()).isEqualTo(5);
    }

    @Test
    void shouldExposeLastTenRunsInAnalytics() {
        AutonomousScheduler scheduler = scheduler(TestMemories.config(10_000, 100, false, true, 100));
        List<MemoryRecord> memories = memories(2);
        for (int i = 0; i < 12; i++) {
            scheduler.monitorAndOptimize(memories, true);
        }

        OptimizationAnalytics analytics = scheduler.analytics();

        assertThat(analytics.recentHistory()).hasSize(10);
        assertThat(analytics.recentHistory()).containsExactlyElementsOf(scheduler.history().subList(2, 12));
        assertThat(analytics.performance().optimizationsPerformed()).isEqualTo(12);
        assertThat(analytics.learningEnabled()).isTrue();
        assertThat(analytics.lastOptimization()).isEqualTo(TestMemories.NOW);
    }

    @Test
    void shouldAdaptPurgeAggressivenessFromFeedback() {
        AutonomousScheduler scheduler = scheduler(StorageConfig.defaults());

        scheduler.provideFeedback("run-1", 0.1);
        assertThat(scheduler.settings().maxAutoPurgePercent()).isCloseTo(0.12, within(1e-9));
        scheduler.provideFeedback("run-2", 0.5);
        assertThat(scheduler.settings().maxAutoPurgePercent()).isCloseTo(0.12, within(1e-9));
        scheduler.provideFeedback("run-3", 0.9);
        assertThat(scheduler.settings().maxAutoPurgePercent()).isCloseTo(0.132, within(1e-9));

        for (int i = 0; i < 30; i++) {
            scheduler.provideFeedback("poor", 0.0);
        }
        assertThat(scheduler.settings().maxAutoPurgePercent()).isEqualTo(0.05);
        for (int i = 0; i < 30; i++) {
            scheduler.provideFeedback("great", 1.0);
        }
        assertThat(scheduler.settings().maxAutoPurgePercent()).isEqualTo(0.3);
    }

    @Test
    void shouldRejectFeedbackOutsideUnitInterval() {
        AutonomousScheduler scheduler = scheduler(StorageConfig.defaults());

        assertThatThrownBy(() -> scheduler.provideFeedback("run", 1.2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> scheduler.provideFeedback("run", -0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> scheduler.provideFeedback("run", Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldNotAdaptSettingsWhenLearningIsDisabled() {
        AutonomousScheduler scheduler = scheduler(TestMemories.config(10_000, 100, true, false, 100));

        scheduler.provideFeedback("run", 0.1);

        assertThat(scheduler.settings().maxAutoPurgePercent()).isEqualTo(0.15);
        assertThat(scheduler.performance().userSatisfactionScore()).isEqualTo(0.1);
    }

    @Test
    void shouldStopScheduledRunsWhenAutonomousModeIsDisabled() {
        AutonomousScheduler scheduler = scheduler(StorageConfig.defaults());
        scheduler.setAutonomousMode(false);

        assertThat(scheduler.monitorAndOptimize(memories(3)).outcome()).isEqualTo(SchedulerResult.Outcome.NOT_DUE);

        scheduler.setAutonomousMode(true);
        assertThat(scheduler.monitorAndOptimize(memories(3)).trigger()).isEqualTo(TriggerReason.SCHEDULED_INTERVAL);
    }

    @Test
    void shouldResetHistoryAndTracking() {
        AutonomousScheduler scheduler = scheduler(StorageConfig.defaults());
        scheduler.monitorAndOptimize(memories(3), true);

        scheduler.resetLearningData();

        assertThat(scheduler.history()).isEmpty();
        assertThat(scheduler.performance()).isEqualTo(PerformanceTracking.initial());
    }

    @Test
    void shouldSkipConcurrentCallerWhileRunIsInFlight() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        StorageOptimizer real = PolicyStorageOptimizer.create(StorageConfig.defaults(), timeSource);
        StorageOptimizer blocking = new BlockingOptimizer(real, entered, release);
        AutonomousScheduler scheduler = new AutonomousScheduler(StorageConfig.defaults(), blocking, timeSource);
        List<MemoryRecord> memories = memories(3);

        Future<SchedulerResult> first = executor.submit(() -> scheduler.monitorAndOptimize(memories, true));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        SchedulerResult concurrent = scheduler.monitorAndOptimize(memories, true);
        assertThat(concurrent.outcome()).isEqualTo(SchedulerResult.Outcome.SKIPPED_IN_FLIGHT);
        assertThat(concurrent.optimizationPerformed()).isFalse();
        assertThat(scheduler.state()).isEqualTo(SchedulerState.OPTIMIZING);

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).optimizationPerformed()).isTrue();
        assertThat(scheduler.state()).isEqualTo(SchedulerState.IDLE);
        assertThat(scheduler.history()).hasSize(1);
    }

    private AutonomousScheduler scheduler(StorageConfig config) {
        return new AutonomousScheduler(config, PolicyStorageOptimizer.create(config, timeSource), timeSource);
    }

    private static List<MemoryRecord> memories(int count) {
        List<MemoryRecord> memories = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            memories.add(memory("m" + i).createdAgo(Duration.ofDays(2 + i)).build());
        }
        return memories;
    }

    private static final class BlockingOptimizer implements StorageOptimizer {
        private final StorageOptimizer delegate;
        private final CountDownLatch entered;
        private final CountDownLatch release;

        private BlockingOptimizer(StorageOptimizer delegate, CountDownLatch entered, CountDownLatch release) {
            this.delegate = delegate;
            this.entered = entered;
            this.release = release;
        }

        @Override
        public StorageReport assess(Collection<MemoryRecord> memories) {
            return delegate.assess(memories);
        }

        @Override
        public List<Recommendation> recommend(Collection<MemoryRecord> memories) {
            return delegate.recommend(memories);
        }

        @Override
        public OptimizationResult optimize(Collection<MemoryRecord> memories, PurgeStrategy strategy, double targetReduction) {
            return optimize(memories, strategy, targetReduction, false);
        }

        @Override
        public OptimizationResult optimize(
            Collection<MemoryRecord> memories,
            PurgeStrategy strategy,
            double targetReduction,
            boolean criticalOverride
        ) {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return delegate.optimize(memories, strategy, targetReduction, criticalOverride);
        }
    }
}

package io.mnemo.core.maintenance;

import io.mnemo.core.memory.MemoryRecord;
import io.mnemo.core.optimize.OptimizationResult;
import io.mnemo.core.optimize.OptimizationStatus;
import io.mnemo.core.optimize.StorageOptimizer;
import io.mnemo.core.purge.PurgeStrategy;
import io.mnemo.core.scheduler.AutonomousScheduler;
import io.mnemo.core.scheduler.SchedulerResult;
import java.io.IOException;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies scheduler decisions to a {@link MemoryRepository}. The engine only decides; this is
 * where purged ids are actually deleted.
 */
public final class MaintenanceService implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(MaintenanceService.class);

    private final MemoryRepository repository;
    private final AutonomousScheduler scheduler;
    private final StorageOptimizer optimizer;
    private final MaintenanceLog log;
    private ScheduledExecutorService executor;

    public MaintenanceService(MemoryRepository repository, AutonomousScheduler scheduler, StorageOptimizer optimizer) {
        this(repository, scheduler, optimizer, null);
    }

    /** {@code log} may be null, in which case passes are not recorded. */
    public MaintenanceService(
        MemoryRepository repository,
        AutonomousScheduler scheduler,
        StorageOptimizer optimizer,
        MaintenanceLog log
    ) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer must not be null");
        this.log = log;
    }

    public MaintenanceReport runOnce() throws IOException {
        return runOnce(false);
    }

    public MaintenanceReport runOnce(boolean force) throws IOException {
        List<MemoryRecord> snapshot = repository.snapshot();
        SchedulerResult result = scheduler.monitorAndOptimize(snapshot, force);
        if (!result.optimizationPerformed()) {
            return new MaintenanceReport(result, null, 0, snapshot.size());
        }

        OptimizationResult optimization = result.optimization();
        int deleted = repository.delete(optimization.purgedMemoryIds());
        OptimizationResult escalation = null;
        if (optimization.status() == OptimizationStatus.CAPACITY_STILL_EXCEEDED) {
            Set<String> purged = new HashSet<>(optimization.purgedMemoryIds());
            List<MemoryRecord> remaining = snapshot.stream()
                .filter(memory -> !purged.contains(memory.id()))
                .toList();
            escalation = optimizer.optimize(remaining, PurgeStrategy.HYBRID, 0.0, true);
            deleted += repository.delete(escalation.purgedMemoryIds());
            if (escalation.status() == OptimizationStatus.CAPACITY_STILL_EXCEEDED) {
                LOG.warn("Capacity still exceeded after escalation; {} memories removed", escalation.memoriesRemoved());
            } else {
                LOG.info("Escalated purge removed {} more memories", escalation.memoriesRemoved());
            }
        }
        MaintenanceReport report = new MaintenanceReport(result, escalation, deleted, repository.count());
        appendEntry(report);
        return report;
    }

    public List<MaintenanceEntry> entries() throws IOException {
        return log == null ? List.of() : log.load();
    }

    private void appendEntry(MaintenanceReport report) throws IOException {
        if (log == null) {
            return;
        }
        SchedulerResult result = report.schedulerResult();
        OptimizationResult last = report.escalated() ? report.escalation() : result.optimization();
        log.append(new MaintenanceEntry(
            result.historyId(),
            scheduler.lastOptimization(),
            result.trigger().wireName(),
            last.status().wireName(),
            report.memoriesDeleted(),
            report.memoriesRemaining(),
            report.escalated()
        ));
    }

    public synchronized void start(Duration period) {
        Objects.requireNonNull(period, "period must not be null");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0");
        }
        if (executor != null) {
            throw new IllegalStateException("maintenance already started");
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mnemo-maintenance");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleAtFixedRate(this::tick, period.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Maintenance scheduled every {}", period);
    }

    @Override
    public synchronized void close() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    private void tick() {
        try {
            MaintenanceReport report = runOnce();
            LOG.debug("Maintenance tick deleted {} memories", report.memoriesDeleted());
        } catch (Exception e) {
            LOG.warn("Maintenance tick failed: {}", e.getMessage(), e);
        }
    }
}

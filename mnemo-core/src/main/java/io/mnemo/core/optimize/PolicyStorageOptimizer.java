package io.mnemo.core.optimize;

import io.mnemo.core.config.model.StorageConfig;
import io.mnemo.core.memory.MemoryRecord;
import io.mnemo.core.policy.MemoryCategory;
import io.mnemo.core.policy.RetentionPolicy;
import io.mnemo.core.policy.RetentionPolicyTable;
import io.mnemo.core.purge.PurgeCandidate;
import io.mnemo.core.purge.PurgeStrategy;
import io.mnemo.core.purge.PurgeStrategySelector;
import io.mnemo.core.scoring.ScoringEngine;
import io.mnemo.core.time.TimeSource;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class PolicyStorageOptimizer implements StorageOptimizer {
    private static final Logger LOG = LoggerFactory.getLogger(PolicyStorageOptimizer.class);
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;
    // absorbs float noise such as 0.1 * 30 = 3.0000000000000004 before ceil
    private static final double CEIL_EPSILON = 1e-9;
    private static final double BALANCE_SHARE = 0.3;

    private final StorageConfig config;
    private final ScoringEngine scoringEngine;
    private final PurgeStrategySelector selector;

    public PolicyStorageOptimizer(StorageConfig config, ScoringEngine scoringEngine) {
        this.config = Objects.requireNonNull(config, "config must not be null").validate();
        this.scoringEngine = Objects.requireNonNull(scoringEngine, "scoringEngine must not be null");
        this.selector = new PurgeStrategySelector(scoringEngine);
    }

    public static PolicyStorageOptimizer create(StorageConfig config, TimeSource timeSource) {
        return new PolicyStorageOptimizer(
            config,
            new ScoringEngine(timeSource, RetentionPolicyTable.fromConfig(config))
        );
    }

    public StorageConfig config() {
        return config;
    }

    public ScoringEngine scoringEngine() {
        return scoringEngine;
    }

    @Override
    public StorageReport assess(Collection<MemoryRecord> memories) {
        List<MemoryRecord> snapshot = snapshot(memories);
        TimeSource time = scoringEngine.timeSource();

        Map<String, Integer> counts = new TreeMap<>();
        Map<String, Long> sizes = new TreeMap<>();
        long totalBytes = 0;
        MemoryRecord oldest = null;
        Instant oldestAt = null;
        MemoryRecord newest = null;
        Instant newestAt = null;

        for (MemoryRecord memory : snapshot) {
            String key = categoryOf(memory).key();
            counts.merge(key, 1, Integer::sum);
            sizes.merge(key, memory.contentSizeBytes(), Long::sum);
            totalBytes += memory.contentSizeBytes();

            Instant created = time.parse(memory.createdAt());
            if (TimeSource.MAXIMALLY_STALE.equals(created)) {
                continue;
            }
            if (oldestAt == null || created.isBefore(oldestAt)) {
                oldestAt = created;
                oldest = memory;
            }
            if (newestAt == null || created.isAfter(newestAt)) {
                newestAt = created;
                newest = memory;
            }
        }

        Map<String, Double> categoryUsage = new TreeMap<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            RetentionPolicy policy = scoringEngine.policies().policyFor(entry.getKey());
            categoryUsage.put(entry.getKey(), entry.getValue() / (double) policy.maxCount());
        }

        int total = snapshot.size();
        double countUsage = total / (double) config.maxMemoriesTotal();
        double sizeUsage = totalBytes / (double) config.maxTotalSizeBytes();
        CapacityStatus status = statusOf(Math.max(countUsage, sizeUsage));
        double averageSize = total == 0 ? 0.0 : totalBytes / (double) total;

        List<Recommendation> recommendations = capacityRecommendations(status, counts, categoryUsage, averageSize);
        return new StorageReport(
            total,
            totalBytes,
            counts,
            sizes,
            categoryUsage,
            averageSize,
            oldest == null ? null : oldest.id(),
            newest == null ? null : newest.id(),
            countUsage,
            sizeUsage,
            status,
            recommendations
        );
    }

    @Override
    public List<Recommendation> recommend(Collection<MemoryRecord> memories) {
        StorageReport report = assess(memories);
        List<Recommendation> recommendations = new ArrayList<>(report.recommendations());

        int total = report.totalMemories();
        for (Map.Entry<String, Integer> entry : report.categoryCounts().entrySet()) {
            int count = entry.getValue();
            if (count > total * BALANCE_SHARE) {
                recommendations.add(new Recommendation(
                    "balance_optimization",
                    Recommendation.Priority.LOW,
                    "review_category_" + entry.getKey(),
                    String.format(
                        Locale.ROOT,
                        "Category \"%s\" has %d memories (%.1f%% of total).",
                        entry.getKey(),
                        count,
                        count * 100.0 / total
                    )
                ));
            }
        }

        if (report.oldestMemoryId() != null) {
            recommendations.add(new Recommendation(
                "age_optimization",
                Recommendation.Priority.LOW,
                "review_old_memories",
                "Some memories are quite old and may be candidates for archival."
            ));
        }
        return List.copyOf(recommendations);
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
        Objects.requireNonNull(strategy, "strategy must not be null");
        if (!(targetReduction >= 0 && targetReduction <= 1)) {
            throw new IllegalArgumentException("targetReduction must be in [0, 1]");
        }

        List<MemoryRecord> snapshot = snapshot(memories);
        if (snapshot.isEmpty()) {
            return OptimizationResult.noAction(strategy);
        }

        StorageReport report = assess(snapshot);
        boolean bypassGracePeriod = criticalOverride || report.status() == CapacityStatus.CRITICAL;
        List<PurgeCandidate> ranked = deletable(selector.rank(snapshot, strategy, bypassGracePeriod));

        int total = snapshot.size();
        int countExcess = Math.max(0, total - config.maxMemoriesTotal());
        int requested = (int) Math.ceil(targetReduction * total - CEIL_EPSILON);
        int policyTarget = strategy.policyAware()
            ? (int) ranked.stream().filter(PurgeCandidate::violatesPolicy).count()
            : 0;
        int removalCount = Math.min(total, Math.max(countExcess, Math.max(requested, policyTarget)));

        boolean[] picked = new boolean[ranked.size()];
        int pickedCount = pickCategoryOverflow(ranked, picked, report);
        for (int i = 0; i < ranked.size() && pickedCount < removalCount; i++) {
            if (!picked[i]) {
                picked[i] = true;
                pickedCount++;
            }
        }
        long bytesToFree = report.totalSizeBytes() - config.maxTotalSizeBytes();
        long freedBytes = freedBytes(ranked, picked);
        for (int i = 0; i < ranked.size() && freedBytes < bytesToFree; i++) {
            if (!picked[i]) {
                picked[i] = true;
                pickedCount++;
                freedBytes += ranked.get(i).sizeBytes();
            }
        }

        List<PurgeCandidate> purged = new ArrayList<>(pickedCount);
        for (int i = 0; i < ranked.size(); i++) {
            if (picked[i]) {
                purged.add(ranked.get(i));
            }
        }

        boolean stillExceeded = exceedsHardLimits(snapshot, purged);
        boolean shortfall = purged.size() < removalCount;
        if (purged.isEmpty()) {
            if (stillExceeded) {
                LOG.warn("Capacity exceeded but no memory is eligible for purge under {}", strategy.wireName());
                return new OptimizationResult(
                    OptimizationStatus.CAPACITY_STILL_EXCEEDED, strategy, 0, 0.0, Set.of(), PerformanceImpact.none()
                );
            }
            LOG.debug("No purge needed under {} for {} memories", strategy.wireName(), total);
            return OptimizationResult.noAction(strategy);
        }

        Set<String> purgedIds = new LinkedHashSet<>();
        for (PurgeCandidate candidate : purged) {
            purgedIds.add(candidate.id());
        }
        double sizeSavedMb = freedBytes(ranked, picked) / BYTES_PER_MB;
        OptimizationStatus status = stillExceeded || shortfall
            ? OptimizationStatus.CAPACITY_STILL_EXCEEDED
            : OptimizationStatus.OPTIMIZATION_COMPLETED;

        if (stillExceeded) {
            LOG.warn(
                "Purge under {} removed {} of {} memories but hard limits are still exceeded",
                strategy.wireName(),
                purged.size(),
                total
            );
        } else if (shortfall) {
            LOG.warn(
                "Purge under {} fell short: {} of {} requested memories were eligible",
                strategy.wireName(),
                purged.size(),
                removalCount
            );
        } else {
            LOG.info("Purge under {} selected {} of {} memories ({} MB)", strategy.wireName(), purged.size(), total, round2(sizeSavedMb));
        }
        return new OptimizationResult(status, strategy, purgedIds.size(), sizeSavedMb, purgedIds, impact(purged));
    }

    // a record without an id cannot be deleted; a repeated id is one deletion
    private static List<PurgeCandidate> deletable(List<PurgeCandidate> ranked) {
        Set<String> seen = new HashSet<>();
        List<PurgeCandidate> kept = new ArrayList<>(ranked.size());
        for (PurgeCandidate candidate : ranked) {
            if (!candidate.id().isBlank() && seen.add(candidate.id())) {
                kept.add(candidate);
            }
        }
        if (kept.size() < ranked.size()) {
            LOG.debug("Skipped {} purge candidates with a blank or repeated id", ranked.size() - kept.size());
        }
        return kept;
    }

    private int pickCategoryOverflow(List<PurgeCandidate> ranked, boolean[] picked, StorageReport report) {
        int pickedCount = 0;
        for (Map.Entry<String, Integer> entry : report.categoryCounts().entrySet()) {
            MemoryCategory category = MemoryCategory.fromKey(entry.getKey()).orElse(MemoryCategory.GENERAL);
            int overflow = entry.getValue() - scoringEngine.policies().policyFor(category).maxCount();
            for (int i = 0; i < ranked.size() && overflow > 0; i++) {
                if (!picked[i] && ranked.get(i).category() == category) {
                    picked[i] = true;
                    pickedCount++;
                    overflow--;
                }
            }
        }
        return pickedCount;
    }

    private boolean exceedsHardLimits(List<MemoryRecord> snapshot, List<PurgeCandidate> purged) {
        int remaining = snapshot.size() - purged.size();
        if (remaining > config.maxMemoriesTotal()) {
            return true;
        }

        long remainingBytes = 0;
        Map<MemoryCategory, Integer> remainingCounts = new EnumMap<>(MemoryCategory.class);
        for (MemoryRecord memory : snapshot) {
            remainingBytes += memory.contentSizeBytes();
            remainingCounts.merge(categoryOf(memory), 1, Integer::sum);
        }
        for (PurgeCandidate candidate : purged) {
            remainingBytes -= candidate.sizeBytes();
            remainingCounts.merge(candidate.category(), -1, Integer::sum);
        }
        if (remainingBytes > config.maxTotalSizeBytes()) {
            return true;
        }
        for (Map.Entry<MemoryCategory, Integer> entry : remainingCounts.entrySet()) {
            if (entry.getValue() > scoringEngine.policies().policyFor(entry.getKey()).maxCount()) {
                return true;
            }
        }
        return false;
    }

    private List<Recommendation> capacityRecommendations(
        CapacityStatus status,
        Map<String, Integer> counts,
        Map<String, Double> categoryUsage,
        double averageSize
    ) {
        List<Recommendation> recommendations = new ArrayList<>();
        if (status == CapacityStatus.CRITICAL) {
            recommendations.add(new Recommendation(
                "immediate_action",
                Recommendation.Priority.HIGH,
                "purge_memories",
                "Storage is at critical capacity. Immediate purging required."
            ));
        } else if (status == CapacityStatus.WARNING) {
            recommendations.add(new Recommendation(
                "scheduled_action",
                Recommendation.Priority.MEDIUM,
                "optimize_storage",
                "Storage approaching capacity. Consider optimization."
            ));
        }

        for (Map.Entry<String, Double> entry : categoryUsage.entrySet()) {
            CapacityStatus categoryStatus = statusOf(entry.getValue());
            if (categoryStatus == CapacityStatus.NORMAL) {
                continue;
            }
            recommendations.add(new Recommendation(
                "category_optimization",
                categoryStatus == CapacityStatus.CRITICAL ? Recommendation.Priority.HIGH : Recommendation.Priority.MEDIUM,
                "purge_category_" + entry.getKey(),
                String.format(
                    Locale.ROOT,
                    "Category \"%s\" is at %.1f%% capacity (%d memories).",
                    entry.getKey(),
                    entry.getValue() * 100,
                    counts.getOrDefault(entry.getKey(), 0)
                )
            ));
        }

        if (averageSize > config.maxMemorySizeBytes()) {
            recommendations.add(new Recommendation(
                "performance_optimization",
                Recommendation.Priority.LOW,
                "compress_large_memories",
                "Some memories are larger than optimal. Consider compression."
            ));
        }
        return recommendations;
    }

    private PerformanceImpact impact(List<PurgeCandidate> purged) {
        Map<String, Integer> byCategory = new TreeMap<>();
        int highAccess = 0;
        int recent = 0;
        for (PurgeCandidate candidate : purged) {
            byCategory.merge(candidate.category().key(), 1, Integer::sum);
            Integer accessCount = candidate.memory().accessCount();
            if (accessCount != null && accessCount > 10) {
                highAccess++;
            }
            if (candidate.recency() > 0.8) {
                recent++;
            }
        }
        return new PerformanceImpact(byCategory, highAccess, recent);
    }

    private CapacityStatus statusOf(double usage) {
        return CapacityStatus.of(usage, config.warningThreshold(), config.criticalThreshold());
    }

    private long freedBytes(List<PurgeCandidate> ranked, boolean[] picked) {
        long bytes = 0;
        for (int i = 0; i < ranked.size(); i++) {
            if (picked[i]) {
                bytes += ranked.get(i).sizeBytes();
            }
        }
        return bytes;
    }

    private static MemoryCategory categoryOf(MemoryRecord memory) {
        return MemoryCategory.fromKey(memory.category()).orElse(MemoryCategory.GENERAL);
    }

    private static List<MemoryRecord> snapshot(Collection<MemoryRecord> memories) {
        if (memories == null || memories.isEmpty()) {
            return List.of();
        }
        return memories.stream().filter(Objects::nonNull).toList();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}

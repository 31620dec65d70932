package io.mnemo.core.purge;

import io.mnemo.core.memory.MemoryRecord;
import io.mnemo.core.policy.MemoryCategory;
import io.mnemo.core.policy.RetentionPolicy;
import io.mnemo.core.scoring.ScoringEngine;
import io.mnemo.core.time.TimeSource;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a snapshot into an eviction ordering, most purgeable first. Every ordering ends with the
 * same tie-break (last access, creation, id) so equal keys never depend on input order.
 */
public final class PurgeStrategySelector {
    static final Comparator<PurgeCandidate> TIE_BREAK = Comparator
        .comparing(PurgeCandidate::lastAccessed)
        .thenComparing(PurgeCandidate::createdAt)
        .thenComparing(PurgeCandidate::id);

    static final Comparator<PurgeCandidate> LRU_ORDER = TIE_BREAK;

    static final Comparator<PurgeCandidate> PRIORITY_ORDER = Comparator
        .comparingDouble(PurgeCandidate::score)
        .thenComparing(TIE_BREAK);

    private final ScoringEngine scoringEngine;

    public PurgeStrategySelector(ScoringEngine scoringEngine) {
        this.scoringEngine = Objects.requireNonNull(scoringEngine, "scoringEngine must not be null");
    }

    /**
     * Orders the purge-eligible part of the snapshot. Memories still inside their grace period are
     * left out unless {@code bypassGracePeriod} is set.
     */
    public List<PurgeCandidate> rank(Collection<MemoryRecord> memories, PurgeStrategy strategy, boolean bypassGracePeriod) {
        Objects.requireNonNull(strategy, "strategy must not be null");
        List<PurgeCandidate> all = evaluate(memories);
        List<PurgeCandidate> eligible = all.stream()
            .filter(candidate -> bypassGracePeriod || !candidate.withinGracePeriod())
            .toList();

        return switch (strategy) {
            case LRU -> sorted(eligible, LRU_ORDER);
            case PRIORITY_BASED -> sorted(eligible, PRIORITY_ORDER);
            case CONTEXT_AWARE -> contextAware(eligible, categoryCounts(all), bypassGracePeriod);
            case HYBRID -> hybrid(eligible);
        };
    }

    public List<PurgeCandidate> violators(Collection<MemoryRecord> memories, boolean bypassGracePeriod) {
        return evaluate(memories).stream()
            .filter(PurgeCandidate::violatesPolicy)
            .filter(candidate -> bypassGracePeriod || !candidate.withinGracePeriod())
            .sorted(PRIORITY_ORDER)
            .toList();
    }

    public List<PurgeCandidate> evaluate(Collection<MemoryRecord> memories) {
        if (memories == null || memories.isEmpty()) {
            return List.of();
        }
        TimeSource time = scoringEngine.timeSource();
        List<PurgeCandidate> candidates = new ArrayList<>(memories.size());
        for (MemoryRecord memory : memories) {
            if (memory == null) {
                continue;
            }
            MemoryCategory category = MemoryCategory.fromKey(memory.category()).orElse(MemoryCategory.GENERAL);
            RetentionPolicy policy = scoringEngine.policies().policyFor(category);
            Instant createdAt = time.parse(memory.createdAt());
            Instant lastAccessed = time.parse(memory.effectiveLastAccessed());
            Duration age = time.ageOf(createdAt);
            double score = scoringEngine.categoryScore(memory, policy);
            boolean violates = age.compareTo(policy.maxAge()) > 0 || score < policy.minAcceptableScore();
            boolean protectedByGrace = age.compareTo(policy.minAgeBeforePurge()) < 0;
            candidates.add(new PurgeCandidate(
                memory,
                category,
                policy,
                score,
                scoringEngine.recencyFactor(memory, policy),
                lastAccessed,
                createdAt,
                violates,
                protectedByGrace
            ));
        }
        return candidates;
    }

    /**
     * Violators first, then healthy memories from the fullest category (relative to its own
     * {@code max_count}) down. Outside critical capacity each category keeps its retention floor:
     * healthy memories beyond what the floor allows are moved to the tail in LRU order, so they
     * are reached only when nothing else is left.
     */
    private List<PurgeCandidate> contextAware(
        List<PurgeCandidate> eligible,
        Map<MemoryCategory, Integer> counts,
        boolean bypassGracePeriod
    ) {
        List<PurgeCandidate> violators = new ArrayList<>();
        Map<MemoryCategory, List<PurgeCandidate>> healthy = new EnumMap<>(MemoryCategory.class);
        for (PurgeCandidate candidate : eligible) {
            if (candidate.violatesPolicy()) {
                violators.add(candidate);
            } else {
                healthy.computeIfAbsent(candidate.category(), key -> new ArrayList<>()).add(candidate);
            }
        }
        violators.sort(PRIORITY_ORDER);

        List<PurgeCandidate> rest = new ArrayList<>();
        List<PurgeCandidate> retained = new ArrayList<>();
        for (Map.Entry<MemoryCategory, List<PurgeCandidate>> entry : healthy.entrySet()) {
            List<PurgeCandidate> members = entry.getValue();
            if (bypassGracePeriod) {
                rest.addAll(members);
                continue;
            }
            members.sort(PRIORITY_ORDER);
            long violating = violators.stream().filter(violator -> violator.category() == entry.getKey()).count();
            int floor = members.get(0).policy().retentionFloor();
            int allowed = (int) Math.max(0, counts.getOrDefault(entry.getKey(), 0) - violating - floor);
            int cut = Math.min(allowed, members.size());
            rest.addAll(members.subList(0, cut));
            retained.addAll(members.subList(cut, members.size()));
        }

        Comparator<PurgeCandidate> byCategoryPressure = Comparator
            .comparingDouble((PurgeCandidate candidate) -> fillRatio(candidate, counts))
            .reversed()
            .thenComparing(candidate -> candidate.category().key());
        rest.sort(byCategoryPressure.thenComparing(PRIORITY_ORDER));
        retained.sort(LRU_ORDER);

        List<PurgeCandidate> ordered = new ArrayList<>(eligible.size());
        ordered.addAll(violators);
        ordered.addAll(rest);
        ordered.addAll(retained);
        return List.copyOf(ordered);
    }

    private List<PurgeCandidate> hybrid(List<PurgeCandidate> eligible) {
        List<PurgeCandidate> violators = new ArrayList<>();
        List<PurgeCandidate> rest = new ArrayList<>();
        for (PurgeCandidate candidate : eligible) {
            (candidate.violatesPolicy() ? violators : rest).add(candidate);
        }
        violators.sort(PRIORITY_ORDER);
        rest.sort(PRIORITY_ORDER);

        List<PurgeCandidate> ordered = new ArrayList<>(violators.size() + rest.size());
        ordered.addAll(violators);
        ordered.addAll(rest);
        return List.copyOf(ordered);
    }

    private double fillRatio(PurgeCandidate candidate, Map<MemoryCategory, Integer> counts) {
        return counts.getOrDefault(candidate.category(), 0) / (double) candidate.policy().maxCount();
    }

    private Map<MemoryCategory, Integer> categoryCounts(List<PurgeCandidate> candidates) {
        Map<MemoryCategory, Integer> counts = new EnumMap<>(MemoryCategory.class);
        for (PurgeCandidate candidate : candidates) {
            counts.merge(candidate.category(), 1, Integer::sum);
        }
        return counts;
    }

    private static List<PurgeCandidate> sorted(List<PurgeCandidate> candidates, Comparator<PurgeCandidate> order) {
        List<PurgeCandidate> copy = new ArrayList<>(candidates);
        copy.sort(order);
        return List.copyOf(copy);
    }
}

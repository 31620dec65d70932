package io.mnemo.core.purge;

import io.mnemo.core.memory.MemoryRecord;
import io.mnemo.core.policy.MemoryCategory;
import io.mnemo.core.policy.RetentionPolicy;
import java.time.Instant;

/**
 * A memory with everything the strategies sort on resolved once up front.
 */
public record PurgeCandidate(
    MemoryRecord memory,
    MemoryCategory category,
    RetentionPolicy policy,
    double score,
    double recency,
    Instant lastAccessed,
    Instant createdAt,
    boolean violatesPolicy,
    boolean withinGracePeriod
) {

    public String id() {
        return memory.id();
    }

    public long sizeBytes() {
        return memory.contentSizeBytes();
    }
}

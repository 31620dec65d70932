package io.mnemo.core.maintenance;

import static io.mnemo.core.TestMemories.memory;
import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.memory.MemoryRecord;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileMemoryRepositoryTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldSaveSnapshotAndDelete() throws Exception {
        FileMemoryRepository repository = new FileMemoryRepository(tempDir.resolve("store/memories.json"));
        assertThat(repository.snapshot()).isEmpty();

        repository.saveAll(List.of(memory("a").build(), memory("b").category("testing").build()));
        repository.saveAll(List.of(memory("a").size(42).build()));

        assertThat(repository.count()).isEqualTo(2);
        assertThat(repository.snapshot()).extracting(MemoryRecord::id).containsExactly("a", "b");
        assertThat(repository.snapshot().get(0).contentSizeBytes()).isEqualTo(42);

        assertThat(repository.delete(List.of("b", "missing"))).isEqualTo(1);
        assertThat(repository.snapshot()).extracting(MemoryRecord::id).containsExactly("a");
        assertThat(tempDir.resolve("store/memories.json.tmp")).doesNotExist();
    }

    @Test
    void shouldReadSnakeCaseMetadata() throws Exception {
        Path path = tempDir.resolve("memories.json");
        Files.writeString(path, """
            [
              {
                "id": "m1",
                "content_size_bytes": 512,
                "category": "bug_fix",
                "created_at": "2025-05-01T10:00:00+02:00",
                "last_accessed": "2025-05-20T10:00:00Z",
                "access_count": 4,
                "success_rate": 0.75,
                "error_related": true,
                "embedding": [0.1, 0.2]
              }
            ]
            """);

        MemoryRecord record = new FileMemoryRepository(path).snapshot().get(0);

        assertThat(record.contentSizeBytes()).isEqualTo(512);
        assertThat(record.category()).isEqualTo("bug_fix");
        assertThat(record.createdAt()).isEqualTo("2025-05-01T10:00:00+02:00");
        assertThat(record.accessCount()).isEqualTo(4);
        assertThat(record.successRate()).isEqualTo(0.75);
        assertThat(record.errorRelated()).isTrue();
        assertThat(record.solutionRelated()).isFalse();
    }
}

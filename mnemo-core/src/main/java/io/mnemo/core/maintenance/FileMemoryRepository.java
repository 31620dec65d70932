package io.mnemo.core.maintenance;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemo.core.memory.MemoryRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Memory metadata kept as a JSON array in one file. Writes go to a sibling temp file first and
 * are moved into place atomically.
 */
public final class FileMemoryRepository implements MemoryRepository {
    private final Path path;
    private final ObjectMapper mapper;

    public FileMemoryRepository(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public synchronized List<MemoryRecord> snapshot() throws IOException {
        return List.copyOf(load());
    }

    /** Inserts or replaces by id; records without an id are rejected. */
    @Override
    public synchronized void saveAll(Collection<MemoryRecord> memories) throws IOException {
        if (memories == null || memories.isEmpty()) {
            return;
        }
        Map<String, MemoryRecord> byId = new LinkedHashMap<>();
        for (MemoryRecord existing : load()) {
            byId.put(existing.id(), existing);
        }
        for (MemoryRecord memory : memories) {
            if (memory == null || memory.id().isBlank()) {
                throw new IllegalArgumentException("memory id must not be blank");
            }
            byId.put(memory.id(), memory);
        }
        save(new ArrayList<>(byId.values()));
    }

    @Override
    public synchronized int delete(Collection<String> ids) throws IOException {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        Set<String> doomed = new HashSet<>(ids);
        List<MemoryRecord> records = new ArrayList<>(load());
        int before = records.size();
        records.removeIf(record -> doomed.contains(record.id()));
        int removed = before - records.size();
        if (removed > 0) {
            save(records);
        }
        return removed;
    }

    @Override
    public synchronized int count() throws IOException {
        return load().size();
    }

    private List<MemoryRecord> load() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        String json = Files.readString(path);
        if (json.isBlank()) {
            return List.of();
        }
        return mapper.readValue(json, new TypeReference<List<MemoryRecord>>() {
        });
    }

    private void save(List<MemoryRecord> records) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(records);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}

package io.mnemo.core.maintenance;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maintenance entries as a JSON array, oldest first, trimmed to the newest {@code limit}.
 */
public final class FileMaintenanceLog implements MaintenanceLog {
    private final Path path;
    private final int limit;
    private final ObjectMapper mapper;

    public FileMaintenanceLog(Path path, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.limit = limit;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
    }

    @Override
    public synchronized List<MaintenanceEntry> load() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        String json = Files.readString(path);
        if (json.isBlank()) {
            return List.of();
        }
        return mapper.readValue(json, new TypeReference<List<MaintenanceEntry>>() {
        });
    }

    @Override
    public synchronized void append(MaintenanceEntry entry) throws IOException {
        Objects.requireNonNull(entry, "entry must not be null");
        List<MaintenanceEntry> entries = new ArrayList<>(load());
        entries.add(entry);
        if (entries.size() > limit) {
            entries = new ArrayList<>(entries.subList(entries.size() - limit, entries.size()));
        }

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(entries);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}

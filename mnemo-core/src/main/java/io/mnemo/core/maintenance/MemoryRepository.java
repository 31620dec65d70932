package io.mnemo.core.maintenance;

import io.mnemo.core.memory.MemoryRecord;
import java.io.IOException;
import java.util.Collection;
import java.util.List;

public interface MemoryRepository {
    List<MemoryRecord> snapshot() throws IOException;

    void saveAll(Collection<MemoryRecord> memories) throws IOException;

    int delete(Collection<String> ids) throws IOException;

    int count() throws IOException;
}

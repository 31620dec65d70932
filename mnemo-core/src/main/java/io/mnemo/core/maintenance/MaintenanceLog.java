package io.mnemo.core.maintenance;

import java.io.IOException;
import java.util.List;

public interface MaintenanceLog {
    List<MaintenanceEntry> load() throws IOException;

    void append(MaintenanceEntry entry) throws IOException;
}

package io.mnemo.core.optimize;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public record StorageReport(
    int totalMemories,
    long totalSizeBytes,
    Map<String, Integer> categoryCounts,
    Map<String, Long> categorySizes,
    Map<String, Double> categoryUsage,
    double averageSizeBytes,
    String oldestMemoryId,
    String newestMemoryId,
    double countUsage,
    double sizeUsage,
    CapacityStatus status,
    List<Recommendation> recommendations
) {

    public StorageReport {
        categoryCounts = sortedCopy(categoryCounts);
        categorySizes = sortedCopy(categorySizes);
        categoryUsage = sortedCopy(categoryUsage);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    /** Overall capacity ratio: the larger of count usage and size usage. */
    public double usage() {
        return Math.max(countUsage, sizeUsage);
    }

    public double totalSizeMb() {
        return totalSizeBytes / (1024.0 * 1024.0);
    }

    private static <V> Map<String, V> sortedCopy(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(source));
    }
}

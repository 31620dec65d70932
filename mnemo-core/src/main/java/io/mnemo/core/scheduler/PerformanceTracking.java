package io.mnemo.core.scheduler;

public record PerformanceTracking(
    int optimizationsPerformed,
    long totalMemoriesPurged,
    double averagePerformanceGain,
    double userSatisfactionScore
) {
    private static final double GAIN_NORMALIZATION_MB = 10.0;

    public static PerformanceTracking initial() {
        return new PerformanceTracking(0, 0, 0.0, 0.0);
    }

    /** Gain is freed megabytes normalized to 10 MB; runs that free nothing leave the average alone. */
    PerformanceTracking afterRun(int memoriesRemoved, double sizeSavedMb) {
        int runs = optimizationsPerformed + 1;
        double average = averagePerformanceGain;
        if (sizeSavedMb > 0) {
            double gain = Math.min(sizeSavedMb / GAIN_NORMALIZATION_MB, 1.0);
            average = (averagePerformanceGain * (runs - 1) + gain) / runs;
        }
        return new PerformanceTracking(runs, totalMemoriesPurged + memoriesRemoved, average, userSatisfactionScore);
    }

    PerformanceTracking withFeedback(double satisfaction) {
        double updated = optimizationsPerformed > 0
            ? (userSatisfactionScore * (optimizationsPerformed - 1) + satisfaction) / optimizationsPerformed
            : satisfaction;
        return new PerformanceTracking(optimizationsPerformed, totalMemoriesPurged, averagePerformanceGain, updated);
    }
}

package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Per-category override. Every field is optional; absent fields keep the category's built-in
 * value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RetentionPolicyConfig(
    Integer maxAgeDays,
    Integer maxCount,
    Integer minRetentionCount,
    Double minAcceptableScore,
    Double priorityWeight,
    Double accessWeight,
    WeightsConfig weights,
    Double minAgeBeforePurgeHours
) {
}

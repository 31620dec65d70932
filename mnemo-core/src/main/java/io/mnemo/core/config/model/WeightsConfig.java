package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WeightsConfig(
    Double recency,
    Double frequency,
    Double quality,
    Double priority,
    Double errorBoost,
    Double solutionBoost
) {
}

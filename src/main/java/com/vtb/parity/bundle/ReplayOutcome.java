package com.vtb.parity.bundle;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vtb.parity.models.ReplayClassification;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Результат повторного выполнения одного бандла
 */
@Value
@Builder
public class ReplayOutcome {
    @JsonProperty("reproduction_key")
    String reproductionKey;
    ReplayClassification classification;
    @JsonProperty("original_bundle")
    String originalBundle;
    @JsonProperty("new_bundle")
    String newBundle;
    @JsonProperty("original_paths")
    List<String> originalPaths;
    @JsonProperty("current_paths")
    List<String> currentPaths;
    String detail;
}

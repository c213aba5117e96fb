package com.vtb.parity.reports;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vtb.parity.dynamic.TelemetrySummary;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Итоги explore (summary.json)
 */
@Data
@Builder
public class ExploreSummary {
    @JsonProperty("tool_version")
    private String toolVersion;
    private String specification;
    @JsonProperty("target_a")
    private String targetA;
    @JsonProperty("target_b")
    private String targetB;
    private long seed;
    @JsonProperty("started_at")
    private String startedAt;
    @JsonProperty("duration_ms")
    private long durationMs;
    private int operations;
    @JsonProperty("total_cases")
    private int totalCases;
    @JsonProperty("total_chains")
    private int totalChains;
    private int matches;
    private int mismatches;
    private int errors;
    private int truncated;
    @JsonProperty("degraded_steps")
    private int degradedSteps;
    @JsonProperty("generation_failures")
    private int generationFailures;
    @JsonProperty("mismatches_by_operation")
    @Builder.Default
    private Map<String, Integer> mismatchesByOperation = new LinkedHashMap<>();
    @Builder.Default
    private List<String> bundles = new ArrayList<>();
    @Builder.Default
    private List<String> notices = new ArrayList<>();
    private TelemetrySummary telemetry;
}

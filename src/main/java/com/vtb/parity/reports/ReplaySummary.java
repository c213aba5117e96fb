package com.vtb.parity.reports;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vtb.parity.bundle.ReplayOutcome;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Итоги replay (replay_summary.json)
 */
@Data
@Builder
public class ReplaySummary {
    @JsonProperty("tool_version")
    private String toolVersion;
    private String input;
    @JsonProperty("target_a")
    private String targetA;
    @JsonProperty("target_b")
    private String targetB;
    @JsonProperty("total_bundles")
    private int totalBundles;
    @JsonProperty("still_mismatch")
    private int stillMismatch;
    @JsonProperty("now_match")
    private int nowMatch;
    @JsonProperty("different_mismatch")
    private int differentMismatch;
    private int errors;
    /** Каталоги без case.json/chain.json */
    private int skipped;
    @Builder.Default
    private List<String> corrupted = new ArrayList<>();
    @Builder.Default
    private List<ReplayOutcome> results = new ArrayList<>();
}

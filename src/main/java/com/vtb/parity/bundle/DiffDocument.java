package com.vtb.parity.bundle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vtb.parity.models.BundleKind;
import com.vtb.parity.models.Mismatch;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Содержимое diff.json
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiffDocument {
    @JsonProperty("reproduction_key")
    private String reproductionKey;
    private BundleKind kind;
    @JsonProperty("operation_sequence")
    private List<String> operationSequence = new ArrayList<>();
    @JsonProperty("mismatch_step")
    private int mismatchStep;
    private List<Mismatch> mismatches = new ArrayList<>();
}

package com.vtb.parity.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Воспроизводимый артефакт расхождения: кейс или префикс цепочки, ответы обеих целей
 * по выполненным шагам и список расхождений. После записи не изменяется.
 */
@Value
@Builder(toBuilder = true)
public class Bundle {
    BundleKind kind;
    String reproductionKey;
    RequestCase requestCase;
    Chain chain;
    @Builder.Default
    List<StepExecution> targetA = new ArrayList<>();
    @Builder.Default
    List<StepExecution> targetB = new ArrayList<>();
    @Builder.Default
    List<Mismatch> mismatches = new ArrayList<>();
    int mismatchStep;
    BundleMetadata metadata;
    @JsonIgnore
    Path location;

    @JsonIgnore
    public List<String> operationSequence() {
        if (kind == BundleKind.CHAIN && chain != null) {
            return chain.operationIds();
        }
        return requestCase != null ? List.of(requestCase.getOperationId()) : List.of();
    }
}

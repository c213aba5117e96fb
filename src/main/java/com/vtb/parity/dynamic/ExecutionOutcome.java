package com.vtb.parity.dynamic;

import com.vtb.parity.models.Chain;
import com.vtb.parity.models.Mismatch;
import com.vtb.parity.models.RequestCase;
import com.vtb.parity.models.StepExecution;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Итог выполнения кейса или цепочки.
 *
 * MISMATCH: на шаге {@code mismatchStep} найдены расхождения, последующие шаги не выполнялись.
 * ERROR: обе цели вернули терминальную ошибку на одном шаге.
 * TRUNCATED: шаг пропущен из-за неразрешённых link-параметров (политика SKIP).
 */
@Value
@Builder
public class ExecutionOutcome {

    public enum Status {
        MATCH,
        MISMATCH,
        ERROR,
        TRUNCATED
    }

    Status status;
    RequestCase requestCase;
    Chain chain;
    @Builder.Default
    List<StepExecution> targetA = new ArrayList<>();
    @Builder.Default
    List<StepExecution> targetB = new ArrayList<>();
    @Builder.Default
    List<Mismatch> mismatches = new ArrayList<>();
    @Builder.Default
    int mismatchStep = -1;
    String reason;

    public boolean isChain() {
        return chain != null;
    }

    public int executedSteps() {
        return targetA.size();
    }

    public String sequenceKey() {
        return isChain() ? chain.sequenceKey() : requestCase.getOperationId();
    }
}

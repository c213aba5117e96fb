package com.vtb.parity.dynamic;

import com.vtb.parity.config.ParityConfig;
import com.vtb.parity.models.DegradedPolicy;
import com.vtb.parity.models.TargetSide;

public class ExecutorSettings {
    private final ParityConfig.Execution config;

    public ExecutorSettings(ParityConfig.Execution config) {
        this.config = config;
    }

    public long timeoutMs() {
        return config != null && config.getTimeoutMs() != null ? config.getTimeoutMs() : 30_000L;
    }

    public long timeoutFor(String operationId) {
        if (config != null && config.getOperationTimeouts() != null && operationId != null) {
            Long specific = config.getOperationTimeouts().get(operationId);
            if (specific != null && specific > 0) {
                return specific;
            }
        }
        return timeoutMs();
    }

    public double requestsPerSecond() {
        return config != null && config.getRequestsPerSecond() != null ? config.getRequestsPerSecond() : 0.0;
    }

    public int parallelism() {
        return config != null && config.getParallelism() != null ? config.getParallelism() : 4;
    }

    public TargetSide sourceOfTruth() {
        return config != null && config.getSourceOfTruth() != null ? config.getSourceOfTruth() : TargetSide.A;
    }

    public DegradedPolicy degradedPolicy() {
        return config != null && config.getDegradedPolicy() != null
            ? config.getDegradedPolicy()
            : DegradedPolicy.EXECUTE;
    }
}

package com.vtb.parity.dynamic;

import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class TelemetrySummary {
    @Builder.Default
    private int totalResponses = 0;
    @Builder.Default
    private int successResponses = 0;
    @Builder.Default
    private int clientErrors = 0;
    @Builder.Default
    private int rateLimitResponses = 0;
    @Builder.Default
    private int serverErrors = 0;
    @Builder.Default
    private int timeouts = 0;
    @Builder.Default
    private int connectionFailures = 0;
    @Builder.Default
    private int networkErrors = 0;
    @Builder.Default
    private long totalLatencyMs = 0;
}

package com.vtb.parity.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Контекст запуска, сохраняемый в metadata.json бандла
 */
@Value
@Builder
@Jacksonized
public class BundleMetadata {
    String toolVersion;
    String timestamp;
    Long seed;
    String specification;
    String targetA;
    String targetB;
    String rulesScope;
    /** Для бандлов, записанных replay, каталог исходного бандла */
    String replayedFrom;
    ReplayClassification classification;
}

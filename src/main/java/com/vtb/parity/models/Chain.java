package com.vtb.parity.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Многошаговая последовательность запросов, связанных links.
 * Идентичность для дедупликации: последовательность operationId ({@link #sequenceKey()}).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Chain {
    String chainId;
    @Builder.Default
    List<ChainStep> steps = new ArrayList<>();
    int maxDepth;

    @JsonIgnore
    public List<String> operationIds() {
        return steps.stream()
            .map(step -> step.getTemplate().getOperationId())
            .collect(Collectors.toList());
    }

    @JsonIgnore
    public String sequenceKey() {
        return String.join(" -> ", operationIds());
    }

    @JsonIgnore
    public int length() {
        return steps.size();
    }

    /**
     * Префикс цепочки из первых {@code count} шагов (в бандл попадают только выполненные шаги)
     */
    public Chain prefix(int count) {
        int bounded = Math.max(0, Math.min(count, steps.size()));
        return toBuilder()
            .steps(new ArrayList<>(steps.subList(0, bounded)))
            .build();
    }
}

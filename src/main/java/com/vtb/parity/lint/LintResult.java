package com.vtb.parity.lint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Итог проверки спецификации (вывод {@code lint-spec --output json})
 */
@Data
public class LintResult {

    private final List<LintMessage> errors = new ArrayList<>();
    private final List<LintMessage> warnings = new ArrayList<>();
    private final List<LintMessage> info = new ArrayList<>();
    private final Summary summary = new Summary();
    @JsonProperty("chain_depth")
    private final ChainDepth chainDepth = new ChainDepth();

    @Data
    public static class Summary {
        @JsonProperty("total_operations")
        private int totalOperations;
        @JsonProperty("operations_with_links")
        private int operationsWithLinks;
        @JsonProperty("operations_with_response_schemas")
        private int operationsWithResponseSchemas;
        @JsonProperty("error_count")
        private int errorCount;
        @JsonProperty("warning_count")
        private int warningCount;
        @JsonProperty("info_count")
        private int infoCount;
    }

    /**
     * Минимальная глубина цепочки, на которой достижима операция. Глубина 1: стартовые операции.
     */
    @Data
    public static class ChainDepth {
        @JsonProperty("depth_1")
        private int depth1;
        @JsonProperty("depth_2")
        private int depth2;
        @JsonProperty("depth_3")
        private int depth3;
        @JsonProperty("depth_4_plus")
        private int depth4Plus;
        private int unreachable;
    }

    public void add(LintMessage message) {
        switch (message.getLevel()) {
            case ERROR -> {
                errors.add(message);
                summary.setErrorCount(errors.size());
            }
            case WARNING -> {
                warnings.add(message);
                summary.setWarningCount(warnings.size());
            }
            case INFO -> {
                info.add(message);
                summary.setInfoCount(info.size());
            }
        }
    }

    @JsonIgnore
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @JsonIgnore
    public List<LintMessage> find(String code) {
        List<LintMessage> found = new ArrayList<>();
        for (List<LintMessage> messages : List.of(errors, warnings, info)) {
            messages.stream().filter(message -> message.getCode().equals(code)).forEach(found::add);
        }
        return found;
    }
}

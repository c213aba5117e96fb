package com.vtb.parity.lint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Одно замечание линтера. {@code code}: короткий идентификатор вида {@code invalid-link-target}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class LintMessage {
    LintLevel level;
    String code;
    String message;
    @JsonProperty("operation_id")
    String operationId;
    Map<String, Object> details;

    @JsonIgnore
    public String describe() {
        return (operationId != null ? "[" + operationId + "] " : "") + code + ": " + message;
    }
}

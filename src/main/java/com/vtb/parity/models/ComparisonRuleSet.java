package com.vtb.parity.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Файл правил сравнения: правила по умолчанию и переопределения по operationId.
 * Переопределение заменяет правило по умолчанию для того же ключа целиком, без слияния.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ComparisonRuleSet {
    private String version = "1";
    private String description;
    private OperationRules defaultRules = new OperationRules();
    private Map<String, OperationRules> operationRules = new LinkedHashMap<>();

    public static ComparisonRuleSet empty() {
        return new ComparisonRuleSet();
    }
}

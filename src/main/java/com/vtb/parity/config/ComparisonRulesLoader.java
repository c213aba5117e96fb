package com.vtb.parity.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.parity.comparator.ExpressionLibrary;
import com.vtb.parity.comparator.JsonPathPattern;
import com.vtb.parity.models.ComparisonRuleSet;
import com.vtb.parity.models.FieldRule;
import com.vtb.parity.models.OperationRules;
import com.vtb.parity.models.PresenceMode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Загрузка и проверка файла правил сравнения (JSON или YAML по расширению).
 * Любая ошибка в правилах не даёт запуску начаться.
 */
@Slf4j
public class ComparisonRulesLoader {

    private final ExpressionLibrary library;

    public ComparisonRulesLoader(ExpressionLibrary library) {
        this.library = library;
    }

    /**
     * @param file файл правил; null: пустой набор (точное сравнение везде)
     */
    public ComparisonRuleSet load(Path file) {
        if (file == null) {
            log.info("Файл правил не задан, используется точное сравнение");
            return ComparisonRuleSet.empty();
        }
        if (!Files.isRegularFile(file)) {
            throw new ConfigException("Файл правил не найден: " + file);
        }
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = name.endsWith(".yaml") || name.endsWith(".yml")
            ? new ObjectMapper(new YAMLFactory())
            : new ObjectMapper();

        ComparisonRuleSet rules;
        try {
            rules = mapper.readValue(file.toFile(), ComparisonRuleSet.class);
        } catch (IOException e) {
            throw new ConfigException("Ошибка чтения правил " + file + ": " + e.getMessage(), e);
        }
        if (rules == null) {
            rules = ComparisonRuleSet.empty();
        }
        if (rules.getDefaultRules() == null) {
            rules.setDefaultRules(new OperationRules());
        }
        if (rules.getOperationRules() == null) {
            rules.setOperationRules(new java.util.LinkedHashMap<>());
        }

        List<String> problems = validate(rules);
        if (!problems.isEmpty()) {
            throw new ConfigException("Некорректные правила сравнения в " + file + ":\n  - "
                + String.join("\n  - ", problems));
        }
        log.info("Правила сравнения загружены: {} (переопределений операций: {})",
            file, rules.getOperationRules().size());
        return rules;
    }

    public List<String> validate(ComparisonRuleSet rules) {
        List<String> problems = new ArrayList<>();
        validateScope("defaultRules", rules.getDefaultRules(), problems);
        for (Map.Entry<String, OperationRules> entry : rules.getOperationRules().entrySet()) {
            validateScope("operationRules." + entry.getKey(), entry.getValue(), problems);
        }
        return problems;
    }

    private void validateScope(String scope, OperationRules rules, List<String> problems) {
        if (rules == null) {
            return;
        }
        validateRule(scope + ".statusCode", rules.getStatusCode(), problems);
        validateRule(scope + ".binaryRule", rules.getBinaryRule(), problems);
        if (rules.getHeaders() != null) {
            rules.getHeaders().forEach((header, rule) -> validateRule(scope + ".headers." + header, rule, problems));
        }
        if (rules.getBody() != null) {
            for (Map.Entry<String, FieldRule> entry : rules.getBody().entrySet()) {
                String location = scope + ".body['" + entry.getKey() + "']";
                try {
                    JsonPathPattern.parse(entry.getKey());
                } catch (IllegalArgumentException e) {
                    problems.add(location + ": " + e.getMessage());
                }
                validateRule(location, entry.getValue(), problems);
            }
        }
    }

    private void validateRule(String location, FieldRule rule, List<String> problems) {
        if (rule == null) {
            return;
        }
        if (rule.presenceOrDefault() == PresenceMode.FORBIDDEN && rule.hasComparison()) {
            problems.add(location + ": presence 'forbidden' несовместим со сравнением значений");
        }
        if (rule.getExpr() != null && rule.getExpr().isBlank()) {
            problems.add(location + ": пустое выражение expr");
        }
        for (String problem : library.validate(rule)) {
            problems.add(location + ": " + problem);
        }
    }
}

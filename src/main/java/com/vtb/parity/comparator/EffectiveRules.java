package com.vtb.parity.comparator;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.parity.models.ComparisonRuleSet;
import com.vtb.parity.models.FieldRule;
import com.vtb.parity.models.OperationRules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Правила, действующие для одной операции.
 *
 * Двухуровневый поиск по ключу: сначала область операции, затем область по умолчанию.
 * Правило операции заменяет правило по умолчанию с тем же ключом целиком; ключи,
 * не упомянутые операцией, наследуются. Глубокого слияния нет.
 */
public final class EffectiveRules {

    private final String operationId;
    private final OperationRules operationScope;
    private final OperationRules defaultScope;
    private final List<BodyRule> bodyRules;

    /**
     * Правило тела с разобранным шаблоном. Список хранится в порядке объявления:
     * при равной специфичности побеждает объявленное раньше.
     */
    public static final class BodyRule {
        private final JsonPathPattern pattern;
        private final FieldRule rule;

        BodyRule(JsonPathPattern pattern, FieldRule rule) {
            this.pattern = pattern;
            this.rule = rule;
        }

        public JsonPathPattern getPattern() {
            return pattern;
        }

        public FieldRule getRule() {
            return rule;
        }
    }

    private EffectiveRules(String operationId, OperationRules operationScope, OperationRules defaultScope) {
        this.operationId = operationId;
        this.operationScope = operationScope;
        this.defaultScope = defaultScope != null ? defaultScope : new OperationRules();
        this.bodyRules = buildBodyRules();
    }

    public static EffectiveRules of(ComparisonRuleSet ruleSet, String operationId) {
        ComparisonRuleSet rules = ruleSet != null ? ruleSet : ComparisonRuleSet.empty();
        OperationRules scope = operationId != null && rules.getOperationRules() != null
            ? rules.getOperationRules().get(operationId)
            : null;
        return new EffectiveRules(operationId, scope, rules.getDefaultRules());
    }

    public String getOperationId() {
        return operationId;
    }

    public FieldRule statusRule() {
        if (operationScope != null && operationScope.getStatusCode() != null) {
            return operationScope.getStatusCode();
        }
        return defaultScope.getStatusCode();
    }

    /**
     * Имена заголовков (в нижнем регистре), для которых есть правило в любой из областей
     */
    public List<String> headerNames() {
        Set<String> names = new LinkedHashSet<>();
        if (operationScope != null && operationScope.getHeaders() != null) {
            operationScope.getHeaders().keySet().forEach(name -> names.add(name.toLowerCase(Locale.ROOT)));
        }
        if (defaultScope.getHeaders() != null) {
            defaultScope.getHeaders().keySet().forEach(name -> names.add(name.toLowerCase(Locale.ROOT)));
        }
        return new ArrayList<>(names);
    }

    public FieldRule headerRule(String name) {
        FieldRule specific = operationScope != null ? findHeader(operationScope.getHeaders(), name) : null;
        return specific != null ? specific : findHeader(defaultScope.getHeaders(), name);
    }

    /**
     * Самое специфичное правило для каждого конкретного пути, который шаблоны выбирают
     * хотя бы в одном из тел. Ключ: нормализованный путь ({@link JsonPathPattern#normalize}).
     */
    public Map<String, FieldRule> matchBody(JsonNode bodyA, JsonNode bodyB) {
        Map<String, BodyRule> best = new HashMap<>();
        for (BodyRule candidate : bodyRules) {
            Set<String> selected = new LinkedHashSet<>(candidate.pattern.select(bodyA));
            selected.addAll(candidate.pattern.select(bodyB));
            for (String path : selected) {
                best.merge(path, candidate, (current, next) ->
                    next.pattern.compareSpecificity(current.pattern) > 0 ? next : current);
            }
        }
        Map<String, FieldRule> result = new HashMap<>();
        best.forEach((path, bodyRule) -> result.put(path, bodyRule.rule));
        return result;
    }

    /**
     * Первое объявленное литеральное правило для нормализованного пути
     */
    public Optional<BodyRule> literalRule(String normalizedPath) {
        return bodyRules.stream()
            .filter(candidate -> candidate.pattern.isLiteral())
            .filter(candidate -> candidate.pattern.normalizedPath().equals(normalizedPath))
            .findFirst();
    }

    public List<BodyRule> bodyRules() {
        return bodyRules;
    }

    public FieldRule binaryRule() {
        if (operationScope != null && operationScope.getBinaryRule() != null) {
            return operationScope.getBinaryRule();
        }
        return defaultScope.getBinaryRule();
    }

    public boolean compareErrorBodies() {
        if (operationScope != null && operationScope.getCompareErrorBodies() != null) {
            return operationScope.getCompareErrorBodies();
        }
        return Boolean.TRUE.equals(defaultScope.getCompareErrorBodies());
    }

    private List<BodyRule> buildBodyRules() {
        List<BodyRule> result = new ArrayList<>();
        Map<String, FieldRule> specific = operationScope != null && operationScope.getBody() != null
            ? operationScope.getBody()
            : Map.of();
        Map<String, FieldRule> defaults = defaultScope.getBody() != null ? defaultScope.getBody() : Map.of();

        for (Map.Entry<String, FieldRule> entry : specific.entrySet()) {
            result.add(new BodyRule(JsonPathPattern.parse(entry.getKey()), entry.getValue()));
        }
        for (Map.Entry<String, FieldRule> entry : defaults.entrySet()) {
            if (!specific.containsKey(entry.getKey())) {
                result.add(new BodyRule(JsonPathPattern.parse(entry.getKey()), entry.getValue()));
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static FieldRule findHeader(Map<String, FieldRule> headers, String name) {
        if (headers == null || name == null) {
            return null;
        }
        FieldRule exact = headers.get(name);
        if (exact != null) {
            return exact;
        }
        return headers.entrySet().stream()
            .filter(entry -> entry.getKey().equalsIgnoreCase(name))
            .map(Map.Entry::getValue)
            .findFirst()
            .orElse(null);
    }
}

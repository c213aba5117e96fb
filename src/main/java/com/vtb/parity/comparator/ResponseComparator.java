package com.vtb.parity.comparator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.vtb.parity.config.ConfigException;
import com.vtb.parity.evaluator.EvalResult;
import com.vtb.parity.evaluator.ExpressionEvaluator;
import com.vtb.parity.models.ComparisonRuleSet;
import com.vtb.parity.models.FieldRule;
import com.vtb.parity.models.Mismatch;
import com.vtb.parity.models.PresenceMode;
import com.vtb.parity.models.StepResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Сравнение ответов двух целей по правилам.
 *
 * Фазы по порядку, каждая останавливает сравнение при расхождении:
 * транспорт → статус → заголовки → тело. Одинаковый статус ошибки (>= 400) у обеих целей
 * означает совпадение без сравнения заголовков и тела (если правила не требуют иного).
 *
 * Тело обходится по объединению путей обоих ответов. Для каждого пути берётся самое
 * специфичное правило; правило на узле сравнивает узел целиком, без спуска. Без правила
 * объекты и массивы одинаковой длины обходятся поэлементно, листья сравниваются точно.
 */
@Slf4j
public class ResponseComparator {

    public static final String TRANSPORT_PATH = "transport";
    static final String EXACT = "exact_match";
    static final String NUMERIC_TOLERANCE = "numeric_tolerance";
    static final String UNORDERED_UNIQUE = "unordered_unique";
    static final String IGNORE = "ignore";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ComparisonRuleSet ruleSet;
    private final ExpressionLibrary library;
    private final ExpressionEvaluator evaluator;
    private final Map<String, EffectiveRules> effectiveCache = new ConcurrentHashMap<>();

    public ResponseComparator(ComparisonRuleSet ruleSet, ExpressionLibrary library, ExpressionEvaluator evaluator) {
        this.ruleSet = ruleSet != null ? ruleSet : ComparisonRuleSet.empty();
        this.library = library;
        this.evaluator = evaluator;
    }

    public EffectiveRules rulesFor(String operationId) {
        return effectiveCache.computeIfAbsent(operationId != null ? operationId : "",
            id -> EffectiveRules.of(ruleSet, operationId));
    }

    public List<Mismatch> compare(String operationId, StepResult a, StepResult b) {
        return compare(a, b, rulesFor(operationId));
    }

    public List<Mismatch> compare(StepResult a, StepResult b, EffectiveRules rules) {
        List<Mismatch> mismatches = new ArrayList<>();

        if (a.isTerminal() || b.isTerminal()) {
            // обе стороны без ответа: ошибка выполнения, а не расхождение
            if (!(a.isTerminal() && b.isTerminal())) {
                mismatches.add(Mismatch.ofText(TRANSPORT_PATH, TRANSPORT_PATH, a.describe(), b.describe()));
            }
            return mismatches;
        }

        compareStatus(a, b, rules, mismatches);
        if (!mismatches.isEmpty()) {
            return mismatches;
        }
        if (a.getStatusCode() != null && a.getStatusCode() >= 400
            && a.getStatusCode().equals(b.getStatusCode()) && !rules.compareErrorBodies()) {
            log.debug("Обе цели вернули {}, заголовки и тело не сравниваются", a.getStatusCode());
            return mismatches;
        }

        compareHeaders(a, b, rules, mismatches);
        if (!mismatches.isEmpty()) {
            return mismatches;
        }

        compareBody(a, b, rules, mismatches);
        return mismatches;
    }

    private void compareStatus(StepResult a, StepResult b, EffectiveRules rules, List<Mismatch> out) {
        JsonNode statusA = a.getStatusCode() != null ? NODES.numberNode(a.getStatusCode()) : null;
        JsonNode statusB = b.getStatusCode() != null ? NODES.numberNode(b.getStatusCode()) : null;
        FieldRule rule = rules.statusRule();
        if (rule == null) {
            if (!JsonValues.equivalent(statusA, statusB)) {
                out.add(Mismatch.of("status_code", EXACT, statusA, statusB));
            }
            return;
        }
        applyRule("status_code", statusA, statusB, rule).ifPresent(out::add);
    }

    private void compareHeaders(StepResult a, StepResult b, EffectiveRules rules, List<Mismatch> out) {
        for (String name : rules.headerNames()) {
            FieldRule rule = rules.headerRule(name);
            // только первое значение многозначного заголовка
            JsonNode valueA = a.firstHeader(name).map(NODES::textNode).orElse(null);
            JsonNode valueB = b.firstHeader(name).map(NODES::textNode).orElse(null);
            applyRule("headers." + name, valueA, valueB, rule).ifPresent(out::add);
        }
    }

    private void compareBody(StepResult a, StepResult b, EffectiveRules rules, List<Mismatch> out) {
        boolean jsonA = a.getBody() != null;
        boolean jsonB = b.getBody() != null;
        boolean binaryA = !jsonA && a.getBodyBase64() != null;
        boolean binaryB = !jsonB && b.getBodyBase64() != null;

        if (jsonA && jsonB) {
            Set<String> visited = new LinkedHashSet<>();
            Map<String, FieldRule> matched = rules.matchBody(a.getBody(), b.getBody());
            walk(new ArrayList<>(), a.getBody(), b.getBody(), matched, out, visited);
            checkRequiredLiterals(rules, visited, out);
            return;
        }
        if (binaryA && binaryB) {
            compareBinary(a.getBodyBase64(), b.getBodyBase64(), rules, out);
            return;
        }
        if (jsonA || jsonB || binaryA || binaryB) {
            out.add(Mismatch.ofText("$", "body_presence", describeBody(jsonA, binaryA), describeBody(jsonB, binaryB)));
        }
    }

    private static String describeBody(boolean json, boolean binary) {
        if (json) {
            return "<json body>";
        }
        return binary ? "<binary body>" : "<no body>";
    }

    private void compareBinary(String base64A, String base64B, EffectiveRules rules, List<Mismatch> out) {
        FieldRule rule = rules.binaryRule();
        JsonNode valueA = NODES.textNode(base64A);
        JsonNode valueB = NODES.textNode(base64B);
        if (rule == null) {
            if (!base64A.equals(base64B)) {
                out.add(Mismatch.of("$", "binary_body", valueA, valueB));
            }
            return;
        }
        applyRule("$", valueA, valueB, rule).ifPresent(out::add);
    }

    private void walk(List<Object> path, JsonNode a, JsonNode b, Map<String, FieldRule> matched,
                      List<Mismatch> out, Set<String> visited) {
        String rendered = JsonPathPattern.render(path);
        String normalized = JsonPathPattern.normalize(path);
        visited.add(normalized);

        FieldRule rule = matched.get(normalized);
        if (rule != null) {
            applyRule(rendered, a, b, rule).ifPresent(out::add);
            return;
        }

        if (a == null || b == null) {
            if (a != b) {
                out.add(Mismatch.of(rendered, "presence:" + PresenceMode.PARITY.wireName(), a, b));
            }
            return;
        }
        if (a.isObject() && b.isObject()) {
            Set<String> keys = new LinkedHashSet<>();
            a.fieldNames().forEachRemaining(keys::add);
            b.fieldNames().forEachRemaining(keys::add);
            for (String key : keys) {
                path.add(key);
                walk(path, a.get(key), b.get(key), matched, out, visited);
                path.remove(path.size() - 1);
            }
            return;
        }
        if (a.isArray() && b.isArray()) {
            if (a.size() != b.size()) {
                out.add(Mismatch.of(rendered, EXACT, a, b));
                return;
            }
            for (int i = 0; i < a.size(); i++) {
                path.add(i);
                walk(path, a.get(i), b.get(i), matched, out, visited);
                path.remove(path.size() - 1);
            }
            return;
        }
        if (!JsonValues.equivalent(a, b)) {
            out.add(Mismatch.of(rendered, EXACT, a, b));
        }
    }

    /**
     * Литеральные пути, отсутствующие в обоих ответах, обходом не посещаются;
     * для них отдельно проверяется presence (required провалится, остальные режимы пройдут)
     */
    private void checkRequiredLiterals(EffectiveRules rules, Set<String> visited, List<Mismatch> out) {
        for (EffectiveRules.BodyRule bodyRule : rules.bodyRules()) {
            JsonPathPattern pattern = bodyRule.getPattern();
            if (!pattern.isLiteral()) {
                continue;
            }
            String normalized = pattern.normalizedPath();
            String rendered = JsonPathPattern.display(normalized);
            if (visited.contains(normalized) || reportedAbove(rendered, out)) {
                continue;
            }
            if (rules.literalRule(normalized).orElse(null) != bodyRule) {
                continue;
            }
            applyRule(rendered, null, null, bodyRule.getRule()).ifPresent(out::add);
        }
    }

    private static boolean reportedAbove(String rendered, List<Mismatch> out) {
        for (Mismatch mismatch : out) {
            String reported = mismatch.getPath();
            if (rendered.length() > reported.length() && rendered.startsWith(reported)) {
                char next = rendered.charAt(reported.length());
                if (next == '.' || next == '[') {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Presence, затем сравнение значений. Ошибка вычисления становится расхождением
     * с правилом {@code "error: <текст>"}.
     */
    Optional<Mismatch> applyRule(String path, JsonNode a, JsonNode b, FieldRule rule) {
        PresenceMode presence = rule.presenceOrDefault();
        boolean presentA = a != null;
        boolean presentB = b != null;

        boolean passed = switch (presence) {
            case PARITY -> presentA == presentB;
            case REQUIRED -> presentA && presentB;
            case FORBIDDEN -> !presentA && !presentB;
            case OPTIONAL -> true;
        };
        if (!passed) {
            return Optional.of(Mismatch.of(path, "presence:" + presence.wireName(), a, b));
        }
        if (!(presentA && presentB) || !rule.hasComparison()) {
            return Optional.empty();
        }

        Verdict verdict = evaluate(a, b, rule);
        if (verdict.error != null) {
            return Optional.of(Mismatch.of(path, "error: " + verdict.error, a, b));
        }
        if (!verdict.passed) {
            return Optional.of(Mismatch.of(path, rule.ruleName(), a, b));
        }
        return Optional.empty();
    }

    private Verdict evaluate(JsonNode a, JsonNode b, FieldRule rule) {
        if (rule.getExpr() != null) {
            return viaEvaluator(rule.getExpr(), a, b);
        }
        return switch (rule.getPredefined()) {
            case EXACT -> Verdict.of(JsonValues.equivalent(a, b));
            case IGNORE -> Verdict.of(true);
            case NUMERIC_TOLERANCE -> numericTolerance(a, b, rule.getTolerance());
            // кратность не учитывается: [1,1,2] и [1,2,2] считаются равными
            case UNORDERED_UNIQUE -> Verdict.of(a.isArray() && b.isArray()
                && JsonValues.asSet(a).equals(JsonValues.asSet(b)));
            default -> viaLibrary(rule, a, b);
        };
    }

    private static Verdict numericTolerance(JsonNode a, JsonNode b, Double tolerance) {
        if (tolerance == null) {
            return Verdict.error("Missing required parameter 'tolerance' for predefined '" + NUMERIC_TOLERANCE + "'");
        }
        if (!a.isNumber() || !b.isNumber()) {
            return Verdict.of(false);
        }
        return Verdict.of(Math.abs(a.doubleValue() - b.doubleValue()) <= tolerance);
    }

    private Verdict viaLibrary(FieldRule rule, JsonNode a, JsonNode b) {
        String expression;
        try {
            expression = library.expand(rule);
        } catch (ConfigException e) {
            return Verdict.error(e.getMessage());
        }
        return viaEvaluator(expression, a, b);
    }

    private Verdict viaEvaluator(String expression, JsonNode a, JsonNode b) {
        Map<String, JsonNode> bindings = new LinkedHashMap<>();
        bindings.put("a", a);
        bindings.put("b", b);
        EvalResult result = evaluator.evaluate(expression, bindings);
        if (!result.isOk()) {
            return Verdict.error(result.getError());
        }
        JsonNode value = result.getValue();
        if (value == null || !value.isBoolean()) {
            return Verdict.error("expression did not return a boolean: " + value);
        }
        return Verdict.of(value.booleanValue());
    }

    private static final class Verdict {
        final boolean passed;
        final String error;

        private Verdict(boolean passed, String error) {
            this.passed = passed;
            this.error = error;
        }

        static Verdict of(boolean passed) {
            return new Verdict(passed, null);
        }

        static Verdict error(String message) {
            return new Verdict(false, message);
        }
    }
}

package com.vtb.parity.comparator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.parity.evaluator.EvalResult;
import com.vtb.parity.evaluator.EvaluatorProtocol;
import com.vtb.parity.models.ComparisonRuleSet;
import com.vtb.parity.models.FieldRule;
import com.vtb.parity.models.Mismatch;
import com.vtb.parity.models.OperationRules;
import com.vtb.parity.models.PresenceMode;
import com.vtb.parity.models.StepResult;
import com.vtb.parity.models.TransportErrorKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResponseComparatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final InProcessEvaluator evaluator = new InProcessEvaluator();

    private StepResult response(int status, String json) throws Exception {
        return StepResult.builder()
            .statusCode(status)
            .body(json != null ? mapper.readTree(json) : null)
            .build();
    }

    private ResponseComparator comparator(ComparisonRuleSet rules) {
        return new ResponseComparator(rules, ExpressionLibrary.loadDefault(), evaluator);
    }

    private static ComparisonRuleSet defaults(Map<String, FieldRule> body) {
        ComparisonRuleSet rules = ComparisonRuleSet.empty();
        rules.getDefaultRules().setBody(body);
        return rules;
    }

    private static FieldRule tolerance(String name, String param, double value) {
        FieldRule rule = FieldRule.predefined(name);
        if (param.equals("tolerance")) {
            rule.setTolerance(value);
        } else {
            rule.setSeconds(value);
        }
        return rule;
    }

    @Test
    void testEquivalentBodiesMatch() throws Exception {
        List<Mismatch> mismatches = comparator(ComparisonRuleSet.empty()).compare("op",
            response(200, "{\"a\":1,\"b\":{\"c\":[1,2]}}"),
            response(200, "{\"b\":{\"c\":[1,2.0]},\"a\":1.0}"));

        assertTrue(mismatches.isEmpty(), "Порядок ключей и запись чисел не важны: " + mismatches);
    }

    @Test
    void testLeafDifferenceReportedWithPath() throws Exception {
        List<Mismatch> mismatches = comparator(ComparisonRuleSet.empty()).compare("op",
            response(200, "{\"items\":[{\"name\":\"pen\"}]}"),
            response(200, "{\"items\":[{\"name\":\"pencil\"}]}"));

        assertEquals(1, mismatches.size());
        assertEquals("$.items[0].name", mismatches.get(0).getPath());
        assertEquals(ResponseComparator.EXACT, mismatches.get(0).getRule());
        assertEquals("pen", mismatches.get(0).getTargetA().asText());
        assertEquals("pencil", mismatches.get(0).getTargetB().asText());
    }

    @Test
    void testStatusMismatchStopsComparison() throws Exception {
        List<Mismatch> mismatches = comparator(ComparisonRuleSet.empty()).compare("op",
            response(200, "{\"a\":1}"),
            response(201, "{\"a\":2}"));

        assertEquals(1, mismatches.size());
        assertEquals("status_code", mismatches.get(0).getPath());
    }

    @Test
    void testEqualErrorStatusesSkipBody() throws Exception {
        StepResult a = response(404, "{\"error\":\"no item 1\"}");
        StepResult b = response(404, "{\"message\":\"missing\"}");

        assertTrue(comparator(ComparisonRuleSet.empty()).compare("op", a, b).isEmpty(),
            "Одинаковый статус ошибки означает совпадение");

        ComparisonRuleSet strict = ComparisonRuleSet.empty();
        strict.getDefaultRules().setCompareErrorBodies(true);
        assertFalse(comparator(strict).compare("op", a, b).isEmpty());
    }

    @Test
    void testTransportMismatchWhenOneSideFails() throws Exception {
        StepResult failed = StepResult.terminal(TransportErrorKind.TIMEOUT, "timeout after 100 ms", 100);

        List<Mismatch> mismatches = comparator(ComparisonRuleSet.empty()).compare("op", response(200, "{}"), failed);

        assertEquals(1, mismatches.size());
        assertEquals(ResponseComparator.TRANSPORT_PATH, mismatches.get(0).getPath());
        assertTrue(mismatches.get(0).getTargetB().asText().contains("TIMEOUT"));
        assertTrue(comparator(ComparisonRuleSet.empty()).compare("op", failed, failed).isEmpty(),
            "Обе стороны без ответа не дают расхождения");
    }

    @Test
    void testOperationRuleOverridesDefaultForSamePath() throws Exception {
        ComparisonRuleSet rules = defaults(Map.of("$.id", FieldRule.predefined("ignore")));
        OperationRules getItem = new OperationRules();
        getItem.setBody(Map.of("$.id", FieldRule.predefined("exact_match")));
        rules.setOperationRules(Map.of("getItem", getItem));
        ResponseComparator comparator = comparator(rules);

        StepResult a = response(200, "{\"id\":\"1\"}");
        StepResult b = response(200, "{\"id\":\"2\"}");

        assertTrue(comparator.compare("listItems", a, b).isEmpty(), "По умолчанию id игнорируется");
        List<Mismatch> overridden = comparator.compare("getItem", a, b);
        assertEquals(1, overridden.size());
        assertEquals("exact_match", overridden.get(0).getRule());
    }

    @Test
    void testWildcardRuleAppliesToEveryElement() throws Exception {
        ResponseComparator comparator = comparator(defaults(Map.of("$.items[*].updatedAt", FieldRule.predefined("ignore"))));

        List<Mismatch> mismatches = comparator.compare("op",
            response(200, "{\"items\":[{\"id\":1,\"updatedAt\":\"t1\"},{\"id\":2,\"updatedAt\":\"t2\"}]}"),
            response(200, "{\"items\":[{\"id\":1,\"updatedAt\":\"t3\"},{\"id\":2,\"updatedAt\":\"t4\"}]}"));

        assertTrue(mismatches.isEmpty(), mismatches.toString());
    }

    @Test
    void testDescentRuleYieldsToMoreSpecificLiteral() throws Exception {
        ComparisonRuleSet rules = ComparisonRuleSet.empty();
        rules.getDefaultRules().getBody().put("$..updatedAt", FieldRule.predefined("ignore"));
        rules.getDefaultRules().getBody().put("$.meta.updatedAt", FieldRule.predefined("exact_match"));
        ResponseComparator comparator = comparator(rules);

        List<Mismatch> mismatches = comparator.compare("op",
            response(200, "{\"updatedAt\":1,\"items\":[{\"updatedAt\":2}],\"meta\":{\"updatedAt\":\"x\"}}"),
            response(200, "{\"updatedAt\":5,\"items\":[{\"updatedAt\":6}],\"meta\":{\"updatedAt\":\"y\"}}"));

        assertEquals(1, mismatches.size(), mismatches.toString());
        assertEquals("$.meta.updatedAt", mismatches.get(0).getPath());
        assertEquals("exact_match", mismatches.get(0).getRule());
    }

    @Test
    void testRuleSelectedOnlyInOneBodyStillApplies() throws Exception {
        FieldRule optional = new FieldRule();
        optional.setPresence(PresenceMode.OPTIONAL);
        ResponseComparator comparator = comparator(defaults(Map.of("$.items[*].note", optional)));

        List<Mismatch> mismatches = comparator.compare("op",
            response(200, "{\"items\":[{\"id\":1,\"note\":\"draft\"}]}"),
            response(200, "{\"items\":[{\"id\":1}]}"));

        assertTrue(mismatches.isEmpty(), mismatches.toString());
    }

    @Test
    void testUnorderedUniqueIgnoresMultiplicity() throws Exception {
        ResponseComparator comparator = comparator(defaults(Map.of("$.tags", FieldRule.predefined("unordered_unique"))));

        assertTrue(comparator.compare("op", response(200, "{\"tags\":[1,1,2]}"), response(200, "{\"tags\":[1,2,2]}")).isEmpty());
        assertTrue(comparator.compare("op", response(200, "{\"tags\":[\"b\",\"a\"]}"), response(200, "{\"tags\":[\"a\",\"b\"]}")).isEmpty());

        List<Mismatch> different = comparator.compare("op", response(200, "{\"tags\":[1,2]}"), response(200, "{\"tags\":[1,3]}"));
        assertEquals("unordered_unique", different.get(0).getRule());
    }

    @Test
    void testNumericTolerance() throws Exception {
        ResponseComparator comparator = comparator(defaults(Map.of("$.price", tolerance("numeric_tolerance", "tolerance", 0.01))));

        assertTrue(comparator.compare("op", response(200, "{\"price\":10.001}"), response(200, "{\"price\":10.005}")).isEmpty());
        assertEquals(1, comparator.compare("op", response(200, "{\"price\":10}"), response(200, "{\"price\":10.5}")).size());
        assertTrue(evaluator.expressions().isEmpty(), "Встроенные стратегии не обращаются к вычислителю");
    }

    @Test
    void testLibraryExpressionEvaluated() throws Exception {
        ResponseComparator comparator = comparator(defaults(Map.of("$.ts", tolerance("epoch_seconds_tolerance", "seconds", 5))));

        assertTrue(comparator.compare("op", response(200, "{\"ts\":1000}"), response(200, "{\"ts\":1003}")).isEmpty());
        List<Mismatch> far = comparator.compare("op", response(200, "{\"ts\":1000}"), response(200, "{\"ts\":1010}"));
        assertEquals(1, far.size());
        assertEquals("epoch_seconds_tolerance", far.get(0).getRule());
        assertEquals("a - b <= 5 && b - a <= 5", evaluator.expressions().get(0));
    }

    @Test
    void testCustomExpression() throws Exception {
        ResponseComparator comparator = comparator(defaults(Map.of("$.count", FieldRule.expression("a >= 0 && b >= 0"))));

        assertTrue(comparator.compare("op", response(200, "{\"count\":3}"), response(200, "{\"count\":7}")).isEmpty());
        List<Mismatch> negative = comparator.compare("op", response(200, "{\"count\":3}"), response(200, "{\"count\":-1}"));
        assertEquals("custom", negative.get(0).getRule());
    }

    @Test
    void testEvaluatorFailureBecomesMismatch() throws Exception {
        ResponseComparator comparator = new ResponseComparator(defaults(Map.of("$.v", FieldRule.expression("while (true) {}"))),
            ExpressionLibrary.loadDefault(),
            (expression, bindings) -> EvalResult.failure(EvaluatorProtocol.TIMEOUT_ERROR));

        List<Mismatch> mismatches = comparator.compare("op", response(200, "{\"v\":1}"), response(200, "{\"v\":1}"));

        assertEquals(1, mismatches.size());
        assertTrue(mismatches.get(0).getRule().contains("evaluation timeout exceeded"), mismatches.get(0).getRule());
    }

    @Test
    void testNonBooleanExpressionResultIsError() throws Exception {
        ResponseComparator comparator = comparator(defaults(Map.of("$.v", FieldRule.expression("a + b"))));

        List<Mismatch> mismatches = comparator.compare("op", response(200, "{\"v\":1}"), response(200, "{\"v\":2}"));

        assertTrue(mismatches.get(0).getRule().startsWith("error: "));
    }

    @Test
    void testMissingToleranceIsError() throws Exception {
        ResponseComparator comparator = comparator(defaults(Map.of("$.v", FieldRule.predefined("numeric_tolerance"))));

        List<Mismatch> mismatches = comparator.compare("op", response(200, "{\"v\":1}"), response(200, "{\"v\":1}"));

        assertTrue(mismatches.get(0).getRule().contains("Missing required parameter 'tolerance'"));
    }

    @Test
    void testPresenceModes() throws Exception {
        FieldRule required = new FieldRule();
        required.setPresence(PresenceMode.REQUIRED);
        FieldRule optional = FieldRule.predefined("exact_match");
        optional.setPresence(PresenceMode.OPTIONAL);
        FieldRule forbidden = new FieldRule();
        forbidden.setPresence(PresenceMode.FORBIDDEN);
        ResponseComparator comparator = comparator(defaults(Map.of(
            "$.token", required,
            "$.debug", optional,
            "$.secret", forbidden)));

        List<Mismatch> mismatches = comparator.compare("op",
            response(200, "{\"debug\":1,\"secret\":\"x\"}"),
            response(200, "{}"));

        assertEquals(2, mismatches.size(), mismatches.toString());
        assertTrue(mismatches.stream().anyMatch(m -> m.getPath().equals("$.token") && m.getRule().equals("presence:required")));
        assertTrue(mismatches.stream().anyMatch(m -> m.getPath().equals("$.secret") && m.getRule().equals("presence:forbidden")));
        assertEquals(Mismatch.MISSING, mismatches.stream()
            .filter(m -> m.getPath().equals("$.token")).findFirst().orElseThrow().getTargetA().asText());
    }

    @Test
    void testParityPresenceByDefault() throws Exception {
        List<Mismatch> mismatches = comparator(ComparisonRuleSet.empty()).compare("op",
            response(200, "{\"a\":1,\"extra\":true}"),
            response(200, "{\"a\":1}"));

        assertEquals(1, mismatches.size());
        assertEquals("$.extra", mismatches.get(0).getPath());
        assertEquals("presence:parity", mismatches.get(0).getRule());
    }

    @Test
    void testHeaderComparesFirstValueOnly() throws Exception {
        ComparisonRuleSet rules = ComparisonRuleSet.empty();
        rules.getDefaultRules().setHeaders(Map.of("X-Version", FieldRule.predefined("exact_match")));
        StepResult a = StepResult.builder().statusCode(200)
            .headers(StepResult.normalizeHeaders(Map.of("X-Version", List.of("a", "b")))).build();
        StepResult b = StepResult.builder().statusCode(200)
            .headers(StepResult.normalizeHeaders(Map.of("x-version", List.of("a", "c")))).build();
        StepResult other = StepResult.builder().statusCode(200)
            .headers(StepResult.normalizeHeaders(Map.of("x-version", List.of("z")))).build();

        assertTrue(comparator(rules).compare("op", a, b).isEmpty());
        List<Mismatch> mismatches = comparator(rules).compare("op", a, other);
        assertEquals("headers.x-version", mismatches.get(0).getPath());
    }

    @Test
    void testUnlistedHeadersIgnored() throws Exception {
        StepResult a = StepResult.builder().statusCode(200)
            .headers(StepResult.normalizeHeaders(Map.of("Date", List.of("Mon")))).build();
        StepResult b = StepResult.builder().statusCode(200)
            .headers(StepResult.normalizeHeaders(Map.of("Date", List.of("Tue")))).build();

        assertTrue(comparator(ComparisonRuleSet.empty()).compare("op", a, b).isEmpty());
    }

    @Test
    void testBinaryBodies() throws Exception {
        StepResult a = StepResult.builder().statusCode(200).bodyBase64("AQID").build();
        StepResult b = StepResult.builder().statusCode(200).bodyBase64("AQIE").build();

        assertEquals("binary_body", comparator(ComparisonRuleSet.empty()).compare("op", a, b).get(0).getRule());
        assertEquals("body_presence", comparator(ComparisonRuleSet.empty())
            .compare("op", a, response(200, "{}")).get(0).getRule());

        ComparisonRuleSet rules = ComparisonRuleSet.empty();
        rules.getDefaultRules().setBinaryRule(FieldRule.predefined("ignore"));
        assertTrue(comparator(rules).compare("op", a, b).isEmpty());
    }

    @Test
    void testArrayLengthDifference() throws Exception {
        List<Mismatch> mismatches = comparator(ComparisonRuleSet.empty()).compare("op",
            response(200, "[1,2,3]"), response(200, "[1,2]"));

        assertEquals(1, mismatches.size());
        assertEquals("$", mismatches.get(0).getPath());
    }
}

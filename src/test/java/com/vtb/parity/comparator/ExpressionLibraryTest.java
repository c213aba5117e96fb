package com.vtb.parity.comparator;

import com.vtb.parity.config.ConfigException;
import com.vtb.parity.evaluator.JexlExpressionEngine;
import com.vtb.parity.models.FieldRule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionLibraryTest {

    private final ExpressionLibrary library = ExpressionLibrary.loadDefault();

    @Test
    void testDefaultLibraryContainsNativeStrategies() {
        for (String name : ExpressionLibrary.NATIVE) {
            assertTrue(library.contains(name), "Нет встроенной стратегии " + name);
        }
        assertTrue(library.contains("both_in_range"));
    }

    @Test
    void testExpandSubstitutesParameters() {
        FieldRule rule = FieldRule.predefined("both_in_range");
        rule.setMin(1.5);
        rule.setMax(10.0);

        assertEquals("a >= 1.5 && a <= 10 && b >= 1.5 && b <= 10", library.expand(rule));
    }

    @Test
    void testStringParametersEscaped() {
        FieldRule rule = FieldRule.predefined("string_contains");
        rule.setSubstring("say \"hi\" \\ bye");

        assertEquals("a.contains(\"say \\\"hi\\\" \\\\ bye\") && b.contains(\"say \\\"hi\\\" \\\\ bye\")",
            library.expand(rule));
    }

    @Test
    void testRegexRulesSearchWithoutAnchors() {
        JexlExpressionEngine engine = new JexlExpressionEngine();
        FieldRule rule = FieldRule.predefined("both_match_regex");
        rule.setPattern("\\d+");

        String expression = library.expand(rule);
        assertEquals(Boolean.TRUE, engine.evaluate(expression, Map.of("a", "abc123", "b", "id-42")),
            "Шаблон ищется внутри строки: " + expression);
        assertEquals(Boolean.FALSE, engine.evaluate(expression, Map.of("a", "abc123", "b", "none")));

        String uuid = library.expand(FieldRule.predefined("uuid_format"));
        assertEquals(Boolean.TRUE, engine.evaluate(uuid, Map.of(
            "a", "123e4567-e89b-12d3-a456-426614174000", "b", "00000000-0000-0000-0000-000000000000")));
        assertEquals(Boolean.FALSE, engine.evaluate(uuid, Map.of(
            "a", "id-123e4567-e89b-12d3-a456-426614174000", "b", "00000000-0000-0000-0000-000000000000")),
            "UUID должен занимать всё значение");
    }

    @Test
    void testExpandFailures() {
        assertThrows(ConfigException.class, () -> library.expand(FieldRule.predefined("no_such_rule")));
        ConfigException missing = assertThrows(ConfigException.class,
            () -> library.expand(FieldRule.predefined("epoch_millis_tolerance")));
        assertTrue(missing.getMessage().contains("millis"));
    }

    @Test
    void testValidate() {
        FieldRule both = FieldRule.predefined("exact_match");
        both.setExpr("a == b");

        assertEquals(1, library.validate(both).size());
        assertEquals(1, library.validate(FieldRule.predefined("unknown")).size());
        assertEquals(1, library.validate(FieldRule.predefined("string_prefix")).size());
        assertEquals(List.of(), library.validate(FieldRule.expression("a == b")));
    }
}

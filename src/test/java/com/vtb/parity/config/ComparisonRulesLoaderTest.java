package com.vtb.parity.config;

import com.vtb.parity.comparator.ExpressionLibrary;
import com.vtb.parity.models.ComparisonRuleSet;
import com.vtb.parity.models.FieldRule;
import com.vtb.parity.models.PresenceMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ComparisonRulesLoaderTest {

    @TempDir
    Path directory;

    private final ComparisonRulesLoader loader = new ComparisonRulesLoader(ExpressionLibrary.loadDefault());

    private Path write(String name, String content) throws Exception {
        Path file = directory.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testLoadsYamlRules() throws Exception {
        Path file = write("rules.yaml", String.join("\n",
            "version: \"1\"",
            "defaultRules:",
            "  headers:",
            "    Content-Type:",
            "      predefined: exact_match",
            "  body:",
            "    \"$.updatedAt\":",
            "      predefined: epoch_seconds_tolerance",
            "      seconds: 5",
            "    \"$..trace\":",
            "      presence: optional",
            "operationRules:",
            "  getItem:",
            "    statusCode:",
            "      predefined: exact_match",
            "    compareErrorBodies: true",
            "    body:",
            "      \"$.items[*].price\":",
            "        predefined: numeric_tolerance",
            "        tolerance: 0.01",
            ""));

        ComparisonRuleSet rules = loader.load(file);

        FieldRule updated = rules.getDefaultRules().getBody().get("$.updatedAt");
        assertEquals("epoch_seconds_tolerance", updated.getPredefined());
        assertEquals(5.0, updated.getSeconds());
        assertEquals(PresenceMode.OPTIONAL, rules.getDefaultRules().getBody().get("$..trace").getPresence());
        assertTrue(rules.getDefaultRules().getHeaders().containsKey("Content-Type"));
        assertEquals(Boolean.TRUE, rules.getOperationRules().get("getItem").getCompareErrorBodies());
        assertEquals(0.01, rules.getOperationRules().get("getItem").getBody().get("$.items[*].price").getTolerance());
    }

    @Test
    void testLoadsJsonRules() throws Exception {
        Path file = write("rules.json",
            "{\"defaultRules\":{\"body\":{\"$.id\":{\"expr\":\"a == b\"}}}}");

        ComparisonRuleSet rules = loader.load(file);

        assertEquals("a == b", rules.getDefaultRules().getBody().get("$.id").getExpr());
        assertTrue(rules.getOperationRules().isEmpty());
    }

    @Test
    void testMissingFileMeansExactComparison() {
        ComparisonRuleSet rules = loader.load(null);

        assertTrue(rules.getDefaultRules().getBody().isEmpty());
        assertTrue(rules.getOperationRules().isEmpty());
    }

    @Test
    void testNonexistentFileRejected() {
        assertThrows(ConfigException.class, () -> loader.load(directory.resolve("absent.yaml")));
    }

    @Test
    void testInvalidRulesCollectedInOneError() throws Exception {
        Path file = write("rules.yaml", String.join("\n",
            "defaultRules:",
            "  body:",
            "    \"id\":",
            "      predefined: exact_match",
            "    \"$.secret\":",
            "      presence: forbidden",
            "      predefined: exact_match",
            "    \"$.price\":",
            "      predefined: no_such_rule",
            "    \"$.range\":",
            "      predefined: both_in_range",
            "      min: 1",
            ""));

        ConfigException error = assertThrows(ConfigException.class, () -> loader.load(file));

        String message = error.getMessage();
        assertTrue(message.contains("defaultRules.body['id']"), "Путь без '$': " + message);
        assertTrue(message.contains("forbidden"), message);
        assertTrue(message.contains("no_such_rule"), message);
        assertTrue(message.contains("$.range"), "Не хватает параметра max: " + message);
    }

    @Test
    void testBrokenYamlRejected() throws Exception {
        Path file = write("rules.yml", "defaultRules: [unterminated");

        assertThrows(ConfigException.class, () -> loader.load(file));
    }

    @Test
    void testUnknownFieldInRuleRejected() throws Exception {
        Path file = write("rules.json", "{\"defaultRules\":{\"body\":{\"$.id\":{\"tolerence\":1}}}}");

        assertThrows(ConfigException.class, () -> loader.load(file));
    }
}

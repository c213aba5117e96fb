package com.vtb.parity.lint;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.parity.TestFixtures;
import com.vtb.parity.bundle.BundleFiles;
import com.vtb.parity.core.OpenAPIParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SpecLinterTest {

    @TempDir
    Path directory;

    private static LintResult lint(Path file) {
        OpenAPIParser parser = new OpenAPIParser();
        parser.parseFromFile(file.toString());
        return new SpecLinter(parser.getOpenAPI(), parser.buildModel(), file).lint();
    }

    private Path write(String name, String... lines) throws Exception {
        Path file = directory.resolve(name);
        Files.writeString(file, String.join("\n", lines) + "\n");
        return file;
    }

    @Test
    void testItemsSpecification() {
        LintResult result = lint(TestFixtures.resource(TestFixtures.ITEMS_SPEC));

        assertEquals(5, result.getSummary().getTotalOperations());
        assertEquals(4, result.getSummary().getOperationsWithLinks());
        assertEquals(3, result.getSummary().getOperationsWithResponseSchemas());

        List<LintMessage> invalid = result.find("invalid-link-target");
        assertEquals(1, invalid.size());
        assertEquals("get_tags_tag", invalid.get(0).getOperationId());
        assertEquals("missingOperation", invalid.get(0).getDetails().get("target"));
        assertTrue(result.hasErrors());

        assertEquals("get_tags_tag", result.find("isolated-operation").get(0).getOperationId());
        assertEquals("deleteItem", result.find("chain-terminator").get(0).getOperationId());
        assertEquals(2, result.find("chain-entry-point").size());
        assertTrue(result.find("no-explicit-links").isEmpty());

        Map<String, Object> expressions = result.find("link-expression-coverage").get(0).getDetails();
        assertEquals(3, expressions.get("body_expressions"), "Связь по $ref считается по разрешённому определению");
        assertEquals(1, expressions.get("request_expressions"));
        assertEquals(List.of("/0/id", "/id"), expressions.get("body_fields"));

        assertEquals(1, result.find("non-200-status-links").size());
        assertEquals(List.of("deleteItem", "get_tags_tag"),
            result.find("missing-response-schema").get(0).getDetails().get("operations_without_schema"));
    }

    @Test
    void testChainDepth() {
        LintResult result = lint(TestFixtures.resource(TestFixtures.ITEMS_SPEC));

        LintResult.ChainDepth depth = result.getChainDepth();
        assertEquals(2, depth.getDepth1());
        assertEquals(1, depth.getDepth2());
        assertEquals(1, depth.getDepth3());
        assertEquals(0, depth.getDepth4Plus());
        assertEquals(1, depth.getUnreachable());

        List<LintMessage> deep = result.find("deep-chain-depth-3");
        assertEquals(1, deep.size());
        assertEquals("deleteItem", deep.get(0).getOperationId());
        assertEquals(LintLevel.WARNING, deep.get(0).getLevel());
    }

    @Test
    void testDuplicateLinkNamesFoundInSource() throws Exception {
        Path file = write("duplicates.yaml",
            "openapi: 3.0.3",
            "info: {title: dup, version: '1'}",
            "paths:",
            "  /a:",
            "    get:",
            "      operationId: getA",
            "      responses:",
            "        '200':",
            "          description: ok",
            "          links:",
            "            Next:",
            "              operationId: getB",
            "            Next:",
            "              operationId: getB",
            "  /b:",
            "    get:",
            "      operationId: getB",
            "      responses:",
            "        '200': {description: ok}");

        List<LintMessage> duplicates = SpecLinter.duplicateLinkNames(file);

        assertEquals(1, duplicates.size(), duplicates.toString());
        assertEquals(LintLevel.ERROR, duplicates.get(0).getLevel());
        assertEquals("Next", duplicates.get(0).getDetails().get("link_name"));
        assertEquals(11, duplicates.get(0).getDetails().get("first_line"));
        assertEquals(13, duplicates.get(0).getDetails().get("duplicate_line"));
    }

    @Test
    void testSameNamesInDifferentLinkSectionsAllowed() throws Exception {
        Path file = write("spec.json",
            "{\"paths\": {",
            "  \"/a\": {\"get\": {\"responses\": {\"200\": {\"links\": {\"Next\": {\"operationId\": \"getB\"}}}}}},",
            "  \"/b\": {\"get\": {\"responses\": {\"200\": {\"links\": {\"Next\": {\"operationId\": \"getA\"}}}}}}",
            "}}");

        assertTrue(SpecLinter.duplicateLinkNames(file).isEmpty());
    }

    @Test
    void testSpecificationWithoutLinks() throws Exception {
        Path file = write("plain.yaml",
            "openapi: 3.0.3",
            "info: {title: plain, version: '1'}",
            "paths:",
            "  /items:",
            "    get:",
            "      operationId: listItems",
            "      responses:",
            "        '200': {description: ok}");

        LintResult result = lint(file);

        assertFalse(result.hasErrors());
        assertEquals(1, result.find("no-explicit-links").size());
        assertTrue(result.find("chain-depth-summary").isEmpty());
        assertEquals(1, result.getChainDepth().getUnreachable());

        JsonNode json = BundleFiles.mapper().valueToTree(result);
        assertEquals(1, json.get("summary").get("total_operations").asInt());
        assertEquals(1, json.get("summary").get("warning_count").asInt());
        assertEquals("warning", json.get("warnings").get(0).get("level").asText());
        assertTrue(json.has("chain_depth"));
    }
}

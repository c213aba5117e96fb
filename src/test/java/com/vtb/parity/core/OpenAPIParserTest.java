package com.vtb.parity.core;

import com.vtb.parity.TestFixtures;
import com.vtb.parity.config.ConfigException;
import com.vtb.parity.models.LinkSpec;
import com.vtb.parity.models.Operation;
import com.vtb.parity.models.ParameterLocation;
import com.vtb.parity.models.ParameterSpec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для OpenAPIParser
 */
class OpenAPIParserTest {

    @Test
    void testParseValidYaml() {
        OpenAPIParser parser = new OpenAPIParser();
        parser.parseFromFile(TestFixtures.resource(TestFixtures.ITEMS_SPEC).toString());

        assertNotNull(parser.getOpenAPI(), "OpenAPI объект должен быть создан");
        assertEquals("Items API", parser.getApiTitle());
        assertEquals("1.2.0", parser.getApiVersion());
    }

    @Test
    void testOperationsInDocumentOrder() {
        SpecificationModel model = TestFixtures.itemsSpecification();

        List<String> ids = model.getOperations().stream()
            .map(Operation::getOperationId)
            .collect(Collectors.toList());
        assertEquals(List.of("listItems", "createItem", "getItem", "deleteItem", "get_tags_tag"), ids,
            "Операции должны идти в порядке документа, id без operationId синтезируется из метода и пути");
    }

    @Test
    void testPathLevelParametersMerged() {
        SpecificationModel model = TestFixtures.itemsSpecification();

        Operation getItem = model.find("getItem").orElseThrow();
        ParameterSpec itemId = getItem.findParameter("item_id").orElseThrow();
        assertEquals(ParameterLocation.PATH, itemId.getLocation());
        assertTrue(itemId.isRequired(), "Path-параметр всегда обязателен");
        assertEquals("^[a-z0-9]{6}$", itemId.getSchema().getPattern());

        Operation listItems = model.find("listItems").orElseThrow();
        assertEquals(1, listItems.parametersIn(ParameterLocation.HEADER).size());
        assertEquals(1, listItems.parametersIn(ParameterLocation.COOKIE).size());
        assertFalse(listItems.findParameter("limit").orElseThrow().isRequired());
    }

    @Test
    void testRequestBodyAndResponses() {
        Operation createItem = TestFixtures.itemsSpecification().find("createItem").orElseThrow();

        assertTrue(createItem.isBodyRequired());
        assertEquals("application/json", createItem.preferredMediaType().orElse(null));
        assertNotNull(createItem.getRequestBodies().get("application/json").getProperties(),
            "Схема тела должна быть разрешена из components");
        assertTrue(createItem.getResponseSchemas().containsKey("201"));
    }

    @Test
    void testLinksResolved() {
        SpecificationModel model = TestFixtures.itemsSpecification();

        Map<String, String> targets = model.links().stream()
            .collect(Collectors.toMap(LinkSpec::getName, LinkSpec::getTargetOperationId));
        assertEquals("getItem", targets.get("FirstItem"), "operationRef должен разрешаться в operationId");
        assertEquals("getItem", targets.get("GetCreated"), "$ref на components.links должен разрешаться");
        assertEquals("deleteItem", targets.get("DeleteIt"));
        assertFalse(targets.containsKey("Unknown"), "Link на неизвестную операцию пропускается");

        LinkSpec created = model.links().stream()
            .filter(link -> link.getName().equals("GetCreated"))
            .findFirst()
            .orElseThrow();
        assertEquals("createItem", created.getSourceOperationId());
        assertEquals("201", created.getStatusCode());
        assertEquals("$response.body#/id", created.getParameters().get("item_id"));
    }

    @Test
    void testResolveOperationRef() {
        Map<String, String> ids = Map.of("GET /items/{id}", "getItem", "GET /a~b", "tilde");

        assertEquals("getItem", OpenAPIParser.resolveOperationRef("#/paths/~1items~1{id}/get", ids));
        assertEquals("tilde", OpenAPIParser.resolveOperationRef("#/paths/~1a~0b/get", ids));
        assertNull(OpenAPIParser.resolveOperationRef("other.yaml#/paths/~1items/get", ids));
    }

    @Test
    void testSynthesizeId() {
        assertEquals("get_items_item_id", OpenAPIParser.synthesizeId("GET", "/items/{item_id}"));
        assertEquals("post", OpenAPIParser.synthesizeId("POST", "/"));
    }

    @Test
    void testExcludeOperations() {
        SpecificationModel model = TestFixtures.itemsSpecification().without(Set.of("deleteItem", "listItems"));

        assertTrue(model.find("deleteItem").isEmpty());
        assertTrue(model.find("createItem").isPresent());
        assertEquals(3, model.getOperations().size());
    }

    @Test
    void testParseInvalidFile() {
        OpenAPIParser parser = new OpenAPIParser();

        assertThrows(ConfigException.class, () -> {
            parser.parseFromFile("nonexistent.yaml");
        }, "Должна быть ошибка при несуществующем файле");
    }
}

package com.vtb.parity.chain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.parity.models.RequestCase;
import com.vtb.parity.models.StepResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LinkExpressionResolverTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private RequestCase request;
    private StepResult response;

    @BeforeEach
    void setUp() throws Exception {
        request = RequestCase.builder()
            .operationId("createItem")
            .method("POST")
            .pathTemplate("/stores/{store}/items")
            .pathParameters(Map.of("store", "main"))
            .renderedPath("/stores/main/items")
            .query(Map.of("dry", List.of("false")))
            .headers(Map.of("X-Trace", List.of("t-1")))
            .cookies(Map.of("session", "s1"))
            .body(mapper.readTree("{\"name\":\"pen\",\"tags\":[\"a\",\"b\"]}"))
            .build();
        response = StepResult.builder()
            .statusCode(201)
            .headers(StepResult.normalizeHeaders(Map.of("Location", List.of("/items/abc123", "/mirror/abc123"))))
            .body(mapper.readTree("{\"id\":\"abc123\",\"meta\":{\"rev\":3},\"owner\":null}"))
            .build();
    }

    @Test
    void testResponseBodyPointer() {
        assertEquals(Optional.of("abc123"), LinkExpressionResolver.resolve("$response.body#/id", request, response));
        assertEquals(Optional.of("3"), LinkExpressionResolver.resolve("$response.body#/meta/rev", request, response));
        assertEquals(Optional.of("{\"rev\":3}"), LinkExpressionResolver.resolve("$response.body#/meta", request, response),
            "Объект передаётся как JSON-текст");
    }

    @Test
    void testMissingOrNullValueUnresolved() {
        assertTrue(LinkExpressionResolver.resolve("$response.body#/absent", request, response).isEmpty());
        assertTrue(LinkExpressionResolver.resolve("$response.body#/owner", request, response).isEmpty(),
            "null в ответе не даёт значения");
        assertTrue(LinkExpressionResolver.resolve("$response.body#/id",
            request, StepResult.builder().statusCode(204).build()).isEmpty());
    }

    @Test
    void testResponseHeaderWithIndex() {
        assertEquals(Optional.of("/items/abc123"), LinkExpressionResolver.resolve("$response.header.Location", request, response));
        assertEquals(Optional.of("/mirror/abc123"), LinkExpressionResolver.resolve("$response.header.location[1]", request, response));
        assertTrue(LinkExpressionResolver.resolve("$response.header.Location[5]", request, response).isEmpty());
    }

    @Test
    void testRequestExpressions() {
        assertEquals(Optional.of("main"), LinkExpressionResolver.resolve("$request.path.store", request, response));
        assertEquals(Optional.of("false"), LinkExpressionResolver.resolve("$request.query.dry", request, response));
        assertEquals(Optional.of("t-1"), LinkExpressionResolver.resolve("$request.header.x-trace", request, response));
        assertEquals(Optional.of("s1"), LinkExpressionResolver.resolve("$request.cookie.session", request, response));
        assertEquals(Optional.of("b"), LinkExpressionResolver.resolve("$request.body#/tags/1", request, response));
    }

    @Test
    void testRuntimeValues() {
        assertEquals(Optional.of("201"), LinkExpressionResolver.resolve("$statusCode", request, response));
        assertEquals(Optional.of("POST"), LinkExpressionResolver.resolve("$method", request, response));
        assertEquals(Optional.of("/stores/main/items"), LinkExpressionResolver.resolve("$url", request, response));
    }

    @Test
    void testLiteralAndEmbedded() {
        assertEquals(Optional.of("fixed"), LinkExpressionResolver.resolve("fixed", request, response));
        assertEquals(Optional.of("item-abc123-main"),
            LinkExpressionResolver.resolve("item-{$response.body#/id}-{$request.path.store}", request, response));
        assertTrue(LinkExpressionResolver.resolve("item-{$response.body#/nope}", request, response).isEmpty());
    }
}

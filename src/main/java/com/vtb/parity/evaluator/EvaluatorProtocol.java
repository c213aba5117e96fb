package com.vtb.parity.evaluator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Протокол воркера: по одному JSON-сообщению на строку.
 *
 * <pre>
 * воркер → {"ready":true}                       при старте
 * запрос → {"id":"7","expression":"a == b","bindings":{"a":1,"b":1}}
 * ответ  ← {"id":"7","ok":true,"result":true}
 *        ← {"id":"7","ok":false,"error":"evaluation timeout exceeded"}
 * </pre>
 *
 * Jackson без INDENT_OUTPUT экранирует переводы строк внутри строк, так что сообщение
 * всегда занимает ровно одну строку.
 */
public final class EvaluatorProtocol {

    public static final String TIMEOUT_ERROR = "evaluation timeout exceeded";
    public static final String CALL_TIMEOUT_ERROR = "evaluator call timeout exceeded";

    static final ObjectMapper MAPPER = new ObjectMapper();

    private EvaluatorProtocol() {
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Request {
        private String id;
        private String expression;
        private Map<String, JsonNode> bindings = new LinkedHashMap<>();
    }

    @Data
    @NoArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Response {
        private String id;
        private Boolean ok;
        private JsonNode result;
        private String error;
        private Boolean ready;

        public static Response ready() {
            Response response = new Response();
            response.setReady(Boolean.TRUE);
            return response;
        }

        public static Response success(String id, JsonNode result) {
            Response response = new Response();
            response.setId(id);
            response.setOk(Boolean.TRUE);
            response.setResult(result);
            return response;
        }

        public static Response failure(String id, String error) {
            Response response = new Response();
            response.setId(id);
            response.setOk(Boolean.FALSE);
            response.setError(error);
            return response;
        }

        @JsonIgnore
        public boolean isReadyMessage() {
            return Boolean.TRUE.equals(ready);
        }

        @JsonIgnore
        public boolean isSuccess() {
            return Boolean.TRUE.equals(ok);
        }
    }

    static String encode(Object message) throws JsonProcessingException {
        return MAPPER.writeValueAsString(message);
    }

    static Request decodeRequest(String line) throws JsonProcessingException {
        return MAPPER.readValue(line, Request.class);
    }

    static Response decodeResponse(String line) throws JsonProcessingException {
        return MAPPER.readValue(line, Response.class);
    }
}

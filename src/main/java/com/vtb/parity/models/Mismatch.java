package com.vtb.parity.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Расхождение ответов целей по конкретному пути.
 * {@code rule}: имя сработавшего правила либо текст ошибки вычисления.
 */
@Value
@Builder
@Jacksonized
public class Mismatch {

    public static final String MISSING = "<missing>";

    String path;
    String rule;
    JsonNode targetA;
    JsonNode targetB;

    public static Mismatch of(String path, String rule, JsonNode a, JsonNode b) {
        return Mismatch.builder()
            .path(path)
            .rule(rule)
            .targetA(a != null ? a : JsonNodeFactory.instance.textNode(MISSING))
            .targetB(b != null ? b : JsonNodeFactory.instance.textNode(MISSING))
            .build();
    }

    public static Mismatch ofText(String path, String rule, String a, String b) {
        return of(path, rule, JsonNodeFactory.instance.textNode(a), JsonNodeFactory.instance.textNode(b));
    }
}

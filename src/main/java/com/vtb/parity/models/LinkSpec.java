package com.vtb.parity.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Объявленная в спецификации связь: поле ответа операции-источника → параметр операции-приёмника.
 *
 * Ключи {@code parameters}: имена параметров приёмника (допускается префикс
 * {@code path.}/{@code query.}/{@code header.}/{@code cookie.}), значения: runtime expressions
 * OpenAPI ({@code $response.body#/id}, {@code $response.header.Location} и т.д.).
 */
@Value
@Builder
@Jacksonized
public class LinkSpec {
    String name;
    String sourceOperationId;
    String statusCode;
    String targetOperationId;
    @Singular
    Map<String, String> parameters;

    /**
     * Имя параметра без префикса расположения ({@code path.item_id} → {@code item_id})
     */
    public static String bareParameterName(String key) {
        if (key == null) {
            return null;
        }
        int dot = key.indexOf('.');
        if (dot > 0) {
            String prefix = key.substring(0, dot);
            if (prefix.equals("path") || prefix.equals("query")
                || prefix.equals("header") || prefix.equals("cookie")) {
                return key.substring(dot + 1);
            }
        }
        return key;
    }
}

package com.vtb.parity.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Правила сравнения одной области видимости (default или конкретный operationId).
 * {@code body}: JSON path pattern → правило, {@code headers}: имя заголовка → правило.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationRules {
    private FieldRule statusCode;
    private Map<String, FieldRule> headers = new LinkedHashMap<>();
    private Map<String, FieldRule> body = new LinkedHashMap<>();
    /** Сравнение бинарных (не JSON) тел */
    private FieldRule binaryRule;
    /** Сравнивать ли заголовки и тела, когда обе цели вернули одинаковый статус ошибки */
    private Boolean compareErrorBodies;
}

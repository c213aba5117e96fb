package com.vtb.parity.evaluator;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * Результат вычисления выражения: значение либо текст ошибки
 */
@Value
public class EvalResult {
    boolean ok;
    JsonNode value;
    String error;

    public static EvalResult success(JsonNode value) {
        return new EvalResult(true, value, null);
    }

    public static EvalResult failure(String error) {
        return new EvalResult(false, null, error);
    }

    public boolean isTrue() {
        return ok && value != null && value.isBoolean() && value.booleanValue();
    }
}

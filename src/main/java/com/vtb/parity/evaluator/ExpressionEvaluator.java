package com.vtb.parity.evaluator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Вычисление выражения над JSON-значениями. Ошибки вычисления возвращаются как
 * {@link EvalResult#failure(String)}, исключение только {@link BridgeUnavailableException}.
 */
public interface ExpressionEvaluator {

    EvalResult evaluate(String expression, Map<String, JsonNode> bindings);
}

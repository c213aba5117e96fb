package com.vtb.parity.evaluator;

import java.util.Map;

/**
 * Движок выражений внутри процесса-воркера
 */
public interface ExpressionEngine {

    /**
     * @throws EvaluationException синтаксическая ошибка, ошибка типов или отмена
     */
    Object evaluate(String expression, Map<String, Object> bindings);
}

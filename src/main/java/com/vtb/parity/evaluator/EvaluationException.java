package com.vtb.parity.evaluator;

/**
 * Ошибка вычисления выражения (синтаксис, тип, таймаут).
 * Внутри воркера превращается в ответ {@code ok:false}, наружу не пробрасывается.
 */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}

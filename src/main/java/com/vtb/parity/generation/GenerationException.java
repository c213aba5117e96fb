package com.vtb.parity.generation;

/**
 * Схема не может быть удовлетворена генератором (противоречивые ограничения, недостижимый pattern)
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}

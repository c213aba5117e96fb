package com.vtb.parity.evaluator;

/**
 * Процесс вычислителя исчерпал лимит перезапусков. Фатально до конца запуска.
 */
public class BridgeUnavailableException extends RuntimeException {

    public BridgeUnavailableException(String message) {
        super(message);
    }

    public BridgeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

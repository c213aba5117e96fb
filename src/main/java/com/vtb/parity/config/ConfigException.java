package com.vtb.parity.config;

/**
 * Ошибка конфигурации: нечитаемая спецификация, неверные правила, недоступная цель при старте.
 * Не даёт запуску начаться.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}

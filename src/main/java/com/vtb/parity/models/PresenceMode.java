package com.vtb.parity.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Требование к наличию поля, проверяется до сравнения значений
 */
public enum PresenceMode {
    /** Поле есть в обоих ответах или отсутствует в обоих */
    PARITY,
    /** Поле обязано быть в обоих */
    REQUIRED,
    /** Поле не должно быть ни в одном */
    FORBIDDEN,
    /** Сравнивать, только если поле есть в обоих */
    OPTIONAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PresenceMode fromWire(String value) {
        if (value == null || value.isBlank()) {
            return PARITY;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

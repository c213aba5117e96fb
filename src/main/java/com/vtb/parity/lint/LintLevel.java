package com.vtb.parity.lint;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum LintLevel {
    ERROR,
    WARNING,
    INFO;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

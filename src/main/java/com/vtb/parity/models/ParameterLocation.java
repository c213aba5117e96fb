package com.vtb.parity.models;

import java.util.Locale;

/**
 * Где передаётся параметр операции
 */
public enum ParameterLocation {
    PATH,
    QUERY,
    HEADER,
    COOKIE;

    public static ParameterLocation fromOpenApi(String in) {
        if (in == null) {
            return QUERY;
        }
        return valueOf(in.trim().toUpperCase(Locale.ROOT));
    }
}

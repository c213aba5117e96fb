package com.vtb.parity.generation;

/**
 * Приведение значений заголовков и cookies к передаваемому набору символов.
 * Каждый недопустимый символ заменяется на {@link #PLACEHOLDER}; длина значения сохраняется.
 */
public final class HeaderSanitizer {

    public static final char PLACEHOLDER = '?';

    private HeaderSanitizer() {
    }

    /**
     * Только печатный ASCII (0x20..0x7E)
     */
    public static String sanitize(String value) {
        if (value == null) {
            return null;
        }
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            out.append(isHeaderChar(c) ? c : PLACEHOLDER);
        }
        return out.toString();
    }

    /**
     * Как {@link #sanitize(String)}, плюс запрещённые в cookie-octet пробел, кавычка, запятая,
     * точка с запятой и обратный слэш
     */
    public static String sanitizeCookie(String value) {
        if (value == null) {
            return null;
        }
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            out.append(isHeaderChar(c) && !isCookieDelimiter(c) ? c : PLACEHOLDER);
        }
        return out.toString();
    }

    public static boolean isTransportable(String value) {
        return value == null || value.equals(sanitize(value));
    }

    private static boolean isHeaderChar(char c) {
        return c >= 0x20 && c <= 0x7E;
    }

    private static boolean isCookieDelimiter(char c) {
        return c == ' ' || c == '"' || c == ',' || c == ';' || c == '\\';
    }
}

package com.vtb.parity.evaluator;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Пространство имён {@code re:} для выражений сравнения.
 * Поиск без привязки к началу и концу строки, как {@code matches()} в CEL.
 */
public final class RegexFunctions {

    private static final int CACHE_LIMIT = 128;
    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    private RegexFunctions() {
    }

    /**
     * true, если в значении есть фрагмент, соответствующий шаблону. null не соответствует ничему.
     */
    public static boolean find(String pattern, Object value) {
        if (pattern == null || value == null) {
            return false;
        }
        return compile(pattern).matcher(String.valueOf(value)).find();
    }

    private static Pattern compile(String pattern) {
        Pattern compiled = PATTERNS.get(pattern);
        if (compiled != null) {
            return compiled;
        }
        try {
            compiled = Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new EvaluationException("invalid regex " + pattern + ": " + e.getDescription(), e);
        }
        if (PATTERNS.size() >= CACHE_LIMIT) {
            PATTERNS.clear();
        }
        PATTERNS.put(pattern, compiled);
        return compiled;
    }
}

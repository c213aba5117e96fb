package com.vtb.parity.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Конкретный запрос для операции: параметры, заголовки, cookies, тело.
 * Неизменяем: подстановка значений из links создаёт новый экземпляр.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RequestCase {
    String caseId;
    String operationId;
    String method;
    String pathTemplate;
    @Builder.Default
    Map<String, String> pathParameters = new LinkedHashMap<>();
    String renderedPath;
    @Builder.Default
    Map<String, List<String>> query = new LinkedHashMap<>();
    @Builder.Default
    Map<String, List<String>> headers = new LinkedHashMap<>();
    @Builder.Default
    Map<String, String> cookies = new LinkedHashMap<>();
    JsonNode body;
    String mediaType;
    /** Параметры, значения которых должен дать предыдущий шаг цепочки */
    @Builder.Default
    Set<String> unresolvedParameters = new LinkedHashSet<>();

    @JsonIgnore
    public boolean isResolved() {
        return unresolvedParameters == null || unresolvedParameters.isEmpty();
    }

    /**
     * Подставить значение параметра (по имени, в path/query/header/cookie, где он объявлен в кейсе).
     * Параметр снимается с учёта как неразрешённый, путь перерисовывается.
     */
    public RequestCase withParameter(String name, String value) {
        Map<String, String> path = new LinkedHashMap<>(pathParameters);
        Map<String, List<String>> newQuery = new LinkedHashMap<>(query);
        Map<String, List<String>> newHeaders = new LinkedHashMap<>(headers);
        Map<String, String> newCookies = new LinkedHashMap<>(cookies);

        if (path.containsKey(name)) {
            // Location заголовки часто дают "/id", ведущий слэш не часть значения
            path.put(name, stripLeadingSlashes(value));
        } else if (newQuery.containsKey(name)) {
            newQuery.put(name, List.of(value));
        } else if (newCookies.containsKey(name)) {
            newCookies.put(name, value);
        } else {
            String existing = newHeaders.keySet().stream()
                .filter(key -> key.equalsIgnoreCase(name))
                .findFirst()
                .orElse(null);
            if (existing != null) {
                newHeaders.put(existing, List.of(value));
            } else {
                newQuery.put(name, List.of(value));
            }
        }

        Set<String> unresolved = new LinkedHashSet<>(unresolvedParameters);
        unresolved.remove(name);

        return toBuilder()
            .pathParameters(path)
            .renderedPath(renderPath(pathTemplate, path))
            .query(newQuery)
            .headers(newHeaders)
            .cookies(newCookies)
            .unresolvedParameters(unresolved)
            .build();
    }

    public static String renderPath(String template, Map<String, String> parameters) {
        if (template == null) {
            return null;
        }
        String rendered = template;
        for (Map.Entry<String, String> entry : parameters.entrySet()) {
            String encoded = URLEncoder.encode(String.valueOf(entry.getValue()), StandardCharsets.UTF_8)
                .replace("+", "%20");
            rendered = rendered.replace("{" + entry.getKey() + "}", encoded);
        }
        return rendered;
    }

    private static String stripLeadingSlashes(String value) {
        if (value == null) {
            return null;
        }
        int idx = 0;
        while (idx < value.length() && value.charAt(idx) == '/') {
            idx++;
        }
        return value.substring(idx);
    }
}

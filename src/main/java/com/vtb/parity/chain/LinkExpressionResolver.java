package com.vtb.parity.chain;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.parity.models.RequestCase;
import com.vtb.parity.models.StepResult;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Вычисление runtime expressions OpenAPI links против запроса и ответа предыдущего шага.
 *
 * Поддерживаются {@code $statusCode}, {@code $method}, {@code $url},
 * {@code $response.body[#/pointer]}, {@code $response.header.Name[idx]},
 * {@code $request.path|query|header|cookie.name}, {@code $request.body[#/pointer]},
 * встроенные шаблоны {@code "prefix-{$response.body#/id}"} и литералы.
 * Пустой результат означает, что значение взять неоткуда.
 */
public final class LinkExpressionResolver {

    private static final Pattern EMBEDDED = Pattern.compile("\\{(\\$[^}]+)}");
    private static final Pattern HEADER_INDEX = Pattern.compile("^(.+)\\[(\\d+)]$");

    private LinkExpressionResolver() {
    }

    public static Optional<String> resolve(String expression, RequestCase request, StepResult response) {
        if (expression == null) {
            return Optional.empty();
        }
        if (expression.startsWith("$")) {
            return evaluate(expression.trim(), request, response);
        }
        if (!expression.contains("{$")) {
            return Optional.of(expression);
        }
        Matcher matcher = EMBEDDED.matcher(expression);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Optional<String> value = evaluate(matcher.group(1), request, response);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value.get()));
        }
        matcher.appendTail(result);
        return Optional.of(result.toString());
    }

    private static Optional<String> evaluate(String expression, RequestCase request, StepResult response) {
        if (expression.equals("$statusCode")) {
            return response != null && response.getStatusCode() != null
                ? Optional.of(String.valueOf(response.getStatusCode()))
                : Optional.empty();
        }
        if (expression.equals("$method")) {
            return request != null ? Optional.ofNullable(request.getMethod()) : Optional.empty();
        }
        if (expression.equals("$url")) {
            return request != null ? Optional.ofNullable(request.getRenderedPath()) : Optional.empty();
        }
        if (expression.startsWith("$response.body")) {
            return response != null
                ? body(response.getBody(), expression.substring("$response.body".length()))
                : Optional.empty();
        }
        if (expression.startsWith("$response.header.")) {
            return response != null
                ? responseHeader(response, expression.substring("$response.header.".length()))
                : Optional.empty();
        }
        if (request == null) {
            return Optional.empty();
        }
        if (expression.startsWith("$request.body")) {
            return body(request.getBody(), expression.substring("$request.body".length()));
        }
        if (expression.startsWith("$request.path.")) {
            return Optional.ofNullable(request.getPathParameters().get(expression.substring("$request.path.".length())));
        }
        if (expression.startsWith("$request.query.")) {
            return first(request.getQuery().get(expression.substring("$request.query.".length())));
        }
        if (expression.startsWith("$request.header.")) {
            String name = expression.substring("$request.header.".length());
            return request.getHeaders().entrySet().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(name))
                .map(Map.Entry::getValue)
                .findFirst()
                .flatMap(LinkExpressionResolver::first);
        }
        if (expression.startsWith("$request.cookie.")) {
            return Optional.ofNullable(request.getCookies().get(expression.substring("$request.cookie.".length())));
        }
        return Optional.empty();
    }

    private static Optional<String> body(JsonNode body, String fragment) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return Optional.empty();
        }
        JsonNode node = body;
        if (!fragment.isEmpty()) {
            if (!fragment.startsWith("#")) {
                return Optional.empty();
            }
            String pointer = fragment.substring(1);
            if (!pointer.isEmpty()) {
                try {
                    node = body.at(JsonPointer.compile(pointer));
                } catch (IllegalArgumentException e) {
                    return Optional.empty();
                }
            }
        }
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Optional.empty();
        }
        return Optional.of(node.isValueNode() ? node.asText() : node.toString());
    }

    private static Optional<String> responseHeader(StepResult response, String spec) {
        String name = spec;
        int index = 0;
        Matcher matcher = HEADER_INDEX.matcher(spec);
        if (matcher.matches()) {
            name = matcher.group(1);
            index = Integer.parseInt(matcher.group(2));
        }
        List<String> values = response.getHeaders().get(name.toLowerCase(Locale.ROOT));
        if (values == null || index >= values.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(index));
    }

    private static Optional<String> first(List<String> values) {
        return values == null || values.isEmpty() ? Optional.empty() : Optional.ofNullable(values.get(0));
    }
}

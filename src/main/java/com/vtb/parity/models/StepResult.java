package com.vtb.parity.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Результат одного шага против одной цели.
 *
 * Заголовки: ключи в нижнем регистре, значения: непустые упорядоченные списки.
 * Тело хранится структурно ({@code body}) если media type распознан, иначе base64 ({@code bodyBase64}).
 * При терминальной ошибке {@code statusCode == null}, заполнен {@code error}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class StepResult {
    Integer statusCode;
    @Builder.Default
    Map<String, List<String>> headers = new LinkedHashMap<>();
    JsonNode body;
    String bodyBase64;
    long elapsedMs;
    TransportErrorKind error;
    String errorMessage;

    @JsonIgnore
    public boolean isTerminal() {
        return error != null;
    }

    public Optional<String> firstHeader(String name) {
        if (headers == null || name == null) {
            return Optional.empty();
        }
        List<String> values = headers.get(name.toLowerCase(Locale.ROOT));
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }

    public static StepResult terminal(TransportErrorKind kind, String message, long elapsedMs) {
        return StepResult.builder()
            .error(kind)
            .errorMessage(message)
            .elapsedMs(elapsedMs)
            .build();
    }

    /**
     * Нормализация заголовков: ключи в нижний регистр, пустые списки отбрасываются
     */
    public static Map<String, List<String>> normalizeHeaders(Map<String, List<String>> raw) {
        Map<String, List<String>> normalized = new LinkedHashMap<>();
        if (raw == null) {
            return normalized;
        }
        raw.forEach((name, values) -> {
            if (name == null || values == null || values.isEmpty()) {
                return;
            }
            normalized.merge(name.toLowerCase(Locale.ROOT), List.copyOf(values), (left, right) -> {
                List<String> merged = new java.util.ArrayList<>(left);
                merged.addAll(right);
                return List.copyOf(merged);
            });
        });
        return normalized;
    }

    @JsonIgnore
    public String describe() {
        if (isTerminal()) {
            return error + ": " + errorMessage;
        }
        return "HTTP " + statusCode;
    }
}

package com.vtb.parity.models;

import io.swagger.v3.oas.models.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Операция API (method + path) со схемами параметров, тела запроса и объявленными links.
 * Неизменяема после загрузки спецификации.
 */
@Value
@Builder
public class Operation {

    private static final String JSON = "application/json";

    String operationId;
    String method;
    String pathTemplate;
    @Singular
    List<ParameterSpec> parameters;
    /** media type → схема тела запроса, в порядке объявления */
    @Singular
    Map<String, Schema<?>> requestBodies;
    boolean bodyRequired;
    @Singular
    List<LinkSpec> links;
    /** status code → схема JSON-ответа */
    @Singular
    Map<String, Schema<?>> responseSchemas;

    public List<ParameterSpec> parametersIn(ParameterLocation location) {
        return parameters.stream()
            .filter(p -> p.getLocation() == location)
            .collect(Collectors.toList());
    }

    public Optional<ParameterSpec> findParameter(String name) {
        return parameters.stream()
            .filter(p -> p.getName().equals(name))
            .findFirst();
    }

    /**
     * Предпочтительный media type тела: JSON, затем любой *+json, затем первый объявленный
     */
    public Optional<String> preferredMediaType() {
        if (requestBodies.isEmpty()) {
            return Optional.empty();
        }
        if (requestBodies.containsKey(JSON)) {
            return Optional.of(JSON);
        }
        return requestBodies.keySet().stream()
            .filter(type -> type.toLowerCase(Locale.ROOT).contains("json"))
            .findFirst()
            .or(() -> requestBodies.keySet().stream().findFirst());
    }

    public String signature() {
        return method + " " + pathTemplate;
    }
}

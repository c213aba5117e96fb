package com.vtb.parity.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.parity.models.GenerationMode;
import com.vtb.parity.models.Operation;
import com.vtb.parity.models.ParameterLocation;
import com.vtb.parity.models.ParameterSpec;
import com.vtb.parity.models.RequestCase;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Генератор кейсов для одной операции.
 *
 * {@link #generate} возвращает ленивую конечную последовательность; каждый новый обход
 * получает собственное зерно и порождает новые, независимые кейсы. Зёрна операции зависят
 * только от исходного зерна и operationId.
 * Значения path-параметров в пределах одного обхода различаются, пока это позволяет схема.
 */
@Slf4j
public class CaseGenerator {

    private static final int DISTINCT_ATTEMPTS = 20;
    private static final double OPTIONAL_RATE = 0.5;
    private static final double OPTIONAL_BODY_RATE = 0.8;

    private final GenerationMode mode;
    private final long seed;
    private final Random seeds;
    private final Map<String, Random> operationSeeds = new HashMap<>();

    public CaseGenerator(long seed, GenerationMode mode) {
        this.mode = mode != null ? mode : GenerationMode.POSITIVE;
        this.seed = seed;
        this.seeds = new Random(seed);
    }

    public GenerationMode getMode() {
        return mode;
    }

    public Iterable<RequestCase> generate(Operation operation, int count) {
        return generate(operation, count, Set.of());
    }

    /**
     * @param linkSupplied параметры, которые даст предыдущий шаг цепочки: всегда присутствуют
     *                     в кейсе (со значением-заглушкой) и помечены как неразрешённые
     */
    public Iterable<RequestCase> generate(Operation operation, int count, Set<String> linkSupplied) {
        return () -> new CaseIterator(operation, count, linkSupplied, new Random(nextSeed(operation.getOperationId())));
    }

    /**
     * Один кейс со свежим зерном
     */
    public RequestCase generateOne(Operation operation, Set<String> linkSupplied) {
        return build(operation, linkSupplied, new Random(nextSeed()));
    }

    private synchronized long nextSeed() {
        return seeds.nextLong();
    }

    /**
     * Зёрна кейсов операции идут из собственной последовательности, заданной (seed, operationId):
     * порядок, в котором пул доходит до операций, на кейсы не влияет.
     */
    private synchronized long nextSeed(String operationId) {
        return operationSeeds.computeIfAbsent(String.valueOf(operationId), id -> new Random(deriveSeed(seed, id)))
            .nextLong();
    }

    static long deriveSeed(long seed, String operationId) {
        long hash = seed ^ 0xcbf29ce484222325L;
        for (byte b : operationId.getBytes(StandardCharsets.UTF_8)) {
            hash = (hash ^ (b & 0xff)) * 0x100000001b3L;
        }
        // финальное перемешивание SplitMix64
        hash = (hash ^ (hash >>> 30)) * 0xbf58476d1ce4e5b9L;
        hash = (hash ^ (hash >>> 27)) * 0x94d049bb133111ebL;
        return hash ^ (hash >>> 31);
    }

    private final class CaseIterator implements Iterator<RequestCase> {
        private final Operation operation;
        private final int count;
        private final Set<String> linkSupplied;
        private final Random random;
        private final Set<Map<String, String>> seenPaths = new HashSet<>();
        private int produced;

        CaseIterator(Operation operation, int count, Set<String> linkSupplied, Random random) {
            this.operation = operation;
            this.count = Math.max(0, count);
            this.linkSupplied = linkSupplied != null ? linkSupplied : Set.of();
            this.random = random;
        }

        @Override
        public boolean hasNext() {
            return produced < count;
        }

        @Override
        public RequestCase next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            produced++;
            RequestCase candidate = build(operation, linkSupplied, random);
            int attempts = 1;
            while (!candidate.getPathParameters().isEmpty()
                && seenPaths.contains(candidate.getPathParameters())
                && attempts < DISTINCT_ATTEMPTS) {
                candidate = build(operation, linkSupplied, random);
                attempts++;
            }
            if (!seenPaths.add(candidate.getPathParameters()) && !candidate.getPathParameters().isEmpty()) {
                log.debug("Пространство path-параметров {} исчерпано, значение повторяется", operation.getOperationId());
            }
            return candidate;
        }
    }

    RequestCase build(Operation operation, Set<String> linkSupplied, Random random) {
        SchemaValueGenerator values = new SchemaValueGenerator(random, mode);
        Set<String> supplied = linkSupplied != null ? linkSupplied : Set.of();

        Map<String, String> path = new LinkedHashMap<>();
        Map<String, List<String>> query = new LinkedHashMap<>();
        Map<String, List<String>> headers = new LinkedHashMap<>();
        Map<String, String> cookies = new LinkedHashMap<>();
        Set<String> unresolved = new LinkedHashSet<>();

        for (ParameterSpec parameter : operation.getParameters()) {
            boolean fromLink = supplied.contains(parameter.getName());
            boolean include = parameter.getLocation() == ParameterLocation.PATH
                || parameter.isRequired()
                || fromLink
                || random.nextDouble() < OPTIONAL_RATE;
            if (!include) {
                continue;
            }
            JsonNode value = values.generate(parameter.getSchema());
            switch (parameter.getLocation()) {
                case PATH -> path.put(parameter.getName(), nonEmpty(scalar(value)));
                case QUERY -> query.put(parameter.getName(), multi(value));
                case HEADER -> headers.put(parameter.getName(), List.of(HeaderSanitizer.sanitize(scalar(value))));
                case COOKIE -> cookies.put(parameter.getName(), HeaderSanitizer.sanitizeCookie(scalar(value)));
            }
            if (fromLink) {
                unresolved.add(parameter.getName());
            }
        }

        JsonNode body = null;
        String mediaType = operation.preferredMediaType().orElse(null);
        if (mediaType != null && (operation.isBodyRequired() || random.nextDouble() < OPTIONAL_BODY_RATE)) {
            body = values.generate(operation.getRequestBodies().get(mediaType));
        } else {
            mediaType = null;
        }

        return RequestCase.builder()
            .caseId(new UUID(random.nextLong(), random.nextLong()).toString())
            .operationId(operation.getOperationId())
            .method(operation.getMethod())
            .pathTemplate(operation.getPathTemplate())
            .pathParameters(path)
            .renderedPath(RequestCase.renderPath(operation.getPathTemplate(), path))
            .query(query)
            .headers(headers)
            .cookies(cookies)
            .body(body)
            .mediaType(mediaType)
            .unresolvedParameters(unresolved)
            .build();
    }

    static String scalar(JsonNode value) {
        if (value == null || value.isNull()) {
            return "";
        }
        if (value.isArray()) {
            List<String> parts = new ArrayList<>();
            value.forEach(element -> parts.add(scalar(element)));
            return String.join(",", parts);
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static List<String> multi(JsonNode value) {
        if (value != null && value.isArray()) {
            List<String> parts = new ArrayList<>();
            value.forEach(element -> parts.add(scalar(element)));
            return parts;
        }
        return List.of(scalar(value));
    }

    private static String nonEmpty(String value) {
        return value.isEmpty() ? "0" : value;
    }
}

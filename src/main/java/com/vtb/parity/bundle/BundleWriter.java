package com.vtb.parity.bundle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.vtb.parity.comparator.JsonPathPattern;
import com.vtb.parity.config.ConfigException;
import com.vtb.parity.dynamic.ExecutionOutcome;
import com.vtb.parity.models.Bundle;
import com.vtb.parity.models.BundleKind;
import com.vtb.parity.models.BundleMetadata;
import com.vtb.parity.models.Chain;
import com.vtb.parity.models.ChainStep;
import com.vtb.parity.models.Mismatch;
import com.vtb.parity.models.RequestCase;
import com.vtb.parity.models.StepExecution;
import com.vtb.parity.models.StepResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Запись бандла расхождения.
 *
 * Каталог собирается во временном каталоге рядом и переносится целиком, так что
 * частично записанный бандл не виден при обнаружении. Ответы пишутся в том виде, в каком
 * они дали расхождения; изменяет их только маскирование секретов.
 */
@Slf4j
public class BundleWriter {

    public static final String REDACTED = "[REDACTED]";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss.SSS'Z'");
    private static final int MAX_SEQUENCE_LENGTH = 80;

    private final ObjectMapper mapper = BundleFiles.mapper();
    private final List<JsonPathPattern> redactedPaths = new ArrayList<>();
    private final List<String> redactedHeaders = new ArrayList<>();

    public BundleWriter(List<String> redactFields) {
        if (redactFields != null) {
            for (String field : redactFields) {
                if (field == null || field.isBlank()) {
                    continue;
                }
                if (field.startsWith("$")) {
                    try {
                        redactedPaths.add(JsonPathPattern.parse(field));
                    } catch (IllegalArgumentException e) {
                        throw new ConfigException("Некорректный путь в secrets.redactFields: " + field, e);
                    }
                } else {
                    redactedHeaders.add(field.toLowerCase(Locale.ROOT));
                }
            }
        }
    }

    /**
     * Бандл из результата выполнения: кейс или выполненный префикс цепочки
     *
     * @param reproductionKey ключ исходного бандла при replay, иначе null
     */
    public static Bundle fromOutcome(ExecutionOutcome outcome, BundleMetadata metadata, String reproductionKey) {
        BundleKind kind = outcome.isChain() ? BundleKind.CHAIN : BundleKind.CASE;
        Chain chain = outcome.isChain() ? outcome.getChain().prefix(outcome.executedSteps()) : null;
        List<String> operations = chain != null
            ? chain.operationIds()
            : List.of(outcome.getRequestCase().getOperationId());
        String key = reproductionKey != null
            ? reproductionKey
            : reproductionKey(kind, operations, outcome.getMismatchStep(), outcome.getMismatches());
        return Bundle.builder()
            .kind(kind)
            .reproductionKey(key)
            .requestCase(outcome.getRequestCase())
            .chain(chain)
            .targetA(outcome.getTargetA())
            .targetB(outcome.getTargetB())
            .mismatches(outcome.getMismatches())
            .mismatchStep(Math.max(0, outcome.getMismatchStep()))
            .metadata(metadata)
            .build();
    }

    /**
     * Стабильный ключ: последовательность операций и путь первого расхождения (без индексов массивов)
     */
    public static String reproductionKey(BundleKind kind, List<String> operations, int step, List<Mismatch> mismatches) {
        String path = mismatches == null || mismatches.isEmpty()
            ? "-"
            : JsonPathPattern.generalize(mismatches.get(0).getPath());
        String location = kind == BundleKind.CHAIN ? "step " + step + " " + path : path;
        return String.join(" -> ", operations) + " @ " + location;
    }

    /**
     * @param root каталог, в котором создаётся подкаталог бандла
     * @return бандл с заполненным location
     */
    public Bundle write(Bundle bundle, Path root) throws IOException {
        Files.createDirectories(root);
        String name = directoryName(bundle);
        Path target = root.resolve(name);
        int suffix = 2;
        while (Files.exists(target)) {
            target = root.resolve(name + "-" + suffix++);
        }
        Path staging = Files.createTempDirectory(root, ".staging-");
        try {
            writeFiles(bundle, staging);
            BundleFiles.move(staging, target);
        } finally {
            deleteRecursively(staging);
        }
        log.info("Бандл записан: {} ({} расхождений)", target, bundle.getMismatches().size());
        return bundle.toBuilder().location(target).build();
    }

    private void writeFiles(Bundle bundle, Path directory) throws IOException {
        if (bundle.getKind() == BundleKind.CHAIN) {
            Chain chain = bundle.getChain();
            List<ChainStep> steps = chain.getSteps().stream()
                .map(step -> step.toBuilder().template(redact(step.getTemplate())).build())
                .collect(Collectors.toList());
            mapper.writeValue(directory.resolve(BundleFiles.CHAIN_FILE).toFile(), chain.toBuilder().steps(steps).build());
        } else {
            mapper.writeValue(directory.resolve(BundleFiles.CASE_FILE).toFile(), redact(bundle.getRequestCase()));
        }
        mapper.writeValue(directory.resolve(BundleFiles.TARGET_A_FILE).toFile(), redactExecutions(bundle.getTargetA()));
        mapper.writeValue(directory.resolve(BundleFiles.TARGET_B_FILE).toFile(), redactExecutions(bundle.getTargetB()));
        mapper.writeValue(directory.resolve(BundleFiles.DIFF_FILE).toFile(), new DiffDocument(
            bundle.getReproductionKey(),
            bundle.getKind(),
            bundle.operationSequence(),
            bundle.getMismatchStep(),
            redactMismatches(bundle.getMismatches(), responseBodies(bundle))));
        if (bundle.getMetadata() != null) {
            mapper.writeValue(directory.resolve(BundleFiles.METADATA_FILE).toFile(), bundle.getMetadata());
        }
    }

    private String directoryName(Bundle bundle) {
        String timestamp = TIMESTAMP.format(ZonedDateTime.now(ZoneOffset.UTC));
        String sequence = String.join("-", bundle.operationSequence()).replaceAll("[^A-Za-z0-9_.-]", "_");
        if (sequence.length() > MAX_SEQUENCE_LENGTH) {
            sequence = sequence.substring(0, MAX_SEQUENCE_LENGTH);
        }
        String identity = bundle.getKind() == BundleKind.CHAIN
            ? bundle.getChain().getChainId()
            : bundle.getRequestCase().getCaseId();
        return timestamp + "__" + sequence + "__" + shortId(bundle.getReproductionKey() + "|" + identity);
    }

    static String shortId(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 недоступен", e);
        }
    }

    private List<StepExecution> redactExecutions(List<StepExecution> executions) {
        if (!isRedacting()) {
            return executions;
        }
        return executions.stream()
            .map(execution -> execution.toBuilder()
                .request(redact(execution.getRequest()))
                .result(redact(execution.getResult()))
                .build())
            .collect(Collectors.toList());
    }

    /**
     * Значения расхождений скрываются, если путь (или его предок) выбран шаблоном секрета в одном из ответов
     */
    private List<Mismatch> redactMismatches(List<Mismatch> mismatches, List<JsonNode> bodies) {
        if (redactedPaths.isEmpty()) {
            return mismatches;
        }
        Set<String> selected = new HashSet<>();
        bodies.forEach(body -> selected.addAll(selectRedacted(body)));
        return mismatches.stream()
            .map(mismatch -> {
                boolean secret = JsonPathPattern.normalizeConcrete(mismatch.getPath())
                    .map(path -> isUnder(path, selected))
                    .orElse(false);
                return secret ? Mismatch.ofText(mismatch.getPath(), mismatch.getRule(), REDACTED, REDACTED) : mismatch;
            })
            .collect(Collectors.toList());
    }

    private static List<JsonNode> responseBodies(Bundle bundle) {
        List<JsonNode> bodies = new ArrayList<>();
        for (List<StepExecution> side : List.of(bundle.getTargetA(), bundle.getTargetB())) {
            for (StepExecution execution : side) {
                if (execution.getResult() != null && execution.getResult().getBody() != null) {
                    bodies.add(execution.getResult().getBody());
                }
            }
        }
        return bodies;
    }

    private static boolean isUnder(String path, Set<String> selected) {
        for (String secret : selected) {
            if (path.equals(secret)
                || path.startsWith(secret) && path.charAt(secret.length()) == '[') {
                return true;
            }
        }
        return false;
    }

    RequestCase redact(RequestCase request) {
        if (request == null || !isRedacting()) {
            return request;
        }
        return request.toBuilder()
            .headers(redactHeaders(request.getHeaders()))
            .cookies(redactCookies(request.getCookies()))
            .body(redactBody(request.getBody()))
            .build();
    }

    StepResult redact(StepResult result) {
        if (result == null || !isRedacting()) {
            return result;
        }
        return result.toBuilder()
            .headers(redactHeaders(result.getHeaders()))
            .body(redactBody(result.getBody()))
            .build();
    }

    private boolean isRedacting() {
        return !redactedPaths.isEmpty() || !redactedHeaders.isEmpty();
    }

    private Map<String, List<String>> redactHeaders(Map<String, List<String>> headers) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        headers.forEach((name, values) -> result.put(name,
            redactedHeaders.contains(name.toLowerCase(Locale.ROOT))
                ? values.stream().map(value -> REDACTED).collect(Collectors.toList())
                : values));
        return result;
    }

    private Map<String, String> redactCookies(Map<String, String> cookies) {
        Map<String, String> result = new LinkedHashMap<>();
        cookies.forEach((name, value) -> result.put(name,
            redactedHeaders.contains(name.toLowerCase(Locale.ROOT)) ? REDACTED : value));
        return result;
    }

    private JsonNode redactBody(JsonNode body) {
        if (body == null || redactedPaths.isEmpty()) {
            return body;
        }
        Set<String> selected = selectRedacted(body);
        if (selected.isEmpty()) {
            return body;
        }
        if (selected.contains("$")) {
            return TextNode.valueOf(REDACTED);
        }
        JsonNode copy = body.deepCopy();
        redactChildren(copy, new ArrayList<>(), selected);
        return copy;
    }

    private Set<String> selectRedacted(JsonNode body) {
        Set<String> selected = new HashSet<>();
        for (JsonPathPattern pattern : redactedPaths) {
            selected.addAll(pattern.select(body));
        }
        return selected;
    }

    private void redactChildren(JsonNode node, List<Object> path, Set<String> selected) {
        if (node instanceof ObjectNode) {
            ObjectNode object = (ObjectNode) node;
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                path.add(name);
                if (selected.contains(JsonPathPattern.normalize(path))) {
                    object.put(name, REDACTED);
                } else {
                    redactChildren(object.get(name), path, selected);
                }
                path.remove(path.size() - 1);
            }
        } else if (node instanceof ArrayNode) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                path.add(i);
                if (selected.contains(JsonPathPattern.normalize(path))) {
                    array.set(i, TextNode.valueOf(REDACTED));
                } else {
                    redactChildren(array.get(i), path, selected);
                }
                path.remove(path.size() - 1);
            }
        }
    }

    private static void deleteRecursively(Path path) {
        if (!Files.exists(path)) {
            return;
        }
        try (var walk = Files.walk(path)) {
            walk.sorted(java.util.Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            log.warn("Не удалось удалить временный каталог {}: {}", path, e.getMessage());
        }
    }
}

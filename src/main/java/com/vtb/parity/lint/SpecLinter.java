package com.vtb.parity.lint;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.parity.core.SpecificationModel;
import com.vtb.parity.models.LinkSpec;
import com.vtb.parity.models.Operation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.links.Link;
import io.swagger.v3.oas.models.responses.ApiResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Проверки спецификации, влияющие на работу explore: связность links, типы выражений в links,
 * наличие схем ответов, повторяющиеся имена links и глубина, на которой достижима каждая операция.
 *
 * Граф строится по тем же links, что использует explore; связи на неизвестные операции
 * попадают только в ошибки.
 */
@Slf4j
public class SpecLinter {

    private static final Pattern BODY_EXPRESSION = Pattern.compile("^\\$response\\.body#(/.*)?$");
    private static final Pattern HEADER_EXPRESSION = Pattern.compile("^\\$response\\.header\\.(.+)$");
    private static final Map<String, Integer> NOT_LINKS = Collections.emptyMap();

    private final OpenAPI openAPI;
    private final SpecificationModel specification;
    private final Path rawFile;
    private final Map<String, String> idsBySignature = new HashMap<>();

    /**
     * @param rawFile исходный файл для поиска повторяющихся ключей; null для спецификаций по URL
     */
    public SpecLinter(OpenAPI openAPI, SpecificationModel specification, Path rawFile) {
        this.openAPI = openAPI;
        this.specification = specification;
        this.rawFile = rawFile;
        for (Operation operation : specification.getOperations()) {
            idsBySignature.put(operation.getMethod().toUpperCase(Locale.ROOT) + " " + operation.getPathTemplate(),
                operation.getOperationId());
        }
    }

    public LintResult lint() {
        LintResult result = new LintResult();
        result.getSummary().setTotalOperations(specification.getOperations().size());

        List<RawLink> rawLinks = rawLinks();
        Map<String, Set<String>> outbound = new LinkedHashMap<>();
        Map<String, Set<String>> inbound = new LinkedHashMap<>();
        for (Operation operation : specification.getOperations()) {
            outbound.put(operation.getOperationId(), new LinkedHashSet<>());
            inbound.put(operation.getOperationId(), new LinkedHashSet<>());
        }
        for (LinkSpec link : specification.links()) {
            outbound.get(link.getSourceOperationId()).add(link.getTargetOperationId());
            inbound.get(link.getTargetOperationId()).add(link.getSourceOperationId());
        }

        checkInvalidTargets(rawLinks, result);
        checkConnectivity(outbound, inbound, result);
        checkExplicitLinks(rawLinks, result);
        checkExpressionCoverage(rawLinks, result);
        checkNon200Links(rawLinks, result);
        checkResponseSchemas(result);
        checkDuplicateLinkNames(result);
        checkChainDepth(outbound, inbound, result);

        log.info("Проверка спецификации: ошибок {}, предупреждений {}, замечаний {}",
            result.getErrors().size(), result.getWarnings().size(), result.getInfo().size());
        return result;
    }

    private void checkInvalidTargets(List<RawLink> rawLinks, LintResult result) {
        for (RawLink raw : rawLinks) {
            String target = raw.link.getOperationId();
            // operationRef разрешает парсер, здесь проверяются только operationId
            if (target == null || idsBySignature.containsValue(target)) {
                continue;
            }
            result.add(LintMessage.builder()
                .level(LintLevel.ERROR)
                .code("invalid-link-target")
                .message("Link '" + raw.name + "' ссылается на несуществующий operationId: " + target)
                .operationId(raw.sourceId)
                .details(details("link_name", raw.name, "target", target, "status_code", raw.statusCode))
                .build());
        }
    }

    private void checkConnectivity(Map<String, Set<String>> outbound, Map<String, Set<String>> inbound,
                                   LintResult result) {
        Set<String> withOutbound = new TreeSet<>();
        Set<String> withInbound = new TreeSet<>();
        outbound.forEach((id, targets) -> {
            if (!targets.isEmpty()) {
                withOutbound.add(id);
            }
        });
        inbound.forEach((id, sources) -> {
            if (!sources.isEmpty()) {
                withInbound.add(id);
            }
        });
        Set<String> linked = new TreeSet<>(withOutbound);
        linked.addAll(withInbound);
        result.getSummary().setOperationsWithLinks(linked.size());

        for (String id : new TreeSet<>(outbound.keySet())) {
            if (linked.contains(id)) {
                continue;
            }
            Operation operation = specification.find(id).orElseThrow();
            result.add(LintMessage.builder()
                .level(LintLevel.INFO)
                .code("isolated-operation")
                .message("Операция без входящих и исходящих links")
                .operationId(id)
                .details(details("method", operation.getMethod(), "path", operation.getPathTemplate()))
                .build());
        }
        for (String id : withInbound) {
            if (!withOutbound.contains(id)) {
                result.add(info("chain-terminator", "Есть входящие links, исходящих нет: цепочки на операции заканчиваются", id));
            }
        }
        for (String id : withOutbound) {
            if (!withInbound.contains(id)) {
                result.add(info("chain-entry-point", "Есть исходящие links, входящих нет: цепочки с операции начинаются", id));
            }
        }
    }

    private void checkExplicitLinks(List<RawLink> rawLinks, LintResult result) {
        if (rawLinks.isEmpty()) {
            result.add(LintMessage.builder()
                .level(LintLevel.WARNING)
                .code("no-explicit-links")
                .message("В спецификации нет links: связи не выводятся автоматически, explore не построит ни одной цепочки")
                .build());
        }
    }

    private void checkExpressionCoverage(List<RawLink> rawLinks, LintResult result) {
        int body = 0;
        int header = 0;
        int request = 0;
        int literal = 0;
        Set<String> bodyFields = new TreeSet<>();
        Set<String> headerNames = new TreeSet<>();
        for (RawLink raw : rawLinks) {
            if (raw.link.getParameters() == null) {
                continue;
            }
            for (Object value : raw.link.getParameters().values()) {
                if (!(value instanceof String)) {
                    continue;
                }
                String expression = (String) value;
                Matcher bodyMatch = BODY_EXPRESSION.matcher(expression);
                Matcher headerMatch = HEADER_EXPRESSION.matcher(expression);
                if (bodyMatch.matches()) {
                    body++;
                    bodyFields.add(bodyMatch.group(1) != null ? bodyMatch.group(1) : "/");
                } else if (headerMatch.matches()) {
                    header++;
                    headerNames.add(headerMatch.group(1).toLowerCase(Locale.ROOT));
                } else if (expression.startsWith("$request.")) {
                    request++;
                } else {
                    literal++;
                }
            }
        }
        if (body + header + request + literal == 0) {
            return;
        }
        Map<String, Object> details = details(
            "body_expressions", body,
            "header_expressions", header,
            "request_expressions", request);
        details.put("literal_expressions", literal);
        details.put("body_fields", List.copyOf(bodyFields));
        details.put("header_names", List.copyOf(headerNames));
        result.add(LintMessage.builder()
            .level(LintLevel.INFO)
            .code("link-expression-coverage")
            .message("Выражения в links: body " + body + ", header " + header
                + ", request " + request + ", литералы " + literal)
            .details(details)
            .build());
    }

    private void checkNon200Links(List<RawLink> rawLinks, LintResult result) {
        List<Map<String, Object>> found = new ArrayList<>();
        Map<String, Integer> byKind = new LinkedHashMap<>();
        for (RawLink raw : rawLinks) {
            if ("200".equals(raw.statusCode)) {
                continue;
            }
            String target = raw.link.getOperationId() != null ? raw.link.getOperationId() : raw.link.getOperationRef();
            found.add(details("source_operation", raw.sourceId, "status_code", raw.statusCode,
                "link_name", raw.name));
            found.get(found.size() - 1).put("target_operation", target);
            byKind.merge(statusKind(raw.statusCode), 1, Integer::sum);
        }
        if (found.isEmpty()) {
            return;
        }
        result.add(LintMessage.builder()
            .level(LintLevel.INFO)
            .code("non-200-status-links")
            .message("Links на кодах, отличных от 200: " + found.size() + " " + byKind
                + ". Поддерживаются, но стоит проверить цепочки в graph-chains")
            .details(details("links", found))
            .build());
    }

    private static String statusKind(String statusCode) {
        if (statusCode.equals("201") || statusCode.equals("202") || statusCode.equals("default")) {
            return statusCode;
        }
        return statusCode.toUpperCase(Locale.ROOT).endsWith("XX") ? "2XX" : "other";
    }

    private void checkResponseSchemas(LintResult result) {
        List<String> without = new ArrayList<>();
        int with = 0;
        for (Operation operation : specification.getOperations()) {
            boolean has = operation.getResponseSchemas().keySet().stream()
                .anyMatch(code -> code.startsWith("2") || code.equals("default"));
            if (has) {
                with++;
            } else {
                without.add(operation.getOperationId());
            }
        }
        result.getSummary().setOperationsWithResponseSchemas(with);
        if (!without.isEmpty()) {
            Collections.sort(without);
            result.add(LintMessage.builder()
                .level(LintLevel.WARNING)
                .code("missing-response-schema")
                .message("Операций без JSON-схемы успешного ответа: " + without.size()
                    + ". Поля их ответов не проверяются по схеме")
                .details(details("operations_without_schema", without))
                .build());
        }
    }

    private void checkDuplicateLinkNames(LintResult result) {
        if (rawFile == null || !Files.isRegularFile(rawFile)) {
            return;
        }
        try {
            duplicateLinkNames(rawFile).forEach(result::add);
        } catch (IOException e) {
            log.warn("Не удалось просканировать {} на повторяющиеся links: {}", rawFile, e.getMessage());
        }
    }

    /**
     * Парсеры YAML и JSON молча оставляют последний из повторяющихся ключей, поэтому имена links
     * проверяются по потоку токенов исходного файла.
     */
    static List<LintMessage> duplicateLinkNames(Path file) throws IOException {
        String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        JsonFactory factory = fileName.endsWith(".json") ? new JsonFactory() : new YAMLFactory();
        List<LintMessage> found = new ArrayList<>();
        try (JsonParser parser = factory.createParser(file.toFile())) {
            Deque<Map<String, Integer>> objects = new ArrayDeque<>();
            String field = null;
            JsonToken token;
            while ((token = parser.nextToken()) != null) {
                switch (token) {
                    case FIELD_NAME -> {
                        field = parser.currentName();
                        Map<String, Integer> names = objects.peek();
                        if (names != null && names != NOT_LINKS) {
                            int line = parser.currentTokenLocation().getLineNr();
                            Integer first = names.putIfAbsent(field, line);
                            if (first != null) {
                                found.add(duplicate(field, first, line));
                            }
                        }
                    }
                    case START_OBJECT -> {
                        objects.push("links".equals(field) ? new HashMap<>() : NOT_LINKS);
                        field = null;
                    }
                    case START_ARRAY -> {
                        objects.push(NOT_LINKS);
                        field = null;
                    }
                    case END_OBJECT, END_ARRAY -> objects.pop();
                    default -> field = null;
                }
            }
        }
        return found;
    }

    private static LintMessage duplicate(String name, int firstLine, int line) {
        return LintMessage.builder()
            .level(LintLevel.ERROR)
            .code("duplicate-link-name")
            .message("Повторяющееся имя link '" + name + "' в строке " + line + ", первое вхождение в строке "
                + firstLine + ". Парсер использует последнее определение")
            .details(details("link_name", name, "first_line", firstLine, "duplicate_line", line))
            .build();
    }

    private void checkChainDepth(Map<String, Set<String>> outbound, Map<String, Set<String>> inbound,
                                 LintResult result) {
        Set<String> entryPoints = new TreeSet<>();
        outbound.forEach((id, targets) -> {
            if (!targets.isEmpty() && inbound.get(id).isEmpty()) {
                entryPoints.add(id);
            }
        });

        Map<String, Integer> depth = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String entry : entryPoints) {
            depth.put(entry, 1);
            queue.add(entry);
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int next = depth.get(current) + 1;
            for (String target : outbound.get(current)) {
                if (!depth.containsKey(target)) {
                    depth.put(target, next);
                    queue.add(target);
                }
            }
        }

        Map<String, List<String>> levels = new LinkedHashMap<>();
        for (String key : List.of("depth_1", "depth_2", "depth_3", "depth_4_plus", "unreachable")) {
            levels.put(key, new ArrayList<>());
        }
        for (String id : new TreeSet<>(outbound.keySet())) {
            Integer level = depth.get(id);
            String key = level == null ? "unreachable"
                : level <= 3 ? "depth_" + level
                : "depth_4_plus";
            levels.get(key).add(id);
        }
        LintResult.ChainDepth summary = result.getChainDepth();
        summary.setDepth1(levels.get("depth_1").size());
        summary.setDepth2(levels.get("depth_2").size());
        summary.setDepth3(levels.get("depth_3").size());
        summary.setDepth4Plus(levels.get("depth_4_plus").size());
        summary.setUnreachable(levels.get("unreachable").size());

        if (entryPoints.isEmpty()) {
            return;
        }
        result.add(LintMessage.builder()
            .level(LintLevel.INFO)
            .code("chain-depth-summary")
            .message("Глубина цепочек: 1 (старт) " + summary.getDepth1() + ", 2: " + summary.getDepth2()
                + ", 3: " + summary.getDepth3() + ", 4+: " + summary.getDepth4Plus()
                + ", недостижимо: " + summary.getUnreachable())
            .details(new LinkedHashMap<>(levels))
            .build());

        for (String key : List.of("depth_3", "depth_4_plus")) {
            for (String id : levels.get(key)) {
                Operation operation = specification.find(id).orElseThrow();
                int level = depth.get(id);
                Map<String, Object> details = details("method", operation.getMethod(), "path", operation.getPathTemplate(),
                    "min_depth", level);
                details.put("potential_link_sources", List.copyOf(entryPoints));
                result.add(LintMessage.builder()
                    .level(LintLevel.WARNING)
                    .code(level == 3 ? "deep-chain-depth-3" : "deep-chain-depth-4-plus")
                    .message("Операция достижима только на глубине " + level
                        + ". Прямой link из стартовой операции сократит цепочку")
                    .operationId(id)
                    .details(details)
                    .build());
            }
        }
    }

    private List<RawLink> rawLinks() {
        List<RawLink> result = new ArrayList<>();
        if (openAPI.getPaths() == null) {
            return result;
        }
        for (Map.Entry<String, PathItem> pathEntry : openAPI.getPaths().entrySet()) {
            for (Map.Entry<PathItem.HttpMethod, io.swagger.v3.oas.models.Operation> operationEntry
                : pathEntry.getValue().readOperationsMap().entrySet()) {
                String sourceId = idsBySignature.get(operationEntry.getKey().name() + " " + pathEntry.getKey());
                io.swagger.v3.oas.models.Operation source = operationEntry.getValue();
                if (sourceId == null || source.getResponses() == null) {
                    continue;
                }
                for (Map.Entry<String, ApiResponse> response : source.getResponses().entrySet()) {
                    Map<String, Link> links = response.getValue().getLinks();
                    if (links == null) {
                        continue;
                    }
                    links.forEach((name, link) -> result.add(
                        new RawLink(sourceId, response.getKey(), name, resolve(link))));
                }
            }
        }
        return result;
    }

    private Link resolve(Link link) {
        if (link.get$ref() == null || openAPI.getComponents() == null || openAPI.getComponents().getLinks() == null) {
            return link;
        }
        String ref = link.get$ref();
        Link resolved = openAPI.getComponents().getLinks().get(ref.substring(ref.lastIndexOf('/') + 1));
        return resolved != null ? resolved : link;
    }

    private static LintMessage info(String code, String message, String operationId) {
        return LintMessage.builder()
            .level(LintLevel.INFO)
            .code(code)
            .message(message)
            .operationId(operationId)
            .build();
    }

    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            details.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return details;
    }

    private static final class RawLink {
        final String sourceId;
        final String statusCode;
        final String name;
        final Link link;

        RawLink(String sourceId, String statusCode, String name, Link link) {
            this.sourceId = sourceId;
            this.statusCode = statusCode;
            this.name = name;
            this.link = link;
        }
    }
}

package com.vtb.parity.core;

import com.vtb.parity.config.ConfigException;
import com.vtb.parity.models.LinkSpec;
import com.vtb.parity.models.Operation;
import com.vtb.parity.models.ParameterLocation;
import com.vtb.parity.models.ParameterSpec;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.links.Link;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Загрузка OpenAPI спецификации и построение модели операций.
 *
 * Ссылки разрешаются полностью (resolveFully): генератору нужны схемы без $ref.
 * operationId, если не задан, строится из метода и пути.
 */
@Slf4j
public class OpenAPIParser {

    private static final String JSON = "application/json";
    private static final String OPERATION_REF_PREFIX = "#/paths/";

    private OpenAPI openAPI;
    private String specificationSource;

    /**
     * Установить OpenAPI объект напрямую (для тестов)
     */
    public void setOpenAPI(OpenAPI openAPI) {
        this.openAPI = openAPI;
        this.specificationSource = "test-synthetic";
    }

    public void parse(String location) {
        if (location == null || location.isBlank()) {
            throw new ConfigException("Не указан путь к спецификации");
        }
        if (location.startsWith("http://") || location.startsWith("https://")) {
            parseFromUrl(location);
        } else {
            parseFromFile(location);
        }
    }

    public void parseFromFile(String filePath) {
        log.info("Загрузка спецификации из файла: {}", filePath);
        Path path = Paths.get(filePath);
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Файл спецификации не найден: " + filePath);
        }
        parseSpecification(path.toAbsolutePath().toString());
    }

    public void parseFromUrl(String url) {
        log.info("Загрузка спецификации по URL: {}", url);
        parseSpecification(url);
    }

    private void parseSpecification(String location) {
        ParseOptions options = new ParseOptions();
        options.setResolve(true);
        options.setResolveFully(true);

        SwaggerParseResult result = new OpenAPIV3Parser().readLocation(location, null, options);
        if (result.getMessages() != null) {
            for (String message : result.getMessages()) {
                log.warn("Предупреждение при парсинге: {}", message);
            }
        }
        this.openAPI = result.getOpenAPI();
        if (this.openAPI == null) {
            throw new ConfigException("Не удалось распарсить спецификацию OpenAPI: " + location
                + (result.getMessages() != null ? " " + result.getMessages() : ""));
        }
        this.specificationSource = location;
        log.info("Спецификация загружена: {} (версия {})", getApiTitle(), getApiVersion());
    }

    public OpenAPI getOpenAPI() {
        return openAPI;
    }

    public String getSpecificationSource() {
        return specificationSource;
    }

    public String getApiTitle() {
        return openAPI != null && openAPI.getInfo() != null ? openAPI.getInfo().getTitle() : null;
    }

    public String getApiVersion() {
        return openAPI != null && openAPI.getInfo() != null ? openAPI.getInfo().getVersion() : null;
    }

    /**
     * Модель операций с links. Связи на несуществующие операции отбрасываются с предупреждением.
     */
    public SpecificationModel buildModel() {
        if (openAPI == null) {
            throw new IllegalStateException("Спецификация не загружена");
        }
        Map<String, String> idsBySignature = new LinkedHashMap<>();
        Map<String, io.swagger.v3.oas.models.Operation> sources = new LinkedHashMap<>();
        Map<String, Operation.OperationBuilder> builders = new LinkedHashMap<>();

        if (openAPI.getPaths() != null) {
            for (Map.Entry<String, PathItem> pathEntry : openAPI.getPaths().entrySet()) {
                String path = pathEntry.getKey();
                PathItem pathItem = pathEntry.getValue();
                for (Map.Entry<PathItem.HttpMethod, io.swagger.v3.oas.models.Operation> operationEntry
                    : pathItem.readOperationsMap().entrySet()) {
                    String method = operationEntry.getKey().name();
                    io.swagger.v3.oas.models.Operation source = operationEntry.getValue();
                    String operationId = source.getOperationId() != null && !source.getOperationId().isBlank()
                        ? source.getOperationId()
                        : synthesizeId(method, path);
                    if (builders.containsKey(operationId)) {
                        log.warn("Повторяющийся operationId '{}' ({} {}), операция пропущена", operationId, method, path);
                        continue;
                    }
                    idsBySignature.put(signature(method, path), operationId);
                    sources.put(operationId, source);
                    builders.put(operationId, describe(operationId, method, path, pathItem, source));
                }
            }
        }

        List<Operation> operations = new ArrayList<>();
        for (Map.Entry<String, Operation.OperationBuilder> entry : builders.entrySet()) {
            Operation.OperationBuilder builder = entry.getValue();
            for (LinkSpec link : links(entry.getKey(), sources.get(entry.getKey()), builders.keySet(), idsBySignature)) {
                builder.link(link);
            }
            operations.add(builder.build());
        }
        log.info("Операций: {}, связей: {}", operations.size(),
            operations.stream().mapToInt(op -> op.getLinks().size()).sum());
        return new SpecificationModel(specificationSource, getApiTitle(), getApiVersion(), operations);
    }

    private Operation.OperationBuilder describe(String operationId, String method, String path,
                                                PathItem pathItem, io.swagger.v3.oas.models.Operation source) {
        Operation.OperationBuilder builder = Operation.builder()
            .operationId(operationId)
            .method(method)
            .pathTemplate(path);

        // параметры операции перекрывают параметры пути с тем же (name, in)
        Map<String, Parameter> merged = new LinkedHashMap<>();
        if (pathItem.getParameters() != null) {
            pathItem.getParameters().forEach(p -> merged.put(p.getIn() + ":" + p.getName(), p));
        }
        if (source.getParameters() != null) {
            source.getParameters().forEach(p -> merged.put(p.getIn() + ":" + p.getName(), p));
        }
        for (Parameter parameter : merged.values()) {
            if (parameter.getName() == null || parameter.getIn() == null) {
                continue;
            }
            ParameterLocation location = ParameterLocation.fromOpenApi(parameter.getIn());
            builder.parameter(ParameterSpec.builder()
                .name(parameter.getName())
                .location(location)
                .required(location == ParameterLocation.PATH || Boolean.TRUE.equals(parameter.getRequired()))
                .schema(parameterSchema(parameter))
                .build());
        }

        if (source.getRequestBody() != null && source.getRequestBody().getContent() != null) {
            for (Map.Entry<String, MediaType> content : source.getRequestBody().getContent().entrySet()) {
                builder.requestBody(content.getKey(), content.getValue().getSchema());
            }
            builder.bodyRequired(Boolean.TRUE.equals(source.getRequestBody().getRequired()));
        }

        if (source.getResponses() != null) {
            for (Map.Entry<String, ApiResponse> response : source.getResponses().entrySet()) {
                Schema<?> schema = jsonSchema(response.getValue().getContent());
                if (schema != null) {
                    builder.responseSchema(response.getKey(), schema);
                }
            }
        }
        return builder;
    }

    private List<LinkSpec> links(String sourceId, io.swagger.v3.oas.models.Operation source,
                                 java.util.Set<String> knownIds, Map<String, String> idsBySignature) {
        List<LinkSpec> result = new ArrayList<>();
        if (source.getResponses() == null) {
            return result;
        }
        for (Map.Entry<String, ApiResponse> response : source.getResponses().entrySet()) {
            Map<String, Link> links = response.getValue().getLinks();
            if (links == null) {
                continue;
            }
            for (Map.Entry<String, Link> entry : links.entrySet()) {
                Link link = resolveLink(entry.getValue());
                if (link == null) {
                    continue;
                }
                String targetId = link.getOperationId();
                if (targetId == null && link.getOperationRef() != null) {
                    targetId = resolveOperationRef(link.getOperationRef(), idsBySignature);
                }
                if (targetId == null || !knownIds.contains(targetId)) {
                    log.warn("Связь '{}' из {} указывает на неизвестную операцию ({}), пропущена",
                        entry.getKey(), sourceId, targetId != null ? targetId : link.getOperationRef());
                    continue;
                }
                result.add(LinkSpec.builder()
                    .name(entry.getKey())
                    .sourceOperationId(sourceId)
                    .statusCode(response.getKey())
                    .targetOperationId(targetId)
                    .parameters(link.getParameters() != null ? link.getParameters() : Map.of())
                    .build());
            }
        }
        return result;
    }

    private Link resolveLink(Link link) {
        if (link == null || link.get$ref() == null) {
            return link;
        }
        String ref = link.get$ref();
        String name = ref.substring(ref.lastIndexOf('/') + 1);
        if (openAPI.getComponents() != null && openAPI.getComponents().getLinks() != null) {
            Link resolved = openAPI.getComponents().getLinks().get(name);
            if (resolved != null) {
                return resolved;
            }
        }
        log.warn("Не удалось разрешить ссылку на link: {}", ref);
        return null;
    }

    /**
     * {@code #/paths/~1items~1{id}/get} → operationId
     */
    static String resolveOperationRef(String operationRef, Map<String, String> idsBySignature) {
        if (!operationRef.startsWith(OPERATION_REF_PREFIX)) {
            return null;
        }
        String pointer = operationRef.substring(OPERATION_REF_PREFIX.length());
        int slash = pointer.lastIndexOf('/');
        if (slash <= 0) {
            return null;
        }
        String path = pointer.substring(0, slash).replace("~1", "/").replace("~0", "~");
        String method = pointer.substring(slash + 1);
        return idsBySignature.get(signature(method, path));
    }

    private static Schema<?> parameterSchema(Parameter parameter) {
        if (parameter.getSchema() != null) {
            return parameter.getSchema();
        }
        return jsonSchema(parameter.getContent());
    }

    private static Schema<?> jsonSchema(Content content) {
        if (content == null || content.isEmpty()) {
            return null;
        }
        MediaType json = content.get(JSON);
        if (json == null) {
            json = content.entrySet().stream()
                .filter(entry -> entry.getKey().toLowerCase(Locale.ROOT).contains("json"))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
        }
        return json != null ? json.getSchema() : null;
    }

    static String synthesizeId(String method, String path) {
        String cleaned = path.replaceAll("[^A-Za-z0-9]+", "_").replaceAll("^_+|_+$", "");
        return method.toLowerCase(Locale.ROOT) + (cleaned.isEmpty() ? "" : "_" + cleaned);
    }

    private static String signature(String method, String path) {
        return method.toUpperCase(Locale.ROOT) + " " + path;
    }
}

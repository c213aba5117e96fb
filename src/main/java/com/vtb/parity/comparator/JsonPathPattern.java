package com.vtb.parity.comparator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.InvalidPathException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;
import com.jayway.jsonpath.spi.json.JacksonJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;
import lombok.EqualsAndHashCode;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Шаблон JSON-пути для правил сравнения и редактирования секретов.
 *
 * Разбор и выборка выполняются Jayway JsonPath: шаблон компилируется один раз,
 * {@link #select} возвращает нормализованные пути вида {@code $['items'][0]['id']}.
 * Своя здесь только оценка специфичности для выбора между пересекающимися правилами.
 */
@EqualsAndHashCode(of = "source")
public final class JsonPathPattern {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Configuration PATH_LIST = Configuration.builder()
        .jsonProvider(new JacksonJsonProvider(MAPPER))
        .mappingProvider(new JacksonMappingProvider(MAPPER))
        .options(Option.AS_PATH_LIST, Option.SUPPRESS_EXCEPTIONS)
        .build();

    private static final Pattern SIMPLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_\\-]*");
    private static final Pattern CONCRETE_INDEX = Pattern.compile("\\[\\d+]");
    /** Сегменты нормализованного пути Jayway: {@code ['name']}, {@code [3]}, {@code [*]}, {@code [?]}, {@code ..} */
    private static final Pattern NORMALIZED_SEGMENT = Pattern.compile("\\['[^']*'(?:,'[^']*')*]|\\[[^\\]]*]|\\.\\.");
    private static final Pattern SINGLE_INDEX = Pattern.compile("\\[\\d+]");
    private static final Pattern SIMPLE_SEGMENT = Pattern.compile("\\['([A-Za-z_][A-Za-z0-9_\\-]*)']");

    private final String source;
    private final JsonPath compiled;
    private final int literalSegments;
    private final int wildcardSegments;

    private JsonPathPattern(String source, JsonPath compiled) {
        this.source = source;
        this.compiled = compiled;
        int literal = 0;
        int wildcard = 0;
        Matcher segment = NORMALIZED_SEGMENT.matcher(compiled.getPath());
        while (segment.find()) {
            String token = segment.group();
            boolean single = token.startsWith("['")
                ? !token.contains("','")
                : SINGLE_INDEX.matcher(token).matches();
            if (single) {
                literal++;
            } else {
                wildcard++;
            }
        }
        this.literalSegments = literal;
        this.wildcardSegments = wildcard;
    }

    /**
     * @throws IllegalArgumentException синтаксическая ошибка в шаблоне
     */
    public static JsonPathPattern parse(String pattern) {
        if (pattern == null || !pattern.startsWith("$")) {
            throw new IllegalArgumentException("JSON path должен начинаться с '$': " + pattern);
        }
        try {
            return new JsonPathPattern(pattern, JsonPath.compile(pattern));
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Некорректный JSON path " + pattern + ": " + e.getMessage(), e);
        }
    }

    public String getSource() {
        return source;
    }

    /**
     * Нормализованные пути, которые шаблон выбирает в документе. Пустой список, если совпадений нет.
     */
    public List<String> select(JsonNode document) {
        if (document == null || document.isMissingNode()) {
            return List.of();
        }
        Object plain = MAPPER.convertValue(document, Object.class);
        if (plain == null) {
            return isRoot() ? List.of("$") : List.of();
        }
        List<String> paths = JsonPath.using(PATH_LIST).parse(plain).read(compiled);
        return paths != null ? paths : List.of();
    }

    /**
     * Шаблон указывает ровно на один путь (без подстановок, спуска и фильтров)
     */
    public boolean isLiteral() {
        return compiled.isDefinite();
    }

    /**
     * Конкретный путь для литерального шаблона в нормализованной записи
     */
    public String normalizedPath() {
        return compiled.getPath();
    }

    /**
     * Больше: специфичнее: сначала число литеральных сегментов, затем меньше подстановок
     */
    public int compareSpecificity(JsonPathPattern other) {
        if (literalSegments != other.literalSegments) {
            return Integer.compare(literalSegments, other.literalSegments);
        }
        return Integer.compare(other.wildcardSegments, wildcardSegments);
    }

    private boolean isRoot() {
        return "$".equals(compiled.getPath());
    }

    /**
     * Путь в нормализованной записи Jayway, как его возвращает {@link #select}
     */
    public static String normalize(List<Object> path) {
        StringBuilder out = new StringBuilder("$");
        for (Object element : path) {
            if (element instanceof Integer) {
                out.append('[').append(element).append(']');
            } else {
                out.append("['").append(element).append("']");
            }
        }
        return out.toString();
    }

    /**
     * Нормализованная запись конкретного пути ({@code $.items[0].id} даёт {@code $['items'][0]['id']}).
     * Пусто для путей вне тела и шаблонов с подстановками.
     */
    public static Optional<String> normalizeConcrete(String path) {
        if (path == null || !path.startsWith("$")) {
            return Optional.empty();
        }
        try {
            JsonPathPattern parsed = parse(path);
            return parsed.isLiteral() ? Optional.of(parsed.normalizedPath()) : Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Нормализованный путь в записи для отчётов
     */
    public static String display(String normalized) {
        return SIMPLE_SEGMENT.matcher(normalized).replaceAll(".$1");
    }

    /**
     * Путь для отчётов: {@code $.items[0].name}, имена с особыми символами в кавычках
     */
    public static String render(List<Object> path) {
        StringBuilder out = new StringBuilder("$");
        for (Object element : path) {
            if (element instanceof Integer) {
                out.append('[').append(element).append(']');
            } else {
                String name = String.valueOf(element);
                if (SIMPLE_NAME.matcher(name).matches()) {
                    out.append('.').append(name);
                } else {
                    out.append("['")
                        .append(name.replace("\\", "\\\\").replace("'", "\\'"))
                        .append("']");
                }
            }
        }
        return out.toString();
    }

    /**
     * Индексы массивов заменяются на {@code [*]}: пути сравниваются по шаблону, а не по позиции
     */
    public static String generalize(String concretePath) {
        if (concretePath == null) {
            return null;
        }
        return CONCRETE_INDEX.matcher(concretePath).replaceAll("[*]");
    }

    @Override
    public String toString() {
        return source;
    }
}

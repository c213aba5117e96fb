package com.vtb.parity.comparator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.parity.config.ConfigException;
import com.vtb.parity.models.FieldRule;
import lombok.Data;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Библиотека предопределённых сравнений: имя → шаблон выражения с параметрами {@code ${param}}.
 */
public class ExpressionLibrary {

    public static final String RESOURCE = "comparison-library.yaml";

    /** Стратегии, которые сравниватель выполняет сам, без вычислителя */
    public static final Set<String> NATIVE = Set.of("exact_match", "numeric_tolerance", "unordered_unique", "ignore");

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Definition {
        private String description;
        private List<String> params = new ArrayList<>();
        private String expr;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LibraryFile {
        private String version;
        private Map<String, Definition> predefined = new LinkedHashMap<>();
    }

    private final Map<String, Definition> predefined;

    public ExpressionLibrary(Map<String, Definition> predefined) {
        this.predefined = Collections.unmodifiableMap(new LinkedHashMap<>(predefined));
    }

    public static ExpressionLibrary loadDefault() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream is = ExpressionLibrary.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (is == null) {
                throw new ConfigException(RESOURCE + " не найден в classpath");
            }
            LibraryFile file = mapper.readValue(is, LibraryFile.class);
            return new ExpressionLibrary(file.getPredefined() != null ? file.getPredefined() : Map.of());
        } catch (IOException e) {
            throw new ConfigException("Ошибка загрузки библиотеки сравнений: " + e.getMessage(), e);
        }
    }

    public boolean contains(String name) {
        return predefined.containsKey(name);
    }

    public Map<String, Definition> getPredefined() {
        return predefined;
    }

    /**
     * Проблемы правила: неизвестное имя, отсутствующий параметр, оба способа сравнения сразу
     */
    public List<String> validate(FieldRule rule) {
        List<String> problems = new ArrayList<>();
        if (rule == null) {
            return problems;
        }
        if (rule.getPredefined() != null && rule.getExpr() != null) {
            problems.add("правило не может одновременно задавать predefined и expr");
        }
        if (rule.getPredefined() != null) {
            Definition definition = predefined.get(rule.getPredefined());
            if (definition == null) {
                problems.add("неизвестное предопределённое сравнение '" + rule.getPredefined() + "'");
            } else {
                for (String param : definition.getParams()) {
                    if (rule.parameter(param) == null) {
                        problems.add("для '" + rule.getPredefined() + "' не задан параметр '" + param + "'");
                    }
                }
            }
        }
        return problems;
    }

    /**
     * Развернуть предопределённое правило в выражение.
     *
     * @throws ConfigException неизвестное имя или отсутствующий параметр
     */
    public String expand(FieldRule rule) {
        Definition definition = predefined.get(rule.getPredefined());
        if (definition == null) {
            throw new ConfigException("Неизвестное предопределённое сравнение: " + rule.getPredefined());
        }
        String expr = definition.getExpr();
        for (String param : definition.getParams()) {
            Object value = rule.parameter(param);
            if (value == null) {
                throw new ConfigException("Missing required parameter '" + param + "' for predefined '" + rule.getPredefined() + "'");
            }
            expr = expr.replace("${" + param + "}", literal(value));
        }
        return expr;
    }

    static String literal(Object value) {
        if (value instanceof String) {
            return quote((String) value);
        }
        if (value instanceof Double) {
            return BigDecimal.valueOf((Double) value).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }

    /**
     * Строковый литерал выражения: обратный слэш и кавычка экранируются до подстановки
     */
    static String quote(String value) {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}

package com.vtb.parity.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.parity.models.DegradedPolicy;
import com.vtb.parity.models.GenerationMode;
import com.vtb.parity.models.TargetSide;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Настройки запуска из YAML.
 *
 * Значения по умолчанию лежат в classpath ({@code parity-config.yaml}); пользовательский файл
 * перекрывает их поключево, вложенные секции сливаются.
 */
@Data
@Slf4j
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParityConfig {

    static final String DEFAULTS_RESOURCE = "parity-config.yaml";
    private static final Pattern ENV_REFERENCE = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private Map<String, Target> targets = new LinkedHashMap<>();
    private Execution executor;
    private Evaluation evaluator;
    private Generation generation;
    private Chains chains;
    private Secrets secrets;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Target {
        private String baseUrl;
        private Map<String, String> headers = new LinkedHashMap<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Execution {
        private Long timeoutMs;
        private Map<String, Long> operationTimeouts = new LinkedHashMap<>();
        private Double requestsPerSecond;
        private Integer parallelism;
        private TargetSide sourceOfTruth;
        private DegradedPolicy degradedPolicy;

        public void ensureDefaults() {
            if (timeoutMs == null || timeoutMs <= 0) {
                timeoutMs = 30_000L;
            }
            if (operationTimeouts == null) {
                operationTimeouts = new LinkedHashMap<>();
            }
            if (requestsPerSecond == null || requestsPerSecond < 0) {
                requestsPerSecond = 0.0;
            }
            if (parallelism == null || parallelism <= 0) {
                parallelism = 4;
            }
            if (sourceOfTruth == null) {
                sourceOfTruth = TargetSide.A;
            }
            if (degradedPolicy == null) {
                degradedPolicy = DegradedPolicy.EXECUTE;
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Evaluation {
        private Long workerDeadlineMs;
        private Long callTimeoutMs;
        private Long startupTimeoutMs;
        private Integer maxRestarts;
        private List<String> command = new ArrayList<>();

        public void ensureDefaults() {
            if (workerDeadlineMs == null || workerDeadlineMs <= 0) {
                workerDeadlineMs = 5_000L;
            }
            if (callTimeoutMs == null || callTimeoutMs <= 0) {
                callTimeoutMs = 10_000L;
            }
            // ответ воркера о таймауте должен успеть дойти до вызывающего
            if (callTimeoutMs <= workerDeadlineMs) {
                callTimeoutMs = workerDeadlineMs * 2;
            }
            if (startupTimeoutMs == null || startupTimeoutMs <= 0) {
                startupTimeoutMs = 10_000L;
            }
            if (maxRestarts == null || maxRestarts < 0) {
                maxRestarts = 3;
            }
            if (command == null) {
                command = new ArrayList<>();
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Generation {
        private Integer casesPerOperation;
        private Long seed;
        private GenerationMode mode;

        public void ensureDefaults() {
            if (casesPerOperation == null || casesPerOperation < 0) {
                casesPerOperation = 10;
            }
            if (seed == null) {
                seed = 42L;
            }
            if (mode == null) {
                mode = GenerationMode.POSITIVE;
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Chains {
        private Boolean enabled;
        private Integer maxDepth;
        private Integer maxChains;
        private Integer perSequenceCap;

        public void ensureDefaults() {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (maxDepth == null || maxDepth < 2) {
                maxDepth = 4;
            }
            if (maxChains == null || maxChains < 0) {
                maxChains = 50;
            }
            if (perSequenceCap == null || perSequenceCap <= 0) {
                perSequenceCap = 1;
            }
        }

        public boolean isEnabled() {
            return Boolean.TRUE.equals(enabled);
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Secrets {
        private List<String> redactFields = new ArrayList<>();

        public void ensureDefaults() {
            if (redactFields == null) {
                redactFields = new ArrayList<>();
            }
        }
    }

    /**
     * Только значения по умолчанию из classpath
     */
    public static ParityConfig load() {
        return load(null);
    }

    /**
     * Значения по умолчанию, перекрытые пользовательским файлом (если задан)
     */
    public static ParityConfig load(Path overrides) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.setDefaultMergeable(true);

        ParityConfig config;
        try (InputStream is = ParityConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (is == null) {
                throw new ConfigException(DEFAULTS_RESOURCE + " не найден в classpath");
            }
            config = mapper.readValue(is, ParityConfig.class);
        } catch (IOException e) {
            throw new ConfigException("Ошибка загрузки конфигурации по умолчанию: " + e.getMessage(), e);
        }

        if (overrides != null) {
            if (!Files.isRegularFile(overrides)) {
                throw new ConfigException("Файл конфигурации не найден: " + overrides);
            }
            log.info("Загрузка конфигурации: {}", overrides);
            try {
                config = mapper.readerForUpdating(config).readValue(overrides.toFile());
            } catch (IOException e) {
                throw new ConfigException("Ошибка чтения конфигурации " + overrides + ": " + e.getMessage(), e);
            }
        }

        config.ensureDefaults();
        return config;
    }

    public void ensureDefaults() {
        if (targets == null) {
            targets = new LinkedHashMap<>();
        }
        if (executor == null) {
            executor = new Execution();
        }
        executor.ensureDefaults();
        if (evaluator == null) {
            evaluator = new Evaluation();
        }
        evaluator.ensureDefaults();
        if (generation == null) {
            generation = new Generation();
        }
        generation.ensureDefaults();
        if (chains == null) {
            chains = new Chains();
        }
        chains.ensureDefaults();
        if (secrets == null) {
            secrets = new Secrets();
        }
        secrets.ensureDefaults();
    }

    /**
     * Цель по имени из секции targets либо по URL.
     * Значения заголовков с {@code ${ENV}} подставляются из окружения.
     */
    public Target resolveTarget(String nameOrUrl) {
        return resolveTarget(nameOrUrl, System.getenv());
    }

    Target resolveTarget(String nameOrUrl, Map<String, String> environment) {
        if (nameOrUrl == null || nameOrUrl.isBlank()) {
            throw new ConfigException("Цель не указана");
        }
        String lower = nameOrUrl.toLowerCase(Locale.ROOT);
        Target source;
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            source = new Target();
            source.setBaseUrl(nameOrUrl);
        } else {
            source = targets.get(nameOrUrl);
            if (source == null) {
                throw new ConfigException("Неизвестная цель '" + nameOrUrl + "', доступны: " + targets.keySet());
            }
        }
        if (source.getBaseUrl() == null || source.getBaseUrl().isBlank()) {
            throw new ConfigException("У цели '" + nameOrUrl + "' не задан baseUrl");
        }

        Target resolved = new Target();
        resolved.setBaseUrl(expandEnvironment(source.getBaseUrl(), environment));
        Map<String, String> headers = new LinkedHashMap<>();
        if (source.getHeaders() != null) {
            source.getHeaders().forEach((name, value) -> headers.put(name, expandEnvironment(value, environment)));
        }
        resolved.setHeaders(headers);
        return resolved;
    }

    static String expandEnvironment(String value, Map<String, String> environment) {
        if (value == null || !value.contains("${")) {
            return value;
        }
        Matcher matcher = ENV_REFERENCE.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String variable = matcher.group(1);
            String replacement = environment.get(variable);
            if (replacement == null) {
                throw new ConfigException("Переменная окружения не задана: " + variable);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}

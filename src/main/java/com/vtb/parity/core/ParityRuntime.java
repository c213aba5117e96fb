package com.vtb.parity.core;

import com.vtb.parity.bundle.BundleWriter;
import com.vtb.parity.comparator.ExpressionLibrary;
import com.vtb.parity.comparator.ResponseComparator;
import com.vtb.parity.config.ParityConfig;
import com.vtb.parity.dynamic.ChainRunner;
import com.vtb.parity.dynamic.DualExecutor;
import com.vtb.parity.dynamic.ExecutorSettings;
import com.vtb.parity.dynamic.RequestThrottle;
import com.vtb.parity.dynamic.TargetClient;
import com.vtb.parity.dynamic.TelemetryCollector;
import com.vtb.parity.evaluator.EvaluatorBridge;
import com.vtb.parity.evaluator.ExpressionEvaluator;
import com.vtb.parity.models.BundleMetadata;
import com.vtb.parity.models.ComparisonRuleSet;
import com.vtb.parity.models.FieldRule;
import com.vtb.parity.models.OperationRules;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Компоненты одного запуска: цели, исполнитель, сравниватель, вычислитель выражений.
 * Закрытие останавливает воркер вычислителя и потоки исполнителя.
 */
@Slf4j
@Getter
public class ParityRuntime implements AutoCloseable {

    public static final String TOOL_VERSION = "api-parity 1.0.0";

    private final ParityConfig config;
    private final ComparisonRuleSet rules;
    private final String rulesScope;
    private final ExecutorSettings settings;
    private final TelemetryCollector telemetry;
    private final ExpressionEvaluator evaluator;
    private final ResponseComparator comparator;
    private final DualExecutor executor;
    private final ChainRunner runner;
    private final BundleWriter bundleWriter;

    public ParityRuntime(ParityConfig config, ComparisonRuleSet rules, String rulesScope,
                         ParityConfig.Target targetA, ParityConfig.Target targetB) {
        this(config, rules, rulesScope, targetA, targetB, new EvaluatorBridge(config.getEvaluator()));
    }

    public ParityRuntime(ParityConfig config, ComparisonRuleSet rules, String rulesScope,
                         ParityConfig.Target targetA, ParityConfig.Target targetB,
                         ExpressionEvaluator evaluator) {
        this.config = config;
        this.rules = rules;
        this.rulesScope = rulesScope;
        this.settings = new ExecutorSettings(config.getExecutor());
        this.telemetry = new TelemetryCollector();
        RequestThrottle throttle = new RequestThrottle(settings.requestsPerSecond());
        this.executor = new DualExecutor(
            new TargetClient("A", targetA, settings, telemetry),
            new TargetClient("B", targetB, settings, telemetry), throttle);
        this.evaluator = evaluator;
        this.comparator = new ResponseComparator(rules, ExpressionLibrary.loadDefault(), evaluator);
        this.runner = new ChainRunner(executor, comparator, settings);
        this.bundleWriter = new BundleWriter(config.getSecrets().getRedactFields());
    }

    /**
     * Обе цели должны отвечать до начала прогона
     */
    public void checkTargets() {
        executor.getTargetA().checkReachable(settings.timeoutMs());
        executor.getTargetB().checkReachable(settings.timeoutMs());
    }

    /**
     * Запустить воркер до прогона, если правилам нужны выражения: ошибка запуска проявится сразу
     */
    public void startEvaluator() {
        if (evaluator instanceof EvaluatorBridge && usesExpressions(rules)) {
            ((EvaluatorBridge) evaluator).start();
        }
    }

    static boolean usesExpressions(ComparisonRuleSet rules) {
        List<OperationRules> scopes = new ArrayList<>();
        scopes.add(rules.getDefaultRules());
        scopes.addAll(rules.getOperationRules().values());
        return scopes.stream()
            .filter(Objects::nonNull)
            .flatMap(ParityRuntime::fieldRules)
            .anyMatch(rule -> rule.getExpr() != null
                || (rule.getPredefined() != null && !ExpressionLibrary.NATIVE.contains(rule.getPredefined())));
    }

    private static Stream<FieldRule> fieldRules(OperationRules scope) {
        List<FieldRule> all = new ArrayList<>();
        all.add(scope.getStatusCode());
        all.add(scope.getBinaryRule());
        if (scope.getHeaders() != null) {
            all.addAll(scope.getHeaders().values());
        }
        if (scope.getBody() != null) {
            all.addAll(scope.getBody().values());
        }
        return all.stream().filter(Objects::nonNull);
    }

    public BundleMetadata metadata(String specification) {
        return BundleMetadata.builder()
            .toolVersion(TOOL_VERSION)
            .timestamp(Instant.now().toString())
            .seed(config.getGeneration().getSeed())
            .specification(specification)
            .targetA(executor.getTargetA().getBaseUrl())
            .targetB(executor.getTargetB().getBaseUrl())
            .rulesScope(rulesScope)
            .build();
    }

    @Override
    public void close() {
        executor.close();
        if (evaluator instanceof AutoCloseable) {
            try {
                ((AutoCloseable) evaluator).close();
            } catch (Exception e) {
                log.warn("Ошибка остановки вычислителя: {}", e.getMessage());
            }
        }
    }
}

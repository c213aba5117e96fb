package com.vtb.parity.dynamic;

import com.vtb.parity.chain.LinkExpressionResolver;
import com.vtb.parity.comparator.ResponseComparator;
import com.vtb.parity.models.Chain;
import com.vtb.parity.models.ChainStep;
import com.vtb.parity.models.DegradedPolicy;
import com.vtb.parity.models.LinkSpec;
import com.vtb.parity.models.Mismatch;
import com.vtb.parity.models.RequestCase;
import com.vtb.parity.models.StepExecution;
import com.vtb.parity.models.StepResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Пошаговое выполнение кейсов и цепочек с сравнением ответов.
 *
 * Шаги цепочки строго последовательны: параметры шага N+1 берутся из ответа шага N
 * цели-источника истины. Выполнение останавливается на первом шаге с расхождениями.
 */
@Slf4j
public class ChainRunner {

    private final DualExecutor executor;
    private final ResponseComparator comparator;
    private final ExecutorSettings settings;

    public ChainRunner(DualExecutor executor, ResponseComparator comparator, ExecutorSettings settings) {
        this.executor = executor;
        this.comparator = comparator;
        this.settings = settings;
    }

    public ExecutionOutcome runCase(RequestCase requestCase) {
        StepPair pair = executor.runStep(requestCase, settings.timeoutFor(requestCase.getOperationId()));
        List<StepExecution> executionsA = List.of(execution(0, requestCase, pair.getTargetA(), false));
        List<StepExecution> executionsB = List.of(execution(0, requestCase, pair.getTargetB(), false));
        ExecutionOutcome.ExecutionOutcomeBuilder outcome = ExecutionOutcome.builder()
            .requestCase(requestCase)
            .targetA(executionsA)
            .targetB(executionsB);

        if (pair.bothTerminal()) {
            return outcome.status(ExecutionOutcome.Status.ERROR)
                .reason("обе цели: " + pair.getTargetA().describe() + " / " + pair.getTargetB().describe())
                .build();
        }
        List<Mismatch> mismatches = comparator.compare(requestCase.getOperationId(), pair.getTargetA(), pair.getTargetB());
        if (!mismatches.isEmpty()) {
            return outcome.status(ExecutionOutcome.Status.MISMATCH)
                .mismatches(mismatches)
                .mismatchStep(0)
                .build();
        }
        return outcome.status(ExecutionOutcome.Status.MATCH).build();
    }

    public ExecutionOutcome runChain(Chain chain) {
        List<StepExecution> executionsA = new ArrayList<>();
        List<StepExecution> executionsB = new ArrayList<>();
        ExecutionOutcome.ExecutionOutcomeBuilder outcome = ExecutionOutcome.builder()
            .chain(chain)
            .targetA(executionsA)
            .targetB(executionsB);

        RequestCase previousRequest = null;
        StepResult previousResult = null;
        // КРИТИЧНО: длина цепочки ограничена maxDepth независимо от числа шагов в описании
        int limit = chain.getMaxDepth() > 0 ? Math.min(chain.length(), chain.getMaxDepth()) : chain.length();

        for (int index = 0; index < limit; index++) {
            ChainStep step = chain.getSteps().get(index);
            RequestCase request = step.getTemplate();
            if (step.getLinkSource() != null && previousResult != null) {
                request = applyLink(request, step.getLinkSource(), previousRequest, previousResult);
            }

            boolean degraded = !request.isResolved();
            if (degraded) {
                if (settings.degradedPolicy() == DegradedPolicy.SKIP) {
                    log.info("Цепочка {} остановлена на шаге {}: не разрешены {}",
                        chain.sequenceKey(), index, request.getUnresolvedParameters());
                    return outcome.status(ExecutionOutcome.Status.TRUNCATED)
                        .reason("шаг " + index + ": не разрешены " + request.getUnresolvedParameters())
                        .build();
                }
                log.debug("Шаг {} цепочки {} выполняется деградированно: {}",
                    index, chain.sequenceKey(), request.getUnresolvedParameters());
            }

            StepPair pair = executor.runStep(request, settings.timeoutFor(request.getOperationId()));
            executionsA.add(execution(index, request, pair.getTargetA(), degraded));
            executionsB.add(execution(index, request, pair.getTargetB(), degraded));

            if (pair.bothTerminal()) {
                return outcome.status(ExecutionOutcome.Status.ERROR)
                    .reason("шаг " + index + ", обе цели: " + pair.getTargetA().describe()
                        + " / " + pair.getTargetB().describe())
                    .build();
            }

            List<Mismatch> mismatches = comparator.compare(request.getOperationId(), pair.getTargetA(), pair.getTargetB());
            if (!mismatches.isEmpty()) {
                return outcome.status(ExecutionOutcome.Status.MISMATCH)
                    .mismatches(mismatches)
                    .mismatchStep(index)
                    .build();
            }

            previousRequest = request;
            previousResult = pair.side(settings.sourceOfTruth());
        }
        return outcome.status(ExecutionOutcome.Status.MATCH).build();
    }

    /**
     * Подстановка значений link из ответа предыдущего шага. Отсутствующее поле
     * оставляет параметр неразрешённым.
     */
    static RequestCase applyLink(RequestCase template, LinkSpec link,
                                 RequestCase previousRequest, StepResult previousResult) {
        RequestCase request = template;
        for (Map.Entry<String, String> parameter : link.getParameters().entrySet()) {
            String name = LinkSpec.bareParameterName(parameter.getKey());
            if (!request.getUnresolvedParameters().contains(name)) {
                continue;
            }
            Optional<String> value = LinkExpressionResolver.resolve(parameter.getValue(), previousRequest, previousResult);
            if (value.isPresent()) {
                request = request.withParameter(name, value.get());
            } else {
                log.debug("Link {}: значение {} недоступно в ответе {}",
                    link.getName(), parameter.getValue(), previousResult.describe());
            }
        }
        return request;
    }

    private static StepExecution execution(int index, RequestCase request, StepResult result, boolean degraded) {
        return StepExecution.builder()
            .stepIndex(index)
            .request(request)
            .result(result)
            .degraded(degraded)
            .build();
    }
}

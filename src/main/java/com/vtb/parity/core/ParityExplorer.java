package com.vtb.parity.core;

import com.vtb.parity.bundle.BundleFiles;
import com.vtb.parity.bundle.BundleWriter;
import com.vtb.parity.chain.ChainExplorer;
import com.vtb.parity.chain.LinkGraph;
import com.vtb.parity.config.ParityConfig;
import com.vtb.parity.dynamic.ExecutionOutcome;
import com.vtb.parity.evaluator.BridgeUnavailableException;
import com.vtb.parity.generation.CaseGenerator;
import com.vtb.parity.generation.GenerationException;
import com.vtb.parity.models.Bundle;
import com.vtb.parity.models.Chain;
import com.vtb.parity.models.GenerationMode;
import com.vtb.parity.models.Operation;
import com.vtb.parity.models.RequestCase;
import com.vtb.parity.reports.ChainsLogWriter;
import com.vtb.parity.reports.ExploreSummary;
import com.vtb.parity.reports.SummaryWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Прогон explore: кейсы по каждой операции и цепочки по графу связей, выполнение против
 * обеих целей, бандлы расхождений и итоги.
 *
 * Ошибки и сбои отдельных кейсов и цепочек становятся данными (счётчик errors и notices);
 * прогон прерывает только недоступность вычислителя.
 */
@Slf4j
public class ParityExplorer {

    private final ParityRuntime runtime;
    private final ParityConfig config;

    public ParityExplorer(ParityRuntime runtime) {
        this.runtime = runtime;
        this.config = runtime.getConfig();
    }

    public ExploreSummary explore(SpecificationModel specification, Path outputDirectory) throws IOException {
        Instant startedAt = Instant.now();
        Files.createDirectories(outputDirectory);
        Path mismatchesDir = outputDirectory.resolve(BundleFiles.MISMATCHES_DIR);

        ParityConfig.Generation generation = config.getGeneration();
        if (generation.getMode() == GenerationMode.EXPLORATORY) {
            log.warn("Режим EXPLORATORY: кейсы могут нарушать схему, расхождения возможны из-за валидации входа");
        }
        CaseGenerator generator = new CaseGenerator(generation.getSeed(), generation.getMode());
        RunStats stats = new RunStats();
        ChainsLogWriter chainsLog = new ChainsLogWriter();

        ExecutorService pool = Executors.newFixedThreadPool(runtime.getSettings().parallelism());
        List<Future<?>> tasks = new ArrayList<>();
        try {
            for (Operation operation : specification.getOperations()) {
                tasks.add(pool.submit(() -> runCases(operation, generator, stats, mismatchesDir, specification)));
            }
            if (config.getChains().isEnabled()) {
                LinkGraph graph = LinkGraph.build(specification);
                ChainExplorer chainExplorer = new ChainExplorer(graph, generator);
                ParityConfig.Chains chains = config.getChains();
                Iterator<Chain> planned = chainExplorer
                    .explore(chains.getMaxDepth(), chains.getMaxChains(), chains.getPerSequenceCap())
                    .iterator();
                while (planned.hasNext()) {
                    Chain chain;
                    try {
                        chain = planned.next();
                    } catch (GenerationException e) {
                        log.warn("Генерация шагов цепочки не удалась: {}", e.getMessage());
                        stats.generationFailed("chain", e.getMessage());
                        continue;
                    } catch (BridgeUnavailableException e) {
                        throw e;
                    } catch (RuntimeException e) {
                        log.error("Построение цепочек остановлено", e);
                        stats.failed("chain", e);
                        break;
                    }
                    tasks.add(pool.submit(() -> {
                        try {
                            ExecutionOutcome outcome = runtime.getRunner().runChain(chain);
                            chainsLog.record(outcome);
                            handle(outcome, stats, mismatchesDir, specification);
                        } catch (BridgeUnavailableException e) {
                            throw e;
                        } catch (RuntimeException e) {
                            log.error("Цепочка {} завершилась сбоем", chain.sequenceKey(), e);
                            stats.failed(chain.sequenceKey(), e);
                        }
                    }));
                }
            }
            await(tasks);
        } finally {
            pool.shutdownNow();
        }

        runtime.getTelemetry().buildNotices().forEach(stats::notice);
        ExploreSummary summary = ExploreSummary.builder()
            .toolVersion(ParityRuntime.TOOL_VERSION)
            .specification(specification.getSource())
            .targetA(runtime.getExecutor().getTargetA().getBaseUrl())
            .targetB(runtime.getExecutor().getTargetB().getBaseUrl())
            .seed(generation.getSeed())
            .startedAt(startedAt.toString())
            .durationMs(Instant.now().toEpochMilli() - startedAt.toEpochMilli())
            .operations(specification.getOperations().size())
            .totalCases(stats.getCases())
            .totalChains(stats.getChains())
            .matches(stats.getMatches())
            .mismatches(stats.getMismatches())
            .errors(stats.getErrors())
            .truncated(stats.getTruncated())
            .degradedSteps(stats.getDegradedSteps())
            .generationFailures(stats.getGenerationFailures())
            .mismatchesByOperation(stats.getMismatchesByOperation())
            .bundles(stats.getBundles())
            .notices(stats.getNotices())
            .telemetry(runtime.getTelemetry().summarize())
            .build();

        new SummaryWriter().write(summary, outputDirectory);
        if (config.getChains().isEnabled()) {
            chainsLog.write(outputDirectory);
        }
        log.info("Explore завершён: кейсов {}, цепочек {}, расхождений {}, ошибок {}",
            summary.getTotalCases(), summary.getTotalChains(), summary.getMismatches(), summary.getErrors());
        return summary;
    }

    private void runCases(Operation operation, CaseGenerator generator, RunStats stats,
                          Path mismatchesDir, SpecificationModel specification) {
        Iterator<RequestCase> cases = generator.generate(operation, config.getGeneration().getCasesPerOperation()).iterator();
        while (true) {
            RequestCase requestCase;
            try {
                if (!cases.hasNext()) {
                    return;
                }
                requestCase = cases.next();
            } catch (GenerationException e) {
                log.warn("Генерация кейсов для {} не удалась: {}", operation.getOperationId(), e.getMessage());
                stats.generationFailed(operation.getOperationId(), e.getMessage());
                return;
            } catch (RuntimeException e) {
                log.error("Генерация кейсов для {} завершилась сбоем", operation.getOperationId(), e);
                stats.failed(operation.getOperationId(), e);
                return;
            }
            try {
                handle(runtime.getRunner().runCase(requestCase), stats, mismatchesDir, specification);
            } catch (BridgeUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Кейс {} операции {} завершился сбоем", requestCase.getCaseId(), operation.getOperationId(), e);
                stats.failed(operation.getOperationId(), e);
            }
        }
    }

    private void handle(ExecutionOutcome outcome, RunStats stats, Path mismatchesDir, SpecificationModel specification) {
        stats.record(outcome);
        if (outcome.getStatus() == ExecutionOutcome.Status.ERROR) {
            log.warn("{}: {}", outcome.sequenceKey(), outcome.getReason());
        }
        if (outcome.getStatus() != ExecutionOutcome.Status.MISMATCH) {
            return;
        }
        Bundle bundle = BundleWriter.fromOutcome(outcome, runtime.metadata(specification.getSource()), null);
        try {
            Bundle written = runtime.getBundleWriter().write(bundle, mismatchesDir);
            stats.bundleWritten(written.getLocation().toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось записать бандл " + bundle.getReproductionKey(), e);
        }
    }

    private static void await(List<Future<?>> tasks) throws IOException {
        for (Future<?> task : tasks) {
            try {
                task.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Прогон прерван", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof BridgeUnavailableException) {
                    throw (BridgeUnavailableException) cause;
                }
                if (cause instanceof UncheckedIOException) {
                    throw ((UncheckedIOException) cause).getCause();
                }
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new IllegalStateException(cause);
            }
        }
    }
}

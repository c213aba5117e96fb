package com.vtb.parity.bundle;

import com.vtb.parity.comparator.JsonPathPattern;
import com.vtb.parity.comparator.ResponseComparator;
import com.vtb.parity.dynamic.ChainRunner;
import com.vtb.parity.dynamic.ExecutionOutcome;
import com.vtb.parity.models.Bundle;
import com.vtb.parity.models.BundleKind;
import com.vtb.parity.models.BundleMetadata;
import com.vtb.parity.models.Mismatch;
import com.vtb.parity.models.ReplayClassification;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Повторное выполнение бандла против текущих целей с текущими правилами.
 *
 * Классификация сравнивает пути расхождений по шаблону (индексы массивов обобщаются),
 * а не по значениям. Свежий бандл пишется всегда, сохранённые ответы не переносятся.
 */
@Slf4j
public class ReplayEngine {

    private final ChainRunner runner;
    private final BundleWriter writer;
    private final BundleMetadata context;

    /**
     * @param context metadata текущего запуска (цели, версия, правила); seed и спецификация
     *                берутся из исходного бандла, если в контексте не заданы
     */
    public ReplayEngine(ChainRunner runner, BundleWriter writer, BundleMetadata context) {
        this.runner = runner;
        this.writer = writer;
        this.context = context != null ? context : BundleMetadata.builder().build();
    }

    public ReplayOutcome replay(Bundle original, Path output) throws IOException {
        ExecutionOutcome outcome = original.getKind() == BundleKind.CHAIN
            ? runner.runChain(original.getChain())
            : runner.runCase(original.getRequestCase());

        Set<String> originalPaths = failingPaths(original.getKind(), original.getMismatchStep(), original.getMismatches());
        Set<String> currentPaths = failingPaths(original.getKind(), outcome.getMismatchStep(), outcome.getMismatches());
        ReplayClassification classification = classify(original, outcome, originalPaths, currentPaths);

        BundleMetadata previous = original.getMetadata() != null ? original.getMetadata() : BundleMetadata.builder().build();
        BundleMetadata replayMetadata = BundleMetadata.builder()
            .toolVersion(context.getToolVersion())
            .timestamp(Instant.now().toString())
            .seed(context.getSeed() != null ? context.getSeed() : previous.getSeed())
            .specification(context.getSpecification() != null ? context.getSpecification() : previous.getSpecification())
            .targetA(context.getTargetA())
            .targetB(context.getTargetB())
            .rulesScope(context.getRulesScope())
            .replayedFrom(original.getLocation() != null ? original.getLocation().toString() : null)
            .classification(classification)
            .build();

        Bundle fresh = BundleWriter.fromOutcome(outcome, replayMetadata, original.getReproductionKey());
        Path written = writer.write(fresh, output.resolve(directoryFor(classification))).getLocation();

        log.info("Replay {}: {}", original.getReproductionKey(), classification);
        return ReplayOutcome.builder()
            .reproductionKey(original.getReproductionKey())
            .classification(classification)
            .originalBundle(original.getLocation() != null ? original.getLocation().toString() : null)
            .newBundle(written.toString())
            .originalPaths(new ArrayList<>(originalPaths))
            .currentPaths(new ArrayList<>(currentPaths))
            .detail(outcome.getReason())
            .build();
    }

    static ReplayClassification classify(Bundle original, ExecutionOutcome outcome,
                                         Set<String> originalPaths, Set<String> currentPaths) {
        if (outcome.getStatus() == ExecutionOutcome.Status.ERROR
            || outcome.getStatus() == ExecutionOutcome.Status.TRUNCATED) {
            return ReplayClassification.ERROR;
        }
        // КРИТИЧНО: недоступность цели при replay не считается новым расхождением
        if (hasTransportMismatch(outcome.getMismatches()) && !hasTransportMismatch(original.getMismatches())) {
            return ReplayClassification.ERROR;
        }
        if (currentPaths.isEmpty()) {
            return ReplayClassification.FIXED;
        }
        return originalPaths.containsAll(currentPaths)
            ? ReplayClassification.PERSISTENT
            : ReplayClassification.DIFFERENT;
    }

    static Set<String> failingPaths(BundleKind kind, int step, List<Mismatch> mismatches) {
        Set<String> paths = new LinkedHashSet<>();
        if (mismatches == null) {
            return paths;
        }
        for (Mismatch mismatch : mismatches) {
            String path = JsonPathPattern.generalize(mismatch.getPath());
            paths.add(kind == BundleKind.CHAIN ? "step " + step + ": " + path : path);
        }
        return paths;
    }

    private static boolean hasTransportMismatch(List<Mismatch> mismatches) {
        return mismatches != null && mismatches.stream().anyMatch(m -> ResponseComparator.TRANSPORT_PATH.equals(m.getPath()));
    }

    private static String directoryFor(ReplayClassification classification) {
        return switch (classification) {
            case FIXED -> BundleFiles.FIXED_DIR;
            case ERROR -> BundleFiles.ERRORS_DIR;
            default -> BundleFiles.MISMATCHES_DIR;
        };
    }
}

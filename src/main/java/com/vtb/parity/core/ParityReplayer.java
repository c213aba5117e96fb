package com.vtb.parity.core;

import com.vtb.parity.bundle.BundleLoader;
import com.vtb.parity.bundle.ReplayEngine;
import com.vtb.parity.bundle.ReplayOutcome;
import com.vtb.parity.models.Bundle;
import com.vtb.parity.reports.ReplaySummary;
import com.vtb.parity.reports.SummaryWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Прогон replay: все найденные бандлы повторяются против текущих целей
 */
@Slf4j
public class ParityReplayer {

    private final ParityRuntime runtime;

    public ParityReplayer(ParityRuntime runtime) {
        this.runtime = runtime;
    }

    public ReplaySummary replay(Path input, Path outputDirectory) throws IOException {
        if (input.toAbsolutePath().normalize().equals(outputDirectory.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("--out должен отличаться от --in: replay не перезаписывает исходные бандлы");
        }
        BundleLoader.Discovery discovery = new BundleLoader().discover(input);
        Files.createDirectories(outputDirectory);
        ReplayEngine engine = new ReplayEngine(runtime.getRunner(), runtime.getBundleWriter(), runtime.metadata(null));

        List<ReplayOutcome> results = new ArrayList<>();
        int still = 0;
        int fixed = 0;
        int different = 0;
        int errors = 0;
        for (Bundle bundle : discovery.getBundles()) {
            ReplayOutcome outcome = engine.replay(bundle, outputDirectory);
            results.add(outcome);
            switch (outcome.getClassification()) {
                case PERSISTENT -> still++;
                case FIXED -> fixed++;
                case DIFFERENT -> different++;
                case ERROR -> errors++;
            }
        }

        ReplaySummary summary = ReplaySummary.builder()
            .toolVersion(ParityRuntime.TOOL_VERSION)
            .input(input.toString())
            .targetA(runtime.getExecutor().getTargetA().getBaseUrl())
            .targetB(runtime.getExecutor().getTargetB().getBaseUrl())
            .totalBundles(discovery.getBundles().size())
            .stillMismatch(still)
            .nowMatch(fixed)
            .differentMismatch(different)
            .errors(errors)
            .skipped(discovery.getSkipped())
            .corrupted(discovery.getCorrupted())
            .results(results)
            .build();
        new SummaryWriter().write(summary, outputDirectory);
        log.info("Replay завершён: {} бандлов, сохраняется {}, исправлено {}, иное {}, ошибок {}",
            results.size(), still, fixed, different, errors);
        return summary;
    }
}

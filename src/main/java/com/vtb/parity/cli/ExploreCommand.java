package com.vtb.parity.cli;

import com.vtb.parity.config.ParityConfig;
import com.vtb.parity.core.ParityExplorer;
import com.vtb.parity.core.ParityRuntime;
import com.vtb.parity.core.SpecificationModel;
import com.vtb.parity.reports.ExploreSummary;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Slf4j
@Command(
    name = "explore",
    mixinStandardHelpOptions = true,
    description = "Сгенерировать кейсы и цепочки, выполнить против обеих целей, сохранить расхождения"
)
public class ExploreCommand implements Callable<Integer> {

    @Mixin
    private SpecOptions specOptions;

    @Mixin
    private RunOptions runOptions;

    @Option(
        names = {"-o", "--out"},
        description = "Каталог результатов (по умолчанию: ./parity-out)"
    )
    private Path outputDir = Path.of("parity-out");

    @Option(names = {"--seed"}, description = "Зерно генерации")
    private Long seed;

    @Option(names = {"--cases"}, description = "Кейсов на операцию")
    private Integer casesPerOperation;

    @Option(names = {"--max-depth"}, description = "Максимальная длина цепочки")
    private Integer maxDepth;

    @Option(names = {"--max-chains"}, description = "Максимум цепочек")
    private Integer maxChains;

    @Option(names = {"--no-chains"}, description = "Только одиночные кейсы")
    private boolean noChains;

    @Option(names = {"--skip-preflight"}, description = "Не проверять доступность целей перед запуском")
    private boolean skipPreflight;

    @Option(names = {"--fail-on-mismatch"}, description = "Код выхода 1 при найденных расхождениях (для CI/CD)")
    private boolean failOnMismatch;

    @Override
    public Integer call() throws Exception {
        ParityConfig config = runOptions.loadConfig();
        applyOverrides(config);
        SpecificationModel specification = specOptions.loadSpecification();

        try (ParityRuntime runtime = runOptions.openRuntime(config)) {
            if (!skipPreflight) {
                runtime.checkTargets();
            }
            runtime.startEvaluator();
            ExploreSummary summary = new ParityExplorer(runtime).explore(specification, outputDir);
            printSummary(summary);
            return failOnMismatch && summary.getMismatches() > 0 ? MainCommand.EXIT_MISMATCHES : MainCommand.EXIT_OK;
        }
    }

    private void applyOverrides(ParityConfig config) {
        if (seed != null) {
            config.getGeneration().setSeed(seed);
        }
        if (casesPerOperation != null) {
            config.getGeneration().setCasesPerOperation(casesPerOperation);
        }
        if (maxDepth != null) {
            config.getChains().setMaxDepth(maxDepth);
        }
        if (maxChains != null) {
            config.getChains().setMaxChains(maxChains);
        }
        if (noChains) {
            config.getChains().setEnabled(false);
        }
        config.ensureDefaults();
    }

    private void printSummary(ExploreSummary summary) {
        System.out.println();
        System.out.println("Кейсов:      " + summary.getTotalCases());
        System.out.println("Цепочек:     " + summary.getTotalChains());
        System.out.println("Совпадений:  " + summary.getMatches());
        System.out.println("Расхождений: " + summary.getMismatches());
        System.out.println("Ошибок:      " + summary.getErrors());
        if (summary.getTruncated() > 0) {
            System.out.println("Оборвано:    " + summary.getTruncated());
        }
        summary.getNotices().forEach(notice -> System.out.println("  ! " + notice));
        System.out.println("Результаты:  " + outputDir.toAbsolutePath());
    }
}

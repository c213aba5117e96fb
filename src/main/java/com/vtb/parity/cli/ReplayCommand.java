package com.vtb.parity.cli;

import com.vtb.parity.config.ParityConfig;
import com.vtb.parity.core.ParityReplayer;
import com.vtb.parity.core.ParityRuntime;
import com.vtb.parity.reports.ReplaySummary;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "replay",
    mixinStandardHelpOptions = true,
    description = "Повторить сохранённые бандлы против текущих целей и классифицировать результат"
)
public class ReplayCommand implements Callable<Integer> {

    @Mixin
    private RunOptions runOptions;

    @Option(names = {"-i", "--in"}, required = true, description = "Каталог результатов предыдущего запуска")
    private Path inputDir;

    @Option(names = {"-o", "--out"}, required = true, description = "Новый каталог для результатов replay")
    private Path outputDir;

    @Option(names = {"--fail-on-mismatch"}, description = "Код выхода 1, если расхождения сохраняются")
    private boolean failOnMismatch;

    @Override
    public Integer call() throws Exception {
        ParityConfig config = runOptions.loadConfig();
        try (ParityRuntime runtime = runOptions.openRuntime(config)) {
            runtime.startEvaluator();
            ReplaySummary summary = new ParityReplayer(runtime).replay(inputDir, outputDir);
            System.out.println();
            System.out.println("Бандлов:             " + summary.getTotalBundles());
            System.out.println("Сохраняются:         " + summary.getStillMismatch());
            System.out.println("Исправлены:          " + summary.getNowMatch());
            System.out.println("Другое расхождение:  " + summary.getDifferentMismatch());
            System.out.println("Ошибки выполнения:   " + summary.getErrors());
            if (summary.getSkipped() > 0 || !summary.getCorrupted().isEmpty()) {
                System.out.println("Пропущено каталогов: " + summary.getSkipped()
                    + ", повреждено: " + summary.getCorrupted().size());
            }
            boolean remaining = summary.getStillMismatch() + summary.getDifferentMismatch() > 0;
            return failOnMismatch && remaining ? MainCommand.EXIT_MISMATCHES : MainCommand.EXIT_OK;
        }
    }
}

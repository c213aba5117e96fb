package com.vtb.parity.cli;

import com.vtb.parity.bundle.BundleFiles;
import com.vtb.parity.core.OpenAPIParser;
import com.vtb.parity.lint.LintMessage;
import com.vtb.parity.lint.LintResult;
import com.vtb.parity.lint.SpecLinter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "lint-spec",
    mixinStandardHelpOptions = true,
    description = "Проверить спецификацию на проблемы, мешающие explore: links, схемы ответов, глубина цепочек"
)
public class LintSpecCommand implements Callable<Integer> {

    enum OutputFormat { text, json }

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-s", "--spec"},
        required = true,
        description = "Путь к файлу OpenAPI спецификации (YAML/JSON) или URL"
    )
    private String specificationPath;

    @Option(names = {"--output"}, description = "Формат вывода: ${COMPLETION-CANDIDATES} (по умолчанию: text)")
    private OutputFormat output = OutputFormat.text;

    @Override
    public Integer call() throws Exception {
        OpenAPIParser parser = new OpenAPIParser();
        parser.parse(specificationPath);
        boolean remote = specificationPath.startsWith("http://") || specificationPath.startsWith("https://");
        LintResult result = new SpecLinter(parser.getOpenAPI(), parser.buildModel(),
            remote ? null : Path.of(specificationPath)).lint();

        PrintWriter out = spec.commandLine().getOut();
        if (output == OutputFormat.json) {
            out.println(BundleFiles.mapper().writeValueAsString(result));
        } else {
            print(result, out);
        }
        out.flush();
        return result.hasErrors() ? MainCommand.EXIT_LINT_ERRORS : MainCommand.EXIT_OK;
    }

    private static void print(LintResult result, PrintWriter out) {
        LintResult.Summary summary = result.getSummary();
        out.println("Проверка спецификации");
        out.println("Операций: " + summary.getTotalOperations());
        out.println("Операций с links: " + summary.getOperationsWithLinks());
        out.println("Операций со схемой ответа: " + summary.getOperationsWithResponseSchemas());

        LintResult.ChainDepth depth = result.getChainDepth();
        if (depth.getDepth1() + depth.getDepth2() + depth.getDepth3() + depth.getDepth4Plus() > 0) {
            out.println();
            out.println("Глубина цепочек:");
            out.println("  1 (старт):    " + depth.getDepth1());
            out.println("  2:            " + depth.getDepth2());
            out.println("  3:            " + depth.getDepth3());
            out.println("  4+:           " + depth.getDepth4Plus());
            out.println("  недостижимо:  " + depth.getUnreachable());
        }

        section(out, "ОШИБКИ", result.getErrors());
        section(out, "ПРЕДУПРЕЖДЕНИЯ", result.getWarnings());
        section(out, "ЗАМЕЧАНИЯ", result.getInfo());

        out.println();
        if (result.hasErrors()) {
            out.println("Результат: FAIL (есть ошибки)");
        } else if (!result.getWarnings().isEmpty()) {
            out.println("Результат: PASS (с предупреждениями)");
        } else {
            out.println("Результат: PASS");
        }
    }

    private static void section(PrintWriter out, String title, List<LintMessage> messages) {
        if (messages.isEmpty()) {
            return;
        }
        out.println();
        out.println(title + " (" + messages.size() + ")");
        messages.forEach(message -> out.println("  " + message.describe()));
    }
}

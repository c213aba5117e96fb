package com.vtb.parity.cli;

import com.vtb.parity.comparator.ExpressionLibrary;
import com.vtb.parity.config.ComparisonRulesLoader;
import com.vtb.parity.config.ParityConfig;
import com.vtb.parity.core.ParityRuntime;
import com.vtb.parity.models.ComparisonRuleSet;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Общие опции команд, работающих с целями
 */
public class RunOptions {

    @Option(
        names = {"-c", "--config"},
        description = "YAML с настройками, перекрывающими значения по умолчанию"
    )
    Path configPath;

    @Option(
        names = {"-r", "--rules"},
        description = "Файл правил сравнения (JSON/YAML). Без него используется точное сравнение"
    )
    Path rulesPath;

    @Option(
        names = {"-a", "--target-a"},
        description = "Цель A: имя из секции targets или base URL (по умолчанию: a)"
    )
    String targetA = "a";

    @Option(
        names = {"-b", "--target-b"},
        description = "Цель B: имя из секции targets или base URL (по умолчанию: b)"
    )
    String targetB = "b";

    ParityConfig loadConfig() {
        return ParityConfig.load(configPath);
    }

    ParityRuntime openRuntime(ParityConfig config) {
        ComparisonRuleSet rules = new ComparisonRulesLoader(ExpressionLibrary.loadDefault()).load(rulesPath);
        return new ParityRuntime(config, rules,
            rulesPath != null ? rulesPath.toString() : "default",
            config.resolveTarget(targetA),
            config.resolveTarget(targetB));
    }
}

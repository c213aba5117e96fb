package com.vtb.parity.cli;

import com.vtb.parity.config.ConfigException;
import com.vtb.parity.evaluator.BridgeUnavailableException;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Главная CLI команда дифференциального тестирования API
 */
@Slf4j
@Command(
    name = "api-parity",
    mixinStandardHelpOptions = true,
    version = "API Parity 1.0.0",
    subcommands = {
        ExploreCommand.class,
        ReplayCommand.class,
        ListOperationsCommand.class,
        GraphChainsCommand.class,
        LintSpecCommand.class
    },
    description = """

        API Parity

        Дифференциальное тестирование двух реализаций одного OpenAPI контракта

        Возможности:
          • Генерация кейсов и цепочек запросов по схемам и links
          • Параллельное выполнение против целей A и B
          • Сравнение ответов по настраиваемым правилам
          • Бандлы расхождений и их повторное воспроизведение
          • Проверка спецификации на проблемы с links (lint-spec)

        """
)
public class MainCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_MISMATCHES = 1;
    static final int EXIT_LINT_ERRORS = 1;
    static final int EXIT_CONFIG = 2;
    static final int EXIT_BRIDGE = 3;

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand())
            .setExecutionExceptionHandler(MainCommand::handleExecutionException)
            .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(System.out);
        return EXIT_OK;
    }

    /**
     * Ошибки конфигурации и отказ вычислителя: сообщение без стектрейса и отдельный код выхода
     */
    static int handleExecutionException(Exception e, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        if (e instanceof ConfigException) {
            log.error("Ошибка конфигурации: {}", e.getMessage());
            commandLine.getErr().println("Ошибка конфигурации: " + e.getMessage());
            return EXIT_CONFIG;
        }
        if (e instanceof BridgeUnavailableException) {
            log.error("Вычислитель выражений недоступен, прогон прерван: {}", e.getMessage());
            commandLine.getErr().println("Вычислитель выражений недоступен: " + e.getMessage());
            return EXIT_BRIDGE;
        }
        if (e instanceof IllegalArgumentException) {
            commandLine.getErr().println(e.getMessage());
            return EXIT_CONFIG;
        }
        log.error("Ошибка выполнения команды", e);
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}

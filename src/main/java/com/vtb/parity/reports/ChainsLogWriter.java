package com.vtb.parity.reports;

import com.vtb.parity.dynamic.ExecutionOutcome;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * chains.txt: по строке на выполненную цепочку с итогом
 */
@Slf4j
public class ChainsLogWriter {

    public static final String FILE = "chains.txt";

    private final List<String> lines = new ArrayList<>();

    public synchronized void record(ExecutionOutcome outcome) {
        if (!outcome.isChain()) {
            return;
        }
        StringBuilder line = new StringBuilder()
            .append(String.format("%-9s", outcome.getStatus()))
            .append(' ')
            .append(outcome.getChain().sequenceKey())
            .append("  [шагов ")
            .append(outcome.executedSteps())
            .append('/')
            .append(outcome.getChain().length())
            .append(']');
        if (outcome.getStatus() == ExecutionOutcome.Status.MISMATCH) {
            line.append(" расхождение на шаге ").append(outcome.getMismatchStep());
        }
        if (outcome.getReason() != null) {
            line.append(" (").append(outcome.getReason()).append(')');
        }
        lines.add(line.toString());
    }

    public synchronized List<String> getLines() {
        return new ArrayList<>(lines);
    }

    public Path write(Path outputDirectory) throws IOException {
        Path target = outputDirectory.resolve(FILE);
        Files.createDirectories(outputDirectory);
        List<String> snapshot = getLines();
        Files.write(target, snapshot, StandardCharsets.UTF_8);
        log.info("Журнал цепочек: {} ({} строк)", target, snapshot.size());
        return target;
    }
}

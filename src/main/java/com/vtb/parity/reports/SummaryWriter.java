package com.vtb.parity.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.parity.bundle.BundleFiles;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Запись итогов запуска в JSON
 */
@Slf4j
public class SummaryWriter {

    public static final String EXPLORE_FILE = "summary.json";
    public static final String REPLAY_FILE = "replay_summary.json";

    private final ObjectMapper objectMapper = BundleFiles.mapper();

    public Path write(ExploreSummary summary, Path outputDirectory) throws IOException {
        return write((Object) summary, outputDirectory.resolve(EXPLORE_FILE));
    }

    public Path write(ReplaySummary summary, Path outputDirectory) throws IOException {
        return write((Object) summary, outputDirectory.resolve(REPLAY_FILE));
    }

    private Path write(Object summary, Path outputPath) throws IOException {
        // КРИТИЧНО: итог пишется всегда, даже если часть цепочек оборвалась
        if (summary == null) {
            throw new IllegalArgumentException("Итоги не могут быть null");
        }
        log.info("Запись итогов: {}", outputPath);
        BundleFiles.writeAtomically(objectMapper, outputPath, summary);
        log.info("Итоги сохранены: {} ({} байт)", outputPath, Files.size(outputPath));
        return outputPath;
    }
}

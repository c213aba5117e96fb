package com.vtb.parity.bundle;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.parity.models.Bundle;
import com.vtb.parity.models.BundleKind;
import com.vtb.parity.models.BundleMetadata;
import com.vtb.parity.models.Chain;
import com.vtb.parity.models.RequestCase;
import com.vtb.parity.models.StepExecution;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Обнаружение и чтение бандлов для replay.
 *
 * Если во входном каталоге есть подкаталог mismatches, просматривается он, иначе сам каталог.
 * Каталоги без case.json/chain.json пропускаются; повреждённые бандлы пропускаются и учитываются.
 */
@Slf4j
public class BundleLoader {

    private static final TypeReference<List<StepExecution>> EXECUTIONS = new TypeReference<>() {
    };

    private final ObjectMapper mapper = BundleFiles.mapper();

    @Value
    public static class Discovery {
        List<Bundle> bundles;
        /** Каталоги без описания кейса/цепочки */
        int skipped;
        /** Бандлы с описанием, но без обязательных файлов или с некорректным JSON */
        List<String> corrupted;
    }

    public Discovery discover(Path input) throws IOException {
        if (!Files.isDirectory(input)) {
            throw new IOException("Каталог не найден: " + input);
        }
        List<Bundle> bundles = new ArrayList<>();
        List<String> corrupted = new ArrayList<>();
        int skipped = 0;

        if (BundleFiles.hasDescriptor(input)) {
            try {
                bundles.add(load(input));
            } catch (BundleCorruptionException e) {
                log.warn("Повреждённый бандл пропущен: {} ({})", e.getLocation(), e.getMessage());
                corrupted.add(input.toString());
            }
            return new Discovery(bundles, 0, corrupted);
        }

        Path root = Files.isDirectory(input.resolve(BundleFiles.MISMATCHES_DIR))
            ? input.resolve(BundleFiles.MISMATCHES_DIR)
            : input;
        List<Path> candidates;
        try (Stream<Path> list = Files.list(root)) {
            candidates = list.filter(Files::isDirectory)
                .filter(path -> !path.getFileName().toString().startsWith("."))
                .sorted()
                .collect(Collectors.toList());
        }
        for (Path candidate : candidates) {
            if (!BundleFiles.hasDescriptor(candidate)) {
                log.debug("Пропуск {}: нет {} или {}", candidate, BundleFiles.CASE_FILE, BundleFiles.CHAIN_FILE);
                skipped++;
                continue;
            }
            try {
                bundles.add(load(candidate));
            } catch (BundleCorruptionException e) {
                log.warn("Повреждённый бандл пропущен: {} ({})", e.getLocation(), e.getMessage());
                corrupted.add(candidate.toString());
            }
        }
        log.info("Найдено бандлов: {} в {} (пропущено каталогов: {}, повреждено: {})",
            bundles.size(), root, skipped, corrupted.size());
        return new Discovery(bundles, skipped, corrupted);
    }

    public Bundle load(Path directory) {
        Path diffFile = directory.resolve(BundleFiles.DIFF_FILE);
        if (!Files.isRegularFile(diffFile)) {
            throw new BundleCorruptionException(directory, "отсутствует " + BundleFiles.DIFF_FILE);
        }
        try {
            DiffDocument diff = mapper.readValue(diffFile.toFile(), DiffDocument.class);
            Path chainFile = directory.resolve(BundleFiles.CHAIN_FILE);
            boolean isChain = Files.isRegularFile(chainFile);
            Bundle.BundleBuilder bundle = Bundle.builder()
                .kind(isChain ? BundleKind.CHAIN : BundleKind.CASE)
                .reproductionKey(diff.getReproductionKey())
                .mismatches(diff.getMismatches() != null ? diff.getMismatches() : new ArrayList<>())
                .mismatchStep(diff.getMismatchStep())
                .targetA(readExecutions(directory.resolve(BundleFiles.TARGET_A_FILE)))
                .targetB(readExecutions(directory.resolve(BundleFiles.TARGET_B_FILE)))
                .location(directory);
            if (isChain) {
                Chain chain = mapper.readValue(chainFile.toFile(), Chain.class);
                if (chain.getSteps() == null || chain.getSteps().isEmpty()) {
                    throw new BundleCorruptionException(directory, "цепочка без шагов");
                }
                bundle.chain(chain);
            } else {
                bundle.requestCase(mapper.readValue(directory.resolve(BundleFiles.CASE_FILE).toFile(), RequestCase.class));
            }
            Path metadataFile = directory.resolve(BundleFiles.METADATA_FILE);
            if (Files.isRegularFile(metadataFile)) {
                bundle.metadata(mapper.readValue(metadataFile.toFile(), BundleMetadata.class));
            }
            return bundle.build();
        } catch (IOException e) {
            throw new BundleCorruptionException(directory, "ошибка чтения: " + e.getMessage(), e);
        }
    }

    private List<StepExecution> readExecutions(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            return new ArrayList<>();
        }
        return mapper.readValue(file.toFile(), EXECUTIONS);
    }
}

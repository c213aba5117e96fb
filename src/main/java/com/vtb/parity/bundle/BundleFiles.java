package com.vtb.parity.bundle;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Раскладка каталога бандла и общий ObjectMapper
 */
public final class BundleFiles {

    public static final String MISMATCHES_DIR = "mismatches";
    public static final String FIXED_DIR = "fixed";
    public static final String ERRORS_DIR = "errors";

    public static final String CASE_FILE = "case.json";
    public static final String CHAIN_FILE = "chain.json";
    public static final String TARGET_A_FILE = "target_a.json";
    public static final String TARGET_B_FILE = "target_b.json";
    public static final String DIFF_FILE = "diff.json";
    public static final String METADATA_FILE = "metadata.json";

    private BundleFiles() {
    }

    public static ObjectMapper mapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public static boolean hasDescriptor(Path directory) {
        return Files.isRegularFile(directory.resolve(CASE_FILE)) || Files.isRegularFile(directory.resolve(CHAIN_FILE));
    }

    /**
     * Запись через временный файл в том же каталоге и перемещение поверх целевого
     */
    public static void writeAtomically(ObjectMapper mapper, Path target, Object value) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, "." + target.getFileName(), ".tmp");
        try {
            mapper.writeValue(temp.toFile(), value);
            move(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}

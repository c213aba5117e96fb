package com.vtb.parity.bundle;

import java.nio.file.Path;

/**
 * Бандл не читается: нет дескриптора или файлы повреждены.
 * При поиске бандлов такие каталоги пропускаются и учитываются в статистике.
 */
public class BundleCorruptionException extends RuntimeException {

    private final Path location;

    public BundleCorruptionException(Path location, String message) {
        super(message + ": " + location);
        this.location = location;
    }

    public BundleCorruptionException(Path location, String message, Throwable cause) {
        super(message + ": " + location, cause);
        this.location = location;
    }

    public Path getLocation() {
        return location;
    }
}

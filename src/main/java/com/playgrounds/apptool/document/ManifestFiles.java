package com.playgrounds.apptool.document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * UTF-8 text I/O for manifests and the files scaffolded next to them.
 */
public final class ManifestFiles {

    private ManifestFiles() {
    }

    public static String readText(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    /**
     * Writes {@code text} to a sibling temporary file and moves it over {@code target}, so a
     * reader sees either the old or the new content.
     */
    public static void writeText(Path target, String text) throws IOException {
        Path tmpFile = target.resolveSibling(target.getFileName().toString() + ".tmp");
        Files.writeString(tmpFile, text, StandardCharsets.UTF_8);
        try {
            Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(tmpFile);
            throw e;
        }
    }
}

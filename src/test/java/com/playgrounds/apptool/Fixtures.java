package com.playgrounds.apptool;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads the manifests under {@code src/test/resources/manifests}.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static String manifest(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/manifests/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String playground() {
        return manifest("playground.swift");
    }
}

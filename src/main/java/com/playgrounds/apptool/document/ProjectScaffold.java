package com.playgrounds.apptool.document;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Files and directories that accompany a manifest edit.
 */
public final class ProjectScaffold {

    private static final Logger LOG = Logger.getLogger(ProjectScaffold.class.getName());

    static final String INFO_PLIST_TEMPLATE = "/templates/Info.plist";

    private final Path projectDirectory;

    public ProjectScaffold(Path projectDirectory) {
        this.projectDirectory = projectDirectory;
    }

    /**
     * @return {@code true} if the directory had to be created
     */
    public boolean createResourcesDirectory(String name) throws IOException {
        Path directory = projectDirectory.resolve(checkRelative(name));
        if (Files.isDirectory(directory)) {
            return false;
        }
        Files.createDirectories(directory);
        LOG.info(() -> "Created " + directory);
        return true;
    }

    /**
     * Writes the bundled Info.plist template to {@code fileName} unless that file exists.
     *
     * @return {@code true} if the file was written
     */
    public boolean createInfoPlist(String fileName) throws IOException {
        Path file = projectDirectory.resolve(checkRelative(fileName));
        if (Files.exists(file)) {
            LOG.fine(() -> file + " already exists");
            return false;
        }
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        ManifestFiles.writeText(file, infoPlistTemplate());
        LOG.info(() -> "Created " + file);
        return true;
    }

    /**
     * Normalizes a path given relative to the project directory.
     *
     * @throws IllegalArgumentException if the path is absolute or leads out of the project directory
     */
    public static Path checkRelative(String name) {
        Path path = Path.of(name).normalize();
        if (path.isAbsolute() || path.startsWith("..") || path.toString().isEmpty()) {
            throw new IllegalArgumentException("'" + name + "' is not a path inside the project directory.");
        }
        return path;
    }

    static String infoPlistTemplate() throws IOException {
        try (InputStream in = ProjectScaffold.class.getResourceAsStream(INFO_PLIST_TEMPLATE)) {
            if (in == null) {
                throw new IOException("Missing resource " + INFO_PLIST_TEMPLATE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    public Path projectDirectory() {
        return projectDirectory;
    }
}

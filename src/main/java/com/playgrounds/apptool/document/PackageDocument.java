package com.playgrounds.apptool.document;

import com.playgrounds.apptool.editor.EditResult;
import com.playgrounds.apptool.editor.TargetNotFoundException;
import com.playgrounds.apptool.syntax.ManifestParser;
import com.playgrounds.apptool.syntax.SourceFile;
import com.playgrounds.apptool.syntax.SyntaxPrinter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * A manifest loaded from disk: its path, the text it was loaded with and the current tree.
 * Instances are immutable; {@link #apply} and {@link #save} return new documents.
 */
public final class PackageDocument {

    private static final Logger LOG = Logger.getLogger(PackageDocument.class.getName());

    public static final String MANIFEST_FILE_NAME = "Package.swift";

    private final Path path;
    private final String sourceText;
    private final SourceFile tree;

    private PackageDocument(Path path, String sourceText, SourceFile tree) {
        this.path = path;
        this.sourceText = sourceText;
        this.tree = tree;
    }

    /**
     * Loads {@code location}, which is either a manifest file or a project directory holding
     * {@value #MANIFEST_FILE_NAME}.
     *
     * @throws NoSuchFileException if there is no manifest at {@code location}
     */
    public static PackageDocument load(Path location) throws IOException {
        Path manifest = resolve(location);
        String text = ManifestFiles.readText(manifest);
        LOG.info(() -> "Loaded " + manifest + " (" + text.length() + " characters)");
        return parse(manifest, text);
    }

    public static PackageDocument parse(Path path, String text) {
        return new PackageDocument(path, text, ManifestParser.parse(text));
    }

    static Path resolve(Path location) throws NoSuchFileException {
        Path manifest = Files.isDirectory(location) ? location.resolve(MANIFEST_FILE_NAME) : location;
        if (!Files.isRegularFile(manifest)) {
            throw new NoSuchFileException(manifest.toString(), null, "No " + MANIFEST_FILE_NAME + " found");
        }
        return manifest;
    }

    /**
     * Runs an editor write against the current tree.
     *
     * @throws TargetNotFoundException if the editor could not find what it edits; this
     *                                 document is unaffected
     */
    public PackageDocument apply(Function<SourceFile, EditResult> edit) throws TargetNotFoundException {
        SourceFile updated = edit.apply(tree).treeOrThrow();
        return updated == tree ? this : new PackageDocument(path, sourceText, updated);
    }

    public <T> T read(Function<SourceFile, T> reader) {
        return reader.apply(tree);
    }

    public String text() {
        return SyntaxPrinter.print(tree);
    }

    public boolean isModified() {
        return !text().equals(sourceText);
    }

    /**
     * Writes the current text back to {@link #path()} when it differs from what was loaded.
     */
    public PackageDocument save() throws IOException {
        if (!isModified()) {
            LOG.fine(() -> "No changes to write to " + path);
            return this;
        }
        String text = text();
        ManifestFiles.writeText(path, text);
        LOG.info(() -> "Saved " + path);
        return new PackageDocument(path, text, tree);
    }

    public Path path() {
        return path;
    }

    public Path projectDirectory() {
        Path parent = path.toAbsolutePath().getParent();
        return parent != null ? parent : path.toAbsolutePath();
    }

    public SourceFile tree() {
        return tree;
    }

    public String sourceText() {
        return sourceText;
    }
}

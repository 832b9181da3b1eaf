package com.playgrounds.apptool.cli;

import com.playgrounds.apptool.document.PackageDocument;
import com.playgrounds.apptool.editor.EditResult;
import com.playgrounds.apptool.editor.ManifestEditException;
import com.playgrounds.apptool.match.AmbiguousArgumentException;
import com.playgrounds.apptool.syntax.SourceFile;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Base of the leaf commands: opens the manifest, runs one edit or read, and maps failures to
 * exit codes.
 */
abstract class ManifestCommand implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_NOT_FOUND = 1;
    static final int EXIT_INVALID_ARGUMENT = 2;
    static final int EXIT_IO = 3;

    @Mixin
    ProjectOptions options;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        try {
            run();
            return EXIT_OK;
        } catch (ManifestEditException | AmbiguousArgumentException e) {
            return fail(EXIT_NOT_FOUND, e.getMessage());
        } catch (IllegalArgumentException e) {
            return fail(EXIT_INVALID_ARGUMENT, e.getMessage());
        } catch (IOException e) {
            return fail(EXIT_IO, e.getMessage());
        }
    }

    protected abstract void run() throws IOException, ManifestEditException;

    protected PackageDocument load() throws IOException {
        return PackageDocument.load(options.project);
    }

    /**
     * Applies {@code edit} to the manifest and saves it when the text changed.
     *
     * @return the saved document
     */
    protected PackageDocument edit(Function<SourceFile, EditResult> edit) throws IOException, ManifestEditException {
        PackageDocument document = load().apply(edit);
        boolean modified = document.isModified();
        PackageDocument saved = document.save();
        if (!modified) {
            out().println("Package.swift is already up to date.");
        }
        return saved;
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    private int fail(int exitCode, String message) {
        PrintWriter err = spec.commandLine().getErr();
        err.println("Error: " + message);
        err.flush();
        return exitCode;
    }
}

package com.playgrounds.apptool.cli;

import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options shared by every command that opens a manifest.
 */
public class ProjectOptions {
    @Option(names = {"-p", "--project"}, defaultValue = ".",
            description = "Playground directory or its Package.swift (default: ${DEFAULT-VALUE})")
    Path project;

    @Option(names = {"-t", "--target"}, defaultValue = "AppModule",
            description = "Build target to edit (default: ${DEFAULT-VALUE})")
    String target;
}

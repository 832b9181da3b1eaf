package com.playgrounds.apptool.cli;

import com.playgrounds.apptool.editor.ManifestEditException;
import com.playgrounds.apptool.editor.Platform;
import com.playgrounds.apptool.editor.PlatformEditor;
import com.playgrounds.apptool.output.ReportFormatter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;

@Command(name = "platform", description = "Manage the minimum platform versions of the package",
         subcommands = {PlatformCommand.ListPlatforms.class, PlatformCommand.SetPlatform.class,
                        PlatformCommand.RemovePlatform.class})
public class PlatformCommand {

    @Command(name = "list", description = "Print the declared platforms")
    static class ListPlatforms extends ManifestCommand {
        @Option(names = "--json", description = "Print JSON instead of text")
        boolean json;

        @Override
        protected void run() throws IOException {
            PlatformEditor editor = new PlatformEditor();
            out().println(new ReportFormatter(json).formatPlatforms(load().read(editor::platforms)));
        }
    }

    @Command(name = "set", description = "Set the minimum version of a platform")
    static class SetPlatform extends ManifestCommand {
        @Parameters(index = "0", description = "Minimum version, e.g. 17.0")
        String version;

        @Option(names = "--platform", defaultValue = "iOS",
                description = "iOS, macOS, macCatalyst, tvOS, watchOS, visionOS or driverKit (default: ${DEFAULT-VALUE})")
        String platformName;

        @Override
        protected void run() throws IOException, ManifestEditException {
            Platform platform = Platform.fromName(platformName);
            PlatformEditor editor = new PlatformEditor();
            edit(tree -> editor.setMinimum(tree, platform, version));
            out().println("Minimum " + platform.swiftName() + " version is " + version + ".");
        }
    }

    @Command(name = "remove", description = "Remove a platform from the package")
    static class RemovePlatform extends ManifestCommand {
        @Parameters(index = "0", description = "Platform name, e.g. macOS")
        String platformName;

        @Override
        protected void run() throws IOException, ManifestEditException {
            Platform platform = Platform.fromName(platformName);
            PlatformEditor editor = new PlatformEditor();
            edit(tree -> editor.remove(tree, platform));
            out().println("Removed " + platform.swiftName() + " from platforms.");
        }
    }
}

package com.playgrounds.apptool.cli;

import com.playgrounds.apptool.document.PackageDocument;
import com.playgrounds.apptool.editor.ManifestEditException;
import com.playgrounds.apptool.editor.SwiftVersionEditor;
import com.playgrounds.apptool.output.ReportFormatter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;

@Command(name = "swift-version", description = "Manage the Swift language version of the package",
         subcommands = {SwiftVersionCommand.GetSwiftVersion.class, SwiftVersionCommand.SetSwiftVersion.class,
                        SwiftVersionCommand.RemoveSwiftVersion.class})
public class SwiftVersionCommand {

    @Command(name = "get", description = "Print the language and tools versions")
    static class GetSwiftVersion extends ManifestCommand {
        @Option(names = "--json", description = "Print JSON instead of text")
        boolean json;

        @Override
        protected void run() throws IOException {
            SwiftVersionEditor editor = new SwiftVersionEditor();
            PackageDocument document = load();
            out().println(new ReportFormatter(json).formatSwiftVersion(
                    document.read(editor::read), document.read(editor::toolsVersion)));
        }
    }

    @Command(name = "set", description = "Set the Swift language version and the matching tools version")
    static class SetSwiftVersion extends ManifestCommand {
        @Parameters(index = "0", description = "Swift version, e.g. 6 or 5.9")
        String version;

        @Override
        protected void run() throws IOException, ManifestEditException {
            SwiftVersionEditor editor = new SwiftVersionEditor();
            edit(tree -> editor.set(tree, version));
            out().println("Swift language version is " + version + ".");
        }
    }

    @Command(name = "remove", description = "Remove the Swift language version requirement")
    static class RemoveSwiftVersion extends ManifestCommand {
        @Override
        protected void run() throws IOException, ManifestEditException {
            SwiftVersionEditor editor = new SwiftVersionEditor();
            edit(editor::remove);
            out().println("Removed the Swift language version requirement.");
        }
    }
}

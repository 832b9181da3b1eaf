package com.playgrounds.apptool.cli;

import com.playgrounds.apptool.document.PackageDocument;
import com.playgrounds.apptool.document.ProjectScaffold;
import com.playgrounds.apptool.editor.InfoPlistEditor;
import com.playgrounds.apptool.editor.ManifestEditException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;

@Command(name = "info-plist", description = "Manage the additional Info.plist of the app product",
         subcommands = {InfoPlistCommand.InitInfoPlist.class, InfoPlistCommand.RemoveInfoPlist.class})
public class InfoPlistCommand {

    @Command(name = "init", description = "Link an Info.plist to the app product and create it from a template")
    static class InitInfoPlist extends ManifestCommand {
        @Option(names = {"-f", "--file"}, defaultValue = "Info.plist",
                description = "File relative to the project (default: ${DEFAULT-VALUE})")
        String fileName;

        @Override
        protected void run() throws IOException, ManifestEditException {
            ProjectScaffold.checkRelative(fileName);
            InfoPlistEditor editor = new InfoPlistEditor();
            PackageDocument document = edit(tree -> editor.link(tree, fileName));
            String linked = document.read(editor::linkedFile).orElse(fileName);
            if (new ProjectScaffold(document.projectDirectory()).createInfoPlist(linked)) {
                out().println("Created " + linked + ".");
            }
            out().println("App product reads additional Info.plist content from " + linked + ".");
        }
    }

    @Command(name = "remove", description = "Unlink the Info.plist; the file is kept")
    static class RemoveInfoPlist extends ManifestCommand {
        @Override
        protected void run() throws IOException, ManifestEditException {
            InfoPlistEditor editor = new InfoPlistEditor();
            edit(editor::unlink);
            out().println("App product no longer links an Info.plist.");
        }
    }
}

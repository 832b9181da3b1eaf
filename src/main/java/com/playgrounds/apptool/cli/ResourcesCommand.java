package com.playgrounds.apptool.cli;

import com.playgrounds.apptool.document.PackageDocument;
import com.playgrounds.apptool.document.ProjectScaffold;
import com.playgrounds.apptool.editor.ManifestEditException;
import com.playgrounds.apptool.editor.TargetResourcesEditor;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;

@Command(name = "resources", description = "Manage the resources of a build target",
         subcommands = {ResourcesCommand.ResourcesStatus.class, ResourcesCommand.InitResources.class,
                        ResourcesCommand.RemoveResources.class})
public class ResourcesCommand {

    @Command(name = "status", description = "Tell whether the target declares resources")
    static class ResourcesStatus extends ManifestCommand {
        @Override
        protected void run() throws IOException {
            TargetResourcesEditor editor = new TargetResourcesEditor();
            boolean linked = load().read(tree -> editor.hasResources(tree, options.target));
            out().println("Target '" + options.target + "' " + (linked ? "declares" : "does not declare") + " resources.");
        }
    }

    @Command(name = "init", description = "Link a resources directory to the target and create it")
    static class InitResources extends ManifestCommand {
        @Option(names = {"-d", "--directory"}, defaultValue = "Resources",
                description = "Directory relative to the project (default: ${DEFAULT-VALUE})")
        String directory;

        @Override
        protected void run() throws IOException, ManifestEditException {
            ProjectScaffold.checkRelative(directory);
            TargetResourcesEditor editor = new TargetResourcesEditor();
            PackageDocument document = edit(tree -> editor.link(tree, options.target, directory));
            if (new ProjectScaffold(document.projectDirectory()).createResourcesDirectory(directory)) {
                out().println("Created directory " + directory + ".");
            }
            out().println("Target '" + options.target + "' processes resources from " + directory + ".");
        }
    }

    @Command(name = "remove", description = "Unlink the resources of the target; files are kept")
    static class RemoveResources extends ManifestCommand {
        @Override
        protected void run() throws IOException, ManifestEditException {
            TargetResourcesEditor editor = new TargetResourcesEditor();
            edit(tree -> editor.unlink(tree, options.target));
            out().println("Target '" + options.target + "' no longer declares resources.");
        }
    }
}

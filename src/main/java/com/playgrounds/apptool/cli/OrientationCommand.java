package com.playgrounds.apptool.cli;

import com.playgrounds.apptool.editor.DeviceFamily;
import com.playgrounds.apptool.editor.ManifestEditException;
import com.playgrounds.apptool.editor.Orientation;
import com.playgrounds.apptool.editor.OrientationEditor;
import com.playgrounds.apptool.output.ReportFormatter;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Sets;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;

@Command(name = "orientation", description = "Manage the supported interface orientations of the iOS app",
         subcommands = {OrientationCommand.ListOrientations.class, OrientationCommand.AddOrientation.class,
                        OrientationCommand.RemoveOrientation.class})
public class OrientationCommand {

    @Command(name = "list", description = "Print the supported orientations")
    static class ListOrientations extends ManifestCommand {
        @Option(names = "--json", description = "Print JSON instead of text")
        boolean json;

        @Override
        protected void run() throws IOException {
            OrientationEditor editor = new OrientationEditor();
            out().println(new ReportFormatter(json).formatOrientations(load().read(editor::list)));
        }
    }

    @Command(name = "add", description = "Add an orientation, e.g. portrait or landscapeRight")
    static class AddOrientation extends ManifestCommand {
        @Parameters(index = "0", description = "portrait, portraitUpsideDown, landscapeLeft or landscapeRight")
        String orientationName;

        @Option(names = "--pad", description = "Only on iPad")
        boolean pad;

        @Option(names = "--phone", description = "Only on iPhone")
        boolean phone;

        @Override
        protected void run() throws IOException, ManifestEditException {
            Orientation orientation = Orientation.fromName(orientationName);
            MutableSet<DeviceFamily> families = Sets.mutable.empty();
            if (pad) {
                families.add(DeviceFamily.PAD);
            }
            if (phone) {
                families.add(DeviceFamily.PHONE);
            }
            OrientationEditor editor = new OrientationEditor();
            edit(tree -> editor.add(tree, orientation, families));
            out().println("Supported orientations include " + orientation.swiftName() + ".");
        }
    }

    @Command(name = "remove", description = "Remove an orientation")
    static class RemoveOrientation extends ManifestCommand {
        @Parameters(index = "0", description = "portrait, portraitUpsideDown, landscapeLeft or landscapeRight")
        String orientationName;

        @Override
        protected void run() throws IOException, ManifestEditException {
            Orientation orientation = Orientation.fromName(orientationName);
            OrientationEditor editor = new OrientationEditor();
            edit(tree -> editor.remove(tree, orientation));
            out().println("Removed " + orientation.swiftName() + " from the supported orientations.");
        }
    }
}

package com.playgrounds.apptool.cli;

import com.playgrounds.apptool.editor.AppCategory;
import com.playgrounds.apptool.editor.AppColor;
import com.playgrounds.apptool.editor.AppInfo;
import com.playgrounds.apptool.editor.AppInfoEditor;
import com.playgrounds.apptool.editor.DeviceFamily;
import com.playgrounds.apptool.editor.ManifestEditException;
import com.playgrounds.apptool.editor.ManifestEditor;
import com.playgrounds.apptool.editor.PresetColor;
import com.playgrounds.apptool.editor.TargetNotFoundException;
import com.playgrounds.apptool.output.ReportFormatter;
import com.playgrounds.apptool.syntax.SourceFile;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.List;
import java.util.function.UnaryOperator;

@Command(name = "app-info", description = "Read and change the settings of the app product",
         subcommands = {AppInfoCommand.GetAppInfo.class, AppInfoCommand.SetAppInfo.class,
                        AppInfoCommand.SetCategory.class, AppInfoCommand.SetAccentColor.class,
                        AppInfoCommand.SetDeviceFamilies.class})
public class AppInfoCommand {

    /**
     * Reads the app product, applies {@code change} and writes back what differs.
     */
    abstract static class AppInfoChange extends ManifestCommand {
        protected void change(UnaryOperator<AppInfo> change) throws IOException, ManifestEditException {
            AppInfoEditor editor = new AppInfoEditor();
            edit(tree -> editor.write(tree, change.apply(current(editor, tree))));
        }

        private static AppInfo current(AppInfoEditor editor, SourceFile tree) {
            return editor.read(tree).orElse(AppInfo.EMPTY);
        }
    }

    @Command(name = "get", description = "Print the app product settings")
    static class GetAppInfo extends ManifestCommand {
        @Option(names = "--json", description = "Print JSON instead of text")
        boolean json;

        @Override
        protected void run() throws IOException, ManifestEditException {
            AppInfoEditor editor = new AppInfoEditor();
            AppInfo info = load().read(editor::read)
                    .orElseThrow(() -> new TargetNotFoundException(ManifestEditor.APPLICATION_NOT_FOUND));
            out().println(new ReportFormatter(json).formatAppInfo(info));
        }
    }

    @Command(name = "set", description = "Set basic app settings; an empty value removes the setting")
    static class SetAppInfo extends AppInfoChange {
        @Option(names = "--name", description = "Display name of the app")
        String name;

        @Option(names = "--bundle-id", description = "Bundle identifier")
        String bundleIdentifier;

        @Option(names = "--team-id", description = "Development team identifier")
        String teamIdentifier;

        @Option(names = "--display-version", description = "Marketing version, e.g. 1.2")
        String displayVersion;

        @Option(names = "--bundle-version", description = "Build number")
        String bundleVersion;

        @Override
        protected void run() throws IOException, ManifestEditException {
            change(info -> {
                AppInfo updated = info;
                if (name != null) {
                    updated = updated.withName(name);
                }
                if (bundleIdentifier != null) {
                    updated = updated.withBundleIdentifier(bundleIdentifier);
                }
                if (teamIdentifier != null) {
                    updated = updated.withTeamIdentifier(teamIdentifier);
                }
                if (displayVersion != null) {
                    updated = updated.withDisplayVersion(displayVersion);
                }
                if (bundleVersion != null) {
                    updated = updated.withBundleVersion(bundleVersion);
                }
                return updated;
            });
            out().println("Updated the app product.");
        }
    }

    @Command(name = "set-category", description = "Set the App Store category; 'none' removes it")
    static class SetCategory extends AppInfoChange {
        @Parameters(index = "0", description = "Category, e.g. games or developerTools")
        String categoryName;

        @Override
        protected void run() throws IOException, ManifestEditException {
            AppCategory category = "none".equalsIgnoreCase(categoryName) ? null : AppCategory.fromName(categoryName);
            change(info -> info.withAppCategory(category));
            out().println(category == null ? "Removed the app category." : "App category is " + category.swiftName() + ".");
        }
    }

    @Command(name = "set-accent-color", description = "Set the accent color of the app")
    static class SetAccentColor extends AppInfoChange {
        @ArgGroup(exclusive = true, multiplicity = "1")
        ColorChoice choice;

        static class ColorChoice {
            @Option(names = "--preset", description = "SwiftUI preset color, e.g. blue")
            String preset;

            @Option(names = "--asset", description = "Color set name in the asset catalog")
            String asset;

            @Option(names = "--none", description = "Remove the accent color")
            boolean none;
        }

        @Override
        protected void run() throws IOException, ManifestEditException {
            AppColor color = null;
            if (choice.preset != null) {
                color = AppColor.preset(PresetColor.fromName(choice.preset));
            } else if (choice.asset != null) {
                color = AppColor.asset(choice.asset);
            }
            AppColor accentColor = color;
            change(info -> info.withAccentColor(accentColor));
            out().println(accentColor == null ? "Removed the accent color." : "Accent color is " + accentColor.source() + ".");
        }
    }

    @Command(name = "set-device-families", description = "Set the supported device families")
    static class SetDeviceFamilies extends AppInfoChange {
        @Option(names = {"-f", "--family"}, split = ",", required = true,
                description = "pad, phone, mac, tv or vision; repeat or separate with commas")
        List<String> familyNames;

        @Override
        protected void run() throws IOException, ManifestEditException {
            ImmutableList<DeviceFamily> families = Lists.immutable.withAll(familyNames)
                    .collect(DeviceFamily::fromName)
                    .distinct();
            change(info -> info.withSupportedDeviceFamilies(families));
            out().println("Supported device families: " + families.collect(DeviceFamily::swiftName).makeString(", ") + ".");
        }
    }
}

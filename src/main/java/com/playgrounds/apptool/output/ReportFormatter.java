package com.playgrounds.apptool.output;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.playgrounds.apptool.editor.AppColor;
import com.playgrounds.apptool.editor.AppInfo;
import com.playgrounds.apptool.editor.DeviceFamily;
import com.playgrounds.apptool.editor.OrientationEntry;
import com.playgrounds.apptool.editor.PlatformVersion;
import org.eclipse.collections.api.list.ImmutableList;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Renders what the editors read, either as aligned text for people or as JSON for scripts.
 */
public class ReportFormatter {
    private static final int LABEL_WIDTH = 20;

    private final JsonFactory factory = new JsonFactory();
    private final boolean json;

    public ReportFormatter(boolean json) {
        this.json = json;
    }

    public String formatAppInfo(AppInfo info) {
        if (json) {
            return writeJson(generator -> {
                generator.writeStartObject();
                writeField(generator, "name", info.name());
                writeField(generator, "bundleIdentifier", info.bundleIdentifier());
                writeField(generator, "teamIdentifier", info.teamIdentifier());
                writeField(generator, "displayVersion", info.displayVersion());
                writeField(generator, "bundleVersion", info.bundleVersion());
                writeField(generator, "iconAssetName", info.iconAssetName());
                writeField(generator, "accentColor", describe(info.accentColor()));
                generator.writeArrayFieldStart("supportedDeviceFamilies");
                for (DeviceFamily family : info.supportedDeviceFamilies()) {
                    generator.writeString(family.swiftName());
                }
                generator.writeEndArray();
                writeField(generator, "appCategory", info.appCategory() == null ? null : info.appCategory().swiftName());
                writeField(generator, "infoPlist", info.infoPlistPath());
                generator.writeEndObject();
            });
        }
        StringBuilder sb = new StringBuilder();
        line(sb, "Name", info.name());
        line(sb, "Bundle identifier", info.bundleIdentifier());
        line(sb, "Team identifier", info.teamIdentifier());
        line(sb, "Display version", info.displayVersion());
        line(sb, "Bundle version", info.bundleVersion());
        line(sb, "App icon", info.iconAssetName());
        line(sb, "Accent color", describe(info.accentColor()));
        line(sb, "Device families", info.supportedDeviceFamilies().isEmpty()
                ? null
                : info.supportedDeviceFamilies().collect(DeviceFamily::swiftName).makeString(", "));
        line(sb, "App category", info.appCategory() == null ? null : info.appCategory().swiftName());
        line(sb, "Info.plist", info.infoPlistPath());
        return sb.toString().stripTrailing();
    }

    public String formatPlatforms(ImmutableList<PlatformVersion> platforms) {
        if (json) {
            return writeJson(generator -> {
                generator.writeStartObject();
                for (PlatformVersion platform : platforms) {
                    generator.writeStringField(platform.platform().swiftName(), platform.version());
                }
                generator.writeEndObject();
            });
        }
        if (platforms.isEmpty()) {
            return "No platforms declared.";
        }
        StringBuilder sb = new StringBuilder();
        for (PlatformVersion platform : platforms) {
            line(sb, platform.platform().swiftName(), platform.version());
        }
        return sb.toString().stripTrailing();
    }

    public String formatOrientations(ImmutableList<OrientationEntry> orientations) {
        if (json) {
            return writeJson(generator -> {
                generator.writeStartArray();
                for (OrientationEntry entry : orientations) {
                    generator.writeStartObject();
                    generator.writeStringField("orientation", entry.name());
                    generator.writeArrayFieldStart("deviceFamilies");
                    for (DeviceFamily family : entry.deviceFamilies()) {
                        generator.writeString(family.swiftName());
                    }
                    generator.writeEndArray();
                    generator.writeStringField("source", entry.source());
                    generator.writeEndObject();
                }
                generator.writeEndArray();
            });
        }
        if (orientations.isEmpty()) {
            return "No orientations found.";
        }
        StringBuilder sb = new StringBuilder("Configured Orientations:");
        for (OrientationEntry entry : orientations) {
            sb.append("\n - ").append(entry.source());
        }
        return sb.toString();
    }

    public String formatSwiftVersion(Optional<String> languageVersion, Optional<String> toolsVersion) {
        if (json) {
            return writeJson(generator -> {
                generator.writeStartObject();
                writeField(generator, "swiftLanguageVersion", languageVersion.orElse(null));
                writeField(generator, "toolsVersion", toolsVersion.orElse(null));
                generator.writeEndObject();
            });
        }
        StringBuilder sb = new StringBuilder();
        line(sb, "Swift language", languageVersion.orElse(null));
        line(sb, "Tools version", toolsVersion.orElse(null));
        return sb.toString().stripTrailing();
    }

    static String describe(AppColor color) {
        if (color instanceof AppColor.Asset asset) {
            return "asset " + asset.name();
        }
        if (color instanceof AppColor.Preset preset) {
            return "preset " + preset.color().swiftName();
        }
        return null;
    }

    private static void line(StringBuilder sb, String label, String value) {
        String text = label + ":";
        sb.append(text)
          .append(" ".repeat(Math.max(1, LABEL_WIDTH - text.length())))
          .append(value == null ? "-" : value)
          .append('\n');
    }

    private static void writeField(JsonGenerator generator, String name, String value) throws IOException {
        if (value == null) {
            generator.writeNullField(name);
        } else {
            generator.writeStringField(name, value);
        }
    }

    private String writeJson(JsonWriter writer) {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = factory.createGenerator(out)) {
            generator.useDefaultPrettyPrinter();
            writer.write(generator);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    @FunctionalInterface
    private interface JsonWriter {
        void write(JsonGenerator generator) throws IOException;
    }
}

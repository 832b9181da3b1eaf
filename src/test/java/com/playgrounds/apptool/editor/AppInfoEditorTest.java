package com.playgrounds.apptool.editor;

import com.playgrounds.apptool.Fixtures;
import com.playgrounds.apptool.ManifestLoggingConfig;
import com.playgrounds.apptool.syntax.SourceFile;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.util.function.UnaryOperator;

import static com.playgrounds.apptool.editor.EditorAssertions.*;
import static org.junit.jupiter.api.Assertions.*;

public class AppInfoEditorTest extends ManifestLoggingConfig {

    private final AppInfoEditor editor = new AppInfoEditor();

    // ==== Reading ====

    @Test
    public void testReadPlayground() {
        AppInfo info = editor.read(parse(Fixtures.playground())).orElseThrow();

        assertEquals("My App", info.name());
        assertEquals("com.example.MyApp", info.bundleIdentifier());
        assertEquals("ABCDE12345", info.teamIdentifier());
        assertEquals("1.0", info.displayVersion());
        assertEquals("1", info.bundleVersion());
        assertNull(info.iconAssetName());
        assertEquals(AppColor.preset(PresetColor.BLUE), info.accentColor());
        assertEquals(Lists.immutable.with(DeviceFamily.PAD, DeviceFamily.PHONE), info.supportedDeviceFamilies());
        assertEquals(AppCategory.DEVELOPER_TOOLS, info.appCategory());
        assertFalse(info.hasInfoPlist());
    }

    @Test
    public void testReadLegacyLabels() {
        AppInfo info = editor.read(parse(Fixtures.manifest("legacy.swift"))).orElseThrow();

        assertEquals("com.example.legacy", info.bundleIdentifier());
        assertNull(info.teamIdentifier());
        assertEquals("2.1", info.displayVersion());
        assertEquals("7", info.bundleVersion());
        assertEquals("AppIcon", info.iconAssetName());
        assertEquals(AppColor.asset("AccentColor"), info.accentColor());
        assertEquals(AppCategory.GAMES, info.appCategory());
        assertEquals("Custom.plist", info.infoPlistPath());
    }

    @Test
    public void testReadWithoutProduct() {
        assertTrue(editor.read(parse("Package(name: \"A\")")).isEmpty());
    }

    // ==== Writing ====

    @Test
    public void testWriteUnchangedInfo() {
        SourceFile tree = parse(Fixtures.playground());

        assertUnchanged(editor.write(tree, editor.read(tree).orElseThrow()));
    }

    @Test
    public void testRenameTouchesOnlyTheProduct() {
        String source = Fixtures.playground();

        assertEquals(source.replace("            name: \"My App\",", "            name: \"Renamed\","),
                write(source, info -> info.withName("Renamed")));
    }

    @Test
    public void testWriteRenamesLegacyLabel() {
        String source = Fixtures.manifest("legacy.swift");

        assertEquals(source.replace("id: \"com.example.legacy\"", "bundleIdentifier: \"com.example.other\""),
                write(source, info -> info.withBundleIdentifier("com.example.other")));
    }

    @Test
    public void testEmptyValueRemovesArgument() {
        String source = Fixtures.playground();

        assertEquals(source.replace("            teamIdentifier: \"ABCDE12345\",\n", ""),
                write(source, info -> info.withTeamIdentifier("")));
        assertEquals(source.replace("            teamIdentifier: \"ABCDE12345\",\n", ""),
                write(source, info -> info.withTeamIdentifier(null)));
    }

    @Test
    public void testAddMissingValue() {
        String source = Fixtures.manifest("legacy.swift");

        assertEquals(source.replace("infoPlist: \"Custom.plist\")", "infoPlist: \"Custom.plist\", teamIdentifier: \"T1\")"),
                write(source, info -> info.withTeamIdentifier("T1")));
    }

    @Test
    public void testAccentColor() {
        String source = Fixtures.playground();

        assertEquals(source.replace(".presetColor(.blue)", ".asset(\"Accent\")"),
                write(source, info -> info.withAccentColor(AppColor.asset("Accent"))));
        assertEquals(source.replace(".presetColor(.blue)", ".presetColor(.mint)"),
                write(source, info -> info.withAccentColor(AppColor.preset(PresetColor.MINT))));
        assertEquals(source.replace("            accentColor: .presetColor(.blue),\n", ""),
                write(source, info -> info.withAccentColor(null)));
    }

    @Test
    public void testCategory() {
        String source = Fixtures.playground();

        assertEquals(source.replace(".developerTools", ".games"),
                write(source, info -> info.withAppCategory(AppCategory.GAMES)));
        assertEquals(source.replace("            ],\n            appCategory: .developerTools\n", "            ]\n"),
                write(source, info -> info.withAppCategory(null)));
    }

    @Test
    public void testDeviceFamilies() {
        String source = Fixtures.playground();

        assertEquals(source.replace("                .pad,\n                .phone\n", "                .phone\n"),
                write(source, info -> info.withSupportedDeviceFamilies(Lists.immutable.with(DeviceFamily.PHONE))));
        assertEquals(source.replace("                .pad,\n                .phone\n",
                        "                .pad,\n                .phone,\n                .mac\n"),
                write(source, info -> info.withSupportedDeviceFamilies(
                        Lists.immutable.with(DeviceFamily.PAD, DeviceFamily.PHONE, DeviceFamily.MAC))));
        assertEquals(source.replace("            supportedDeviceFamilies: [\n                .pad,\n                .phone\n            ],\n", ""),
                write(source, info -> info.withSupportedDeviceFamilies(Lists.immutable.empty())));
    }

    @Test
    public void testUnreadableValuesSurvive() {
        String source = ".iOSApplication(name: \"A\", accentColor: .presetColor(.custom), appCategory: .someday)";

        assertEquals(".iOSApplication(name: \"B\", accentColor: .presetColor(.custom), appCategory: .someday)",
                write(source, info -> info.withName("B")));
    }

    @Test
    public void testMissingProduct() {
        assertNotFound(ManifestEditor.APPLICATION_NOT_FOUND, editor.write(parse("Package(name: \"A\")"), AppInfo.EMPTY));
    }

    private String write(String source, UnaryOperator<AppInfo> change) {
        SourceFile tree = parse(source);
        return printed(editor.write(tree, change.apply(editor.read(tree).orElseThrow())));
    }
}

package com.playgrounds.apptool.editor;

import com.playgrounds.apptool.Fixtures;
import com.playgrounds.apptool.ManifestLoggingConfig;
import com.playgrounds.apptool.syntax.SourceFile;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.playgrounds.apptool.editor.EditorAssertions.*;
import static org.junit.jupiter.api.Assertions.*;

public class PlatformEditorTest extends ManifestLoggingConfig {

    private static final String SINGLE_LINE = "Package(name: \"App\", platforms: [.iOS(\"16.0\")])";

    private final PlatformEditor editor = new PlatformEditor();

    // ==== Reading ====

    @Test
    public void testReadPlatforms() {
        assertEquals(Lists.immutable.with(new PlatformVersion(Platform.IOS, "17.0")),
                editor.platforms(parse(Fixtures.playground())));
    }

    @Test
    public void testReadVersionMembers() {
        SourceFile tree = parse(Fixtures.manifest("legacy.swift"));

        assertEquals(Lists.immutable.with(new PlatformVersion(Platform.IOS, "15"),
                new PlatformVersion(Platform.MACOS, "10.15")), editor.platforms(tree));
        assertEquals(Optional.of("10.15"), editor.minimumVersion(tree, Platform.MACOS));
        assertEquals(Optional.empty(), editor.minimumVersion(tree, Platform.TVOS));
    }

    @Test
    public void testReadWithoutPlatforms() {
        assertTrue(editor.platforms(parse("Package(name: \"A\")")).isEmpty());
        assertTrue(editor.platforms(parse(Fixtures.manifest("no-package.swift"))).isEmpty());
    }

    // ==== Setting ====

    @Test
    public void testReplaceExistingVersion() {
        assertEquals("Package(name: \"App\", platforms: [.iOS(\"18.0\")])",
                printed(editor.setMinimum(parse(SINGLE_LINE), Platform.IOS, "18.0")));
    }

    @Test
    public void testAddPlatform() {
        assertEquals("Package(name: \"App\", platforms: [.iOS(\"16.0\"), .macOS(\"14.0\")])",
                printed(editor.setMinimum(parse(SINGLE_LINE), Platform.MACOS, "14.0")));
    }

    @Test
    public void testAddPlatformToPaddedList() {
        assertEquals("Package(name: \"App\", platforms: [ .iOS(\"16.0\"), .macOS(\"14.0\") ])",
                printed(editor.setMinimum(parse("Package(name: \"App\", platforms: [ .iOS(\"16.0\") ])"),
                        Platform.MACOS, "14.0")));
    }

    @Test
    public void testAddPlatformToMultiLineList() {
        String source = Fixtures.playground();
        String expected = source.replace("        .iOS(\"17.0\")\n", "        .iOS(\"17.0\"),\n        .macOS(\"14.0\")\n");

        assertEquals(expected, printed(editor.setMinimum(parse(source), Platform.MACOS, "14.0")));
    }

    @Test
    public void testReplaceKeepsComment() {
        String source = Fixtures.manifest("legacy.swift");
        String expected = source.replace("[.iOS(.v15), .macOS(.v10_15)]", "[.iOS(\"17.0\"), .macOS(.v10_15)]");

        assertEquals(expected, printed(editor.setMinimum(parse(source), Platform.IOS, "17.0")));
    }

    @Test
    public void testCreatePlatformsAfterName() {
        assertEquals("Package(name: \"App\", platforms: [.iOS(\"17.0\")], products: [])",
                printed(editor.setMinimum(parse("Package(name: \"App\", products: [])"), Platform.IOS, "17.0")));
    }

    @Test
    public void testCreatePlatformsOnItsOwnLine() {
        String source = "let package = Package(\n    name: \"App\",\n    targets: []\n)\n";

        assertEquals("let package = Package(\n    name: \"App\",\n    platforms: [.iOS(\"17.0\")],\n    targets: []\n)\n",
                printed(editor.setMinimum(parse(source), Platform.IOS, "17.0")));
    }

    @Test
    public void testSetSameVersionIsNoOp() {
        assertUnchanged(editor.setMinimum(parse(SINGLE_LINE), Platform.IOS, "16.0"));
    }

    @Test
    public void testInvalidVersion() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> editor.setMinimum(parse(SINGLE_LINE), Platform.IOS, "17.x"));
        assertEquals("'17.x' is not a valid platform version string.", e.getMessage());
    }

    @Test
    public void testMissingPackage() {
        assertNotFound(ManifestEditor.PACKAGE_NOT_FOUND,
                editor.setMinimum(parse(Fixtures.manifest("no-package.swift")), Platform.IOS, "17.0"));
    }

    @Test
    public void testPlatformsNotAnArray() {
        EditResult result = editor.setMinimum(parse("Package(name: \"A\", platforms: supported)"), Platform.IOS, "17.0");

        assertInstanceOf(EditResult.NotFound.class, result);
    }

    // ==== Removing ====

    @Test
    public void testRemove() {
        SourceFile tree = parse("Package(platforms: [.iOS(\"16.0\"), .macOS(\"14.0\")])");

        assertEquals("Package(platforms: [.iOS(\"16.0\")])", printed(editor.remove(tree, Platform.MACOS)));
        assertUnchanged(editor.remove(tree, Platform.WATCHOS));
    }

    @Test
    public void testRemoveWithoutPlatforms() {
        assertUnchanged(editor.remove(parse("Package(name: \"A\")"), Platform.IOS));
    }
}

package com.playgrounds.apptool.document;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ProjectScaffoldTest {

    @TempDir
    Path projectDir;

    @Test
    public void testCreateResourcesDirectory() throws IOException {
        ProjectScaffold scaffold = new ProjectScaffold(projectDir);

        assertTrue(scaffold.createResourcesDirectory("Resources"));
        assertTrue(Files.isDirectory(projectDir.resolve("Resources")));
        assertFalse(scaffold.createResourcesDirectory("Resources"));
    }

    @Test
    public void testCreateInfoPlistFromTemplate() throws IOException {
        ProjectScaffold scaffold = new ProjectScaffold(projectDir);

        assertTrue(scaffold.createInfoPlist("Info.plist"));

        String content = Files.readString(projectDir.resolve("Info.plist"), StandardCharsets.UTF_8);
        assertEquals(ProjectScaffold.infoPlistTemplate(), content);
        assertTrue(content.contains("<key>ITSAppUsesNonExemptEncryption</key>"));
    }

    @Test
    public void testExistingInfoPlistIsKept() throws IOException {
        Path plist = projectDir.resolve("Info.plist");
        Files.writeString(plist, "custom", StandardCharsets.UTF_8);

        assertFalse(new ProjectScaffold(projectDir).createInfoPlist("Info.plist"));
        assertEquals("custom", Files.readString(plist, StandardCharsets.UTF_8));
    }

    @Test
    public void testInfoPlistInSubdirectory() throws IOException {
        assertTrue(new ProjectScaffold(projectDir).createInfoPlist("Config/App.plist"));
        assertTrue(Files.isRegularFile(projectDir.resolve("Config").resolve("App.plist")));
    }

    // ==== paths outside the project ====

    @ParameterizedTest
    @CsvSource({"../x.plist", "Config/../../x.plist", "/tmp/x.plist", "."})
    public void testInfoPlistOutsideProjectIsRejected(String fileName) {
        ProjectScaffold scaffold = new ProjectScaffold(projectDir);

        assertThrows(IllegalArgumentException.class, () -> scaffold.createInfoPlist(fileName));
        assertFalse(Files.exists(projectDir.resolveSibling("x.plist")));
    }

    @Test
    public void testResourcesOutsideProjectIsRejected() {
        ProjectScaffold scaffold = new ProjectScaffold(projectDir);

        assertThrows(IllegalArgumentException.class, () -> scaffold.createResourcesDirectory("../Resources"));
        assertFalse(Files.exists(projectDir.resolveSibling("Resources")));
    }

    @Test
    public void testCheckRelativeNormalizes() {
        assertEquals(Path.of("App.plist"), ProjectScaffold.checkRelative("Config/../App.plist"));
    }
}

package com.playgrounds.apptool.rewrite;

import com.playgrounds.apptool.syntax.ManifestParser;
import com.playgrounds.apptool.syntax.SourceFile;
import com.playgrounds.apptool.syntax.SyntaxPrinter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class LeadingDirectiveTest {

    private static final LeadingDirective TOOLS = LeadingDirective.SWIFT_TOOLS_VERSION;

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "// swift-tools-version: 5.9                      | 5.9",
            "// swift-tools-version:5.6                       | 5.6",
            "//swift-tools-version:5.7.1;(experimentalFeature) | 5.7.1",
            "// Swift-Tools-Version: 6.0                      | 6.0"
    })
    public void testRead(String line, String version) {
        SourceFile tree = ManifestParser.parse(line + "\nimport PackageDescription\n");

        assertEquals(Optional.of(version), TOOLS.read(tree));
    }

    @Test
    public void testReadWithoutDirective() {
        assertTrue(TOOLS.read(ManifestParser.parse("// just a comment\nimport PackageDescription\n")).isEmpty());
        assertTrue(TOOLS.read(ManifestParser.parse("")).isEmpty());
    }

    @Test
    public void testWriteReplacesPayload() {
        SourceFile tree = ManifestParser.parse("// swift-tools-version: 5.9\n\nimport PackageDescription\n");

        SourceFile updated = TOOLS.write(tree, "6.0", FormattingConventions.DEFAULT);

        assertEquals("// swift-tools-version: 6.0\n\nimport PackageDescription\n", SyntaxPrinter.print(updated));
    }

    @Test
    public void testWriteSamePayloadReturnsInput() {
        SourceFile tree = ManifestParser.parse("// swift-tools-version:6.0\nimport PackageDescription\n");

        assertSame(tree, TOOLS.write(tree, "6.0", FormattingConventions.DEFAULT));
    }

    @Test
    public void testWritePrependsMissingDirective() {
        SourceFile tree = ManifestParser.parse("// Package manifest\nimport PackageDescription\n");

        SourceFile updated = TOOLS.write(tree, "5.9", FormattingConventions.DEFAULT);

        assertEquals("// swift-tools-version: 5.9\n\n// Package manifest\nimport PackageDescription\n",
                SyntaxPrinter.print(updated));
    }

    @Test
    public void testWriteIntoEmptyFile() {
        SourceFile updated = TOOLS.write(ManifestParser.parse(""), "5.9", FormattingConventions.DEFAULT);

        assertEquals("// swift-tools-version: 5.9\n\n", SyntaxPrinter.print(updated));
    }
}

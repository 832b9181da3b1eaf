package com.playgrounds.apptool.editor;

import com.playgrounds.apptool.Fixtures;
import com.playgrounds.apptool.syntax.SourceFile;
import com.playgrounds.apptool.syntax.SyntaxPrinter;
import org.eclipse.collections.impl.factory.Sets;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.function.Function;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Every write against a manifest without the call it edits reports the miss and leaves the tree alone.
 */
public class EditorsNotFoundTest {

    static Stream<Arguments> writes() {
        PlatformEditor platforms = new PlatformEditor();
        SwiftVersionEditor swiftVersion = new SwiftVersionEditor();
        TargetResourcesEditor resources = new TargetResourcesEditor();
        InfoPlistEditor infoPlist = new InfoPlistEditor();
        OrientationEditor orientations = new OrientationEditor();
        AppInfoEditor appInfo = new AppInfoEditor();
        return Stream.of(
                write("platform set", tree -> platforms.setMinimum(tree, Platform.IOS, "17.0")),
                write("platform remove", tree -> platforms.remove(tree, Platform.IOS)),
                write("swift-version set", tree -> swiftVersion.set(tree, "6")),
                write("swift-version remove", swiftVersion::remove),
                write("resources link", tree -> resources.link(tree, "AppModule", "Resources")),
                write("resources unlink", tree -> resources.unlink(tree, "AppModule")),
                write("info-plist link", tree -> infoPlist.link(tree, "Info.plist")),
                write("info-plist unlink", infoPlist::unlink),
                write("orientation add", tree -> orientations.add(tree, Orientation.PORTRAIT, Sets.immutable.empty())),
                write("orientation remove", tree -> orientations.remove(tree, Orientation.PORTRAIT)),
                write("app-info write", tree -> appInfo.write(tree, AppInfo.EMPTY.withName("X"))));
    }

    private static Arguments write(String name, Function<SourceFile, EditResult> write) {
        return Arguments.of(name, write);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("writes")
    public void testWriteReportsMissingTarget(String name, Function<SourceFile, EditResult> write) {
        String source = Fixtures.manifest("no-package.swift");
        SourceFile tree = EditorAssertions.parse(source);

        EditResult result = write.apply(tree);

        assertInstanceOf(EditResult.NotFound.class, result);
        assertThrows(TargetNotFoundException.class, result::treeOrThrow);
        assertEquals(source, SyntaxPrinter.print(tree));
    }
}

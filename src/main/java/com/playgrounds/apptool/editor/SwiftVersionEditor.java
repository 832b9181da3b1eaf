package com.playgrounds.apptool.editor;

import com.playgrounds.apptool.match.ArgumentLabel;
import com.playgrounds.apptool.match.CallMatcher;
import com.playgrounds.apptool.match.Matchers;
import com.playgrounds.apptool.rewrite.ArgumentListEdits;
import com.playgrounds.apptool.rewrite.FormattingConventions;
import com.playgrounds.apptool.rewrite.LeadingDirective;
import com.playgrounds.apptool.syntax.ArrayExpr;
import com.playgrounds.apptool.syntax.CallExpr;
import com.playgrounds.apptool.syntax.Expr;
import com.playgrounds.apptool.syntax.ManifestParser;
import com.playgrounds.apptool.syntax.MemberAccessExpr;
import com.playgrounds.apptool.syntax.SourceFile;
import com.playgrounds.apptool.syntax.StringLiterals;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The Swift language version of the package: {@code swiftLanguageVersions: [.version("6")]}
 * together with the {@code // swift-tools-version:} line at the top of the file.
 */
public class SwiftVersionEditor extends ManifestEditor {

    static final ArgumentLabel LANGUAGE_VERSIONS = ArgumentLabel.of("swiftLanguageVersions", "swiftLanguageModes");

    private static final Pattern VERSION = Pattern.compile("\\d+(\\.\\d+){0,2}");
    private static final Pattern VERSION_MEMBER = Pattern.compile("v\\d+(_\\d+)*");

    public SwiftVersionEditor() {
        this(FormattingConventions.DEFAULT);
    }

    public SwiftVersionEditor(FormattingConventions conventions) {
        super(conventions);
    }

    /**
     * The first declared language version: {@code .version("6")} reads as {@code 6},
     * {@code .v4_2} as {@code 4.2}.
     */
    public Optional<String> read(SourceFile tree) {
        return find(tree, CallMatcher.PACKAGE)
                .flatMap(call -> Matchers.argument(call, LANGUAGE_VERSIONS))
                .map(argument -> argument.value())
                .filter(ArrayExpr.class::isInstance)
                .flatMap(value -> ((ArrayExpr) value).values().getFirstOptional())
                .flatMap(SwiftVersionEditor::versionOf);
    }

    public Optional<String> toolsVersion(SourceFile tree) {
        return LeadingDirective.SWIFT_TOOLS_VERSION.read(tree);
    }

    /**
     * Declares {@code version} as the only language version and raises the tools version to
     * match. A major-only version such as {@code 6} is written to the tools version line as
     * {@code 6.0}.
     *
     * @throws IllegalArgumentException if {@code version} is not a dotted version number
     */
    public EditResult set(SourceFile tree, String version) {
        if (version == null || !VERSION.matcher(version).matches()) {
            throw new IllegalArgumentException("'" + version + "' is not a valid Swift version.");
        }
        Expr value = ManifestParser.parseExpression("[.version(" + StringLiterals.quote(version) + ")]");
        EditResult result = editArguments(tree, CallMatcher.PACKAGE, PACKAGE_NOT_FOUND,
                arguments -> ArgumentListEdits.set(arguments, LANGUAGE_VERSIONS, value, conventions));
        if (!(result instanceof EditResult.Applied applied)) {
            return result;
        }
        String toolsVersion = version.contains(".") ? version : version + ".0";
        SourceFile updated = LeadingDirective.SWIFT_TOOLS_VERSION.write(applied.tree(), toolsVersion, conventions);
        return EditResult.applied(tree, updated);
    }

    /**
     * Drops the language version declaration. The tools version line is kept.
     */
    public EditResult remove(SourceFile tree) {
        return editArguments(tree, CallMatcher.PACKAGE, PACKAGE_NOT_FOUND,
                arguments -> ArgumentListEdits.remove(arguments, LANGUAGE_VERSIONS));
    }

    private static Optional<String> versionOf(Expr element) {
        if (element instanceof CallExpr call && call.calleeName().filter("version"::equals).isPresent()
                && call.arguments().notEmpty()) {
            return Matchers.stringValue(call.arguments().getFirst().value());
        }
        if (element instanceof MemberAccessExpr member && VERSION_MEMBER.matcher(member.memberName()).matches()) {
            return Optional.of(member.memberName().substring(1).replace('_', '.'));
        }
        return Optional.empty();
    }
}

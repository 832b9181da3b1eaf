package com.playgrounds.apptool.editor;

import com.playgrounds.apptool.match.ArgumentLabel;
import com.playgrounds.apptool.match.CallMatcher;
import com.playgrounds.apptool.match.Matchers;
import com.playgrounds.apptool.rewrite.ArgumentListEdits;
import com.playgrounds.apptool.rewrite.FormattingConventions;
import com.playgrounds.apptool.syntax.Argument;
import com.playgrounds.apptool.syntax.SourceFile;
import com.playgrounds.apptool.syntax.StringLiteralExpr;

import java.util.Optional;

/**
 * Links an additional Info.plist to the app product.
 */
public class InfoPlistEditor extends ManifestEditor {

    static final ArgumentLabel INFO_PLIST = ArgumentLabel.of("additionalInfoPlistContentFilePath", "infoPlist");

    public InfoPlistEditor() {
        this(FormattingConventions.DEFAULT);
    }

    public InfoPlistEditor(FormattingConventions conventions) {
        super(conventions);
    }

    public boolean isLinked(SourceFile tree) {
        return argument(tree).isPresent();
    }

    /**
     * The linked file, when it is given as a string literal.
     */
    public Optional<String> linkedFile(SourceFile tree) {
        return argument(tree).flatMap(argument -> Matchers.stringValue(argument.value()));
    }

    /**
     * Appends {@code additionalInfoPlistContentFilePath: "<fileName>"} to the app product. An
     * existing link is left untouched, even when it names another file.
     */
    public EditResult link(SourceFile tree, String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("Info.plist file name must not be empty");
        }
        return editArguments(tree, CallMatcher.APPLICATION_PRODUCT, APPLICATION_NOT_FOUND, arguments -> {
            if (Matchers.argument(arguments, INFO_PLIST).isPresent()) {
                return arguments;
            }
            return ArgumentListEdits.set(arguments, INFO_PLIST, StringLiteralExpr.of(fileName), conventions);
        });
    }

    public EditResult unlink(SourceFile tree) {
        return editArguments(tree, CallMatcher.APPLICATION_PRODUCT, APPLICATION_NOT_FOUND,
                arguments -> ArgumentListEdits.remove(arguments, INFO_PLIST));
    }

    private static Optional<Argument> argument(SourceFile tree) {
        return find(tree, CallMatcher.APPLICATION_PRODUCT).flatMap(call -> Matchers.argument(call, INFO_PLIST));
    }
}

package com.playgrounds.apptool.editor;

import com.playgrounds.apptool.match.ArgumentLabel;
import com.playgrounds.apptool.match.CallMatcher;
import com.playgrounds.apptool.match.Matchers;
import com.playgrounds.apptool.rewrite.ArgumentListEdits;
import com.playgrounds.apptool.rewrite.FormattingConventions;
import com.playgrounds.apptool.syntax.Argument;
import com.playgrounds.apptool.syntax.ManifestParser;
import com.playgrounds.apptool.syntax.SourceFile;
import com.playgrounds.apptool.syntax.StringLiterals;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Links a resources directory to a build target with {@code resources: [.process("...")]}.
 */
public class TargetResourcesEditor extends ManifestEditor {

    static final ArgumentLabel RESOURCES = ArgumentLabel.of("resources");

    /** Labels that PackageDescription declares before {@code resources:}. */
    static final ImmutableList<String> PRECEDING_LABELS =
            Lists.immutable.with("name", "dependencies", "path", "exclude", "sources");

    public TargetResourcesEditor() {
        this(FormattingConventions.DEFAULT);
    }

    public TargetResourcesEditor(FormattingConventions conventions) {
        super(conventions);
    }

    public boolean hasResources(SourceFile tree, String target) {
        return find(tree, CallMatcher.buildTarget(target))
                .flatMap(call -> Matchers.argument(call, RESOURCES))
                .isPresent();
    }

    /**
     * Adds {@code resources: [.process("<directory>")]} to the target, right after the
     * arguments that must precede it. A target that already declares resources is left alone.
     */
    public EditResult link(SourceFile tree, String target, String directory) {
        if (directory == null || directory.isBlank()) {
            throw new IllegalArgumentException("Resource directory must not be empty");
        }
        Argument argument = ManifestParser.parseArgument(
                RESOURCES.canonical() + ": [.process(" + StringLiterals.quote(directory) + ")]");
        return editArguments(tree, CallMatcher.buildTarget(target), notFound(target), arguments -> {
            if (Matchers.argument(arguments, RESOURCES).isPresent()) {
                return arguments;
            }
            return ArgumentListEdits.insertOrdered(arguments, argument, PRECEDING_LABELS, conventions);
        });
    }

    public EditResult unlink(SourceFile tree, String target) {
        return editArguments(tree, CallMatcher.buildTarget(target), notFound(target),
                arguments -> ArgumentListEdits.remove(arguments, RESOURCES));
    }

    private static String notFound(String target) {
        return "Could not find a target named '" + target + "' in Package.swift.";
    }
}

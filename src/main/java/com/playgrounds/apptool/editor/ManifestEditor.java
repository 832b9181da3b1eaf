package com.playgrounds.apptool.editor;

import com.playgrounds.apptool.match.CallMatcher;
import com.playgrounds.apptool.match.Matchers;
import com.playgrounds.apptool.rewrite.CallRewriter;
import com.playgrounds.apptool.rewrite.FormattingConventions;
import com.playgrounds.apptool.rewrite.Rewrite;
import com.playgrounds.apptool.syntax.Argument;
import com.playgrounds.apptool.syntax.CallExpr;
import com.playgrounds.apptool.syntax.SourceFile;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Shared plumbing of the feature editors: locate the first matching call, rewrite it, and
 * report whether anything changed.
 */
public abstract class ManifestEditor {

    private static final Logger LOG = Logger.getLogger(ManifestEditor.class.getName());

    public static final String PACKAGE_NOT_FOUND = "Could not locate the Package(...) call in Package.swift.";
    public static final String APPLICATION_NOT_FOUND =
            "Could not find an .iOSApplication or .macOSApplication product declaration in Package.swift.";
    public static final String IOS_APPLICATION_NOT_FOUND =
            "Could not find an .iOSApplication product declaration in Package.swift.";

    protected final FormattingConventions conventions;

    protected ManifestEditor(FormattingConventions conventions) {
        this.conventions = Objects.requireNonNull(conventions, "conventions");
    }

    protected EditResult edit(SourceFile tree, CallMatcher matcher, String notFound, UnaryOperator<CallExpr> edit) {
        Rewrite rewrite = CallRewriter.rewriteFirst(tree, matcher, edit);
        if (!rewrite.found()) {
            LOG.fine(() -> "No call matching " + matcher.description());
            return EditResult.notFound(notFound);
        }
        EditResult.Applied result = (EditResult.Applied) EditResult.applied(tree, rewrite.tree());
        LOG.fine(() -> "Edited " + matcher.description() + (result.changed() ? "" : ", already up to date"));
        return result;
    }

    protected EditResult editArguments(SourceFile tree, CallMatcher matcher, String notFound,
            UnaryOperator<ImmutableList<Argument>> edit) {
        return edit(tree, matcher, notFound, call -> {
            ImmutableList<Argument> updated = edit.apply(call.arguments());
            return updated == call.arguments() ? call : call.withArguments(updated);
        });
    }

    protected static Optional<CallExpr> find(SourceFile tree, CallMatcher matcher) {
        return Matchers.findFirst(tree, matcher);
    }
}

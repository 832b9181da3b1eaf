package com.playgrounds.apptool.rewrite;

import com.playgrounds.apptool.match.AmbiguousArgumentException;
import com.playgrounds.apptool.match.ArgumentLabel;
import com.playgrounds.apptool.match.Matchers;
import com.playgrounds.apptool.syntax.Argument;
import com.playgrounds.apptool.syntax.Expr;
import com.playgrounds.apptool.syntax.SyntaxPrinter;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Optional;

/**
 * Labelled argument edits on a call's argument list.
 */
public final class ArgumentListEdits {

    private ArgumentListEdits() {
    }

    /**
     * Sets {@code label} to {@code value}. An existing argument keeps its position and the
     * whitespace around its value, and a legacy label is rewritten to the canonical one; a
     * missing argument is appended. Returns {@code arguments} itself when the argument already
     * has this value under its canonical label.
     */
    public static ImmutableList<Argument> set(ImmutableList<Argument> arguments, ArgumentLabel label, Expr value,
            FormattingConventions conventions) {
        Optional<Argument> existing = Matchers.argument(arguments, label);
        if (existing.isEmpty()) {
            return SeparatedLists.append(arguments, Argument.labeled(label.canonical(), value), conventions);
        }
        Argument argument = existing.get();
        boolean sameValue = sameText(argument.value(), value);
        boolean canonical = label.isCanonical(argument.labelText());
        if (sameValue && canonical) {
            return arguments;
        }
        Argument updated = argument;
        if (!sameValue) {
            Expr old = argument.value();
            updated = updated.withValue(value.withLeadingTrivia(old.leadingTrivia()).withTrailingTrivia(old.trailingTrivia()));
        }
        if (!canonical) {
            updated = updated.withLabel(label.canonical());
        }
        return SeparatedLists.replace(arguments, arguments.indexOf(argument), updated);
    }

    /**
     * Inserts {@code argument} right after the last argument whose label is one of
     * {@code precedingLabels}, or first when there is none.
     */
    public static ImmutableList<Argument> insertOrdered(ImmutableList<Argument> arguments, Argument argument,
            ImmutableList<String> precedingLabels, FormattingConventions conventions) {
        int last = arguments.detectLastIndex(candidate -> precedingLabels.contains(candidate.labelText()));
        return SeparatedLists.insert(arguments, last + 1, argument, conventions);
    }

    /**
     * Removes the argument spelled with {@code label} or one of its aliases. Returns
     * {@code arguments} itself when there is none.
     *
     * @throws AmbiguousArgumentException if the argument is spelled more than once
     */
    public static ImmutableList<Argument> remove(ImmutableList<Argument> arguments, ArgumentLabel label) {
        Optional<Argument> existing = Matchers.argument(arguments, label);
        if (existing.isEmpty()) {
            return arguments;
        }
        Argument argument = existing.get();
        return SeparatedLists.removeIf(arguments, candidate -> candidate == argument);
    }

    static boolean sameText(Expr left, Expr right) {
        return SyntaxPrinter.printWithoutTrivia(left).equals(SyntaxPrinter.printWithoutTrivia(right));
    }
}

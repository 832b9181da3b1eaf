package com.playgrounds.apptool.rewrite;

import com.playgrounds.apptool.match.BaseIdentity;
import com.playgrounds.apptool.syntax.ArrayElement;
import com.playgrounds.apptool.syntax.ArrayExpr;
import com.playgrounds.apptool.syntax.Expr;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.set.ImmutableSet;

import java.util.Optional;

/**
 * Array edits keyed by element identity, see {@link BaseIdentity}.
 */
public final class ArrayEdits {

    private ArrayEdits() {
    }

    public static ArrayExpr insertIfAbsent(ArrayExpr array, Expr element, FormattingConventions conventions) {
        String identity = identityOf(element);
        if (indexOf(array, identity) >= 0) {
            return array;
        }
        return array.withElements(SeparatedLists.append(array.elements(), ArrayElement.of(element), conventions));
    }

    /**
     * Replaces the element with the same identity as {@code element}, keeping its trivia, or
     * appends {@code element} when there is none.
     */
    public static ArrayExpr upsert(ArrayExpr array, Expr element, FormattingConventions conventions) {
        int index = indexOf(array, identityOf(element));
        if (index < 0) {
            return array.withElements(SeparatedLists.append(array.elements(), ArrayElement.of(element), conventions));
        }
        ArrayElement existing = array.elements().get(index);
        if (ArgumentListEdits.sameText(existing.value(), element)) {
            return array;
        }
        Expr old = existing.value();
        Expr replacement = element.withLeadingTrivia(old.leadingTrivia()).withTrailingTrivia(old.trailingTrivia());
        return array.withElements(SeparatedLists.replace(array.elements(), index, existing.withValue(replacement)));
    }

    public static ArrayExpr removeByIdentity(ArrayExpr array, String identity) {
        ImmutableList<ArrayElement> elements = SeparatedLists.removeIf(array.elements(),
                element -> BaseIdentity.is(element.value(), identity));
        return elements == array.elements() ? array : array.withElements(elements);
    }

    /**
     * Makes the identities in {@code array} equal to those of {@code desired}. Surviving
     * elements are untouched; missing ones are appended in {@code desired} order.
     */
    public static ArrayExpr sync(ArrayExpr array, ImmutableList<Expr> desired, FormattingConventions conventions) {
        ImmutableSet<String> wanted = desired.collect(ArrayEdits::identityOf).toSet().toImmutable();
        ImmutableList<ArrayElement> kept = SeparatedLists.removeIf(array.elements(),
                element -> !BaseIdentity.of(element.value()).map(wanted::contains).orElse(false));
        ArrayExpr result = kept == array.elements() ? array : array.withElements(kept);
        for (Expr element : desired) {
            result = insertIfAbsent(result, element, conventions);
        }
        return result;
    }

    public static Optional<Expr> find(ArrayExpr array, String identity) {
        int index = indexOf(array, identity);
        return index < 0 ? Optional.empty() : Optional.of(array.elements().get(index).value());
    }

    private static int indexOf(ArrayExpr array, String identity) {
        return array.elements().detectIndex(element -> BaseIdentity.is(element.value(), identity));
    }

    private static String identityOf(Expr element) {
        return BaseIdentity.of(element)
                .orElseThrow(() -> new IllegalArgumentException("Array element has no identity: " + element));
    }
}

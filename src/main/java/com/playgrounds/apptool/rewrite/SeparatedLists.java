package com.playgrounds.apptool.rewrite;

import com.playgrounds.apptool.syntax.SeparatedItem;
import com.playgrounds.apptool.syntax.Token;
import com.playgrounds.apptool.syntax.Trivia;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;

import java.util.function.Predicate;

/**
 * Insertion and removal in comma separated lists that keep commas and trivia consistent.
 * <p>
 * New elements copy the line break and indentation of their neighbour, so a list laid out one
 * element per line stays that way and a single-line list stays on one line. A comment after an
 * element stays attached to that element when a comma has to be added behind it.
 */
public final class SeparatedLists {

    private SeparatedLists() {
    }

    public static <T extends SeparatedItem<T>> ImmutableList<T> append(ImmutableList<T> items, T item,
            FormattingConventions conventions) {
        return insert(items, items.size(), item, conventions);
    }

    /**
     * Inserts {@code item} so that it ends up at position {@code index}. The item's own leading
     * trivia and trailing comma are replaced.
     */
    public static <T extends SeparatedItem<T>> ImmutableList<T> insert(ImmutableList<T> items, int index, T item,
            FormattingConventions conventions) {
        if (index < 0 || index > items.size()) {
            throw new IndexOutOfBoundsException("Index " + index + " outside list of " + items.size());
        }
        MutableList<T> result = items.toList();
        Trivia leading = items.isEmpty()
                ? conventions.emptyListTrivia()
                : items.get(Math.max(index - 1, 0)).leadingTrivia().lineIndentation();

        // spaces before the closer stay in front of it
        Trivia padding = Trivia.EMPTY;
        if (index > 0) {
            T previous = items.get(index - 1);
            if (previous.trailingComma() == null) {
                Trivia moved = previous.contentTrailingTrivia();
                if (index == items.size() && !moved.containsNewline() && !moved.containsComment()) {
                    padding = moved;
                    moved = Trivia.EMPTY;
                }
                if (moved.isEmpty() && !leading.containsNewline()) {
                    moved = conventions.separatorTrivia();
                }
                previous = previous.withContentTrailingTrivia(Trivia.EMPTY).withTrailingComma(Token.comma(moved));
                result.set(index - 1, previous);
            }
            if (previous.trailingComma().trailingTrivia().endsWithLineComment() && !leading.containsNewline()) {
                leading = Trivia.newline().append(leading);
            }
        }

        T inserted = item.withTrailingComma(null).withLeadingTrivia(leading);
        if (!padding.isEmpty()) {
            inserted = inserted.withContentTrailingTrivia(padding);
        }
        boolean trailingCommaStyle = index == items.size() && index > 0 && items.get(index - 1).trailingComma() != null;
        if (index < items.size()) {
            Trivia after = items.get(index).leadingTrivia().isEmpty() ? conventions.separatorTrivia() : Trivia.EMPTY;
            inserted = inserted.withTrailingComma(Token.comma(after));
        } else if (trailingCommaStyle) {
            inserted = inserted.withTrailingComma(Token.comma(Trivia.EMPTY));
        }
        result.add(index, inserted);
        return result.toImmutable();
    }

    /**
     * Replaces the element at {@code index} keeping its comma.
     */
    public static <T extends SeparatedItem<T>> ImmutableList<T> replace(ImmutableList<T> items, int index, T item) {
        MutableList<T> result = items.toList();
        result.set(index, item.withTrailingComma(items.get(index).trailingComma()));
        return result.toImmutable();
    }

    /**
     * Removes every element matching {@code predicate}. When the last element goes and the list
     * did not use a trailing comma, the comma of the new last element is dropped too. Returns
     * {@code items} itself when nothing matches.
     */
    public static <T extends SeparatedItem<T>> ImmutableList<T> removeIf(ImmutableList<T> items,
            Predicate<? super T> predicate) {
        if (!items.anySatisfy(predicate::test)) {
            return items;
        }
        ImmutableList<T> kept = items.reject(predicate::test);
        T last = items.getLast();
        if (kept.isEmpty() || !predicate.test(last) || last.trailingComma() != null) {
            return kept;
        }
        T newLast = kept.getLast();
        if (newLast.trailingComma() == null) {
            return kept;
        }
        Trivia commaTrivia = newLast.trailingComma().trailingTrivia();
        T stripped = newLast.withTrailingComma(null);
        if (commaTrivia.containsComment()) {
            stripped = stripped.withContentTrailingTrivia(stripped.contentTrailingTrivia().append(commaTrivia));
        }
        MutableList<T> result = kept.toList();
        result.set(result.size() - 1, stripped);
        return result.toImmutable();
    }
}

package com.playgrounds.apptool.syntax;

/**
 * An element of a comma separated list: a call argument or an array element.
 *
 * @param <T> the concrete item type
 */
public interface SeparatedItem<T extends SeparatedItem<T>> {

    /**
     * The comma following this item, or {@code null}.
     */
    Token trailingComma();

    T withTrailingComma(Token comma);

    Trivia leadingTrivia();

    T withLeadingTrivia(Trivia trivia);

    /**
     * Trailing trivia of the item's content, that is of the token before the comma.
     */
    Trivia contentTrailingTrivia();

    T withContentTrailingTrivia(Trivia trivia);
}

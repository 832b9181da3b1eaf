package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * An atomic lexical unit together with the trivia on either side of it.
 * A token whose text is empty (other than end-of-file) was inserted by error recovery and
 * prints nothing but its trivia.
 */
public record Token(TokenKind tokenKind, String text, Trivia leadingTrivia, Trivia trailingTrivia)
        implements SyntaxNode {

    public static Token of(TokenKind kind, String text) {
        return new Token(kind, text, Trivia.EMPTY, Trivia.EMPTY);
    }

    public static Token missing(TokenKind kind) {
        return new Token(kind, "", Trivia.EMPTY, Trivia.EMPTY);
    }

    public static Token comma(Trivia trailingTrivia) {
        return new Token(TokenKind.COMMA, ",", Trivia.EMPTY, trailingTrivia);
    }

    public boolean isMissing() {
        return text.isEmpty() && tokenKind != TokenKind.END_OF_FILE;
    }

    public boolean is(TokenKind kind) {
        return tokenKind == kind;
    }

    /**
     * The identifier this token spells, without the back-ticks of an escaped identifier.
     */
    public String identifier() {
        if (text.length() >= 2 && text.startsWith("`") && text.endsWith("`")) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    public Token withText(String newText) {
        return new Token(tokenKind, newText, leadingTrivia, trailingTrivia);
    }

    @Override
    public Token withLeadingTrivia(Trivia trivia) {
        return new Token(tokenKind, text, trivia, trailingTrivia);
    }

    @Override
    public Token withTrailingTrivia(Trivia trivia) {
        return new Token(tokenKind, text, leadingTrivia, trivia);
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.TOKEN;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
        return Lists.immutable.empty();
    }
}

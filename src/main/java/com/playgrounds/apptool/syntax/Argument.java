package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * One element of a call argument list or tuple: optional label and colon, the value and an
 * optional trailing comma.
 */
public record Argument(Token label, Token colon, Expr value, Token trailingComma)
        implements SyntaxNode, SeparatedItem<Argument> {

    /**
     * A fresh argument {@code label: value} without a trailing comma.
     */
    public static Argument labeled(String label, Expr value) {
        return new Argument(Token.of(TokenKind.IDENTIFIER, label),
                new Token(TokenKind.COLON, ":", Trivia.EMPTY, Trivia.spaces(1)), value, null);
    }

    public static Argument unlabeled(Expr value) {
        return new Argument(null, null, value, null);
    }

    /**
     * The label without back-ticks, or {@code null} for an unlabeled argument.
     */
    public String labelText() {
        return label == null ? null : label.identifier();
    }

    public Argument withLabel(String newLabel) {
        if (label == null) {
            return new Argument(Token.of(TokenKind.IDENTIFIER, newLabel),
                    new Token(TokenKind.COLON, ":", Trivia.EMPTY, Trivia.spaces(1)),
                    value.withLeadingTrivia(Trivia.EMPTY), trailingComma)
                    .withLeadingTrivia(value.leadingTrivia());
        }
        return new Argument(label.withText(newLabel), colon, value, trailingComma);
    }

    public Argument withValue(Expr newValue) {
        return new Argument(label, colon, newValue, trailingComma);
    }

    @Override
    public Argument withTrailingComma(Token comma) {
        return new Argument(label, colon, value, comma);
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.ARGUMENT;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
        return SyntaxTrees.childrenOf(label, colon, value, trailingComma);
    }

    @Override
    public Trivia leadingTrivia() {
        return label != null ? label.leadingTrivia() : value.leadingTrivia();
    }

    @Override
    public Argument withLeadingTrivia(Trivia trivia) {
        if (label != null) {
            return new Argument(label.withLeadingTrivia(trivia), colon, value, trailingComma);
        }
        return withValue(value.withLeadingTrivia(trivia));
    }

    @Override
    public Trivia trailingTrivia() {
        return trailingComma != null ? trailingComma.trailingTrivia() : value.trailingTrivia();
    }

    @Override
    public Argument withTrailingTrivia(Trivia trivia) {
        if (trailingComma != null) {
            return withTrailingComma(trailingComma.withTrailingTrivia(trivia));
        }
        return withValue(value.withTrailingTrivia(trivia));
    }

    @Override
    public Trivia contentTrailingTrivia() {
        return value.trailingTrivia();
    }

    @Override
    public Argument withContentTrailingTrivia(Trivia trivia) {
        return withValue(value.withTrailingTrivia(trivia));
    }
}

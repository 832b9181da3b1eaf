package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;

public record ArrayElement(Expr value, Token trailingComma) implements SyntaxNode, SeparatedItem<ArrayElement> {

    public static ArrayElement of(Expr value) {
        return new ArrayElement(value, null);
    }

    public ArrayElement withValue(Expr newValue) {
        return new ArrayElement(newValue, trailingComma);
    }

    @Override
    public ArrayElement withTrailingComma(Token comma) {
        return new ArrayElement(value, comma);
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.ARRAY_ELEMENT;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
        return SyntaxTrees.childrenOf(value, trailingComma);
    }

    @Override
    public Trivia leadingTrivia() {
        return value.leadingTrivia();
    }

    @Override
    public ArrayElement withLeadingTrivia(Trivia trivia) {
        return withValue(value.withLeadingTrivia(trivia));
    }

    @Override
    public Trivia trailingTrivia() {
        return trailingComma != null ? trailingComma.trailingTrivia() : value.trailingTrivia();
    }

    @Override
    public ArrayElement withTrailingTrivia(Trivia trivia) {
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
    public ArrayElement withContentTrailingTrivia(Trivia trivia) {
        return withValue(value.withTrailingTrivia(trivia));
    }
}

package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

public record ArrayExpr(Token leftBracket, ImmutableList<ArrayElement> elements, Token rightBracket)
        implements Expr {

    public static ArrayExpr of(ImmutableList<ArrayElement> elements) {
        return new ArrayExpr(Token.of(TokenKind.LEFT_BRACKET, "["), elements, Token.of(TokenKind.RIGHT_BRACKET, "]"));
    }

    public ImmutableList<Expr> values() {
        return elements.collect(ArrayElement::value);
    }

    public ArrayExpr withElements(ImmutableList<ArrayElement> newElements) {
        return new ArrayExpr(leftBracket, newElements, rightBracket);
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.ARRAY;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
        MutableList<SyntaxNode> children = Lists.mutable.with(leftBracket);
        children.addAllIterable(elements);
        children.add(rightBracket);
        return children.toImmutable();
    }

    @Override
    public ArrayExpr withLeadingTrivia(Trivia trivia) {
        return new ArrayExpr(leftBracket.withLeadingTrivia(trivia), elements, rightBracket);
    }

    @Override
    public ArrayExpr withTrailingTrivia(Trivia trivia) {
        return new ArrayExpr(leftBracket, elements, rightBracket.withTrailingTrivia(trivia));
    }
}

package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

public record BlockExpr(Token leftBrace, ImmutableList<Expr> items, Token rightBrace) implements Expr {

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.BLOCK;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
        MutableList<SyntaxNode> children = Lists.mutable.with(leftBrace);
        children.addAllIterable(items);
        children.add(rightBrace);
        return children.toImmutable();
    }

    @Override
    public BlockExpr withLeadingTrivia(Trivia trivia) {
        return new BlockExpr(leftBrace.withLeadingTrivia(trivia), items, rightBrace);
    }

    @Override
    public BlockExpr withTrailingTrivia(Trivia trivia) {
        return new BlockExpr(leftBrace, items, rightBrace.withTrailingTrivia(trivia));
    }
}

package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * A parenthesized expression list that is not the argument list of a call.
 */
public record TupleExpr(Token leftParen, ImmutableList<Argument> elements, Token rightParen) implements Expr {

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.TUPLE;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
        MutableList<SyntaxNode> children = Lists.mutable.with(leftParen);
        children.addAllIterable(elements);
        children.add(rightParen);
        return children.toImmutable();
    }

    @Override
    public TupleExpr withLeadingTrivia(Trivia trivia) {
        return new TupleExpr(leftParen.withLeadingTrivia(trivia), elements, rightParen);
    }

    @Override
    public TupleExpr withTrailingTrivia(Trivia trivia) {
        return new TupleExpr(leftParen, elements, rightParen.withTrailingTrivia(trivia));
    }
}

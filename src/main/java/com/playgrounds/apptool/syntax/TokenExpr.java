package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * A single token in expression position that has no richer structure: a number, an operator,
 * a keyword such as {@code let}, or a stray closing bracket kept for round-tripping.
 */
public record TokenExpr(Token token) implements Expr {

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.OPAQUE;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
        return Lists.immutable.with(token);
    }

    @Override
    public TokenExpr withLeadingTrivia(Trivia trivia) {
        return new TokenExpr(token.withLeadingTrivia(trivia));
    }

    @Override
    public TokenExpr withTrailingTrivia(Trivia trivia) {
        return new TokenExpr(token.withTrailingTrivia(trivia));
    }
}

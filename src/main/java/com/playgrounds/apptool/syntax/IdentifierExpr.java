package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

public record IdentifierExpr(Token name) implements Expr {

    public static IdentifierExpr of(String name) {
        return new IdentifierExpr(Token.of(TokenKind.IDENTIFIER, name));
    }

    public String identifier() {
        return name.identifier();
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.IDENTIFIER;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
        return Lists.immutable.with(name);
    }

    @Override
    public IdentifierExpr withLeadingTrivia(Trivia trivia) {
        return new IdentifierExpr(name.withLeadingTrivia(trivia));
    }

    @Override
    public IdentifierExpr withTrailingTrivia(Trivia trivia) {
        return new IdentifierExpr(name.withTrailingTrivia(trivia));
    }
}

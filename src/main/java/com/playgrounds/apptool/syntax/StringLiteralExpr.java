package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

public record StringLiteralExpr(Token literal) implements Expr {

    public static StringLiteralExpr of(String value) {
        return new StringLiteralExpr(Token.of(TokenKind.STRING_LITERAL, StringLiterals.quote(value)));
    }

    /**
     * The decoded contents. Interpolated segments are returned verbatim.
     */
    public String value() {
        return StringLiterals.decode(literal.text());
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.STRING_LITERAL;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
        return Lists.immutable.with(literal);
    }

    @Override
    public StringLiteralExpr withLeadingTrivia(Trivia trivia) {
        return new StringLiteralExpr(literal.withLeadingTrivia(trivia));
    }

    @Override
    public StringLiteralExpr withTrailingTrivia(Trivia trivia) {
        return new StringLiteralExpr(literal.withTrailingTrivia(trivia));
    }
}

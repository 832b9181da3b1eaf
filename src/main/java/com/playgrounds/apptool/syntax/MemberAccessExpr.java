package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * {@code base.name}, or the implicit member form {@code .name} when {@code base} is {@code null}.
 */
public record MemberAccessExpr(Expr base, Token period, Token name) implements Expr {

    public static MemberAccessExpr implicit(String name) {
        return new MemberAccessExpr(null, Token.of(TokenKind.PERIOD, "."), Token.of(TokenKind.IDENTIFIER, name));
    }

    public String memberName() {
        return name.identifier();
    }

    public boolean isImplicit() {
        return base == null;
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.MEMBER_ACCESS;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
        return SyntaxTrees.childrenOf(base, period, name);
    }

    @Override
    public MemberAccessExpr withLeadingTrivia(Trivia trivia) {
        if (base != null) {
            return new MemberAccessExpr(base.withLeadingTrivia(trivia), period, name);
        }
        return new MemberAccessExpr(null, period.withLeadingTrivia(trivia), name);
    }

    @Override
    public MemberAccessExpr withTrailingTrivia(Trivia trivia) {
        return new MemberAccessExpr(base, period, name.withTrailingTrivia(trivia));
    }
}

package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;

/**
 * A function call such as {@code Package(name: "App")} or {@code .iOS("17.0")}.
 */
public record CallExpr(Expr callee, Token leftParen, ImmutableList<Argument> arguments, Token rightParen)
        implements Expr {

    public static CallExpr of(Expr callee, ImmutableList<Argument> arguments) {
        return new CallExpr(callee, Token.of(TokenKind.LEFT_PAREN, "("), arguments,
                Token.of(TokenKind.RIGHT_PAREN, ")"));
    }

    /**
     * The name the callee spells: the identifier of a bare reference or the member name of a
     * member access. Empty for any other callee.
     */
    public Optional<String> calleeName() {
        if (callee instanceof IdentifierExpr identifier) {
            return Optional.of(identifier.identifier());
        }
        if (callee instanceof MemberAccessExpr member) {
            return Optional.of(member.memberName());
        }
        return Optional.empty();
    }

    public CallExpr withArguments(ImmutableList<Argument> newArguments) {
        return new CallExpr(callee, leftParen, newArguments, rightParen);
    }

    public CallExpr withCallee(Expr newCallee) {
        return new CallExpr(newCallee, leftParen, arguments, rightParen);
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.CALL;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
        MutableList<SyntaxNode> children = Lists.mutable.with(callee, leftParen);
        children.addAllIterable(arguments);
        children.add(rightParen);
        return children.toImmutable();
    }

    @Override
    public CallExpr withLeadingTrivia(Trivia trivia) {
        return withCallee(callee.withLeadingTrivia(trivia));
    }

    @Override
    public CallExpr withTrailingTrivia(Trivia trivia) {
        return new CallExpr(callee, leftParen, arguments, rightParen.withTrailingTrivia(trivia));
    }
}

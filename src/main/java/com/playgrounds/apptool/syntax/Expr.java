package com.playgrounds.apptool.syntax;

public sealed interface Expr extends SyntaxNode
        permits IdentifierExpr, MemberAccessExpr, StringLiteralExpr, CallExpr, ArrayExpr, TupleExpr,
                BlockExpr, SequenceExpr, TokenExpr {

    @Override
    Expr withLeadingTrivia(Trivia trivia);

    @Override
    Expr withTrailingTrivia(Trivia trivia);
}

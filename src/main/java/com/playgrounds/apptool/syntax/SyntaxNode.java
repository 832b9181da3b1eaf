package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * A node of the full-fidelity manifest tree. The set of node kinds is closed; code that needs
 * to look inside a node walks {@link #children()} or tests for the concrete record type.
 * Every node is immutable and {@code with...} methods return updated copies.
 */
public sealed interface SyntaxNode permits Token, SourceFile, Argument, ArrayElement, Expr {

    SyntaxKind kind();

    /**
     * The direct children in source order, tokens included.
     */
    ImmutableList<SyntaxNode> children();

    default Trivia leadingTrivia() {
        return SyntaxTrees.firstToken(this).map(Token::leadingTrivia).orElse(Trivia.EMPTY);
    }

    default Trivia trailingTrivia() {
        return SyntaxTrees.lastToken(this).map(Token::trailingTrivia).orElse(Trivia.EMPTY);
    }

    /**
     * Replaces the leading trivia of the first token of this node.
     */
    SyntaxNode withLeadingTrivia(Trivia trivia);

    /**
     * Replaces the trailing trivia of the last token of this node.
     */
    SyntaxNode withTrailingTrivia(Trivia trivia);
}

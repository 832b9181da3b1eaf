package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;

/**
 * The root of a parsed manifest. Trivia after the last token lives on {@link #endOfFile()}.
 */
public record SourceFile(ImmutableList<Expr> items, Token endOfFile) implements SyntaxNode {

    public SourceFile withItems(ImmutableList<Expr> newItems) {
        return new SourceFile(newItems, endOfFile);
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.SOURCE_FILE;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
        MutableList<SyntaxNode> children = items.collect(item -> (SyntaxNode) item).toList();
        children.add(endOfFile);
        return children.toImmutable();
    }

    @Override
    public SourceFile withLeadingTrivia(Trivia trivia) {
        if (items.isEmpty()) {
            return new SourceFile(items, endOfFile.withLeadingTrivia(trivia));
        }
        MutableList<Expr> updated = items.toList();
        updated.set(0, items.getFirst().withLeadingTrivia(trivia));
        return new SourceFile(updated.toImmutable(), endOfFile);
    }

    @Override
    public SourceFile withTrailingTrivia(Trivia trivia) {
        return new SourceFile(items, endOfFile.withTrailingTrivia(trivia));
    }
}

package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;

/**
 * Juxtaposed expressions the manifest grammar does not model, such as {@code a ?? b}. May be
 * empty when a list element has no content at all.
 */
public record SequenceExpr(ImmutableList<Expr> items) implements Expr {

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.SEQUENCE;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
        return items.collect(item -> (SyntaxNode) item);
    }

    @Override
    public SequenceExpr withLeadingTrivia(Trivia trivia) {
        if (items.isEmpty()) {
            return this;
        }
        MutableList<Expr> updated = items.toList();
        updated.set(0, items.getFirst().withLeadingTrivia(trivia));
        return new SequenceExpr(updated.toImmutable());
    }

    @Override
    public SequenceExpr withTrailingTrivia(Trivia trivia) {
        if (items.isEmpty()) {
            return this;
        }
        MutableList<Expr> updated = items.toList();
        updated.set(updated.size() - 1, items.getLast().withTrailingTrivia(trivia));
        return new SequenceExpr(updated.toImmutable());
    }
}

package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * The trivia attached to one side of a token. Immutable; every edit returns a new instance.
 */
public record Trivia(ImmutableList<TriviaPiece> pieces) {

    public static final Trivia EMPTY = new Trivia(Lists.immutable.empty());

    public static Trivia of(TriviaPiece... pieces) {
        return new Trivia(Lists.immutable.with(pieces));
    }

    /**
     * Splits raw text into trivia pieces. Characters that cannot be trivia are kept as
     * {@link TriviaPiece.Kind#GARBAGE} so that {@link #text()} always returns {@code raw}.
     */
    public static Trivia parse(String raw) {
        if (raw.isEmpty()) {
            return EMPTY;
        }
        return ManifestLexer.scanTrivia(raw);
    }

    public static Trivia spaces(int count) {
        return count == 0 ? EMPTY : of(TriviaPiece.spaces(count));
    }

    public static Trivia newline() {
        return of(TriviaPiece.newlines(1));
    }

    public boolean isEmpty() {
        return pieces.isEmpty();
    }

    public boolean containsNewline() {
        return pieces.anySatisfy(TriviaPiece::isNewline);
    }

    public boolean containsComment() {
        return pieces.anySatisfy(TriviaPiece::isComment);
    }

    /**
     * Whether a token placed right after this trivia would land inside a line comment.
     */
    public boolean endsWithLineComment() {
        for (int i = pieces.size() - 1; i >= 0; i--) {
            TriviaPiece piece = pieces.get(i);
            if (piece.isWhitespace()) {
                continue;
            }
            return piece.kind() == TriviaPiece.Kind.LINE_COMMENT || piece.kind() == TriviaPiece.Kind.DOC_LINE_COMMENT;
        }
        return false;
    }

    public Trivia append(Trivia other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return new Trivia(pieces.newWithAll(other.pieces));
    }

    public Trivia prepend(TriviaPiece... leading) {
        return new Trivia(Lists.immutable.with(leading).newWithAll(pieces));
    }

    /**
     * The line break and indentation that introduce the token this trivia leads, without any
     * comments or blank lines above it. Used when a new sibling should start on its own line at
     * the same column.
     */
    public Trivia lineIndentation() {
        int lastNewline = pieces.detectLastIndex(TriviaPiece::isNewline);
        if (lastNewline < 0) {
            return new Trivia(pieces.select(TriviaPiece::isWhitespace));
        }
        String breaks = pieces.get(lastNewline).text();
        String lineBreak = breaks.endsWith("\r\n") ? "\r\n" : breaks.substring(breaks.length() - 1);
        MutableList<TriviaPiece> result = Lists.mutable.with(new TriviaPiece(TriviaPiece.Kind.NEWLINES, lineBreak));
        for (int i = lastNewline + 1; i < pieces.size(); i++) {
            TriviaPiece piece = pieces.get(i);
            if (piece.isWhitespace()) {
                result.add(piece);
            }
        }
        return new Trivia(result.toImmutable());
    }

    public String text() {
        if (pieces.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (TriviaPiece piece : pieces) {
            sb.append(piece.text());
        }
        return sb.toString();
    }
}

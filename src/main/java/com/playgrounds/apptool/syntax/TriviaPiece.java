package com.playgrounds.apptool.syntax;

/**
 * One run of non-semantic source text: whitespace, line breaks or a comment.
 */
public record TriviaPiece(Kind kind, String text) {

    public enum Kind {
        SPACES,
        TABS,
        NEWLINES,
        LINE_COMMENT,
        DOC_LINE_COMMENT,
        BLOCK_COMMENT,
        DOC_BLOCK_COMMENT,
        GARBAGE
    }

    public static TriviaPiece spaces(int count) {
        return new TriviaPiece(Kind.SPACES, " ".repeat(count));
    }

    public static TriviaPiece newlines(int count) {
        return new TriviaPiece(Kind.NEWLINES, "\n".repeat(count));
    }

    public static TriviaPiece lineComment(String text) {
        return new TriviaPiece(Kind.LINE_COMMENT, text);
    }

    public boolean isWhitespace() {
        return kind == Kind.SPACES || kind == Kind.TABS;
    }

    public boolean isNewline() {
        return kind == Kind.NEWLINES;
    }

    public boolean isComment() {
        return switch (kind) {
            case LINE_COMMENT, DOC_LINE_COMMENT, BLOCK_COMMENT, DOC_BLOCK_COMMENT -> true;
            default -> false;
        };
    }
}

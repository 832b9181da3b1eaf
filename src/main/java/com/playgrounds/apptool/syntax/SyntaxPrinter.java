package com.playgrounds.apptool.syntax;

/**
 * Turns a tree back into source text. Printing a freshly parsed tree reproduces the input
 * exactly.
 */
public final class SyntaxPrinter {

    private SyntaxPrinter() {
    }

    public static String print(SyntaxNode node) {
        StringBuilder sb = new StringBuilder();
        append(sb, node, true);
        return sb.toString();
    }

    /**
     * Token text only. Two nodes print equal here when they differ at most in whitespace and
     * comments.
     */
    public static String printWithoutTrivia(SyntaxNode node) {
        StringBuilder sb = new StringBuilder();
        append(sb, node, false);
        return sb.toString();
    }

    private static void append(StringBuilder sb, SyntaxNode node, boolean withTrivia) {
        if (node instanceof Token token) {
            if (withTrivia) {
                sb.append(token.leadingTrivia().text());
            }
            sb.append(token.text());
            if (withTrivia) {
                sb.append(token.trailingTrivia().text());
            }
            return;
        }
        for (SyntaxNode child : node.children()) {
            append(sb, child, withTrivia);
        }
    }
}

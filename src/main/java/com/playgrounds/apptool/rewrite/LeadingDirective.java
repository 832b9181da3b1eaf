package com.playgrounds.apptool.rewrite;

import com.playgrounds.apptool.syntax.SourceFile;
import com.playgrounds.apptool.syntax.SyntaxTrees;
import com.playgrounds.apptool.syntax.Token;
import com.playgrounds.apptool.syntax.Trivia;
import com.playgrounds.apptool.syntax.TriviaPiece;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;

import java.util.Locale;
import java.util.Optional;

/**
 * A {@code // name: payload} comment in the leading trivia of the first token of a file.
 */
public record LeadingDirective(String name) {

    public static final LeadingDirective SWIFT_TOOLS_VERSION = new LeadingDirective("swift-tools-version");

    public Optional<String> read(SourceFile tree) {
        ImmutableList<TriviaPiece> pieces = firstTokenTrivia(tree).pieces();
        int index = indexIn(pieces);
        return index < 0 ? Optional.empty() : Optional.of(payload(pieces.get(index).text()));
    }

    /**
     * Rewrites the directive to carry {@code payload}, or puts a new directive and a blank line
     * in front of the file.
     */
    public SourceFile write(SourceFile tree, String payload, FormattingConventions conventions) {
        String comment = "// " + name + ": " + payload;
        Trivia trivia = firstTokenTrivia(tree);
        int index = indexIn(trivia.pieces());
        Trivia updated;
        if (index >= 0) {
            if (payload(trivia.pieces().get(index).text()).equals(payload)) {
                return tree;
            }
            MutableList<TriviaPiece> pieces = trivia.pieces().toList();
            pieces.set(index, TriviaPiece.lineComment(comment));
            updated = new Trivia(pieces.toImmutable());
        } else {
            updated = Trivia.of(TriviaPiece.lineComment(comment))
                    .append(Trivia.parse(conventions.directiveSeparator()))
                    .append(trivia);
        }
        return tree.withLeadingTrivia(updated);
    }

    private static Trivia firstTokenTrivia(SourceFile tree) {
        return SyntaxTrees.firstToken(tree).map(Token::leadingTrivia).orElse(Trivia.EMPTY);
    }

    private int indexIn(ImmutableList<TriviaPiece> pieces) {
        return pieces.detectIndex(piece -> piece.kind() == TriviaPiece.Kind.LINE_COMMENT
                && body(piece.text()).toLowerCase(Locale.ROOT).startsWith(name.toLowerCase(Locale.ROOT) + ":"));
    }

    private String payload(String comment) {
        String value = body(comment).substring(name.length() + 1).trim();
        int end = value.indexOf(';');
        return end < 0 ? value : value.substring(0, end).trim();
    }

    private static String body(String comment) {
        return comment.substring(2).trim();
    }
}

package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.logging.Logger;

/**
 * Splits manifest source into tokens with attached trivia.
 * <p>
 * Trailing trivia of a token runs up to, but not including, the next line break. Everything
 * else between two tokens is leading trivia of the second. The lexer never fails: text it does
 * not understand becomes a single-character operator token, so concatenating every token with
 * its trivia reproduces the input.
 */
public final class ManifestLexer {

    private static final Logger LOG = Logger.getLogger(ManifestLexer.class.getName());

    private static final String OPERATOR_CHARS = "/=-+!*%<>&|^~?";

    private final String source;
    private int pos;

    private ManifestLexer(String source) {
        this.source = source;
    }

    public static ImmutableList<Token> tokenize(String source) {
        ManifestLexer lexer = new ManifestLexer(source);
        ImmutableList<Token> tokens = lexer.scanTokens();
        LOG.finer(() -> "Tokenized " + source.length() + " characters into " + tokens.size() + " tokens");
        return tokens;
    }

    static Trivia scanTrivia(String raw) {
        ManifestLexer lexer = new ManifestLexer(raw);
        MutableList<TriviaPiece> pieces = Lists.mutable.empty();
        while (lexer.pos < raw.length()) {
            TriviaPiece piece = lexer.scanTriviaPiece(false);
            if (piece == null) {
                int start = lexer.pos;
                lexer.pos += Character.charCount(raw.codePointAt(start));
                piece = new TriviaPiece(TriviaPiece.Kind.GARBAGE, raw.substring(start, lexer.pos));
            }
            pieces.add(piece);
        }
        return new Trivia(pieces.toImmutable());
    }

    private ImmutableList<Token> scanTokens() {
        MutableList<Token> tokens = Lists.mutable.empty();
        while (true) {
            Trivia leading = scanTrivia(false);
            if (pos >= source.length()) {
                tokens.add(new Token(TokenKind.END_OF_FILE, "", leading, Trivia.EMPTY));
                return tokens.toImmutable();
            }
            int start = pos;
            TokenKind kind = scanToken();
            String text = source.substring(start, pos);
            Trivia trailing = scanTrivia(true);
            tokens.add(new Token(kind, text, leading, trailing));
        }
    }

    private Trivia scanTrivia(boolean stopAtNewline) {
        MutableList<TriviaPiece> pieces = Lists.mutable.empty();
        TriviaPiece piece;
        while ((piece = scanTriviaPiece(stopAtNewline)) != null) {
            pieces.add(piece);
        }
        return pieces.isEmpty() ? Trivia.EMPTY : new Trivia(pieces.toImmutable());
    }

    private TriviaPiece scanTriviaPiece(boolean stopAtNewline) {
        if (pos >= source.length()) {
            return null;
        }
        int start = pos;
        char c = source.charAt(pos);
        if (c == ' ') {
            return run(start, ' ', TriviaPiece.Kind.SPACES);
        }
        if (c == '\t') {
            return run(start, '\t', TriviaPiece.Kind.TABS);
        }
        if (c == '\n' || c == '\r') {
            if (stopAtNewline) {
                return null;
            }
            while (pos < source.length() && (source.charAt(pos) == '\n' || source.charAt(pos) == '\r')) {
                pos++;
            }
            return new TriviaPiece(TriviaPiece.Kind.NEWLINES, source.substring(start, pos));
        }
        if (start == 0 && source.startsWith("#!")) {
            skipToLineEnd();
            return new TriviaPiece(TriviaPiece.Kind.GARBAGE, source.substring(start, pos));
        }
        if (source.startsWith("//", pos)) {
            boolean doc = source.startsWith("///", pos) && !source.startsWith("////", pos);
            skipToLineEnd();
            return new TriviaPiece(doc ? TriviaPiece.Kind.DOC_LINE_COMMENT : TriviaPiece.Kind.LINE_COMMENT,
                    source.substring(start, pos));
        }
        if (source.startsWith("/*", pos)) {
            boolean doc = source.startsWith("/**", pos) && !source.startsWith("/**/", pos);
            skipBlockComment();
            return new TriviaPiece(doc ? TriviaPiece.Kind.DOC_BLOCK_COMMENT : TriviaPiece.Kind.BLOCK_COMMENT,
                    source.substring(start, pos));
        }
        return null;
    }

    private TriviaPiece run(int start, char c, TriviaPiece.Kind kind) {
        while (pos < source.length() && source.charAt(pos) == c) {
            pos++;
        }
        return new TriviaPiece(kind, source.substring(start, pos));
    }

    private void skipToLineEnd() {
        while (pos < source.length() && source.charAt(pos) != '\n' && source.charAt(pos) != '\r') {
            pos++;
        }
    }

    private void skipBlockComment() {
        int depth = 0;
        while (pos < source.length()) {
            if (source.startsWith("/*", pos)) {
                depth++;
                pos += 2;
            } else if (source.startsWith("*/", pos)) {
                depth--;
                pos += 2;
                if (depth == 0) {
                    return;
                }
            } else {
                pos++;
            }
        }
    }

    private TokenKind scanToken() {
        int c = source.codePointAt(pos);
        switch (c) {
            case '(':
                pos++;
                return TokenKind.LEFT_PAREN;
            case ')':
                pos++;
                return TokenKind.RIGHT_PAREN;
            case '[':
                pos++;
                return TokenKind.LEFT_BRACKET;
            case ']':
                pos++;
                return TokenKind.RIGHT_BRACKET;
            case '{':
                pos++;
                return TokenKind.LEFT_BRACE;
            case '}':
                pos++;
                return TokenKind.RIGHT_BRACE;
            case ',':
                pos++;
                return TokenKind.COMMA;
            case ':':
                pos++;
                return TokenKind.COLON;
            case '"':
                scanString(0);
                return TokenKind.STRING_LITERAL;
            case '`':
                return scanEscapedIdentifier();
            case '#':
                return scanPound();
            case '.':
                if (source.startsWith("..", pos)) {
                    while (pos < source.length()
                            && (source.charAt(pos) == '.' || OPERATOR_CHARS.indexOf(source.charAt(pos)) >= 0)) {
                        pos++;
                    }
                    return TokenKind.OPERATOR;
                }
                pos++;
                return TokenKind.PERIOD;
            default:
                break;
        }
        if (Character.isDigit(c)) {
            scanNumber();
            return TokenKind.NUMBER;
        }
        if (Character.isJavaIdentifierStart(c)) {
            scanIdentifierRest();
            return TokenKind.IDENTIFIER;
        }
        if (OPERATOR_CHARS.indexOf(c) >= 0) {
            pos++;
            while (pos < source.length() && OPERATOR_CHARS.indexOf(source.charAt(pos)) >= 0
                    && !source.startsWith("//", pos) && !source.startsWith("/*", pos)) {
                pos++;
            }
            return TokenKind.OPERATOR;
        }
        pos += Character.charCount(c);
        return TokenKind.OPERATOR;
    }

    private void scanIdentifierRest() {
        pos += Character.charCount(source.codePointAt(pos));
        while (pos < source.length()) {
            int c = source.codePointAt(pos);
            if (!Character.isJavaIdentifierPart(c) || Character.isIdentifierIgnorable(c)) {
                return;
            }
            pos += Character.charCount(c);
        }
    }

    private TokenKind scanEscapedIdentifier() {
        int close = pos + 1;
        while (close < source.length() && source.charAt(close) != '`' && source.charAt(close) != '\n') {
            close++;
        }
        if (close < source.length() && source.charAt(close) == '`' && close > pos + 1) {
            pos = close + 1;
            return TokenKind.IDENTIFIER;
        }
        pos++;
        return TokenKind.OPERATOR;
    }

    private void scanNumber() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            boolean fraction = c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1));
            if (!Character.isLetterOrDigit(c) && c != '_' && !fraction) {
                return;
            }
            pos++;
        }
    }

    private TokenKind scanPound() {
        int hashes = 0;
        while (pos + hashes < source.length() && source.charAt(pos + hashes) == '#') {
            hashes++;
        }
        if (pos + hashes < source.length() && source.charAt(pos + hashes) == '"') {
            pos += hashes;
            scanString(hashes);
            return TokenKind.STRING_LITERAL;
        }
        pos++;
        if (pos < source.length() && Character.isJavaIdentifierStart(source.codePointAt(pos))) {
            scanIdentifierRest();
            return TokenKind.POUND_KEYWORD;
        }
        return TokenKind.OPERATOR;
    }

    /**
     * Scans a string literal starting at the opening quote. {@code hashes} is the number of
     * {@code #} delimiters of a raw string, already consumed.
     */
    private void scanString(int hashes) {
        String closeHashes = "#".repeat(hashes);
        String escape = "\\" + closeHashes;
        boolean multiLine = source.startsWith("\"\"\"", pos);
        String quotes = multiLine ? "\"\"\"" : "\"";
        pos += quotes.length();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (!multiLine && (c == '\n' || c == '\r')) {
                return;
            }
            if (source.startsWith(escape, pos)) {
                pos += escape.length();
                if (pos < source.length() && source.charAt(pos) == '(') {
                    pos++;
                    scanInterpolation();
                } else if (pos < source.length()) {
                    pos++;
                }
                continue;
            }
            if (source.startsWith(quotes + closeHashes, pos)) {
                pos += quotes.length() + hashes;
                return;
            }
            pos++;
        }
    }

    private void scanInterpolation() {
        int depth = 1;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '"') {
                scanString(0);
                continue;
            }
            if (c == '\n' || c == '\r') {
                return;
            }
            pos++;
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return;
            }
        }
    }
}

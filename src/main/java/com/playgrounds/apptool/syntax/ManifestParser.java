package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.logging.Logger;

/**
 * Builds the full-fidelity tree for a manifest.
 * <p>
 * Only the shapes that manifest editing cares about get their own nodes: calls, labeled
 * argument lists, arrays, member accesses, identifiers and string literals. Anything else is
 * kept as opaque tokens. The parser accepts every input; a missing closing bracket is recorded
 * as a zero-width token, and a stray one becomes an opaque item. For any input
 * {@code SyntaxPrinter.print(parse(text)).equals(text)}.
 */
public final class ManifestParser {

    private static final Logger LOG = Logger.getLogger(ManifestParser.class.getName());

    private final ImmutableList<Token> tokens;
    private int index;

    private ManifestParser(ImmutableList<Token> tokens) {
        this.tokens = tokens;
    }

    public static SourceFile parse(String source) {
        ManifestParser parser = new ManifestParser(ManifestLexer.tokenize(source));
        SourceFile file = parser.parseSourceFile();
        LOG.fine(() -> "Parsed manifest with " + file.items().size() + " top-level items");
        return file;
    }

    /**
     * Parses a source fragment into one expression, for building replacement nodes. Trivia
     * after the fragment's last token is dropped.
     */
    public static Expr parseExpression(String source) {
        SourceFile file = new ManifestParser(ManifestLexer.tokenize(source)).parseSourceFile();
        ImmutableList<Expr> items = file.items();
        return items.size() == 1 ? items.getFirst() : new SequenceExpr(items);
    }

    /**
     * Parses a single call argument such as {@code resources: [.process("Resources")]}.
     *
     * @throws IllegalArgumentException if the fragment does not hold an argument
     */
    public static Argument parseArgument(String source) {
        Expr expr = parseExpression("call(" + source + ")");
        if (expr instanceof CallExpr call && call.arguments().size() == 1) {
            return call.arguments().getFirst();
        }
        throw new IllegalArgumentException("Not a single argument: " + source);
    }

    private SourceFile parseSourceFile() {
        MutableList<Expr> items = Lists.mutable.empty();
        while (!at(TokenKind.END_OF_FILE)) {
            items.add(parsePostfix());
        }
        return new SourceFile(items.toImmutable(), advance());
    }

    private Expr parsePostfix() {
        Expr expr = parsePrimary();
        while (true) {
            if (at(TokenKind.LEFT_PAREN) && isCallable(expr) && !current().leadingTrivia().containsNewline()) {
                Token left = advance();
                ImmutableList<Argument> arguments = parseArguments(TokenKind.RIGHT_PAREN);
                expr = new CallExpr(expr, left, arguments, expect(TokenKind.RIGHT_PAREN));
            } else if (at(TokenKind.PERIOD) && peek(1).is(TokenKind.IDENTIFIER)) {
                Token period = advance();
                expr = new MemberAccessExpr(expr, period, advance());
            } else {
                return expr;
            }
        }
    }

    private static boolean isCallable(Expr expr) {
        return expr instanceof IdentifierExpr || expr instanceof MemberAccessExpr || expr instanceof CallExpr;
    }

    private Expr parsePrimary() {
        Token token = current();
        switch (token.tokenKind()) {
            case IDENTIFIER:
                return new IdentifierExpr(advance());
            case STRING_LITERAL:
                return new StringLiteralExpr(advance());
            case PERIOD:
                if (peek(1).is(TokenKind.IDENTIFIER)) {
                    Token period = advance();
                    return new MemberAccessExpr(null, period, advance());
                }
                return new TokenExpr(advance());
            case LEFT_BRACKET:
                return parseArray();
            case LEFT_PAREN: {
                Token left = advance();
                ImmutableList<Argument> elements = parseArguments(TokenKind.RIGHT_PAREN);
                return new TupleExpr(left, elements, expect(TokenKind.RIGHT_PAREN));
            }
            case LEFT_BRACE:
                return parseBlock();
            default:
                return new TokenExpr(advance());
        }
    }

    private ArrayExpr parseArray() {
        Token left = advance();
        MutableList<ArrayElement> elements = Lists.mutable.empty();
        while (!at(TokenKind.RIGHT_BRACKET) && !atListEnd()) {
            Expr value = parseValue();
            Token comma = at(TokenKind.COMMA) ? advance() : null;
            elements.add(new ArrayElement(value, comma));
        }
        return new ArrayExpr(left, elements.toImmutable(), expect(TokenKind.RIGHT_BRACKET));
    }

    private ImmutableList<Argument> parseArguments(TokenKind closer) {
        MutableList<Argument> arguments = Lists.mutable.empty();
        while (!at(closer) && !atListEnd()) {
            Token label = null;
            Token colon = null;
            if (at(TokenKind.IDENTIFIER) && peek(1).is(TokenKind.COLON)) {
                label = advance();
                colon = advance();
            }
            Expr value = parseValue();
            Token comma = at(TokenKind.COMMA) ? advance() : null;
            arguments.add(new Argument(label, colon, value, comma));
        }
        return arguments.toImmutable();
    }

    private BlockExpr parseBlock() {
        Token left = advance();
        MutableList<Expr> items = Lists.mutable.empty();
        while (!at(TokenKind.RIGHT_BRACE) && !atListEnd()) {
            items.add(parsePostfix());
        }
        return new BlockExpr(left, items.toImmutable(), expect(TokenKind.RIGHT_BRACE));
    }

    /**
     * Parses one list element value up to the next comma or closing bracket.
     */
    private Expr parseValue() {
        MutableList<Expr> items = Lists.mutable.empty();
        while (!at(TokenKind.COMMA) && !atListEnd()) {
            items.add(parsePostfix());
        }
        return items.size() == 1 ? items.getFirst() : new SequenceExpr(items.toImmutable());
    }

    private boolean atListEnd() {
        return switch (current().tokenKind()) {
            case RIGHT_PAREN, RIGHT_BRACKET, RIGHT_BRACE, END_OF_FILE -> true;
            default -> false;
        };
    }

    private Token expect(TokenKind kind) {
        if (at(kind)) {
            return advance();
        }
        LOG.fine(() -> "Missing " + kind + " before token " + index);
        return Token.missing(kind);
    }

    private boolean at(TokenKind kind) {
        return current().is(kind);
    }

    private Token current() {
        return tokens.get(index);
    }

    private Token peek(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (index < tokens.size() - 1) {
            index++;
        }
        return token;
    }
}

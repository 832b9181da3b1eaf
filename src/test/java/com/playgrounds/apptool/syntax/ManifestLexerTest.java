package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ManifestLexerTest {

    @Test
    public void testPunctuationAndIdentifiers() {
        ImmutableList<Token> tokens = ManifestLexer.tokenize(".iOS(\"17.0\")");

        assertEquals(
                Lists.immutable.with(TokenKind.PERIOD, TokenKind.IDENTIFIER, TokenKind.LEFT_PAREN,
                        TokenKind.STRING_LITERAL, TokenKind.RIGHT_PAREN, TokenKind.END_OF_FILE),
                tokens.collect(Token::tokenKind));
        assertEquals("iOS", tokens.get(1).text());
        assertEquals("\"17.0\"", tokens.get(3).text());
    }

    @Test
    public void testTrailingTriviaStopsAtLineBreak() {
        ImmutableList<Token> tokens = ManifestLexer.tokenize("a // note\n  b");

        Token a = tokens.get(0);
        assertEquals(" // note", a.trailingTrivia().text());
        assertEquals(TriviaPiece.Kind.LINE_COMMENT, a.trailingTrivia().pieces().getLast().kind());

        Token b = tokens.get(1);
        assertEquals("\n  ", b.leadingTrivia().text());
        assertEquals(TriviaPiece.Kind.NEWLINES, b.leadingTrivia().pieces().getFirst().kind());
        assertTrue(b.trailingTrivia().isEmpty());
    }

    @Test
    public void testNestedBlockComment() {
        ImmutableList<Token> tokens = ManifestLexer.tokenize("/* a /* b */ c */ x");

        assertEquals(2, tokens.size());
        Token x = tokens.getFirst();
        assertEquals("x", x.text());
        assertEquals(TriviaPiece.Kind.BLOCK_COMMENT, x.leadingTrivia().pieces().getFirst().kind());
        assertEquals("/* a /* b */ c */", x.leadingTrivia().pieces().getFirst().text());
    }

    @Test
    public void testDocComments() {
        Token token = ManifestLexer.tokenize("/// docs\n/** more */\nx").getFirst();

        assertEquals(TriviaPiece.Kind.DOC_LINE_COMMENT, token.leadingTrivia().pieces().get(0).kind());
        assertEquals(TriviaPiece.Kind.DOC_BLOCK_COMMENT, token.leadingTrivia().pieces().get(2).kind());
    }

    @Test
    public void testInterpolatedStringIsOneToken() {
        ImmutableList<Token> tokens = ManifestLexer.tokenize("\"a\\(b(\"c\"))d\"");

        assertEquals(2, tokens.size());
        assertEquals(TokenKind.STRING_LITERAL, tokens.getFirst().tokenKind());
    }

    @Test
    public void testRawString() {
        ImmutableList<Token> tokens = ManifestLexer.tokenize("#\"a\"b\"#");

        assertEquals(2, tokens.size());
        assertEquals("#\"a\"b\"#", tokens.getFirst().text());
        assertEquals(TokenKind.STRING_LITERAL, tokens.getFirst().tokenKind());
    }

    @Test
    public void testMultiLineString() {
        String source = "\"\"\"\n  line \"quoted\"\n  \"\"\"";
        ImmutableList<Token> tokens = ManifestLexer.tokenize(source);

        assertEquals(2, tokens.size());
        assertEquals(source, tokens.getFirst().text());
    }

    @Test
    public void testUnterminatedStringEndsAtLineBreak() {
        ImmutableList<Token> tokens = ManifestLexer.tokenize("\"abc\nx");

        assertEquals("\"abc", tokens.get(0).text());
        assertEquals("x", tokens.get(1).text());
        assertEquals("\n", tokens.get(1).leadingTrivia().text());
    }

    @Test
    public void testShebangIsGarbageTrivia() {
        Token token = ManifestLexer.tokenize("#!/usr/bin/swift\nlet x").getFirst();

        assertEquals("let", token.text());
        assertEquals(TriviaPiece.Kind.GARBAGE, token.leadingTrivia().pieces().getFirst().kind());
    }

    @Test
    public void testNumbersOperatorsAndEscapedIdentifiers() {
        ImmutableList<Token> tokens = ManifestLexer.tokenize("10.15 ..< `default` #if");

        assertEquals(TokenKind.NUMBER, tokens.get(0).tokenKind());
        assertEquals("10.15", tokens.get(0).text());
        assertEquals(TokenKind.OPERATOR, tokens.get(1).tokenKind());
        assertEquals("..<", tokens.get(1).text());
        assertEquals(TokenKind.IDENTIFIER, tokens.get(2).tokenKind());
        assertEquals("default", tokens.get(2).identifier());
        assertEquals(TokenKind.POUND_KEYWORD, tokens.get(3).tokenKind());
    }

    @Test
    public void testUnknownCharactersBecomeTokens() {
        ImmutableList<Token> tokens = ManifestLexer.tokenize("a @ § b");

        assertEquals(5, tokens.size());
        assertEquals("@", tokens.get(1).text());
        assertEquals("§", tokens.get(2).text());
    }

    @Test
    public void testEndOfFileCarriesTrailingTrivia() {
        ImmutableList<Token> tokens = ManifestLexer.tokenize("x\n\n// end\n");

        Token eof = tokens.getLast();
        assertEquals(TokenKind.END_OF_FILE, eof.tokenKind());
        assertEquals("\n\n// end\n", eof.leadingTrivia().text());
        assertFalse(eof.isMissing());
    }

    @Test
    public void testEmptyInput() {
        ImmutableList<Token> tokens = ManifestLexer.tokenize("");

        assertEquals(1, tokens.size());
        assertEquals(TokenKind.END_OF_FILE, tokens.getFirst().tokenKind());
    }
}

package com.playgrounds.apptool.syntax;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class TriviaTest {

    @Test
    public void testLineIndentationDropsCommentsAndBlankLines() {
        Trivia trivia = Trivia.parse("\n\n    // note\n    ");

        assertEquals("\n    ", trivia.lineIndentation().text());
    }

    @Test
    public void testLineIndentationOnOneLine() {
        assertEquals("  ", Trivia.parse(" /* x */ ").lineIndentation().text());
        assertTrue(Trivia.EMPTY.lineIndentation().isEmpty());
    }

    @Test
    public void testLineIndentationKeepsCarriageReturns() {
        assertEquals("\r\n\t", Trivia.parse("\r\n\r\n\t").lineIndentation().text());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "' // note'      | true",
            "' /// doc  '    | true",
            "' /* block */ ' | false",
            "'   '           | false"
    })
    public void testEndsWithLineComment(String raw, boolean expected) {
        assertEquals(expected, Trivia.parse(raw).endsWithLineComment());
    }

    @Test
    public void testLineCommentFollowedByLineBreakIsClosed() {
        assertFalse(Trivia.parse(" // note\n").endsWithLineComment());
    }

    @Test
    public void testParseKeepsUnknownTextAsGarbage() {
        Trivia trivia = Trivia.parse(" x ");

        assertEquals(" x ", trivia.text());
        assertEquals(TriviaPiece.Kind.GARBAGE, trivia.pieces().get(1).kind());
    }

    @Test
    public void testAppendAndPrepend() {
        Trivia trivia = Trivia.spaces(2).append(Trivia.newline()).prepend(TriviaPiece.lineComment("// a"));

        assertEquals("// a  \n", trivia.text());
        assertTrue(trivia.containsComment());
        assertTrue(trivia.containsNewline());
    }
}

package com.playgrounds.apptool.rewrite;

import com.playgrounds.apptool.match.BaseIdentity;
import com.playgrounds.apptool.syntax.ArrayElement;
import com.playgrounds.apptool.syntax.ArrayExpr;
import com.playgrounds.apptool.syntax.ManifestParser;
import com.playgrounds.apptool.syntax.SyntaxPrinter;
import org.eclipse.collections.api.list.ImmutableList;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SeparatedListsTest {

    // ==== Insertion ====

    @Test
    public void testAppendOnOneLine() {
        assertEquals("[.a, .b, .c]", append("[.a, .b]", ".c"));
    }

    @Test
    public void testAppendKeepsPaddingBeforeCloser() {
        assertEquals("[ .a, .b ]", append("[ .a ]", ".b"));
    }

    @Test
    public void testAppendOnSeparateLines() {
        assertEquals("[\n    .a,\n    .b\n]", append("[\n    .a\n]", ".b"));
    }

    @Test
    public void testAppendKeepsTrailingCommaStyle() {
        assertEquals("[\n    .a,\n    .b,\n]", append("[\n    .a,\n]", ".b"));
    }

    @Test
    public void testAppendToEmptyList() {
        assertEquals("[\n.a]", append("[]", ".a"));
    }

    @Test
    public void testCommentStaysWithItsElement() {
        assertEquals("[\n    .a, // first\n    .b\n]", append("[\n    .a // first\n]", ".b"));
    }

    @Test
    public void testLineCommentForcesLineBreak() {
        assertEquals("[.a, // first\n.b\n]", append("[.a // first\n]", ".b"));
    }

    @Test
    public void testAppendKeepsCarriageReturns() {
        assertEquals("[\r\n    .a,\r\n    .b\r\n]", append("[\r\n    .a\r\n]", ".b"));
    }

    @Test
    public void testInsertFirst() {
        assertEquals("[.a, .b, .c]", insert("[.b, .c]", 0, ".a"));
    }

    @Test
    public void testInsertBetweenLines() {
        assertEquals("[\n    .a,\n    .b,\n    .c\n]", insert("[\n    .a,\n    .c\n]", 1, ".b"));
    }

    @Test
    public void testInsertOutOfRange() {
        ArrayExpr array = array("[.a]");

        assertThrows(IndexOutOfBoundsException.class,
                () -> SeparatedLists.insert(array.elements(), 2, element(".b"), FormattingConventions.DEFAULT));
    }

    // ==== Removal ====

    @Test
    public void testRemoveMiddle() {
        assertEquals("[.a, .c]", remove("[.a, .b, .c]", "b"));
    }

    @Test
    public void testRemoveLastDropsDanglingComma() {
        assertEquals("[.a]", remove("[.a, .b]", "b"));
        assertEquals("[\n    .a\n]", remove("[\n    .a,\n    .b\n]", "b"));
    }

    @Test
    public void testRemoveLastKeepsTrailingCommaStyle() {
        assertEquals("[\n    .a,\n]", remove("[\n    .a,\n    .b,\n]", "b"));
    }

    @Test
    public void testRemoveLastKeepsCommentOfDroppedComma() {
        assertEquals("[\n    .a // keep\n]", remove("[\n    .a, // keep\n    .b\n]", "b"));
    }

    @Test
    public void testRemoveOnly() {
        assertEquals("[]", remove("[.a]", "a"));
    }

    @Test
    public void testRemoveWithoutMatchReturnsInput() {
        ImmutableList<ArrayElement> elements = array("[.a, .b]").elements();

        assertSame(elements, SeparatedLists.removeIf(elements, element -> BaseIdentity.is(element.value(), "c")));
    }

    @Test
    public void testReplaceKeepsComma() {
        ImmutableList<ArrayElement> elements = array("[.a, .b]").elements();

        ImmutableList<ArrayElement> replaced = SeparatedLists.replace(elements, 0, element(".z"));

        assertEquals("[.z, .b]", SyntaxPrinter.print(array("[.a, .b]").withElements(replaced)));
    }

    private static String append(String source, String value) {
        ArrayExpr array = array(source);
        return SyntaxPrinter.print(array.withElements(
                SeparatedLists.append(array.elements(), element(value), FormattingConventions.DEFAULT)));
    }

    private static String insert(String source, int index, String value) {
        ArrayExpr array = array(source);
        return SyntaxPrinter.print(array.withElements(
                SeparatedLists.insert(array.elements(), index, element(value), FormattingConventions.DEFAULT)));
    }

    private static String remove(String source, String identity) {
        ArrayExpr array = array(source);
        return SyntaxPrinter.print(array.withElements(
                SeparatedLists.removeIf(array.elements(), element -> BaseIdentity.is(element.value(), identity))));
    }

    private static ArrayExpr array(String source) {
        return (ArrayExpr) ManifestParser.parseExpression(source);
    }

    private static ArrayElement element(String source) {
        return ArrayElement.of(ManifestParser.parseExpression(source));
    }
}

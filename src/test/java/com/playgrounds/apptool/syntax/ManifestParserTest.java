package com.playgrounds.apptool.syntax;

import com.playgrounds.apptool.Fixtures;
import org.eclipse.collections.api.list.ImmutableList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class ManifestParserTest {

    // ==== Printing a parsed tree gives back the input ====

    static Stream<String> sources() {
        return Stream.of(
                "",
                "\n\n",
                "// only a comment",
                Fixtures.playground(),
                Fixtures.manifest("legacy.swift"),
                Fixtures.manifest("no-package.swift"),
                "let package = Package(\r\n    name: \"App\"\r\n)\r\n",
                "Package(name: \"x\"",
                ")]}",
                "[.a, , .b,]",
                "f(a: 1 b: 2)",
                "\"unterminated\nPackage()",
                "/* never closed",
                "let x = y ?? [\"a\": 1, \"b\": 2]",
                "Package(name: \"Caf\u00e9 \u2615\", targets: [ .target(name: `default`) ])",
                "#if os(iOS)\nlet a = 1\n#endif\n",
                "foo { bar($0) } (baz)",
                "\t\tPackage( name : \"spaced\" , )  \n");
    }

    @ParameterizedTest
    @MethodSource("sources")
    public void testRoundTrip(String source) {
        SourceFile tree = ManifestParser.parse(source);

        assertEquals(source, SyntaxPrinter.print(tree));
    }

    // ==== Structure ====

    @Test
    public void testPackageCall() {
        SourceFile tree = ManifestParser.parse("let package = Package(name: \"App\", platforms: [.iOS(\"16.0\")])");

        assertEquals(4, tree.items().size());
        CallExpr call = (CallExpr) tree.items().get(3);
        assertEquals("Package", call.calleeName().orElseThrow());
        assertEquals("name", call.arguments().get(0).labelText());
        assertEquals("App", ((StringLiteralExpr) call.arguments().get(0).value()).value());
        assertEquals("platforms", call.arguments().get(1).labelText());

        ArrayExpr platforms = (ArrayExpr) call.arguments().get(1).value();
        assertEquals(1, platforms.elements().size());
        CallExpr ios = (CallExpr) platforms.values().getFirst();
        MemberAccessExpr callee = (MemberAccessExpr) ios.callee();
        assertTrue(callee.isImplicit());
        assertEquals("iOS", callee.memberName());
    }

    @Test
    public void testMemberChain() {
        CallExpr call = (CallExpr) ManifestParser.parseExpression("Foo.bar.baz(1)");

        assertEquals("baz", call.calleeName().orElseThrow());
        MemberAccessExpr callee = (MemberAccessExpr) call.callee();
        assertFalse(callee.isImplicit());
        assertInstanceOf(MemberAccessExpr.class, callee.base());
    }

    @Test
    public void testParenthesisOnNextLineIsNotACall() {
        SourceFile tree = ManifestParser.parse("foo\n(bar)");

        assertEquals(2, tree.items().size());
        assertInstanceOf(IdentifierExpr.class, tree.items().get(0));
        assertInstanceOf(TupleExpr.class, tree.items().get(1));
    }

    @Test
    public void testMissingClosingParenthesis() {
        SourceFile tree = ManifestParser.parse("Package(name: \"x\"");

        CallExpr call = (CallExpr) tree.items().getFirst();
        assertTrue(call.rightParen().isMissing());
        assertEquals(1, call.arguments().size());
    }

    @Test
    public void testStrayClosersAreOpaque() {
        ImmutableList<Expr> items = ManifestParser.parse(")]}").items();

        assertEquals(3, items.size());
        assertTrue(items.allSatisfy(TokenExpr.class::isInstance));
    }

    @Test
    public void testTrailingCommaIsKeptOnElement() {
        ArrayExpr array = (ArrayExpr) ManifestParser.parseExpression("[\n  .pad,\n  .phone,\n]");

        assertEquals(2, array.elements().size());
        assertNotNull(array.elements().getLast().trailingComma());
    }

    @Test
    public void testUnlabeledArgument() {
        CallExpr call = (CallExpr) ManifestParser.parseExpression(".process(\"Resources\")");

        Argument argument = call.arguments().getFirst();
        assertNull(argument.label());
        assertNull(argument.labelText());
    }

    @Test
    public void testParseArgument() {
        Argument argument = ManifestParser.parseArgument("resources: [.process(\"Resources\")]");

        assertEquals("resources", argument.labelText());
        assertInstanceOf(ArrayExpr.class, argument.value());
        assertNull(argument.trailingComma());
    }

    @Test
    public void testParseArgumentRejectsLists() {
        assertThrows(IllegalArgumentException.class, () -> ManifestParser.parseArgument("a: 1, b: 2"));
    }

    @Test
    public void testParseExpressionDropsTrailingTrivia() {
        Expr expr = ManifestParser.parseExpression(".iOS(\"17.0\")\n");

        assertEquals(".iOS(\"17.0\")", SyntaxPrinter.print(expr));
    }
}

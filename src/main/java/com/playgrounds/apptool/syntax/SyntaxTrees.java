package com.playgrounds.apptool.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;

/**
 * Structural helpers over the manifest tree.
 */
public final class SyntaxTrees {

    private SyntaxTrees() {
    }

    static ImmutableList<SyntaxNode> childrenOf(SyntaxNode... nodes) {
        MutableList<SyntaxNode> children = Lists.mutable.empty();
        for (SyntaxNode node : nodes) {
            if (node != null) {
                children.add(node);
            }
        }
        return children.toImmutable();
    }

    public static Optional<Token> firstToken(SyntaxNode node) {
        if (node instanceof Token token) {
            return Optional.of(token);
        }
        for (SyntaxNode child : node.children()) {
            Optional<Token> token = firstToken(child);
            if (token.isPresent()) {
                return token;
            }
        }
        return Optional.empty();
    }

    public static Optional<Token> lastToken(SyntaxNode node) {
        if (node instanceof Token token) {
            return Optional.of(token);
        }
        ImmutableList<SyntaxNode> children = node.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            Optional<Token> token = lastToken(children.get(i));
            if (token.isPresent()) {
                return token;
            }
        }
        return Optional.empty();
    }

    /**
     * Returns {@code root} with the node that is identical to {@code target} replaced by
     * {@code replacement}. Every ancestor on the path is rebuilt; everything else is shared
     * with the input. Returns {@code root} itself when {@code target} is not part of it.
     *
     * @throws ClassCastException if the replacement cannot stand in the target's slot
     */
    public static SyntaxNode replace(SyntaxNode root, SyntaxNode target, SyntaxNode replacement) {
        return rewrite(root, target, replacement);
    }

    private static SyntaxNode rewrite(SyntaxNode node, SyntaxNode target, SyntaxNode replacement) {
        if (node == target) {
            return replacement;
        }
        if (node == null || node instanceof Token) {
            return node;
        }
        if (node instanceof SourceFile file) {
            ImmutableList<Expr> items = rewriteAll(file.items(), Expr.class, target, replacement);
            Token eof = (Token) rewrite(file.endOfFile(), target, replacement);
            return items == file.items() && eof == file.endOfFile() ? file : new SourceFile(items, eof);
        }
        if (node instanceof Argument argument) {
            Token label = (Token) rewrite(argument.label(), target, replacement);
            Token colon = (Token) rewrite(argument.colon(), target, replacement);
            Expr value = (Expr) rewrite(argument.value(), target, replacement);
            Token comma = (Token) rewrite(argument.trailingComma(), target, replacement);
            if (label == argument.label() && colon == argument.colon() && value == argument.value()
                    && comma == argument.trailingComma()) {
                return argument;
            }
            return new Argument(label, colon, value, comma);
        }
        if (node instanceof ArrayElement element) {
            Expr value = (Expr) rewrite(element.value(), target, replacement);
            Token comma = (Token) rewrite(element.trailingComma(), target, replacement);
            if (value == element.value() && comma == element.trailingComma()) {
                return element;
            }
            return new ArrayElement(value, comma);
        }
        if (node instanceof IdentifierExpr identifier) {
            Token name = (Token) rewrite(identifier.name(), target, replacement);
            return name == identifier.name() ? identifier : new IdentifierExpr(name);
        }
        if (node instanceof StringLiteralExpr literal) {
            Token token = (Token) rewrite(literal.literal(), target, replacement);
            return token == literal.literal() ? literal : new StringLiteralExpr(token);
        }
        if (node instanceof TokenExpr opaque) {
            Token token = (Token) rewrite(opaque.token(), target, replacement);
            return token == opaque.token() ? opaque : new TokenExpr(token);
        }
        if (node instanceof MemberAccessExpr member) {
            Expr base = (Expr) rewrite(member.base(), target, replacement);
            Token period = (Token) rewrite(member.period(), target, replacement);
            Token name = (Token) rewrite(member.name(), target, replacement);
            if (base == member.base() && period == member.period() && name == member.name()) {
                return member;
            }
            return new MemberAccessExpr(base, period, name);
        }
        if (node instanceof CallExpr call) {
            Expr callee = (Expr) rewrite(call.callee(), target, replacement);
            Token left = (Token) rewrite(call.leftParen(), target, replacement);
            ImmutableList<Argument> arguments = rewriteAll(call.arguments(), Argument.class, target, replacement);
            Token right = (Token) rewrite(call.rightParen(), target, replacement);
            if (callee == call.callee() && left == call.leftParen() && arguments == call.arguments()
                    && right == call.rightParen()) {
                return call;
            }
            return new CallExpr(callee, left, arguments, right);
        }
        if (node instanceof ArrayExpr array) {
            Token left = (Token) rewrite(array.leftBracket(), target, replacement);
            ImmutableList<ArrayElement> elements = rewriteAll(array.elements(), ArrayElement.class, target, replacement);
            Token right = (Token) rewrite(array.rightBracket(), target, replacement);
            if (left == array.leftBracket() && elements == array.elements() && right == array.rightBracket()) {
                return array;
            }
            return new ArrayExpr(left, elements, right);
        }
        if (node instanceof TupleExpr tuple) {
            Token left = (Token) rewrite(tuple.leftParen(), target, replacement);
            ImmutableList<Argument> elements = rewriteAll(tuple.elements(), Argument.class, target, replacement);
            Token right = (Token) rewrite(tuple.rightParen(), target, replacement);
            if (left == tuple.leftParen() && elements == tuple.elements() && right == tuple.rightParen()) {
                return tuple;
            }
            return new TupleExpr(left, elements, right);
        }
        if (node instanceof BlockExpr block) {
            Token left = (Token) rewrite(block.leftBrace(), target, replacement);
            ImmutableList<Expr> items = rewriteAll(block.items(), Expr.class, target, replacement);
            Token right = (Token) rewrite(block.rightBrace(), target, replacement);
            if (left == block.leftBrace() && items == block.items() && right == block.rightBrace()) {
                return block;
            }
            return new BlockExpr(left, items, right);
        }
        if (node instanceof SequenceExpr sequence) {
            ImmutableList<Expr> items = rewriteAll(sequence.items(), Expr.class, target, replacement);
            return items == sequence.items() ? sequence : new SequenceExpr(items);
        }
        throw new IllegalStateException("Unknown node kind: " + node.kind());
    }

    private static <T extends SyntaxNode> ImmutableList<T> rewriteAll(ImmutableList<T> nodes, Class<T> type,
            SyntaxNode target, SyntaxNode replacement) {
        MutableList<T> rewritten = null;
        for (int i = 0; i < nodes.size(); i++) {
            T original = nodes.get(i);
            T updated = type.cast(rewrite(original, target, replacement));
            if (updated != original && rewritten == null) {
                rewritten = Lists.mutable.withAll(nodes);
            }
            if (rewritten != null) {
                rewritten.set(i, updated);
            }
        }
        return rewritten == null ? nodes : rewritten.toImmutable();
    }
}

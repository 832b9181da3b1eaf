package com.playgrounds.apptool.match;

import com.playgrounds.apptool.syntax.Argument;
import com.playgrounds.apptool.syntax.CallExpr;
import com.playgrounds.apptool.syntax.Expr;
import com.playgrounds.apptool.syntax.MemberAccessExpr;
import com.playgrounds.apptool.syntax.StringLiteralExpr;
import com.playgrounds.apptool.syntax.SyntaxNode;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Optional;

/**
 * Queries over the manifest tree.
 */
public final class Matchers {

    private Matchers() {
    }

    /**
     * The first call in document order that satisfies {@code matcher}. An enclosing call is
     * visited before the calls nested in its arguments.
     */
    public static Optional<CallExpr> findFirst(SyntaxNode root, CallMatcher matcher) {
        if (root instanceof CallExpr call && matcher.test(call)) {
            return Optional.of(call);
        }
        for (SyntaxNode child : root.children()) {
            Optional<CallExpr> found = findFirst(child, matcher);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * The argument spelled with {@code label} or one of its aliases.
     *
     * @throws AmbiguousArgumentException if more than one argument matches
     */
    public static Optional<Argument> argument(ImmutableList<Argument> arguments, ArgumentLabel label) {
        ImmutableList<Argument> matches = arguments.select(argument -> label.matches(argument.labelText()));
        if (matches.size() > 1) {
            throw new AmbiguousArgumentException(label, matches.size());
        }
        return matches.getFirstOptional();
    }

    public static Optional<Argument> argument(CallExpr call, ArgumentLabel label) {
        return argument(call.arguments(), label);
    }

    public static Optional<String> stringValue(Expr expr) {
        if (expr instanceof StringLiteralExpr literal) {
            return Optional.of(literal.value());
        }
        return Optional.empty();
    }

    /**
     * The member name of an implicit member expression such as {@code .games}.
     */
    public static Optional<String> memberName(Expr expr) {
        if (expr instanceof MemberAccessExpr member) {
            return Optional.of(member.memberName());
        }
        return Optional.empty();
    }
}

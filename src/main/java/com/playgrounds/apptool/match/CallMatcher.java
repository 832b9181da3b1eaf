package com.playgrounds.apptool.match;

import com.playgrounds.apptool.syntax.Argument;
import com.playgrounds.apptool.syntax.CallExpr;
import com.playgrounds.apptool.syntax.IdentifierExpr;
import com.playgrounds.apptool.syntax.MemberAccessExpr;
import com.playgrounds.apptool.syntax.StringLiteralExpr;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Sets;

import java.util.function.Predicate;

/**
 * Recognizes a call by the shape and name of its callee and, optionally, by a string argument.
 */
public final class CallMatcher implements Predicate<CallExpr> {

    /** The top-level {@code Package(...)} initializer. */
    public static final CallMatcher PACKAGE = bare("Package");

    /** {@code .iOSApplication(...)} or {@code .macOSApplication(...)} inside {@code products:}. */
    public static final CallMatcher APPLICATION_PRODUCT = member("iOSApplication", "macOSApplication");

    public static final CallMatcher IOS_APPLICATION = member("iOSApplication");

    private enum CalleeShape {
        BARE,
        MEMBER
    }

    private final CalleeShape shape;
    private final ImmutableSet<String> names;
    private final String argumentLabel;
    private final String argumentValue;

    private CallMatcher(CalleeShape shape, ImmutableSet<String> names, String argumentLabel, String argumentValue) {
        this.shape = shape;
        this.names = names;
        this.argumentLabel = argumentLabel;
        this.argumentValue = argumentValue;
    }

    public static CallMatcher bare(String... names) {
        return new CallMatcher(CalleeShape.BARE, Sets.immutable.with(names), null, null);
    }

    public static CallMatcher member(String... names) {
        return new CallMatcher(CalleeShape.MEMBER, Sets.immutable.with(names), null, null);
    }

    /**
     * {@code .target(name: "<name>", ...)} or {@code .executableTarget(name: "<name>", ...)}.
     */
    public static CallMatcher buildTarget(String name) {
        return member("target", "executableTarget").withStringArgument("name", name);
    }

    public CallMatcher withStringArgument(String label, String value) {
        return new CallMatcher(shape, names, label, value);
    }

    @Override
    public boolean test(CallExpr call) {
        String calleeName;
        if (shape == CalleeShape.BARE && call.callee() instanceof IdentifierExpr identifier) {
            calleeName = identifier.identifier();
        } else if (shape == CalleeShape.MEMBER && call.callee() instanceof MemberAccessExpr member) {
            calleeName = member.memberName();
        } else {
            return false;
        }
        if (!names.contains(calleeName)) {
            return false;
        }
        return argumentLabel == null || hasStringArgument(call);
    }

    private boolean hasStringArgument(CallExpr call) {
        for (Argument argument : call.arguments()) {
            if (argumentLabel.equals(argument.labelText())
                    && argument.value() instanceof StringLiteralExpr literal
                    && argumentValue.equals(literal.value())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Human readable form used in "not found" messages.
     */
    public String description() {
        String prefix = shape == CalleeShape.MEMBER ? "." : "";
        String callees = names.toSortedList().collect(name -> prefix + name).makeString(" or ");
        if (argumentLabel == null) {
            return callees;
        }
        return callees + "(" + argumentLabel + ": \"" + argumentValue + "\")";
    }

    @Override
    public String toString() {
        return "CallMatcher[" + description() + "]";
    }
}

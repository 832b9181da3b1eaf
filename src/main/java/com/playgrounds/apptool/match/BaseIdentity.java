package com.playgrounds.apptool.match;

import com.playgrounds.apptool.syntax.CallExpr;
import com.playgrounds.apptool.syntax.Expr;
import com.playgrounds.apptool.syntax.IdentifierExpr;
import com.playgrounds.apptool.syntax.MemberAccessExpr;

import java.util.Optional;

/**
 * The name that identifies an array element regardless of its arguments: {@code .iOS("17.0")}
 * and {@code .iOS("16.0")} both have identity {@code iOS}.
 */
public final class BaseIdentity {

    private BaseIdentity() {
    }

    public static Optional<String> of(Expr expr) {
        Expr base = expr instanceof CallExpr call ? call.callee() : expr;
        if (base instanceof MemberAccessExpr member) {
            return Optional.of(member.memberName());
        }
        if (base instanceof IdentifierExpr identifier) {
            return Optional.of(identifier.identifier());
        }
        return Optional.empty();
    }

    public static boolean is(Expr expr, String identity) {
        return of(expr).map(identity::equals).orElse(false);
    }
}

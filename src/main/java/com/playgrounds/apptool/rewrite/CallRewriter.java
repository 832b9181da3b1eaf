package com.playgrounds.apptool.rewrite;

import com.playgrounds.apptool.match.CallMatcher;
import com.playgrounds.apptool.match.Matchers;
import com.playgrounds.apptool.syntax.CallExpr;
import com.playgrounds.apptool.syntax.SourceFile;
import com.playgrounds.apptool.syntax.SyntaxTrees;

import java.util.Optional;
import java.util.function.UnaryOperator;

public final class CallRewriter {

    private CallRewriter() {
    }

    /**
     * Applies {@code edit} to the first call matching {@code matcher} and rebuilds the path to
     * it. Later matches are left alone. When nothing matches the input tree is returned as is.
     */
    public static Rewrite rewriteFirst(SourceFile tree, CallMatcher matcher, UnaryOperator<CallExpr> edit) {
        Optional<CallExpr> target = Matchers.findFirst(tree, matcher);
        if (target.isEmpty()) {
            return new Rewrite(tree, Optional.empty());
        }
        CallExpr replacement = edit.apply(target.get());
        if (replacement == target.get()) {
            return new Rewrite(tree, target);
        }
        return new Rewrite((SourceFile) SyntaxTrees.replace(tree, target.get(), replacement), Optional.of(replacement));
    }
}

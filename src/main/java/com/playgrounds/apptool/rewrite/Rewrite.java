package com.playgrounds.apptool.rewrite;

import com.playgrounds.apptool.syntax.CallExpr;
import com.playgrounds.apptool.syntax.SourceFile;

import java.util.Optional;

/**
 * Outcome of {@link CallRewriter#rewriteFirst}: the new tree and, when a call matched, the
 * replacement that was put in its place.
 */
public record Rewrite(SourceFile tree, Optional<CallExpr> matched) {

    public boolean found() {
        return matched.isPresent();
    }
}

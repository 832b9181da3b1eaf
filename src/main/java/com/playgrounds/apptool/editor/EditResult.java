package com.playgrounds.apptool.editor;

import com.playgrounds.apptool.syntax.SourceFile;

/**
 * Outcome of an editor write.
 */
public sealed interface EditResult permits EditResult.Applied, EditResult.NotFound {

    /**
     * The edit went through. {@code changed} is false when the manifest already was in the
     * requested state.
     */
    record Applied(SourceFile tree, boolean changed) implements EditResult {
    }

    /**
     * The call or list the edit needs is not in the manifest. Nothing was changed.
     */
    record NotFound(String reason) implements EditResult {
    }

    static EditResult applied(SourceFile before, SourceFile after) {
        return new Applied(after, before != after && !before.equals(after));
    }

    static EditResult notFound(String reason) {
        return new NotFound(reason);
    }

    /**
     * The edited tree.
     *
     * @throws TargetNotFoundException if the edit could not find its target
     */
    default SourceFile treeOrThrow() throws TargetNotFoundException {
        if (this instanceof Applied applied) {
            return applied.tree();
        }
        throw new TargetNotFoundException(((NotFound) this).reason());
    }
}

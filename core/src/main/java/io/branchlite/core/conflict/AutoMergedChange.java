package io.branchlite.core.conflict;

import io.branchlite.core.UpdateOps;

/**
 * A field both sides changed through commutative operators. Not a conflict:
 * the combined operators can be applied in place of either side's.
 */
public record AutoMergedChange(
        String target,
        String field,
        UpdateOps ours,
        UpdateOps theirs,
        UpdateOps combined
) {
}

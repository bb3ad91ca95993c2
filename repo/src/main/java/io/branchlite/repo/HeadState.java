package io.branchlite.repo;

import java.util.Objects;

/**
 * Where HEAD points: at a branch (symbolic) or directly at a commit (detached).
 */
public sealed interface HeadState permits HeadState.OnBranch, HeadState.Detached {

    /** HEAD follows {@code branch}. The branch may not have a commit yet. */
    record OnBranch(String branch) implements HeadState {
        public OnBranch {
            Objects.requireNonNull(branch, "branch");
        }
    }

    record Detached(String commit) implements HeadState {
        public Detached {
            Objects.requireNonNull(commit, "commit");
        }
    }
}

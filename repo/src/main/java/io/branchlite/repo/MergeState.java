package io.branchlite.repo;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A branch merge that has started but not finished: which commits take part and which
 * entities still need a decision.
 * <p>
 * Status follows the conflicts:
 *  - no conflicts recorded: {@link MergeStatus#IN_PROGRESS},
 *  - any conflict open: {@link MergeStatus#CONFLICTED},
 *  - every conflict settled: {@link MergeStatus#RESOLVED}.
 * Instances are immutable; the mutators return updated copies.
 *
 * @param strategy  resolution strategy token chosen for the merge, or null.
 * @param startedAt epoch millis.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MergeState(
        String source,
        String target,
        String baseCommit,
        String sourceCommit,
        String targetCommit,
        String strategy,
        MergeStatus status,
        List<MergeConflict> conflicts,
        long startedAt
) {
    public MergeState {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(sourceCommit, "sourceCommit");
        Objects.requireNonNull(targetCommit, "targetCommit");
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        if (status == null) status = statusOf(conflicts);
    }

    /** A fresh merge with no conflicts yet. */
    public static MergeState start(String source, String target, String baseCommit,
                                   String sourceCommit, String targetCommit, String strategy, long startedAt) {
        return new MergeState(source, target, baseCommit, sourceCommit, targetCommit, strategy,
                MergeStatus.IN_PROGRESS, List.of(), startedAt);
    }

    public MergeState addConflict(MergeConflict conflict) {
        Objects.requireNonNull(conflict, "conflict");
        List<MergeConflict> next = new ArrayList<>(conflicts);
        next.add(conflict);
        return withConflicts(next);
    }

    /**
     * Mark every conflict on {@code entityId} as settled by {@code resolution}.
     *
     * @throws IllegalArgumentException if no conflict is recorded for the entity
     */
    public MergeState resolveConflict(String entityId, String resolution) {
        boolean found = false;
        List<MergeConflict> next = new ArrayList<>(conflicts.size());
        for (MergeConflict c : conflicts) {
            if (c.entityId().equals(entityId)) {
                next.add(c.resolve(resolution));
                found = true;
            } else {
                next.add(c);
            }
        }
        if (!found) throw new IllegalArgumentException("No conflict recorded for " + entityId);
        return withConflicts(next);
    }

    public List<MergeConflict> unresolvedConflicts() {
        return conflicts.stream().filter(c -> !c.resolved()).toList();
    }

    /** True when nothing is left open, including when nothing conflicted. */
    public boolean allConflictsResolved() {
        return conflicts.stream().allMatch(MergeConflict::resolved);
    }

    private MergeState withConflicts(List<MergeConflict> next) {
        return new MergeState(source, target, baseCommit, sourceCommit, targetCommit, strategy,
                statusOf(next), next, startedAt);
    }

    private static MergeStatus statusOf(List<MergeConflict> conflicts) {
        if (conflicts.isEmpty()) return MergeStatus.IN_PROGRESS;
        return conflicts.stream().allMatch(MergeConflict::resolved) ? MergeStatus.RESOLVED : MergeStatus.CONFLICTED;
    }
}

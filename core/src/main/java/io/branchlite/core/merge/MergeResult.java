package io.branchlite.core.merge;

import io.branchlite.core.Event;
import io.branchlite.core.conflict.AutoMergedChange;
import io.branchlite.core.conflict.ConflictInfo;
import io.branchlite.core.conflict.Resolution;

import java.util.List;

/**
 * Outcome of merging two event streams.
 * <p>
 * {@code conflicts} holds every detected conflict; those settled by the strategy are
 * flagged {@link ConflictInfo#resolved()}. {@code resolved} holds the completed
 * resolutions only, in conflict order.
 */
public record MergeResult(
        boolean success,
        List<Event> mergedEvents,
        List<ConflictInfo> conflicts,
        List<Resolution> resolved,
        List<AutoMergedChange> autoMerged,
        Stats stats
) {
    public MergeResult {
        mergedEvents = List.copyOf(mergedEvents);
        conflicts = List.copyOf(conflicts);
        resolved = List.copyOf(resolved);
        autoMerged = List.copyOf(autoMerged);
    }

    /**
     * @param fromOurs              input events on our side, before dedup.
     * @param fromTheirs            input events on their side, before dedup.
     * @param entitiesProcessed     distinct targets across both streams.
     * @param entitiesWithConflicts distinct targets with at least one conflict.
     * @param autoMerged            fields combined as commutative.
     * @param conflictsResolved     conflicts settled by the strategy.
     */
    public record Stats(int fromOurs, int fromTheirs, int entitiesProcessed,
                        int entitiesWithConflicts, int autoMerged, int conflictsResolved) { }

    /** Conflicts still waiting for a decision. */
    public List<ConflictInfo> pending() {
        return conflicts.stream().filter(c -> !c.resolved()).toList();
    }
}

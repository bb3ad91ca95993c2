package io.branchlite.core.merge;

import io.branchlite.core.Event;
import io.branchlite.core.JsonValues;
import io.branchlite.core.conflict.ConflictDetector;
import io.branchlite.core.conflict.ConflictInfo;
import io.branchlite.core.conflict.ConflictResolver;
import io.branchlite.core.conflict.Resolution;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Merges two divergent event streams into one.
 * <p>
 * Steps:
 *  1) Drop their copies of events we already have: a CREATE on the same target with a
 *     deep-equal after-state, or an event with the same id.
 *  2) Detect conflicts on the full inputs.
 *  3) If a strategy is configured, resolve every conflict with it; complete resolutions
 *     mark their conflict as resolved.
 *  4) Concatenate ours and the remaining theirs, then stable-sort by ts.
 * <p>
 * Never throws for conflicting data. Deterministic for the same inputs.
 */
public final class EventMerger {
    private static final Logger log = Logger.getLogger(EventMerger.class.getName());

    private static final Comparator<Event> BY_TS = Comparator.comparingLong(Event::ts);

    private final ConflictDetector detector;
    private final ConflictResolver resolver;

    public EventMerger() {
        this(new ConflictDetector(), new ConflictResolver());
    }

    public EventMerger(ConflictDetector detector, ConflictResolver resolver) {
        this.detector = Objects.requireNonNull(detector, "detector");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public MergeResult mergeEventStreams(List<Event> ours, List<Event> theirs) {
        return mergeEventStreams(ours, theirs, MergeOptions.defaults());
    }

    public MergeResult mergeEventStreams(List<Event> ours, List<Event> theirs, MergeOptions options) {
        Objects.requireNonNull(ours, "ours");
        Objects.requireNonNull(theirs, "theirs");
        Objects.requireNonNull(options, "options");

        List<Event> theirsKept = dropDuplicates(ours, theirs);
        ConflictDetector.Detection detection = detector.detect(ours, theirs, options.autoMergeCommutative());

        List<ConflictInfo> conflicts = new ArrayList<>(detection.conflicts().size());
        List<Resolution> resolved = new ArrayList<>();
        if (options.resolves()) {
            List<Resolution> all = resolver.resolveAllConflicts(detection.conflicts(), options.resolutionStrategy());
            for (int i = 0; i < all.size(); i++) {
                ConflictInfo c = detection.conflicts().get(i);
                Resolution r = all.get(i);
                if (r.isComplete()) {
                    conflicts.add(c.markResolved());
                    resolved.add(r);
                } else {
                    conflicts.add(c);
                }
            }
        } else {
            conflicts.addAll(detection.conflicts());
        }

        List<Event> merged = new ArrayList<>(ours.size() + theirsKept.size());
        merged.addAll(ours);
        merged.addAll(theirsKept);
        merged.sort(BY_TS);

        boolean success = conflicts.stream().allMatch(ConflictInfo::resolved);
        MergeResult.Stats stats = new MergeResult.Stats(
                ours.size(),
                theirs.size(),
                distinctTargets(ours, theirs),
                (int) conflicts.stream().map(ConflictInfo::target).distinct().count(),
                detection.autoMerged().size(),
                resolved.size());

        log.log(Level.FINE, () -> "Merged " + stats.fromOurs() + "+" + stats.fromTheirs() + " events into "
                + merged.size() + ", conflicts=" + conflicts.size() + ", resolved=" + stats.conflictsResolved()
                + ", autoMerged=" + stats.autoMerged());
        return new MergeResult(success, merged, conflicts, resolved, detection.autoMerged(), stats);
    }

    /** Stable ascending sort by ts; returns a new list. */
    public static List<Event> sortEvents(List<Event> events) {
        List<Event> sorted = new ArrayList<>(events);
        sorted.sort(BY_TS);
        return sorted;
    }

    private static List<Event> dropDuplicates(List<Event> ours, List<Event> theirs) {
        Set<String> ourIds = new HashSet<>();
        List<Event> ourCreates = new ArrayList<>();
        for (Event e : ours) {
            ourIds.add(e.id());
            if (e.isCreate()) ourCreates.add(e);
        }

        List<Event> kept = new ArrayList<>(theirs.size());
        for (Event e : theirs) {
            if (ourIds.contains(e.id())) continue;
            if (e.isCreate() && claimMatchingCreate(ourCreates, e)) continue;
            kept.add(e);
        }
        return kept;
    }

    // Each of our creates absorbs at most one of theirs.
    private static boolean claimMatchingCreate(List<Event> ourCreates, Event theirs) {
        for (int i = 0; i < ourCreates.size(); i++) {
            Event mine = ourCreates.get(i);
            if (mine.op() == theirs.op()
                    && mine.target().equals(theirs.target())
                    && JsonValues.deepEquals(mine.after(), theirs.after())) {
                ourCreates.remove(i);
                return true;
            }
        }
        return false;
    }

    private static int distinctTargets(List<Event> ours, List<Event> theirs) {
        Set<String> targets = new HashSet<>();
        for (Event e : ours) targets.add(e.target());
        for (Event e : theirs) targets.add(e.target());
        return targets.size();
    }
}

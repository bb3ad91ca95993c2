package io.branchlite.core.conflict;

import com.fasterxml.jackson.databind.JsonNode;
import io.branchlite.core.CommutativeOps;
import io.branchlite.core.Event;
import io.branchlite.core.JsonValues;
import io.branchlite.core.UpdateOps;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compares the latest event per target from two divergent streams.
 * <p>
 * Algorithm:
 *  1) Reduce each stream to its latest event per target (max ts, last seen wins on ties).
 *  2) Only targets present on both sides are compared.
 *  3) Classify each pair:
 *     - delete/delete:               no conflict.
 *     - delete vs create/update:     one DELETE_UPDATE conflict.
 *     - create/create:               CREATE_CREATE unless the after-states are equal.
 *     - otherwise, per field:        a field conflicts when the values differ and both
 *                                    sides changed it relative to their own before-state.
 *                                    Fields whose operators commute are suppressed and
 *                                    reported as auto-merged instead.
 * <p>
 * Pure and deterministic: conflicts come out in first-seen target order of {@code ours}.
 */
public final class ConflictDetector {
    private static final Logger log = Logger.getLogger(ConflictDetector.class.getName());

    /** Conflicts plus the field changes that were suppressed as commutative. */
    public record Detection(List<ConflictInfo> conflicts, List<AutoMergedChange> autoMerged) {
        public Detection {
            conflicts = List.copyOf(conflicts);
            autoMerged = List.copyOf(autoMerged);
        }
    }

    public List<ConflictInfo> detectConflicts(List<Event> ours, List<Event> theirs) {
        return detect(ours, theirs, true).conflicts();
    }

    /**
     * @param suppressCommutative when false, fields changed by commuting operators are
     *                            reported as ordinary CONCURRENT_UPDATE conflicts.
     */
    public Detection detect(List<Event> ours, List<Event> theirs, boolean suppressCommutative) {
        Map<String, Event> ourLatest = latestByTarget(ours);
        Map<String, Event> theirLatest = latestByTarget(theirs);

        List<ConflictInfo> conflicts = new ArrayList<>();
        List<AutoMergedChange> autoMerged = new ArrayList<>();

        for (Map.Entry<String, Event> e : ourLatest.entrySet()) {
            Event theirEvent = theirLatest.get(e.getKey());
            if (theirEvent == null) continue;
            compare(e.getKey(), e.getValue(), theirEvent, suppressCommutative, conflicts, autoMerged);
        }
        return new Detection(conflicts, autoMerged);
    }

    /** Latest event per target; later entries win when timestamps tie. */
    static Map<String, Event> latestByTarget(List<Event> events) {
        Map<String, Event> latest = new LinkedHashMap<>();
        for (Event ev : events) {
            Event existing = latest.get(ev.target());
            if (existing == null || ev.ts() >= existing.ts()) latest.put(ev.target(), ev);
        }
        return latest;
    }

    private void compare(String target, Event ours, Event theirs, boolean suppressCommutative,
                         List<ConflictInfo> conflicts, List<AutoMergedChange> autoMerged) {
        if (ours.isDelete() && theirs.isDelete()) return;

        if (ours.isDelete() || theirs.isDelete()) {
            JsonNode base = ours.before() != null ? ours.before() : theirs.before();
            conflicts.add(new ConflictInfo(
                    ConflictType.DELETE_UPDATE, target, null,
                    ours.isDelete() ? null : ours.after(),
                    theirs.isDelete() ? null : theirs.after(),
                    base, ours, theirs));
            return;
        }

        if (ours.isCreate() && theirs.isCreate()) {
            if (JsonValues.deepEquals(ours.after(), theirs.after())) return;
            conflicts.add(new ConflictInfo(
                    ConflictType.CREATE_CREATE, target, null,
                    ours.after(), theirs.after(), null, ours, theirs));
            return;
        }

        compareFields(target, ours, theirs, suppressCommutative, conflicts, autoMerged);
    }

    private void compareFields(String target, Event ours, Event theirs, boolean suppressCommutative,
                               List<ConflictInfo> conflicts, List<AutoMergedChange> autoMerged) {
        Set<String> fields = new LinkedHashSet<>(JsonValues.fieldNames(ours.after()));
        fields.addAll(JsonValues.fieldNames(theirs.after()));
        fields.remove(Event.OPS_KEY);

        UpdateOps ourOps = CommutativeOps.extractOperations(ours);
        UpdateOps theirOps = CommutativeOps.extractOperations(theirs);
        boolean provenance = !ourOps.isEmpty() && !theirOps.isEmpty();

        for (String field : fields) {
            JsonNode ourValue = JsonValues.field(ours.after(), field);
            JsonNode theirValue = JsonValues.field(theirs.after(), field);
            if (JsonValues.deepEquals(ourValue, theirValue)) continue;
            if (!changed(ours, field, ourValue) || !changed(theirs, field, theirValue)) continue;

            if (provenance && touched(ourOps, theirOps, field)
                    && CommutativeOps.isCommutativeOnField(ourOps, theirOps, field)) {
                UpdateOps mine = ourOps.restrictTo(field);
                UpdateOps other = theirOps.restrictTo(field);
                if (suppressCommutative) {
                    log.log(Level.FINE, () -> "Commutative change on " + target + "." + field + " suppressed");
                    autoMerged.add(new AutoMergedChange(target, field, mine, other,
                            CommutativeOps.combineOperations(mine, other)));
                    continue;
                }
            }

            JsonNode base = JsonValues.field(ours.before(), field);
            if (base == null) base = JsonValues.field(theirs.before(), field);
            conflicts.add(new ConflictInfo(
                    ConflictType.CONCURRENT_UPDATE, target, field,
                    ourValue, theirValue, base, ours, theirs));
        }
    }

    /** A side changed a field unless its before-state holds the same value. Absent before counts as changed. */
    private static boolean changed(Event event, String field, JsonNode after) {
        if (event.before() == null || !event.before().isObject()) return true;
        return !JsonValues.deepEquals(JsonValues.field(event.before(), field), after);
    }

    private static boolean touched(UpdateOps ours, UpdateOps theirs, String field) {
        return !ours.operatorsTouching(field).isEmpty() || !theirs.operatorsTouching(field).isEmpty();
    }
}

package io.branchlite.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Immutable fact about one entity change, as produced by the upstream event log.
 * <p>
 * Fields:
 *  - id:       sortable unique id (ULID-like).
 *  - ts:       wall-clock timestamp in epoch millis.
 *  - op:       kind of change.
 *  - target:   entity key, {@code "<namespace>:<localId>"}.
 *  - before:   entity state before the change, or null when absent.
 *  - after:    entity state after the change, or null when absent. May carry an
 *              {@code _ops} object recording the update operators that produced it.
 *  - actor:    who made the change.
 *  - metadata: optional free-form metadata; {@code metadata.update} may hold the
 *              update document when {@code _ops} is not embedded.
 * <p>
 * A Java {@code null} means "absent"; a JSON null is represented by a NullNode.
 * The JsonNode payloads are shared, callers must not mutate them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Event(
        String id,
        long ts,
        EventOp op,
        String target,
        JsonNode before,
        JsonNode after,
        String actor,
        JsonNode metadata
) {
    /** Reserved key inside {@code after} that carries operator provenance. */
    public static final String OPS_KEY = "_ops";

    public Event {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(target, "target");
    }

    public Event(String id, long ts, EventOp op, String target, JsonNode before, JsonNode after, String actor) {
        this(id, ts, op, target, before, after, actor, null);
    }

    @JsonIgnore
    public boolean isCreate() { return op.isCreate(); }

    @JsonIgnore
    public boolean isDelete() { return op.isDelete(); }

    @JsonIgnore
    public boolean isUpdate() { return op.isUpdate(); }

    /** Namespace part of the target ("posts" for "posts:p1"), or the whole target if it has no ':'. */
    @JsonIgnore
    public String namespace() {
        int idx = target.indexOf(':');
        return idx < 0 ? target : target.substring(0, idx);
    }

    /** Local id part of the target ("p1" for "posts:p1"), or empty if it has no ':'. */
    @JsonIgnore
    public String localId() {
        int idx = target.indexOf(':');
        return idx < 0 ? "" : target.substring(idx + 1);
    }
}

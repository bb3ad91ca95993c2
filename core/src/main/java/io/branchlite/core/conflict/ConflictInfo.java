package io.branchlite.core.conflict;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import io.branchlite.core.Event;

import java.util.Objects;

/**
 * One detected conflict.
 * <p>
 * {@code field} is set only for {@link ConflictType#CONCURRENT_UPDATE}; the other types
 * compare whole entity states. Values are null when absent on that side (for example the
 * deleting side of a delete/update conflict).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConflictInfo(
        ConflictType type,
        String target,
        String field,
        JsonNode ourValue,
        JsonNode theirValue,
        JsonNode baseValue,
        Event ourEvent,
        Event theirEvent,
        boolean resolved
) {
    public ConflictInfo {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(ourEvent, "ourEvent");
        Objects.requireNonNull(theirEvent, "theirEvent");
        if (type == ConflictType.CONCURRENT_UPDATE && field == null) {
            throw new IllegalArgumentException("concurrent_update conflicts need a field");
        }
    }

    public ConflictInfo(ConflictType type, String target, String field,
                        JsonNode ourValue, JsonNode theirValue, JsonNode baseValue,
                        Event ourEvent, Event theirEvent) {
        this(type, target, field, ourValue, theirValue, baseValue, ourEvent, theirEvent, false);
    }

    public boolean hasField() { return field != null; }

    /** Copy of this conflict flagged as resolved. */
    public ConflictInfo markResolved() {
        if (resolved) return this;
        return new ConflictInfo(type, target, field, ourValue, theirValue, baseValue, ourEvent, theirEvent, true);
    }

    /** Human readable location: {@code posts:p1.title} or {@code posts:p1}. */
    public String location() {
        return field == null ? target : target + "." + field;
    }
}

package io.branchlite.core;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Kind of change an {@link Event} records.
 * <p>
 * Relationship operations are classified together with their entity counterparts:
 * REL_CREATE counts as a create and REL_DELETE as a delete when events are compared.
 */
public enum EventOp {
    CREATE, UPDATE, DELETE, REL_CREATE, REL_DELETE;

    public boolean isCreate() { return this == CREATE || this == REL_CREATE; }

    public boolean isDelete() { return this == DELETE || this == REL_DELETE; }

    public boolean isUpdate() { return this == UPDATE; }

    /** Parse a wire name such as {@code "UPDATE"} (case-insensitive). */
    @JsonCreator
    public static EventOp parse(String name) {
        if (name == null) throw new IllegalArgumentException("event op must not be null");
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown event op: " + name, e);
        }
    }
}

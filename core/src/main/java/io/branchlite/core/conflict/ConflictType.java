package io.branchlite.core.conflict;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Taxonomy of genuine divergences between two sides' latest state for a target.
 */
public enum ConflictType {
    /** Both sides changed the same field to different values. Field-level. */
    CONCURRENT_UPDATE("concurrent_update"),
    /** One side deleted the entity while the other created or updated it. Entity-level. */
    DELETE_UPDATE("delete_update"),
    /** Both sides created the entity with different contents. Entity-level. */
    CREATE_CREATE("create_create");

    private final String wireName;

    ConflictType(String wireName) { this.wireName = wireName; }

    @JsonValue
    public String wireName() { return wireName; }

    @Override public String toString() { return wireName; }
}

package io.branchlite.repo;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Snapshot descriptor recorded by a commit. Produced by the storage engine; this module
 * only hashes and stores it.
 *
 * @param collections      collection name to its content hashes.
 * @param relationships    hashes of the relationship indexes, or null.
 * @param eventLogPosition position in the event log the snapshot reflects, or null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DatabaseState(
        Map<String, CollectionState> collections,
        RelationshipState relationships,
        EventLogPosition eventLogPosition
) {
    private static final DatabaseState EMPTY = new DatabaseState(Map.of(), null, null);

    public DatabaseState {
        collections = collections == null ? Map.of() : Map.copyOf(collections);
    }

    public static DatabaseState empty() { return EMPTY; }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CollectionState(String dataHash, String schemaHash, long rowCount) { }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RelationshipState(String forwardHash, String reverseHash) { }

    public record EventLogPosition(String segmentId, long offset) { }
}

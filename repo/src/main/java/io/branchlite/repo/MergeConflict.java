package io.branchlite.repo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * One entity that could not be merged automatically.
 *
 * @param entityId   the conflicting entity, e.g. {@code users/user1}.
 * @param fields     fields that differ; empty when the whole entity conflicts.
 * @param resolution how it was settled ({@code ours}, {@code theirs}, ...), null while open.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MergeConflict(
        String entityId,
        String collection,
        List<String> fields,
        boolean resolved,
        String resolution,
        JsonNode ourValue,
        JsonNode theirValue,
        JsonNode baseValue
) {
    public MergeConflict {
        Objects.requireNonNull(entityId, "entityId");
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    /** An open conflict. */
    public static MergeConflict of(String entityId, String collection, List<String> fields,
                                   JsonNode ourValue, JsonNode theirValue, JsonNode baseValue) {
        return new MergeConflict(entityId, collection, fields, false, null, ourValue, theirValue, baseValue);
    }

    public MergeConflict resolve(String how) {
        return new MergeConflict(entityId, collection, fields, true, Objects.requireNonNull(how, "how"),
                ourValue, theirValue, baseValue);
    }
}

package io.branchlite.core.conflict;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of applying a strategy to a conflict.
 * <p>
 * Invariant: when {@code requiresManualResolution} is true, {@code resolvedValue} is null.
 * A resolved value of null (with the flag false) means "the entity or field is absent",
 * as when the deleting side of a delete/update conflict wins.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Resolution(
        JsonNode resolvedValue,
        String strategy,
        boolean requiresManualResolution,
        ConflictInfo conflict,
        String explanation
) {
    public Resolution {
        if (requiresManualResolution && resolvedValue != null) {
            throw new IllegalArgumentException("a resolution that requires manual work cannot carry a value");
        }
    }

    public static Resolution resolved(JsonNode value, String strategy, ConflictInfo conflict, String explanation) {
        return new Resolution(value, strategy, false, conflict, explanation);
    }

    public static Resolution manual(String strategy, ConflictInfo conflict, String explanation) {
        return new Resolution(null, strategy, true, conflict, explanation);
    }

    @JsonIgnore
    public boolean isComplete() { return !requiresManualResolution; }
}

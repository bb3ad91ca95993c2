package io.branchlite.core.conflict;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import io.branchlite.core.JsonValues;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builders for composite and value-aware strategies. Each returns a reusable
 * {@link ResolutionStrategy.Custom}.
 */
public final class Strategies {

    private static final ConflictResolver RESOLVER = new ConflictResolver();

    private Strategies() {
        // utility
    }

    /** Decides between our and their value; true picks ours. */
    @FunctionalInterface
    public interface ValuePreference {
        boolean preferOurs(JsonNode ourValue, JsonNode theirValue, ConflictInfo conflict);
    }

    /**
     * Try each strategy in order and return the first result that does not need manual work.
     * If all of them do, the last result is returned.
     */
    public static ResolutionStrategy fallback(ResolutionStrategy... strategies) {
        List<ResolutionStrategy> chain = List.of(strategies);
        if (chain.isEmpty()) throw new IllegalArgumentException("fallback needs at least one strategy");
        return ResolutionStrategy.custom(conflict -> {
            Resolution last = null;
            for (ResolutionStrategy s : chain) {
                last = RESOLVER.resolveConflict(conflict, s);
                if (!last.requiresManualResolution()) return last;
            }
            return last;
        });
    }

    public static ResolutionStrategy fieldBased(Map<String, ResolutionStrategy> byField) {
        return fieldBased(byField, ResolutionStrategy.MANUAL);
    }

    /** Dispatch on the conflicting field; unmapped fields and entity-level conflicts use the default. */
    public static ResolutionStrategy fieldBased(Map<String, ResolutionStrategy> byField,
                                                ResolutionStrategy defaultStrategy) {
        Map<String, ResolutionStrategy> table = Map.copyOf(byField);
        Objects.requireNonNull(defaultStrategy, "defaultStrategy");
        return ResolutionStrategy.custom(conflict -> {
            ResolutionStrategy s = conflict.field() == null
                    ? defaultStrategy
                    : table.getOrDefault(conflict.field(), defaultStrategy);
            return RESOLVER.resolveConflict(conflict, s);
        });
    }

    public static ResolutionStrategy preference(ValuePreference preference) {
        Objects.requireNonNull(preference, "preference");
        return ResolutionStrategy.custom(conflict -> {
            boolean ours = preference.preferOurs(conflict.ourValue(), conflict.theirValue(), conflict);
            return Resolution.resolved(ours ? conflict.ourValue() : conflict.theirValue(), "preference",
                    conflict, ours ? "Preference selected our value" : "Preference selected their value");
        });
    }

    /** Pick the side that has a value when the other is null or absent; ours otherwise. */
    public static ResolutionStrategy nonNull() {
        return ResolutionStrategy.custom(conflict -> {
            boolean ourNull = JsonValues.isNullish(conflict.ourValue());
            boolean theirNull = JsonValues.isNullish(conflict.theirValue());
            if (ourNull && !theirNull) {
                return Resolution.resolved(conflict.theirValue(), "non-null", conflict, "Using their non-null value");
            }
            return Resolution.resolved(conflict.ourValue(), "non-null", conflict,
                    theirNull && !ourNull ? "Using our non-null value" : "Using our value");
        });
    }

    public static ResolutionStrategy concatenate() {
        return concatenate(" ");
    }

    /** Join two string values as {@code our + separator + their}; non-strings need manual work. */
    public static ResolutionStrategy concatenate(String separator) {
        Objects.requireNonNull(separator, "separator");
        return ResolutionStrategy.custom(conflict -> {
            JsonNode ours = conflict.ourValue();
            JsonNode theirs = conflict.theirValue();
            if (ours == null || theirs == null || !ours.isTextual() || !theirs.isTextual()) {
                return Resolution.manual("concatenate", conflict,
                        "Cannot concatenate non-string values at " + conflict.location());
            }
            return Resolution.resolved(TextNode.valueOf(ours.textValue() + separator + theirs.textValue()),
                    "concatenate", conflict, "Concatenated both values");
        });
    }

    /** Our array followed by their elements not already present; non-arrays need manual work. */
    public static ResolutionStrategy arrayMerge() {
        return ResolutionStrategy.custom(conflict -> {
            JsonNode ours = conflict.ourValue();
            JsonNode theirs = conflict.theirValue();
            if (ours == null || theirs == null || !ours.isArray() || !theirs.isArray()) {
                return Resolution.manual("array-merge", conflict,
                        "Cannot array-merge non-array values at " + conflict.location());
            }
            ArrayNode merged = JsonNodeFactory.instance.arrayNode();
            merged.addAll((ArrayNode) ours);
            for (JsonNode v : theirs) addIfAbsent(merged, v);
            return Resolution.resolved(merged, "array-merge", conflict, "Merged arrays without duplicates");
        });
    }

    private static void addIfAbsent(ArrayNode into, JsonNode value) {
        for (JsonNode existing : into) {
            if (JsonValues.deepEquals(existing, value)) return;
        }
        into.add(value);
    }
}

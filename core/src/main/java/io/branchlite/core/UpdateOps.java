package io.branchlite.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable set of update operators: operator name -> (field -> payload).
 * <p>
 * Only used to reason about commutativity and to combine concurrent operators.
 * Applying operators to an entity is the query executor's job.
 * <p>
 * Insertion order of operators and fields is preserved.
 */
public final class UpdateOps {

    public static final String SET = "$set";
    public static final String UNSET = "$unset";
    public static final String INC = "$inc";
    public static final String PUSH = "$push";
    public static final String PULL = "$pull";
    public static final String ADD_TO_SET = "$addToSet";
    public static final String MIN = "$min";
    public static final String MAX = "$max";

    private static final UpdateOps EMPTY = new UpdateOps(Map.of());

    private final Map<String, Map<String, JsonNode>> ops;

    public UpdateOps(Map<String, Map<String, JsonNode>> ops) {
        Objects.requireNonNull(ops, "ops");
        var copy = new LinkedHashMap<String, Map<String, JsonNode>>();
        for (var e : ops.entrySet()) {
            if (e.getValue() == null || e.getValue().isEmpty()) continue;
            copy.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
        }
        this.ops = Collections.unmodifiableMap(copy);
    }

    public static UpdateOps empty() { return EMPTY; }

    public static Builder builder() { return new Builder(); }

    /**
     * Read an operator document such as {@code {"$inc": {"count": 1}}}.
     * Non-object documents yield an empty set; operator payloads that are not
     * objects are skipped.
     */
    public static UpdateOps fromJson(JsonNode node) {
        if (node == null || !node.isObject()) return EMPTY;
        var builder = builder();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            var op = it.next();
            if (!op.getValue().isObject()) continue;
            for (Iterator<Map.Entry<String, JsonNode>> fit = op.getValue().fields(); fit.hasNext(); ) {
                var f = fit.next();
                builder.put(op.getKey(), f.getKey(), f.getValue());
            }
        }
        return builder.build();
    }

    @JsonValue
    public ObjectNode toJson() {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        ops.forEach((op, fields) -> {
            ObjectNode f = root.putObject(op);
            fields.forEach(f::set);
        });
        return root;
    }

    @JsonIgnore
    public boolean isEmpty() { return ops.isEmpty(); }

    public Set<String> operators() { return ops.keySet(); }

    /** Field payloads for one operator; empty map when the operator is not present. */
    public Map<String, JsonNode> fields(String operator) {
        return ops.getOrDefault(operator, Map.of());
    }

    /** Operators in this set that touch {@code field}. */
    public Set<String> operatorsTouching(String field) {
        var out = new LinkedHashSet<String>();
        ops.forEach((op, fields) -> {
            if (fields.containsKey(field)) out.add(op);
        });
        return out;
    }

    /** The subset of this operator set that touches only {@code field}. */
    public UpdateOps restrictTo(String field) {
        var builder = builder();
        ops.forEach((op, fields) -> {
            JsonNode v = fields.get(field);
            if (v != null) builder.put(op, field, v);
        });
        return builder.build();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UpdateOps other)) return false;
        return ops.equals(other.ops);
    }

    @Override public int hashCode() { return ops.hashCode(); }

    @Override public String toString() { return toJson().toString(); }

    public static final class Builder {
        private final Map<String, Map<String, JsonNode>> ops = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String operator, String field, JsonNode value) {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(field, "field");
            ops.computeIfAbsent(operator, k -> new LinkedHashMap<>())
                    .put(field, value == null ? JsonNodeFactory.instance.nullNode() : value);
            return this;
        }

        public Builder put(String operator, String field, Object value) {
            return put(operator, field, JsonValues.of(value));
        }

        public Builder set(String field, Object value) { return put(SET, field, value); }

        public Builder unset(String field) { return put(UNSET, field, ""); }

        public Builder inc(String field, Number by) { return put(INC, field, by); }

        public Builder push(String field, Object value) { return put(PUSH, field, value); }

        public Builder addToSet(String field, Object value) { return put(ADD_TO_SET, field, value); }

        public Builder min(String field, Object value) { return put(MIN, field, value); }

        public Builder max(String field, Object value) { return put(MAX, field, value); }

        public UpdateOps build() { return ops.isEmpty() ? EMPTY : new UpdateOps(ops); }
    }
}

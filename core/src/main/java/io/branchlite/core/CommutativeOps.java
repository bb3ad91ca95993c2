package io.branchlite.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.branchlite.core.UpdateOps.ADD_TO_SET;
import static io.branchlite.core.UpdateOps.INC;
import static io.branchlite.core.UpdateOps.MAX;
import static io.branchlite.core.UpdateOps.MIN;
import static io.branchlite.core.UpdateOps.PUSH;
import static io.branchlite.core.UpdateOps.SET;
import static io.branchlite.core.UpdateOps.UNSET;

/**
 * Pure analysis of whether two concurrent operator sets can be combined without loss.
 * <p>
 * Rules for a field touched by both sides:
 *  - $inc, $min, $max and $addToSet accumulate independently of order, but only when
 *    both sides use the same operator kind on that field.
 *  - $set and $unset overwrite, so they never commute with anything on the same field.
 *  - $push is order-sensitive and never commutes on the same field, not even with itself.
 *  - Any other operator on a shared field is treated as non-commutative.
 * Fields touched by only one side never conflict.
 */
public final class CommutativeOps {

    private static final Set<String> ACCUMULATORS = Set.of(INC, MIN, MAX, ADD_TO_SET);
    private static final String EACH = "$each";

    private CommutativeOps() {
        // utility
    }

    /** Symmetric: {@code isCommutative(a, b) == isCommutative(b, a)}. */
    public static boolean isCommutative(UpdateOps a, UpdateOps b) {
        Set<String> shared = getAffectedFields(a);
        shared.retainAll(getAffectedFields(b));
        for (String field : shared) {
            if (!isCommutativeOnField(a, b, field)) return false;
        }
        return true;
    }

    /** Commutativity of the two sets restricted to a single field. */
    public static boolean isCommutativeOnField(UpdateOps a, UpdateOps b, String field) {
        Set<String> left = a.operatorsTouching(field);
        Set<String> right = b.operatorsTouching(field);
        if (left.isEmpty() || right.isEmpty()) return true;

        Set<String> kinds = new LinkedHashSet<>(left);
        kinds.addAll(right);
        if (kinds.contains(PUSH) || kinds.contains(SET) || kinds.contains(UNSET)) return false;
        if (!ACCUMULATORS.containsAll(kinds)) return false;
        return kinds.size() == 1;
    }

    /**
     * Combine two operator sets that passed {@link #isCommutative}.
     * <p>
     * Per operator:
     *  - $inc:       per-field sum.
     *  - $min/$max:  per-field minimum/maximum.
     *  - $addToSet:  union of the {@code $each} lists, de-duplicated, first-seen order.
     *  - $push:      ours then theirs, as a {@code $each} list.
     *  - others:     union of field maps (fields are expected to be disjoint).
     */
    public static UpdateOps combineOperations(UpdateOps a, UpdateOps b) {
        Map<String, Map<String, JsonNode>> out = new LinkedHashMap<>();
        for (UpdateOps side : List.of(a, b)) {
            for (String op : side.operators()) {
                Map<String, JsonNode> target = out.computeIfAbsent(op, k -> new LinkedHashMap<>());
                side.fields(op).forEach((field, value) -> {
                    JsonNode existing = target.get(field);
                    target.put(field, existing == null ? normalize(op, value) : reduce(op, existing, value));
                });
            }
        }
        return new UpdateOps(out);
    }

    /** Union of field names across all operators, in first-seen order. */
    public static Set<String> getAffectedFields(UpdateOps ops) {
        Set<String> fields = new LinkedHashSet<>();
        for (String op : ops.operators()) fields.addAll(ops.fields(op).keySet());
        return fields;
    }

    /** The {@code _ops} descriptor embedded in an after-state, or an empty set. */
    public static UpdateOps extractOperations(JsonNode afterState) {
        return UpdateOps.fromJson(JsonValues.field(afterState, Event.OPS_KEY));
    }

    /**
     * Operators that produced an event's after-state: the embedded {@code _ops} when present,
     * else the {@code metadata.update} document, else an empty set.
     */
    public static UpdateOps extractOperations(Event event) {
        UpdateOps embedded = extractOperations(event.after());
        if (!embedded.isEmpty()) return embedded;
        return UpdateOps.fromJson(JsonValues.field(event.metadata(), "update"));
    }

    // ----------------- reducers -----------------

    private static JsonNode normalize(String op, JsonNode value) {
        if (ADD_TO_SET.equals(op)) return eachNode(dedupe(eachValues(value)));
        if (PUSH.equals(op)) return eachNode(eachValues(value));
        return value;
    }

    private static JsonNode reduce(String op, JsonNode left, JsonNode right) {
        return switch (op) {
            case INC -> left.isNumber() && right.isNumber() ? JsonValues.add(left, right) : right;
            case MIN -> compareScalars(right, left) < 0 ? right : left;
            case MAX -> compareScalars(right, left) > 0 ? right : left;
            case ADD_TO_SET -> {
                List<JsonNode> all = new ArrayList<>(eachValues(left));
                all.addAll(eachValues(right));
                yield eachNode(dedupe(all));
            }
            case PUSH -> {
                List<JsonNode> all = new ArrayList<>(eachValues(left));
                all.addAll(eachValues(right));
                yield eachNode(all);
            }
            default -> right;
        };
    }

    private static int compareScalars(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) return JsonValues.compareNumbers(a, b);
        if (a.isTextual() && b.isTextual()) return a.textValue().compareTo(b.textValue());
        return 0;
    }

    private static List<JsonNode> eachValues(JsonNode value) {
        List<JsonNode> out = new ArrayList<>();
        JsonNode each = JsonValues.field(value, EACH);
        if (each != null && each.isArray()) {
            each.forEach(out::add);
        } else {
            out.add(value);
        }
        return out;
    }

    private static List<JsonNode> dedupe(List<JsonNode> values) {
        List<JsonNode> out = new ArrayList<>(values.size());
        for (JsonNode v : values) {
            boolean seen = false;
            for (JsonNode o : out) {
                if (JsonValues.deepEquals(o, v)) { seen = true; break; }
            }
            if (!seen) out.add(v);
        }
        return out;
    }

    private static JsonNode eachNode(List<JsonNode> values) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        ArrayNode arr = node.putArray(EACH);
        values.forEach(arr::add);
        return node;
    }
}

package io.branchlite.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Helpers over Jackson's JsonNode, the value type used for event payloads.
 * <p>
 * Conventions:
 *  - Java null stands for "absent" (undefined), NullNode for JSON null.
 *  - Numbers compare by numeric value, so {@code 5}, {@code 5L} and {@code 5.0} are equal.
 */
public final class JsonValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Comparator<JsonNode> NUMERIC_AWARE = (a, b) -> {
        if (a.isNumber() && b.isNumber()) return compareNumbers(a, b);
        return a.equals(b) ? 0 : 1;
    };

    private JsonValues() {
        // utility
    }

    /** Shared mapper for conversions. Treat as read-only configuration. */
    public static ObjectMapper mapper() { return MAPPER; }

    /** Parse JSON text into a tree. */
    public static JsonNode parse(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Convert a plain Java value (String, Number, Boolean, List, Map, null) into a tree. */
    public static JsonNode of(Object value) {
        if (value == null) return JsonNodeFactory.instance.nullNode();
        if (value instanceof JsonNode node) return node;
        return MAPPER.valueToTree(value);
    }

    /** Structural equality. Two absent values are equal; absent never equals JSON null. */
    public static boolean deepEquals(JsonNode a, JsonNode b) {
        if (a == null || b == null) return a == b;
        return a.equals(NUMERIC_AWARE, b);
    }

    /** Field of an object node, or null when the node is absent, not an object, or lacks the field. */
    public static JsonNode field(JsonNode node, String name) {
        if (node == null || !node.isObject()) return null;
        return node.get(name);
    }

    /** Field names of an object node in document order; empty for anything else. */
    public static List<String> fieldNames(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || !node.isObject()) return out;
        for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) out.add(it.next());
        return out;
    }

    /** True for absent values and JSON null. */
    public static boolean isNullish(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    /** Numeric comparison; both arguments must be number nodes. */
    public static int compareNumbers(JsonNode a, JsonNode b) {
        if (a.isIntegralNumber() && b.isIntegralNumber()) {
            return a.bigIntegerValue().compareTo(b.bigIntegerValue());
        }
        double da = a.doubleValue();
        double db = b.doubleValue();
        if (Double.isNaN(da) || Double.isNaN(db) || Double.isInfinite(da) || Double.isInfinite(db)) {
            return Double.compare(da, db);
        }
        return a.decimalValue().compareTo(b.decimalValue());
    }

    /** Sum of two number nodes, keeping integral results integral. */
    public static JsonNode add(JsonNode a, JsonNode b) {
        if (a.isIntegralNumber() && b.isIntegralNumber()) {
            BigInteger sum = a.bigIntegerValue().add(b.bigIntegerValue());
            if (sum.bitLength() < 64) return JsonNodeFactory.instance.numberNode(sum.longValue());
            return JsonNodeFactory.instance.numberNode(sum);
        }
        if (a.isBigDecimal() || b.isBigDecimal()) {
            BigDecimal sum = a.decimalValue().add(b.decimalValue());
            return JsonNodeFactory.instance.numberNode(sum);
        }
        return JsonNodeFactory.instance.numberNode(a.doubleValue() + b.doubleValue());
    }
}

package com.yamltest.service.compare;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Static helpers over Jackson trees shared by comparison, extraction and diffing.
 *
 * A {@code null} reference stands for "absent", which is distinct from a JSON null node.
 */
public final class JsonValues {

    private JsonValues() {
    }

    /** Strings as-is, everything else as compact JSON; {@code undefined} when absent. */
    public static String render(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "undefined";
        }
        return node.isTextual() ? node.textValue() : node.toString();
    }

    /** Compact JSON, with strings quoted; {@code undefined} when absent. */
    public static String toJson(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "undefined";
        }
        return node.toString();
    }

    /**
     * Structural equality. Numbers are equal when their values are ({@code 1 == 1.0}),
     * arrays element-wise, objects by key set and recursively equal values.
     */
    public static boolean deepEquals(JsonNode a, JsonNode b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        if (a.isArray() != b.isArray() || a.isObject() != b.isObject()) {
            return false;
        }
        if (a.isArray()) {
            if (a.size() != b.size()) return false;
            for (int i = 0; i < a.size(); i++) {
                if (!deepEquals(a.get(i), b.get(i))) return false;
            }
            return true;
        }
        if (a.isObject()) {
            if (a.size() != b.size()) return false;
            Iterator<Map.Entry<String, JsonNode>> fields = a.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!b.has(field.getKey())) return false;
                if (!deepEquals(field.getValue(), b.get(field.getKey()))) return false;
            }
            return true;
        }
        return a.equals(b);
    }

    /**
     * Lenient numeric reading: numbers, numeric strings, booleans as 1/0,
     * null and blank strings as 0. Anything else is NaN.
     */
    public static double toNumber(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return Double.NaN;
        }
        if (node.isNull()) {
            return 0;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? 1 : 0;
        }
        if (node.isTextual()) {
            String text = node.textValue().trim();
            if (text.isEmpty()) {
                return 0;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }
}

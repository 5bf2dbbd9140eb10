package com.yamltest.service.diff;

import com.fasterxml.jackson.databind.JsonNode;
import com.yamltest.service.compare.JsonValues;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Structural diff of two JSON trees. Objects are compared key by key, arrays
 * index by index; an array whose length changed is reported once as
 * {@link Difference.Kind#ARRAY} ahead of its element differences.
 */
public final class JsonDiff {

    private JsonDiff() {
    }

    public static List<Difference> diff(JsonNode lhs, JsonNode rhs) {
        List<Difference> out = new ArrayList<>();
        walk(lhs, rhs, new ArrayList<>(), out);
        return out;
    }

    private static void walk(JsonNode lhs, JsonNode rhs, List<String> path, List<Difference> out) {
        if (lhs != null && rhs != null && lhs.isObject() && rhs.isObject()) {
            Iterator<String> names = lhs.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                List<String> child = append(path, name);
                if (!rhs.has(name)) {
                    out.add(new Difference(Difference.Kind.DELETED, child, lhs.get(name), null));
                } else {
                    walk(lhs.get(name), rhs.get(name), child, out);
                }
            }
            Iterator<String> added = rhs.fieldNames();
            while (added.hasNext()) {
                String name = added.next();
                if (!lhs.has(name)) {
                    out.add(new Difference(Difference.Kind.NEW, append(path, name), null, rhs.get(name)));
                }
            }
            return;
        }
        if (lhs != null && rhs != null && lhs.isArray() && rhs.isArray()) {
            if (lhs.size() != rhs.size()) {
                out.add(new Difference(Difference.Kind.ARRAY, List.copyOf(path), lhs, rhs));
            }
            int common = Math.min(lhs.size(), rhs.size());
            for (int i = 0; i < common; i++) {
                walk(lhs.get(i), rhs.get(i), append(path, String.valueOf(i)), out);
            }
            return;
        }
        if (!JsonValues.deepEquals(lhs, rhs)) {
            out.add(new Difference(Difference.Kind.EDITED, List.copyOf(path), lhs, rhs));
        }
    }

    private static List<String> append(List<String> path, String segment) {
        List<String> next = new ArrayList<>(path);
        next.add(segment);
        return List.copyOf(next);
    }
}

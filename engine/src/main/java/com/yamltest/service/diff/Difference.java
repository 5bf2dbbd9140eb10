package com.yamltest.service.diff;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One structural difference between two documents.
 *
 * @param kind  what changed
 * @param path  keys and array indices from the root
 * @param lhs   value on the left (absent for NEW)
 * @param rhs   value on the right (absent for DELETED)
 */
public record Difference(Kind kind, List<String> path, JsonNode lhs, JsonNode rhs) {

    public enum Kind {
        /** Present only on the right. */
        NEW,
        /** Present only on the left. */
        DELETED,
        /** Present on both sides with different values. */
        EDITED,
        /** An array whose length changed; lhs and rhs hold the whole arrays. */
        ARRAY
    }

    public String pathString() {
        return String.join(".", path);
    }
}

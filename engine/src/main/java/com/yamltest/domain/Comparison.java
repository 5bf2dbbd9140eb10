package com.yamltest.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import jakarta.annotation.Nullable;

/**
 * A single leaf expectation: {@code {comparator, value?, negate?, matchword?}}.
 * {@code value} is ignored by {@code exists}.
 */
public record Comparison(
    @Nullable String comparator,
    @Nullable JsonNode value,
    boolean negate,
    boolean matchword
) {

    public static Comparison of(String comparator, @Nullable JsonNode value, boolean negate) {
        return new Comparison(comparator, value, negate, false);
    }

    public static Comparison contains(String text) {
        return new Comparison("contains", TextNode.valueOf(text), false, false);
    }
}

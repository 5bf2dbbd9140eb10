package com.yamltest.domain;

import jakarta.annotation.Nullable;

/**
 * One {@code setVars} entry.
 *
 * @param type        which part of the result to read
 * @param expression  the JSONPath, header name or regex pattern, depending on type
 * @param group       regex capture group, 1-based
 * @param textSource  regex input for command results: {@code stdout} or {@code stderr}
 */
public record ExtractionRule(
    Type type,
    @Nullable String expression,
    int group,
    String textSource
) {

    public static ExtractionRule of(Type type) {
        return new ExtractionRule(type, null, 1, "stdout");
    }

    public static ExtractionRule of(Type type, String expression) {
        return new ExtractionRule(type, expression, 1, "stdout");
    }

    public enum Type {
        JSON_PATH("jsonPath"),
        HEADER("header"),
        STATUS_CODE("statusCode"),
        BODY("body"),
        STDOUT("stdout"),
        STDERR("stderr"),
        EXIT_CODE("exitCode"),
        VALUE("value"),
        REGEX("regex");

        private final String key;

        Type(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }
    }
}

package com.yamltest.domain;

/**
 * The four kinds of test definition. A definition carries exactly one of
 * the corresponding top-level keys.
 */
public enum TestKind {
    HTTP("http"),
    COMMAND("command"),
    WAIT("wait"),
    BODY_COMPARISON("bodyComparison");

    private final String key;

    TestKind(String key) {
        this.key = key;
    }

    /** The YAML key that selects this kind. */
    public String key() {
        return key;
    }
}

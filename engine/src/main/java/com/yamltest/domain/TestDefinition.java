package com.yamltest.domain;

import java.util.Map;

/**
 * One parsed and validated test definition. Immutable.
 *
 * @param name     display name (from {@code name}, {@code test_title} or a positional default)
 * @param retries  additional attempts after a failed one
 * @param step     the kind-specific part
 * @param setVars  extraction rules run after the expectations pass, in declaration order
 */
public record TestDefinition(
    String name,
    int retries,
    TestStep step,
    Map<String, ExtractionRule> setVars
) {

    public TestKind kind() {
        return step.kind();
    }
}

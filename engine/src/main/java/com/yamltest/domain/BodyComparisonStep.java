package com.yamltest.domain;

import java.util.List;

public record BodyComparisonStep(
    HttpCall request1,
    HttpCall request2,
    double delaySeconds,
    boolean parseAsJson,
    List<String> removeJsonPaths
) implements TestStep {

    @Override
    public TestKind kind() {
        return TestKind.BODY_COMPARISON;
    }
}

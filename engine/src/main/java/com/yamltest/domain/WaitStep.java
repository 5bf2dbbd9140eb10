package com.yamltest.domain;

import jakarta.annotation.Nullable;

public record WaitStep(
    Selector target,
    @Nullable String jsonPath,
    @Nullable Comparison expectation,
    Polling polling
) implements TestStep {

    @Override
    public TestKind kind() {
        return TestKind.WAIT;
    }
}

package com.yamltest.domain;

public record HttpStep(HttpCall call, HttpExpectations expect) implements TestStep {

    @Override
    public TestKind kind() {
        return TestKind.HTTP;
    }
}

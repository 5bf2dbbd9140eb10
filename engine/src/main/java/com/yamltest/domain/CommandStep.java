package com.yamltest.domain;

public record CommandStep(CommandSpec command, Source source, CommandExpectations expect) implements TestStep {

    @Override
    public TestKind kind() {
        return TestKind.COMMAND;
    }
}

package com.yamltest.domain;

/**
 * Kind-specific body of a {@link TestDefinition}.
 *
 * Implementations: {@link HttpStep}, {@link CommandStep}, {@link WaitStep},
 * {@link BodyComparisonStep}.
 */
public interface TestStep {

    TestKind kind();
}

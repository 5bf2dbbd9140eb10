package com.yamltest.domain;

import jakarta.annotation.Nullable;

import java.util.List;

/**
 * The {@code expect} block of a command test. {@code output} is an alias
 * of stdout kept for older definitions.
 */
public record CommandExpectations(
    @Nullable Integer exitCode,
    List<Comparison> stdout,
    List<Comparison> stderr,
    List<Comparison> output,
    List<PathComparison> json,
    List<PathComparison> jsonPath
) {

    public static CommandExpectations none() {
        return new CommandExpectations(null, List.of(), List.of(), List.of(), List.of(), List.of());
    }
}

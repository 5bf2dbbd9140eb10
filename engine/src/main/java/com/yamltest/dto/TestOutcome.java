package com.yamltest.dto;

import jakarta.annotation.Nullable;
import io.micronaut.serde.annotation.Serdeable;

/**
 * Outcome of one definition within a batch. {@code attempts} is 0 for
 * definitions skipped after an earlier failure.
 */
@Serdeable
public record TestOutcome(
    String name,
    boolean passed,
    @Nullable String error,
    long durationMs,
    int attempts,
    boolean skipped
) {

    public static TestOutcome passed(String name, long durationMs, int attempts) {
        return new TestOutcome(name, true, null, durationMs, attempts, false);
    }

    public static TestOutcome failed(String name, String error, long durationMs, int attempts) {
        return new TestOutcome(name, false, error, durationMs, attempts, false);
    }

    public static TestOutcome skipped(String name) {
        return new TestOutcome(name, false, "Skipped due to previous failure", 0, 0, true);
    }
}

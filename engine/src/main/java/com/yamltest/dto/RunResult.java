package com.yamltest.dto;

import io.micronaut.serde.annotation.Serdeable;

import java.util.List;

@Serdeable
public record RunResult(
    int total,
    int passed,
    int failed,
    int skipped,
    List<TestOutcome> results
) {

    public static RunResult of(List<TestOutcome> results) {
        int passed = (int) results.stream().filter(TestOutcome::passed).count();
        int skipped = (int) results.stream().filter(TestOutcome::skipped).count();
        return new RunResult(results.size(), passed, results.size() - passed - skipped, skipped, List.copyOf(results));
    }

    public boolean allPassed() {
        return failed == 0 && skipped == 0;
    }
}

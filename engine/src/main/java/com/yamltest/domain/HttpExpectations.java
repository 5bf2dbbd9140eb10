package com.yamltest.domain;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.Nullable;

import java.util.List;

/**
 * The {@code expect} block of an HTTP test. Empty lists mean "not checked".
 */
public record HttpExpectations(
    List<Integer> statusCodes,
    @Nullable JsonNode body,
    List<Comparison> bodyContains,
    List<Comparison> bodyRegex,
    List<PathComparison> bodyJsonPath,
    List<HeaderExpectation> headers
) {

    public static HttpExpectations none() {
        return new HttpExpectations(List.of(), null, List.of(), List.of(), List.of(), List.of());
    }
}

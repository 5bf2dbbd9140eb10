package com.yamltest.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.yamltest.domain.TestKind;

/** The value a satisfied wait read from the resource. */
public record WaitObservation(JsonNode extractedValue) implements ResponseData {

    @Override
    public TestKind kind() {
        return TestKind.WAIT;
    }
}

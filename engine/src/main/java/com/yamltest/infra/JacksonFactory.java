package com.yamltest.infra;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

/**
 * Provides the Jackson {@link ObjectMapper} used for response bodies,
 * kubectl output and JSONPath evaluation.
 *
 * Floats are read as {@code BigDecimal} so numeric comparisons and
 * re-serialization keep the digits the server sent.
 */
@Factory
public class JacksonFactory {

    @Singleton
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }
}

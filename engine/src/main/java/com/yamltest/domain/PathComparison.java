package com.yamltest.domain;

import jakarta.annotation.Nullable;

/**
 * A comparison applied to the first JSONPath match, or to the whole
 * document when {@code path} is null.
 */
public record PathComparison(@Nullable String path, Comparison comparison) {
}

package com.yamltest.domain;

import jakarta.annotation.Nullable;

/**
 * Bounds of a wait. {@code maxRetries} is independent of the deadline;
 * null means only the deadline applies.
 */
public record Polling(long timeoutSeconds, long intervalSeconds, @Nullable Integer maxRetries) {

    public static final long DEFAULT_TIMEOUT_SECONDS = 60;
    public static final long DEFAULT_INTERVAL_SECONDS = 2;
}

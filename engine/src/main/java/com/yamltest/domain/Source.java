package com.yamltest.domain;

import jakarta.annotation.Nullable;

/**
 * Where a request or command originates.
 *
 * For {@code pod} sources the transport hints are mutually exclusive; when
 * neither is set, HTTP requests go through an ephemeral debug container.
 */
public record Source(
    SourceType type,
    @Nullable Selector selector,
    @Nullable String container,
    boolean usePortForward,
    boolean usePodExec
) {

    private static final Source LOCAL = new Source(SourceType.LOCAL, null, null, false, false);

    public static Source local() {
        return LOCAL;
    }

    public boolean isPod() {
        return type == SourceType.POD;
    }
}

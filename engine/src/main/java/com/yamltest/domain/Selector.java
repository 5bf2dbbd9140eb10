package com.yamltest.domain;

import jakarta.annotation.Nullable;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Locates a Kubernetes resource by name or by label set.
 * Exactly one of {@code name} and {@code labels} is set.
 */
public record Selector(
    String kind,
    @Nullable String namespace,
    @Nullable String name,
    Map<String, String> labels,
    @Nullable String context
) {

    public boolean byName() {
        return name != null;
    }

    public boolean isPod() {
        return "pod".equalsIgnoreCase(kind);
    }

    /** {@code k1=v1,k2=v2}, the form kubectl takes after {@code -l}. */
    public String labelSelector() {
        return labels.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(","));
    }

    /** Human-readable {@code Kind/namespace/name} used in log lines and error messages. */
    public String describe() {
        String ns = namespace != null ? namespace : "default";
        String target = name != null ? name : "with labels " + labelSelector();
        return kind + "/" + ns + "/" + target;
    }
}

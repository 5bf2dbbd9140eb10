package com.yamltest.domain;

import jakarta.annotation.Nullable;

import java.util.Map;

public record CommandSpec(
    String command,
    Map<String, String> env,
    @Nullable String workingDir,
    boolean parseJson
) {
}

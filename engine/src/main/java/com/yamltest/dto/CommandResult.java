package com.yamltest.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.yamltest.domain.TestKind;
import jakarta.annotation.Nullable;

/**
 * Trimmed output of a local or in-pod command.
 *
 * {@code json} is set only when {@code parseJson} was requested and stdout
 * parsed; otherwise {@code jsonParseError} may carry the parser message.
 */
public record CommandResult(
    String stdout,
    String stderr,
    int exitCode,
    @Nullable JsonNode json,
    @Nullable String jsonParseError
) implements ResponseData {

    /** Older definitions refer to stdout as {@code output}. */
    public String output() {
        return stdout;
    }

    @Override
    public TestKind kind() {
        return TestKind.COMMAND;
    }
}

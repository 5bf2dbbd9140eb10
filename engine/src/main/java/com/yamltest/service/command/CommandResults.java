package com.yamltest.service.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yamltest.dto.CommandResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class CommandResults {

    private static final Logger log = LoggerFactory.getLogger(CommandResults.class);

    private CommandResults() {
    }

    /**
     * Trim both streams and, when requested, parse stdout as JSON. A parse
     * failure is recorded on the result rather than thrown.
     */
    static CommandResult of(ObjectMapper mapper, String stdout, String stderr, int exitCode, boolean parseJson) {
        String out = stdout == null ? "" : stdout.trim();
        String err = stderr == null ? "" : stderr.trim();
        JsonNode json = null;
        String parseError = null;
        if (parseJson && !out.isEmpty()) {
            try {
                json = mapper.readTree(out);
            } catch (JsonProcessingException e) {
                parseError = e.getOriginalMessage();
                log.debug("Failed to parse JSON: {}", parseError);
            }
        }
        return new CommandResult(out, err, exitCode, json, parseError);
    }
}

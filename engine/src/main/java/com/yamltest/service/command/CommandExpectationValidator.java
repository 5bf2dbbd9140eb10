package com.yamltest.service.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.yamltest.domain.CommandExpectations;
import com.yamltest.domain.Comparison;
import com.yamltest.domain.PathComparison;
import com.yamltest.dto.CommandResult;
import com.yamltest.infra.ExpectationFailedException;
import com.yamltest.service.compare.ComparatorEngine;
import com.yamltest.service.compare.JsonPathEvaluator;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Checks a command result: exit code, stdout, stderr, output, json, jsonPath.
 */
@Singleton
public class CommandExpectationValidator {

    private static final Logger log = LoggerFactory.getLogger(CommandExpectationValidator.class);

    @Inject ComparatorEngine comparator;
    @Inject JsonPathEvaluator jsonPath;

    public void validate(CommandResult result, CommandExpectations expect, String testName) {
        log.debug("Validating expectations for: {}", testName);

        if (expect.exitCode() != null && expect.exitCode() != result.exitCode()) {
            throw new ExpectationFailedException("Exit code mismatch: expected " + expect.exitCode()
                + ", got " + result.exitCode());
        }

        checkOutput(result.stdout(), expect.stdout(), "stdout");
        checkOutput(result.stderr(), expect.stderr(), "stderr");
        checkOutput(result.output(), expect.output(), "output");

        if (!expect.json().isEmpty()) {
            requireJson(result, "");
            for (PathComparison pc : expect.json()) {
                if (pc.path() == null) {
                    comparator.compare(result.json(), pc.comparison(), "JSON output");
                } else {
                    comparator.compare(firstMatch(result.json(), pc.path()), pc.comparison(), "JSONPath \"" + pc.path() + "\"");
                }
            }
        }

        if (!expect.jsonPath().isEmpty()) {
            requireJson(result, "jsonPath ");
            for (PathComparison pc : expect.jsonPath()) {
                comparator.compare(firstMatch(result.json(), pc.path()), pc.comparison(), "JSONPath \"" + pc.path() + "\"");
            }
        }
    }

    private void checkOutput(String actual, List<Comparison> expectations, String outputType) {
        for (Comparison c : expectations) {
            comparator.compare(TextNode.valueOf(actual), c, outputType + " " + c.comparator());
        }
    }

    private JsonNode firstMatch(JsonNode json, String path) {
        JsonNode match = jsonPath.first(json, path);
        if (match == null) {
            throw new ExpectationFailedException("JSONPath \"" + path + "\" not found in output");
        }
        return match;
    }

    private static void requireJson(CommandResult result, String what) {
        if (result.json() != null) {
            return;
        }
        if (result.jsonParseError() != null) {
            throw new ExpectationFailedException("JSON parsing failed" + (what.isEmpty() ? "" : ", cannot validate " + what.trim())
                + ": " + result.jsonParseError());
        }
        throw new ExpectationFailedException("No JSON output available for " + what + "validation");
    }
}

package com.yamltest.service.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.yamltest.domain.Comparison;
import com.yamltest.domain.HeaderExpectation;
import com.yamltest.domain.HttpExpectations;
import com.yamltest.domain.PathComparison;
import com.yamltest.dto.HttpResponseData;
import com.yamltest.infra.ConfigurationException;
import com.yamltest.infra.ExpectationFailedException;
import com.yamltest.service.VariableStore;
import com.yamltest.service.compare.ComparatorEngine;
import com.yamltest.service.compare.JsonPathEvaluator;
import com.yamltest.service.compare.JsonValues;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks an HTTP response against the {@code expect} block, in order:
 * status code, exact body, bodyContains, bodyRegex, bodyJsonPath, headers.
 * The first failing check throws.
 */
@Singleton
public class HttpExpectationValidator {

    private static final Logger log = LoggerFactory.getLogger(HttpExpectationValidator.class);

    @Inject ComparatorEngine comparator;
    @Inject JsonPathEvaluator jsonPath;
    @Inject VariableStore variables;

    public void validate(HttpResponseData response, HttpExpectations expect, String testName) {
        log.debug("Validating expectations for: {}", testName);

        List<Integer> codes = expect.statusCodes();
        if (!codes.isEmpty() && !codes.contains(response.statusCode())) {
            Object expected = codes.size() == 1 ? codes.get(0) : codes;
            throw new ExpectationFailedException("Status code mismatch: expected " + expected
                + ", got " + response.statusCode());
        }

        if (expect.body() != null && !JsonValues.deepEquals(response.body(), expect.body())) {
            throw new ExpectationFailedException("Body mismatch: expected " + JsonValues.toJson(expect.body())
                + ", got " + JsonValues.toJson(response.body()));
        }

        String rawBody = JsonValues.render(response.body());
        for (Comparison c : expect.bodyContains()) {
            checkContains(rawBody, c);
        }
        for (Comparison c : expect.bodyRegex()) {
            checkRegex(rawBody, c);
        }
        for (PathComparison pc : expect.bodyJsonPath()) {
            checkJsonPath(response.body(), pc);
        }
        for (HeaderExpectation h : expect.headers()) {
            checkHeader(response, h);
        }
        log.debug("All expectations validated successfully for: {}", testName);
    }

    private void checkContains(String rawBody, Comparison c) {
        String needle = JsonValues.render(c.value());
        if (needle.startsWith("$")) {
            needle = variables.interpolate(needle);
        }
        boolean contains = c.matchword()
            ? Pattern.compile("\\b" + Pattern.quote(needle) + "\\b").matcher(rawBody).find()
            : rawBody.contains(needle);
        if (c.negate() == contains) {
            throw new ExpectationFailedException(c.negate()
                ? "Body should not contain substring but does: \"" + needle + "\""
                : "Body does not contain substring: \"" + needle + "\"");
        }
    }

    private void checkRegex(String rawBody, Comparison c) {
        String regex = JsonValues.render(c.value());
        boolean matches;
        try {
            matches = Pattern.compile(regex).matcher(rawBody).find();
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid regular expression /" + regex + "/: " + e.getDescription(), e);
        }
        if (c.negate() == matches) {
            throw new ExpectationFailedException(c.negate()
                ? "Body should not match regex but does: " + regex
                : "Body does not match regex: " + regex);
        }
    }

    private void checkJsonPath(JsonNode body, PathComparison pc) {
        List<JsonNode> results = jsonPath.read(body, pc.path());
        Comparison c = pc.comparison();
        if (results.isEmpty()) {
            if (c.negate() && "exists".equals(c.comparator())) {
                log.debug("JSONPath \"{}\" does not exist, as expected", pc.path());
                return;
            }
            throw new ExpectationFailedException("JSONPath \"" + pc.path() + "\" did not return any results");
        }
        comparator.compare(results.get(0), c, "JSONPath " + pc.path());
    }

    private void checkHeader(HttpResponseData response, HeaderExpectation h) {
        String value = response.header(h.name());
        JsonNode actual = value == null ? null : TextNode.valueOf(value);
        if (!"exists".equals(h.comparison().comparator()) && actual == null) {
            throw new ExpectationFailedException("Header \"" + h.name() + "\" not found in response");
        }
        comparator.compare(actual, h.comparison(), "Header \"" + h.name() + "\"");
    }
}

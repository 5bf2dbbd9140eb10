package com.yamltest.service.compare;

import com.fasterxml.jackson.databind.JsonNode;
import com.yamltest.domain.Comparison;
import com.yamltest.infra.ConfigurationException;
import com.yamltest.infra.ExpectationFailedException;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates one {@link Comparison} against an actual value.
 *
 * Comparators:
 *   exists       → value present and not JSON null
 *   equals       → structural equality, see {@link JsonValues#deepEquals}
 *   contains     → substring of the rendered value ({@code matchword} adds word boundaries)
 *   matches      → regex find against the rendered value
 *   greaterThan  → numeric, see {@link JsonValues#toNumber}
 *   lessThan     → numeric
 *
 * {@code negate} inverts the result. Failures throw {@link ExpectationFailedException};
 * an unknown comparator is a {@link ConfigurationException}.
 */
@Singleton
public class ComparatorEngine {

    private static final Logger log = LoggerFactory.getLogger(ComparatorEngine.class);

    public void compare(JsonNode actual, Comparison comparison, String description) {
        String rendered = JsonValues.render(actual);
        String comparator = comparison.comparator();
        JsonNode expected = comparison.value();

        boolean result = switch (comparator == null ? "" : comparator) {
            case "exists" -> actual != null && !actual.isMissingNode() && !actual.isNull();
            case "equals" -> JsonValues.deepEquals(actual, expected);
            case "contains" -> contains(rendered, needle(expected), comparison.matchword());
            case "matches" -> compile(needle(expected)).matcher(rendered).find();
            case "greaterThan" -> JsonValues.toNumber(actual) > JsonValues.toNumber(expected);
            case "lessThan" -> JsonValues.toNumber(actual) < JsonValues.toNumber(expected);
            default -> throw new ConfigurationException("Unknown comparator: " + comparator);
        };

        log.debug("{} {}{} {}: found {} -> {}", description, comparison.negate() ? "not " : "",
            comparator, JsonValues.toJson(expected), rendered, result);

        if (comparison.negate() == result) {
            String operation = comparison.negate() ? "not " + comparator : comparator;
            String valueStr = "exists".equals(comparator) ? "" : " " + JsonValues.toJson(expected);
            throw new ExpectationFailedException(description + " comparison failed: expected to "
                + operation + valueStr + ", found " + rendered);
        }
    }

    private static boolean contains(String haystack, String needle, boolean matchword) {
        if (matchword) {
            return Pattern.compile("\\b" + Pattern.quote(needle) + "\\b").matcher(haystack).find();
        }
        return haystack.contains(needle);
    }

    private static String needle(JsonNode expected) {
        if (expected == null || expected.isMissingNode()) {
            return "undefined";
        }
        return expected.isValueNode() ? expected.asText() : expected.toString();
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid regular expression /" + regex + "/: " + e.getDescription(), e);
        }
    }
}

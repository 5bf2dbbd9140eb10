package com.yamltest.service.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.yamltest.domain.ExtractionRule;
import com.yamltest.domain.TestKind;
import com.yamltest.dto.CommandResult;
import com.yamltest.dto.HttpResponseData;
import com.yamltest.dto.ResponseData;
import com.yamltest.dto.WaitObservation;
import com.yamltest.infra.ExpectationFailedException;
import com.yamltest.infra.InvalidSourceForKindException;
import com.yamltest.infra.NoResultsException;
import com.yamltest.service.VariableStore;
import com.yamltest.service.compare.JsonPathEvaluator;
import com.yamltest.service.compare.JsonValues;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies {@code setVars} rules to a completed result and publishes the
 * values into the {@link VariableStore}.
 *
 * Rule → valid result kinds:
 *   jsonPath                   → http, command (parseJson)
 *   header, statusCode, body   → http
 *   stdout, stderr, exitCode   → command
 *   value                      → wait
 *   regex                      → http (body), command (stdout or stderr)
 *
 * Rules run in declaration order. The first failing rule aborts the rest;
 * values published before it stay published.
 */
@Singleton
public class VariableExtractor {

    private static final Logger log = LoggerFactory.getLogger(VariableExtractor.class);

    @Inject VariableStore variables;
    @Inject JsonPathEvaluator jsonPath;
    @Inject ObjectMapper mapper;

    public void apply(Map<String, ExtractionRule> rules, ResponseData data) {
        if (rules == null || rules.isEmpty()) {
            return;
        }
        for (Map.Entry<String, ExtractionRule> entry : rules.entrySet()) {
            String name = entry.getKey();
            JsonNode value = extract(name, entry.getValue(), data);
            if (value == null || value.isNull() || value.isMissingNode()) {
                throw new ExpectationFailedException(prefix(name) + "extracted value is null or undefined");
            }
            String text = JsonValues.render(value).trim();
            variables.put(name, text);
            log.debug("setVars: {}={}", name, text);
        }
    }

    private JsonNode extract(String name, ExtractionRule rule, ResponseData data) {
        return switch (rule.type()) {
            case JSON_PATH -> fromJsonPath(name, rule, data);
            case HEADER -> {
                HttpResponseData http = requireHttp(name, rule, data);
                String header = http.header(rule.expression());
                if (header == null) {
                    throw new ExpectationFailedException(prefix(name) + "header \"" + rule.expression() + "\" not present in response");
                }
                yield TextNode.valueOf(header);
            }
            case STATUS_CODE -> IntNode.valueOf(requireHttp(name, rule, data).statusCode());
            case BODY -> TextNode.valueOf(JsonValues.render(requireHttp(name, rule, data).body()));
            case STDOUT -> TextNode.valueOf(requireCommand(name, rule, data).stdout());
            case STDERR -> TextNode.valueOf(requireCommand(name, rule, data).stderr());
            case EXIT_CODE -> IntNode.valueOf(requireCommand(name, rule, data).exitCode());
            case VALUE -> {
                if (!(data instanceof WaitObservation observation)) {
                    throw invalidSource(name, rule, data);
                }
                yield observation.extractedValue();
            }
            case REGEX -> fromRegex(name, rule, data);
        };
    }

    private JsonNode fromJsonPath(String name, ExtractionRule rule, ResponseData data) {
        JsonNode document;
        if (data instanceof HttpResponseData http) {
            document = parseIfText(name, http.body());
        } else if (data instanceof CommandResult command) {
            document = command.json();
        } else {
            throw invalidSource(name, rule, data);
        }
        if (document == null || document.isNull()) {
            throw new ExpectationFailedException(prefix(name) + "no JSON data available for jsonPath extraction");
        }
        List<JsonNode> results = jsonPath.read(document, rule.expression());
        if (results.isEmpty()) {
            throw new NoResultsException(prefix(name) + "jsonPath \"" + rule.expression() + "\" returned no results");
        }
        if (results.size() == 1) {
            return results.get(0);
        }
        ArrayNode array = mapper.createArrayNode();
        results.forEach(array::add);
        return array;
    }

    private JsonNode fromRegex(String name, ExtractionRule rule, ResponseData data) {
        String text;
        if (data instanceof HttpResponseData http) {
            text = JsonValues.render(http.body());
        } else if (data instanceof CommandResult command) {
            text = switch (rule.textSource()) {
                case "stdout" -> command.stdout();
                case "stderr" -> command.stderr();
                default -> throw new InvalidSourceForKindException(
                    prefix(name) + "regex source must be \"stdout\" or \"stderr\", got \"" + rule.textSource() + "\"");
            };
        } else {
            throw invalidSource(name, rule, data);
        }
        if (text == null) {
            throw new ExpectationFailedException(prefix(name) + "no text available for regex extraction");
        }
        Matcher m = Pattern.compile(rule.expression()).matcher(text);
        if (!m.find()) {
            throw new ExpectationFailedException(prefix(name) + "regex \"" + rule.expression() + "\" did not match");
        }
        if (rule.group() < 0 || rule.group() > m.groupCount() || m.group(rule.group()) == null) {
            throw new ExpectationFailedException(prefix(name) + "regex capture group " + rule.group() + " not found in match");
        }
        return TextNode.valueOf(m.group(rule.group()));
    }

    private JsonNode parseIfText(String name, JsonNode body) {
        if (body == null || !body.isTextual()) {
            return body;
        }
        try {
            return mapper.readTree(body.textValue());
        } catch (JsonProcessingException e) {
            throw new ExpectationFailedException(prefix(name) + "response body is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static HttpResponseData requireHttp(String name, ExtractionRule rule, ResponseData data) {
        if (data instanceof HttpResponseData http) {
            return http;
        }
        throw invalidSource(name, rule, data);
    }

    private static CommandResult requireCommand(String name, ExtractionRule rule, ResponseData data) {
        if (data instanceof CommandResult command) {
            return command;
        }
        throw invalidSource(name, rule, data);
    }

    private static InvalidSourceForKindException invalidSource(String name, ExtractionRule rule, ResponseData data) {
        return new InvalidSourceForKindException(prefix(name) + "\"" + rule.type().key()
            + "\" source is not valid for " + data.kind().key() + " tests");
    }


    private static String prefix(String name) {
        return "setVars \"" + name + "\": ";
    }
}

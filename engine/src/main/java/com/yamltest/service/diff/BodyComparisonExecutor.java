package com.yamltest.service.diff;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yamltest.domain.BodyComparisonStep;
import com.yamltest.domain.HttpCall;
import com.yamltest.dto.HttpResponseData;
import com.yamltest.infra.ExpectationFailedException;
import com.yamltest.infra.TransportException;
import com.yamltest.service.compare.JsonPathEvaluator;
import com.yamltest.service.compare.JsonValues;
import com.yamltest.service.http.HttpTestExecutor;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Sends two requests and fails when their bodies differ.
 *
 * With {@code parseAsJson}, text bodies are parsed and {@code removeJsonPaths}
 * are stripped from both sides before comparing.
 */
@Singleton
public class BodyComparisonExecutor {

    private static final Logger log = LoggerFactory.getLogger(BodyComparisonExecutor.class);

    @Inject HttpTestExecutor http;
    @Inject JsonPathEvaluator jsonPath;
    @Inject DiffFormatter formatter;
    @Inject ObjectMapper mapper;

    public boolean execute(BodyComparisonStep step) {
        log.debug("Executing HTTP body comparison test: {} vs {}", label(step.request1()), label(step.request2()));

        HttpResponseData response1 = http.perform(step.request1());
        if (step.delaySeconds() > 0) {
            log.debug("Waiting {} seconds before executing second request", step.delaySeconds());
            pause(step.delaySeconds());
        }
        HttpResponseData response2 = http.perform(step.request2());

        JsonNode body1 = response1.body();
        JsonNode body2 = response2.body();
        if (step.parseAsJson()) {
            body1 = jsonPath.delete(asJson(body1, "response1"), step.removeJsonPaths());
            body2 = jsonPath.delete(asJson(body2, "response2"), step.removeJsonPaths());
        }

        if (JsonValues.deepEquals(body1, body2)) {
            log.debug("HTTP body comparison passed: bodies match");
            return true;
        }

        List<Difference> differences = JsonDiff.diff(body1, body2);
        StringBuilder message = new StringBuilder("HTTP response bodies do not match");
        if (!differences.isEmpty()) {
            message.append(":\n\nDifferences:\n").append(formatter.format(differences));
        } else {
            message.append(":\n\nResponse 1 body:\n").append(pretty(body1))
                .append("\n\nResponse 2 body:\n").append(pretty(body2));
        }
        throw new ExpectationFailedException(message.toString());
    }

    private JsonNode asJson(JsonNode body, String which) {
        if (body == null || !body.isTextual()) {
            return body;
        }
        try {
            return mapper.readTree(body.textValue());
        } catch (JsonProcessingException e) {
            throw new ExpectationFailedException("Failed to parse " + which + " body as JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String pretty(JsonNode body) {
        if (body == null || body.isTextual()) {
            return JsonValues.render(body);
        }
        return body.toPrettyString();
    }

    private static String label(HttpCall call) {
        return call.http().method() + " " + call.http().fullUrl();
    }

    private static void pause(double seconds) {
        try {
            Thread.sleep((long) (seconds * 1000));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted between requests", e);
        }
    }
}

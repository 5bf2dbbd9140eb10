package com.yamltest.service.wait;

import com.fasterxml.jackson.databind.JsonNode;
import com.yamltest.domain.Comparison;
import com.yamltest.domain.ExtractionRule;
import com.yamltest.domain.Polling;
import com.yamltest.domain.WaitStep;
import com.yamltest.dto.WaitObservation;
import com.yamltest.infra.ConfigurationException;
import com.yamltest.infra.RetriesExhaustedException;
import com.yamltest.infra.TestFailureException;
import com.yamltest.infra.TransportException;
import com.yamltest.infra.WaitTimeoutException;
import com.yamltest.k8s.Kubectl;
import com.yamltest.service.compare.ComparatorEngine;
import com.yamltest.service.compare.JsonPathEvaluator;
import com.yamltest.service.compare.JsonValues;
import com.yamltest.service.extract.VariableExtractor;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Polls {@code kubectl get <kind> <name|-l labels> -o json} until the
 * resource satisfies the wait condition.
 *
 * Each attempt either satisfies the condition or counts as "not yet": empty or
 * invalid output, a failed lookup, no match for the JSONPath, a null match, an
 * empty-string match when no expectation is given, or a failed expectation.
 * An attempt is never started once {@code maxRetries} attempts were made or
 * the deadline has passed. Configuration errors are not retried.
 */
@Singleton
public class WaitPoller {

    private static final Logger log = LoggerFactory.getLogger(WaitPoller.class);

    @Inject Kubectl kubectl;
    @Inject JsonPathEvaluator jsonPath;
    @Inject ComparatorEngine comparator;
    @Inject VariableExtractor extractor;

    public boolean execute(WaitStep step, Map<String, ExtractionRule> setVars) {
        String resource = step.target().describe();
        Polling polling = step.polling();
        Integer maxRetries = polling.maxRetries();
        String retryInfo = maxRetries != null ? " (max " + maxRetries + " retries)" : "";

        if (step.expectation() != null) {
            log.info("Waiting for {} until {} {}{}", resource, step.jsonPath(), describe(step.expectation()), retryInfo);
        } else {
            log.info("Waiting for {}{}", resource, retryInfo);
        }

        long deadline = System.currentTimeMillis() + polling.timeoutSeconds() * 1000;
        int attempts = 0;
        while (System.currentTimeMillis() < deadline) {
            if (maxRetries != null && attempts >= maxRetries) {
                throw new RetriesExhaustedException("Maximum retries (" + maxRetries
                    + ") exceeded while waiting for " + resource);
            }
            attempts++;
            String attempt = "Attempt " + attempts + (maxRetries != null ? "/" + maxRetries : "");

            JsonNode observed;
            try {
                observed = observe(step, attempt);
            } catch (ConfigurationException e) {
                throw e;
            } catch (TestFailureException e) {
                log.debug("{}: lookup failed, will retry: {}", attempt, e.getMessage());
                observed = null;
            }

            if (observed != null) {
                log.info("{} is ready", resource);
                extractor.apply(setVars, new WaitObservation(observed));
                return true;
            }
            sleep(polling.intervalSeconds());
        }

        StringBuilder message = new StringBuilder("Timed-out (" + polling.timeoutSeconds() + "s) waiting for " + resource);
        if (step.jsonPath() != null) {
            message.append(" → ").append(step.jsonPath());
            if (step.expectation() != null) {
                message.append(" to ").append(describe(step.expectation()));
            }
        }
        throw new WaitTimeoutException(message.toString());
    }

    /** The satisfying value, or null when the condition does not hold yet. */
    private JsonNode observe(WaitStep step, String attempt) {
        JsonNode json = kubectl.getJson(step.target());
        if (step.jsonPath() == null) {
            if (!step.target().byName() && json.path("items").isEmpty()) {
                log.debug("{}: no resources match {}, retrying", attempt, step.target().describe());
                return null;
            }
            log.debug("Resource {} exists", step.target().describe());
            return json;
        }

        List<JsonNode> matches = jsonPath.read(json, step.jsonPath());
        if (matches.isEmpty() && !step.jsonPath().startsWith("$")) {
            matches = jsonPath.read(json, "$" + step.jsonPath());
        }
        if (matches.isEmpty() || matches.get(0).isNull()) {
            log.debug("{}: jsonPath {} not found yet, retrying", attempt, step.jsonPath());
            return null;
        }
        JsonNode value = matches.get(0);

        if (step.expectation() != null) {
            try {
                comparator.compare(value, step.expectation(), "JSONPath " + step.jsonPath());
            } catch (ConfigurationException e) {
                throw e;
            } catch (TestFailureException e) {
                log.debug("{}: {}, retrying", attempt, e.getMessage());
                return null;
            }
        } else if (value.isTextual() && value.textValue().isEmpty()) {
            log.debug("{}: value is empty string, retrying", attempt);
            return null;
        }
        log.debug("Found value for {}: {}", step.jsonPath(), JsonValues.render(value));
        return value;
    }

    private static String describe(Comparison expectation) {
        String op = expectation.negate() ? "not " + expectation.comparator() : expectation.comparator();
        return "exists".equals(expectation.comparator()) ? op : op + " " + JsonValues.toJson(expectation.value());
    }

    private static void sleep(long seconds) {
        try {
            Thread.sleep(seconds * 1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting", e);
        }
    }
}

package com.yamltest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.yamltest.domain.TestDefinition;
import com.yamltest.dto.RunResult;
import com.yamltest.dto.TestOutcome;
import com.yamltest.infra.TestFailureException;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a batch of definitions in order.
 *
 * Each definition gets {@code 1 + retries} attempts with a fixed pause between
 * them; configuration errors end the definition on the first attempt. After the
 * first failed definition the rest are recorded as skipped.
 */
@Singleton
public class TestRunner {

    private static final Logger log = LoggerFactory.getLogger(TestRunner.class);

    @Inject TestDefinitionParser parser;
    @Inject TestExecutor executor;

    @Value("${yamltest.runner.retry-pause-millis:500}")
    long retryPauseMillis;

    public RunResult runTests(String yaml) {
        List<JsonNode> definitions = parser.parseBatch(yaml);
        log.info("Running {} test(s)", definitions.size());

        List<TestOutcome> outcomes = new ArrayList<>();
        boolean failed = false;
        for (int i = 0; i < definitions.size(); i++) {
            JsonNode node = definitions.get(i);
            String name = TestDefinitionParser.displayName(node, i);
            if (failed) {
                log.info("Skipping '{}'", name);
                outcomes.add(TestOutcome.skipped(name));
                continue;
            }
            TestOutcome outcome = runOne(node, i, name);
            outcomes.add(outcome);
            failed = !outcome.passed();
        }

        RunResult result = RunResult.of(outcomes);
        log.info("Finished: {} passed, {} failed, {} skipped of {}",
            result.passed(), result.failed(), result.skipped(), result.total());
        return result;
    }

    private TestOutcome runOne(JsonNode node, int index, String name) {
        long start = System.currentTimeMillis();
        log.info("Running '{}'", name);

        TestDefinition definition;
        try {
            definition = parser.toDefinition(node, index);
        } catch (TestFailureException e) {
            log.info("'{}' failed: {}", name, e.getMessage());
            return TestOutcome.failed(name, e.getMessage(), System.currentTimeMillis() - start, 1);
        } catch (RuntimeException e) {
            return unexpected(name, e, start, 1);
        }

        int maxAttempts = definition.retries() + 1;
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                executor.execute(definition);
                long elapsed = System.currentTimeMillis() - start;
                log.info("'{}' passed in {} ms ({} attempt(s))", name, elapsed, attempt);
                return TestOutcome.passed(name, elapsed, attempt);
            } catch (TestFailureException e) {
                if (!e.isRetryable() || attempt >= maxAttempts) {
                    long elapsed = System.currentTimeMillis() - start;
                    log.info("'{}' failed after {} attempt(s): {}", name, attempt, e.getMessage());
                    return TestOutcome.failed(name, e.getMessage(), elapsed, attempt);
                }
                log.info("'{}' attempt {}/{} failed, retrying: {}", name, attempt, maxAttempts, e.getMessage());
                if (!pause()) {
                    return TestOutcome.failed(name, "Interrupted while waiting to retry",
                        System.currentTimeMillis() - start, attempt);
                }
            } catch (RuntimeException e) {
                return unexpected(name, e, start, attempt);
            }
        }
    }

    // Never retried.
    private TestOutcome unexpected(String name, RuntimeException e, long start, int attempts) {
        log.warn("'{}' failed with an unexpected error", name, e);
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return TestOutcome.failed(name, "Unexpected error: " + message, System.currentTimeMillis() - start, attempts);
    }

    private boolean pause() {
        try {
            Thread.sleep(retryPauseMillis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

package com.yamltest.service.command;

import com.yamltest.domain.CommandStep;
import com.yamltest.domain.ExtractionRule;
import com.yamltest.domain.Source;
import com.yamltest.dto.CommandResult;
import com.yamltest.service.extract.VariableExtractor;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Runs a {@code command} test locally or in a pod, validates the result and
 * extracts {@code setVars}.
 */
@Singleton
public class CommandTestExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandTestExecutor.class);

    @Inject LocalCommandTransport localTransport;
    @Inject PodCommandTransport podTransport;
    @Inject CommandExpectationValidator validator;
    @Inject VariableExtractor extractor;

    public boolean execute(CommandStep step, Map<String, ExtractionRule> setVars) {
        Source source = step.source();
        String testName = "Command: " + step.command().command();
        if (source.isPod()) {
            testName += " (via pod " + source.selector().describe() + ")";
        }
        log.debug("Executing command test: {}", testName);

        CommandTransport transport = source.isPod() ? podTransport : localTransport;
        CommandResult result = transport.execute(step.command(), source);
        log.debug("stdout: {}", result.stdout());
        log.debug("stderr: {}", result.stderr());

        validator.validate(result, step.expect(), testName);
        extractor.apply(setVars, result);
        log.debug("Command test passed: {}", testName);
        return true;
    }
}

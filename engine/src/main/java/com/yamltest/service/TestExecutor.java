package com.yamltest.service;

import com.yamltest.domain.BodyComparisonStep;
import com.yamltest.domain.CommandStep;
import com.yamltest.domain.HttpStep;
import com.yamltest.domain.TestDefinition;
import com.yamltest.domain.WaitStep;
import com.yamltest.service.command.CommandTestExecutor;
import com.yamltest.service.diff.BodyComparisonExecutor;
import com.yamltest.service.http.HttpTestExecutor;
import com.yamltest.service.wait.WaitPoller;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a single test definition by handing it to the executor for its kind.
 * Returns {@code true} on success; every failure surfaces as a
 * {@link com.yamltest.infra.TestFailureException}.
 */
@Singleton
public class TestExecutor {

    private static final Logger log = LoggerFactory.getLogger(TestExecutor.class);

    @Inject TestDefinitionParser parser;
    @Inject HttpTestExecutor httpExecutor;
    @Inject CommandTestExecutor commandExecutor;
    @Inject WaitPoller waitPoller;
    @Inject BodyComparisonExecutor bodyComparisonExecutor;

    public boolean execute(String yaml) {
        return execute(parser.parseSingle(yaml));
    }

    public boolean execute(TestDefinition definition) {
        log.debug("Dispatching {} test '{}'", definition.kind().key(), definition.name());
        return switch (definition.kind()) {
            case HTTP -> httpExecutor.execute((HttpStep) definition.step(), definition.setVars());
            case COMMAND -> commandExecutor.execute((CommandStep) definition.step(), definition.setVars());
            case WAIT -> waitPoller.execute((WaitStep) definition.step(), definition.setVars());
            case BODY_COMPARISON -> bodyComparisonExecutor.execute((BodyComparisonStep) definition.step());
        };
    }
}

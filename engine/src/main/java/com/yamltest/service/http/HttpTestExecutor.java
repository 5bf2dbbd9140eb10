package com.yamltest.service.http;

import com.yamltest.domain.ExtractionRule;
import com.yamltest.domain.HttpCall;
import com.yamltest.domain.HttpRequestSpec;
import com.yamltest.domain.HttpStep;
import com.yamltest.domain.Source;
import com.yamltest.dto.HttpResponseData;
import com.yamltest.service.extract.VariableExtractor;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Runs an {@code http} test: prepare, send through the selected transport,
 * validate, then extract {@code setVars}.
 */
@Singleton
public class HttpTestExecutor {

    private static final Logger log = LoggerFactory.getLogger(HttpTestExecutor.class);

    @Inject HttpRequestPreparer preparer;
    @Inject HttpTransportSelector transports;
    @Inject HttpExpectationValidator validator;
    @Inject VariableExtractor extractor;

    public boolean execute(HttpStep step, Map<String, ExtractionRule> setVars) {
        HttpRequestSpec request = preparer.prepare(step.call());
        String testName = describe(request, step.call().source());

        log.debug("Executing HTTP test: {}", testName);
        HttpResponseData response = send(request, step.call().source());

        validator.validate(response, step.expect(), testName);
        extractor.apply(setVars, response);
        log.debug("Test passed: {}", testName);
        return true;
    }

    /** Prepare and send one request without validating it. */
    public HttpResponseData perform(HttpCall call) {
        return send(preparer.prepare(call), call.source());
    }

    private HttpResponseData send(HttpRequestSpec request, Source source) {
        HttpTransport transport = transports.select(source);
        log.debug("Using {} for {} {}", transport.getClass().getSimpleName(), request.method(), request.fullUrl());
        HttpResponseData response = transport.send(request, source);
        log.debug("Response received: status={}, headers={}, body={}",
            response.statusCode(), response.headers(), response.body());
        return response;
    }

    static String describe(HttpRequestSpec request, Source source) {
        String name = request.method() + " " + request.fullUrl();
        if (source.isPod() && source.selector() != null) {
            name += " (via pod " + source.selector().describe() + ")";
        }
        return name;
    }
}

package com.yamltest;

import com.yamltest.infra.ExpectationFailedException;
import com.yamltest.service.TestExecutor;
import com.yamltest.service.VariableStore;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@MicronautTest
class HttpTestExecutorTest {

    @Inject TestExecutor executor;
    @Inject VariableStore variables;

    private TestHttpServer server;

    @BeforeEach
    void start() throws Exception {
        variables.clear();
        server = new TestHttpServer();
        variables.put("BASE", server.baseUrl());
    }

    @AfterEach
    void stop() {
        server.close();
    }

    @Test
    void execute_expectationsPass_andValuesAreCaptured() {
        boolean passed = executor.execute("""
            http:
              url: $BASE
              path: /items
            expect:
              statusCode: 200
              bodyContains: widget
              bodyRegex: '"id":\\s*\\d+'
              bodyJsonPath:
                - { path: $.name, comparator: equals, value: widget }
                - { path: $.deleted, comparator: exists, negate: true }
              headers:
                - { name: x-trace, comparator: equals, value: t-1 }
            setVars:
              ITEM_ID: { jsonPath: $.id }
              TRACE: { header: X-Trace }
            """);

        assertThat(passed).isTrue();
        assertThat(variables.snapshot()).containsEntry("ITEM_ID", "42").containsEntry("TRACE", "t-1");
    }

    @Test
    void execute_capturedValue_isUsedInLaterRequest() {
        variables.put("TOKEN", "secret-1");

        assertThatCode(() -> executor.execute("""
            http:
              url: ${BASE}
              path: /echo
              headers: { Authorization: "Bearer $TOKEN" }
            expect:
              bodyJsonPath:
                - { path: $.auth, comparator: equals, value: "Bearer secret-1" }
            """)).doesNotThrowAnyException();
    }

    @Test
    void execute_bodyContainsVariable_isInterpolated() {
        variables.put("EXPECTED_NAME", "widget");

        assertThatCode(() -> executor.execute("""
            http: { url: $BASE, path: /items }
            expect:
              bodyContains: $EXPECTED_NAME
            """)).doesNotThrowAnyException();
    }

    @Test
    void execute_statusMismatch_failsWithBothCodes() {
        assertThatThrownBy(() -> executor.execute("""
            http: { url: $BASE, path: /redirect }
            expect: { statusCode: 200 }
            """))
            .isInstanceOf(ExpectationFailedException.class)
            .hasMessage("Status code mismatch: expected 200, got 302");
    }

    @Test
    void execute_missingJsonPath_fails() {
        assertThatThrownBy(() -> executor.execute("""
            http: { url: $BASE, path: /items }
            expect:
              bodyJsonPath:
                - { path: $.owner, comparator: equals, value: me }
            """))
            .isInstanceOf(ExpectationFailedException.class)
            .hasMessage("JSONPath \"$.owner\" did not return any results");
    }

    @Test
    void execute_missingHeader_fails() {
        assertThatThrownBy(() -> executor.execute("""
            http: { url: $BASE, path: /items }
            expect:
              headers:
                - { name: ETag, comparator: equals, value: x }
            """))
            .isInstanceOf(ExpectationFailedException.class)
            .hasMessage("Header \"ETag\" not found in response");
    }
}

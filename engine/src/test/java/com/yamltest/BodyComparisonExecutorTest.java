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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@MicronautTest
class BodyComparisonExecutorTest {

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
    void execute_volatileFieldRemoved_bodiesMatch() {
        boolean passed = executor.execute("""
            bodyComparison:
              request1: { http: { url: $BASE, path: /items } }
              request2: { http: { url: $BASE, path: /items } }
              parseAsJson: true
              removeJsonPaths: [$.updatedAt]
            """);

        assertThat(passed).isTrue();
    }

    @Test
    void execute_volatileFieldKept_reportsEditedPath() {
        assertThatThrownBy(() -> executor.execute("""
            bodyComparison:
              request1: { http: { url: $BASE, path: /items } }
              request2: { http: { url: $BASE, path: /items } }
              delaySeconds: 0.01
              parseAsJson: true
            """))
            .isInstanceOf(ExpectationFailedException.class)
            .hasMessageStartingWith("HTTP response bodies do not match:\n\nDifferences:\n")
            .hasMessageContaining("• updatedAt: ")
            .hasMessageNotContaining("• id");
    }

    @Test
    void execute_arrayGrew_isShownAsBeforeAfterBlock() {
        assertThatThrownBy(() -> executor.execute("""
            bodyComparison:
              request1: { http: { url: $BASE, path: /counter } }
              request2: { http: { url: $BASE, path: /counter } }
              parseAsJson: true
            """))
            .isInstanceOf(ExpectationFailedException.class)
            .hasMessageContaining("• count: 1 => 2")
            .hasMessageContaining("• items:\n\nBefore:\n- 0\nAfter:\n- 0\n- 1");
    }

    @Test
    void execute_differentTextBodies_printsBothBodies() {
        assertThatThrownBy(() -> executor.execute("""
            bodyComparison:
              request1: { http: { url: $BASE, path: /text } }
              request2: { http: { url: $BASE, path: /items } }
            """))
            .isInstanceOf(ExpectationFailedException.class)
            .hasMessageContaining("• (root): \"plain words here\" => {");
    }
}

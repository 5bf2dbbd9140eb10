package com.yamltest;

import com.yamltest.infra.AmbiguousTestKindException;
import com.yamltest.infra.ExpectationFailedException;
import com.yamltest.infra.ProcessResult;
import com.yamltest.infra.ProcessRunner;
import com.yamltest.infra.UnknownTestKindException;
import com.yamltest.service.TestExecutor;
import com.yamltest.service.VariableStore;
import io.micronaut.test.annotation.MockBean;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@MicronautTest
class TestExecutorTest {

    @Inject TestExecutor executor;
    @Inject ProcessRunner processRunner;
    @Inject VariableStore variables;

    @MockBean(ProcessRunner.class)
    ProcessRunner mockProcessRunner() {
        return mock(ProcessRunner.class);
    }

    @BeforeEach
    void reset() {
        variables.clear();
    }

    @Test
    void execute_commandDefinition_runsThroughShell() {
        when(processRunner.run(eq(List.of("sh", "-c", "echo hello")), any(), any()))
            .thenReturn(new ProcessResult(0, "hello\n", ""));

        boolean passed = executor.execute("""
            command: { command: "echo hello" }
            expect:
              exitCode: 0
              stdout: hello
            setVars:
              GREETING: { stdout: true }
            """);

        assertThat(passed).isTrue();
        assertThat(variables.snapshot()).containsEntry("GREETING", "hello");
    }

    @Test
    void execute_failedExpectation_throws() {
        when(processRunner.run(anyList(), any(), any())).thenReturn(new ProcessResult(2, "", "boom"));

        assertThatThrownBy(() -> executor.execute("""
            command: { command: "exit 2" }
            expect: { exitCode: 0 }
            """))
            .isInstanceOf(ExpectationFailedException.class)
            .hasMessage("Exit code mismatch: expected 0, got 2");
    }

    @Test
    void execute_waitDefinition_usesKubectlGet() {
        when(processRunner.run(eq(List.of("kubectl", "-n", "prod", "get", "deployment", "web", "-o", "json")), any(), any()))
            .thenReturn(new ProcessResult(0, "{\"status\":{\"readyReplicas\":3}}", ""));

        boolean passed = executor.execute("""
            wait:
              target:
                kind: Deployment
                metadata: { name: web, namespace: prod }
              jsonPath: $.status.readyReplicas
              jsonPathExpectation: { comparator: equals, value: 3 }
              polling: { timeoutSeconds: 5, intervalSeconds: 0 }
            """);

        assertThat(passed).isTrue();
    }

    @Test
    void execute_ambiguousDefinition_neverRunsAnything() {
        assertThatThrownBy(() -> executor.execute("""
            command: { command: ls }
            wait: { target: { metadata: { name: x } } }
            """))
            .isInstanceOf(AmbiguousTestKindException.class);

        verify(processRunner, never()).run(anyList(), any(), any());
    }

    @Test
    void execute_unknownDefinition_throws() {
        assertThatThrownBy(() -> executor.execute("name: empty"))
            .isInstanceOf(UnknownTestKindException.class)
            .hasMessageContaining("http, command, wait, bodyComparison");
    }
}

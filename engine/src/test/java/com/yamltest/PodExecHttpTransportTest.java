package com.yamltest;

import com.yamltest.infra.ExpectationFailedException;
import com.yamltest.infra.ProcessResult;
import com.yamltest.infra.ProcessRunner;
import com.yamltest.infra.TransportException;
import com.yamltest.service.TestExecutor;
import com.yamltest.service.VariableStore;
import io.micronaut.test.annotation.MockBean;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@MicronautTest
class PodExecHttpTransportTest {

    private static final String CURL_OUTPUT = "HTTP/1.1 100 Continue\r\n\r\n"
        + "HTTP/1.1 201 Created\r\nContent-Type: application/json\r\nX-Id: 9\r\n\r\n"
        + "{\"ok\":true}\n---RESPONSE_END---\n";

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

    // ── Helpers ─────────────────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private List<String> lastCommand() {
        ArgumentCaptor<List<String>> captor = ArgumentCaptor.forClass(List.class);
        verify(processRunner).run(captor.capture(), any(), any());
        return captor.getValue();
    }

    // ── Tests ───────────────────────────────────────────────────────────────

    @Test
    void execute_namedPod_buildsQuotedCurlCommand() {
        when(processRunner.run(anyList(), any(), any())).thenReturn(new ProcessResult(0, CURL_OUTPUT, ""));

        boolean passed = executor.execute("""
            http:
              url: http://localhost:8080
              path: /api
              method: POST
              headers: { X-Tenant: acme }
              body: { note: "it's" }
            source:
              type: pod
              usePodExec: true
              container: app
              selector:
                metadata: { name: web-0, namespace: shop }
            expect:
              statusCode: 201
              bodyJsonPath:
                - { path: $.ok, comparator: equals, value: true }
              headers:
                - { name: X-Id, comparator: equals, value: "9" }
            """);

        assertThat(passed).isTrue();
        assertThat(lastCommand()).containsExactly("kubectl", "-n", "shop", "exec", "web-0", "-c", "app", "--", "sh", "-c",
            "curl -s -i -w '\\n---RESPONSE_END---\\n' -X POST -H 'X-Tenant: acme'"
                + " -H 'Content-Type: application/json' -d '{\"note\":\"it'\\''s\"}' 'http://localhost:8080/api'");
    }

    @Test
    void execute_labelSelector_resolvesFirstPod() {
        when(processRunner.run(eq(List.of("kubectl", "-n", "shop", "get", "pod", "-l", "app=cart", "-o", "json")), any(), any()))
            .thenReturn(new ProcessResult(0, """
                {"apiVersion":"v1","kind":"List","items":[
                  {"metadata":{"name":"cart-1"}},{"metadata":{"name":"cart-2"}}]}
                """, ""));
        when(processRunner.run(eq(List.of("kubectl", "-n", "shop", "exec", "cart-1", "--", "sh", "-c",
            "curl -s -i -w '\\n---RESPONSE_END---\\n' 'http://localhost:8080/'")), any(), any()))
            .thenReturn(new ProcessResult(0, "HTTP/1.1 200 OK\n\nready\n---RESPONSE_END---", ""));

        boolean passed = executor.execute("""
            http: { url: "http://localhost:8080" }
            source:
              type: pod
              usePodExec: true
              selector:
                metadata:
                  namespace: shop
                  labels: { app: cart }
            expect:
              statusCode: 200
              bodyContains: ready
            """);

        assertThat(passed).isTrue();
    }

    @Test
    void execute_noPodsForLabels_isTransportError() {
        when(processRunner.run(anyList(), any(), any()))
            .thenReturn(new ProcessResult(0, "{\"apiVersion\":\"v1\",\"kind\":\"List\",\"items\":[]}", ""));

        assertThatThrownBy(() -> executor.execute("""
            http: { url: "http://localhost:8080" }
            source:
              type: pod
              usePodExec: true
              selector:
                metadata:
                  namespace: shop
                  labels: { app: cart }
            """))
            .isInstanceOf(TransportException.class)
            .hasMessage("No pods found matching labels app=cart in namespace shop");
    }

    @Test
    void execute_curlFailure_reconstructsResponseWithStderr() {
        when(processRunner.run(anyList(), any(), any()))
            .thenReturn(new ProcessResult(7, "", "curl: (7) Failed to connect"));

        assertThatThrownBy(() -> executor.execute("""
            http: { url: "http://localhost:9" }
            source:
              type: pod
              usePodExec: true
              selector:
                metadata: { name: web-0, namespace: shop }
            expect:
              statusCode: 200
            """))
            .isInstanceOf(ExpectationFailedException.class)
            .hasMessage("Status code mismatch: expected 200, got 500");
    }

    @Test
    void execute_curlFailure_bodyCarriesStderr() {
        when(processRunner.run(anyList(), any(), any()))
            .thenReturn(new ProcessResult(7, "", "curl: (7) Failed to connect"));

        boolean passed = executor.execute("""
            http: { url: "http://localhost:9" }
            source:
              type: pod
              usePodExec: true
              selector:
                metadata: { name: web-0, namespace: shop }
            expect:
              statusCode: 500
              bodyContains: Failed to connect
            """);

        assertThat(passed).isTrue();
    }
}

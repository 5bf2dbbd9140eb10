package com.yamltest.service.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yamltest.domain.HttpRequestSpec;
import com.yamltest.domain.Source;
import com.yamltest.dto.HttpResponseData;
import com.yamltest.infra.ProcessResult;
import com.yamltest.infra.ShellQuoting;
import com.yamltest.infra.TransportException;
import com.yamltest.k8s.Kubectl;
import com.yamltest.k8s.PodResolver;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Sends the request with curl inside an existing container:
 *   kubectl exec {target} [-c container] -- sh -c "curl -s -i ... '{url}'"
 *
 * A non-zero exit still yields a response, reconstructed from whatever curl
 * printed; stderr is appended to the body.
 */
@Singleton
public class PodExecHttpTransport implements HttpTransport {

    private static final Logger log = LoggerFactory.getLogger(PodExecHttpTransport.class);
    static final int FALLBACK_STATUS = 500;

    @Inject Kubectl kubectl;
    @Inject PodResolver podResolver;
    @Inject ObjectMapper mapper;

    @Override
    public HttpResponseData send(HttpRequestSpec request, Source source) {
        String target = podResolver.workloadTarget(source.selector());

        List<String> args = new ArrayList<>(List.of("exec", target));
        if (source.container() != null) {
            args.add("-c");
            args.add(source.container());
        }
        args.addAll(List.of("--", "sh", "-c", curlCommand(request)));
        List<String> cmd = kubectl.command(source.selector(), args);

        log.debug("Executing curl via pod-exec: {}", String.join(" ", cmd));
        ProcessResult result = kubectl.run(cmd);
        log.debug("Raw output: {}", result.stdout());

        if (result.success()) {
            CurlResponseParser.Parsed parsed = CurlResponseParser.parse(result.stdout());
            return new HttpResponseData(parsed.statusCode(), parsed.headers(), ResponseBodies.parse(mapper, parsed.body()));
        }
        return reconstruct(result);
    }

    private HttpResponseData reconstruct(ProcessResult result) {
        log.debug("Pod-exec curl command failed with exit code {}", result.exitCode());
        int status = FALLBACK_STATUS;
        Map<String, String> headers = Map.of();
        String body;
        try {
            CurlResponseParser.Parsed parsed = CurlResponseParser.parse(result.stdout());
            status = parsed.statusCode();
            headers = parsed.headers();
            body = parsed.body();
        } catch (TransportException e) {
            log.debug("Failed to parse curl response from error output: {}", e.getMessage());
            body = result.stdout().trim();
        }
        if (!result.stderr().isBlank()) {
            body += "\n" + result.stderr();
        }
        return new HttpResponseData(status, headers, ResponseBodies.parse(mapper, body));
    }

    static String curlCommand(HttpRequestSpec request) {
        StringBuilder curl = new StringBuilder("curl -s -i -w '\\n" + CurlResponseParser.END_MARKER + "\\n'");
        String method = request.method().toUpperCase(Locale.ROOT);
        if (!"GET".equals(method)) {
            curl.append(" -X ").append(method);
        }
        request.headers().forEach((name, value) ->
            curl.append(" -H ").append(ShellQuoting.quote(name + ": " + value)));
        String body = ResponseBodies.serialize(request.body());
        if (body != null) {
            if (!request.body().isTextual()
                    && request.headers().keySet().stream().noneMatch("Content-Type"::equalsIgnoreCase)) {
                curl.append(" -H ").append(ShellQuoting.quote("Content-Type: application/json"));
            }
            curl.append(" -d ").append(ShellQuoting.quote(body));
        }
        if (request.skipSslVerification()) {
            curl.append(" -k");
        }
        curl.append(' ').append(ShellQuoting.quote(LocalHttpTransport.buildUri(request).toString()));
        return curl.toString();
    }
}

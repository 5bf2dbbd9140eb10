package com.yamltest.service.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.yamltest.domain.HttpRequestSpec;
import com.yamltest.domain.Selector;
import com.yamltest.domain.Source;
import com.yamltest.dto.HttpResponseData;
import com.yamltest.infra.ConfigurationException;
import com.yamltest.infra.ProcessResult;
import com.yamltest.infra.ProcessRunner;
import com.yamltest.infra.TransportException;
import com.yamltest.k8s.Kubectl;
import com.yamltest.k8s.PodResolver;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sends the request from an ephemeral debug container attached to the
 * selected pod:
 *   kubectl debug {pod} -i --quiet --image={image} --profile={profile} [--target={container}] -- node -e {program}
 *
 * The debug session is killed once {@code yamltest.debug.timeout-seconds} has passed.
 */
@Singleton
public class DebugContainerHttpTransport implements HttpTransport {

    private static final Logger log = LoggerFactory.getLogger(DebugContainerHttpTransport.class);
    private static final Pattern RESPONSE_BLOCK = Pattern.compile(
        DebugRequestScript.START_MARKER + "\\s+(.*?)\\s+" + DebugRequestScript.END_MARKER, Pattern.DOTALL);

    @Value("${yamltest.debug.image:node:slim}")
    String image;

    @Value("${yamltest.debug.profile:general}")
    String profile;

    @Value("${yamltest.debug.timeout-seconds:120}")
    long timeoutSeconds;

    @Inject Kubectl kubectl;
    @Inject PodResolver podResolver;
    @Inject ProcessRunner processRunner;
    @Inject ObjectMapper mapper;

    @Override
    public HttpResponseData send(HttpRequestSpec request, Source source) {
        Selector selector = source.selector();
        if (selector.namespace() == null) {
            throw new ConfigurationException("Namespace is required in the Kubernetes selector");
        }
        String pod = podResolver.podName(selector);

        List<String> args = new ArrayList<>(List.of("debug", pod, "-i", "--quiet",
            "--image=" + image, "--profile=" + profile));
        if (source.container() != null) {
            args.add("--target=" + source.container());
        }
        args.addAll(List.of("--", "node", "-e", DebugRequestScript.render(mapper, request)));
        List<String> cmd = kubectl.command(selector, args);

        log.debug("Debugging pod {}/{} to execute {} {}", selector.namespace(), pod, request.method(), request.fullUrl());
        ProcessResult result = processRunner.run(cmd, Duration.ofSeconds(timeoutSeconds));
        log.debug("Debug output raw length: {} bytes", result.stdout().length());

        Matcher m = RESPONSE_BLOCK.matcher(result.stdout());
        if (!m.find()) {
            if (!result.success()) {
                throw new TransportException("Failed to debug pod " + selector.namespace() + "/" + pod + ": "
                    + (result.stderr().isBlank() ? "exit code " + result.exitCode() : result.stderr().trim()));
            }
            log.debug("Full pod debug output:\n{}", result.stdout());
            throw new TransportException("Could not find HTTP response markers in the output");
        }
        return toResponse(m.group(1).trim());
    }

    HttpResponseData toResponse(String json) {
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TransportException("Failed to parse JSON response: " + e.getOriginalMessage(), e);
        }
        if (node.path("error").asBoolean(false)) {
            throw new TransportException("Request from debug container failed: " + node.path("message").asText());
        }
        Map<String, String> headers = new LinkedHashMap<>();
        node.path("headers").fields().forEachRemaining(e -> headers.put(e.getKey(), headerValue(e.getValue())));
        JsonNode body = node.get("body");
        return new HttpResponseData(node.path("statusCode").asInt(), headers,
            body == null || body.isNull() ? TextNode.valueOf("") : body);
    }

    private static String headerValue(JsonNode value) {
        if (value.isArray()) {
            List<String> parts = new ArrayList<>();
            value.forEach(v -> parts.add(v.asText()));
            return String.join(", ", parts);
        }
        return value.asText();
    }
}

package com.yamltest.service.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yamltest.domain.HttpRequestSpec;
import com.yamltest.domain.Source;
import com.yamltest.dto.HttpResponseData;
import com.yamltest.infra.ConfigurationException;
import com.yamltest.infra.TransportException;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Sends the request from this process with the JDK {@link HttpClient}.
 *
 * Redirects are followed by hand so the per-request {@code maxRedirects}
 * limit (default 0) applies; a 303, or a 301/302 after a POST, continues as GET.
 */
@Singleton
public class LocalHttpTransport implements HttpTransport {

    private static final Logger log = LoggerFactory.getLogger(LocalHttpTransport.class);

    @Value("${yamltest.http.request-timeout-seconds:30}")
    long requestTimeoutSeconds;

    @Inject TlsContextFactory tlsContextFactory;
    @Inject ObjectMapper mapper;

    @Override
    public HttpResponseData send(HttpRequestSpec request, Source source) {
        return send(request);
    }

    public HttpResponseData send(HttpRequestSpec request) {
        URI uri = buildUri(request);
        HttpClient client = newClient(request, uri);

        String method = request.method().toUpperCase(Locale.ROOT);
        String body = ResponseBodies.serialize(request.body());
        Map<String, String> headers = new LinkedHashMap<>(request.headers());
        if (body != null && !request.body().isTextual() && !hasHeader(headers, "Content-Type")) {
            headers.put("Content-Type", "application/json");
        }

        int redirects = 0;
        while (true) {
            log.debug("{} {}", method, uri);
            HttpResponse<String> response = exchange(client, newRequest(uri, method, body, headers));
            Optional<String> location = response.headers().firstValue("location");
            if (isRedirect(response.statusCode()) && location.isPresent() && redirects < request.maxRedirects()) {
                redirects++;
                uri = uri.resolve(location.get());
                if (response.statusCode() == 303
                        || ((response.statusCode() == 301 || response.statusCode() == 302) && "POST".equals(method))) {
                    method = "GET";
                    body = null;
                }
                log.debug("Following redirect {} of {} to {}", redirects, request.maxRedirects(), uri);
                continue;
            }
            log.debug("Response received with status code: {}", response.statusCode());
            return new HttpResponseData(response.statusCode(), flatten(response), ResponseBodies.parse(mapper, response.body()));
        }
    }

    private HttpClient newClient(HttpRequestSpec request, URI uri) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(Duration.ofSeconds(requestTimeoutSeconds));
        if ("https".equalsIgnoreCase(uri.getScheme())) {
            SSLContext ssl = tlsContextFactory.create(request);
            if (ssl != null) {
                builder.sslContext(ssl);
            }
        }
        return builder.build();
    }

    private HttpRequest newRequest(URI uri, String method, String body, Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(requestTimeoutSeconds))
            .method(method, body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        headers.forEach((name, value) -> {
            try {
                builder.header(name, value);
            } catch (IllegalArgumentException e) {
                log.warn("Header '{}' cannot be set by the HTTP client and is ignored", name);
            }
        });
        return builder.build();
    }

    private HttpResponse<String> exchange(HttpClient client, HttpRequest request) {
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TransportException("Request " + request.method() + " " + request.uri() + " failed: "
                + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted during " + request.method() + " " + request.uri(), e);
        }
    }

    static URI buildUri(HttpRequestSpec request) {
        if (request.url() == null || request.url().isBlank()) {
            throw new ConfigurationException("http.url is required");
        }
        StringBuilder url = new StringBuilder(request.fullUrl());
        if (!request.params().isEmpty()) {
            url.append(url.indexOf("?") >= 0 ? '&' : '?');
            url.append(request.params().entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&")));
        }
        URI uri;
        try {
            uri = new URI(url.toString());
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Invalid URL " + url + ": " + e.getMessage(), e);
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
            throw new ConfigurationException("Invalid URL " + url + ": scheme must be http or https");
        }
        return uri;
    }

    private static Map<String, String> flatten(HttpResponse<?> response) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : response.headers().map().entrySet()) {
            if (!e.getKey().startsWith(":")) {
                headers.put(e.getKey(), String.join(", ", e.getValue()));
            }
        }
        return headers;
    }

    private static boolean hasHeader(Map<String, String> headers, String name) {
        return headers.keySet().stream().anyMatch(name::equalsIgnoreCase);
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}

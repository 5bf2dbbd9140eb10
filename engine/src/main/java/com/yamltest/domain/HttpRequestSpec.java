package com.yamltest.domain;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.Nullable;

import java.util.Map;

/**
 * The {@code http} block of a test.
 *
 * {@code port} and {@code scheme} are only consulted when the URL is
 * discovered from a Service's load-balancer status.
 */
public record HttpRequestSpec(
    @Nullable String url,
    String method,
    String path,
    Map<String, String> headers,
    Map<String, String> params,
    @Nullable JsonNode body,
    boolean skipSslVerification,
    @Nullable String cert,
    @Nullable String key,
    @Nullable String ca,
    int maxRedirects,
    @Nullable JsonNode port,
    String scheme
) {

    public String fullUrl() {
        return (url != null ? url : "") + path;
    }

    public HttpRequestSpec withUrl(String newUrl) {
        return new HttpRequestSpec(newUrl, method, path, headers, params, body, skipSslVerification,
            cert, key, ca, maxRedirects, port, scheme);
    }

    public HttpRequestSpec withHeaders(Map<String, String> newHeaders) {
        return new HttpRequestSpec(url, method, path, newHeaders, params, body, skipSslVerification,
            cert, key, ca, maxRedirects, port, scheme);
    }
}

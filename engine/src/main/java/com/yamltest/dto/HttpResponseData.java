package com.yamltest.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.yamltest.domain.TestKind;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Transport-independent HTTP response. Header lookups ignore case; the body
 * is the parsed JSON document or a text node when the payload is not JSON.
 */
public record HttpResponseData(int statusCode, Map<String, String> headers, JsonNode body) implements ResponseData {

    public HttpResponseData {
        Map<String, String> normalized = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            normalized.putAll(headers);
        }
        headers = Collections.unmodifiableMap(normalized);
    }

    public String header(String name) {
        return headers.get(name);
    }

    @Override
    public TestKind kind() {
        return TestKind.HTTP;
    }
}

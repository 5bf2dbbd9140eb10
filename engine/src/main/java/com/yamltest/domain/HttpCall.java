package com.yamltest.domain;

/**
 * A request together with the place it is sent from.
 */
public record HttpCall(HttpRequestSpec http, Source source) {
}

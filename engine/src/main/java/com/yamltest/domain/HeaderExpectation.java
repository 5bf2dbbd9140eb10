package com.yamltest.domain;

public record HeaderExpectation(String name, Comparison comparison) {
}

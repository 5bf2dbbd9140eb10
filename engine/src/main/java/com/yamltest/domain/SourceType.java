package com.yamltest.domain;

public enum SourceType {
    LOCAL,
    POD
}

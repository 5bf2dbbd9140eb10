package com.yamltest.infra;

public class RetriesExhaustedException extends TestFailureException {

    public RetriesExhaustedException(String message) {
        super(message);
    }
}

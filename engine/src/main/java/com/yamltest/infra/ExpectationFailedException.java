package com.yamltest.infra;

public class ExpectationFailedException extends TestFailureException {

    public ExpectationFailedException(String message) {
        super(message);
    }

    public ExpectationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}

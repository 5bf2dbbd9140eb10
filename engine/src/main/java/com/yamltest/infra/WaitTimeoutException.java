package com.yamltest.infra;

public class WaitTimeoutException extends TestFailureException {

    public WaitTimeoutException(String message) {
        super(message);
    }
}

package com.yamltest.infra;

/**
 * The target could not be reached: kubectl failed, a tunnel never became
 * ready, or a pod produced output we cannot read. Retried like an
 * expectation failure.
 */
public class TransportException extends TestFailureException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}

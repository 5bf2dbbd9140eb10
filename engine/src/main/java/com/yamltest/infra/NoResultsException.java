package com.yamltest.infra;

/**
 * A JSONPath used for extraction matched nothing.
 */
public class NoResultsException extends ExpectationFailedException {

    public NoResultsException(String message) {
        super(message);
    }
}

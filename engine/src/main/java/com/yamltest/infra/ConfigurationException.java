package com.yamltest.infra;

/**
 * The test definition itself is invalid. Always fatal for that test.
 */
public class ConfigurationException extends TestFailureException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}

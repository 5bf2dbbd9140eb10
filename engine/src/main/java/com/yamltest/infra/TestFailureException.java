package com.yamltest.infra;

/**
 * Base of every failure raised while executing a test definition.
 *
 * Subclasses:
 *   ConfigurationException: malformed definition, never retried
 *   ExpectationFailedException: result did not satisfy an expectation
 *   TransportException: subprocess / network problem reaching the target
 *   WaitTimeoutException: wait deadline passed
 *   RetriesExhaustedException: wait retry ceiling reached
 */
public class TestFailureException extends RuntimeException {

    public TestFailureException(String message) {
        super(message);
    }

    public TestFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Whether the orchestrator may run the definition again after this failure. */
    public boolean isRetryable() {
        return true;
    }
}

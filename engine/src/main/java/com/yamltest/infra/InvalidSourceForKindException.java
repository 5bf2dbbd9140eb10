package com.yamltest.infra;

/**
 * A setVars rule was applied to a result kind it cannot read from,
 * e.g. {@code header} on a command result.
 */
public class InvalidSourceForKindException extends ConfigurationException {

    public InvalidSourceForKindException(String message) {
        super(message);
    }
}

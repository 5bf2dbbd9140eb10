package com.yamltest.infra;

public class UnknownTestKindException extends ConfigurationException {

    public UnknownTestKindException() {
        super("Unknown test type: test definition must contain one of: http, command, wait, bodyComparison");
    }
}

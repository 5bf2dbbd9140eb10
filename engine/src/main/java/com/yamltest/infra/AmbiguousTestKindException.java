package com.yamltest.infra;

import java.util.List;

public class AmbiguousTestKindException extends ConfigurationException {

    public AmbiguousTestKindException(List<String> kinds) {
        super("Ambiguous test type: test definition contains more than one of " + kinds
            + " (exactly one of http, command, wait, bodyComparison is allowed)");
    }
}

package com.yamltest.dto;

import com.yamltest.domain.TestKind;

/**
 * The completed result of one step, handed to expectation checks and
 * {@code setVars} extraction.
 *
 * Implementations: {@link HttpResponseData}, {@link CommandResult}, {@link WaitObservation}.
 */
public interface ResponseData {

    TestKind kind();
}

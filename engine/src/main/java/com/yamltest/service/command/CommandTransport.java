package com.yamltest.service.command;

import com.yamltest.domain.CommandSpec;
import com.yamltest.domain.Source;
import com.yamltest.dto.CommandResult;

/**
 * Runs a shell command somewhere and reports what it printed. A non-zero
 * exit is a result, not an error.
 */
public interface CommandTransport {

    CommandResult execute(CommandSpec command, Source source);
}

package com.yamltest.service.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yamltest.domain.CommandSpec;
import com.yamltest.domain.Source;
import com.yamltest.dto.CommandResult;
import com.yamltest.infra.ProcessResult;
import com.yamltest.infra.ProcessRunner;
import com.yamltest.service.VariableStore;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the command through {@code sh -c} ({@code cmd /c} on Windows).
 *
 * The child sees the process environment, overlaid with captured variables,
 * overlaid with {@code command.env}.
 */
@Singleton
public class LocalCommandTransport implements CommandTransport {

    private static final Logger log = LoggerFactory.getLogger(LocalCommandTransport.class);

    @Inject ProcessRunner processRunner;
    @Inject VariableStore variables;
    @Inject ObjectMapper mapper;

    @Override
    public CommandResult execute(CommandSpec command, Source source) {
        Map<String, String> env = new HashMap<>(System.getenv());
        env.putAll(variables.snapshot());
        env.putAll(command.env());

        Path workingDir = command.workingDir() != null ? Path.of(command.workingDir()) : null;
        log.debug("Executing shell command: {}", command.command());
        ProcessResult result = processRunner.run(shell(command.command()), workingDir, env);

        log.debug("Command completed with exit code: {}", result.exitCode());
        return CommandResults.of(mapper, result.stdout(), result.stderr(), result.exitCode(), command.parseJson());
    }

    static List<String> shell(String command) {
        boolean windows = System.getProperty("os.name", "").toLowerCase().startsWith("windows");
        return windows ? List.of("cmd", "/c", command) : List.of("sh", "-c", command);
    }
}

package com.yamltest.infra;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Abstraction over {@link ProcessBuilder} so kubectl and shell interactions
 * can be tested without actually spawning processes.
 *
 * The default production implementation is {@link DefaultProcessRunner}.
 * Tests replace this with a {@code @MockBean}.
 */
public interface ProcessRunner {

    /**
     * Run a command to completion.
     *
     * @param command     the command and its arguments (e.g. ["kubectl", "get", "pods"])
     * @param workingDir  directory in which to run the command, or null for the current one
     * @param environment the complete environment for the child process, or null to inherit ours
     * @return            exit code, stdout and stderr
     */
    ProcessResult run(List<String> command, Path workingDir, Map<String, String> environment);

    /**
     * Run a command to completion, killing it once {@code timeout} has passed.
     * A killed process is reported with a non-zero exit code.
     */
    ProcessResult run(List<String> command, Duration timeout);

    /**
     * Start a long-running command (a port-forward tunnel) and hand back the live process.
     * The caller owns the process and must destroy it.
     */
    Process start(List<String> command) throws IOException;
}

package com.yamltest.infra;

/**
 * Result of a command executed by {@link ProcessRunner}.
 * stdout and stderr are captured separately and left untrimmed.
 */
public record ProcessResult(int exitCode, String stdout, String stderr) {

    /** Returns true if the process exited with code 0. */
    public boolean success() {
        return exitCode == 0;
    }
}

package com.yamltest.infra;

import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Production {@link ProcessRunner} that delegates to {@link ProcessBuilder}.
 *
 * stderr is drained on a separate thread so a chatty child cannot block on a
 * full pipe. Processes exceeding their timeout ({@code yamltest.process.timeout-seconds}
 * unless the caller passes one) are killed and reported with exit code 124.
 */
@Singleton
public class DefaultProcessRunner implements ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(DefaultProcessRunner.class);
    static final int TIMEOUT_EXIT_CODE = 124;

    @Value("${yamltest.process.timeout-seconds:300}")
    long timeoutSeconds;

    @Override
    public ProcessResult run(List<String> command, Path workingDir, Map<String, String> environment) {
        return run(command, workingDir, environment, Duration.ofSeconds(timeoutSeconds));
    }

    @Override
    public ProcessResult run(List<String> command, Duration timeout) {
        return run(command, null, null, timeout);
    }

    private ProcessResult run(List<String> command, Path workingDir, Map<String, String> environment, Duration timeout) {
        Process p;
        try {
            p = newBuilder(command, workingDir, environment).start();
        } catch (IOException e) {
            log.warn("Process execution failed: {}", e.getMessage());
            return new ProcessResult(1, "",
                e.getMessage() != null ? e.getMessage() : "Process execution error");
        }

        closeQuietly(p);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(p.getErrorStream()));
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(p.getInputStream()));

        try {
            boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                p.destroyForcibly();
                log.warn("Command '{}' exceeded {}s and was killed", String.join(" ", command), timeout.toSeconds());
                return new ProcessResult(TIMEOUT_EXIT_CODE, stdout.getNow(""),
                    "Process timed out after " + timeout.toSeconds() + "s");
            }
            int code = p.exitValue();
            ProcessResult result = new ProcessResult(code, stdout.get(), stderr.get());
            log.debug("Command '{}' exited {}", String.join(" ", command), code);
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
            throw new TransportException("Interrupted while running: " + String.join(" ", command), e);
        } catch (ExecutionException e) {
            throw new TransportException("Failed to read process output: " + e.getCause().getMessage(), e);
        }
    }

    @Override
    public Process start(List<String> command) throws IOException {
        log.debug("Starting background process '{}'", String.join(" ", command));
        return newBuilder(command, null, null).start();
    }

    private ProcessBuilder newBuilder(List<String> command, Path workingDir, Map<String, String> environment) {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        if (environment != null) {
            Map<String, String> env = pb.environment();
            env.clear();
            env.putAll(environment);
        }
        return pb;
    }

    private static String drain(InputStream in) {
        try {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void closeQuietly(Process p) {
        try {
            p.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of child process: {}", e.getMessage());
        }
    }
}

package com.yamltest.k8s;

import com.yamltest.infra.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A running {@code kubectl port-forward} process.
 *
 * Readiness is signalled by a "Forwarding from" line on either stream (kubectl
 * versions differ). Closing terminates the process, forcibly if it does not
 * exit within the grace period.
 */
public class PortForwardSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PortForwardSession.class);
    static final String READY_MARKER = "Forwarding from";

    private final Process process;
    private final int localPort;
    private final long killGraceMillis;
    private final CompletableFuture<Void> ready = new CompletableFuture<>();
    private volatile String lastError;

    PortForwardSession(Process process, int localPort, long killGraceMillis) {
        this.process = process;
        this.localPort = localPort;
        this.killGraceMillis = killGraceMillis;
        pump(process.getInputStream(), "stdout");
        pump(process.getErrorStream(), "stderr");
        process.onExit().thenAccept(p -> ready.completeExceptionally(new TransportException(
            "Port-forward exited with code " + p.exitValue() + (lastError != null ? ": " + lastError : ""))));
    }

    public int localPort() {
        return localPort;
    }

    public void awaitReady(Duration timeout) {
        try {
            ready.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new TransportException("Port-forward timed out waiting to become ready");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TransportException te) {
                throw te;
            }
            throw new TransportException("Port-forward process error: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for port-forward", e);
        }
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public void close() {
        process.destroy();
        try {
            if (!process.waitFor(killGraceMillis, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping port-forward on local port {}", localPort);
            process.destroyForcibly();
        }
        log.debug("Port-forward on local port {} stopped", localPort);
    }

    private void pump(InputStream stream, String name) {
        Thread t = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("Port-forward {}: {}", name, line);
                    if (line.contains(READY_MARKER)) {
                        ready.complete(null);
                    }
                    if (line.toLowerCase().contains("error")) {
                        lastError = line;
                    }
                }
            } catch (IOException e) {
                log.debug("Port-forward {} closed: {}", name, e.getMessage());
            }
        }, "port-forward-" + name + "-" + localPort);
        t.setDaemon(true);
        t.start();
    }
}

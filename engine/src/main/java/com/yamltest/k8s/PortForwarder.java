package com.yamltest.k8s;

import com.yamltest.domain.Selector;
import com.yamltest.infra.ProcessRunner;
import com.yamltest.infra.TransportException;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Opens {@code kubectl port-forward} tunnels to a selected workload.
 */
@Singleton
public class PortForwarder {

    private static final Logger log = LoggerFactory.getLogger(PortForwarder.class);

    @Value("${yamltest.port-forward.ready-timeout-seconds:30}")
    long readyTimeoutSeconds;

    @Value("${yamltest.port-forward.kill-grace-millis:100}")
    long killGraceMillis;

    @Inject Kubectl kubectl;
    @Inject PodResolver podResolver;
    @Inject LocalPortAllocator portAllocator;
    @Inject ProcessRunner processRunner;

    /**
     * Start a tunnel from a free local port to {@code remotePort} and wait until
     * kubectl reports it is forwarding. The caller must close the session.
     */
    public PortForwardSession open(Selector selector, int remotePort) {
        String target = podResolver.workloadTarget(selector);
        int localPort = portAllocator.allocate();
        List<String> cmd = kubectl.command(selector, "port-forward", target, localPort + ":" + remotePort);
        log.debug("Starting port-forward: {}", String.join(" ", cmd));

        Process process;
        try {
            process = processRunner.start(cmd);
        } catch (IOException e) {
            throw new TransportException("Port-forward process error: " + e.getMessage(), e);
        }

        PortForwardSession session = new PortForwardSession(process, localPort, killGraceMillis);
        try {
            session.awaitReady(Duration.ofSeconds(readyTimeoutSeconds));
        } catch (RuntimeException e) {
            session.close();
            throw e;
        }
        log.info("Port-forward {} -> {}:{} ready", localPort, target, remotePort);
        return session;
    }
}

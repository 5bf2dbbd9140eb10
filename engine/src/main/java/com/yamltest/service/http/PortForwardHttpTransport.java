package com.yamltest.service.http;

import com.yamltest.domain.HttpRequestSpec;
import com.yamltest.domain.Source;
import com.yamltest.dto.HttpResponseData;
import com.yamltest.infra.ConfigurationException;
import com.yamltest.infra.TransportException;
import com.yamltest.k8s.PortForwardSession;
import com.yamltest.k8s.PortForwarder;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Tunnels to the selected workload with {@code kubectl port-forward} and
 * sends the request locally through the tunnel. The remote port is the port
 * of {@code http.url} (80 or 443 when absent).
 */
@Singleton
public class PortForwardHttpTransport implements HttpTransport {

    private static final Logger log = LoggerFactory.getLogger(PortForwardHttpTransport.class);
    static final long SETTLE_MILLIS = 100;

    @Inject PortForwarder portForwarder;
    @Inject LocalHttpTransport localTransport;

    @Override
    public HttpResponseData send(HttpRequestSpec request, Source source) {
        URI target = baseUri(request);
        String scheme = target.getScheme() != null ? target.getScheme() : "http";
        int remotePort = target.getPort() > 0 ? target.getPort() : ("https".equalsIgnoreCase(scheme) ? 443 : 80);

        try (PortForwardSession session = portForwarder.open(source.selector(), remotePort)) {
            settle();
            String localUrl = scheme + "://localhost:" + session.localPort()
                + (target.getRawPath() != null ? target.getRawPath() : "")
                + (target.getRawQuery() != null ? "?" + target.getRawQuery() : "");
            log.debug("Executing local HTTP request to {}{}", localUrl, request.path());
            return localTransport.send(request.withUrl(localUrl));
        }
    }

    private static URI baseUri(HttpRequestSpec request) {
        if (request.url() == null || request.url().isBlank()) {
            throw new ConfigurationException("http.url is required");
        }
        try {
            return new URI(request.url());
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Invalid URL " + request.url() + ": " + e.getMessage(), e);
        }
    }

    private static void settle() {
        try {
            Thread.sleep(SETTLE_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for port-forward", e);
        }
    }
}

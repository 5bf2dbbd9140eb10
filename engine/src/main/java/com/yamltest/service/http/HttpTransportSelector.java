package com.yamltest.service.http;

import com.yamltest.domain.Source;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * Picks the {@link HttpTransport} for a request source.
 *
 *   local                  → {@link LocalHttpTransport}
 *   pod + usePortForward   → {@link PortForwardHttpTransport}
 *   pod + usePodExec       → {@link PodExecHttpTransport}
 *   pod                    → {@link DebugContainerHttpTransport}
 */
@Singleton
public class HttpTransportSelector {

    @Inject LocalHttpTransport localTransport;
    @Inject PortForwardHttpTransport portForwardTransport;
    @Inject PodExecHttpTransport podExecTransport;
    @Inject DebugContainerHttpTransport debugContainerTransport;

    public HttpTransport select(Source source) {
        if (!source.isPod()) {
            return localTransport;
        }
        if (source.usePortForward()) {
            return portForwardTransport;
        }
        if (source.usePodExec()) {
            return podExecTransport;
        }
        return debugContainerTransport;
    }
}

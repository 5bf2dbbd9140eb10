package com.yamltest.service.http;

import com.yamltest.domain.HttpCall;
import com.yamltest.domain.HttpRequestSpec;
import com.yamltest.domain.Source;
import com.yamltest.k8s.ServiceEndpointDiscovery;
import com.yamltest.service.VariableStore;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final request shape before a transport sees it: URL discovered from a
 * LoadBalancer Service when absent, variables interpolated in the URL and
 * header values.
 */
@Singleton
public class HttpRequestPreparer {

    private static final Logger log = LoggerFactory.getLogger(HttpRequestPreparer.class);

    @Inject VariableStore variables;
    @Inject ServiceEndpointDiscovery endpointDiscovery;

    public HttpRequestSpec prepare(HttpCall call) {
        HttpRequestSpec request = call.http();
        Source source = call.source();

        if (request.url() == null && !source.isPod() && source.selector() != null
                && "Service".equals(source.selector().kind())) {
            log.debug("Auto-discovering LoadBalancer IP and port for {}", source.selector().describe());
            request = request.withUrl(endpointDiscovery.discover(source.selector(), request.port(), request.scheme()));
        }

        Map<String, String> headers = new LinkedHashMap<>();
        request.headers().forEach((name, value) -> headers.put(name, variables.interpolate(value)));
        return request.withUrl(variables.interpolate(request.url())).withHeaders(headers);
    }
}

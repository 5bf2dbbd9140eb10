package com.yamltest.k8s;

import com.fasterxml.jackson.databind.JsonNode;
import com.yamltest.domain.Selector;
import com.yamltest.infra.TransportException;
import io.fabric8.kubernetes.api.model.LoadBalancerIngress;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceList;
import io.fabric8.kubernetes.api.model.ServicePort;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Discovers {@code scheme://host:port} for a LoadBalancer Service.
 *
 * Host is the first ingress IP, falling back to its hostname. Port selection:
 *   number → the port with that number, else the port at that index
 *   string → the port with that name
 *   absent → the first port
 */
@Singleton
public class ServiceEndpointDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ServiceEndpointDiscovery.class);

    @Inject
    Kubectl kubectl;

    public String discover(Selector selector, JsonNode portSpec, String scheme) {
        if (!"Service".equals(selector.kind())) {
            throw new TransportException("Selector must be of kind \"Service\" for LoadBalancer IP discovery");
        }
        Service service;
        try {
            service = fetch(selector);
        } catch (TransportException e) {
            throw new TransportException("Failed to discover LoadBalancer IP and port: " + e.getMessage(), e);
        }

        String host = ingressHost(service, selector);
        List<ServicePort> ports = service.getSpec() != null ? service.getSpec().getPorts() : null;
        if (ports == null || ports.isEmpty()) {
            throw new TransportException("No ports defined for service " + selector.describe());
        }
        int port = selectPort(ports, portSpec);
        String url = scheme + "://" + host + ":" + port;
        log.debug("Discovered LoadBalancer endpoint {} for {}", url, selector.describe());
        return url;
    }

    private Service fetch(Selector selector) {
        if (selector.byName()) {
            return kubectl.getAs(selector, Service.class);
        }
        ServiceList list = kubectl.getAs(selector, ServiceList.class);
        if (list.getItems() == null || list.getItems().isEmpty()) {
            throw new TransportException("No services found matching labels " + selector.labelSelector());
        }
        if (list.getItems().size() > 1) {
            log.warn("{} services match labels {}, using the first", list.getItems().size(), selector.labelSelector());
        }
        return list.getItems().get(0);
    }

    private static String ingressHost(Service service, Selector selector) {
        List<LoadBalancerIngress> ingress = service.getStatus() != null && service.getStatus().getLoadBalancer() != null
            ? service.getStatus().getLoadBalancer().getIngress()
            : null;
        if (ingress != null && !ingress.isEmpty()) {
            LoadBalancerIngress first = ingress.get(0);
            if (first.getIp() != null && !first.getIp().isEmpty()) {
                return first.getIp();
            }
            if (first.getHostname() != null && !first.getHostname().isEmpty()) {
                return first.getHostname();
            }
        }
        throw new TransportException("No LoadBalancer IP/hostname found for service " + selector.describe());
    }

    static int selectPort(List<ServicePort> ports, JsonNode portSpec) {
        if (portSpec == null || portSpec.isNull() || portSpec.isMissingNode()) {
            if (ports.size() > 1) {
                log.debug("Multiple ports available, using first port: {}", ports.get(0).getPort());
            }
            return ports.get(0).getPort();
        }
        if (portSpec.isNumber()) {
            int wanted = portSpec.intValue();
            for (ServicePort p : ports) {
                if (p.getPort() != null && p.getPort() == wanted) {
                    return p.getPort();
                }
            }
            if (wanted >= 0 && wanted < ports.size()) {
                return ports.get(wanted).getPort();
            }
            throw new TransportException("Port " + wanted + " not found in service");
        }
        String name = portSpec.asText();
        for (ServicePort p : ports) {
            if (name.equals(p.getName())) {
                return p.getPort();
            }
        }
        throw new TransportException("Port with name \"" + name + "\" not found in service");
    }
}

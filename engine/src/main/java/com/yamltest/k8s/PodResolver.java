package com.yamltest.k8s;

import com.yamltest.domain.Selector;
import com.yamltest.infra.TransportException;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodList;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Turns a selector into something kubectl exec / debug / port-forward accepts.
 *
 * Label selectors always resolve to a concrete pod; when several pods match,
 * the first one kubectl lists is used.
 */
@Singleton
public class PodResolver {

    private static final Logger log = LoggerFactory.getLogger(PodResolver.class);

    @Inject
    Kubectl kubectl;

    /** The selector's name, or the first pod matching its labels. */
    public String podName(Selector selector) {
        if (selector.byName()) {
            return selector.name();
        }
        return firstPodWithLabels(selector);
    }

    /**
     * Target usable by {@code kubectl exec} and {@code kubectl port-forward}:
     * {@code name} for pods, {@code kind/name} for other named kinds,
     * a label-resolved pod name otherwise.
     */
    public String workloadTarget(Selector selector) {
        if (!selector.byName()) {
            return firstPodWithLabels(selector);
        }
        if (selector.isPod()) {
            return selector.name();
        }
        return selector.kind().toLowerCase(Locale.ROOT) + "/" + selector.name();
    }

    private String firstPodWithLabels(Selector selector) {
        Selector pods = new Selector("Pod", selector.namespace(), null, selector.labels(), selector.context());
        String ns = selector.namespace() != null ? selector.namespace() : "default";
        PodList list;
        try {
            list = kubectl.getAs(pods, PodList.class);
        } catch (TransportException e) {
            throw new TransportException("Failed to find pod with labels " + selector.labelSelector()
                + " in namespace " + ns + ": " + e.getMessage(), e);
        }
        List<Pod> items = list.getItems();
        if (items == null || items.isEmpty()) {
            throw new TransportException("No pods found matching labels " + selector.labelSelector()
                + " in namespace " + ns);
        }
        String name = items.get(0).getMetadata().getName();
        if (items.size() > 1) {
            log.warn("{} pods match labels {} in namespace {}, using {}",
                items.size(), selector.labelSelector(), ns, name);
        }
        log.debug("Resolved labels {} to pod {}", selector.labelSelector(), name);
        return name;
    }
}

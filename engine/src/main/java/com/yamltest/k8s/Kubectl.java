package com.yamltest.k8s;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yamltest.domain.Selector;
import com.yamltest.infra.ProcessResult;
import com.yamltest.infra.ProcessRunner;
import com.yamltest.infra.TransportException;
import com.yamltest.service.VariableStore;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds and runs kubectl invocations.
 *
 * Every command starts with the configured binary followed by the selector's
 * {@code --context} (interpolated from the variable store) and {@code -n}
 * namespace, so all cluster access for one selector targets the same place.
 */
@Singleton
public class Kubectl {

    private static final Logger log = LoggerFactory.getLogger(Kubectl.class);

    @Value("${yamltest.kubectl.binary:kubectl}")
    String binary;

    @Inject ProcessRunner processRunner;
    @Inject VariableStore variables;
    @Inject ObjectMapper mapper;

    /** {@code kubectl [--context=c] [-n ns] args...} */
    public List<String> command(Selector selector, List<String> args) {
        List<String> cmd = new ArrayList<>();
        cmd.add(binary);
        if (selector.context() != null) {
            cmd.add("--context=" + variables.interpolate(selector.context()));
        }
        if (selector.namespace() != null) {
            cmd.add("-n");
            cmd.add(selector.namespace());
        }
        cmd.addAll(args);
        return cmd;
    }

    public List<String> command(Selector selector, String... args) {
        return command(selector, List.of(args));
    }

    /** {@code get <kind> <name | -l labels> -o json} for the selector. */
    public List<String> getCommand(Selector selector) {
        List<String> args = new ArrayList<>();
        args.add("get");
        args.add(selector.kind().toLowerCase(Locale.ROOT));
        if (selector.byName()) {
            args.add(selector.name());
        } else {
            args.add("-l");
            args.add(selector.labelSelector());
        }
        args.add("-o");
        args.add("json");
        return command(selector, args);
    }

    public ProcessResult run(List<String> cmd) {
        log.debug("kubectl: {}", String.join(" ", cmd));
        return processRunner.run(cmd, null, null);
    }

    /**
     * Fetch the selected resource (or list, for label selectors) as JSON.
     *
     * @throws TransportException when kubectl fails, prints nothing or prints something that is not JSON
     */
    public JsonNode getJson(Selector selector) {
        ProcessResult result = run(getCommand(selector));
        if (!result.success()) {
            throw new TransportException("kubectl get " + selector.describe() + " failed: "
                + firstNonBlank(result.stderr(), result.stdout()));
        }
        if (result.stdout().isBlank()) {
            throw new TransportException("No output from kubectl for " + selector.describe());
        }
        try {
            return mapper.readTree(result.stdout());
        } catch (JsonProcessingException e) {
            throw new TransportException("Invalid JSON from kubectl for " + selector.describe() + ": "
                + e.getOriginalMessage(), e);
        }
    }

    /** {@link #getJson} bound to a fabric8 model type. */
    public <T> T getAs(Selector selector, Class<T> type) {
        JsonNode json = getJson(selector);
        try {
            return mapper.treeToValue(json, type);
        } catch (JsonProcessingException e) {
            throw new TransportException("Unexpected kubectl output for " + selector.describe() + ": "
                + e.getOriginalMessage(), e);
        }
    }

    static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v.trim();
            }
        }
        return "no output";
    }
}

package com.yamltest.service.compare;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.InvalidPathException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;
import com.jayway.jsonpath.spi.json.JacksonJsonNodeJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;
import jakarta.annotation.PostConstruct;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * JSONPath over Jackson trees. Reads always return every match as a list;
 * a missing path yields an empty list rather than an exception.
 */
@Singleton
public class JsonPathEvaluator {

    private static final Logger log = LoggerFactory.getLogger(JsonPathEvaluator.class);

    @Inject
    ObjectMapper mapper;

    private Configuration configuration;

    @PostConstruct
    void init() {
        configuration = Configuration.builder()
            .jsonProvider(new JacksonJsonNodeJsonProvider(mapper))
            .mappingProvider(new JacksonMappingProvider(mapper))
            .options(Option.ALWAYS_RETURN_LIST, Option.SUPPRESS_EXCEPTIONS)
            .build();
    }

    public List<JsonNode> read(JsonNode document, String path) {
        List<JsonNode> matches = new ArrayList<>();
        if (document == null || path == null || path.isBlank()) {
            return matches;
        }
        Object result;
        try {
            result = JsonPath.using(configuration).parse(document).read(path);
        } catch (InvalidPathException e) {
            log.debug("Invalid JSONPath '{}': {}", path, e.getMessage());
            return matches;
        }
        if (result instanceof JsonNode node) {
            if (node.isArray()) {
                node.forEach(matches::add);
            } else {
                matches.add(node);
            }
        }
        return matches;
    }

    /** First match of {@code path}, or null when nothing matches. */
    public JsonNode first(JsonNode document, String path) {
        List<JsonNode> matches = read(document, path);
        return matches.isEmpty() ? null : matches.get(0);
    }

    /**
     * Copy of {@code document} with every node matched by each path removed.
     * Paths that are invalid or match nothing are logged and skipped.
     */
    public JsonNode delete(JsonNode document, List<String> paths) {
        if (document == null || paths == null || paths.isEmpty()) {
            return document;
        }
        DocumentContext context = JsonPath.using(configuration).parse(document.deepCopy());
        for (String path : paths) {
            try {
                context.delete(path);
            } catch (RuntimeException e) {
                log.warn("Failed to remove JSONPath '{}': {}", path, e.getMessage());
            }
        }
        return context.json();
    }
}

package com.yamltest.service;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Process-wide store of values captured by {@code setVars}.
 *
 * Lookups consult the store first and then the process environment, so a
 * captured value shadows an environment variable of the same name. Values
 * live until {@link #clear()} or the end of the process.
 */
@Singleton
public class VariableStore {

    private static final Logger log = LoggerFactory.getLogger(VariableStore.class);
    private static final Pattern REFERENCE =
        Pattern.compile("\\$(?:\\{([A-Za-z_][A-Za-z0-9_]*)}|([A-Za-z_][A-Za-z0-9_]*))");

    private final Map<String, String> values = new ConcurrentHashMap<>();

    public void put(String name, String value) {
        values.put(name, value);
    }

    public Optional<String> lookup(String name) {
        String captured = values.get(name);
        if (captured != null) {
            return Optional.of(captured);
        }
        return Optional.ofNullable(System.getenv(name));
    }

    /** Captured values only, without the process environment. */
    public Map<String, String> snapshot() {
        return Map.copyOf(values);
    }

    public void clear() {
        values.clear();
    }

    /**
     * Replace {@code $NAME} and {@code ${NAME}} references. Unresolved references
     * are left as written and logged.
     */
    public String interpolate(String text) {
        if (text == null || text.indexOf('$') < 0) {
            return text;
        }
        Matcher m = REFERENCE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String name = m.group(1) != null ? m.group(1) : m.group(2);
            Optional<String> resolved = lookup(name);
            if (resolved.isEmpty()) {
                log.warn("Variable {} is not set", name);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(resolved.orElse(m.group())));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}

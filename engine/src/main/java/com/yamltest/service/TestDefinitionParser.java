package com.yamltest.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.yamltest.domain.BodyComparisonStep;
import com.yamltest.domain.CommandExpectations;
import com.yamltest.domain.CommandSpec;
import com.yamltest.domain.CommandStep;
import com.yamltest.domain.Comparison;
import com.yamltest.domain.ExtractionRule;
import com.yamltest.domain.HeaderExpectation;
import com.yamltest.domain.HttpCall;
import com.yamltest.domain.HttpExpectations;
import com.yamltest.domain.HttpRequestSpec;
import com.yamltest.domain.HttpStep;
import com.yamltest.domain.PathComparison;
import com.yamltest.domain.Polling;
import com.yamltest.domain.Selector;
import com.yamltest.domain.Source;
import com.yamltest.domain.SourceType;
import com.yamltest.domain.TestDefinition;
import com.yamltest.domain.TestKind;
import com.yamltest.domain.TestStep;
import com.yamltest.domain.WaitStep;
import com.yamltest.infra.AmbiguousTestKindException;
import com.yamltest.infra.ConfigurationException;
import com.yamltest.infra.UnknownTestKindException;
import com.yamltest.service.compare.JsonValues;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads YAML test definitions into {@link TestDefinition}s.
 *
 * All structural validation happens here so executors only see well-formed
 * definitions; every problem is reported as a {@link ConfigurationException}.
 */
@Singleton
public class TestDefinitionParser {

    private static final String BODY_COMPARISON_ALIAS = "httpBodyComparison";

    private final YAMLMapper yaml = YAMLMapper.builder()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .build();

    // ── Documents ───────────────────────────────────────────────────────────

    /** A single definition or a sequence of them, in document order. */
    public List<JsonNode> parseBatch(String text) {
        JsonNode root;
        try {
            root = yaml.readTree(text == null ? "" : text);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Failed to parse YAML: " + e.getOriginalMessage(), e);
        }
        if (root == null || !(root.isObject() || root.isArray())) {
            throw new ConfigurationException("Invalid YAML: expected an object or array of test definitions");
        }
        List<JsonNode> definitions = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(definitions::add);
        } else {
            definitions.add(root);
        }
        if (definitions.isEmpty()) {
            throw new ConfigurationException("No test definitions found in YAML");
        }
        return definitions;
    }

    /** Exactly one definition. */
    public TestDefinition parseSingle(String text) {
        JsonNode root;
        try {
            root = yaml.readTree(text == null ? "" : text);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Failed to parse test YAML definition: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Invalid test definition: expected a YAML object");
        }
        return toDefinition(root, 0);
    }

    /** {@code name}, else {@code test_title}, else {@code test-<n>} with n 1-based. */
    public static String displayName(JsonNode node, int index) {
        String name = text(node, "name");
        if (name == null) {
            name = text(node, "test_title");
        }
        return name != null ? name : "test-" + (index + 1);
    }

    public TestDefinition toDefinition(JsonNode node, int index) {
        if (node == null || !node.isObject()) {
            throw new ConfigurationException("Invalid test definition: expected a YAML object");
        }
        TestKind kind = kindOf(node);
        JsonNode setVarsNode = node.has("setVars") ? node.get("setVars") : node.get("capture");
        boolean hasSetVars = setVarsNode != null && !setVarsNode.isNull();
        JsonNode expect = node.get("expect");

        if (hasSetVars && (kind == TestKind.HTTP || kind == TestKind.COMMAND) && isAbsent(expect)) {
            throw new ConfigurationException("setVars requires \"expect\" to be defined on the test");
        }
        if (hasSetVars && kind == TestKind.BODY_COMPARISON) {
            throw new ConfigurationException("setVars is not supported on bodyComparison tests");
        }

        TestStep step = switch (kind) {
            case HTTP -> new HttpStep(
                new HttpCall(httpSpec(node.get("http")), source(node.get("source"))),
                httpExpectations(expect));
            case COMMAND -> new CommandStep(commandSpec(node.get("command")), source(node.get("source")),
                commandExpectations(expect));
            case WAIT -> waitStep(node.get("wait"));
            case BODY_COMPARISON -> bodyComparison(node.has("bodyComparison")
                ? node.get("bodyComparison") : node.get(BODY_COMPARISON_ALIAS));
        };

        Map<String, ExtractionRule> setVars = hasSetVars ? setVars(setVarsNode) : Map.of();
        if (step instanceof WaitStep wait && wait.jsonPath() == null) {
            setVars.forEach((name, rule) -> {
                if (rule.type() == ExtractionRule.Type.VALUE) {
                    throw new ConfigurationException("setVars \"" + name
                        + "\": \"value\" extraction requires \"jsonPath\" to be defined in the wait config");
                }
            });
        }

        int retries = node.path("retries").asInt(0);
        if (retries < 0) {
            throw new ConfigurationException("retries must be zero or greater");
        }
        return new TestDefinition(displayName(node, index), retries, step, setVars);
    }

    private static TestKind kindOf(JsonNode node) {
        List<String> present = new ArrayList<>();
        for (TestKind kind : TestKind.values()) {
            if (!isAbsent(node.get(kind.key()))) {
                present.add(kind.key());
            }
        }
        if (!isAbsent(node.get(BODY_COMPARISON_ALIAS)) && !present.contains(TestKind.BODY_COMPARISON.key())) {
            present.add(TestKind.BODY_COMPARISON.key());
        }
        if (present.isEmpty()) {
            throw new UnknownTestKindException();
        }
        if (present.size() > 1) {
            throw new AmbiguousTestKindException(present);
        }
        String key = present.get(0);
        for (TestKind kind : TestKind.values()) {
            if (kind.key().equals(key)) {
                return kind;
            }
        }
        throw new UnknownTestKindException();
    }

    // ── Sources and selectors ───────────────────────────────────────────────

    Source source(JsonNode node) {
        if (isAbsent(node)) {
            return Source.local();
        }
        String type = text(node, "type");
        SourceType sourceType;
        if (type == null || "local".equals(type)) {
            sourceType = SourceType.LOCAL;
        } else if ("pod".equals(type)) {
            sourceType = SourceType.POD;
        } else {
            throw new ConfigurationException("Unsupported source type: " + type + ". Use 'local' or 'pod'");
        }
        Selector selector = isAbsent(node.get("selector")) ? null : selector(node.get("selector"));
        if (sourceType == SourceType.POD && selector == null) {
            throw new ConfigurationException("Kubernetes selector is required for pod-based tests");
        }
        boolean portForward = node.path("usePortForward").asBoolean(false);
        boolean podExec = node.path("usePodExec").asBoolean(false);
        if (portForward && podExec) {
            throw new ConfigurationException("usePortForward and usePodExec cannot both be set");
        }
        return new Source(sourceType, selector, text(node, "container"), portForward, podExec);
    }

    Selector selector(JsonNode node) {
        JsonNode metadata = node.path("metadata");
        String name = text(metadata, "name");
        Map<String, String> labels = stringMap(metadata.get("labels"));
        if (name == null && labels.isEmpty()) {
            throw new ConfigurationException("Either metadata.name or metadata.labels must be provided in Kubernetes selector");
        }
        String kind = text(node, "kind");
        return new Selector(kind != null ? kind : "Pod", text(metadata, "namespace"), name,
            name != null ? Map.of() : labels, text(node, "context"));
    }

    // ── HTTP ────────────────────────────────────────────────────────────────

    HttpRequestSpec httpSpec(JsonNode node) {
        if (isAbsent(node) || !node.isObject()) {
            throw new ConfigurationException("HTTP configuration missing in request config");
        }
        String method = text(node, "method");
        String path = text(node, "path");
        String scheme = text(node, "scheme");
        JsonNode body = node.get("body");
        JsonNode port = node.get("port");
        return new HttpRequestSpec(
            text(node, "url"),
            method != null ? method.toUpperCase(Locale.ROOT) : "GET",
            path != null ? path : "/",
            stringMap(node.get("headers")),
            stringMap(node.get("params")),
            isAbsent(body) ? null : body,
            node.path("skipSslVerification").asBoolean(false),
            text(node, "cert"),
            text(node, "key"),
            text(node, "ca"),
            node.path("maxRedirects").asInt(0),
            isAbsent(port) ? null : port,
            scheme != null ? scheme : "http");
    }

    HttpExpectations httpExpectations(JsonNode node) {
        if (isAbsent(node)) {
            return HttpExpectations.none();
        }
        List<Integer> statusCodes = new ArrayList<>();
        JsonNode status = node.get("statusCode");
        if (status != null && status.isArray()) {
            status.forEach(s -> statusCodes.add(s.asInt()));
        } else if (!isAbsent(status)) {
            statusCodes.add(status.asInt());
        }

        List<Comparison> bodyContains = new ArrayList<>();
        forEachItem(node.get("bodyContains"), item -> bodyContains.add(valueItem(item, "contains", "bodyContains")));
        List<Comparison> bodyRegex = new ArrayList<>();
        forEachItem(node.get("bodyRegex"), item -> {
            Comparison c = valueItem(item, "matches", "bodyRegex");
            checkRegex(JsonValues.render(c.value()));
            bodyRegex.add(c);
        });

        List<PathComparison> bodyJsonPath = new ArrayList<>();
        forEachItem(node.get("bodyJsonPath"), item ->
            bodyJsonPath.add(new PathComparison(requireText(item, "path", "bodyJsonPath"), comparison(item))));

        List<HeaderExpectation> headers = new ArrayList<>();
        forEachItem(node.get("headers"), item ->
            headers.add(new HeaderExpectation(requireText(item, "name", "headers"), comparison(item))));

        JsonNode body = node.get("body");
        return new HttpExpectations(statusCodes, isAbsent(body) ? null : body,
            bodyContains, bodyRegex, bodyJsonPath, headers);
    }

    /** String shorthand or {@code {value, negate, matchword}}. */
    private static Comparison valueItem(JsonNode item, String comparator, String field) {
        if (item.isObject()) {
            JsonNode value = item.get("value");
            if (isAbsent(value)) {
                throw new ConfigurationException(field + " entries must have a \"value\"");
            }
            return new Comparison(comparator, value, item.path("negate").asBoolean(false),
                item.path("matchword").asBoolean(false));
        }
        return new Comparison(comparator, item, false, false);
    }

    // ── Commands ────────────────────────────────────────────────────────────

    CommandSpec commandSpec(JsonNode node) {
        if (node.isTextual()) {
            throw new ConfigurationException(
                "Command must be an object with a \"command\" property. Use: { command: \"your command here\" }");
        }
        String command = text(node, "command");
        if (command == null || command.isEmpty()) {
            throw new ConfigurationException("Command object must have a \"command\" property with the command string");
        }
        return new CommandSpec(command, stringMap(node.get("env")), text(node, "workingDir"),
            node.path("parseJson").asBoolean(false));
    }

    CommandExpectations commandExpectations(JsonNode node) {
        if (isAbsent(node)) {
            return CommandExpectations.none();
        }
        JsonNode exit = node.get("exitCode");
        List<PathComparison> json = new ArrayList<>();
        forEachItem(node.get("json"), item -> json.add(new PathComparison(text(item, "path"), comparison(item))));
        List<PathComparison> jsonPath = new ArrayList<>();
        forEachItem(node.get("jsonPath"), item ->
            jsonPath.add(new PathComparison(requireText(item, "path", "jsonPath"), comparison(item))));
        return new CommandExpectations(
            isAbsent(exit) ? null : exit.asInt(),
            outputExpectations(node.get("stdout")),
            outputExpectations(node.get("stderr")),
            outputExpectations(node.get("output")),
            json,
            jsonPath);
    }

    /**
     * A string (contains), {@code {contains|matches|regex|equals|exists, negate}},
     * a direct comparison, or a list of any of these.
     */
    private static List<Comparison> outputExpectations(JsonNode node) {
        List<Comparison> out = new ArrayList<>();
        forEachItem(node, item -> {
            if (item.isTextual()) {
                out.add(Comparison.contains(item.textValue()));
                return;
            }
            boolean negate = item.path("negate").asBoolean(false);
            if (item.has("contains")) {
                out.add(Comparison.of("contains", item.get("contains"), negate));
            } else if (item.has("matches") || item.has("regex")) {
                JsonNode pattern = item.has("matches") ? item.get("matches") : item.get("regex");
                checkRegex(JsonValues.render(pattern));
                out.add(Comparison.of("matches", pattern, negate));
            } else if (item.has("equals")) {
                out.add(Comparison.of("equals", item.get("equals"), negate));
            } else if (item.has("exists")) {
                out.add(Comparison.of("exists", null, negate));
            } else {
                out.add(comparison(item));
            }
        });
        return out;
    }

    // ── Wait ────────────────────────────────────────────────────────────────

    WaitStep waitStep(JsonNode node) {
        if (isAbsent(node.get("target"))) {
            throw new ConfigurationException("target block required for wait");
        }
        JsonNode polling = node.path("polling");
        JsonNode maxRetries = polling.get("maxRetries");
        JsonNode expectation = node.get("jsonPathExpectation");
        return new WaitStep(
            selector(node.get("target")),
            text(node, "jsonPath"),
            isAbsent(expectation) ? null : comparison(expectation),
            new Polling(
                polling.path("timeoutSeconds").asLong(Polling.DEFAULT_TIMEOUT_SECONDS),
                polling.path("intervalSeconds").asLong(Polling.DEFAULT_INTERVAL_SECONDS),
                isAbsent(maxRetries) ? null : maxRetries.asInt()));
    }

    // ── Body comparison ─────────────────────────────────────────────────────

    BodyComparisonStep bodyComparison(JsonNode node) {
        if (isAbsent(node.get("request1")) || isAbsent(node.get("request2"))) {
            throw new ConfigurationException("Both request1 and request2 are required for HTTP body comparison");
        }
        List<String> removePaths = new ArrayList<>();
        forEachItem(node.get("removeJsonPaths"), item -> removePaths.add(item.asText()));
        return new BodyComparisonStep(
            httpCall(node.get("request1")),
            httpCall(node.get("request2")),
            node.path("delaySeconds").asDouble(0),
            node.path("parseAsJson").asBoolean(false),
            removePaths);
    }

    private HttpCall httpCall(JsonNode node) {
        return new HttpCall(httpSpec(node.get("http")), source(node.get("source")));
    }

    // ── setVars ─────────────────────────────────────────────────────────────

    Map<String, ExtractionRule> setVars(JsonNode node) {
        if (!node.isObject()) {
            throw new ConfigurationException("setVars must be a mapping of variable names to extraction rules");
        }
        Map<String, ExtractionRule> rules = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            rules.put(field.getKey(), extractionRule(field.getKey(), field.getValue()));
        }
        return rules;
    }

    private static ExtractionRule extractionRule(String name, JsonNode rule) {
        List<ExtractionRule> found = new ArrayList<>();
        if (rule.isObject()) {
            for (ExtractionRule.Type type : ExtractionRule.Type.values()) {
                JsonNode value = rule.get(type.key());
                if (isAbsent(value) || (value.isBoolean() && !value.booleanValue())) {
                    continue;
                }
                found.add(switch (type) {
                    case JSON_PATH, HEADER -> ExtractionRule.of(type, value.asText());
                    case REGEX -> regexRule(name, value);
                    default -> ExtractionRule.of(type);
                });
            }
        }
        if (found.isEmpty()) {
            throw new ConfigurationException("setVars \"" + name + "\": unknown extraction rule: " + rule);
        }
        if (found.size() > 1) {
            throw new ConfigurationException("setVars \"" + name
                + "\": extraction rule must define exactly one source, found " + found.stream().map(r -> r.type().key()).toList());
        }
        return found.get(0);
    }

    private static ExtractionRule regexRule(String name, JsonNode value) {
        String pattern = value.isTextual() ? value.textValue() : text(value, "pattern");
        if (pattern == null) {
            throw new ConfigurationException("setVars \"" + name + "\": regex requires a \"pattern\"");
        }
        checkRegex(pattern);
        int group = value.path("group").asInt(1);
        if (group < 0) {
            throw new ConfigurationException("setVars \"" + name + "\": regex group must be zero or greater, got " + group);
        }
        String source = value.isObject() && text(value, "source") != null ? text(value, "source") : "stdout";
        return new ExtractionRule(ExtractionRule.Type.REGEX, pattern, group, source);
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    /** {@code {comparator, value?, negate?, matchword?}} */
    private static Comparison comparison(JsonNode node) {
        JsonNode value = node.get("value");
        return new Comparison(text(node, "comparator"), isAbsent(value) && !node.has("value") ? null : value,
            node.path("negate").asBoolean(false), node.path("matchword").asBoolean(false));
    }

    private static void forEachItem(JsonNode node, Consumer<JsonNode> action) {
        if (isAbsent(node)) {
            return;
        }
        if (node.isArray()) {
            node.forEach(action);
        } else {
            action.accept(node);
        }
    }

    private static void checkRegex(String regex) {
        try {
            Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid regular expression /" + regex + "/: " + e.getDescription(), e);
        }
    }

    private static String requireText(JsonNode node, String field, String owner) {
        String value = text(node, field);
        if (value == null) {
            throw new ConfigurationException(owner + " entries must have a \"" + field + "\"");
        }
        return value;
    }

    private static Map<String, String> stringMap(JsonNode node) {
        Map<String, String> map = new LinkedHashMap<>();
        if (node != null && node.isObject()) {
            node.fields().forEachRemaining(e -> map.put(e.getKey(), e.getValue().isNull() ? "" : e.getValue().asText()));
        }
        return map;
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return isAbsent(value) ? null : value.asText();
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }
}

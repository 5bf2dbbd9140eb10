package com.yamltest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.yamltest.domain.ExtractionRule;
import com.yamltest.domain.ExtractionRule.Type;
import com.yamltest.dto.CommandResult;
import com.yamltest.dto.HttpResponseData;
import com.yamltest.dto.WaitObservation;
import com.yamltest.infra.ExpectationFailedException;
import com.yamltest.infra.InvalidSourceForKindException;
import com.yamltest.infra.NoResultsException;
import com.yamltest.service.VariableStore;
import com.yamltest.service.extract.VariableExtractor;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@MicronautTest
class VariableExtractorTest {

    @Inject VariableExtractor extractor;
    @Inject VariableStore variables;
    @Inject ObjectMapper mapper;

    @BeforeEach
    void reset() {
        variables.clear();
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private HttpResponseData http(String body) throws Exception {
        return new HttpResponseData(201, Map.of("X-Request-Id", "abc-123"), mapper.readTree(body));
    }

    private static CommandResult command(String stdout, String stderr, int exitCode) {
        return new CommandResult(stdout, stderr, exitCode, null, null);
    }

    // ── HTTP ────────────────────────────────────────────────────────────────

    @Test
    void jsonPath_singleNumber_isStoredAsText() throws Exception {
        extractor.apply(Map.of("ID", ExtractionRule.of(Type.JSON_PATH, "$.id")), http("{\"id\":42}"));

        assertThat(variables.snapshot()).containsEntry("ID", "42");
    }

    @Test
    void jsonPath_severalMatches_isStoredAsJsonArray() throws Exception {
        extractor.apply(Map.of("NAMES", ExtractionRule.of(Type.JSON_PATH, "$.items[*].name")),
            http("{\"items\":[{\"name\":\"a\"},{\"name\":\"b\"}]}"));

        assertThat(variables.snapshot()).containsEntry("NAMES", "[\"a\",\"b\"]");
    }

    @Test
    void jsonPath_noMatch_throwsNoResults() {
        assertThatThrownBy(() -> extractor.apply(Map.of("X", ExtractionRule.of(Type.JSON_PATH, "$.missing")),
            http("{\"id\":1}")))
            .isInstanceOf(NoResultsException.class)
            .hasMessageStartingWith("setVars \"X\": ");
    }

    @Test
    void jsonPath_textBodyHoldingJson_isParsed() {
        var response = new HttpResponseData(200, Map.of(), TextNode.valueOf("{\"token\":\"t-1\"}"));

        extractor.apply(Map.of("TOKEN", ExtractionRule.of(Type.JSON_PATH, "$.token")), response);

        assertThat(variables.snapshot()).containsEntry("TOKEN", "t-1");
    }

    @Test
    void header_isLookedUpCaseInsensitively() throws Exception {
        extractor.apply(Map.of("RID", ExtractionRule.of(Type.HEADER, "x-request-id")), http("{}"));

        assertThat(variables.snapshot()).containsEntry("RID", "abc-123");
    }

    @Test
    void header_missing_fails() {
        assertThatThrownBy(() -> extractor.apply(Map.of("H", ExtractionRule.of(Type.HEADER, "etag")), http("{}")))
            .isInstanceOf(ExpectationFailedException.class)
            .hasMessageContaining("etag");
    }

    @Test
    void statusCodeAndBody_areRendered() throws Exception {
        Map<String, ExtractionRule> rules = new LinkedHashMap<>();
        rules.put("CODE", ExtractionRule.of(Type.STATUS_CODE));
        rules.put("BODY", ExtractionRule.of(Type.BODY));

        extractor.apply(rules, http("{\"a\":1}"));

        assertThat(variables.snapshot()).containsEntry("CODE", "201").containsEntry("BODY", "{\"a\":1}");
    }

    @Test
    void regex_onHttpBody_usesGroup() throws Exception {
        var rule = new ExtractionRule(Type.REGEX, "build-(\\d+)", 1, "stdout");

        extractor.apply(Map.of("BUILD", rule), new HttpResponseData(200, Map.of(), TextNode.valueOf("ok build-77 done")));

        assertThat(variables.snapshot()).containsEntry("BUILD", "77");
    }

    // ── Command ─────────────────────────────────────────────────────────────

    @Test
    void stdoutAndExitCode_areCaptured() {
        Map<String, ExtractionRule> rules = new LinkedHashMap<>();
        rules.put("OUT", ExtractionRule.of(Type.STDOUT));
        rules.put("CODE", ExtractionRule.of(Type.EXIT_CODE));

        extractor.apply(rules, command("hello", "", 3));

        assertThat(variables.snapshot()).containsEntry("OUT", "hello").containsEntry("CODE", "3");
    }

    @Test
    void regex_onStderr_readsSelectedStream() {
        var rule = new ExtractionRule(Type.REGEX, "pid=(\\d+)", 1, "stderr");

        extractor.apply(Map.of("PID", rule), command("", "started pid=991", 0));

        assertThat(variables.snapshot()).containsEntry("PID", "991");
    }

    @Test
    void regex_missingGroup_fails() {
        var rule = new ExtractionRule(Type.REGEX, "pid=\\d+", 1, "stdout");

        assertThatThrownBy(() -> extractor.apply(Map.of("PID", rule), command("pid=1", "", 0)))
            .isInstanceOf(ExpectationFailedException.class)
            .hasMessageContaining("capture group 1");
    }

    @Test
    void regex_negativeGroup_fails() {
        var rule = new ExtractionRule(Type.REGEX, "id=(\\d+)", -1, "stdout");

        assertThatThrownBy(() -> extractor.apply(Map.of("ID", rule), command("id=7", "", 0)))
            .isInstanceOf(ExpectationFailedException.class)
            .hasMessageContaining("capture group -1 not found");
    }

    @Test
    void jsonPath_commandWithoutParsedJson_fails() {
        assertThatThrownBy(() -> extractor.apply(Map.of("X", ExtractionRule.of(Type.JSON_PATH, "$.a")),
            command("{\"a\":1}", "", 0)))
            .isInstanceOf(ExpectationFailedException.class)
            .hasMessageContaining("no JSON data available");
    }

    // ── Source validity ─────────────────────────────────────────────────────

    @Test
    void headerOnCommand_isInvalidSource() {
        assertThatThrownBy(() -> extractor.apply(Map.of("H", ExtractionRule.of(Type.HEADER, "x")), command("", "", 0)))
            .isInstanceOf(InvalidSourceForKindException.class)
            .hasMessage("setVars \"H\": \"header\" source is not valid for command tests");
    }

    @Test
    void stdoutOnHttp_isInvalidSource() {
        assertThatThrownBy(() -> extractor.apply(Map.of("O", ExtractionRule.of(Type.STDOUT)), http("{}")))
            .isInstanceOf(InvalidSourceForKindException.class)
            .hasMessage("setVars \"O\": \"stdout\" source is not valid for http tests");
    }

    @Test
    void value_onWaitObservation_isStored() {
        extractor.apply(Map.of("PHASE", ExtractionRule.of(Type.VALUE)), new WaitObservation(TextNode.valueOf("Running ")));

        assertThat(variables.snapshot()).containsEntry("PHASE", "Running");
    }

    @Test
    void value_onHttp_isInvalidSource() {
        assertThatThrownBy(() -> extractor.apply(Map.of("V", ExtractionRule.of(Type.VALUE)),
            new HttpResponseData(200, Map.of(), IntNode.valueOf(1))))
            .isInstanceOf(InvalidSourceForKindException.class);
    }

    @Test
    void firstFailure_keepsEarlierValuesPublished() throws Exception {
        Map<String, ExtractionRule> rules = new LinkedHashMap<>();
        rules.put("ID", ExtractionRule.of(Type.JSON_PATH, "$.id"));
        rules.put("MISSING", ExtractionRule.of(Type.JSON_PATH, "$.nope"));

        assertThatThrownBy(() -> extractor.apply(rules, http("{\"id\":7}")))
            .isInstanceOf(NoResultsException.class);
        assertThat(variables.snapshot()).containsEntry("ID", "7").doesNotContainKey("MISSING");
    }
}

package com.yamltest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.yamltest.domain.Comparison;
import com.yamltest.infra.ConfigurationException;
import com.yamltest.infra.ExpectationFailedException;
import com.yamltest.service.compare.ComparatorEngine;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@MicronautTest
class ComparatorEngineTest {

    @Inject ComparatorEngine comparator;
    @Inject ObjectMapper mapper;

    // ── Helpers ─────────────────────────────────────────────────────────────

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    private static Comparison cmp(String comparator, JsonNode value) {
        return Comparison.of(comparator, value, false);
    }

    private static Comparison not(String comparator, JsonNode value) {
        return Comparison.of(comparator, value, true);
    }

    // ── equals ──────────────────────────────────────────────────────────────

    @Test
    void equals_integerAndDecimal_areEqual() throws Exception {
        assertThatCode(() -> comparator.compare(json("1"), cmp("equals", json("1.0")), "value"))
            .doesNotThrowAnyException();
    }

    @Test
    void equals_objectsWithDifferentKeyOrder_areEqual() throws Exception {
        assertThatCode(() -> comparator.compare(json("{\"a\":1,\"b\":[1,2]}"),
            cmp("equals", json("{\"b\":[1,2],\"a\":1}")), "body")).doesNotThrowAnyException();
    }

    @Test
    void equals_arraysOfDifferentLength_fail() throws Exception {
        assertThatThrownBy(() -> comparator.compare(json("[1,2]"), cmp("equals", json("[1,2,3]")), "body"))
            .isInstanceOf(ExpectationFailedException.class)
            .hasMessage("body comparison failed: expected to equals [1,2,3], found [1,2]");
    }

    @Test
    void equals_stringVersusNumber_fail() {
        assertThatThrownBy(() -> comparator.compare(TextNode.valueOf("1"), cmp("equals", IntNode.valueOf(1)), "value"))
            .isInstanceOf(ExpectationFailedException.class);
    }

    // ── contains / matches ──────────────────────────────────────────────────

    @Test
    void contains_matchword_requiresWordBoundary() {
        Comparison word = new Comparison("contains", TextNode.valueOf("run"), false, true);

        assertThatCode(() -> comparator.compare(TextNode.valueOf("a run started"), word, "stdout"))
            .doesNotThrowAnyException();
        assertThatThrownBy(() -> comparator.compare(TextNode.valueOf("running"), word, "stdout"))
            .isInstanceOf(ExpectationFailedException.class);
    }

    @Test
    void contains_objectActual_searchesRenderedJson() throws Exception {
        assertThatCode(() -> comparator.compare(json("{\"status\":\"ok\"}"),
            cmp("contains", TextNode.valueOf("\"status\":\"ok\"")), "body")).doesNotThrowAnyException();
    }

    @Test
    void contains_negated_failsWithNotInMessage() {
        assertThatThrownBy(() -> comparator.compare(TextNode.valueOf("error: boom"),
            not("contains", TextNode.valueOf("error")), "stdout contains"))
            .isInstanceOf(ExpectationFailedException.class)
            .hasMessage("stdout contains comparison failed: expected to not contains \"error\", found error: boom");
    }

    @Test
    void matches_findsAnywhereInText() {
        assertThatCode(() -> comparator.compare(TextNode.valueOf("version 1.24.3"),
            cmp("matches", TextNode.valueOf("\\d+\\.\\d+")), "stdout")).doesNotThrowAnyException();
    }

    @Test
    void matches_invalidRegex_isConfigurationError() {
        assertThatThrownBy(() -> comparator.compare(TextNode.valueOf("x"), cmp("matches", TextNode.valueOf("(")), "stdout"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Invalid regular expression");
    }

    // ── exists / numeric ────────────────────────────────────────────────────

    @Test
    void exists_nullAndAbsent_fail() {
        assertThatThrownBy(() -> comparator.compare(NullNode.getInstance(), cmp("exists", null), "JSONPath $.a"))
            .isInstanceOf(ExpectationFailedException.class)
            .hasMessage("JSONPath $.a comparison failed: expected to exists, found null");
        assertThatThrownBy(() -> comparator.compare(null, cmp("exists", null), "JSONPath $.a"))
            .hasMessageEndingWith("found undefined");
    }

    @Test
    void exists_negatedOnAbsent_passes() {
        assertThatCode(() -> comparator.compare(null, not("exists", null), "JSONPath $.a"))
            .doesNotThrowAnyException();
    }

    @Test
    void greaterThan_coercesNumericStrings() {
        assertThatCode(() -> comparator.compare(TextNode.valueOf("10"), cmp("greaterThan", IntNode.valueOf(9)), "value"))
            .doesNotThrowAnyException();
        assertThatThrownBy(() -> comparator.compare(TextNode.valueOf("abc"), cmp("greaterThan", IntNode.valueOf(0)), "value"))
            .isInstanceOf(ExpectationFailedException.class);
    }

    @Test
    void lessThan_equalValues_fail() {
        assertThatThrownBy(() -> comparator.compare(IntNode.valueOf(5), cmp("lessThan", IntNode.valueOf(5)), "value"))
            .isInstanceOf(ExpectationFailedException.class);
    }

    @Test
    void unknownComparator_isConfigurationError() {
        assertThatThrownBy(() -> comparator.compare(IntNode.valueOf(1), cmp("approximately", IntNode.valueOf(1)), "value"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessage("Unknown comparator: approximately");
    }
}

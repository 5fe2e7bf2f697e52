package com.agrivision.common.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class FieldIdsTest {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @ParameterizedTest
    @ValueSource(strings = {"Field_01", "a", "north-plot-7", "ABC_def-123", "__", "0"})
    void shouldAcceptAllowedCharacters(String fieldId) {
        assertThat(FieldIds.sanitize(NODES.textNode(fieldId))).contains(fieldId);
    }

    @Test
    void shouldTrimSurroundingWhitespace() {
        assertThat(FieldIds.sanitize(NODES.textNode("  Field_01\t\n"))).contains("Field_01");
    }

    @Test
    void shouldTrimNoBreakSpaceAndByteOrderMark() {
        assertThat(FieldIds.sanitize(NODES.textNode("Field_01\u00A0"))).contains("Field_01");
        assertThat(FieldIds.sanitize(NODES.textNode("\uFEFFField_01"))).contains("Field_01");
        assertThat(FieldIds.sanitize(NODES.textNode("\u3000\u2028Field_01\u2009"))).contains("Field_01");
    }

    @ParameterizedTest
    @ValueSource(strings = {"Field_01\u001F", "\u001CField_01", "Field_01\u0085"})
    void shouldKeepControlCharactersWhenTrimming(String fieldId) {
        assertThat(FieldIds.sanitize(NODES.textNode(fieldId))).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "bad id!", "field.01", "field/01", "système", "a b", "$where", "field_01;drop"})
    void shouldRejectDisallowedValues(String fieldId) {
        assertThat(FieldIds.sanitize(NODES.textNode(fieldId))).isEmpty();
    }

    @Test
    void shouldEnforceMaximumLength() {
        String longest = "f".repeat(FieldIds.MAX_LENGTH);

        assertThat(FieldIds.sanitize(NODES.textNode(longest))).contains(longest);
        assertThat(FieldIds.sanitize(NODES.textNode(longest + "f"))).isEmpty();
    }

    @Test
    void shouldRejectNonStringValues() {
        assertThat(FieldIds.sanitize(NODES.numberNode(42))).isEmpty();
        assertThat(FieldIds.sanitize(NODES.booleanNode(true))).isEmpty();
        assertThat(FieldIds.sanitize(NODES.nullNode())).isEmpty();
        assertThat(FieldIds.sanitize(NODES.arrayNode().add("Field_01"))).isEmpty();
        assertThat(FieldIds.sanitize(NODES.objectNode().put("id", "Field_01"))).isEmpty();
        assertThat(FieldIds.sanitize((JsonNode) null)).isEmpty();
    }
}

package com.bristol.siteintel.infrastructure.adapter.normalizer;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class NumericValuesTest {

    @Test
    void shouldStripThousandsSeparators() {
        assertThat(NumericValues.parse("1,234,567.5")).isEqualTo(1234567.5);
        assertThat(NumericValues.parse(" 3.8 ")).isEqualTo(3.8);
    }

    @ParameterizedTest
    @ValueSource(strings = {"(NA)", "(D)", "(X)", "N/A", "-", "", "   ", "abc", "12..5"})
    void shouldTreatSuppressedOrUnparseableValuesAsMissing(String raw) {
        assertThat(NumericValues.parse(raw)).isNull();
    }

    @Test
    void shouldReadJsonNodes() {
        var factory = JsonNodeFactory.instance;

        assertThat(NumericValues.parse(factory.numberNode(42))).isEqualTo(42.0);
        assertThat(NumericValues.parse(factory.textNode("2,000"))).isEqualTo(2000.0);
        assertThat(NumericValues.parse(factory.nullNode())).isNull();
        assertThat(NumericValues.parse(MissingNode.getInstance())).isNull();
        assertThat(NumericValues.parse(factory.booleanNode(true))).isNull();
    }

    @Test
    void shouldKeepZero() {
        assertThat(NumericValues.parse("0")).isEqualTo(0.0);
    }
}

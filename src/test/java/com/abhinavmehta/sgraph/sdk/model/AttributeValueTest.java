package com.abhinavmehta.sgraph.sdk.model;

import com.abhinavmehta.sgraph.sdk.dto.AttributeType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttributeValueTest {

    @Test
    void stringNeverEqualsNumber_evenWithSameText() {
        assertThat(AttributeValue.of("5")).isNotEqualTo(AttributeValue.of(5));
        assertThat(AttributeValue.of("true")).isNotEqualTo(AttributeValue.of(true));
    }

    @Test
    void numbersCompareByValue_acrossJavaNumberTypes() {
        AttributeValue integral = AttributeValue.of(5);
        AttributeValue floating = AttributeValue.of(5.0d);
        AttributeValue big = AttributeValue.of(new BigDecimal("5.000"));

        assertThat(integral).isEqualTo(floating).isEqualTo(big);
        assertThat(integral.hashCode()).isEqualTo(floating.hashCode()).isEqualTo(big.hashCode());
        assertThat(integral.getType()).isEqualTo(AttributeType.NUMBER);
    }

    @Test
    void toJavaValue_returnsLongForIntegralNumbers() {
        assertThat(AttributeValue.of(120).toJavaValue()).isEqualTo(120L);
        assertThat(AttributeValue.of(1.5d).toJavaValue()).isEqualTo(new BigDecimal("1.5"));
        assertThat(AttributeValue.of("x").toJavaValue()).isEqualTo("x");
        assertThat(AttributeValue.of(false).toJavaValue()).isEqualTo(false);
    }

    @Test
    void rejectsUnsupportedValues() {
        assertThatThrownBy(() -> AttributeValue.of(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AttributeValue.of(List.of(1))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AttributeValue.of(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }
}

/* (C)2026 */
package com.ammann.valuation.calculation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CalculationMathTest {

    @ParameterizedTest
    @CsvSource({
        "'$1,234,567', 1234567",
        "'$1.2M', 1200000",
        "'1.5 million', 1500000",
        "'$2 billion', 2000000000",
        "'$450k', 450000",
        "'75 thousand', 75000"
    })
    void parsesCurrencyWithUnits(String text, double expected) {
        assertThat(CalculationMath.parseCurrency(text)).isEqualTo(expected);
    }

    @Test
    void nonCurrencyTextIsNotParsed() {
        assertThat(CalculationMath.parseCurrency("about a million")).isNull();
        assertThat(CalculationMath.parseCurrency(null)).isNull();
    }
}

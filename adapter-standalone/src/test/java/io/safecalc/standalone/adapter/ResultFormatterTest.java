package io.safecalc.standalone.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ResultFormatterTest {

    private final ResultFormatter formatter = new ResultFormatter(10);

    @Nested
    @DisplayName("Integral values")
    class Integral {

        @ParameterizedTest
        @CsvSource({"4.0, 4", "-12.0, -12", "0.0, 0", "1024.0, 1024", "1e20, 100000000000000000000"})
        void printWithoutFraction(double value, String expected) {
            assertThat(formatter.format(value)).isEqualTo(expected);
        }

        @Test
        void negativeZeroPrintsAsZero() {
            assertThat(formatter.format(-0.0)).isEqualTo("0");
        }
    }

    @Nested
    @DisplayName("Fractional values")
    class Fractional {

        @Test
        void roundedToPrecisionAndTrimmed() {
            assertThat(formatter.format(1.0 / 3.0)).isEqualTo("0.3333333333");
            assertThat(formatter.format(2.0 / 3.0)).isEqualTo("0.6666666667");
            assertThat(formatter.format(0.1 + 0.2)).isEqualTo("0.3");
            assertThat(formatter.format(2.5)).isEqualTo("2.5");
            assertThat(formatter.format(-0.125)).isEqualTo("-0.125");
        }

        @Test
        void valuesBelowPrecisionPrintAsZero() {
            assertThat(formatter.format(1e-12)).isEqualTo("0");
            assertThat(formatter.format(-1e-12)).isEqualTo("0");
        }

        @Test
        void neverUsesScientificNotation() {
            assertThat(formatter.format(1.5e-7)).isEqualTo("0.00000015");
        }

        @Test
        void precisionIsConfigurable() {
            ResultFormatter two = new ResultFormatter(2);

            assertThat(two.format(Math.PI)).isEqualTo("3.14");
            assertThat(two.format(0.125)).isEqualTo("0.12");
            assertThat(two.format(0.375)).isEqualTo("0.38");
            assertThat(two.precision()).isEqualTo(2);
        }
    }

    @Test
    void nonFiniteValues() {
        assertThat(formatter.format(Double.POSITIVE_INFINITY)).isEqualTo("inf");
        assertThat(formatter.format(Double.NEGATIVE_INFINITY)).isEqualTo("-inf");
        assertThat(formatter.format(Double.NaN)).isEqualTo("nan");
    }

    @Test
    void negativePrecisionIsRejected() {
        assertThatThrownBy(() -> new ResultFormatter(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}

package com.demoPayroll.taxEngine.normalizer.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Coercions Tests")
class CoercionsTest {

    @Nested
    @DisplayName("Number Coercion Tests")
    class NumberTests {

        @ParameterizedTest
        @CsvSource({
                "125000.00, 125000.0",
                "12.5abc, 12.5",
                "' 42', 42.0",
                "-7.25, -7.25",
                ".5, 0.5",
                "1e3, 1000.0",
                "abc, 0.0",
                "'', 0.0"
        })
        @DisplayName("Should read the leading number of a string")
        void shouldReadLeadingNumber(String input, double expected) {
            assertThat(Coercions.toNumber(input)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should give zero for null, booleans and non-finite numbers")
        void shouldGiveZeroForNonNumbers() {
            assertThat(Coercions.toNumber(null)).isZero();
            assertThat(Coercions.toNumber(true)).isZero();
            assertThat(Coercions.toNumber(Double.NaN)).isZero();
            assertThat(Coercions.toNumber(Double.POSITIVE_INFINITY)).isZero();
            assertThat(Coercions.toNumber(Map.of())).isZero();
        }

        @ParameterizedTest
        @ValueSource(strings = {"abc", "=100", "", "  "})
        @DisplayName("Should return null when a string does not start with a number")
        void shouldReturnNullWithoutLeadingNumber(String input) {
            assertThat(Coercions.leadingNumber(input)).isNull();
        }

        @Test
        @DisplayName("Should return null for a null string")
        void shouldReturnNullForNull() {
            assertThat(Coercions.leadingNumber(null)).isNull();
        }
    }

    @Nested
    @DisplayName("Boolean Coercion Tests")
    class BooleanTests {

        @Test
        @DisplayName("Should accept booleans, true strings and non-zero numbers")
        void shouldCoerceTruthyValues() {
            assertThat(Coercions.toBoolean(true)).isTrue();
            assertThat(Coercions.toBoolean(" True ")).isTrue();
            assertThat(Coercions.toBoolean(1)).isTrue();
            assertThat(Coercions.toBoolean(false)).isFalse();
            assertThat(Coercions.toBoolean("yes")).isFalse();
            assertThat(Coercions.toBoolean(0.0)).isFalse();
            assertThat(Coercions.toBoolean(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("Path Lookup Tests")
    class PathTests {

        private final Map<String, Object> record = Map.of(
                "deductions", Map.of("section_80dd", Map.of("amount", "75000.00", "relation", " ")),
                "regime_type", "new");

        @Test
        @DisplayName("Should follow nested keys")
        void shouldFollowNestedKeys() {
            assertThat(Coercions.valueAt(record, "deductions", "section_80dd", "amount")).isEqualTo("75000.00");
            assertThat(Coercions.amountAt(record, "deductions", "section_80dd", "amount")).isEqualTo(75000.0);
            assertThat(Coercions.textAt(record, "old", "regime_type")).isEqualTo("new");
        }

        @Test
        @DisplayName("Should fall back when a step is missing or blank")
        void shouldFallBackForMissingPath() {
            assertThat(Coercions.valueAt(record, "deductions", "section_80u", "amount")).isNull();
            assertThat(Coercions.valueAt(record, "regime_type", "nested")).isNull();
            assertThat(Coercions.amountAt(record, "perquisites", "loans")).isZero();
            assertThat(Coercions.textAt(record, "unknown", "deductions", "section_80dd", "relation"))
                    .isEqualTo("unknown");
        }
    }
}

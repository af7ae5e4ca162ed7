package com.demoPayroll.taxEngine.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EmployeeIdMasker Tests")
class EmployeeIdMaskerTest {

    @ParameterizedTest
    @CsvSource({
            "EMP00107, EM****07",
            "ABCDE, AB*DE",
            "ABCD, ****",
            "'  ', ****"
    })
    @DisplayName("Should keep the first and last two characters")
    void shouldMaskMiddle(String employeeId, String expected) {
        assertThat(EmployeeIdMasker.mask(employeeId)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should fully mask a null id")
    void shouldMaskNull() {
        assertThat(EmployeeIdMasker.mask(null)).isEqualTo("****");
    }
}

package com.demoPayroll.taxEngine.validation.service;

import com.demoPayroll.taxEngine.limits.service.LimitTableLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GeneralLimitValidator Tests")
class GeneralLimitValidatorTest {

    private final GeneralLimitValidator validator = new GeneralLimitValidator(new LimitTableLoader().load("2024-2025"));

    @Test
    @DisplayName("Should warn on negative amounts and amounts above the sanity ceiling")
    void shouldWarnOnAmounts() {
        assertThat(validator.validateAmount(-1).getWarning()).isEqualTo("Amount cannot be negative");
        assertThat(validator.validateAmount(99999999).hasWarning()).isFalse();
        assertThat(validator.validateAmount(100000000).getWarning())
                .isEqualTo("Amount exceeds recommended limit of ₹9,99,99,999");
        assertThat(validator.validateAmount(5001, 5000).getLimit()).isEqualTo(5000.0);
    }

    @Test
    @DisplayName("Should warn outside the working age range without blocking")
    void shouldWarnOnAge() {
        assertThat(validator.validateAge(17).getWarning()).isEqualTo("Age is below typical working age of 18");
        assertThat(validator.validateAge(18).hasWarning()).isFalse();
        assertThat(validator.validateAge(100).hasWarning()).isFalse();
        assertThat(validator.validateAge(9999).getWarning()).isEqualTo("Age exceeds typical limit of 100");
        assertThat(validator.validateAge(9999).isValid()).isTrue();
        assertThat(validator.validateAge(-4).isValid()).isTrue();
    }

    @Test
    @DisplayName("Should warn on percentages outside 0 to 100")
    void shouldWarnOnPercentage() {
        assertThat(validator.validatePercentage(0).hasWarning()).isFalse();
        assertThat(validator.validatePercentage(100).hasWarning()).isFalse();
        assertThat(validator.validatePercentage(100.5).hasWarning()).isTrue();
        assertThat(validator.validatePercentage(-1).isValid()).isTrue();
    }
}

package com.demoPayroll.taxEngine.validation.service;

import com.demoPayroll.taxEngine.limits.service.LimitTableLoader;
import com.demoPayroll.taxEngine.validation.model.CapitalGainsOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("CapitalGainsValidator Tests")
class CapitalGainsValidatorTest {

    private final CapitalGainsValidator validator = new CapitalGainsValidator(new LimitTableLoader().load("2024-2025"));

    @Test
    @DisplayName("Should tax STCG flat and LTCG above the exemption")
    void shouldComputeSpecialRateTax() {
        // When
        CapitalGainsOutcome outcome = validator.validateCapitalGains(100000, 200000);

        // Then
        assertThat(outcome.getStcg111aTax()).isCloseTo(20000.0, within(0.001));
        assertThat(outcome.getTaxableLtcg112a()).isEqualTo(75000.0);
        assertThat(outcome.getLtcg112aTax()).isCloseTo(9375.0, within(0.001));
        assertThat(outcome.getTotalTax()).isCloseTo(29375.0, within(0.001));
        assertThat(outcome.getUnusedLtcgExemption()).isZero();
        assertThat(outcome.getInfo()).startsWith("Capital gains tax at special rates: ₹29,375");
    }

    @Test
    @DisplayName("Should report LTCG within the exemption")
    void shouldReportLtcgWithinExemption() {
        // When
        CapitalGainsOutcome outcome = validator.validateCapitalGains(0, 100000);

        // Then
        assertThat(outcome.getTotalTax()).isZero();
        assertThat(outcome.getUnusedLtcgExemption()).isEqualTo(25000.0);
        assertThat(outcome.getInfo()).isEqualTo("LTCG of ₹1,00,000 is within the exemption of ₹1,25,000");
    }

    @Test
    @DisplayName("Should count losses as zero gains")
    void shouldIgnoreLosses() {
        CapitalGainsOutcome outcome = validator.validateCapitalGains(-50000, -1);

        assertThat(outcome.getTotalTax()).isZero();
        assertThat(outcome.getInfo()).isNull();
        assertThat(outcome.isValid()).isTrue();
    }
}

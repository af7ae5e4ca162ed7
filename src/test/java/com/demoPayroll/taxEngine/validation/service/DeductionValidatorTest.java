package com.demoPayroll.taxEngine.validation.service;

import com.demoPayroll.taxEngine.limits.model.LimitTable;
import com.demoPayroll.taxEngine.limits.service.LimitTableLoader;
import com.demoPayroll.taxEngine.validation.model.ValidationOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DeductionValidator Tests")
class DeductionValidatorTest {

    private static final LimitTable LIMITS = new LimitTableLoader().load("2024-2025");

    private final DeductionValidator validator = new DeductionValidator(LIMITS);

    @Nested
    @DisplayName("Section 80C Tests")
    class Section80CTests {

        @Test
        @DisplayName("Should not warn exactly at the ceiling")
        void shouldNotWarnAtCeiling() {
            // When
            ValidationOutcome outcome = validator.validateSection80C(150000);

            // Then
            assertThat(outcome.hasWarning()).isFalse();
            assertThat(outcome.getRemainingLimit()).isZero();
            assertThat(outcome.isValid()).isTrue();
        }

        @Test
        @DisplayName("Should warn one rupee above the ceiling")
        void shouldWarnAboveCeiling() {
            // When
            ValidationOutcome outcome = validator.validateSection80C(150001);

            // Then
            assertThat(outcome.getWarning()).isEqualTo(
                    "Total Section 80C deductions exceed statutory limit of ₹1,50,000. "
                            + "Excess amount will not be considered for deduction.");
            assertThat(outcome.getRemainingLimit()).isZero();
            assertThat(outcome.getInfo()).isNull();
            assertThat(outcome.getDerivedValue()).isEqualTo(150000.0);
            assertThat(outcome.isValid()).isTrue();
        }

        @Test
        @DisplayName("Should report remaining headroom below the ceiling")
        void shouldReportRemainingHeadroom() {
            // When
            ValidationOutcome outcome = validator.validateSection80C(100000);

            // Then
            assertThat(outcome.getRemainingLimit()).isEqualTo(50000.0);
            assertThat(outcome.getInfo()).isEqualTo("Remaining Section 80C limit: ₹50,000");
            assertThat(validator.validateSection80C(0).getInfo()).isNull();
        }

        @ParameterizedTest
        @CsvSource({"0,0", "1000,500", "75000,75000", "149999,1", "150000,50000", "200000,10"})
        @DisplayName("Should never increase remaining headroom when the total grows")
        void shouldBeMonotonic(double a, double b) {
            double remainingForA = validator.validateSection80C(a).getRemainingLimit();
            double remainingForSum = validator.validateSection80C(a + b).getRemainingLimit();

            assertThat(remainingForSum).isLessThanOrEqualTo(remainingForA);
        }
    }

    @Nested
    @DisplayName("Section 80D Tests")
    class Section80DTests {

        @Test
        @DisplayName("Should apply the below-60 ceiling at age 59")
        void shouldApplyBelowSixtyCeiling() {
            // When
            ValidationOutcome outcome = validator.validateSection80D(30000, 59, "self_family");

            // Then
            assertThat(outcome.getLimit()).isEqualTo(25000.0);
            assertThat(outcome.getWarning()).isEqualTo(
                    "Section 80D self_family deduction exceeds statutory limit of ₹25,000 for individuals below 60. "
                            + "Excess amount will not be considered.");
        }

        @Test
        @DisplayName("Should apply the senior ceiling from age 60")
        void shouldApplySeniorCeiling() {
            // When
            ValidationOutcome outcome = validator.validateSection80D(30000, 60, "self_family");

            // Then
            assertThat(outcome.getLimit()).isEqualTo(50000.0);
            assertThat(outcome.hasWarning()).isFalse();
        }

        @Test
        @DisplayName("Should describe super senior citizens as senior citizens")
        void shouldDescribeSuperSeniorAsSenior() {
            ValidationOutcome outcome = validator.validateSection80D(60000, 85, "parents");

            assertThat(outcome.getLimit()).isEqualTo(50000.0);
            assertThat(outcome.getWarning()).contains("Section 80D parents").endsWith(
                    "for senior citizens. Excess amount will not be considered.");
        }

        @Test
        @DisplayName("Should apply the lower ceiling and flag an unrecognized category")
        void shouldFlagUnrecognizedCategory() {
            // When
            ValidationOutcome within = validator.validateSection80D(10000, 70, "spouse");
            ValidationOutcome above = validator.validateSection80D(30000, 70, "spouse");

            // Then
            assertThat(within.getLimit()).isEqualTo(25000.0);
            assertThat(within.getWarning()).startsWith("Unrecognized Section 80D category 'spouse'");
            assertThat(above.getWarning()).contains("exceeds statutory limit of ₹25,000");
            assertThat(above.isValid()).isTrue();
        }

        @Test
        @DisplayName("Should cap the combined claim")
        void shouldCapCombinedClaim() {
            assertThat(validator.validateSection80DCombined(50000, 50000).hasWarning()).isFalse();

            ValidationOutcome outcome = validator.validateSection80DCombined(50000, 60000);
            assertThat(outcome.getWarning()).contains("₹1,00,000");
            assertThat(outcome.getDerivedValue()).isEqualTo(100000.0);
        }
    }

    @Nested
    @DisplayName("Other Deduction Tests")
    class OtherDeductionTests {

        @Test
        @DisplayName("Should cap each NPS component and total the allowed amount")
        void shouldCapNpsComponents() {
            // When
            ValidationOutcome outcome = validator.validateSection80CCD(60000, 60000, 100000, 500000);

            // Then
            assertThat(outcome.getWarning())
                    .contains("NPS contribution under 80CCD(1) exceeds 10% of salary (₹50,000)")
                    .contains("Additional NPS contribution under 80CCD(1B) exceeds limit of ₹50,000")
                    .contains("Employer NPS contribution under 80CCD(2) exceeds 14% of salary (₹70,000)");
            assertThat(outcome.getDerivedValue()).isEqualTo(170000.0);
        }

        @Test
        @DisplayName("Should accept NPS contributions within their caps")
        void shouldAcceptNpsWithinCaps() {
            ValidationOutcome outcome = validator.validateSection80CCD(40000, 50000, 70000, 500000);

            assertThat(outcome.hasWarning()).isFalse();
            assertThat(outcome.getDerivedValue()).isEqualTo(160000.0);
        }

        @ParameterizedTest
        @CsvSource({"40,75000", "79.9,75000", "80,125000", "100,125000"})
        @DisplayName("Should raise the 80DD and 80U ceilings for severe disability")
        void shouldRaiseCeilingForSevereDisability(double disabilityPercentage, double expectedLimit) {
            assertThat(validator.validateSection80DD(100000, disabilityPercentage).getLimit()).isEqualTo(expectedLimit);
            assertThat(validator.validateSection80U(100000, disabilityPercentage).getLimit()).isEqualTo(expectedLimit);
        }

        @Test
        @DisplayName("Should apply the senior 80DDB ceiling from age 60")
        void shouldApplySenior80DDBCeiling() {
            assertThat(validator.validateSection80DDB(50000, 45).getWarning())
                    .isEqualTo("Section 80DDB deduction exceeds statutory limit of ₹40,000 for individuals below 60.");
            assertThat(validator.validateSection80DDB(50000, 65).hasWarning()).isFalse();
        }

        @Test
        @DisplayName("Should warn on electric vehicle loan interest above the ceiling")
        void shouldWarnOn80EEB() {
            assertThat(validator.validateSection80EEB(150000).hasWarning()).isFalse();
            assertThat(validator.validateSection80EEB(150001).getDerivedValue()).isEqualTo(150000.0);
        }
    }

    @Test
    @DisplayName("Should never report invalid for absurd input")
    void shouldNeverBlock() {
        assertThat(validator.validateSection80C(-5).isValid()).isTrue();
        assertThat(validator.validateSection80C(1e12).isValid()).isTrue();
        assertThat(validator.validateSection80D(-1, 9999, "self_family").isValid()).isTrue();
        assertThat(validator.validateSection80D(1e9, -3, null).isValid()).isTrue();
        assertThat(validator.validateSection80CCD(-1, -1, -1, -1).isValid()).isTrue();
        assertThat(validator.validateSection80DD(1e9, 9999).isValid()).isTrue();
        assertThat(validator.validateSection80DDB(1e9, 9999).isValid()).isTrue();
        assertThat(validator.validateSection80U(-10, -10).isValid()).isTrue();
    }
}

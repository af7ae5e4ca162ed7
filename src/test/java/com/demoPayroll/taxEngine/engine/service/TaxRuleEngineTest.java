package com.demoPayroll.taxEngine.engine.service;

import com.demoPayroll.taxEngine.engine.model.PreparedRecord;
import com.demoPayroll.taxEngine.engine.model.TaxationReview;
import com.demoPayroll.taxEngine.expression.service.ExpressionEvaluator;
import com.demoPayroll.taxEngine.expression.service.ExpressionFieldResolver;
import com.demoPayroll.taxEngine.limits.model.LimitTable;
import com.demoPayroll.taxEngine.limits.service.LimitTableLoader;
import com.demoPayroll.taxEngine.normalizer.model.DeclarationSection;
import com.demoPayroll.taxEngine.normalizer.model.TaxationFormRecord;
import com.demoPayroll.taxEngine.normalizer.service.RecordNormalizer;
import com.demoPayroll.taxEngine.util.JsonFileLoader;
import com.demoPayroll.taxEngine.validation.service.AllowanceValidator;
import com.demoPayroll.taxEngine.validation.service.CapitalGainsValidator;
import com.demoPayroll.taxEngine.validation.service.DeductionValidator;
import com.demoPayroll.taxEngine.validation.service.GeneralLimitValidator;
import com.demoPayroll.taxEngine.validation.service.RetirementBenefitValidator;
import com.demoPayroll.taxEngine.validation.service.TaxationFormValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static com.demoPayroll.taxEngine.normalizer.util.Coercions.valueAt;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TaxRuleEngine Tests")
class TaxRuleEngineTest {

    private static final LimitTable LIMITS = new LimitTableLoader().load("2024-2025");

    private final RecordNormalizer normalizer = new RecordNormalizer(LIMITS);

    private final TaxRuleEngine engine = new TaxRuleEngine(
            normalizer,
            new ExpressionFieldResolver(new ExpressionEvaluator(256, 32)),
            new TaxationFormValidator(LIMITS,
                    new GeneralLimitValidator(LIMITS), new DeductionValidator(LIMITS),
                    new AllowanceValidator(LIMITS), new RetirementBenefitValidator(LIMITS),
                    new CapitalGainsValidator(LIMITS)));

    @Nested
    @DisplayName("Review Tests")
    class ReviewTests {

        @Test
        @DisplayName("Should normalize and validate a backend record")
        void shouldReviewBackendRecord() throws IOException {
            // Given
            Map<String, Object> record = JsonFileLoader.loadAsMap("fixtures/comprehensive-record.json");

            // When
            TaxationReview review = engine.review(record, "EMP00107");

            // Then
            assertThat(review.isValid()).isTrue();
            assertThat(review.hasExpressionErrors()).isFalse();
            assertThat(review.getFormRecord().getAge()).isEqualTo(42);
            assertThat(review.getWarnings().section("salary"))
                    .containsEntry("hra_info", "HRA exemption: ₹2,34,000, Taxable: ₹6,000");
            assertThat(review.getWarnings().section("perquisites"))
                    .containsEntry("loans_info", "Loan amount is exempt from perquisite tax");
            assertThat(review.getWarnings().getWarnings()).doesNotContainKey("deductions");
        }

        @Test
        @DisplayName("Should review defaults when the backend has no record")
        void shouldReviewMissingRecord() {
            // When
            TaxationReview review = engine.review(null, "EMP00107");

            // Then
            assertThat(review.getFormRecord().getEmployeeId()).isEqualTo("EMP00107");
            assertThat(review.getWarnings().hasWarnings()).isFalse();
        }

        @Test
        @DisplayName("Should resolve expressions before validating an edited form")
        void shouldResolveExpressionsBeforeValidating() {
            // Given
            TaxationFormRecord form = normalizer.defaultRecord("EMP00107");
            form.getSection(DeclarationSection.SALARY_INCOME).put("basic_salary", "=50000*12");
            form.getSection(DeclarationSection.SALARY_INCOME).put("hra_received", "=600000*40%");
            form.getSection(DeclarationSection.SALARY_INCOME).put("bonus", "=abc");
            @SuppressWarnings("unchecked")
            Map<String, Object> section80c = (Map<String, Object>) form.getSection(DeclarationSection.DEDUCTIONS)
                    .get("section_80c");
            section80c.put("life_insurance_premium", "=100000+75000");

            // When
            TaxationReview review = engine.reviewForm(form);

            // Then
            Map<String, Object> salary = review.getFormRecord().getSection(DeclarationSection.SALARY_INCOME);
            assertThat(salary).containsEntry("basic_salary", 600000.0)
                    .containsEntry("hra_received", 240000.0)
                    .containsEntry("bonus", "=abc");
            assertThat(review.getExpressionErrors()).containsOnlyKeys("salary_income.bonus");
            assertThat(review.getWarnings().section("deductions")).containsKey("section_80c");
            assertThat(review.isValid()).isTrue();
        }
    }

    @Nested
    @DisplayName("Persistence Tests")
    class PersistenceTests {

        @Test
        @DisplayName("Should resolve expressions and write the backend shape")
        void shouldPrepareBackendRecord() {
            // Given
            TaxationFormRecord form = normalizer.defaultRecord("EMP00107");
            form.getSection(DeclarationSection.SALARY_INCOME).put("basic_salary", "=45000*12");
            form.getPassThrough().put("filing_status", "submitted");

            // When
            PreparedRecord prepared = engine.prepareForPersistence(form);

            // Then
            assertThat(prepared.hasExpressionErrors()).isFalse();
            assertThat(valueAt(prepared.backendRecord(), "salary_income", "basic_salary")).isEqualTo(540000.0);
            assertThat(prepared.backendRecord())
                    .containsEntry("employee_id", "EMP00107")
                    .containsEntry("filing_status", "submitted");
        }

        @Test
        @DisplayName("Should report failed expressions and store zero in typed fields")
        void shouldReportFailedExpressions() {
            // Given
            TaxationFormRecord form = normalizer.defaultRecord("EMP00107");
            form.getSection(DeclarationSection.SALARY_INCOME).put("commission", "=5+");

            // When
            PreparedRecord prepared = engine.prepareForPersistence(form);

            // Then
            assertThat(prepared.expressionErrors()).containsOnlyKeys("salary_income.commission");
            assertThat(valueAt(prepared.backendRecord(), "salary_income", "commission")).isEqualTo(0.0);
        }
    }
}

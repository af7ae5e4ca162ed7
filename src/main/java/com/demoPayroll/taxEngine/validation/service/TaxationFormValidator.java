package com.demoPayroll.taxEngine.validation.service;

import com.demoPayroll.taxEngine.limits.model.LimitKey;
import com.demoPayroll.taxEngine.limits.model.LimitTable;
import com.demoPayroll.taxEngine.normalizer.model.DeclarationSection;
import com.demoPayroll.taxEngine.normalizer.model.TaxationFormRecord;
import com.demoPayroll.taxEngine.normalizer.util.Coercions;
import com.demoPayroll.taxEngine.validation.model.AggregateWarnings;
import com.demoPayroll.taxEngine.validation.model.CapitalGainsOutcome;
import com.demoPayroll.taxEngine.validation.model.CityCategory;
import com.demoPayroll.taxEngine.validation.model.FieldHint;
import com.demoPayroll.taxEngine.validation.model.HraExemption;
import com.demoPayroll.taxEngine.validation.model.LoanPerquisiteOutcome;
import com.demoPayroll.taxEngine.validation.model.Section80DType;
import com.demoPayroll.taxEngine.validation.model.ValidationOutcome;
import com.demoPayroll.taxEngine.validation.util.IndianNumberFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.demoPayroll.taxEngine.normalizer.util.Coercions.amountAt;
import static com.demoPayroll.taxEngine.validation.util.IndianNumberFormat.rupees;

/**
 * Walks a whole form record and collects advisory warnings keyed by the path
 * they belong to ({@code salary.hra_info}, {@code deductions.section_80c}, ...).
 *
 * Never blocks: the result is always valid, a section without entries is clean.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaxationFormValidator {

    static final String EMP_AGE = "emp_age";
    static final String SALARY = "salary";
    static final String DEDUCTIONS = "deductions";
    static final String PERQUISITES = "perquisites";
    static final String RETIREMENT_BENEFITS = "retirement_benefits";
    static final String CAPITAL_GAINS = "capital_gains_income";

    static final String SECTION_80C_TOTAL = "section_80c_total";
    static final String HRA = "hra";

    private static final String NEW_REGIME = "new";

    /**
     * Section 80C instruments counted towards the aggregate ceiling.
     */
    private static final List<String> SECTION_80C_FIELDS = List.of(
            "life_insurance_premium", "epf_contribution", "ssp_contribution",
            "nsc_investment", "ulip_investment", "others");

    private final LimitTable limits;
    private final GeneralLimitValidator generalLimitValidator;
    private final DeductionValidator deductionValidator;
    private final AllowanceValidator allowanceValidator;
    private final RetirementBenefitValidator retirementBenefitValidator;
    private final CapitalGainsValidator capitalGainsValidator;

    /**
     * Validates every section of a form record.
     *
     * @param formRecord Normalized form record
     * @return Warnings keyed like the declaration; empty when clean
     */
    public AggregateWarnings validateTaxationForm(TaxationFormRecord formRecord) {
        Map<String, Object> warnings = new LinkedHashMap<>();

        if (formRecord.getAge() != 0) {
            ValidationOutcome ageOutcome = generalLimitValidator.validateAge(formRecord.getAge());
            if (ageOutcome.hasWarning()) {
                warnings.put(EMP_AGE, ageOutcome.getWarning());
            }
        }

        putSection(warnings, SALARY, salaryWarnings(formRecord));
        putSection(warnings, DEDUCTIONS, deductionWarnings(formRecord));
        putSection(warnings, PERQUISITES, perquisiteWarnings(formRecord.getSection(DeclarationSection.PERQUISITES)));
        putSection(warnings, RETIREMENT_BENEFITS, retirementWarnings(formRecord));
        putSection(warnings, CAPITAL_GAINS,
                capitalGainsWarnings(formRecord.getSection(DeclarationSection.CAPITAL_GAINS_INCOME)));

        log.debug("Aggregate validation produced warnings for {}", warnings.keySet());
        return new AggregateWarnings(warnings);
    }

    /**
     * Real-time hint for a single input.
     *
     * The amount ceiling is checked first for every field; {@code section_80c_total}
     * and {@code hra} get contextual hints on top. For {@code hra} the context must
     * carry {@code basic} and {@code rentPaid}, and may carry {@code da} and {@code city}.
     *
     * @param field Field name
     * @param value Raw input, number or grouped string ("1,50,000")
     * @param context Related values the hint depends on
     * @return the hint, or null when there is nothing to show
     */
    public FieldHint getValidationMessage(String field, Object value, Map<String, Object> context) {
        double amount = value instanceof String
                ? IndianNumberFormat.parse((String) value)
                : Coercions.toNumber(value);

        ValidationOutcome amountOutcome = generalLimitValidator.validateAmount(amount);
        if (amountOutcome.hasWarning()) {
            return FieldHint.warning(amountOutcome.getWarning());
        }

        if (SECTION_80C_TOTAL.equals(field)) {
            ValidationOutcome outcome = deductionValidator.validateSection80C(amount);
            if (outcome.hasWarning()) {
                return FieldHint.warning(outcome.getWarning());
            }
            return outcome.getInfo() != null ? FieldHint.info(outcome.getInfo()) : null;
        }

        if (HRA.equals(field) && context != null) {
            double basic = Coercions.toNumber(context.get("basic"));
            double rentPaid = Coercions.toNumber(context.get("rentPaid"));
            if (basic != 0 && rentPaid != 0) {
                Object city = context.get("city");
                HraExemption hra = allowanceValidator.validateHRA(amount, basic,
                        Coercions.toNumber(context.get("da")), rentPaid,
                        CityCategory.fromCityName(city != null ? String.valueOf(city) : null));
                return FieldHint.info("HRA exemption: " + rupees(hra.getExemption()));
            }
        }
        return null;
    }

    private Map<String, String> salaryWarnings(TaxationFormRecord formRecord) {
        Map<String, Object> salary = formRecord.getSection(DeclarationSection.SALARY_INCOME);
        Map<String, String> result = new LinkedHashMap<>();

        salary.forEach((field, value) -> {
            if (value instanceof Number) {
                put(result, field, generalLimitValidator.validateAmount(((Number) value).doubleValue()));
            }
        });

        double hra = amountAt(salary, "hra_received");
        double basic = amountAt(salary, "basic_salary");
        if (hra != 0 && basic != 0) {
            HraExemption exemption = allowanceValidator.validateHRA(hra, basic,
                    amountAt(salary, "dearness_allowance"), amountAt(salary, "actual_rent_paid"),
                    cityCategory(salary));
            if (exemption.getTaxable() > 0) {
                result.put("hra_info", "HRA exemption: " + rupees(exemption.getExemption())
                        + ", Taxable: " + rupees(exemption.getTaxable()));
            }
        }

        put(result, "children_education_limits", allowanceValidator.validateChildrenAllowances(
                (int) amountAt(salary, "children_education_count"),
                (int) amountAt(salary, "children_education_months")));
        put(result, "hostel_limits", allowanceValidator.validateHostelAllowance(
                (int) amountAt(salary, "hostel_count"),
                (int) amountAt(salary, "hostel_months")));

        if (NEW_REGIME.equalsIgnoreCase(formRecord.getRegime())) {
            result.put("standard_deduction_info", "Standard deduction of "
                    + rupees(limits.get(LimitKey.STANDARD_DEDUCTION_NEW_REGIME)) + " applies under the new regime");
        }
        return result;
    }

    private Map<String, String> deductionWarnings(TaxationFormRecord formRecord) {
        Map<String, Object> deductions = formRecord.getSection(DeclarationSection.DEDUCTIONS);
        Map<String, Object> salary = formRecord.getSection(DeclarationSection.SALARY_INCOME);
        Map<String, String> result = new LinkedHashMap<>();
        int age = formRecord.getAge();

        double section80CTotal = 0;
        for (String field : SECTION_80C_FIELDS) {
            section80CTotal += amountAt(deductions, "section_80c", field);
        }
        put(result, "section_80c", deductionValidator.validateSection80C(section80CTotal));

        double selfFamily = amountAt(deductions, "section_80d", "self_family_premium")
                + amountAt(deductions, "section_80d", "preventive_health_checkup_self");
        double parents = amountAt(deductions, "section_80d", "parent_premium");
        if (selfFamily != 0) {
            put(result, "section_80d_self", deductionValidator.validateSection80D(
                    selfFamily, age, Section80DType.SELF_FAMILY.getCode()));
        }
        if (parents != 0) {
            put(result, "section_80d_parents", deductionValidator.validateSection80D(
                    parents, (int) amountAt(deductions, "section_80d", "parent_age"),
                    Section80DType.PARENTS.getCode()));
        }
        put(result, "section_80d_combined", deductionValidator.validateSection80DCombined(selfFamily, parents));

        double salaryForNps = amountAt(salary, "basic_salary") + amountAt(salary, "dearness_allowance");
        put(result, "section_80ccd", deductionValidator.validateSection80CCD(
                amountAt(deductions, "section_80ccd", "nps_contribution_10_percent"),
                amountAt(deductions, "section_80ccd", "additional_nps_50k"),
                amountAt(deductions, "section_80ccd", "employer_nps_contribution"),
                salaryForNps));

        put(result, "section_80dd", deductionValidator.validateSection80DD(
                amountAt(deductions, "section_80dd", "amount"),
                amountAt(deductions, "section_80dd", "disability_percentage")));
        put(result, "section_80ddb", deductionValidator.validateSection80DDB(
                amountAt(deductions, "section_80ddb", "amount"), age));
        put(result, "section_80eeb", deductionValidator.validateSection80EEB(
                amountAt(deductions, "section_80eeb", "amount")));
        put(result, "section_80u", deductionValidator.validateSection80U(
                amountAt(deductions, "section_80u", "amount"),
                amountAt(deductions, "section_80u", "disability_percentage")));

        put(result, "section_80e", generalLimitValidator.validateAmount(
                amountAt(deductions, "section_80e", "education_loan_interest")));
        put(result, "section_80ggc", generalLimitValidator.validateAmount(
                amountAt(deductions, "section_80ggc", "amount")));
        return result;
    }

    private Map<String, String> perquisiteWarnings(Map<String, Object> perquisites) {
        Map<String, String> result = new LinkedHashMap<>();

        put(result, "leave_travel_allowance", allowanceValidator.validateLTA(
                (int) amountAt(perquisites, "leave_travel_allowance", "lta_claimed"),
                amountAt(perquisites, "leave_travel_allowance", "lta_exempt")));
        put(result, "medical_reimbursement", allowanceValidator.validateMedicalReimbursement(
                amountAt(perquisites, "medical_reimbursement", "amount")));
        put(result, "gift_vouchers", allowanceValidator.validateGiftVouchers(
                amountAt(perquisites, "other_perquisites", "gift_vouchers_amount_paid_by_employer")));

        double loanAmount = amountAt(perquisites, "loans", "loan_amount");
        if (loanAmount > 0) {
            LoanPerquisiteOutcome loan = allowanceValidator.validateInterestFreeLoan(loanAmount);
            result.put("loans_info", loan.message());
        }
        return result;
    }

    private Map<String, String> retirementWarnings(TaxationFormRecord formRecord) {
        Map<String, Object> benefits = formRecord.getSection(DeclarationSection.RETIREMENT_BENEFITS);
        Map<String, String> result = new LinkedHashMap<>();
        boolean govtEmployee = formRecord.isGovtEmployee();

        put(result, "gratuity", retirementBenefitValidator.validateGratuity(
                amountAt(benefits, "gratuity", "gratuity_received"), govtEmployee));
        ValidationOutcome leaveEncashment = retirementBenefitValidator.validateLeaveEncashment(
                amountAt(benefits, "leave_encashment", "leave_encashment_income_received"), govtEmployee,
                Coercions.toBoolean(Coercions.valueAt(benefits, "leave_encashment", "during_employment")));
        put(result, "leave_encashment", leaveEncashment);
        if (leaveEncashment.getInfo() != null) {
            result.put("leave_encashment_info", leaveEncashment.getInfo());
        }
        put(result, "vrs", retirementBenefitValidator.validateVrs(
                amountAt(benefits, "vrs", "compensation_received")));
        return result;
    }

    private Map<String, String> capitalGainsWarnings(Map<String, Object> capitalGains) {
        Map<String, String> result = new LinkedHashMap<>();
        CapitalGainsOutcome outcome = capitalGainsValidator.validateCapitalGains(
                amountAt(capitalGains, "stcg_111a_equity_stt"),
                amountAt(capitalGains, "ltcg_112a_equity_stt"));
        if (outcome.getInfo() != null) {
            result.put("capital_gains_info", outcome.getInfo());
        }
        return result;
    }

    /**
     * A non-blank city name in {@code hra_city} wins over the stored {@code hra_city_type}.
     */
    private static CityCategory cityCategory(Map<String, Object> salary) {
        String cityName = Coercions.textAt(salary, null, "hra_city");
        if (cityName != null) {
            return CityCategory.fromCityName(cityName);
        }
        return CityCategory.fromCode(Coercions.textAt(salary, null, "hra_city_type"));
    }

    private static void put(Map<String, String> target, String key, ValidationOutcome outcome) {
        if (outcome.hasWarning()) {
            target.put(key, outcome.getWarning());
        }
    }

    private static void putSection(Map<String, Object> warnings, String key, Map<String, String> section) {
        if (!section.isEmpty()) {
            warnings.put(key, section);
        }
    }
}

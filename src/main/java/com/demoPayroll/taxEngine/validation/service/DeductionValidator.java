package com.demoPayroll.taxEngine.validation.service;

import com.demoPayroll.taxEngine.limits.model.LimitKey;
import com.demoPayroll.taxEngine.limits.model.LimitTable;
import com.demoPayroll.taxEngine.validation.model.AgeCategory;
import com.demoPayroll.taxEngine.validation.model.Section80DType;
import com.demoPayroll.taxEngine.validation.model.ValidationOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

import static com.demoPayroll.taxEngine.validation.util.IndianNumberFormat.rupees;

/**
 * Chapter VI-A deduction ceilings (sections 80C, 80CCD, 80D, 80DD, 80DDB, 80EEB, 80U).
 * 
 * Every check is advisory: amounts above a ceiling produce a warning and the
 * excess is simply not deducted downstream.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeductionValidator {
    
    private final LimitTable limits;
    
    /**
     * Checks the aggregate Section 80C claim and reports the headroom left.
     */
    public ValidationOutcome validateSection80C(double total) {
        double limit = limits.get(LimitKey.SECTION_80C_LIMIT);
        double remaining = Math.max(0, limit - total);
        
        String warning = total > limit
                ? "Total Section 80C deductions exceed statutory limit of " + rupees(limit)
                        + ". Excess amount will not be considered for deduction."
                : null;
        String info = total > 0 && total <= limit
                ? "Remaining Section 80C limit: " + rupees(remaining)
                : null;
        
        return ValidationOutcome.builder()
                .warning(warning)
                .info(info)
                .limit(limit)
                .remainingLimit(remaining)
                .derivedValue(Math.min(Math.max(total, 0), limit))
                .build();
    }
    
    /**
     * Checks a Section 80D premium against the age-tiered ceiling for its category.
     * 
     * An unrecognized category is checked against the lower (below 60) ceiling and
     * flagged in the warning.
     * 
     * @param amount Premium claimed
     * @param age Age of the insured person the tier depends on
     * @param type "self_family" or "parents"
     */
    public ValidationOutcome validateSection80D(double amount, int age, String type) {
        Section80DType category = Section80DType.fromCode(type);
        AgeCategory ageCategory = AgeCategory.of(age, limits);
        
        List<String> warnings = new ArrayList<>();
        double limit;
        if (category == null) {
            log.warn("Unrecognized Section 80D category '{}', applying the lower limit", type);
            limit = limits.get(LimitKey.SECTION_80D_SELF_FAMILY_BELOW_60);
            warnings.add("Unrecognized Section 80D category '" + type + "'; the lower statutory limit of "
                    + rupees(limit) + " has been applied");
        } else {
            limit = section80DLimit(category, ageCategory);
        }
        
        if (amount > limit) {
            String label = category != null ? category.getCode() : String.valueOf(type);
            String band = ageCategory.isSenior() ? AgeCategory.SENIOR_CITIZEN.getDescription()
                    : AgeCategory.BELOW_60.getDescription();
            warnings.add("Section 80D " + label + " deduction exceeds statutory limit of " + rupees(limit)
                    + " for " + band + ". Excess amount will not be considered.");
        }
        
        return ValidationOutcome.builder()
                .warning(join(warnings))
                .limit(limit)
                .derivedValue(Math.min(Math.max(amount, 0), limit))
                .build();
    }
    
    /**
     * Checks the combined Section 80D claim (self/family plus parents).
     */
    public ValidationOutcome validateSection80DCombined(double selfFamily, double parents) {
        double limit = limits.get(LimitKey.SECTION_80D_TOTAL_LIMIT);
        double total = selfFamily + parents;
        return ValidationOutcome.builder()
                .warning(total > limit
                        ? "Combined Section 80D deductions exceed overall limit of " + rupees(limit) + "."
                        : null)
                .limit(limit)
                .derivedValue(Math.min(Math.max(total, 0), limit))
                .build();
    }
    
    /**
     * Checks NPS contributions under 80CCD(1), 80CCD(1B) and 80CCD(2).
     * 
     * @param employeeContribution 80CCD(1) contribution, capped at a share of salary
     * @param additionalContribution 80CCD(1B) contribution, capped at a fixed amount
     * @param employerContribution 80CCD(2) employer contribution, capped at a share of salary
     * @param salary Basic plus dearness allowance
     */
    public ValidationOutcome validateSection80CCD(double employeeContribution, double additionalContribution,
                                                  double employerContribution, double salary) {
        double employeeRate = limits.get(LimitKey.SECTION_80CCD_1_LIMIT_PERCENT);
        double employerRate = limits.get(LimitKey.SECTION_80CCD_2_EMPLOYER_LIMIT_PERCENT);
        double employeeCap = salary * employeeRate;
        double additionalCap = limits.get(LimitKey.SECTION_80CCD_1B_ADDITIONAL);
        double employerCap = salary * employerRate;
        
        List<String> warnings = new ArrayList<>();
        if (employeeContribution > employeeCap) {
            warnings.add("NPS contribution under 80CCD(1) exceeds " + percent(employeeRate)
                    + " of salary (" + rupees(employeeCap) + ")");
        }
        if (additionalContribution > additionalCap) {
            warnings.add("Additional NPS contribution under 80CCD(1B) exceeds limit of " + rupees(additionalCap));
        }
        if (employerContribution > employerCap) {
            warnings.add("Employer NPS contribution under 80CCD(2) exceeds " + percent(employerRate)
                    + " of salary (" + rupees(employerCap) + ")");
        }
        
        double allowed = Math.min(Math.max(employeeContribution, 0), employeeCap)
                + Math.min(Math.max(additionalContribution, 0), additionalCap)
                + Math.min(Math.max(employerContribution, 0), employerCap);
        return ValidationOutcome.builder()
                .warning(join(warnings))
                .derivedValue(allowed)
                .build();
    }
    
    /**
     * Section 80DD: maintenance of a disabled dependent. Severe disability raises the ceiling.
     */
    public ValidationOutcome validateSection80DD(double amount, double disabilityPercentage) {
        boolean severe = isSevere(disabilityPercentage);
        double limit = limits.get(severe ? LimitKey.SECTION_80DD_SEVERE : LimitKey.SECTION_80DD_NORMAL);
        return capped(amount, limit, "Section 80DD deduction exceeds statutory limit of " + rupees(limit)
                + (severe ? " for severe disability" : "") + ".");
    }
    
    /**
     * Section 80DDB: treatment of specified diseases. Senior citizens get the higher ceiling.
     */
    public ValidationOutcome validateSection80DDB(double amount, int age) {
        AgeCategory ageCategory = AgeCategory.of(age, limits);
        double limit = limits.get(ageCategory.isSenior()
                ? LimitKey.SECTION_80DDB_SENIOR_CITIZEN : LimitKey.SECTION_80DDB_NORMAL);
        return capped(amount, limit, "Section 80DDB deduction exceeds statutory limit of " + rupees(limit)
                + " for " + ageCategory.getDescription() + ".");
    }
    
    /**
     * Section 80EEB: interest on an electric vehicle loan.
     */
    public ValidationOutcome validateSection80EEB(double amount) {
        double limit = limits.get(LimitKey.SECTION_80EEB_LIMIT);
        return capped(amount, limit, "Section 80EEB deduction exceeds statutory limit of " + rupees(limit) + ".");
    }
    
    /**
     * Section 80U: self disability. Severe disability raises the ceiling.
     */
    public ValidationOutcome validateSection80U(double amount, double disabilityPercentage) {
        boolean severe = isSevere(disabilityPercentage);
        double limit = limits.get(severe ? LimitKey.SECTION_80U_SEVERE : LimitKey.SECTION_80U_NORMAL);
        return capped(amount, limit, "Section 80U deduction exceeds statutory limit of " + rupees(limit)
                + (severe ? " for severe disability" : "") + ".");
    }
    
    private double section80DLimit(Section80DType category, AgeCategory ageCategory) {
        if (category == Section80DType.SELF_FAMILY) {
            return limits.get(ageCategory.isSenior()
                    ? LimitKey.SECTION_80D_SELF_FAMILY_60_PLUS : LimitKey.SECTION_80D_SELF_FAMILY_BELOW_60);
        }
        return limits.get(ageCategory.isSenior()
                ? LimitKey.SECTION_80D_PARENTS_60_PLUS : LimitKey.SECTION_80D_PARENTS_BELOW_60);
    }
    
    private boolean isSevere(double disabilityPercentage) {
        return disabilityPercentage >= limits.get(LimitKey.SEVERE_DISABILITY_PERCENTAGE);
    }
    
    private ValidationOutcome capped(double amount, double limit, String warning) {
        return ValidationOutcome.builder()
                .warning(amount > limit ? warning : null)
                .limit(limit)
                .derivedValue(Math.min(Math.max(amount, 0), limit))
                .build();
    }
    
    private static String percent(double rate) {
        return Math.round(rate * 100) + "%";
    }
    
    private static String join(List<String> messages) {
        return messages.isEmpty() ? null : String.join(". ", messages);
    }
}

package com.demoPayroll.taxEngine.validation.service;

import com.demoPayroll.taxEngine.limits.model.LimitKey;
import com.demoPayroll.taxEngine.limits.model.LimitTable;
import com.demoPayroll.taxEngine.validation.model.CityCategory;
import com.demoPayroll.taxEngine.validation.model.HraExemption;
import com.demoPayroll.taxEngine.validation.model.LoanPerquisiteOutcome;
import com.demoPayroll.taxEngine.validation.model.ValidationOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

import static com.demoPayroll.taxEngine.validation.util.IndianNumberFormat.rupees;

/**
 * Salary allowances and perquisites with a statutory exemption.
 */
@Service
@RequiredArgsConstructor
public class AllowanceValidator {
    
    private final LimitTable limits;
    
    /**
     * Computes the HRA exemption as the least of the three statutory figures.
     * 
     * @param hra HRA received
     * @param basic Basic salary
     * @param da Dearness allowance
     * @param rentPaid Actual rent paid
     * @param cityCategory Metro or non-metro
     */
    public HraExemption validateHRA(double hra, double basic, double da, double rentPaid, CityCategory cityCategory) {
        double salary = basic + da;
        double cityRate = limits.get(cityCategory == CityCategory.METRO
                ? LimitKey.HRA_METRO_RATE : LimitKey.HRA_NON_METRO_RATE);
        
        double cityBasedLimit = salary * cityRate;
        double rentBasedLimit = Math.max(0, rentPaid - salary * limits.get(LimitKey.HRA_RENT_EXCESS_PERCENT));
        double exemption = Math.min(hra, Math.min(cityBasedLimit, rentBasedLimit));
        
        return HraExemption.builder()
                .exemption(exemption)
                .taxable(Math.max(0, rentPaid - exemption))
                .actualHra(hra)
                .cityBasedLimit(cityBasedLimit)
                .rentBasedLimit(rentBasedLimit)
                .cityCategory(cityCategory)
                .build();
    }
    
    /**
     * Warns when more journeys are claimed than the block allows.
     */
    public ValidationOutcome validateLTA(int claimedCount, double amount) {
        int maxJourneys = limits.getInt(LimitKey.LTA_MAX_JOURNEYS);
        if (claimedCount > maxJourneys) {
            return ValidationOutcome.warning("LTA claimed " + claimedCount + " times exceeds limit of " + maxJourneys
                    + " times in " + limits.getInt(LimitKey.LTA_BLOCK_YEARS) + " years. Excess claims may not be exempt.");
        }
        return ValidationOutcome.clean();
    }
    
    /**
     * Children's education allowance. The derived value is the exempt amount for the year.
     */
    public ValidationOutcome validateChildrenAllowances(int childrenCount, int months) {
        return childAllowance(childrenCount, months, LimitKey.CHILDREN_EDUCATION_ALLOWANCE_PER_CHILD,
                "education allowance");
    }
    
    /**
     * Hostel allowance, same child and month caps as the education allowance.
     */
    public ValidationOutcome validateHostelAllowance(int childrenCount, int months) {
        return childAllowance(childrenCount, months, LimitKey.HOSTEL_ALLOWANCE_PER_CHILD, "hostel allowance");
    }
    
    /**
     * Medical reimbursement above the exemption is taxable; the derived value is that excess.
     */
    public ValidationOutcome validateMedicalReimbursement(double amount) {
        double limit = limits.get(LimitKey.MEDICAL_REIMBURSEMENT_EXEMPTION);
        return excessOver(amount, limit, "Medical reimbursement exceeds exemption limit of " + rupees(limit)
                + ". Excess amount is taxable as a perquisite.");
    }
    
    /**
     * Gift vouchers above the exemption are taxable; the derived value is that excess.
     */
    public ValidationOutcome validateGiftVouchers(double amount) {
        double limit = limits.get(LimitKey.GIFT_VOUCHER_EXEMPTION);
        return excessOver(amount, limit, "Gift vouchers exceed exemption limit of " + rupees(limit)
                + ". Excess amount is taxable as a perquisite.");
    }
    
    public LoanPerquisiteOutcome validateInterestFreeLoan(double loanAmount) {
        boolean exempt = loanAmount <= limits.get(LimitKey.LOAN_EXEMPTION_LIMIT);
        return new LoanPerquisiteOutcome(exempt, exempt
                ? "Loan amount is exempt from perquisite tax"
                : "Loan amount exceeds exemption limit, perquisite value will be calculated");
    }
    
    private ValidationOutcome childAllowance(int childrenCount, int months, LimitKey rateKey, String label) {
        int maxChildren = limits.getInt(LimitKey.MAX_CHILDREN_FOR_EDUCATION);
        int maxMonths = limits.getInt(LimitKey.MAX_MONTHS_PER_YEAR);
        
        List<String> warnings = new ArrayList<>();
        if (childrenCount > maxChildren) {
            warnings.add("Children count exceeds limit of " + maxChildren + " for " + label);
        }
        if (months > maxMonths) {
            warnings.add("Months cannot exceed " + maxMonths);
        }
        
        int eligibleChildren = Math.max(0, Math.min(childrenCount, maxChildren));
        int eligibleMonths = Math.max(0, Math.min(months, maxMonths));
        return ValidationOutcome.builder()
                .warning(warnings.isEmpty() ? null : String.join(". ", warnings))
                .derivedValue(eligibleChildren * limits.get(rateKey) * eligibleMonths)
                .build();
    }
    
    private static ValidationOutcome excessOver(double amount, double limit, String warning) {
        return ValidationOutcome.builder()
                .warning(amount > limit ? warning : null)
                .limit(limit)
                .derivedValue(Math.max(0, amount - limit))
                .build();
    }
}

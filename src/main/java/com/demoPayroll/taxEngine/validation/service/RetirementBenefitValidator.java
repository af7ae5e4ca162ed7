package com.demoPayroll.taxEngine.validation.service;

import com.demoPayroll.taxEngine.limits.model.LimitKey;
import com.demoPayroll.taxEngine.limits.model.LimitTable;
import com.demoPayroll.taxEngine.validation.model.ValidationOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import static com.demoPayroll.taxEngine.validation.util.IndianNumberFormat.rupees;

/**
 * Exemption ceilings on retirement payouts. Derived value is the taxable part.
 */
@Service
@RequiredArgsConstructor
public class RetirementBenefitValidator {
    
    private final LimitTable limits;
    
    /**
     * Gratuity is fully exempt for government employees, otherwise capped.
     */
    public ValidationOutcome validateGratuity(double amount, boolean govtEmployee) {
        if (govtEmployee) {
            return ValidationOutcome.builder().derivedValue(0.0).build();
        }
        double limit = limits.get(LimitKey.GRATUITY_EXEMPTION_LIMIT);
        return taxableAbove(amount, limit, "Gratuity exceeds exemption limit of " + rupees(limit)
                + ". Excess amount is taxable.");
    }
    
    /**
     * Leave encashment is exempt only at retirement, and fully so for government employees.
     * 
     * @param duringEmployment true when encashed while still in service, which gets no exemption
     */
    public ValidationOutcome validateLeaveEncashment(double amount, boolean govtEmployee, boolean duringEmployment) {
        if (duringEmployment) {
            return ValidationOutcome.builder()
                    .info(amount > 0 ? "Leave encashed during employment is fully taxable" : null)
                    .derivedValue(Math.max(0, amount))
                    .build();
        }
        if (govtEmployee) {
            return ValidationOutcome.builder().derivedValue(0.0).build();
        }
        double limit = limits.get(LimitKey.LEAVE_ENCASHMENT_EXEMPTION_LIMIT);
        return taxableAbove(amount, limit, "Leave encashment exceeds exemption limit of " + rupees(limit)
                + ". Excess amount is taxable.");
    }
    
    public ValidationOutcome validateVrs(double amount) {
        double limit = limits.get(LimitKey.VRS_EXEMPTION_LIMIT);
        return taxableAbove(amount, limit, "VRS compensation exceeds exemption limit of " + rupees(limit)
                + ". Excess amount is taxable.");
    }
    
    private static ValidationOutcome taxableAbove(double amount, double limit, String warning) {
        return ValidationOutcome.builder()
                .warning(amount > limit ? warning : null)
                .limit(limit)
                .derivedValue(Math.max(0, amount - limit))
                .build();
    }
}

package com.demoPayroll.taxEngine.validation.service;

import com.demoPayroll.taxEngine.limits.model.LimitKey;
import com.demoPayroll.taxEngine.limits.model.LimitTable;
import com.demoPayroll.taxEngine.validation.model.ValidationOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import static com.demoPayroll.taxEngine.validation.util.IndianNumberFormat.rupees;

/**
 * Sanity bounds shared by all sections: amounts, ages and percentages.
 */
@Service
@RequiredArgsConstructor
public class GeneralLimitValidator {
    
    private final LimitTable limits;
    
    /**
     * Checks an amount against the generic sanity ceiling.
     */
    public ValidationOutcome validateAmount(double amount) {
        return validateAmount(amount, limits.get(LimitKey.MAX_SALARY_COMPONENT));
    }
    
    public ValidationOutcome validateAmount(double amount, double maxLimit) {
        if (amount < 0) {
            return ValidationOutcome.warning("Amount cannot be negative");
        }
        if (amount > maxLimit) {
            return ValidationOutcome.builder()
                    .warning("Amount exceeds recommended limit of " + rupees(maxLimit))
                    .limit(maxLimit)
                    .build();
        }
        return ValidationOutcome.clean();
    }
    
    public ValidationOutcome validateAge(int age) {
        int minAge = limits.getInt(LimitKey.MIN_AGE);
        int maxAge = limits.getInt(LimitKey.MAX_AGE);
        if (age < minAge) {
            return ValidationOutcome.warning("Age is below typical working age of " + minAge);
        }
        if (age > maxAge) {
            return ValidationOutcome.warning("Age exceeds typical limit of " + maxAge);
        }
        return ValidationOutcome.clean();
    }
    
    public ValidationOutcome validatePercentage(double percentage) {
        if (percentage < 0 || percentage > 100) {
            return ValidationOutcome.warning("Percentage should be between 0 and 100");
        }
        return ValidationOutcome.clean();
    }
}

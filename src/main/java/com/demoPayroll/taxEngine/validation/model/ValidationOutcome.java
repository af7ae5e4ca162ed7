package com.demoPayroll.taxEngine.validation.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Advisory result of a statutory check for one field or section.
 * 
 * Statutory checks never block submission, so {@link #isValid()} is always true;
 * a null {@code warning} means the value is within statutory bounds.
 */
@Getter
@Builder
@ToString
public class ValidationOutcome {
    
    /**
     * Advisory text when the value exceeds a statutory bound, otherwise null.
     */
    private final String warning;
    
    /**
     * Informational text (e.g., remaining limit), independent of the warning.
     */
    private final String info;
    
    /**
     * Statutory ceiling that was applied, where the check resolves one.
     */
    private final Double limit;
    
    /**
     * Headroom left under the ceiling (Section 80C).
     */
    private final Double remainingLimit;
    
    /**
     * Figure derived from the input: exempt or taxable portion, allowed deduction.
     */
    private final Double derivedValue;
    
    public boolean isValid() {
        return true;
    }
    
    public boolean hasWarning() {
        return warning != null;
    }
    
    public static ValidationOutcome clean() {
        return ValidationOutcome.builder().build();
    }
    
    public static ValidationOutcome warning(String warning) {
        return ValidationOutcome.builder().warning(warning).build();
    }
}

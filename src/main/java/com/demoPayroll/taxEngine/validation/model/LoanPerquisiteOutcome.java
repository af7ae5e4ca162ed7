package com.demoPayroll.taxEngine.validation.model;

/**
 * Whether an interest-free or concessional loan stays within the perquisite exemption.
 */
public record LoanPerquisiteOutcome(boolean exempt, String message) {
    
    public boolean isValid() {
        return true;
    }
}

package com.demoPayroll.taxEngine.util;

/**
 * Masks employee identifiers before they reach a log line.
 */
public final class EmployeeIdMasker {
    
    private static final int VISIBLE = 2;
    private static final String FULLY_MASKED = "****";
    
    private EmployeeIdMasker() {}
    
    /**
     * Keeps the first and last two characters and masks every character between them,
     * so the masked value has the same length as the original.
     * 
     * @param employeeId Employee identifier, may be null
     * @return e.g. "EMP00107" becomes "EM****07"; ids of four characters or fewer are fully masked
     */
    public static String mask(String employeeId) {
        if (employeeId == null || employeeId.isBlank() || employeeId.length() <= VISIBLE * 2) {
            return FULLY_MASKED;
        }
        int hidden = employeeId.length() - VISIBLE * 2;
        return employeeId.substring(0, VISIBLE) + "*".repeat(hidden)
                + employeeId.substring(employeeId.length() - VISIBLE);
    }
}

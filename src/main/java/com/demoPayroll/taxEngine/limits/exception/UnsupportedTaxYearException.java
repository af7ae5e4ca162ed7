package com.demoPayroll.taxEngine.limits.exception;

/**
 * Exception thrown when no usable limit table exists for the requested tax year.
 */
public class UnsupportedTaxYearException extends RuntimeException {
    
    private final String taxYear;
    
    public UnsupportedTaxYearException(String taxYear, String message) {
        super(message);
        this.taxYear = taxYear;
    }
    
    public UnsupportedTaxYearException(String taxYear, String message, Throwable cause) {
        super(message, cause);
        this.taxYear = taxYear;
    }
    
    public String getTaxYear() {
        return taxYear;
    }
}

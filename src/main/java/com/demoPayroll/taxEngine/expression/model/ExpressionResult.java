package com.demoPayroll.taxEngine.expression.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of evaluating a calculator expression.
 * 
 * {@code result} is 0 whenever {@code valid} is false.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExpressionResult {
    
    private final boolean valid;
    
    /**
     * Evaluated value rounded to 2 decimal places.
     */
    private final double result;
    
    /**
     * Reason for rejection, null on success.
     */
    private final String error;
    
    public static ExpressionResult success(double result) {
        return new ExpressionResult(true, result, null);
    }
    
    public static ExpressionResult failure(String error) {
        return new ExpressionResult(false, 0, error);
    }
}

package com.demoPayroll.taxEngine.expression.model;

/**
 * Structural pre-check of a calculator expression. {@code message} is empty when valid.
 */
public record ExpressionCheck(boolean valid, String message) {
    
    public static ExpressionCheck ok() {
        return new ExpressionCheck(true, "");
    }
    
    public static ExpressionCheck rejected(String message) {
        return new ExpressionCheck(false, message);
    }
}

package com.demoPayroll.taxEngine.expression.exception;

/**
 * Raised by the arithmetic parser on malformed input.
 * Never leaves the expression package: callers receive an invalid result instead.
 */
public class ExpressionSyntaxException extends RuntimeException {
    
    private final int position;
    
    public ExpressionSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }
    
    public int getPosition() {
        return position;
    }
}

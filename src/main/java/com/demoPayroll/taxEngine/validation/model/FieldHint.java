package com.demoPayroll.taxEngine.validation.model;

/**
 * Real-time hint rendered next to a single input.
 */
public record FieldHint(HintType type, String message) {
    
    public enum HintType {
        WARNING,
        INFO
    }
    
    public static FieldHint warning(String message) {
        return new FieldHint(HintType.WARNING, message);
    }
    
    public static FieldHint info(String message) {
        return new FieldHint(HintType.INFO, message);
    }
}

package com.demoPayroll.taxEngine.expression.model;

import java.util.Map;

/**
 * A section with its calculator expressions replaced by their values.
 * 
 * @param values Copy of the section; failing expressions keep their raw text
 * @param errors Dotted field path to error message, for expressions that failed
 */
public record ResolvedFields(Map<String, Object> values, Map<String, String> errors) {
    
    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}

package com.demoPayroll.taxEngine.engine.model;

import java.util.Map;

/**
 * Backend record ready to hand to the API client.
 * 
 * @param backendRecord Nested record; a failed expression becomes 0 in typed sections and keeps its text in pass-through sections
 * @param expressionErrors "section.field" path to error for those fields
 */
public record PreparedRecord(Map<String, Object> backendRecord, Map<String, String> expressionErrors) {
    
    public boolean hasExpressionErrors() {
        return !expressionErrors.isEmpty();
    }
}

package com.demoPayroll.taxEngine.validation.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Warnings for a whole declaration, keyed like the declaration itself.
 * 
 * Top-level values are either a message (e.g., {@code emp_age}) or a map of
 * field key to message for a section. Only fields that produced a message appear;
 * an empty map means a clean declaration.
 */
@Getter
@ToString
public class AggregateWarnings {
    
    private final Map<String, Object> warnings;
    
    public AggregateWarnings(Map<String, Object> warnings) {
        this.warnings = Collections.unmodifiableMap(new LinkedHashMap<>(warnings));
    }
    
    /**
     * Always true: the aggregate check never blocks submission.
     */
    public boolean isValid() {
        return true;
    }
    
    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
    
    /**
     * Messages for one section, empty when the section is clean or has a scalar entry.
     */
    @SuppressWarnings("unchecked")
    public Map<String, String> section(String sectionKey) {
        Object value = warnings.get(sectionKey);
        return value instanceof Map ? (Map<String, String>) value : Map.of();
    }
}

package com.demoPayroll.taxEngine.normalizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattened, fully defaulted view of a declaration, as consumed by the form layer
 * and the validators.
 * 
 * Every {@link DeclarationSection} is always present with every default key.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class TaxationFormRecord {
    
    private String employeeId;
    
    /**
     * Employee age in years; the form layer reads it as {@code emp_age}.
     */
    private int age;
    
    /**
     * Tax regime: "old" or "new".
     */
    private String regime;
    
    /**
     * Tax year label (e.g., "2024-2025").
     */
    private String taxYear;
    
    private boolean govtEmployee;
    
    /**
     * Section key to defaulted section contents.
     */
    @Builder.Default
    private Map<DeclarationSection, Map<String, Object>> sections = new EnumMap<>(DeclarationSection.class);
    
    /**
     * Optional top-level entries carried through unchanged
     * (multiple_house_properties, monthly_payroll, periodic_salary_income, unknown keys).
     */
    @Builder.Default
    private Map<String, Object> passThrough = new LinkedHashMap<>();
    
    public Map<String, Object> getSection(DeclarationSection section) {
        Map<String, Object> contents = sections.get(section);
        return contents != null ? contents : Map.of();
    }
}

package com.demoPayroll.taxEngine.limits.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * JSON shape of a limit table resource ({@code limits/<tax-year>.json}).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LimitTableDocument {
    
    /**
     * Tax year label, e.g. "2024-2025".
     */
    private String taxYear;
    
    /**
     * Limit name to value. Names match {@link LimitKey} constants.
     */
    private Map<String, Double> limits;
}

package com.demoPayroll.taxEngine.validation.model;

import com.demoPayroll.taxEngine.limits.model.LimitKey;
import com.demoPayroll.taxEngine.limits.model.LimitTable;

/**
 * Statutory age bands.
 */
public enum AgeCategory {
    
    BELOW_60("individuals below 60"),
    SENIOR_CITIZEN("senior citizens"),
    SUPER_SENIOR_CITIZEN("super senior citizens");
    
    private final String description;
    
    AgeCategory(String description) {
        this.description = description;
    }
    
    public String getDescription() {
        return description;
    }
    
    public boolean isSenior() {
        return this != BELOW_60;
    }
    
    public static AgeCategory of(int age, LimitTable limits) {
        if (age >= limits.getInt(LimitKey.SUPER_SENIOR_CITIZEN_AGE)) {
            return SUPER_SENIOR_CITIZEN;
        }
        if (age >= limits.getInt(LimitKey.SENIOR_CITIZEN_AGE)) {
            return SENIOR_CITIZEN;
        }
        return BELOW_60;
    }
}

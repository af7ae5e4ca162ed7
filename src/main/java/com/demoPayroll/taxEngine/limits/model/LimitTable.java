package com.demoPayroll.taxEngine.limits.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Statutory constants for exactly one tax year.
 * 
 * Immutable once built: the backing map is copied on construction and only
 * exposed read-only, so a single instance is shared by every validator.
 */
public final class LimitTable {
    
    private final String taxYear;
    private final Map<LimitKey, Double> limits;
    
    private LimitTable(String taxYear, Map<LimitKey, Double> limits) {
        this.taxYear = taxYear;
        this.limits = Collections.unmodifiableMap(new EnumMap<>(limits));
    }
    
    /**
     * Builds a table, requiring a value for every {@link LimitKey}.
     * 
     * @throws IllegalArgumentException if a key is missing or a value is null
     */
    public static LimitTable of(String taxYear, Map<LimitKey, Double> limits) {
        if (taxYear == null || taxYear.isBlank()) {
            throw new IllegalArgumentException("Tax year is required for a limit table");
        }
        for (LimitKey key : LimitKey.values()) {
            if (limits.get(key) == null) {
                throw new IllegalArgumentException("Limit table " + taxYear + " is missing value for " + key);
            }
        }
        return new LimitTable(taxYear, limits);
    }
    
    public String getTaxYear() {
        return taxYear;
    }
    
    public double get(LimitKey key) {
        return limits.get(key);
    }
    
    /**
     * Integral view of a count or threshold constant (ages, journeys, children).
     */
    public int getInt(LimitKey key) {
        return (int) Math.round(limits.get(key));
    }
    
    public Map<LimitKey, Double> asMap() {
        return limits;
    }
    
    @Override
    public String toString() {
        return "LimitTable{taxYear=" + taxYear + ", keys=" + limits.size() + "}";
    }
}

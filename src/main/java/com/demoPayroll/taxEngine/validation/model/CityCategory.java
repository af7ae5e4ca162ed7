package com.demoPayroll.taxEngine.validation.model;

import java.util.Set;

/**
 * City classification used by the HRA exemption rate.
 */
public enum CityCategory {
    
    METRO("metro"),
    NON_METRO("non_metro");
    
    private static final Set<String> METRO_CITIES = Set.of("Delhi", "Mumbai", "Kolkata", "Chennai");
    
    private final String code;
    
    CityCategory(String code) {
        this.code = code;
    }
    
    public String getCode() {
        return code;
    }
    
    /**
     * Classifies a city by name. Only the four statutory metros count as metro.
     */
    public static CityCategory fromCityName(String city) {
        return city != null && METRO_CITIES.contains(city.trim()) ? METRO : NON_METRO;
    }
    
    /**
     * Reads a stored city type ("metro", "non_metro", "non-metro"). Anything else is non-metro.
     */
    public static CityCategory fromCode(String code) {
        return code != null && METRO.code.equalsIgnoreCase(code.trim()) ? METRO : NON_METRO;
    }
}

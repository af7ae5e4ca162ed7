package com.demoPayroll.taxEngine.validation.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * HRA exemption computed as the least of the actual HRA, the city-rate share of
 * (basic + DA), and rent paid in excess of 10% of (basic + DA).
 */
@Getter
@Builder
@ToString
public class HraExemption {
    
    private final double exemption;
    
    /**
     * Rent paid not covered by the exemption, floored at zero.
     */
    private final double taxable;
    
    private final double actualHra;
    private final double cityBasedLimit;
    private final double rentBasedLimit;
    private final CityCategory cityCategory;
    
    public boolean isValid() {
        return true;
    }
}

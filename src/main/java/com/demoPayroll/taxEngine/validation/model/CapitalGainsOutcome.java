package com.demoPayroll.taxEngine.validation.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Special-rate tax on equity capital gains (sections 111A and 112A).
 */
@Getter
@Builder
@ToString
public class CapitalGainsOutcome {
    
    private final double stcg111aTax;
    
    /**
     * Long-term gains above the annual exemption.
     */
    private final double taxableLtcg112a;
    
    private final double ltcg112aTax;
    
    /**
     * Unused part of the LTCG exemption.
     */
    private final double unusedLtcgExemption;
    
    private final String info;
    
    public boolean isValid() {
        return true;
    }
    
    public double getTotalTax() {
        return stcg111aTax + ltcg112aTax;
    }
}

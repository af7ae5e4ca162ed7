package com.demoPayroll.taxEngine.validation.service;

import com.demoPayroll.taxEngine.limits.model.LimitKey;
import com.demoPayroll.taxEngine.limits.model.LimitTable;
import com.demoPayroll.taxEngine.validation.model.CapitalGainsOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import static com.demoPayroll.taxEngine.validation.util.IndianNumberFormat.rupees;

@Service
@RequiredArgsConstructor
public class CapitalGainsValidator {
    
    private final LimitTable limits;
    
    /**
     * Special-rate tax on listed equity gains: a flat rate under 111A, and a flat
     * rate above the annual exemption under 112A. Negative gains count as zero.
     */
    public CapitalGainsOutcome validateCapitalGains(double stcg111a, double ltcg112a) {
        double exemption = limits.get(LimitKey.LTCG_EXEMPTION_LIMIT);
        double shortTerm = Math.max(0, stcg111a);
        double longTerm = Math.max(0, ltcg112a);
        double taxableLongTerm = Math.max(0, longTerm - exemption);
        
        double stcgTax = shortTerm * limits.get(LimitKey.STCG_111A_RATE);
        double ltcgTax = taxableLongTerm * limits.get(LimitKey.LTCG_112A_RATE);
        
        String info = null;
        if (stcgTax + ltcgTax > 0) {
            info = "Capital gains tax at special rates: " + rupees(stcgTax + ltcgTax)
                    + " (STCG 111A: " + rupees(stcgTax) + ", LTCG 112A: " + rupees(ltcgTax) + ")";
        } else if (longTerm > 0) {
            info = "LTCG of " + rupees(longTerm) + " is within the exemption of " + rupees(exemption);
        }
        
        return CapitalGainsOutcome.builder()
                .stcg111aTax(stcgTax)
                .taxableLtcg112a(taxableLongTerm)
                .ltcg112aTax(ltcgTax)
                .unusedLtcgExemption(Math.max(0, exemption - longTerm))
                .info(info)
                .build();
    }
}

package com.demoPayroll.taxEngine.limits.config;

import com.demoPayroll.taxEngine.limits.model.LimitTable;
import com.demoPayroll.taxEngine.limits.service.LimitTableLoader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the active limit table. The tax year is the engine's only external setting.
 */
@Configuration
public class LimitTableConfig {
    
    @Value("${tax-engine.tax-year:2024-2025}")
    private String taxYear;
    
    @Bean
    public LimitTable activeLimitTable(LimitTableLoader limitTableLoader) {
        return limitTableLoader.load(taxYear);
    }
}

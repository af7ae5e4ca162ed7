package com.demoPayroll.taxEngine.limits.service;

import com.demoPayroll.taxEngine.limits.exception.UnsupportedTaxYearException;
import com.demoPayroll.taxEngine.limits.model.LimitKey;
import com.demoPayroll.taxEngine.limits.model.LimitTable;
import com.demoPayroll.taxEngine.limits.model.LimitTableDocument;
import com.demoPayroll.taxEngine.util.JsonFileLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;

/**
 * Loads statutory limit tables from classpath JSON resources.
 * 
 * One resource per tax year: {@code limits/<tax-year>.json}.
 */
@Slf4j
@Component
public class LimitTableLoader {
    
    private static final String RESOURCE_PATTERN = "limits/%s.json";
    
    /**
     * Loads and validates the table for a tax year.
     * 
     * @param taxYear Tax year label (e.g., "2024-2025")
     * @return Immutable limit table
     * @throws UnsupportedTaxYearException if the resource is absent, unreadable or incomplete
     */
    public LimitTable load(String taxYear) {
        if (taxYear == null || taxYear.isBlank()) {
            throw new UnsupportedTaxYearException(taxYear, "Tax year must not be blank");
        }
        
        String resourcePath = String.format(RESOURCE_PATTERN, taxYear.trim());
        LimitTableDocument document;
        try {
            document = JsonFileLoader.loadAsObject(resourcePath, LimitTableDocument.class);
        } catch (IOException e) {
            throw new UnsupportedTaxYearException(taxYear, "No limit table available for tax year " + taxYear, e);
        }
        
        if (document.getLimits() == null) {
            throw new UnsupportedTaxYearException(taxYear, "Limit table " + resourcePath + " has no limits section");
        }
        if (document.getTaxYear() != null && !document.getTaxYear().equals(taxYear.trim())) {
            throw new UnsupportedTaxYearException(taxYear,
                    "Limit table " + resourcePath + " declares tax year " + document.getTaxYear());
        }
        
        Map<LimitKey, Double> limits = new EnumMap<>(LimitKey.class);
        for (Map.Entry<String, Double> entry : document.getLimits().entrySet()) {
            LimitKey key = resolveKey(entry.getKey());
            if (key == null) {
                log.warn("Ignoring unknown limit '{}' in {}", entry.getKey(), resourcePath);
                continue;
            }
            limits.put(key, entry.getValue());
        }
        
        try {
            LimitTable table = LimitTable.of(taxYear.trim(), limits);
            log.info("Loaded limit table for tax year {} ({} limits)", table.getTaxYear(), table.asMap().size());
            return table;
        } catch (IllegalArgumentException e) {
            throw new UnsupportedTaxYearException(taxYear, e.getMessage(), e);
        }
    }
    
    private LimitKey resolveKey(String name) {
        try {
            return LimitKey.valueOf(name);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}

package com.demoPayroll.taxEngine.engine.service;

import com.demoPayroll.taxEngine.engine.model.PreparedRecord;
import com.demoPayroll.taxEngine.engine.model.TaxationReview;
import com.demoPayroll.taxEngine.expression.model.ResolvedFields;
import com.demoPayroll.taxEngine.expression.service.ExpressionFieldResolver;
import com.demoPayroll.taxEngine.normalizer.model.DeclarationSection;
import com.demoPayroll.taxEngine.normalizer.model.TaxationFormRecord;
import com.demoPayroll.taxEngine.normalizer.service.RecordNormalizer;
import com.demoPayroll.taxEngine.util.EmployeeIdMasker;
import com.demoPayroll.taxEngine.validation.model.AggregateWarnings;
import com.demoPayroll.taxEngine.validation.service.TaxationFormValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for callers of the engine.
 * 
 * Flow: normalize backend record -> resolve calculator expressions -> aggregate
 * validation. The reverse direction resolves expressions and converts the form
 * record back for persistence.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaxRuleEngine {
    
    private final RecordNormalizer recordNormalizer;
    private final ExpressionFieldResolver expressionFieldResolver;
    private final TaxationFormValidator taxationFormValidator;
    
    /**
     * Reviews a declaration as loaded from the backend.
     * 
     * @param backendRecord Decoded backend record, may be null or malformed
     * @param employeeId Employee the declaration belongs to
     */
    public TaxationReview review(Map<String, Object> backendRecord, String employeeId) {
        return reviewForm(recordNormalizer.toFormData(backendRecord, employeeId));
    }
    
    /**
     * Reviews a form record as edited in the form layer, where any field may hold
     * a calculator expression.
     */
    public TaxationReview reviewForm(TaxationFormRecord formRecord) {
        Map<String, String> expressionErrors = new LinkedHashMap<>();
        TaxationFormRecord resolved = resolveExpressions(formRecord, expressionErrors);
        AggregateWarnings warnings = taxationFormValidator.validateTaxationForm(resolved);
        
        log.debug("Reviewed declaration for employee {} - expression errors: {}, warning sections: {}",
                EmployeeIdMasker.mask(resolved.getEmployeeId()), expressionErrors.size(),
                warnings.getWarnings().keySet());
        
        return TaxationReview.builder()
                .formRecord(resolved)
                .expressionErrors(expressionErrors)
                .warnings(warnings)
                .build();
    }
    
    /**
     * Resolves expressions and converts the form record to the backend shape.
     */
    public PreparedRecord prepareForPersistence(TaxationFormRecord formRecord) {
        Map<String, String> expressionErrors = new LinkedHashMap<>();
        TaxationFormRecord resolved = resolveExpressions(formRecord, expressionErrors);
        if (!expressionErrors.isEmpty()) {
            log.warn("Persisting declaration for employee {} with unresolved expressions at {}",
                    EmployeeIdMasker.mask(resolved.getEmployeeId()), expressionErrors.keySet());
        }
        return new PreparedRecord(recordNormalizer.toBackendRecord(resolved), expressionErrors);
    }
    
    private TaxationFormRecord resolveExpressions(TaxationFormRecord formRecord, Map<String, String> errors) {
        Map<DeclarationSection, Map<String, Object>> sections = new EnumMap<>(DeclarationSection.class);
        for (DeclarationSection section : DeclarationSection.values()) {
            ResolvedFields fields = expressionFieldResolver.resolve(formRecord.getSection(section), section.getKey());
            sections.put(section, fields.values());
            errors.putAll(fields.errors());
        }
        return formRecord.toBuilder()
                .sections(sections)
                .build();
    }
}

package com.demoPayroll.taxEngine.normalizer.service;

import com.demoPayroll.taxEngine.limits.model.LimitTable;
import com.demoPayroll.taxEngine.normalizer.model.DeclarationSection;
import com.demoPayroll.taxEngine.normalizer.model.DefaultTaxationState;
import com.demoPayroll.taxEngine.normalizer.model.TaxationFormRecord;
import com.demoPayroll.taxEngine.normalizer.util.Coercions;
import com.demoPayroll.taxEngine.normalizer.util.StructuralMerge;
import com.demoPayroll.taxEngine.util.EmployeeIdMasker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Converts between the nested backend taxation record and the flat, fully
 * defaulted form record.
 * 
 * Backend records are decoded JSON: sections may be missing entirely and
 * amounts may arrive as decimal strings. The form record always carries every
 * default field with its declared type.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecordNormalizer {
    
    static final String EMPLOYEE_ID = "employee_id";
    static final String AGE = "age";
    static final String EMP_AGE = "emp_age";
    static final String REGIME_TYPE = "regime_type";
    static final String REGIME = "regime";
    static final String TAX_YEAR = "tax_year";
    static final String IS_GOVT_EMPLOYEE = "is_govt_employee";
    
    private static final Set<String> SCALAR_KEYS =
            Set.of(EMPLOYEE_ID, AGE, EMP_AGE, REGIME_TYPE, REGIME, TAX_YEAR, IS_GOVT_EMPLOYEE);
    
    private final LimitTable limitTable;
    
    /**
     * Transforms a backend record into the form record.
     * 
     * Never throws: a null record yields the default record, and any failure while
     * reading a malformed record is logged and also yields the default record.
     * 
     * @param backendRecord Decoded backend record, may be null
     * @param employeeId Employee the form is for; used when the record carries no id
     * @return Fully defaulted form record
     */
    public TaxationFormRecord toFormData(Map<String, Object> backendRecord, String employeeId) {
        String maskedId = EmployeeIdMasker.mask(employeeId);
        if (backendRecord == null) {
            log.debug("No backend record for employee {}, using defaults", maskedId);
            return defaultRecord(employeeId);
        }
        
        try {
            Map<DeclarationSection, Map<String, Object>> sections = new EnumMap<>(DeclarationSection.class);
            for (DeclarationSection section : DeclarationSection.values()) {
                sections.put(section, normalizeSection(section, backendRecord.get(section.getKey())));
            }
            
            Map<String, Object> passThrough = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : backendRecord.entrySet()) {
                if (!isKnownKey(entry.getKey())) {
                    passThrough.put(entry.getKey(), StructuralMerge.deepCopy(entry.getValue()));
                }
            }
            
            Object age = backendRecord.get(AGE) != null ? backendRecord.get(AGE) : backendRecord.get(EMP_AGE);
            TaxationFormRecord formRecord = TaxationFormRecord.builder()
                    .employeeId(Coercions.textAt(backendRecord, employeeId, EMPLOYEE_ID))
                    .age((int) Coercions.toNumber(age))
                    .regime(Coercions.textAt(backendRecord,
                            Coercions.textAt(backendRecord, DefaultTaxationState.DEFAULT_REGIME, REGIME),
                            REGIME_TYPE))
                    .taxYear(Coercions.textAt(backendRecord, limitTable.getTaxYear(), TAX_YEAR))
                    .govtEmployee(Coercions.toBoolean(backendRecord.get(IS_GOVT_EMPLOYEE)))
                    .sections(sections)
                    .passThrough(passThrough)
                    .build();
            
            log.debug("Normalized backend record for employee {} - sections present: {}, pass-through keys: {}",
                    maskedId, countPresentSections(backendRecord), passThrough.keySet());
            return formRecord;
            
        } catch (RuntimeException e) {
            log.error("Error transforming backend record for employee {}, falling back to defaults", maskedId, e);
            return defaultRecord(employeeId);
        }
    }
    
    /**
     * Collapses a form record back into the nested backend shape.
     * 
     * Every field of the form record is written to the path it was read from;
     * defaulted sections are written out in full. The two identity aliases are
     * normalized on write: an age read from {@code emp_age} is written as
     * {@code age}, and a regime read from {@code regime} as {@code regime_type}.
     */
    public Map<String, Object> toBackendRecord(TaxationFormRecord formRecord) {
        Map<String, Object> backendRecord = new LinkedHashMap<>();
        backendRecord.put(EMPLOYEE_ID, formRecord.getEmployeeId());
        backendRecord.put(AGE, formRecord.getAge());
        backendRecord.put(REGIME_TYPE, formRecord.getRegime());
        backendRecord.put(TAX_YEAR, formRecord.getTaxYear());
        backendRecord.put(IS_GOVT_EMPLOYEE, formRecord.isGovtEmployee());
        
        for (DeclarationSection section : DeclarationSection.values()) {
            Map<String, Object> contents = formRecord.getSection(section);
            Object value = section.getMergeMode() == DeclarationSection.MergeMode.OVERLAY
                    ? StructuralMerge.overlay(section.defaults(), contents)
                    : StructuralMerge.copyOf(contents);
            backendRecord.put(section.getKey(), value);
        }
        
        if (formRecord.getPassThrough() != null) {
            formRecord.getPassThrough().forEach((key, value) ->
                    backendRecord.putIfAbsent(key, StructuralMerge.deepCopy(value)));
        }
        return backendRecord;
    }
    
    /**
     * Complete default form record for an employee in the active tax year.
     */
    public TaxationFormRecord defaultRecord(String employeeId) {
        Map<DeclarationSection, Map<String, Object>> sections = new EnumMap<>(DeclarationSection.class);
        for (DeclarationSection section : DeclarationSection.values()) {
            sections.put(section, section.defaults());
        }
        return TaxationFormRecord.builder()
                .employeeId(employeeId)
                .age(0)
                .regime(DefaultTaxationState.DEFAULT_REGIME)
                .taxYear(limitTable.getTaxYear())
                .govtEmployee(false)
                .sections(sections)
                .passThrough(new LinkedHashMap<>())
                .build();
    }
    
    private Map<String, Object> normalizeSection(DeclarationSection section, Object source) {
        if (section.getMergeMode() == DeclarationSection.MergeMode.OVERLAY) {
            return StructuralMerge.overlay(section.defaults(), source);
        }
        Map<String, Object> sourceMap = Coercions.asMap(source);
        return sourceMap != null ? StructuralMerge.copyOf(sourceMap) : section.defaults();
    }
    
    private boolean isKnownKey(String key) {
        if (SCALAR_KEYS.contains(key)) {
            return true;
        }
        for (DeclarationSection section : DeclarationSection.values()) {
            if (section.getKey().equals(key)) {
                return true;
            }
        }
        return false;
    }
    
    private long countPresentSections(Map<String, Object> backendRecord) {
        long count = 0;
        for (DeclarationSection section : DeclarationSection.values()) {
            if (Coercions.asMap(backendRecord.get(section.getKey())) != null) {
                count++;
            }
        }
        return count;
    }
}

package com.demoPayroll.taxEngine.normalizer.model;

import java.util.Map;

/**
 * Object-valued sections of a declaration, with their wire key and merge behaviour.
 */
public enum DeclarationSection {
    
    SALARY_INCOME("salary_income", MergeMode.OVERLAY),
    OTHER_INCOME("other_income", MergeMode.OVERLAY),
    HOUSE_PROPERTY_INCOME("house_property_income", MergeMode.OVERLAY),
    CAPITAL_GAINS_INCOME("capital_gains_income", MergeMode.OVERLAY),
    RETIREMENT_BENEFITS("retirement_benefits", MergeMode.PASS_THROUGH),
    DEDUCTIONS("deductions", MergeMode.OVERLAY),
    PERQUISITES("perquisites", MergeMode.PASS_THROUGH);
    
    /**
     * How a present source section is combined with the section defaults.
     */
    public enum MergeMode {
        /**
         * Every default leaf is emitted; source leaves are coerced to the default's type.
         */
        OVERLAY,
        /**
         * The source section is copied structurally; defaults only apply when it is absent.
         */
        PASS_THROUGH
    }
    
    private final String key;
    private final MergeMode mergeMode;
    
    DeclarationSection(String key, MergeMode mergeMode) {
        this.key = key;
        this.mergeMode = mergeMode;
    }
    
    public String getKey() {
        return key;
    }
    
    public MergeMode getMergeMode() {
        return mergeMode;
    }
    
    /**
     * Fresh, mutable copy of this section's default shape.
     */
    public Map<String, Object> defaults() {
        return DefaultTaxationState.section(this);
    }
}

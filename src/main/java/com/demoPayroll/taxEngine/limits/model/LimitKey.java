package com.demoPayroll.taxEngine.limits.model;

/**
 * Names of the statutory constants a {@link LimitTable} must carry.
 * The enum constant name is the key used in the limit table JSON resources.
 */
public enum LimitKey {
    
    // Sanity bounds
    MAX_SALARY_COMPONENT,
    MIN_AGE,
    MAX_AGE,
    MAX_MONTHS_PER_YEAR,
    
    // Chapter VI-A deductions
    SECTION_80C_LIMIT,
    SECTION_80D_SELF_FAMILY_BELOW_60,
    SECTION_80D_SELF_FAMILY_60_PLUS,
    SECTION_80D_PARENTS_BELOW_60,
    SECTION_80D_PARENTS_60_PLUS,
    SECTION_80D_TOTAL_LIMIT,
    SECTION_80DD_NORMAL,
    SECTION_80DD_SEVERE,
    SECTION_80DDB_NORMAL,
    SECTION_80DDB_SENIOR_CITIZEN,
    SECTION_80EEB_LIMIT,
    SECTION_80U_NORMAL,
    SECTION_80U_SEVERE,
    SEVERE_DISABILITY_PERCENTAGE,
    SECTION_80CCD_1_LIMIT_PERCENT,
    SECTION_80CCD_1B_ADDITIONAL,
    SECTION_80CCD_2_EMPLOYER_LIMIT_PERCENT,
    
    // HRA
    HRA_METRO_RATE,
    HRA_NON_METRO_RATE,
    HRA_RENT_EXCESS_PERCENT,
    
    // Allowances and perquisites
    MEDICAL_REIMBURSEMENT_EXEMPTION,
    LTA_BLOCK_YEARS,
    LTA_MAX_JOURNEYS,
    CHILDREN_EDUCATION_ALLOWANCE_PER_CHILD,
    MAX_CHILDREN_FOR_EDUCATION,
    HOSTEL_ALLOWANCE_PER_CHILD,
    GIFT_VOUCHER_EXEMPTION,
    LOAN_EXEMPTION_LIMIT,
    
    // Capital gains
    LTCG_EXEMPTION_LIMIT,
    STCG_111A_RATE,
    LTCG_112A_RATE,
    
    // Retirement benefits
    GRATUITY_EXEMPTION_LIMIT,
    LEAVE_ENCASHMENT_EXEMPTION_LIMIT,
    VRS_EXEMPTION_LIMIT,
    
    STANDARD_DEDUCTION_NEW_REGIME,
    
    // Age categories
    SENIOR_CITIZEN_AGE,
    SUPER_SENIOR_CITIZEN_AGE
}

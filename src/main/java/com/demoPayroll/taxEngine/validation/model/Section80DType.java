package com.demoPayroll.taxEngine.validation.model;

/**
 * Whose health insurance premium a Section 80D claim covers.
 */
public enum Section80DType {
    
    SELF_FAMILY("self_family"),
    PARENTS("parents");
    
    private final String code;
    
    Section80DType(String code) {
        this.code = code;
    }
    
    public String getCode() {
        return code;
    }
    
    /**
     * @return the matching type, or null when the code is not recognized
     */
    public static Section80DType fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (Section80DType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        return null;
    }
}

package com.demoPayroll.taxEngine.engine.model;

import com.demoPayroll.taxEngine.normalizer.model.TaxationFormRecord;
import com.demoPayroll.taxEngine.validation.model.AggregateWarnings;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Everything the form layer needs to render a declaration: the normalized record
 * with calculator expressions resolved, expression errors and advisory warnings.
 */
@Getter
@Builder
@ToString
public class TaxationReview {
    
    private final TaxationFormRecord formRecord;
    
    /**
     * "section.field" path to error, for expressions that could not be evaluated.
     */
    private final Map<String, String> expressionErrors;
    
    private final AggregateWarnings warnings;
    
    /**
     * Always true; neither expression errors nor statutory warnings block review.
     */
    public boolean isValid() {
        return true;
    }
    
    public boolean hasExpressionErrors() {
        return !expressionErrors.isEmpty();
    }
}

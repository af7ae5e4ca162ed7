package com.demoPayroll.taxEngine.expression.service;

import com.demoPayroll.taxEngine.expression.model.ExpressionResult;
import com.demoPayroll.taxEngine.expression.model.ResolvedFields;
import com.demoPayroll.taxEngine.normalizer.util.Coercions;
import com.demoPayroll.taxEngine.normalizer.util.StructuralMerge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Replaces calculator expressions found anywhere in a form section with their values.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExpressionFieldResolver {
    
    private final ExpressionEvaluator expressionEvaluator;
    
    /**
     * Resolves every {@code =}-prefixed string leaf of {@code section}, descending
     * into nested maps. The input is not modified.
     * 
     * @param section Section contents
     * @param pathPrefix Prefix for error paths (e.g., "salary_income"), may be empty
     */
    public ResolvedFields resolve(Map<String, Object> section, String pathPrefix) {
        Map<String, String> errors = new LinkedHashMap<>();
        Map<String, Object> values = resolveMap(section, pathPrefix == null ? "" : pathPrefix, errors);
        if (!errors.isEmpty()) {
            log.debug("Unresolved calculator expressions at {}", errors.keySet());
        }
        return new ResolvedFields(values, errors);
    }
    
    private Map<String, Object> resolveMap(Map<String, Object> source, String path, Map<String, String> errors) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            String fieldPath = path.isEmpty() ? key : path + "." + key;
            Map<String, Object> nested = Coercions.asMap(value);
            if (nested != null) {
                resolved.put(key, resolveMap(nested, fieldPath, errors));
            } else if (expressionEvaluator.isCalculatorExpression(value)) {
                ExpressionResult result = expressionEvaluator.evaluate((String) value);
                if (result.isValid()) {
                    resolved.put(key, result.getResult());
                } else {
                    errors.put(fieldPath, result.getError());
                    resolved.put(key, value);
                }
            } else {
                resolved.put(key, StructuralMerge.deepCopy(value));
            }
        });
        return resolved;
    }
}

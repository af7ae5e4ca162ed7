package com.demoPayroll.taxEngine.normalizer.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Overlays decoded source sections onto their default shape.
 * 
 * The default map is authoritative for which keys exist and what type each leaf has:
 * numeric defaults become numbers, string defaults stay strings, boolean defaults
 * stay booleans, nested default maps are overlaid recursively. Source keys the
 * defaults do not know about are copied as-is so nothing populated is lost.
 */
public final class StructuralMerge {
    
    private StructuralMerge() {}
    
    /**
     * Builds a new map from {@code defaults} with any values present in {@code source}
     * laid over them. Neither argument is modified.
     * 
     * @param defaults Default shape of the section
     * @param source   Decoded source section; anything that is not a map counts as absent
     */
    public static Map<String, Object> overlay(Map<String, Object> defaults, Object source) {
        Map<String, Object> sourceMap = Coercions.asMap(source);
        Map<String, Object> result = new LinkedHashMap<>();
        
        for (Map.Entry<String, Object> entry : defaults.entrySet()) {
            Object sourceValue = sourceMap != null ? sourceMap.get(entry.getKey()) : null;
            result.put(entry.getKey(), coerce(entry.getValue(), sourceValue));
        }
        
        if (sourceMap != null) {
            for (Map.Entry<String, Object> entry : sourceMap.entrySet()) {
                if (!result.containsKey(entry.getKey())) {
                    result.put(entry.getKey(), deepCopy(entry.getValue()));
                }
            }
        }
        return result;
    }
    
    /**
     * Copies nested maps and lists; leaves are shared (they are immutable scalars).
     */
    public static Object deepCopy(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((key, nested) -> copy.put(String.valueOf(key), deepCopy(nested)));
            return copy;
        }
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(deepCopy(item)));
            return copy;
        }
        return value;
    }
    
    /**
     * Typed variant of {@link #deepCopy(Object)} for maps.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> copyOf(Map<String, Object> map) {
        return (Map<String, Object>) deepCopy(map);
    }
    
    @SuppressWarnings("unchecked")
    private static Object coerce(Object defaultValue, Object sourceValue) {
        if (defaultValue instanceof Map) {
            return overlay((Map<String, Object>) defaultValue, sourceValue);
        }
        if (sourceValue == null) {
            return deepCopy(defaultValue);
        }
        if (defaultValue instanceof Number) {
            return Coercions.toNumber(sourceValue);
        }
        if (defaultValue instanceof Boolean) {
            return Coercions.toBoolean(sourceValue);
        }
        if (defaultValue instanceof String) {
            return sourceValue instanceof String ? sourceValue : String.valueOf(sourceValue);
        }
        return deepCopy(sourceValue);
    }
}

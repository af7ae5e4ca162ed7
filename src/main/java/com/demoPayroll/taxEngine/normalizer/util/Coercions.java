package com.demoPayroll.taxEngine.normalizer.util;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient conversions for values decoded from backend JSON, where amounts
 * frequently arrive as decimal strings ("125000.00").
 */
public final class Coercions {
    
    private static final Pattern LEADING_NUMBER =
            Pattern.compile("^\\s*([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)");
    
    private Coercions() {}
    
    /**
     * Converts a decoded value to a number. Strings are read up to the first
     * non-numeric character; null, blanks, booleans and anything unparseable give 0.
     */
    public static double toNumber(Object value) {
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            return Double.isFinite(number) ? number : 0;
        }
        if (value instanceof String) {
            Double number = leadingNumber((String) value);
            return number != null ? number : 0;
        }
        return 0;
    }
    
    /**
     * Reads the number a string starts with ("12.5abc" gives 12.5).
     * 
     * @return the number, or null when the string does not start with one
     */
    public static Double leadingNumber(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = LEADING_NUMBER.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        double number = Double.parseDouble(matcher.group(1));
        return Double.isFinite(number) ? number : null;
    }
    
    /**
     * Truthiness of a decoded value: booleans as-is, "true" (any case), non-zero numbers.
     */
    public static boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean(((String) value).trim());
        }
        return false;
    }
    
    /**
     * Returns the value as a string map, or null when it is not an object.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }
    
    /**
     * Follows a key path through nested maps. Returns null when any step is missing.
     */
    public static Object valueAt(Map<String, Object> root, String... path) {
        Object current = root;
        for (String key : path) {
            Map<String, Object> map = asMap(current);
            if (map == null) {
                return null;
            }
            current = map.get(key);
        }
        return current;
    }
    
    /**
     * Numeric value at a key path, 0 when missing.
     */
    public static double amountAt(Map<String, Object> root, String... path) {
        return toNumber(valueAt(root, path));
    }
    
    /**
     * String value at a key path, or {@code fallback} when missing or blank.
     */
    public static String textAt(Map<String, Object> root, String fallback, String... path) {
        Object value = valueAt(root, path);
        if (value == null) {
            return fallback;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? fallback : text;
    }
}

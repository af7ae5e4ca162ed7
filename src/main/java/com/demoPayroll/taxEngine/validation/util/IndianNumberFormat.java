package com.demoPayroll.taxEngine.validation.util;

import com.demoPayroll.taxEngine.normalizer.util.Coercions;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Formatting and parsing helpers for Indian-style amounts (lakh grouping: 1,50,000).
 */
public final class IndianNumberFormat {
    
    private static final String RUPEE = "₹";
    
    private IndianNumberFormat() {}
    
    /**
     * Formats with Indian digit grouping and at most two decimals, dropping trailing zeros.
     * 
     * @param amount Amount to format
     * @return e.g. "1,50,000" or "12,34,567.5"
     */
    public static String format(double amount) {
        if (Double.isNaN(amount) || Double.isInfinite(amount)) {
            return "";
        }
        BigDecimal value = BigDecimal.valueOf(amount).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros();
        boolean negative = value.signum() < 0;
        String plain = value.abs().toPlainString();
        
        int dot = plain.indexOf('.');
        String integerPart = dot >= 0 ? plain.substring(0, dot) : plain;
        String fractionPart = dot >= 0 ? plain.substring(dot) : "";
        
        StringBuilder grouped = new StringBuilder();
        int length = integerPart.length();
        if (length <= 3) {
            grouped.append(integerPart);
        } else {
            String head = integerPart.substring(0, length - 3);
            String tail = integerPart.substring(length - 3);
            int firstGroup = head.length() % 2 == 0 ? 2 : 1;
            grouped.append(head, 0, firstGroup);
            for (int i = firstGroup; i < head.length(); i += 2) {
                grouped.append(',').append(head, i, i + 2);
            }
            grouped.append(',').append(tail);
        }
        return (negative ? "-" : "") + grouped + fractionPart;
    }
    
    /**
     * Rupee-prefixed variant of {@link #format(double)}, used in advisory messages.
     */
    public static String rupees(double amount) {
        return RUPEE + format(amount);
    }
    
    /**
     * Parses a grouped amount such as "1,50,000.50"; blank or unparseable input gives 0.
     */
    public static double parse(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return Coercions.toNumber(text.replace(",", ""));
    }
    
    /**
     * Strips everything but digits and the decimal point, then caps at {@code maxLimit}.
     */
    public static double sanitizeNumericInput(Object value, double maxLimit) {
        if (value == null) {
            return 0;
        }
        String clean = String.valueOf(value).replaceAll("[^0-9.]", "");
        return Math.min(Coercions.toNumber(clean), maxLimit);
    }
}

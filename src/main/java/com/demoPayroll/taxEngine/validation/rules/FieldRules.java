package com.demoPayroll.taxEngine.validation.rules;

import com.demoPayroll.taxEngine.limits.model.LimitKey;
import com.demoPayroll.taxEngine.limits.model.LimitTable;
import com.demoPayroll.taxEngine.normalizer.util.Coercions;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Set;
import java.util.regex.Pattern;

import static com.demoPayroll.taxEngine.validation.util.IndianNumberFormat.rupees;

/**
 * Structural format rules for single form inputs.
 * 
 * Each rule returns null when the value is acceptable, or a message to show.
 * Unlike the statutory checks these may block submission. A null or empty value
 * passes every rule except {@link #required(String)}.
 */
@Component
@RequiredArgsConstructor
public class FieldRules {
    
    private static final Pattern NUMERIC = Pattern.compile("^\\s*[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?\\s*$");
    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern PAN = Pattern.compile("^[A-Z]{5}[0-9]{4}[A-Z]{1}$");
    private static final Pattern AADHAR = Pattern.compile("^[0-9]{12}$");
    
    private static final Set<String> TAX_REGIMES = Set.of("old", "new");
    private static final Set<String> FILING_STATUSES = Set.of("draft", "filed", "approved", "rejected", "pending");
    
    private static final int MIN_FINANCIAL_YEAR = 2000;
    private static final double MAX_INTEREST_RATE = 50;
    private static final double DEFAULT_SALARY_COMPONENT_LIMIT = 10000000;
    
    private final LimitTable limits;
    private final Clock clock;
    
    public String required(String value) {
        return value == null || value.isEmpty() ? "This field is required" : null;
    }
    
    /**
     * Non-negative number.
     */
    public String numeric(String value) {
        if (isEmpty(value)) {
            return null;
        }
        if (!NUMERIC.matcher(value).matches()) {
            return "Please enter a valid positive number";
        }
        double number = Double.parseDouble(value.trim());
        if (!Double.isFinite(number) || number < 0) {
            return "Please enter a valid positive number";
        }
        return null;
    }
    
    public String email(String value) {
        return matchesOrEmpty(EMAIL, value) ? null : "Please enter a valid email address";
    }
    
    /**
     * Permanent Account Number: five upper-case letters, four digits, one upper-case letter.
     */
    public String pan(String value) {
        return matchesOrEmpty(PAN, value) ? null : "Please enter a valid PAN number (e.g., ABCDE1234F)";
    }
    
    public String aadhar(String value) {
        return matchesOrEmpty(AADHAR, value) ? null : "Please enter a valid 12-digit Aadhar number";
    }
    
    public String age(String value) {
        if (isEmpty(value)) {
            return null;
        }
        int minAge = limits.getInt(LimitKey.MIN_AGE);
        int maxAge = limits.getInt(LimitKey.MAX_AGE);
        Double age = Coercions.leadingNumber(value);
        if (age == null || (int) age.doubleValue() < minAge || (int) age.doubleValue() > maxAge) {
            return "Please enter a valid age between " + minAge + " and " + maxAge;
        }
        return null;
    }
    
    public String percentage(String value) {
        return inRange(value, 0, 100) ? null : "Please enter a valid percentage between 0 and 100";
    }
    
    public String interestRate(String value) {
        return inRange(value, 0, MAX_INTEREST_RATE) ? null : "Please enter a valid interest rate between 0 and 50%";
    }
    
    /**
     * Starting calendar year of a financial year, from 2000 to next year.
     */
    public String financialYear(String value) {
        if (isEmpty(value)) {
            return null;
        }
        int maxYear = LocalDate.now(clock).getYear() + 1;
        Double year = Coercions.leadingNumber(value);
        if (year == null || (int) year.doubleValue() < MIN_FINANCIAL_YEAR || (int) year.doubleValue() > maxYear) {
            return "Please enter a valid financial year between " + MIN_FINANCIAL_YEAR + " and " + maxYear;
        }
        return null;
    }
    
    public String taxRegime(String value) {
        if (isEmpty(value) || TAX_REGIMES.contains(value.toLowerCase())) {
            return null;
        }
        return "Please select a valid tax regime (Old or New)";
    }
    
    public String filingStatus(String value) {
        if (isEmpty(value) || FILING_STATUSES.contains(value.toLowerCase())) {
            return null;
        }
        return "Please select a valid filing status";
    }
    
    /**
     * ISO date ("2025-03-31") or ISO date-time.
     */
    public String date(String value) {
        if (isEmpty(value)) {
            return null;
        }
        return parseDate(value) == null ? "Please enter a valid date" : null;
    }
    
    /**
     * Strictly after today. Unparseable dates are left to {@link #date(String)}.
     */
    public String futureDate(String value) {
        LocalDate date = isEmpty(value) ? null : parseDate(value);
        if (date != null && !date.isAfter(LocalDate.now(clock))) {
            return "Please enter a future date";
        }
        return null;
    }
    
    /**
     * Strictly before today. Unparseable dates are left to {@link #date(String)}.
     */
    public String pastDate(String value) {
        LocalDate date = isEmpty(value) ? null : parseDate(value);
        if (date != null && !date.isBefore(LocalDate.now(clock))) {
            return "Please enter a past date";
        }
        return null;
    }
    
    public String salaryComponent(String value) {
        return salaryComponent(value, DEFAULT_SALARY_COMPONENT_LIMIT);
    }
    
    public String salaryComponent(String value, double maxLimit) {
        if (Coercions.toNumber(value) > maxLimit) {
            return "Amount cannot exceed " + rupees(maxLimit);
        }
        return null;
    }
    
    public String deduction(String value, double income) {
        return Coercions.toNumber(value) > income ? "Deduction cannot exceed total income" : null;
    }
    
    /**
     * Rejects an 80C entry that would take the running total over the ceiling.
     * 
     * @param value Amount being entered
     * @param currentTotal 80C total of the other instruments
     */
    public String section80CRemaining(String value, double currentTotal) {
        double limit = limits.get(LimitKey.SECTION_80C_LIMIT);
        if (currentTotal + Coercions.toNumber(value) > limit) {
            return "Total Section 80C deductions cannot exceed " + rupees(limit);
        }
        return null;
    }
    
    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
    
    private static boolean matchesOrEmpty(Pattern pattern, String value) {
        return isEmpty(value) || pattern.matcher(value).matches();
    }
    
    private static boolean inRange(String value, double min, double max) {
        if (isEmpty(value)) {
            return true;
        }
        Double number = Coercions.leadingNumber(value);
        return number != null && number >= min && number <= max;
    }
    
    private static LocalDate parseDate(String value) {
        String text = value.trim();
        try {
            return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(text, DateTimeFormatter.ISO_DATE_TIME);
            } catch (DateTimeParseException nested) {
                return null;
            }
        }
    }
}

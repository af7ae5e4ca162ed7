package com.demoPayroll.taxEngine.expression.service;

import com.demoPayroll.taxEngine.expression.exception.ExpressionSyntaxException;
import com.demoPayroll.taxEngine.expression.model.ArithmeticNode;
import com.demoPayroll.taxEngine.expression.model.ExpressionCheck;
import com.demoPayroll.taxEngine.expression.model.ExpressionResult;
import com.demoPayroll.taxEngine.expression.parser.ArithmeticParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates spreadsheet-style calculator input such as {@code =1200*12} or {@code =50000*40%}.
 * 
 * Only numeric literals, {@code + - * / % ( )} and spaces are accepted; the
 * expression is parsed into an {@link ArithmeticNode} tree and computed
 * directly, nothing is handed to a script engine.
 */
@Slf4j
@Service
public class ExpressionEvaluator {
    
    static final String MUST_START_WITH_EQUALS = "Calculator expressions must start with =";
    static final String EMPTY_EXPRESSION = "Empty expression after =";
    static final String INVALID_CHARACTERS =
            "Invalid characters in expression. Only numbers and +, -, *, /, %, () are allowed.";
    static final String INVALID_FORMAT = "Invalid expression format.";
    static final String INVALID_EXPRESSION = "Invalid mathematical expression.";
    static final String INVALID_NUMBER = "Expression resulted in invalid number.";
    
    private static final Pattern ALLOWED_CHARACTERS = Pattern.compile("^[0-9+\\-*/.() %]+$");
    private static final Pattern PERCENTAGE = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*%");
    
    private final int maxLength;
    private final int maxDepth;
    
    public ExpressionEvaluator(@Value("${tax-engine.expression.max-length:256}") int maxLength,
                               @Value("${tax-engine.expression.max-depth:32}") int maxDepth) {
        this.maxLength = maxLength;
        this.maxDepth = maxDepth;
    }
    
    /**
     * True iff the trimmed value starts with '='.
     */
    public boolean isCalculatorExpression(Object value) {
        return value instanceof String && ((String) value).trim().startsWith("=");
    }
    
    /**
     * Evaluates a calculator expression.
     * 
     * @param expression Raw field value, must start with '='
     * @return Valid result rounded to 2 decimals, or an invalid result with the reason
     */
    public ExpressionResult evaluate(String expression) {
        if (!isCalculatorExpression(expression)) {
            return ExpressionResult.failure(MUST_START_WITH_EQUALS);
        }
        if (expression.length() > maxLength) {
            log.debug("Rejected calculator expression of length {} (max {})", expression.length(), maxLength);
            return ExpressionResult.failure("Expression exceeds maximum length of " + maxLength + " characters.");
        }
        
        String cleanExpression = expression.trim().substring(1).trim();
        if (cleanExpression.isEmpty()) {
            return ExpressionResult.failure(EMPTY_EXPRESSION);
        }
        if (!ALLOWED_CHARACTERS.matcher(cleanExpression).matches()) {
            log.debug("Rejected calculator expression with disallowed characters");
            return ExpressionResult.failure(INVALID_CHARACTERS);
        }
        
        String processedExpression = rewritePercentages(cleanExpression);
        // a '%' not preceded by a number survives the rewrite
        if (processedExpression.indexOf('%') >= 0) {
            return ExpressionResult.failure(INVALID_FORMAT);
        }
        
        double value;
        try {
            ArithmeticNode tree = new ArithmeticParser(processedExpression, maxDepth).parse();
            value = tree.evaluate();
        } catch (ExpressionSyntaxException e) {
            log.debug("Calculator expression failed to parse: {}", e.getMessage());
            return ExpressionResult.failure(INVALID_EXPRESSION);
        }
        
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return ExpressionResult.failure(INVALID_NUMBER);
        }
        return ExpressionResult.success(BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue());
    }
    
    /**
     * Structural pre-check used while the user is still typing.
     */
    public ExpressionCheck validateCalculatorExpression(String expression) {
        if (expression == null || !expression.startsWith("=")) {
            return ExpressionCheck.rejected(MUST_START_WITH_EQUALS);
        }
        
        String cleanExpression = expression.substring(1).trim();
        if (cleanExpression.isEmpty()) {
            return ExpressionCheck.rejected(EMPTY_EXPRESSION);
        }
        if (cleanExpression.contains("**")) {
            return ExpressionCheck.rejected("Use * for multiplication, not **");
        }
        if (cleanExpression.contains("//")) {
            return ExpressionCheck.rejected("Use / for division, not //");
        }
        
        int openParens = 0;
        for (char ch : cleanExpression.toCharArray()) {
            if (ch == '(') {
                openParens++;
            } else if (ch == ')') {
                openParens--;
            }
            if (openParens < 0) {
                return ExpressionCheck.rejected("Unmatched closing parenthesis");
            }
        }
        if (openParens > 0) {
            return ExpressionCheck.rejected("Unmatched opening parenthesis");
        }
        
        return ExpressionCheck.ok();
    }
    
    private String rewritePercentages(String expression) {
        Matcher matcher = PERCENTAGE.matcher(expression);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, "(" + matcher.group(1) + "/100)");
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}

package com.demoPayroll.taxEngine.expression.parser;

import com.demoPayroll.taxEngine.expression.exception.ExpressionSyntaxException;
import com.demoPayroll.taxEngine.expression.model.ArithmeticNode;

/**
 * Recursive-descent parser for the calculator grammar:
 * 
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary)*
 * unary      := ('+' | '-') unary | primary
 * primary    := number | '(' expression ')'
 * number     := digits ['.' digits] | '.' digits
 * </pre>
 * 
 * Same-precedence operators associate to the left. Nesting of parentheses and
 * unary signs is bounded by {@code maxDepth}. Instances are single-use.
 */
public class ArithmeticParser {
    
    private final String input;
    private final int maxDepth;
    private int pos;
    private int depth;
    
    public ArithmeticParser(String input, int maxDepth) {
        this.input = input;
        this.maxDepth = maxDepth;
    }
    
    /**
     * Parses the whole input into a tree.
     * 
     * @throws ExpressionSyntaxException on any unexpected or trailing character
     */
    public ArithmeticNode parse() {
        ArithmeticNode node = parseExpression();
        skipWhitespace();
        if (pos < input.length()) {
            throw new ExpressionSyntaxException("Unexpected character '" + input.charAt(pos) + "'", pos);
        }
        return node;
    }
    
    private ArithmeticNode parseExpression() {
        ArithmeticNode left = parseTerm();
        while (true) {
            skipWhitespace();
            if (consume('+')) {
                left = new ArithmeticNode.Add(left, parseTerm());
            } else if (consume('-')) {
                left = new ArithmeticNode.Sub(left, parseTerm());
            } else {
                return left;
            }
        }
    }
    
    private ArithmeticNode parseTerm() {
        ArithmeticNode left = parseUnary();
        while (true) {
            skipWhitespace();
            if (consume('*')) {
                left = new ArithmeticNode.Mul(left, parseUnary());
            } else if (consume('/')) {
                left = new ArithmeticNode.Div(left, parseUnary());
            } else {
                return left;
            }
        }
    }
    
    private ArithmeticNode parseUnary() {
        skipWhitespace();
        if (consume('-')) {
            enter();
            ArithmeticNode operand = parseUnary();
            depth--;
            return new ArithmeticNode.Neg(operand);
        }
        if (consume('+')) {
            enter();
            ArithmeticNode operand = parseUnary();
            depth--;
            return operand;
        }
        return parsePrimary();
    }
    
    private ArithmeticNode parsePrimary() {
        skipWhitespace();
        if (consume('(')) {
            enter();
            ArithmeticNode inner = parseExpression();
            skipWhitespace();
            if (!consume(')')) {
                throw new ExpressionSyntaxException("Expected ')'", pos);
            }
            depth--;
            return new ArithmeticNode.Paren(inner);
        }
        return parseNumber();
    }
    
    private ArithmeticNode parseNumber() {
        int start = pos;
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
            pos++;
        }
        if (pos < input.length() && input.charAt(pos) == '.') {
            pos++;
            int fractionStart = pos;
            while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                pos++;
            }
            if (fractionStart == pos && fractionStart - 1 == start) {
                throw new ExpressionSyntaxException("Malformed number", start);
            }
        }
        if (start == pos) {
            if (pos >= input.length()) {
                throw new ExpressionSyntaxException("Unexpected end of expression", pos);
            }
            throw new ExpressionSyntaxException("Unexpected character '" + input.charAt(pos) + "'", pos);
        }
        return new ArithmeticNode.Num(Double.parseDouble(input.substring(start, pos)));
    }
    
    private void enter() {
        depth++;
        if (depth > maxDepth) {
            throw new ExpressionSyntaxException("Expression nested deeper than " + maxDepth + " levels", pos);
        }
    }
    
    private boolean consume(char expected) {
        if (pos < input.length() && input.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }
    
    private void skipWhitespace() {
        while (pos < input.length() && input.charAt(pos) == ' ') {
            pos++;
        }
    }
}

package com.demoPayroll.taxEngine.expression.model;

/**
 * Parsed arithmetic expression tree. The node set is closed: numeric literals,
 * the four binary operators, unary negation and parenthesised groups.
 */
public interface ArithmeticNode {
    
    double evaluate();
    
    record Num(double value) implements ArithmeticNode {
        @Override
        public double evaluate() {
            return value;
        }
    }
    
    record Add(ArithmeticNode left, ArithmeticNode right) implements ArithmeticNode {
        @Override
        public double evaluate() {
            return left.evaluate() + right.evaluate();
        }
    }
    
    record Sub(ArithmeticNode left, ArithmeticNode right) implements ArithmeticNode {
        @Override
        public double evaluate() {
            return left.evaluate() - right.evaluate();
        }
    }
    
    record Mul(ArithmeticNode left, ArithmeticNode right) implements ArithmeticNode {
        @Override
        public double evaluate() {
            return left.evaluate() * right.evaluate();
        }
    }
    
    record Div(ArithmeticNode left, ArithmeticNode right) implements ArithmeticNode {
        @Override
        public double evaluate() {
            return left.evaluate() / right.evaluate();
        }
    }
    
    record Neg(ArithmeticNode operand) implements ArithmeticNode {
        @Override
        public double evaluate() {
            return -operand.evaluate();
        }
    }
    
    record Paren(ArithmeticNode inner) implements ArithmeticNode {
        @Override
        public double evaluate() {
            return inner.evaluate();
        }
    }
}

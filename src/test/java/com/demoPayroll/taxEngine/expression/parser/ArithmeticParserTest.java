package com.demoPayroll.taxEngine.expression.parser;

import com.demoPayroll.taxEngine.expression.exception.ExpressionSyntaxException;
import com.demoPayroll.taxEngine.expression.model.ArithmeticNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ArithmeticParser Tests")
class ArithmeticParserTest {

    private static ArithmeticNode parse(String input) {
        return new ArithmeticParser(input, 32).parse();
    }

    @Nested
    @DisplayName("Tree Shape Tests")
    class TreeShapeTests {

        @Test
        @DisplayName("Should bind multiplication tighter than addition")
        void shouldRespectPrecedence() {
            // When
            ArithmeticNode tree = parse("2+3*4");

            // Then
            assertThat(tree).isInstanceOf(ArithmeticNode.Add.class);
            ArithmeticNode.Add add = (ArithmeticNode.Add) tree;
            assertThat(add.left()).isEqualTo(new ArithmeticNode.Num(2));
            assertThat(add.right()).isInstanceOf(ArithmeticNode.Mul.class);
            assertThat(tree.evaluate()).isEqualTo(14.0);
        }

        @Test
        @DisplayName("Should associate same-precedence operators to the left")
        void shouldAssociateLeft() {
            assertThat(parse("10-2-3").evaluate()).isEqualTo(5.0);
            assertThat(parse("100/4/5").evaluate()).isEqualTo(5.0);
        }

        @Test
        @DisplayName("Should keep parentheses as explicit nodes")
        void shouldKeepParentheses() {
            // When
            ArithmeticNode tree = parse("(1+2)*3");

            // Then
            ArithmeticNode.Mul mul = (ArithmeticNode.Mul) tree;
            assertThat(mul.left()).isInstanceOf(ArithmeticNode.Paren.class);
            assertThat(tree.evaluate()).isEqualTo(9.0);
        }

        @Test
        @DisplayName("Should accept unary signs and spaces")
        void shouldAcceptUnarySigns() {
            assertThat(parse("-5 + 2").evaluate()).isEqualTo(-3.0);
            assertThat(parse("--3").evaluate()).isEqualTo(3.0);
            assertThat(parse("+4 * -(1 + 1)").evaluate()).isEqualTo(-8.0);
        }

        @Test
        @DisplayName("Should read leading and trailing decimal points")
        void shouldReadDecimals() {
            assertThat(parse(".5").evaluate()).isEqualTo(0.5);
            assertThat(parse("5.").evaluate()).isEqualTo(5.0);
            assertThat(parse("1.25*4").evaluate()).isEqualTo(5.0);
        }
    }

    @Nested
    @DisplayName("Syntax Error Tests")
    class SyntaxErrorTests {

        @Test
        @DisplayName("Should report the position of an unexpected operator")
        void shouldReportUnexpectedOperator() {
            assertThatThrownBy(() -> parse("1+*2"))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessage("Unexpected character '*' at position 2")
                    .extracting(e -> ((ExpressionSyntaxException) e).getPosition())
                    .isEqualTo(2);
        }

        @Test
        @DisplayName("Should reject a lone decimal point")
        void shouldRejectLoneDecimalPoint() {
            assertThatThrownBy(() -> parse("."))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageStartingWith("Malformed number");
        }

        @Test
        @DisplayName("Should reject unclosed parentheses and trailing input")
        void shouldRejectUnclosedAndTrailing() {
            assertThatThrownBy(() -> parse("(1+2"))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessage("Expected ')' at position 4");
            assertThatThrownBy(() -> parse("1 2"))
                    .isInstanceOf(ExpressionSyntaxException.class);
            assertThatThrownBy(() -> parse("1+"))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageStartingWith("Unexpected end of expression");
        }

        @Test
        @DisplayName("Should bound nesting depth")
        void shouldBoundNestingDepth() {
            assertThat(new ArithmeticParser("((1))", 2).parse().evaluate()).isEqualTo(1.0);
            assertThatThrownBy(() -> new ArithmeticParser("((1))", 1).parse())
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageContaining("nested deeper than 1 levels");
        }
    }
}

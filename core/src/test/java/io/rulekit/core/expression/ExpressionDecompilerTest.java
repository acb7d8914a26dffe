package io.rulekit.core.expression;

import static org.assertj.core.api.Assertions.assertThat;

import io.rulekit.core.model.LogicExpression;
import io.rulekit.core.model.LogicExpression.BinaryOp;
import io.rulekit.core.model.LogicExpression.Call;
import io.rulekit.core.model.LogicExpression.Literal;
import io.rulekit.core.model.LogicExpression.NaryOp;
import io.rulekit.core.model.LogicExpression.UnaryOp;
import io.rulekit.core.model.LogicExpression.Variable;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ExpressionDecompiler")
class ExpressionDecompilerTest {

    private final ExpressionDecompiler decompiler = new ExpressionDecompiler();
    private final ExpressionParser parser = new ExpressionParser();

    private String canonical(String text) {
        return decompiler.decompile(parser.parse(text));
    }

    @Nested
    @DisplayName("minimal parentheses")
    class Parentheses {

        @Test
        void redundantParenthesesAreDropped() {
            assertThat(canonical("((a)) + (b * c)")).isEqualTo("a + b * c");
        }

        @Test
        void requiredParenthesesAreKept() {
            assertThat(canonical("(a + b) * c")).isEqualTo("(a + b) * c");
            assertThat(canonical("a - (b + c)")).isEqualTo("a - (b + c)");
        }

        @Test
        @DisplayName("or inside and is wrapped, and inside or is not")
        void connectives() {
            assertThat(canonical("(a or b) and c")).isEqualTo("(a or b) and c");
            assertThat(canonical("a or (b and c)")).isEqualTo("a or b and c");
        }

        @Test
        @DisplayName("not wraps looser operands only")
        void not() {
            assertThat(canonical("not (a and b)")).isEqualTo("not (a and b)");
            assertThat(canonical("not (a > 1)")).isEqualTo("not a > 1");
        }
    }

    @Nested
    @DisplayName("special shapes")
    class Shapes {

        @Test
        @DisplayName("between pattern is rendered as between")
        void between() {
            assertThat(canonical("age >= 18 and age <= 65")).isEqualTo("age between 18 and 65");
        }

        @Test
        @DisplayName("differing subjects stay a plain and")
        void notBetween() {
            assertThat(canonical("a >= 1 and b <= 2")).isEqualTo("a >= 1 and b <= 2");
        }

        @Test
        @DisplayName("0 - x renders as unary minus, 0 - 5 does not")
        void negation() {
            Variable x = new Variable("x");

            assertThat(decompiler.decompile(new BinaryOp("-", Literal.of(0), x))).isEqualTo("-x");
            assertThat(decompiler.decompile(new BinaryOp("-", Literal.of(0), Literal.of(5)))).isEqualTo("0 - 5");
        }

        @Test
        @DisplayName("three conjuncts of the between shape stay a plain and")
        void threeConjunctsNotBetween() {
            Variable age = new Variable("age");
            LogicExpression tree = new NaryOp("and", List.of(
                    new BinaryOp(">=", age, Literal.of(18)),
                    new BinaryOp("<=", age, Literal.of(65)),
                    new BinaryOp("<=", age, Literal.of(70))));

            String text = decompiler.decompile(tree);

            assertThat(text).isEqualTo("age >= 18 and age <= 65 and age <= 70").doesNotContain("between");
            assertThat(parser.parse(text)).isEqualTo(tree);
        }

        @Test
        @DisplayName("literals print in canonical form")
        void literals() {
            assertThat(decompiler.decompile(LogicExpression.TRUE)).isEqualTo("true");
            assertThat(decompiler.decompile(LogicExpression.NULL)).isEqualTo("null");
            assertThat(decompiler.decompile(new Literal(new BigDecimal("2.50")))).isEqualTo("2.5");
            assertThat(decompiler.decompile(new Literal(new BigDecimal("1E+3")))).isEqualTo("1000");
            assertThat(decompiler.decompile(Literal.of("a\"b"))).isEqualTo("\"a\\\"b\"");
        }

        @Test
        @DisplayName("large exponents print in scientific notation and read back")
        void largeExponents() {
            LogicExpression tree = parser.parse("x > 1e50000000 and y < 2.5e-40");

            String text = decompiler.decompile(tree);

            assertThat(text).isEqualTo("x > 1E+50000000 and y < 2.5E-40");
            assertThat(parser.parse(text)).isEqualTo(tree);
            assertThat(decompiler.decompile(new Literal(new BigDecimal("1E+18")))).isEqualTo("1000000000000000000");
        }

        @Test
        @DisplayName("calls and keyword comparisons")
        void callsAndKeywords() {
            LogicExpression tree = new NaryOp("and", List.of(
                    new BinaryOp("contains", new Variable("tags"), Literal.of("vip")),
                    new UnaryOp("!", new Call("isEmpty", List.of(new Variable("name"))))));

            assertThat(decompiler.decompile(tree)).isEqualTo("tags contains \"vip\" and not isEmpty(name)");
        }

        @Test
        @DisplayName("non-infix binary operator falls back to call syntax")
        void nonInfixBinary() {
            assertThat(decompiler.decompile(new BinaryOp("cat", Literal.of("a"), new Variable("b"))))
                    .isEqualTo("cat(\"a\", b)");
        }
    }
}

package io.rulekit.core.table;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.rulekit.core.error.CellCompileException;
import io.rulekit.core.model.DataType;
import io.rulekit.core.model.DecisionTableColumn;
import io.rulekit.core.model.LogicExpression;
import io.rulekit.core.model.LogicExpression.BinaryOp;
import io.rulekit.core.model.LogicExpression.ListExpr;
import io.rulekit.core.model.LogicExpression.Literal;
import io.rulekit.core.model.LogicExpression.NaryOp;
import io.rulekit.core.model.LogicExpression.Variable;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("CellCompiler")
class CellCompilerTest {

    private static final DecisionTableColumn TOTAL = DecisionTableColumn.input("c1", "total", DataType.NUMBER);
    private static final DecisionTableColumn TIER = DecisionTableColumn.input("c2", "tier", DataType.STRING);
    private static final DecisionTableColumn VIP = DecisionTableColumn.input("c3", "vip", DataType.BOOLEAN);

    private static final Variable TOTAL_VAR = new Variable("total");

    private final CellCompiler cells = new CellCompiler();

    @Nested
    @DisplayName("condition cells")
    class Conditions {

        @ParameterizedTest(name = "\"{0}\" matches anything")
        @ValueSource(strings = {"", "   ", "*", " * "})
        void wildcard(String text) {
            assertThat(cells.compile(text, TOTAL)).isEqualTo(LogicExpression.TRUE);
        }

        @Test
        @DisplayName("comparison prefixes, longest first")
        void comparisons() {
            assertThat(cells.compile(">= 100", TOTAL)).isEqualTo(new BinaryOp(">=", TOTAL_VAR, Literal.of(100)));
            assertThat(cells.compile(">100", TOTAL)).isEqualTo(new BinaryOp(">", TOTAL_VAR, Literal.of(100)));
            assertThat(cells.compile("!= 0", TOTAL)).isEqualTo(new BinaryOp("!=", TOTAL_VAR, Literal.of(0)));
            assertThat(cells.compile("<=-5", TOTAL))
                    .isEqualTo(new BinaryOp("<=", TOTAL_VAR, new Literal(new BigDecimal("-5"))));
        }

        @Test
        @DisplayName("inclusive range")
        void range() {
            assertThat(cells.compile("10..20", TOTAL)).isEqualTo(new NaryOp("and", List.of(
                    new BinaryOp(">=", TOTAL_VAR, Literal.of(10)), new BinaryOp("<=", TOTAL_VAR, Literal.of(20)))));
        }

        @Test
        @DisplayName("comma list becomes in, blank items skipped")
        void list() {
            assertThat(cells.compile("gold, silver,,", TIER)).isEqualTo(new BinaryOp(
                    "in", new Variable("tier"), new ListExpr(List.of(Literal.of("gold"), Literal.of("silver")))));
        }

        @Test
        @DisplayName("plain value is equality")
        void equality() {
            assertThat(cells.compile("gold", TIER)).isEqualTo(new BinaryOp("==", new Variable("tier"), Literal.of("gold")));
        }

        @Test
        @DisplayName("numeric-looking text in a string column becomes a number unless quoted")
        void stringColumnCoercion() {
            assertThat(cells.compile("42", TIER)).isEqualTo(new BinaryOp("==", new Variable("tier"), Literal.of(42)));
            assertThat(cells.compile("\"42\"", TIER))
                    .isEqualTo(new BinaryOp("==", new Variable("tier"), Literal.of("42")));
        }

        @Test
        @DisplayName("boolean text compares as boolean")
        void booleans() {
            assertThat(cells.compile("TRUE", VIP)).isEqualTo(new BinaryOp("==", new Variable("vip"), LogicExpression.TRUE));
            assertThat(cells.compile("false", TIER))
                    .isEqualTo(new BinaryOp("==", new Variable("tier"), new Literal(Boolean.FALSE)));
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        void comparisonWithoutValue() {
            assertThatThrownBy(() -> cells.compile(">=", TOTAL))
                    .isInstanceOf(CellCompileException.class)
                    .hasMessage("Comparison '>=' requires a value");
        }

        @Test
        void invalidNumber() {
            assertThatThrownBy(() -> cells.compile("> abc", TOTAL))
                    .isInstanceOf(CellCompileException.class)
                    .hasMessage("Invalid number \"abc\"")
                    .satisfies(e -> assertThat(((CellCompileException) e).columnId()).isEqualTo("c1"));
        }

        @Test
        @DisplayName("an exponent beyond the decimal range is an invalid number")
        void exponentOverflow() {
            assertThatThrownBy(() -> cells.compile("> 1e9999999999", TOTAL))
                    .isInstanceOf(CellCompileException.class)
                    .hasMessage("Invalid number \"1e9999999999\"")
                    .satisfies(e -> assertThat(((CellCompileException) e).cellText()).isEqualTo("> 1e9999999999"));
        }

        @Test
        void halfOpenRange() {
            assertThatThrownBy(() -> cells.compile("10..", TOTAL))
                    .isInstanceOf(CellCompileException.class)
                    .hasMessageContaining("Invalid range");
        }

        @Test
        void invalidBoolean() {
            assertThatThrownBy(() -> cells.compile("yes", VIP))
                    .isInstanceOf(CellCompileException.class)
                    .hasMessageContaining("expected true or false");
        }
    }

    @Nested
    @DisplayName("output cells and validation")
    class OutputsAndValidation {

        @Test
        void outputCells() {
            DecisionTableColumn rate = DecisionTableColumn.output("o1", "rate", DataType.NUMBER);

            assertThat(cells.compileOutput("", rate)).isEqualTo(LogicExpression.NULL);
            assertThat(cells.compileOutput("0.2", rate)).isEqualTo(new Literal(new BigDecimal("0.2")));
        }

        @Test
        void validate() {
            assertThat(cells.validate("1..5", TOTAL)).isEmpty();
            assertThat(cells.validate("5..1", TOTAL)).contains("Range minimum must be less than or equal to maximum");
            assertThat(cells.validate(">= x", TOTAL)).contains("Invalid number \"x\"");
        }
    }

    @Test
    @DisplayName("CellValues.isNumeric")
    void isNumeric() {
        assertThat(CellValues.isNumeric("-1.5e3")).isTrue();
        assertThat(CellValues.isNumeric(" 7 ")).isTrue();
        assertThat(CellValues.isNumeric("1.")).isFalse();
        assertThat(CellValues.isNumeric("abc")).isFalse();
    }
}

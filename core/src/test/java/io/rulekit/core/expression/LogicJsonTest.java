package io.rulekit.core.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.rulekit.core.error.WireFormatException;
import io.rulekit.core.model.LogicExpression;
import io.rulekit.core.model.LogicExpression.BinaryOp;
import io.rulekit.core.model.LogicExpression.Call;
import io.rulekit.core.model.LogicExpression.Literal;
import io.rulekit.core.model.LogicExpression.NaryOp;
import io.rulekit.core.model.LogicExpression.RecordExpr;
import io.rulekit.core.model.LogicExpression.UnaryOp;
import io.rulekit.core.model.LogicExpression.Variable;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("LogicJson")
class LogicJsonTest {

    private final ExpressionParser parser = new ExpressionParser();

    @Nested
    @DisplayName("writing")
    class Writing {

        @Test
        @DisplayName("comparison and variable in wire form")
        void comparison() {
            assertThat(LogicJson.toJsonString(parser.parse("age >= 18")))
                    .isEqualTo("{\">=\":[{\"var\":\"age\"},18]}");
        }

        @Test
        @DisplayName("integral decimals are written as integers")
        void integralNumbers() {
            JsonNode node = LogicJson.toJson(new Literal(new BigDecimal("150.00")));

            assertThat(node.isIntegralNumber()).isTrue();
            assertThat(node.intValue()).isEqualTo(150);
            assertThat(LogicJson.toJson(new Literal(new BigDecimal("0.20"))).decimalValue())
                    .isEqualByComparingTo("0.2");
        }

        @Test
        @DisplayName("huge integral values keep their exponent")
        void hugeExponent() {
            JsonNode node = LogicJson.toJson(new Literal(new BigDecimal("1E+50000000")));

            assertThat(node.decimalValue().scale()).isEqualTo(-50000000);
            assertThat(LogicJson.toJson(new Literal(new BigDecimal("1E+19"))).decimalValue().toString())
                    .isEqualTo("1E+19");
        }

        @Test
        @DisplayName("between is written as and of two comparisons")
        void between() {
            assertThat(LogicJson.toJsonString(parser.parse("x between 1 and 2")))
                    .isEqualTo("{\"and\":[{\">=\":[{\"var\":\"x\"},1]},{\"<=\":[{\"var\":\"x\"},2]}]}");
        }

        @Test
        void not() {
            assertThat(LogicJson.toJsonString(parser.parse("not active")))
                    .isEqualTo("{\"!\":[{\"var\":\"active\"}]}");
        }
    }

    @Nested
    @DisplayName("reading")
    class Reading {

        @Test
        @DisplayName("infix operators with two operands become binary nodes")
        void binary() {
            assertThat(LogicJson.parseJson("{\"+\": [{\"var\": \"a\"}, 1.5]}")).isEqualTo(
                    new BinaryOp("+", new Variable("a"), new Literal(new BigDecimal("1.5"))));
        }

        @Test
        @DisplayName("variadic arithmetic stays a call")
        void variadic() {
            assertThat(LogicJson.parseJson("{\"+\": [1, 2, 3]}"))
                    .isEqualTo(new Call("+", List.of(Literal.of(1), Literal.of(2), Literal.of(3))));
        }

        @Test
        @DisplayName("bare operand is treated as a single-element list")
        void bareOperand() {
            assertThat(LogicJson.parseJson("{\"!\": {\"var\": \"x\"}}")).isEqualTo(new UnaryOp("!", new Variable("x")));
            assertThat(LogicJson.parseJson("{\"var\": \"x.y\"}")).isEqualTo(new Variable("x.y"));
        }

        @Test
        @DisplayName("var with default stays a call")
        void varWithDefault() {
            assertThat(LogicJson.parseJson("{\"var\": [\"x\", 0]}"))
                    .isEqualTo(new Call("var", List.of(Literal.of("x"), Literal.of(0))));
        }

        @Test
        @DisplayName("multi-key objects are records")
        void record() {
            LogicExpression tree = LogicJson.parseJson("{\"rate\": 0.1, \"code\": \"A\"}");

            assertThat(tree).isInstanceOf(RecordExpr.class);
            assertThat(((RecordExpr) tree).fields()).containsOnlyKeys("rate", "code");
        }

        @Test
        void andOrOperands() {
            assertThat(LogicJson.parseJson("{\"or\": [true, false]}"))
                    .isEqualTo(new NaryOp("or", List.of(LogicExpression.TRUE, new Literal(false))));
        }

        @Test
        @DisplayName("malformed input raises WireFormatException")
        void malformed() {
            assertThatThrownBy(() -> LogicJson.parseJson("{\"and\": [}"))
                    .isInstanceOf(WireFormatException.class)
                    .hasMessageStartingWith("Invalid logic JSON");
            assertThatThrownBy(() -> LogicJson.parseJson("{\"var\": 5}"))
                    .isInstanceOf(WireFormatException.class)
                    .hasMessageContaining("'var' expects a string path");
            assertThatThrownBy(() -> LogicJson.parseJson("{\"and\": []}"))
                    .isInstanceOf(WireFormatException.class);
        }
    }

    @Test
    @DisplayName("trees produced by the parser survive the wire form")
    void parserTreesSurviveWireForm() {
        for (String text : List.of(
                "a + b * 2 > 10 and not done",
                "tier in [\"gold\", \"silver\"]",
                "coalesce($.discount, 0) * 1.5",
                "-x",
                "age between 18 and 65 or vip == true")) {
            LogicExpression tree = parser.parse(text);

            assertThat(LogicJson.parseJson(LogicJson.toJsonString(tree))).as(text).isEqualTo(tree);
        }
    }
}

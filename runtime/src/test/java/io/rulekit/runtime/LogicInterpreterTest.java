package io.rulekit.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.rulekit.core.error.ExpressionEvalException;
import io.rulekit.core.expression.ExpressionParser;
import io.rulekit.core.expression.LogicJson;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("LogicInterpreter")
class LogicInterpreterTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final ExpressionParser parser = new ExpressionParser();
    private final LogicInterpreter interpreter = new LogicInterpreter();

    private JsonNode data;

    @BeforeEach
    void setUp() throws Exception {
        data = JSON.readTree("""
                {
                  "price": 50,
                  "quantity": 3,
                  "name": "Anderson",
                  "tier": "gold",
                  "tags": ["vip", "eu"],
                  "items": [{"sku": "A1"}, {"sku": "B2"}],
                  "active": true,
                  "note": null,
                  "$": {"subtotal": 150}
                }
                """);
    }

    private JsonNode eval(String expression) {
        return interpreter.apply(parser.parse(expression), data);
    }

    @Nested
    @DisplayName("variables")
    class Variables {

        @Test
        void dottedPathsAndArrayIndexes() {
            assertThat(eval("items.1.sku").textValue()).isEqualTo("B2");
            assertThat(eval("$.subtotal").intValue()).isEqualTo(150);
        }

        @Test
        @DisplayName("missing paths evaluate to null")
        void missing() {
            assertThat(eval("customer.address.zip").isNull()).isTrue();
            assertThat(eval("$.discount").isNull()).isTrue();
        }

        @Test
        @DisplayName("var with default applies when the value is missing or null")
        void varDefault() {
            assertThat(interpreter.apply(LogicJson.parseJson("{\"var\": [\"note\", 7]}"), data).intValue())
                    .isEqualTo(7);
            assertThat(interpreter.apply(LogicJson.parseJson("{\"var\": [\"price\", 7]}"), data).intValue())
                    .isEqualTo(50);
        }

        @Test
        @DisplayName("empty path is the whole record")
        void wholeRecord() {
            assertThat(interpreter.apply(LogicJson.parseJson("{\"var\": \"\"}"), data)).isSameAs(data);
        }
    }

    @Nested
    @DisplayName("arithmetic")
    class Arithmetic {

        @ParameterizedTest(name = "{0} = {1}")
        @CsvSource({
            "price * quantity, 150",
            "price - quantity * 10, 20",
            "(price - quantity) * 10, 470",
            "price / 4, 12.5",
            "price % 7, 1",
            "-price + 1, -49",
            "0.1 + 0.2, 0.3"
        })
        void evaluates(String expression, String expected) {
            assertThat(eval(expression).decimalValue()).isEqualByComparingTo(expected);
        }

        @Test
        @DisplayName("integral results are integer nodes")
        void integralResult() {
            assertThat(eval("price * quantity").isIntegralNumber()).isTrue();
        }

        @Test
        void divisionByZero() {
            assertThatThrownBy(() -> eval("price / 0"))
                    .isInstanceOf(ExpressionEvalException.class)
                    .hasMessage("Division by zero");
        }

        @Test
        @DisplayName("non-numeric operand fails")
        void nonNumeric() {
            assertThatThrownBy(() -> eval("name * 2"))
                    .isInstanceOf(ExpressionEvalException.class)
                    .hasMessageContaining("Operator '*' expects a number");
        }

        @Test
        @DisplayName("null and missing operands count as zero")
        void nullOperands() {
            assertThat(eval("price * (1 - missing)").intValue()).isEqualTo(50);
            assertThat(eval("note + 5").intValue()).isEqualTo(5);
            assertThat(interpreter.apply(LogicJson.parseJson("{\"-\": [{\"var\": \"missing\"}]}"), data).intValue())
                    .isZero();
            assertThatThrownBy(() -> eval("price / missing"))
                    .isInstanceOf(ExpressionEvalException.class)
                    .hasMessage("Division by zero");
        }

        @Test
        @DisplayName("variadic + and * from the wire form")
        void variadic() {
            assertThat(interpreter.apply(LogicJson.parseJson("{\"+\": [1, 2, 3, 4]}"), data).intValue()).isEqualTo(10);
            assertThat(interpreter.apply(LogicJson.parseJson("{\"*\": [2]}"), data).intValue()).isEqualTo(2);
            assertThat(interpreter.apply(LogicJson.parseJson("{\"-\": [5]}"), data).intValue()).isEqualTo(-5);
        }
    }

    @Nested
    @DisplayName("logic and comparison")
    class Logic {

        @Test
        void comparisons() {
            assertThat(eval("price >= 50 and quantity < 5").booleanValue()).isTrue();
            assertThat(eval("price between 10 and 49").booleanValue()).isFalse();
            assertThat(eval("tier in [\"gold\", \"silver\"]").booleanValue()).isTrue();
            assertThat(eval("tags contains \"vip\"").booleanValue()).isTrue();
            assertThat(eval("name startswith \"And\" and name endswith \"son\"").booleanValue()).isTrue();
            assertThat(eval("not active").booleanValue()).isFalse();
        }

        @Test
        @DisplayName("comparing with null is false rather than an error")
        void nullComparison() {
            assertThat(eval("missing > 1").booleanValue()).isFalse();
            assertThat(eval("missing == null").booleanValue()).isTrue();
            assertThat(eval("note != 0").booleanValue()).isTrue();
        }

        @Test
        @DisplayName("loose equality between numbers and numeric text")
        void looseEquality() {
            assertThat(eval("price == \"50\"").booleanValue()).isTrue();
            assertThat(eval("price == 50.0").booleanValue()).isTrue();
        }

        @Test
        @DisplayName("and/or return the deciding operand and short-circuit")
        void shortCircuit() {
            assertThat(eval("note or tier").textValue()).isEqualTo("gold");
            assertThat(eval("0 and price / 0").intValue()).isZero();
            assertThat(eval("active or price / 0").booleanValue()).isTrue();
        }

        @Test
        @DisplayName("if evaluates only the chosen branch")
        void lazyIf() {
            assertThat(eval("if(price > 100, price / 0, tier == \"gold\", \"G\", \"other\")").textValue())
                    .isEqualTo("G");
            assertThat(eval("if(false, 1)").isNull()).isTrue();
        }

        @Test
        @DisplayName("three-operand < tests a range")
        void threeOperandLess() {
            assertThat(interpreter.apply(LogicJson.parseJson("{\"<\": [1, {\"var\": \"quantity\"}, 5]}"), data)
                            .booleanValue())
                    .isTrue();
            assertThat(interpreter.apply(LogicJson.parseJson("{\"<=\": [1, 5, 5]}"), data).booleanValue())
                    .isTrue();
        }
    }

    @Nested
    @DisplayName("built-in functions")
    class Functions {

        @Test
        void minMax() {
            assertThat(eval("max(price, quantity, 70)").intValue()).isEqualTo(70);
            assertThat(eval("min(price, quantity)").intValue()).isEqualTo(3);
        }

        @Test
        void substrAndCat() {
            assertThat(eval("substr(name, 1, 3)").textValue()).isEqualTo("nde");
            assertThat(eval("substr(name, -3)").textValue()).isEqualTo("son");
            assertThat(interpreter.apply(LogicJson.parseJson("{\"cat\": [\"a\", 1, \"b\"]}"), data).textValue())
                    .isEqualTo("a1b");
        }

        @Test
        void lists() {
            JsonNode list = eval("[price, tier]");

            assertThat(list.isArray()).isTrue();
            assertThat(list.get(0).intValue()).isEqualTo(50);
            assertThat(list.get(1).textValue()).isEqualTo("gold");
        }

        @Test
        @DisplayName("unknown operator fails evaluation")
        void unknownOperator() {
            assertThatThrownBy(() -> eval("score(price)"))
                    .isInstanceOf(ExpressionEvalException.class)
                    .hasMessage("Unknown operator 'score'");
        }

        @Test
        @DisplayName("custom operators are looked up in the registry")
        void customOperator() {
            OperatorRegistry registry = StandardOperators.registry()
                    .toBuilder()
                    .register("score", args -> JsonValues.number(JsonValues.requireNumber(args.get(0), "score")
                            .multiply(BigDecimal.TEN)))
                    .build();

            JsonNode result = new LogicInterpreter(registry).apply(parser.parse("score(price)"), data);

            assertThat(result.intValue()).isEqualTo(500);
        }
    }
}

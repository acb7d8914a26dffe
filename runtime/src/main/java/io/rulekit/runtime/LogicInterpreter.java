package io.rulekit.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rulekit.core.error.ExpressionEvalException;
import io.rulekit.core.expression.LogicJson;
import io.rulekit.core.model.LogicExpression;
import io.rulekit.core.model.LogicExpression.BinaryOp;
import io.rulekit.core.model.LogicExpression.Call;
import io.rulekit.core.model.LogicExpression.ListExpr;
import io.rulekit.core.model.LogicExpression.Literal;
import io.rulekit.core.model.LogicExpression.NaryOp;
import io.rulekit.core.model.LogicExpression.RecordExpr;
import io.rulekit.core.model.LogicExpression.UnaryOp;
import io.rulekit.core.model.LogicExpression.Variable;
import io.rulekit.core.spi.LogicRuntime;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reference {@link LogicRuntime}: evaluates logic trees with JSONLogic semantics over Jackson
 * nodes.
 *
 * <p>
 * Built in: {@code var} (dotted paths, array indexes, optional default), {@code == !=} (loose),
 * {@code > >= < <=}, {@code !}, short-circuit {@code and}/{@code or} returning the deciding
 * operand, {@code if} chains, {@code + - * / %} on decimals, {@code in}, {@code min max cat
 * substr}. Everything else is looked up in the {@link OperatorRegistry}; an operator found in
 * neither place fails evaluation.
 *
 * <p>
 * Arithmetic is strict: a non-numeric operand or a zero divisor raises
 * {@link ExpressionEvalException}. Ordering is lenient: comparing incomparable values (for
 * example a missing field) is {@code false}.
 *
 * <p>
 * Thread-safe: the registry is immutable and evaluation keeps no state.
 */
public final class LogicInterpreter implements LogicRuntime {

    private final OperatorRegistry operators;

    /** Creates an interpreter with the {@link StandardOperators}. */
    public LogicInterpreter() {
        this(StandardOperators.registry());
    }

    public LogicInterpreter(OperatorRegistry operators) {
        this.operators = Objects.requireNonNull(operators, "operators must not be null");
    }

    @Override
    public JsonNode apply(LogicExpression expression, JsonNode data) {
        return evaluate(expression, data != null ? data : NullNode.getInstance());
    }

    /** Evaluates a tree given in wire form. */
    public JsonNode apply(JsonNode logic, JsonNode data) {
        return apply(LogicJson.fromJson(logic), data);
    }

    private JsonNode evaluate(LogicExpression node, JsonNode data) {
        if (node instanceof Literal literal) {
            return LogicJson.toJson(literal);
        }
        if (node instanceof Variable variable) {
            return resolve(variable.path(), data).orElse(NullNode.getInstance());
        }
        if (node instanceof UnaryOp unary) {
            return JsonValues.bool(!JsonValues.isTruthy(evaluate(unary.operand(), data)));
        }
        if (node instanceof NaryOp nary) {
            return evaluateConnective(nary, data);
        }
        if (node instanceof BinaryOp binary) {
            return evaluateOperator(binary.operator(), List.of(binary.left(), binary.right()), data);
        }
        if (node instanceof Call call) {
            return evaluateOperator(call.operator(), call.arguments(), data);
        }
        if (node instanceof ListExpr list) {
            ArrayNode array = JsonValues.NODES.arrayNode();
            list.elements().forEach(element -> array.add(evaluate(element, data)));
            return array;
        }
        RecordExpr record = (RecordExpr) node;
        ObjectNode object = JsonValues.NODES.objectNode();
        record.fields().forEach((field, value) -> object.set(field, evaluate(value, data)));
        return object;
    }

    /** {@code and} returns the first falsy operand, {@code or} the first truthy one; else the last. */
    private JsonNode evaluateConnective(NaryOp nary, JsonNode data) {
        boolean stopWhen = nary.operator().equals("or");
        if (!stopWhen && !nary.operator().equals("and")) {
            return evaluateOperator(nary.operator(), nary.operands(), data);
        }
        JsonNode value = NullNode.getInstance();
        for (LogicExpression operand : nary.operands()) {
            value = evaluate(operand, data);
            if (JsonValues.isTruthy(value) == stopWhen) {
                return value;
            }
        }
        return value;
    }

    private JsonNode evaluateOperator(String operator, List<LogicExpression> arguments, JsonNode data) {
        // Lazily evaluated operators first.
        if (operator.equals("if")) {
            return evaluateIf(arguments, data);
        }
        if (operator.equals("var")) {
            List<JsonNode> values = evaluateAll(arguments, data);
            String path = values.isEmpty() ? "" : JsonValues.toText(values.get(0));
            JsonNode fallback = values.size() > 1 ? values.get(1) : NullNode.getInstance();
            return resolve(path, data).filter(found -> !found.isNull()).orElse(fallback);
        }

        List<JsonNode> values = evaluateAll(arguments, data);
        switch (operator) {
            case "==":
                return JsonValues.bool(JsonValues.looseEquals(arg(values, 0, operator), arg(values, 1, operator)));
            case "!=":
                return JsonValues.bool(!JsonValues.looseEquals(arg(values, 0, operator), arg(values, 1, operator)));
            case ">":
            case ">=":
            case "<":
            case "<=":
                return JsonValues.bool(ordered(operator, values));
            case "!":
                return JsonValues.bool(!JsonValues.isTruthy(arg(values, 0, operator)));
            case "in":
                return JsonValues.bool(StandardOperators.contains(arg(values, 1, operator), arg(values, 0, operator)));
            case "+":
            case "*":
            case "-":
            case "/":
            case "%":
                return JsonValues.number(arithmetic(operator, values));
            case "min":
            case "max":
                return extreme(operator, values);
            case "cat": {
                StringBuilder text = new StringBuilder();
                values.forEach(value -> text.append(JsonValues.toText(value)));
                return JsonValues.text(text.toString());
            }
            case "substr":
                return substring(values);
            default:
                Optional<LogicOperator> custom = operators.find(operator);
                if (custom.isEmpty()) {
                    throw new ExpressionEvalException("Unknown operator '" + operator + "'");
                }
                JsonNode result = custom.get().apply(values);
                return result != null ? result : NullNode.getInstance();
        }
    }

    private JsonNode evaluateIf(List<LogicExpression> arguments, JsonNode data) {
        int index = 0;
        for (; index + 1 < arguments.size(); index += 2) {
            if (JsonValues.isTruthy(evaluate(arguments.get(index), data))) {
                return evaluate(arguments.get(index + 1), data);
            }
        }
        return index < arguments.size() ? evaluate(arguments.get(index), data) : NullNode.getInstance();
    }

    private List<JsonNode> evaluateAll(List<LogicExpression> arguments, JsonNode data) {
        List<JsonNode> values = new ArrayList<>(arguments.size());
        for (LogicExpression argument : arguments) {
            values.add(evaluate(argument, data));
        }
        return values;
    }

    /** Two operands compare; three operands ({@code < <=} only) test {@code a op b op c}. */
    private static boolean ordered(String operator, List<JsonNode> values) {
        if (values.size() == 3 && (operator.equals("<") || operator.equals("<="))) {
            return holds(operator, JsonValues.compare(values.get(0), values.get(1)))
                    && holds(operator, JsonValues.compare(values.get(1), values.get(2)));
        }
        return holds(operator, JsonValues.compare(arg(values, 0, operator), arg(values, 1, operator)));
    }

    private static boolean holds(String operator, Integer comparison) {
        if (comparison == null) {
            return false;
        }
        switch (operator) {
            case ">":
                return comparison > 0;
            case ">=":
                return comparison >= 0;
            case "<":
                return comparison < 0;
            default:
                return comparison <= 0;
        }
    }

    private static BigDecimal arithmetic(String operator, List<JsonNode> values) {
        if (values.isEmpty()) {
            throw new ExpressionEvalException("Operator '" + operator + "' requires operands");
        }
        if (operator.equals("-") && values.size() == 1) {
            return operand(values.get(0), operator).negate();
        }
        if ((operator.equals("+") || operator.equals("*")) && values.size() != 2) {
            BigDecimal result = operand(values.get(0), operator);
            for (int i = 1; i < values.size(); i++) {
                BigDecimal next = operand(values.get(i), operator);
                result = operator.equals("+") ? result.add(next) : result.multiply(next);
            }
            return result;
        }
        BigDecimal left = operand(arg(values, 0, operator), operator);
        BigDecimal right = operand(arg(values, 1, operator), operator);
        switch (operator) {
            case "+":
                return left.add(right);
            case "-":
                return left.subtract(right);
            case "*":
                return left.multiply(right);
            case "/":
                if (right.signum() == 0) {
                    throw new ExpressionEvalException("Division by zero");
                }
                return left.divide(right, MathContext.DECIMAL64);
            default:
                if (right.signum() == 0) {
                    throw new ExpressionEvalException("Division by zero");
                }
                return left.remainder(right);
        }
    }

    /** Arithmetic reads null and missing values as zero; other non-numbers are an error. */
    private static BigDecimal operand(JsonNode value, String operator) {
        return JsonValues.isNull(value) ? BigDecimal.ZERO : JsonValues.requireNumber(value, operator);
    }

    private static JsonNode extreme(String operator, List<JsonNode> values) {
        BigDecimal best = null;
        for (JsonNode value : values) {
            BigDecimal number = JsonValues.requireNumber(value, operator);
            if (best == null || (operator.equals("max") ? number.compareTo(best) > 0 : number.compareTo(best) < 0)) {
                best = number;
            }
        }
        return best == null ? NullNode.getInstance() : JsonValues.number(best);
    }

    /** {@code substr(text, start[, length])}; negative start counts from the end, negative length trims the end. */
    private static JsonNode substring(List<JsonNode> values) {
        String text = JsonValues.toText(arg(values, 0, "substr"));
        int start = values.size() > 1 ? JsonValues.requireNumber(values.get(1), "substr").intValue() : 0;
        if (start < 0) {
            start = Math.max(0, text.length() + start);
        }
        start = Math.min(start, text.length());
        int end = text.length();
        if (values.size() > 2) {
            int length = JsonValues.requireNumber(values.get(2), "substr").intValue();
            end = length < 0 ? Math.max(start, text.length() + length) : Math.min(text.length(), start + length);
        }
        return JsonValues.text(text.substring(start, end));
    }

    /** Resolves a dotted path; numeric segments index into arrays. Empty path is the whole record. */
    static Optional<JsonNode> resolve(String path, JsonNode data) {
        if (path == null || path.isEmpty()) {
            return Optional.of(data);
        }
        JsonNode current = data;
        for (String segment : path.split("\\.", -1)) {
            if (current.isArray() && segment.chars().allMatch(Character::isDigit) && !segment.isEmpty()) {
                current = current.path(Integer.parseInt(segment));
            } else {
                current = current.path(segment);
            }
            if (current.isMissingNode()) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    private static JsonNode arg(List<JsonNode> values, int index, String operator) {
        if (index >= values.size()) {
            throw new ExpressionEvalException(
                    "Operator '" + operator + "' expects at least " + (index + 1) + " operand(s), got " + values.size());
        }
        return values.get(index);
    }
}

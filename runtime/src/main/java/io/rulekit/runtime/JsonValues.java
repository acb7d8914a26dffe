package io.rulekit.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import io.rulekit.core.error.ExpressionEvalException;
import io.rulekit.core.expression.LogicJson;
import io.rulekit.core.table.CellValues;
import java.math.BigDecimal;
import java.util.Locale;

/**
 * Value semantics shared by the interpreter and the standard operators: truthiness, numeric
 * coercion, loose equality and ordering.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class JsonValues {

    static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonValues() {}

    /**
     * Truthiness as JSONLogic defines it.
     *
     * <ul>
     * <li>{@code null}, {@code NullNode}, {@code MissingNode}: falsy</li>
     * <li>booleans: their value</li>
     * <li>numbers: falsy when zero</li>
     * <li>strings and arrays: falsy when empty</li>
     * <li>objects: truthy</li>
     * </ul>
     */
    public static boolean isTruthy(JsonNode node) {
        if (isNull(node)) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.decimalValue().signum() != 0;
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty();
        }
        if (node.isArray()) {
            return node.size() > 0;
        }
        return true;
    }

    public static boolean isNull(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    /** Numeric view of a number or numeric text; {@code null} for anything else. */
    public static BigDecimal toNumber(JsonNode node) {
        if (isNull(node)) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual() && CellValues.isNumeric(node.textValue())) {
            return new BigDecimal(node.textValue().trim());
        }
        return null;
    }

    /**
     * Numeric view for arithmetic.
     *
     * @throws ExpressionEvalException if the value is not a number or numeric text
     */
    public static BigDecimal requireNumber(JsonNode node, String operator) {
        BigDecimal number = toNumber(node);
        if (number == null) {
            throw new ExpressionEvalException(
                    "Operator '" + operator + "' expects a number, got " + describe(node));
        }
        return number;
    }

    /** Text view: strings as is, numbers in plain notation, {@code null} as the empty string. */
    public static String toText(JsonNode node) {
        if (isNull(node)) {
            return "";
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isNumber()) {
            return LogicJson.numberNode(node.decimalValue()).asText();
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    public static JsonNode number(BigDecimal value) {
        return LogicJson.numberNode(value);
    }

    public static JsonNode bool(boolean value) {
        return NODES.booleanNode(value);
    }

    public static JsonNode text(String value) {
        return value == null ? NullNode.getInstance() : NODES.textNode(value);
    }

    /**
     * Loose equality: numbers (and numeric text compared with a number) numerically, null equals
     * only null, booleans equal their 1/0 numeric value, other values structurally.
     */
    public static boolean looseEquals(JsonNode left, JsonNode right) {
        if (isNull(left) || isNull(right)) {
            return isNull(left) && isNull(right);
        }
        if (left.isNumber() || right.isNumber() || left.isBoolean() != right.isBoolean()) {
            BigDecimal a = numericForEquality(left);
            BigDecimal b = numericForEquality(right);
            if (a != null && b != null) {
                return a.compareTo(b) == 0;
            }
        }
        if (left.isTextual() && right.isTextual()) {
            return left.textValue().equals(right.textValue());
        }
        return left.equals(right);
    }

    private static BigDecimal numericForEquality(JsonNode node) {
        if (node.isBoolean()) {
            return node.booleanValue() ? BigDecimal.ONE : BigDecimal.ZERO;
        }
        return toNumber(node);
    }

    /**
     * Orders two values: numerically when both have a numeric view (numbers or numeric text),
     * lexicographically when both are non-numeric strings.
     *
     * @return the comparison result, or {@code null} when the values are not comparable (for
     *     example when either is null)
     */
    public static Integer compare(JsonNode left, JsonNode right) {
        if (isNull(left) || isNull(right)) {
            return null;
        }
        if (left.isTextual() && right.isTextual()) {
            BigDecimal a = toNumber(left);
            BigDecimal b = toNumber(right);
            return a != null && b != null ? a.compareTo(b) : left.textValue().compareTo(right.textValue());
        }
        BigDecimal a = toNumber(left);
        BigDecimal b = toNumber(right);
        if (a != null && b != null) {
            return a.compareTo(b);
        }
        return null;
    }

    static String describe(JsonNode node) {
        if (isNull(node)) {
            return "null";
        }
        return node.getNodeType().name().toLowerCase(Locale.ROOT) + " " + node;
    }
}

package io.rulekit.core.expression;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rulekit.core.error.WireFormatException;
import io.rulekit.core.model.LogicExpression;
import io.rulekit.core.model.LogicExpression.BinaryOp;
import io.rulekit.core.model.LogicExpression.Call;
import io.rulekit.core.model.LogicExpression.ListExpr;
import io.rulekit.core.model.LogicExpression.Literal;
import io.rulekit.core.model.LogicExpression.NaryOp;
import io.rulekit.core.model.LogicExpression.RecordExpr;
import io.rulekit.core.model.LogicExpression.UnaryOp;
import io.rulekit.core.model.LogicExpression.Variable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Codec between {@link LogicExpression} trees and their JSON wire form, the nested
 * {@code {"operator": [arguments]}} structure consumed by JSONLogic-style runtimes.
 *
 * <ul>
 * <li>literals are JSON scalars; integral numbers are written without a fraction</li>
 * <li>variables are {@code {"var": "path"}}</li>
 * <li>operators and calls are single-key objects whose value is the argument array</li>
 * <li>lists are JSON arrays</li>
 * <li>records are objects with two or more keys (a one-key object always reads back as an
 * operator)</li>
 * </ul>
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class LogicJson {

    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private LogicJson() {}

    /** Converts a tree to its wire form. */
    public static JsonNode toJson(LogicExpression expression) {
        if (expression instanceof Literal literal) {
            return literalNode(literal);
        }
        if (expression instanceof Variable variable) {
            ObjectNode node = NODES.objectNode();
            node.put("var", variable.path());
            return node;
        }
        if (expression instanceof UnaryOp unary) {
            return operatorNode(unary.operator(), List.of(unary.operand()));
        }
        if (expression instanceof BinaryOp binary) {
            return operatorNode(binary.operator(), List.of(binary.left(), binary.right()));
        }
        if (expression instanceof NaryOp nary) {
            return operatorNode(nary.operator(), nary.operands());
        }
        if (expression instanceof Call call) {
            return operatorNode(call.operator(), call.arguments());
        }
        if (expression instanceof ListExpr list) {
            ArrayNode array = NODES.arrayNode();
            list.elements().forEach(element -> array.add(toJson(element)));
            return array;
        }
        RecordExpr record = (RecordExpr) expression;
        ObjectNode node = NODES.objectNode();
        record.fields().forEach((field, value) -> node.set(field, toJson(value)));
        return node;
    }

    /** Converts a tree to compact JSON text. */
    public static String toJsonString(LogicExpression expression) {
        try {
            return MAPPER.writeValueAsString(toJson(expression));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize logic tree", e);
        }
    }

    /**
     * Reads a tree from its wire form.
     *
     * @throws WireFormatException if a {@code var} operand is malformed
     */
    public static LogicExpression fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return LogicExpression.NULL;
        }
        if (node.isNumber()) {
            return new Literal(node.decimalValue());
        }
        if (node.isTextual()) {
            return new Literal(node.textValue());
        }
        if (node.isBoolean()) {
            return new Literal(node.booleanValue());
        }
        if (node.isArray()) {
            return new ListExpr(readAll(node));
        }
        if (!node.isObject()) {
            throw new WireFormatException("Unsupported JSON node type: " + node.getNodeType());
        }
        if (node.size() != 1) {
            Map<String, LogicExpression> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                fields.put(entry.getKey(), fromJson(entry.getValue()));
            }
            return new RecordExpr(fields);
        }
        Map.Entry<String, JsonNode> entry = node.fields().next();
        return readOperator(entry.getKey(), entry.getValue());
    }

    /**
     * Parses JSON text in wire form.
     *
     * @throws WireFormatException if the text is not valid JSON
     */
    public static LogicExpression parseJson(String json) {
        try {
            return fromJson(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new WireFormatException("Invalid logic JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static LogicExpression readOperator(String operator, JsonNode value) {
        List<LogicExpression> arguments = value.isArray() ? readAll(value) : List.of(fromJson(value));
        switch (operator) {
            case "var":
                return readVariable(value, arguments);
            case Operators.NOT_OPERATOR:
                return arguments.size() == 1 ? new UnaryOp(operator, arguments.get(0)) : new Call(operator, arguments);
            case "and":
            case "or":
                if (arguments.isEmpty()) {
                    throw new WireFormatException("'" + operator + "' requires at least one operand");
                }
                return new NaryOp(operator, arguments);
            default:
                if (arguments.size() == 2 && Operators.precedenceOf(operator) != Operators.PRIMARY) {
                    return new BinaryOp(operator, arguments.get(0), arguments.get(1));
                }
                return new Call(operator, arguments);
        }
    }

    private static LogicExpression readVariable(JsonNode value, List<LogicExpression> arguments) {
        JsonNode path = value.isArray() ? value.path(0) : value;
        if (!path.isTextual()) {
            throw new WireFormatException("'var' expects a string path, got: " + path.getNodeType());
        }
        // A default value keeps the generic call form.
        return arguments.size() == 1 ? new Variable(path.textValue()) : new Call("var", arguments);
    }

    private static List<LogicExpression> readAll(JsonNode array) {
        List<LogicExpression> elements = new ArrayList<>(array.size());
        array.forEach(element -> elements.add(fromJson(element)));
        return elements;
    }

    private static JsonNode literalNode(Literal literal) {
        Object value = literal.value();
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof BigDecimal number) {
            return numberNode(number);
        }
        if (value instanceof String text) {
            return NODES.textNode(text);
        }
        return NODES.booleanNode((Boolean) value);
    }

    /**
     * Integral values within {@code long} range become integer nodes, everything else a decimal node.
     * Integral values with a large exponent keep their compact scale.
     */
    public static JsonNode numberNode(BigDecimal number) {
        BigDecimal stripped = number.signum() == 0 ? BigDecimal.ZERO : number.stripTrailingZeros();
        if (stripped.scale() <= 0 && stripped.precision() - stripped.scale() <= 18) {
            long longValue = stripped.longValueExact();
            return longValue == (int) longValue ? NODES.numberNode((int) longValue) : NODES.numberNode(longValue);
        }
        boolean expandable = stripped.scale() < 0 && stripped.scale() >= -ExpressionDecompiler.MAX_PLAIN_EXPONENT;
        return NODES.numberNode(expandable ? stripped.setScale(0) : stripped);
    }

    private static ObjectNode operatorNode(String operator, List<LogicExpression> arguments) {
        ObjectNode node = NODES.objectNode();
        ArrayNode array = node.putArray(operator);
        arguments.forEach(argument -> array.add(toJson(argument)));
        return node;
    }
}

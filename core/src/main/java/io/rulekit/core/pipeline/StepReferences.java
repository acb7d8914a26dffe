package io.rulekit.core.pipeline;

import io.rulekit.core.model.ExecutionContext;
import io.rulekit.core.model.LogicExpression;
import io.rulekit.core.model.LogicExpression.BinaryOp;
import io.rulekit.core.model.LogicExpression.Call;
import io.rulekit.core.model.LogicExpression.ListExpr;
import io.rulekit.core.model.LogicExpression.Literal;
import io.rulekit.core.model.LogicExpression.NaryOp;
import io.rulekit.core.model.LogicExpression.RecordExpr;
import io.rulekit.core.model.LogicExpression.UnaryOp;
import io.rulekit.core.model.LogicExpression.Variable;
import java.util.LinkedHashSet;
import java.util.Set;

/** Finds the pipeline output keys a tree reads through {@code $.<key>} variables. */
public final class StepReferences {

    private StepReferences() {}

    /**
     * Returns the referenced output keys in first-occurrence order. For {@code $.pricing.total}
     * the key is {@code pricing}.
     */
    public static Set<String> referencedKeys(LogicExpression expression) {
        Set<String> keys = new LinkedHashSet<>();
        collect(expression, keys);
        return keys;
    }

    /** Extracts the output key from a variable path, or {@code null} if it is not a step reference. */
    public static String outputKeyOf(String path) {
        if (path == null || !path.startsWith(ExecutionContext.OUTPUT_REFERENCE_PREFIX)) {
            return null;
        }
        String rest = path.substring(ExecutionContext.OUTPUT_REFERENCE_PREFIX.length());
        int dot = rest.indexOf('.');
        String key = dot >= 0 ? rest.substring(0, dot) : rest;
        return key.isEmpty() ? null : key;
    }

    private static void collect(LogicExpression node, Set<String> keys) {
        if (node instanceof Variable variable) {
            addKey(variable.path(), keys);
        } else if (node instanceof UnaryOp unary) {
            collect(unary.operand(), keys);
        } else if (node instanceof BinaryOp binary) {
            collect(binary.left(), keys);
            collect(binary.right(), keys);
        } else if (node instanceof NaryOp nary) {
            nary.operands().forEach(operand -> collect(operand, keys));
        } else if (node instanceof Call call) {
            // var with a default value keeps its path as a string literal
            if (call.operator().equals("var")
                    && !call.arguments().isEmpty()
                    && call.arguments().get(0) instanceof Literal path
                    && path.isString()) {
                addKey((String) path.value(), keys);
            }
            call.arguments().forEach(argument -> collect(argument, keys));
        } else if (node instanceof ListExpr list) {
            list.elements().forEach(element -> collect(element, keys));
        } else if (node instanceof RecordExpr record) {
            record.fields().values().forEach(value -> collect(value, keys));
        }
    }

    private static void addKey(String path, Set<String> keys) {
        String key = outputKeyOf(path);
        if (key != null) {
            keys.add(key);
        }
    }
}

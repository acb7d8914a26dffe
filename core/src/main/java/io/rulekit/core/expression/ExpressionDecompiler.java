package io.rulekit.core.expression;

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
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a {@link LogicExpression} back to canonical business-language text.
 *
 * <p>
 * Uses the precedence levels of {@link Operators}. A child is parenthesised when its precedence
 * is lower than its parent's, and also when equal in a position the parser does not re-associate
 * (right operand of arithmetic, operands of a comparison, operands of a flattened
 * {@code and}/{@code or}). For every tree the parser produces,
 * {@code parser.parse(decompile(tree))} equals {@code tree}.
 */
public final class ExpressionDecompiler {

    static final int MAX_PLAIN_EXPONENT = 18;

    /** Renders the tree as business-language text. */
    public String decompile(LogicExpression expression) {
        return render(expression);
    }

    private String render(LogicExpression node) {
        if (node instanceof Literal literal) {
            return renderLiteral(literal);
        }
        if (node instanceof Variable variable) {
            return variable.path();
        }
        if (node instanceof UnaryOp unary) {
            String operand = render(unary.operand());
            return precedence(unary.operand()) < Operators.NOT ? "not (" + operand + ")" : "not " + operand;
        }
        if (node instanceof NaryOp nary) {
            return renderNary(nary);
        }
        if (node instanceof BinaryOp binary) {
            return renderBinary(binary);
        }
        if (node instanceof Call call) {
            return call.operator() + "(" + renderAll(call.arguments()) + ")";
        }
        if (node instanceof ListExpr list) {
            return "[" + renderAll(list.elements()) + "]";
        }
        RecordExpr record = (RecordExpr) node;
        return record.fields().entrySet().stream()
                .map(field -> quote(field.getKey()) + ": " + render(field.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private String renderNary(NaryOp nary) {
        if (isBetween(nary)) {
            BinaryOp lower = (BinaryOp) nary.operands().get(0);
            BinaryOp upper = (BinaryOp) nary.operands().get(1);
            return wrapAbove(lower.left(), Operators.COMPARISON) + " between "
                    + wrapAbove(lower.right(), Operators.COMPARISON) + " and "
                    + wrapAbove(upper.right(), Operators.COMPARISON);
        }
        int parent = Operators.precedenceOf(nary.operator());
        return nary.operands().stream()
                .map(operand -> wrapAbove(operand, parent))
                .collect(Collectors.joining(" " + nary.operator() + " "));
    }

    private String renderBinary(BinaryOp binary) {
        if (Operators.isNegation(binary)) {
            return "-" + wrapBelow(binary.right(), Operators.UNARY);
        }
        int parent = Operators.precedenceOf(binary.operator());
        String operator = binary.operator();
        if (parent == Operators.PRIMARY) {
            // Not an infix operator the parser knows; fall back to call syntax.
            return operator + "(" + render(binary.left()) + ", " + render(binary.right()) + ")";
        }
        String left = parent == Operators.COMPARISON
                ? wrapAbove(binary.left(), parent)
                : wrapBelow(binary.left(), parent);
        return left + " " + operator + " " + wrapAbove(binary.right(), parent);
    }

    /** Wraps the child unless it binds strictly tighter than {@code parent}. */
    private String wrapAbove(LogicExpression child, int parent) {
        String text = render(child);
        return precedence(child) <= parent ? "(" + text + ")" : text;
    }

    /** Wraps the child only if it binds looser than {@code parent}. */
    private String wrapBelow(LogicExpression child, int parent) {
        String text = render(child);
        return precedence(child) < parent ? "(" + text + ")" : text;
    }

    private String renderAll(List<LogicExpression> nodes) {
        return nodes.stream().map(this::render).collect(Collectors.joining(", "));
    }

    /** Effective precedence of a node as rendered. */
    static int precedence(LogicExpression node) {
        if (node instanceof NaryOp nary) {
            return isBetween(nary) ? Operators.COMPARISON : Operators.precedenceOf(nary.operator());
        }
        if (node instanceof UnaryOp) {
            return Operators.NOT;
        }
        if (node instanceof BinaryOp binary) {
            return Operators.isNegation(binary) ? Operators.UNARY : Operators.precedenceOf(binary.operator());
        }
        if (node instanceof Literal literal && literal.isNumber() && literal.numberValue().signum() < 0) {
            return Operators.UNARY;
        }
        return Operators.PRIMARY;
    }

    /**
     * A two-operand {@code and} of {@code x >= lo} and {@code x <= hi} over the same {@code x}.
     * Three or more operands, or differing left operands, never match.
     */
    static boolean isBetween(NaryOp nary) {
        if (!nary.operator().equals("and") || nary.operands().size() != 2) {
            return false;
        }
        return nary.operands().get(0) instanceof BinaryOp lower
                && nary.operands().get(1) instanceof BinaryOp upper
                && lower.operator().equals(">=")
                && upper.operator().equals("<=")
                && lower.left().equals(upper.left());
    }

    private static String renderLiteral(Literal literal) {
        Object value = literal.value();
        if (value == null) {
            return "null";
        }
        if (value instanceof BigDecimal number) {
            return formatNumber(number);
        }
        if (value instanceof String text) {
            return quote(text);
        }
        return value.toString();
    }

    /**
     * Integral values print without a fraction and other values in plain notation, as long as the
     * exponent stays within {@value #MAX_PLAIN_EXPONENT} digits. Larger exponents print in scientific
     * notation ({@code 1E+50}), which the lexer reads back to the same value.
     */
    static String formatNumber(BigDecimal number) {
        if (number.signum() == 0) {
            return "0";
        }
        BigDecimal stripped = number.stripTrailingZeros();
        if (Math.abs((long) stripped.scale()) > MAX_PLAIN_EXPONENT) {
            return stripped.toString();
        }
        return stripped.scale() <= 0 ? stripped.toBigInteger().toString() : stripped.toPlainString();
    }

    static String quote(String text) {
        StringBuilder out = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\t' -> out.append("\\t");
                default -> out.append(c);
            }
        }
        return out.append('"').toString();
    }
}

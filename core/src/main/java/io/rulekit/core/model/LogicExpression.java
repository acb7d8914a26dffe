package io.rulekit.core.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A compiled logic tree. Every compiler in rulekit targets this type; the wire form (nested
 * {@code {operator: [arguments]}} JSON) is produced only at the boundary by
 * {@link io.rulekit.core.expression.LogicJson}.
 *
 * <p>
 * The hierarchy is sealed: all node variants are known at compile time. Nodes are immutable and
 * compared structurally; identity is never significant.
 */
public sealed interface LogicExpression {

    /** The unconditional match. */
    Literal TRUE = new Literal(Boolean.TRUE);

    /** The absent value. */
    Literal NULL = new Literal(null);

    /** Returns {@code true} if this node is the boolean literal {@code true}. */
    default boolean isTrue() {
        return TRUE.equals(this);
    }

    static Literal literal(Object value) {
        return Literal.of(value);
    }

    static Variable var(String path) {
        return new Variable(path);
    }

    static BinaryOp binary(String operator, LogicExpression left, LogicExpression right) {
        return new BinaryOp(operator, left, right);
    }

    static NaryOp and(List<LogicExpression> operands) {
        return new NaryOp("and", operands);
    }

    static NaryOp or(List<LogicExpression> operands) {
        return new NaryOp("or", operands);
    }

    static Call call(String operator, List<LogicExpression> arguments) {
        return new Call(operator, arguments);
    }

    // ── Variants ──

    /**
     * A scalar literal: {@link BigDecimal}, {@link String}, {@link Boolean} or {@code null}.
     * Numbers compare numerically, so {@code 1.0} equals {@code 1}.
     */
    record Literal(Object value) implements LogicExpression {
        public Literal {
            if (value != null
                    && !(value instanceof BigDecimal)
                    && !(value instanceof String)
                    && !(value instanceof Boolean)) {
                throw new IllegalArgumentException(
                        "Literal must be a BigDecimal, String, Boolean or null, got: "
                                + value.getClass().getName());
            }
        }

        /** Creates a literal, widening any {@link Number} to {@link BigDecimal}. */
        public static Literal of(Object value) {
            if (value instanceof BigDecimal || value == null) {
                return new Literal(value);
            }
            if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
                return new Literal(BigDecimal.valueOf(((Number) value).longValue()));
            }
            if (value instanceof Number number) {
                return new Literal(new BigDecimal(number.toString()));
            }
            return new Literal(value);
        }

        public boolean isNumber() {
            return value instanceof BigDecimal;
        }

        public boolean isString() {
            return value instanceof String;
        }

        public boolean isBoolean() {
            return value instanceof Boolean;
        }

        public boolean isNull() {
            return value == null;
        }

        public BigDecimal numberValue() {
            return (BigDecimal) value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Literal other)) {
                return false;
            }
            if (value instanceof BigDecimal a && other.value instanceof BigDecimal b) {
                return a.compareTo(b) == 0;
            }
            return Objects.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            if (value instanceof BigDecimal number) {
                return number.signum() == 0 ? 0 : number.stripTrailingZeros().hashCode();
            }
            return Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return "Literal[" + (value instanceof String ? "\"" + value + "\"" : value) + "]";
        }
    }

    /** A reference to a field path in the data record, e.g. {@code customer.tier} or {@code $.subtotal}. */
    record Variable(String path) implements LogicExpression {
        public Variable {
            Objects.requireNonNull(path, "path must not be null");
        }
    }

    /** A prefix operator with one operand (logical not). */
    record UnaryOp(String operator, LogicExpression operand) implements LogicExpression {
        public UnaryOp {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    /** A two-operand operator: comparison, membership, string predicate or arithmetic. */
    record BinaryOp(String operator, LogicExpression left, LogicExpression right) implements LogicExpression {
        public BinaryOp {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    /** A flattened boolean connective ({@code and} / {@code or}) over two or more operands. */
    record NaryOp(String operator, List<LogicExpression> operands) implements LogicExpression {
        public NaryOp {
            Objects.requireNonNull(operator, "operator must not be null");
            operands = List.copyOf(operands);
        }
    }

    /**
     * A named operation with ordered arguments: a known function ({@code max}, {@code round},
     * {@code if}), the decision-table aggregate {@code collect}, or an opaque custom operator.
     */
    record Call(String operator, List<LogicExpression> arguments) implements LogicExpression {
        public Call {
            Objects.requireNonNull(operator, "operator must not be null");
            arguments = List.copyOf(arguments);
        }
    }

    /** A list literal, e.g. the right-hand side of {@code in}. */
    record ListExpr(List<LogicExpression> elements) implements LogicExpression {
        public ListExpr {
            elements = List.copyOf(elements);
        }
    }

    /** A field-keyed record, produced for decision tables with several output columns. */
    record RecordExpr(Map<String, LogicExpression> fields) implements LogicExpression {
        public RecordExpr {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }
    }
}

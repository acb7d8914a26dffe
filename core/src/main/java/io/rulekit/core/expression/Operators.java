package io.rulekit.core.expression;

import io.rulekit.core.model.LogicExpression;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Operator names, precedence levels and the known-function table shared by
 * {@link ExpressionParser} and {@link ExpressionDecompiler}. Keeping both sides on one table is
 * what makes {@code parse(decompile(tree))} reproduce {@code tree}.
 */
public final class Operators {

    // Precedence levels, lowest binding first.
    public static final int OR = 1;
    public static final int AND = 2;
    public static final int NOT = 3;
    public static final int COMPARISON = 4;
    public static final int ADDITIVE = 5;
    public static final int MULTIPLICATIVE = 6;
    public static final int UNARY = 7;
    public static final int PRIMARY = 8;

    public static final String NOT_OPERATOR = "!";

    /** Non-chaining infix operators of the comparison level, in canonical (wire) spelling. */
    public static final Set<String> COMPARISONS =
            Set.of("==", "!=", ">", ">=", "<", "<=", "in", "contains", "startsWith", "endsWith");

    public static final Set<String> ADDITIVE_OPERATORS = Set.of("+", "-");
    public static final Set<String> MULTIPLICATIVE_OPERATORS = Set.of("*", "/", "%");

    /** Comparison keywords as lexed (lower case) mapped to their canonical operator name. */
    static final Map<String, String> COMPARISON_KEYWORDS =
            Map.of("in", "in", "contains", "contains", "startswith", "startsWith", "endswith", "endsWith");

    /** Unbounded maximum arity. */
    static final int VARIADIC = Integer.MAX_VALUE;

    /**
     * A known function: canonical name and accepted argument count range.
     *
     * @param name    canonical operator name emitted into the tree
     * @param minArgs minimum argument count
     * @param maxArgs maximum argument count, {@link #VARIADIC} for no limit
     */
    record FunctionSignature(String name, int minArgs, int maxArgs) {

        boolean accepts(int count) {
            return count >= minArgs && count <= maxArgs;
        }

        String arityDescription() {
            if (minArgs == maxArgs) {
                return minArgs == 1 ? "exactly 1 argument" : "exactly " + minArgs + " arguments";
            }
            return maxArgs == VARIADIC ? "at least " + minArgs + " argument(s)" : minArgs + " to " + maxArgs + " arguments";
        }
    }

    private static final Map<String, FunctionSignature> FUNCTIONS = Map.ofEntries(
            function("min", 1, VARIADIC),
            function("max", 1, VARIADIC),
            function("abs", 1, 1),
            function("floor", 1, 1),
            function("ceil", 1, 1),
            function("len", 1, 1),
            function("upper", 1, 1),
            function("lower", 1, 1),
            function("trim", 1, 1),
            function("count", 1, 1),
            function("sum", 1, 1),
            function("avg", 1, 1),
            function("daysSince", 1, 1),
            function("isEmpty", 1, 1),
            function("round", 1, 2),
            function("now", 0, 0),
            function("substr", 0, VARIADIC),
            function("daysBetween", 0, VARIADIC),
            function("coalesce", 0, VARIADIC),
            function("if", 0, VARIADIC));

    private Operators() {}

    private static Map.Entry<String, FunctionSignature> function(String name, int minArgs, int maxArgs) {
        return Map.entry(name.toLowerCase(Locale.ROOT), new FunctionSignature(name, minArgs, maxArgs));
    }

    /** Looks up a known function by name, case-insensitively. */
    static Optional<FunctionSignature> function(String name) {
        return Optional.ofNullable(FUNCTIONS.get(name.toLowerCase(Locale.ROOT)));
    }

    /** Returns {@code true} if the canonical name belongs to the known-function table. */
    public static boolean isKnownFunction(String name) {
        return function(name).filter(signature -> signature.name().equals(name)).isPresent();
    }

    /** Precedence of an infix operator, or {@link #PRIMARY} for anything that is not infix. */
    public static int precedenceOf(String operator) {
        if (COMPARISONS.contains(operator)) {
            return COMPARISON;
        }
        if (ADDITIVE_OPERATORS.contains(operator)) {
            return ADDITIVE;
        }
        if (MULTIPLICATIVE_OPERATORS.contains(operator)) {
            return MULTIPLICATIVE;
        }
        return switch (operator) {
            case "or" -> OR;
            case "and" -> AND;
            case NOT_OPERATOR -> NOT;
            default -> PRIMARY;
        };
    }

    /** Returns {@code true} if the node is {@code 0 - x}, the tree form of unary minus. */
    static boolean isNegation(LogicExpression node) {
        return node instanceof LogicExpression.BinaryOp binary
                && binary.operator().equals("-")
                && binary.left() instanceof LogicExpression.Literal zero
                && zero.isNumber()
                && zero.numberValue().signum() == 0
                && !(binary.right() instanceof LogicExpression.Literal literal && literal.isNumber());
    }
}

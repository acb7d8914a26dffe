package io.rulekit.core.table;

import io.rulekit.core.error.CellCompileException;
import io.rulekit.core.model.DataType;
import io.rulekit.core.model.DecisionTableColumn;
import io.rulekit.core.model.LogicExpression;
import io.rulekit.core.model.LogicExpression.BinaryOp;
import io.rulekit.core.model.LogicExpression.ListExpr;
import io.rulekit.core.model.LogicExpression.Literal;
import io.rulekit.core.model.LogicExpression.NaryOp;
import io.rulekit.core.model.LogicExpression.Variable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Compiles decision-table cell shorthand into a predicate over the column's field.
 *
 * <table>
 * <caption>Cell syntax</caption>
 * <tr><th>Cell</th><th>Predicate</th></tr>
 * <tr><td>empty or {@code *}</td><td>{@code true}</td></tr>
 * <tr><td>{@code >= 50}, {@code <= 20}, {@code != x}, {@code == x}, {@code > 100},
 * {@code < 10}</td><td>that comparison</td></tr>
 * <tr><td>{@code 100..500}</td><td>{@code field >= 100 and field <= 500}</td></tr>
 * <tr><td>{@code US, CA, UK}</td><td>{@code field in ["US", "CA", "UK"]}</td></tr>
 * <tr><td>{@code true} / {@code false}</td><td>equality with a boolean</td></tr>
 * <tr><td>anything else</td><td>equality with the parsed value</td></tr>
 * </table>
 *
 * <p>
 * Cells do not go through the expression grammar. Values are typed by
 * {@link CellValues}.
 */
public final class CellCompiler {

    private static final String[] COMPARISON_PREFIXES = {">=", "<=", "!=", "==", ">", "<"};

    /** Compiles a condition cell of the given column. */
    public LogicExpression compile(String cellText, DecisionTableColumn column) {
        return compile(cellText, column.field(), column.dataType(), column.id());
    }

    /** Compiles a condition cell against a field path outside any table. */
    public LogicExpression compile(String cellText, String field, DataType type) {
        return compile(cellText, field, type, null);
    }

    private LogicExpression compile(String cellText, String field, DataType type, String columnId) {
        try {
            return compileCondition(cellText, field, type, columnId);
        } catch (CellCompileException e) {
            // Report the whole cell, not just the operand that failed.
            throw new CellCompileException(e.getMessage(), columnId, null, cellText);
        }
    }

    private LogicExpression compileCondition(String cellText, String field, DataType type, String columnId) {
        String text = cellText == null ? "" : cellText.trim();
        if (text.isEmpty() || text.equals("*")) {
            return LogicExpression.TRUE;
        }
        Variable subject = new Variable(field);

        String prefix = comparisonPrefix(text);
        if (prefix != null) {
            String operand = text.substring(prefix.length()).trim();
            if (operand.isEmpty()) {
                throw new CellCompileException(
                        "Comparison '" + prefix + "' requires a value", columnId, null, cellText);
            }
            return new BinaryOp(prefix, subject, CellValues.parse(operand, type, columnId));
        }

        int range = text.indexOf("..");
        if (range >= 0) {
            String low = text.substring(0, range).trim();
            String high = text.substring(range + 2).trim();
            if (low.isEmpty() || high.isEmpty()) {
                throw new CellCompileException(
                        "Invalid range \"" + text + "\", expected min..max", columnId, null, cellText);
            }
            return new NaryOp("and", List.of(
                    new BinaryOp(">=", subject, CellValues.parse(low, type, columnId)),
                    new BinaryOp("<=", subject, CellValues.parse(high, type, columnId))));
        }

        if (text.indexOf(',') >= 0) {
            List<LogicExpression> items = new ArrayList<>();
            for (String item : text.split(",")) {
                if (!item.isBlank()) {
                    items.add(CellValues.parse(item, type, columnId));
                }
            }
            return new BinaryOp("in", subject, new ListExpr(items));
        }

        String lower = text.toLowerCase(Locale.ROOT);
        if (type == DataType.BOOLEAN || lower.equals("true") || lower.equals("false")) {
            return new BinaryOp("==", subject, CellValues.parse(text, DataType.BOOLEAN, columnId));
        }
        return new BinaryOp("==", subject, CellValues.parse(text, type, columnId));
    }

    /**
     * Compiles an output cell to a typed value; an empty cell yields {@link LogicExpression#NULL}.
     */
    public LogicExpression compileOutput(String cellText, DecisionTableColumn column) {
        if (cellText == null || cellText.isBlank()) {
            return LogicExpression.NULL;
        }
        return CellValues.parse(cellText, column.dataType(), column.id());
    }

    /**
     * Checks a condition cell without failing.
     *
     * @return a description of the problem, or empty if the cell compiles
     */
    public Optional<String> validate(String cellText, DecisionTableColumn column) {
        LogicExpression compiled;
        try {
            compiled = compile(cellText, column);
        } catch (CellCompileException e) {
            return Optional.of(e.getMessage());
        }
        if (compiled instanceof NaryOp range
                && range.operands().get(0) instanceof BinaryOp lower
                && range.operands().get(1) instanceof BinaryOp upper
                && lower.right() instanceof Literal low
                && upper.right() instanceof Literal high
                && low.isNumber()
                && high.isNumber()
                && low.numberValue().compareTo(high.numberValue()) > 0) {
            return Optional.of("Range minimum must be less than or equal to maximum");
        }
        return Optional.empty();
    }

    private static String comparisonPrefix(String text) {
        for (String prefix : COMPARISON_PREFIXES) {
            if (text.startsWith(prefix)) {
                return prefix;
            }
        }
        return null;
    }
}

package io.rulekit.core.expression;

import io.rulekit.core.error.ExpressionSyntaxException;
import io.rulekit.core.model.LogicExpression;

/**
 * Outcome of {@link ExpressionParser#tryParse(String)}: either a compiled tree, or an error
 * message with the offending character offset.
 */
public final class ParseResult {

    private final LogicExpression expression;
    private final String error;
    private final int offset;

    private ParseResult(LogicExpression expression, String error, int offset) {
        this.expression = expression;
        this.error = error;
        this.offset = offset;
    }

    public static ParseResult success(LogicExpression expression) {
        return new ParseResult(expression, null, -1);
    }

    public static ParseResult failure(String error, int offset) {
        return new ParseResult(null, error, offset);
    }

    public boolean isSuccess() {
        return expression != null;
    }

    /** The compiled tree, or {@code null} on failure. */
    public LogicExpression expression() {
        return expression;
    }

    /** The error message, or {@code null} on success. */
    public String error() {
        return error;
    }

    /** Offset of the offending input, or {@code -1} on success. */
    public int offset() {
        return offset;
    }

    /** Returns the tree, or rethrows the failure as an {@link ExpressionSyntaxException}. */
    public LogicExpression orElseThrow() {
        if (expression == null) {
            throw new ExpressionSyntaxException(error, offset);
        }
        return expression;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ParseResult[SUCCESS, " + expression + "]" : "ParseResult[FAILURE, " + error + "]";
    }
}

package io.rulekit.core.error;

/**
 * Thrown by the lexer and parser when business-language text cannot be compiled. Always
 * recoverable: the caller re-prompts the author with {@link #getMessage()} and {@link #offset()}.
 */
public final class ExpressionSyntaxException extends LogicCompileException {

    private static final long serialVersionUID = 1L;

    private final int offset;

    public ExpressionSyntaxException(String message, int offset) {
        super(message, null, null);
        this.offset = offset;
    }

    public ExpressionSyntaxException(String message, int offset, String definitionId, String source) {
        super(message, definitionId, source);
        this.offset = offset;
    }

    /** Zero-based character offset of the offending input. */
    public int offset() {
        return offset;
    }
}

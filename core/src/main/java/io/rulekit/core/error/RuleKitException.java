package io.rulekit.core.error;

/**
 * Abstract base for all rulekit exceptions. Compile-phase errors extend
 * {@link LogicCompileException}; evaluation errors are {@link ExpressionEvalException}.
 */
public abstract class RuleKitException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        COMPILE,
        EVALUATION
    }

    private final String definitionId;
    private final Phase phase;

    protected RuleKitException(String message, String definitionId, Phase phase) {
        super(message);
        this.definitionId = definitionId;
        this.phase = phase;
    }

    protected RuleKitException(String message, Throwable cause, String definitionId, Phase phase) {
        super(message, cause);
        this.definitionId = definitionId;
        this.phase = phase;
    }

    /** The table, pipeline or rule that triggered the error, or {@code null} if not yet identified. */
    public String definitionId() {
        return definitionId;
    }

    /**
     * The message prefixed with phase and location, e.g.
     * {@code [EVALUATION checkout, step 3] Division by zero}.
     */
    public String describe() {
        StringBuilder prefix = new StringBuilder("[").append(phase);
        if (definitionId != null) {
            prefix.append(' ').append(definitionId);
        }
        return prefix.append(locationSuffix()).append("] ").append(getMessage()).toString();
    }

    /** Extra location detail appended after the definition id, such as a step or a source file. */
    protected String locationSuffix() {
        return "";
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}

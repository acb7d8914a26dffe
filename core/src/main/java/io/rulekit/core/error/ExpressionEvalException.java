package io.rulekit.core.error;

/**
 * Thrown by an apply-runtime when evaluation fails (unknown operator, type error, division by zero).
 * The pipeline executor catches these per step and attaches the pipeline id and step index through
 * {@link #atStep}.
 */
public final class ExpressionEvalException extends RuleKitException {

    private static final long serialVersionUID = 1L;

    private final Integer stepIndex;

    public ExpressionEvalException(String message) {
        this(message, null, null, null);
    }

    public ExpressionEvalException(String message, Throwable cause) {
        this(message, cause, null, null);
    }

    public ExpressionEvalException(String message, Throwable cause, String definitionId, Integer stepIndex) {
        super(message, cause, definitionId, Phase.EVALUATION);
        this.stepIndex = stepIndex;
    }

    /** The zero-based pipeline step index, or {@code null} outside a pipeline. */
    public Integer stepIndex() {
        return stepIndex;
    }

    /** Returns a copy located at the given pipeline step, keeping this exception as the cause. */
    public ExpressionEvalException atStep(String pipelineId, int index) {
        return new ExpressionEvalException(getMessage(), this, pipelineId, index);
    }

    @Override
    protected String locationSuffix() {
        return stepIndex != null ? ", step " + (stepIndex + 1) : "";
    }
}

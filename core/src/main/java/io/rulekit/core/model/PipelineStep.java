package io.rulekit.core.model;

import java.util.Objects;

/**
 * One step of a {@link Pipeline}. The compiled expression may read earlier steps' results
 * through {@code $.<outputKey>} variables.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param id         step identifier
 * @param name       human-readable name
 * @param outputKey  key the step's result is stored under; unique across the pipeline
 * @param kind       authoring kind (editor routing only)
 * @param expression the compiled logic tree
 * @param enabled    disabled steps are skipped and write nothing
 */
public record PipelineStep(
        String id, String name, String outputKey, StepKind kind, LogicExpression expression, boolean enabled) {

    public PipelineStep {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
        name = name != null ? name : id;
        outputKey = outputKey != null ? outputKey : "";
        kind = kind != null ? kind : StepKind.LOGIC;
    }

    /** Creates an enabled step whose id and name equal its output key. */
    public static PipelineStep of(String outputKey, StepKind kind, LogicExpression expression) {
        return new PipelineStep(outputKey, outputKey, outputKey, kind, expression, true);
    }

    /** Returns a copy of this step with the given enabled flag. */
    public PipelineStep withEnabled(boolean flag) {
        return new PipelineStep(id, name, outputKey, kind, expression, flag);
    }
}

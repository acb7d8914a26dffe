package io.rulekit.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of executing a {@link Pipeline}. Either every enabled step succeeded, or execution
 * stopped at the first failing step; in both cases the trace accumulated so far is kept.
 */
public final class PipelineResult {

    private final boolean success;
    private final ExecutionContext context;
    private final List<StepTrace> trace;
    private final String failedStepId;
    private final String error;
    private final Duration elapsed;

    private PipelineResult(
            boolean success,
            ExecutionContext context,
            List<StepTrace> trace,
            String failedStepId,
            String error,
            Duration elapsed) {
        this.success = success;
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.trace = List.copyOf(trace);
        this.failedStepId = failedStepId;
        this.error = error;
        this.elapsed = elapsed;
    }

    /** Creates a result for a run in which every enabled step succeeded. */
    public static PipelineResult success(ExecutionContext context, List<StepTrace> trace, Duration elapsed) {
        return new PipelineResult(true, context, trace, null, null, elapsed);
    }

    /** Creates a result for a run halted by the given step. */
    public static PipelineResult failure(
            ExecutionContext context, List<StepTrace> trace, String failedStepId, String error, Duration elapsed) {
        Objects.requireNonNull(failedStepId, "failedStepId must not be null for a failure");
        return new PipelineResult(false, context, trace, failedStepId, error, elapsed);
    }

    public boolean isSuccess() {
        return success;
    }

    /** The final context (input plus every step result written before completion or failure). */
    public ExecutionContext context() {
        return context;
    }

    /** Ordered per-step records, skipped steps included in their original position. */
    public List<StepTrace> trace() {
        return trace;
    }

    /** The id of the step that halted execution, or {@code null} on success. */
    public String failedStepId() {
        return failedStepId;
    }

    /** The failure message naming the failing step, or {@code null} on success. */
    public String error() {
        return error;
    }

    public Duration elapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return success
                ? "PipelineResult[SUCCESS, steps=" + trace.size() + "]"
                : "PipelineResult[FAILURE, step=" + failedStepId + "]";
    }
}

package io.rulekit.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;

/**
 * Execution record of one pipeline step.
 *
 * @param index     zero-based position of the step in the pipeline
 * @param stepId    step identifier
 * @param stepName  step name
 * @param outputKey the step's output key
 * @param status    outcome of the step
 * @param value     evaluated value ({@code null} unless succeeded)
 * @param error     error message ({@code null} unless failed)
 * @param elapsed   wall-clock evaluation time ({@link Duration#ZERO} when skipped)
 */
public record StepTrace(
        int index,
        String stepId,
        String stepName,
        String outputKey,
        Status status,
        JsonNode value,
        String error,
        Duration elapsed) {

    /** Outcome of a single step. */
    public enum Status {
        SUCCEEDED,
        SKIPPED,
        FAILED
    }

    public static StepTrace succeeded(int index, PipelineStep step, JsonNode value, Duration elapsed) {
        return new StepTrace(index, step.id(), step.name(), step.outputKey(), Status.SUCCEEDED, value, null, elapsed);
    }

    public static StepTrace skipped(int index, PipelineStep step) {
        return new StepTrace(index, step.id(), step.name(), step.outputKey(), Status.SKIPPED, null, null, Duration.ZERO);
    }

    public static StepTrace failed(int index, PipelineStep step, String error, Duration elapsed) {
        return new StepTrace(index, step.id(), step.name(), step.outputKey(), Status.FAILED, null, error, elapsed);
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}

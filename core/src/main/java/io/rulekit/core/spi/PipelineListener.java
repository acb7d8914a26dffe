package io.rulekit.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * SPI for observing pipeline execution, e.g. to bridge into metrics or audit trails.
 *
 * <p>
 * All methods receive immutable event objects. Implementations MUST be thread-safe and
 * non-blocking. Exceptions thrown by listeners are caught by the executor and logged; they never
 * affect execution.
 */
public interface PipelineListener {

    /** Called before the first step runs. */
    void onPipelineStarted(PipelineStartedEvent event);

    /** Called after each enabled step evaluates successfully. */
    void onStepCompleted(StepCompletedEvent event);

    /** Called for each disabled step. */
    void onStepSkipped(StepSkippedEvent event);

    /** Called when a step fails; no further steps run. */
    void onStepFailed(StepFailedEvent event);

    /** Called once execution ends, successfully or not. */
    void onPipelineCompleted(PipelineCompletedEvent event);

    // --- Event records ---

    record PipelineStartedEvent(String pipelineId, int stepCount) {}

    record StepCompletedEvent(String pipelineId, int stepIndex, String stepId, String outputKey, JsonNode value,
            long durationMs) {}

    record StepSkippedEvent(String pipelineId, int stepIndex, String stepId, String outputKey) {}

    record StepFailedEvent(String pipelineId, int stepIndex, String stepId, String outputKey, long durationMs,
            String errorDetail) {}

    record PipelineCompletedEvent(String pipelineId, boolean success, int executedSteps, long durationMs) {}
}

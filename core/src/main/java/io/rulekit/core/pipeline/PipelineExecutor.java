package io.rulekit.core.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.rulekit.core.error.ExpressionEvalException;
import io.rulekit.core.model.ExecutionContext;
import io.rulekit.core.model.Pipeline;
import io.rulekit.core.model.PipelineResult;
import io.rulekit.core.model.PipelineStep;
import io.rulekit.core.model.StepTrace;
import io.rulekit.core.spi.LogicRuntime;
import io.rulekit.core.spi.PipelineListener;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs a pipeline: a single sequential pass over its steps, threading one
 * {@link ExecutionContext} through them.
 *
 * <p>
 * Disabled steps are recorded as skipped and write nothing. Each enabled step is evaluated by
 * the {@link LogicRuntime} against the current context, so later steps see earlier results
 * under {@code $.<outputKey>}. The first runtime failure stops execution; the trace collected so
 * far is kept in the returned {@link PipelineResult}.
 *
 * <p>
 * Thread-safe: every call allocates its own context and trace.
 */
public final class PipelineExecutor {

    /** MDC key holding the pipeline id while {@link #execute} runs. */
    public static final String MDC_PIPELINE_ID = "pipeline_id";

    private static final Logger LOG = LoggerFactory.getLogger(PipelineExecutor.class);

    private final LogicRuntime runtime;
    private final PipelineListener listener;

    /** Creates an executor without a listener. */
    public PipelineExecutor(LogicRuntime runtime) {
        this(runtime, null);
    }

    /**
     * Creates an executor.
     *
     * @param runtime  evaluates each step's tree; must not be null
     * @param listener optional observer of execution events, may be {@code null}
     */
    public PipelineExecutor(LogicRuntime runtime, PipelineListener listener) {
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
        this.listener = listener; // nullable
    }

    /** Executes the pipeline against the given input record. */
    public PipelineResult execute(Pipeline pipeline, JsonNode input) {
        return execute(pipeline.id(), pipeline.steps(), input);
    }

    /**
     * Executes the steps in order against the given input record.
     *
     * @param pipelineId identifier used in logs and events
     * @param steps      ordered steps
     * @param input      input record (a JSON object, or {@code null} for an empty one)
     * @return the outcome, never {@code null}; runtime failures are reported in it, not thrown
     */
    public PipelineResult execute(String pipelineId, List<PipelineStep> steps, JsonNode input) {
        Objects.requireNonNull(steps, "steps must not be null");
        MDC.put(MDC_PIPELINE_ID, pipelineId);
        try {
            return executeInternal(pipelineId, steps, new ExecutionContext(input));
        } finally {
            MDC.remove(MDC_PIPELINE_ID);
        }
    }

    private PipelineResult executeInternal(String pipelineId, List<PipelineStep> steps, ExecutionContext context) {
        long started = System.nanoTime();
        List<StepTrace> trace = new ArrayList<>(steps.size());
        LOG.info("Starting pipeline execution: pipeline_id={}, steps={}", pipelineId, steps.size());
        notifyStarted(pipelineId, steps.size());

        for (int index = 0; index < steps.size(); index++) {
            PipelineStep step = steps.get(index);
            if (!step.enabled()) {
                trace.add(StepTrace.skipped(index, step));
                LOG.debug("Step skipped: step={}/{}, step_id={}", index + 1, steps.size(), step.id());
                notifySkipped(pipelineId, index, step);
                continue;
            }

            long stepStarted = System.nanoTime();
            JsonNode value;
            try {
                value = runtime.apply(step.expression(), context.toData());
            } catch (RuntimeException e) {
                Duration stepElapsed = since(stepStarted);
                String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                trace.add(StepTrace.failed(index, step, detail, stepElapsed));
                String error = "Step '" + step.id() + "' (" + step.name() + ") failed: " + detail;
                LOG.warn(
                        "Pipeline aborted at step {}/{}: step_id={}, output_key={}, error={}",
                        index + 1,
                        steps.size(),
                        step.id(),
                        step.outputKey(),
                        detail);
                ExpressionEvalException cause = e instanceof ExpressionEvalException eval
                        ? eval.atStep(pipelineId, index)
                        : new ExpressionEvalException(detail, e, pipelineId, index);
                LOG.debug("Step failure cause: {}", cause.describe(), cause);
                notifyFailed(pipelineId, index, step, stepElapsed, detail);
                Duration elapsed = since(started);
                notifyCompleted(pipelineId, false, trace.size(), elapsed);
                return PipelineResult.failure(context, trace, step.id(), error, elapsed);
            }

            Duration stepElapsed = since(stepStarted);
            JsonNode stored = value != null ? value : NullNode.getInstance();
            context.putOutput(step.outputKey(), stored);
            trace.add(StepTrace.succeeded(index, step, stored, stepElapsed));
            LOG.debug(
                    "Step completed: step={}/{}, step_id={}, output_key={}, duration_ms={}",
                    index + 1,
                    steps.size(),
                    step.id(),
                    step.outputKey(),
                    stepElapsed.toMillis());
            notifyStepCompleted(pipelineId, index, step, stored, stepElapsed);
        }

        Duration elapsed = since(started);
        LOG.info(
                "Pipeline execution complete: pipeline_id={}, steps={}, duration_ms={}",
                pipelineId,
                trace.size(),
                elapsed.toMillis());
        notifyCompleted(pipelineId, true, trace.size(), elapsed);
        return PipelineResult.success(context, trace, elapsed);
    }

    private static Duration since(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    // --- Listener notifications (failures are logged, never propagated) ---

    private void notifyStarted(String pipelineId, int stepCount) {
        if (listener == null) return;
        try {
            listener.onPipelineStarted(new PipelineListener.PipelineStartedEvent(pipelineId, stepCount));
        } catch (Exception e) {
            LOG.warn("PipelineListener.onPipelineStarted failed", e);
        }
    }

    private void notifyStepCompleted(String pipelineId, int index, PipelineStep step, JsonNode value, Duration elapsed) {
        if (listener == null) return;
        try {
            listener.onStepCompleted(new PipelineListener.StepCompletedEvent(
                    pipelineId, index, step.id(), step.outputKey(), value, elapsed.toMillis()));
        } catch (Exception e) {
            LOG.warn("PipelineListener.onStepCompleted failed", e);
        }
    }

    private void notifySkipped(String pipelineId, int index, PipelineStep step) {
        if (listener == null) return;
        try {
            listener.onStepSkipped(
                    new PipelineListener.StepSkippedEvent(pipelineId, index, step.id(), step.outputKey()));
        } catch (Exception e) {
            LOG.warn("PipelineListener.onStepSkipped failed", e);
        }
    }

    private void notifyFailed(String pipelineId, int index, PipelineStep step, Duration elapsed, String detail) {
        if (listener == null) return;
        try {
            listener.onStepFailed(new PipelineListener.StepFailedEvent(
                    pipelineId, index, step.id(), step.outputKey(), elapsed.toMillis(), detail));
        } catch (Exception e) {
            LOG.warn("PipelineListener.onStepFailed failed", e);
        }
    }

    private void notifyCompleted(String pipelineId, boolean success, int executedSteps, Duration elapsed) {
        if (listener == null) return;
        try {
            listener.onPipelineCompleted(new PipelineListener.PipelineCompletedEvent(
                    pipelineId, success, executedSteps, elapsed.toMillis()));
        } catch (Exception e) {
            LOG.warn("PipelineListener.onPipelineCompleted failed", e);
        }
    }
}

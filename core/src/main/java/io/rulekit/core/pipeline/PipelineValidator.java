package io.rulekit.core.pipeline;

import io.rulekit.core.model.Finding;
import io.rulekit.core.model.Pipeline;
import io.rulekit.core.model.PipelineStep;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Static pre-flight check of a step list, independent of input data and of any runtime.
 *
 * <p>
 * Walks the steps in order and reports, per step: an empty output key, an output key that is not
 * a valid identifier, a duplicate output key, and {@code $.<key>} references to keys that are not
 * defined by a strictly earlier step (forward or unknown references). Disabled steps count as
 * defining their key. Whole pipelines are also checked for an id, a name and at least one step.
 * Findings are advisory: nothing here throws or blocks saving.
 */
public final class PipelineValidator {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /** Validates the pipeline itself and its steps; see {@link #validate(List)}. */
    public List<String> validate(Pipeline pipeline) {
        return errorsOf(review(pipeline));
    }

    /** Returns problems and warnings for the pipeline itself and its steps. */
    public List<Finding> review(Pipeline pipeline) {
        List<Finding> findings = new ArrayList<>();
        if (pipeline.id().isBlank()) {
            findings.add(Finding.error(null, "Pipeline must have an id"));
        }
        if (pipeline.name().isBlank()) {
            findings.add(Finding.error(null, "Pipeline must have a name"));
        }
        if (pipeline.steps().isEmpty()) {
            findings.add(Finding.error(null, "Pipeline must have at least one step"));
            return findings;
        }
        findings.addAll(review(pipeline.steps()));
        return findings;
    }

    /**
     * Returns the problems found, in step order. An empty list means no problems.
     */
    public List<String> validate(List<PipelineStep> steps) {
        return errorsOf(review(steps));
    }

    /**
     * Returns problems and warnings. Warnings flag step outputs that no later step reads (the last
     * step is exempt, its output is the pipeline's result).
     */
    public List<Finding> review(List<PipelineStep> steps) {
        List<Finding> findings = new ArrayList<>();
        Set<String> defined = new HashSet<>();
        for (int index = 0; index < steps.size(); index++) {
            PipelineStep step = steps.get(index);
            String label = label(index, step);
            String key = step.outputKey();

            if (step.name().isBlank()) {
                findings.add(Finding.error(step.id(), label + ": step must have a name"));
            }
            if (key.isBlank()) {
                findings.add(Finding.error(step.id(), label + ": output key must not be empty"));
            } else if (!IDENTIFIER.matcher(key).matches()) {
                findings.add(Finding.error(
                        step.id(),
                        label + ": output key \"" + key + "\" must be a valid identifier"
                                + " (letters, digits and underscore, not starting with a digit)"));
            }
            if (!key.isBlank() && defined.contains(key)) {
                findings.add(Finding.error(step.id(), label + ": duplicate output key \"" + key + "\""));
            }

            for (String reference : StepReferences.referencedKeys(step.expression())) {
                if (defined.contains(reference)) {
                    continue;
                }
                findings.add(Finding.error(step.id(), label + ": " + describeMissing(reference, index, steps)));
            }
            if (!key.isBlank()) {
                defined.add(key);
            }
        }
        findings.addAll(unusedOutputs(steps));
        return findings;
    }

    private static List<String> errorsOf(List<Finding> findings) {
        return findings.stream()
                .filter(Finding::isError)
                .map(Finding::message)
                .toList();
    }

    private static String describeMissing(String reference, int index, List<PipelineStep> steps) {
        if (reference.equals(steps.get(index).outputKey())) {
            return "references its own output $." + reference;
        }
        for (int later = index + 1; later < steps.size(); later++) {
            if (reference.equals(steps.get(later).outputKey())) {
                return "references $." + reference + ", which is defined by a later step; move \""
                        + steps.get(later).id() + "\" before \"" + steps.get(index).id() + "\"";
            }
        }
        return "references $." + reference + ", which no step defines";
    }

    private static List<Finding> unusedOutputs(List<PipelineStep> steps) {
        List<Finding> warnings = new ArrayList<>();
        for (int index = 0; index < steps.size() - 1; index++) {
            PipelineStep step = steps.get(index);
            if (step.outputKey().isBlank()) {
                continue;
            }
            boolean used = false;
            for (int later = index + 1; later < steps.size() && !used; later++) {
                used = StepReferences.referencedKeys(steps.get(later).expression()).contains(step.outputKey());
            }
            if (!used) {
                warnings.add(Finding.warning(
                        step.id(),
                        "Step \"" + step.outputKey() + "\" output is never used by subsequent steps"));
            }
        }
        return warnings;
    }

    private static String label(int index, PipelineStep step) {
        return "Step " + (index + 1) + " (\"" + step.id() + "\")";
    }
}

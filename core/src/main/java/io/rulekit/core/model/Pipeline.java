package io.rulekit.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An ordered list of computation steps. Steps execute strictly in list order.
 *
 * <p>
 * Immutable and thread-safe.
 */
public record Pipeline(String id, String name, List<PipelineStep> steps) {

    public Pipeline {
        Objects.requireNonNull(id, "id must not be null");
        name = name != null ? name : id;
        steps = List.copyOf(Objects.requireNonNull(steps, "steps must not be null"));
    }
}

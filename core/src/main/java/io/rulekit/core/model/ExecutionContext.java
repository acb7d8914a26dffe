package io.rulekit.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-execution state of a pipeline run: the caller's input record plus the results of the steps
 * executed so far.
 *
 * <p>
 * Step results live in their own ordered map, never inside the input record, so an output key can
 * not collide with an input field path. {@link #toData()} builds the record an apply-runtime sees:
 * the input fields at the root and the step results under the reserved {@value #OUTPUT_NAMESPACE}
 * member, which makes {@code $.subtotal} resolve to the {@code subtotal} step's result. An input
 * field literally named {@code $} is shadowed in that view.
 *
 * <p>
 * Not thread-safe: exactly one instance exists per execution call and it is never shared.
 */
public final class ExecutionContext {

    /** Reserved root member under which step results are exposed. */
    public static final String OUTPUT_NAMESPACE = "$";

    /** Prefix of a variable path that reads a step result. */
    public static final String OUTPUT_REFERENCE_PREFIX = OUTPUT_NAMESPACE + ".";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectNode input;
    private final Map<String, JsonNode> outputs = new LinkedHashMap<>();

    /**
     * Creates a context seeded with the given input record.
     *
     * @param input a JSON object, or {@code null} for an empty record
     * @throws IllegalArgumentException if the input is not a JSON object
     */
    public ExecutionContext(JsonNode input) {
        if (input == null || input.isNull() || input.isMissingNode()) {
            this.input = NODES.objectNode();
        } else if (input instanceof ObjectNode object) {
            this.input = object;
        } else {
            throw new IllegalArgumentException("input record must be a JSON object, got: " + input.getNodeType());
        }
    }

    /** The caller's input record (never modified by execution). */
    public JsonNode input() {
        return input;
    }

    /** Unmodifiable view of the step results in execution order. */
    public Map<String, JsonNode> outputs() {
        return Collections.unmodifiableMap(outputs);
    }

    /** Returns the result stored under the given output key, if that step ran. */
    public Optional<JsonNode> output(String outputKey) {
        return Optional.ofNullable(outputs.get(outputKey));
    }

    public boolean hasOutput(String outputKey) {
        return outputs.containsKey(outputKey);
    }

    /**
     * Records a step result. Called by the pipeline executor once per executed step.
     *
     * @param outputKey the step's output key
     * @param value     the evaluated value; {@code null} is stored as JSON null
     */
    public void putOutput(String outputKey, JsonNode value) {
        Objects.requireNonNull(outputKey, "outputKey must not be null");
        outputs.put(outputKey, value != null ? value : NODES.nullNode());
    }

    /** Builds the data record handed to the apply-runtime for the next step. */
    public JsonNode toData() {
        ObjectNode data = NODES.objectNode();
        data.setAll(input);
        ObjectNode namespace = data.putObject(OUTPUT_NAMESPACE);
        outputs.forEach(namespace::set);
        return data;
    }
}

package io.rulekit.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * A custom operator: receives its already-evaluated arguments and returns the result.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe and signal failures with
 * {@link io.rulekit.core.error.ExpressionEvalException}.
 */
@FunctionalInterface
public interface LogicOperator {

    /**
     * Applies the operator.
     *
     * @param arguments evaluated arguments, in order; JSON null is {@code NullNode}
     * @return the result, never {@code null}
     */
    JsonNode apply(List<JsonNode> arguments);
}

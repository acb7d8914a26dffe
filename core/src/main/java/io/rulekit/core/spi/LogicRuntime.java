package io.rulekit.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.rulekit.core.model.LogicExpression;

/**
 * Pluggable apply-runtime SPI: evaluates a compiled logic tree against a data record. Compilers
 * in this module only produce trees; evaluation always goes through this interface.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe. Besides the standard boolean, comparison,
 * arithmetic and collection operators they must support every operator the compilers emit:
 * {@code contains startsWith endsWith upper lower trim len abs floor ceil round count sum avg
 * now daysSince daysBetween isEmpty coalesce between collect}.
 */
public interface LogicRuntime {

    /**
     * Evaluates the tree.
     *
     * @param expression the compiled tree
     * @param data       the data record; pipeline results are under the {@code $} member
     * @return the result, never {@code null} (JSON null is {@code NullNode})
     * @throws io.rulekit.core.error.ExpressionEvalException if evaluation fails
     */
    JsonNode apply(LogicExpression expression, JsonNode data);
}

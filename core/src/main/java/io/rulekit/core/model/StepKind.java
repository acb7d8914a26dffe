package io.rulekit.core.model;

/**
 * How a pipeline step was authored. Used by editors to route a step to the right authoring
 * surface; the executor never looks at it.
 */
public enum StepKind {
    /** Business-language text compiled by the expression parser. */
    EXPRESSION,
    /** A decision table compiled by the table compiler. */
    DECISION_TABLE,
    /** A raw logic tree supplied in wire form. */
    LOGIC
}

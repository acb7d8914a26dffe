package io.rulekit.core.model;

/**
 * How a decision table combines matching rows.
 *
 * <ul>
 * <li>{@link #FIRST_MATCH}: the first row whose condition holds wins (if/elseif chain).</li>
 * <li>{@link #COLLECT_ALL}: every matching row's output is returned, in row order.</li>
 * </ul>
 */
public enum HitPolicy {
    FIRST_MATCH,
    COLLECT_ALL
}

package io.rulekit.core.model;

/** Whether a decision-table column is a condition (input) or a result (output). */
public enum ColumnRole {
    INPUT,
    OUTPUT
}

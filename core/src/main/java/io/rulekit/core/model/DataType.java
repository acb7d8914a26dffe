package io.rulekit.core.model;

/** Declared data type of a decision-table column; drives cell value parsing. */
public enum DataType {
    STRING,
    NUMBER,
    BOOLEAN
}

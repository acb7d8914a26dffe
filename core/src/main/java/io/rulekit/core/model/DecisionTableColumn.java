package io.rulekit.core.model;

import java.util.Objects;

/**
 * A decision-table column. The {@code id} is the stable handle used as key in each row's cell
 * map; {@code field} is the data path the column reads (inputs) or writes (outputs).
 *
 * @param id       unique within the table
 * @param role     input (condition) or output (result)
 * @param field    dotted field path, e.g. {@code customer.tier}
 * @param label    human-readable header
 * @param dataType declared type used to parse cell values
 */
public record DecisionTableColumn(String id, ColumnRole role, String field, String label, DataType dataType) {

    public DecisionTableColumn {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(field, "field must not be null");
        dataType = dataType != null ? dataType : DataType.STRING;
        label = label != null ? label : field;
    }

    public static DecisionTableColumn input(String id, String field, DataType dataType) {
        return new DecisionTableColumn(id, ColumnRole.INPUT, field, field, dataType);
    }

    public static DecisionTableColumn output(String id, String field, DataType dataType) {
        return new DecisionTableColumn(id, ColumnRole.OUTPUT, field, field, dataType);
    }

    public boolean isInput() {
        return role == ColumnRole.INPUT;
    }

    public boolean isOutput() {
        return role == ColumnRole.OUTPUT;
    }
}

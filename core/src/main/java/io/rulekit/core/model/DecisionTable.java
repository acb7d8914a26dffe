package io.rulekit.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A spreadsheet-style decision matrix. Row order is significant: it decides the winner under
 * {@link HitPolicy#FIRST_MATCH} and the output order under {@link HitPolicy#COLLECT_ALL}.
 *
 * <p>
 * Immutable and thread-safe.
 */
public record DecisionTable(
        String id,
        String name,
        String description,
        HitPolicy hitPolicy,
        List<DecisionTableColumn> columns,
        List<DecisionTableRow> rows) {

    public DecisionTable {
        hitPolicy = hitPolicy != null ? hitPolicy : HitPolicy.FIRST_MATCH;
        columns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));
        rows = List.copyOf(Objects.requireNonNull(rows, "rows must not be null"));
    }

    public DecisionTable(
            String id,
            String name,
            HitPolicy hitPolicy,
            List<DecisionTableColumn> columns,
            List<DecisionTableRow> rows) {
        this(id, name, null, hitPolicy, columns, rows);
    }

    public List<DecisionTableColumn> inputColumns() {
        return columns.stream().filter(DecisionTableColumn::isInput).toList();
    }

    public List<DecisionTableColumn> outputColumns() {
        return columns.stream().filter(DecisionTableColumn::isOutput).toList();
    }

    /** Returns a copy of this table with the given rows. */
    public DecisionTable withRows(List<DecisionTableRow> newRows) {
        return new DecisionTable(id, name, description, hitPolicy, columns, newRows);
    }

    /** Returns a copy of this table with the given hit policy. */
    public DecisionTable withHitPolicy(HitPolicy policy) {
        return new DecisionTable(id, name, description, policy, columns, rows);
    }
}

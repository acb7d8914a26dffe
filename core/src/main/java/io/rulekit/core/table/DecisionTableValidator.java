package io.rulekit.core.table;

import io.rulekit.core.error.CellCompileException;
import io.rulekit.core.model.DecisionTable;
import io.rulekit.core.model.DecisionTableColumn;
import io.rulekit.core.model.DecisionTableRow;
import io.rulekit.core.model.Finding;
import io.rulekit.core.model.HitPolicy;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Static, non-throwing checks over a {@link DecisionTable}: structure, cell syntax and
 * reachability. Findings are advisory and never block saving.
 */
public final class DecisionTableValidator {

    private final CellCompiler cells;

    public DecisionTableValidator() {
        this(new CellCompiler());
    }

    public DecisionTableValidator(CellCompiler cells) {
        this.cells = cells;
    }

    /** Validates the table; an empty list means no problems were found. */
    public List<Finding> validate(DecisionTable table) {
        List<Finding> findings = new ArrayList<>();
        if (isBlank(table.id())) {
            findings.add(Finding.error(null, "Table must have an id"));
        }
        if (isBlank(table.name())) {
            findings.add(Finding.error(null, "Table must have a name"));
        }
        if (table.columns().isEmpty()) {
            findings.add(Finding.error(null, "Table must have at least one column"));
        }
        if (table.inputColumns().isEmpty()) {
            findings.add(Finding.error(null, "Table must have at least one input column"));
        }
        if (table.outputColumns().isEmpty()) {
            findings.add(Finding.error(null, "Table must have at least one output column"));
        }

        Set<String> columnIds = new HashSet<>();
        for (DecisionTableColumn column : table.columns()) {
            if (!columnIds.add(column.id())) {
                findings.add(Finding.error(column.id(), "Duplicate column id: " + column.id()));
            }
        }

        Set<String> rowIds = new HashSet<>();
        for (DecisionTableRow row : table.rows()) {
            if (!rowIds.add(row.id())) {
                findings.add(Finding.error(row.id(), "Duplicate row id: " + row.id()));
            }
            for (String cellColumn : row.cells().keySet()) {
                if (!columnIds.contains(cellColumn)) {
                    findings.add(Finding.error(row.id(), "Unknown column id \"" + cellColumn + "\""));
                }
            }
            checkCells(row, table, findings);
        }

        if (table.hitPolicy() == HitPolicy.FIRST_MATCH) {
            checkReachability(table, findings);
        }
        return findings;
    }

    private void checkCells(DecisionTableRow row, DecisionTable table, List<Finding> findings) {
        for (DecisionTableColumn column : table.inputColumns()) {
            Optional<String> problem = cells.validate(row.cell(column.id()), column);
            problem.ifPresent(message -> findings.add(Finding.error(row.id(), label(column) + message)));
        }
        for (DecisionTableColumn column : table.outputColumns()) {
            try {
                cells.compileOutput(row.cell(column.id()), column);
            } catch (CellCompileException e) {
                findings.add(Finding.error(row.id(), label(column) + e.getMessage()));
            }
        }
    }

    /** Rows after the first catch-all can never win under first-match. */
    private void checkReachability(DecisionTable table, List<Finding> findings) {
        String catchAll = null;
        for (DecisionTableRow row : table.rows()) {
            if (catchAll != null) {
                findings.add(Finding.warning(
                        row.id(),
                        "Row '" + row.id() + "' is unreachable: row '" + catchAll
                                + "' matches every input and wins under FIRST_MATCH"));
            } else if (isCatchAll(row, table)) {
                catchAll = row.id();
            }
        }
    }

    private boolean isCatchAll(DecisionTableRow row, DecisionTable table) {
        for (DecisionTableColumn column : table.inputColumns()) {
            try {
                if (!cells.compile(row.cell(column.id()), column).isTrue()) {
                    return false;
                }
            } catch (CellCompileException e) {
                // Reported by checkCells.
                return false;
            }
        }
        return true;
    }

    private static String label(DecisionTableColumn column) {
        return "Column '" + column.id() + "': ";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

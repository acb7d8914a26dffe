package io.rulekit.core.error;

/**
 * Thrown when a decision-table cell cannot be compiled, e.g. a non-numeric value in a NUMBER
 * column. Names the offending column, row and cell text.
 */
public final class CellCompileException extends LogicCompileException {

    private static final long serialVersionUID = 1L;

    private final String columnId;
    private final String rowId;
    private final String cellText;

    public CellCompileException(String message, String columnId, String rowId, String cellText) {
        this(message, columnId, rowId, cellText, null);
    }

    public CellCompileException(String message, String columnId, String rowId, String cellText, String definitionId) {
        super(message, definitionId, columnId);
        this.columnId = columnId;
        this.rowId = rowId;
        this.cellText = cellText;
    }

    /** The column id, or {@code null} when compiled outside a table. */
    public String columnId() {
        return columnId;
    }

    /** The row id, or {@code null} when not known. */
    public String rowId() {
        return rowId;
    }

    /** The raw cell text that failed to compile. */
    public String cellText() {
        return cellText;
    }

    /** Returns a copy of this exception with the row and table attached. */
    public CellCompileException withLocation(String rowId, String definitionId) {
        String located = getMessage() + " (column '" + columnId + "', row '" + rowId + "')";
        return new CellCompileException(located, columnId, rowId, cellText, definitionId);
    }
}

package io.rulekit.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A decision-table row: an ordered mapping from column id to cell text. A column with no entry
 * is treated as an empty (wildcard) cell.
 */
public record DecisionTableRow(String id, Map<String, String> cells) {

    public DecisionTableRow {
        Objects.requireNonNull(id, "id must not be null");
        cells = cells == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    }

    /** Returns the cell text for the given column, or an empty string if absent. */
    public String cell(String columnId) {
        String text = cells.get(columnId);
        return text != null ? text : "";
    }
}

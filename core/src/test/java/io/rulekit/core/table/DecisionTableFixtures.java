package io.rulekit.core.table;

import io.rulekit.core.model.DataType;
import io.rulekit.core.model.DecisionTable;
import io.rulekit.core.model.DecisionTableColumn;
import io.rulekit.core.model.DecisionTableRow;
import io.rulekit.core.model.HitPolicy;
import java.util.List;
import java.util.Map;

/** Shared tables for the table tests. */
final class DecisionTableFixtures {

    private DecisionTableFixtures() {}

    /** Tier/total discount table: gold over 100 gets 20, gold 10, silver 15, anything else 0. */
    static DecisionTable discountTable() {
        return new DecisionTable(
                "discount",
                "Discount",
                HitPolicy.FIRST_MATCH,
                List.of(
                        DecisionTableColumn.input("tier", "customer.tier", DataType.STRING),
                        DecisionTableColumn.input("total", "order.total", DataType.NUMBER),
                        DecisionTableColumn.output("pct", "discount", DataType.NUMBER)),
                List.of(
                        row("r1", "gold", ">= 100", "20"),
                        row("r2", "gold", "", "10"),
                        row("r3", "silver", "", "15"),
                        row("r4", "*", "*", "0")));
    }

    static DecisionTableRow row(String id, String tier, String total, String pct) {
        return new DecisionTableRow(id, Map.of("tier", tier, "total", total, "pct", pct));
    }
}

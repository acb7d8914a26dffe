package io.rulekit.core.table;

import io.rulekit.core.error.CellCompileException;
import io.rulekit.core.model.DecisionTable;
import io.rulekit.core.model.DecisionTableColumn;
import io.rulekit.core.model.DecisionTableRow;
import io.rulekit.core.model.HitPolicy;
import io.rulekit.core.model.LogicExpression;
import io.rulekit.core.model.LogicExpression.Call;
import io.rulekit.core.model.LogicExpression.ListExpr;
import io.rulekit.core.model.LogicExpression.NaryOp;
import io.rulekit.core.model.LogicExpression.RecordExpr;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a {@link DecisionTable} into one logic tree.
 *
 * <ul>
 * <li>{@link HitPolicy#FIRST_MATCH}: {@code if(c1, o1, c2, o2, ..., default)}. The first
 * catch-all row (condition {@code true}) supplies the default and ends the chain; without one the
 * default is {@code null}. A catch-all first row compiles to just its output.</li>
 * <li>{@link HitPolicy#COLLECT_ALL}: {@code collect([[c1, o1], [c2, o2], ...])}; the runtime
 * evaluates every pair and returns the outputs whose condition holds, in row order.</li>
 * </ul>
 *
 * <p>
 * Row outputs: no output column yields {@code null}, one yields its typed scalar, several yield a
 * record keyed by field. A table without rows compiles to {@link Optional#empty()}.
 */
public final class DecisionTableCompiler {

    /** Name of the aggregate operator emitted for {@link HitPolicy#COLLECT_ALL}. */
    public static final String COLLECT_OPERATOR = "collect";

    private static final Logger LOG = LoggerFactory.getLogger(DecisionTableCompiler.class);

    private final CellCompiler cells;

    public DecisionTableCompiler() {
        this(new CellCompiler());
    }

    public DecisionTableCompiler(CellCompiler cells) {
        this.cells = cells;
    }

    /**
     * Compiles the table.
     *
     * @return the compiled tree, or empty if the table has no rows
     * @throws CellCompileException naming the table, row, column and cell text of the first
     *                              cell that does not compile
     */
    public Optional<LogicExpression> compile(DecisionTable table) {
        if (table.rows().isEmpty()) {
            LOG.debug("table.compiled id={} rows=0 result=none", table.id());
            return Optional.empty();
        }
        List<DecisionTableColumn> inputs = table.inputColumns();
        List<DecisionTableColumn> outputs = table.outputColumns();
        LogicExpression compiled = table.hitPolicy() == HitPolicy.COLLECT_ALL
                ? compileCollectAll(table, inputs, outputs)
                : compileFirstMatch(table, inputs, outputs);
        LOG.debug(
                "table.compiled id={} rows={} policy={} inputs={} outputs={}",
                table.id(),
                table.rows().size(),
                table.hitPolicy(),
                inputs.size(),
                outputs.size());
        return Optional.of(compiled);
    }

    private LogicExpression compileFirstMatch(
            DecisionTable table, List<DecisionTableColumn> inputs, List<DecisionTableColumn> outputs) {
        List<LogicExpression> arguments = new ArrayList<>();
        for (DecisionTableRow row : table.rows()) {
            LogicExpression condition = rowCondition(table, row, inputs);
            LogicExpression output = rowOutput(table, row, outputs);
            if (condition.isTrue()) {
                if (arguments.isEmpty()) {
                    return output;
                }
                arguments.add(output);
                return new Call("if", arguments);
            }
            arguments.add(condition);
            arguments.add(output);
        }
        arguments.add(LogicExpression.NULL);
        return new Call("if", arguments);
    }

    private LogicExpression compileCollectAll(
            DecisionTable table, List<DecisionTableColumn> inputs, List<DecisionTableColumn> outputs) {
        List<LogicExpression> pairs = new ArrayList<>();
        for (DecisionTableRow row : table.rows()) {
            pairs.add(new ListExpr(List.of(rowCondition(table, row, inputs), rowOutput(table, row, outputs))));
        }
        return new Call(COLLECT_OPERATOR, List.of(new ListExpr(pairs)));
    }

    /** AND of the row's non-wildcard input predicates; {@code true} when none remain. */
    LogicExpression rowCondition(DecisionTable table, DecisionTableRow row, List<DecisionTableColumn> inputs) {
        List<LogicExpression> predicates = new ArrayList<>();
        for (DecisionTableColumn column : inputs) {
            LogicExpression predicate = compileCell(table, row, () -> cells.compile(row.cell(column.id()), column));
            if (!predicate.isTrue()) {
                predicates.add(predicate);
            }
        }
        if (predicates.isEmpty()) {
            return LogicExpression.TRUE;
        }
        return predicates.size() == 1 ? predicates.get(0) : new NaryOp("and", predicates);
    }

    private LogicExpression rowOutput(DecisionTable table, DecisionTableRow row, List<DecisionTableColumn> outputs) {
        if (outputs.isEmpty()) {
            return LogicExpression.NULL;
        }
        if (outputs.size() == 1) {
            DecisionTableColumn column = outputs.get(0);
            return compileCell(table, row, () -> cells.compileOutput(row.cell(column.id()), column));
        }
        Map<String, LogicExpression> fields = new LinkedHashMap<>();
        for (DecisionTableColumn column : outputs) {
            fields.put(column.field(), compileCell(table, row, () -> cells.compileOutput(row.cell(column.id()), column)));
        }
        return new RecordExpr(fields);
    }

    private static LogicExpression compileCell(DecisionTable table, DecisionTableRow row, Supplier<LogicExpression> task) {
        try {
            return task.get();
        } catch (CellCompileException e) {
            throw e.withLocation(row.id(), table.id());
        }
    }
}

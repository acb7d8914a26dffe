package io.rulekit.core.table;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.rulekit.core.error.DefinitionParseException;
import io.rulekit.core.model.ColumnRole;
import io.rulekit.core.model.DataType;
import io.rulekit.core.model.DecisionTable;
import io.rulekit.core.model.DecisionTableColumn;
import io.rulekit.core.model.DecisionTableRow;
import io.rulekit.core.model.HitPolicy;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spreadsheet interchange for decision tables.
 *
 * <p>
 * The header row names each column with an {@code IN:} or {@code OUT:} prefix; every further
 * line is one row with cells in column order:
 *
 * <pre>
 * IN:Customer Tier,IN:Order Amount,OUT:Discount
 * gold,&gt; 100,0.15
 * silver,&gt; 50,0.10
 * *,*,0.05
 * </pre>
 *
 * <p>
 * Import detects the delimiter ({@code , ; TAB |}) from the header line, skips {@code #}
 * comment lines and blank lines, and derives field names from labels ({@code Customer Tier}
 * becomes {@code customer_tier}). Imported columns are typed {@link DataType#STRING} and the
 * table uses {@link HitPolicy#FIRST_MATCH}.
 */
public final class DecisionTableCsv {

    private static final Logger LOG = LoggerFactory.getLogger(DecisionTableCsv.class);

    private static final String INPUT_PREFIX = "IN:";
    private static final String OUTPUT_PREFIX = "OUT:";
    private static final char[] DELIMITERS = {',', ';', '\t', '|'};

    private static final CsvMapper CSV = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    /**
     * Imported table plus non-fatal observations (missing prefixes, ragged rows).
     *
     * @param table    the imported table
     * @param warnings human-readable warnings, in encounter order
     */
    public record ImportResult(DecisionTable table, List<String> warnings) {

        public ImportResult {
            warnings = List.copyOf(warnings);
        }
    }

    private DecisionTableCsv() {}

    /** Exports the table with a comma delimiter. */
    public static String export(DecisionTable table) {
        return export(table, ',');
    }

    /** Exports the table: one header line, then one line per row. */
    public static String export(DecisionTable table, char delimiter) {
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(delimiter).withLineSeparator("\n");
        StringWriter out = new StringWriter();
        try (SequenceWriter writer = CSV.writer(schema).writeValues(out)) {
            List<DecisionTableColumn> columns = table.columns();
            String[] header = new String[columns.size()];
            for (int i = 0; i < header.length; i++) {
                DecisionTableColumn column = columns.get(i);
                header[i] = (column.isInput() ? INPUT_PREFIX : OUTPUT_PREFIX) + column.label();
            }
            writer.write(header);
            for (DecisionTableRow row : table.rows()) {
                String[] line = new String[columns.size()];
                for (int i = 0; i < line.length; i++) {
                    line[i] = row.cell(columns.get(i).id());
                }
                writer.write(line);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV for table " + table.id(), e);
        }
        return out.toString();
    }

    /**
     * Imports a table.
     *
     * @throws DefinitionParseException if the text is empty, has no usable header column, or is
     *                                  not valid CSV
     */
    public static ImportResult importTable(String csv, String tableId, String tableName) {
        char delimiter = detectDelimiter(csv);
        List<String[]> lines = readLines(csv, delimiter, tableId);
        if (lines.isEmpty()) {
            throw new DefinitionParseException("CSV is empty or contains only comments", tableId, "csv");
        }

        List<String> warnings = new ArrayList<>();
        String[] header = lines.get(0);
        Map<Integer, DecisionTableColumn> columns = new LinkedHashMap<>();
        for (int i = 0; i < header.length; i++) {
            String text = header[i] == null ? "" : header[i].trim();
            if (!text.isEmpty()) {
                columns.put(i, headerColumn(i, text, warnings));
            }
        }
        if (columns.isEmpty()) {
            throw new DefinitionParseException("No valid columns found in header row", tableId, "csv");
        }

        List<DecisionTableRow> rows = new ArrayList<>();
        for (int r = 1; r < lines.size(); r++) {
            String[] values = lines.get(r);
            if (values.length > header.length) {
                warnings.add("Row " + r + " has " + values.length + " values, expected " + header.length
                        + "; extra values ignored");
            }
            Map<String, String> cells = new LinkedHashMap<>();
            columns.forEach((index, column) ->
                    cells.put(column.id(), index < values.length && values[index] != null ? values[index] : ""));
            rows.add(new DecisionTableRow("row_" + r, cells));
        }

        DecisionTable table = new DecisionTable(
                tableId, tableName, HitPolicy.FIRST_MATCH, List.copyOf(columns.values()), rows);
        LOG.debug(
                "csv.imported table={} columns={} rows={} delimiter={} warnings={}",
                tableId,
                columns.size(),
                rows.size(),
                printable(delimiter),
                warnings.size());
        return new ImportResult(table, warnings);
    }

    /** Converts a header label to a field path: {@code "Customer Tier"} becomes {@code customer_tier}. */
    public static String labelToField(String label) {
        String field = label.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        return field.replaceAll("^_+|_+$", "");
    }

    /** Picks the most frequent of {@code , ; TAB |} in the first data line; comma when none occur. */
    static char detectDelimiter(String csv) {
        String first = "";
        for (String line : csv.split("\\r?\\n")) {
            if (!line.isBlank() && !line.startsWith("#")) {
                first = line;
                break;
            }
        }
        char best = ',';
        int bestCount = 0;
        for (char candidate : DELIMITERS) {
            int count = (int) first.chars().filter(c -> c == candidate).count();
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    private static List<String[]> readLines(String csv, char delimiter, String tableId) {
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(delimiter).withComments();
        try (MappingIterator<String[]> iterator = CSV.readerFor(String[].class).with(schema).readValues(csv)) {
            return iterator.readAll();
        } catch (IOException e) {
            throw new DefinitionParseException("Invalid CSV: " + e.getMessage(), e, tableId, "csv");
        }
    }

    private static DecisionTableColumn headerColumn(int index, String header, List<String> warnings) {
        String upper = header.toUpperCase(Locale.ROOT);
        ColumnRole role = ColumnRole.INPUT;
        String label = header;
        if (upper.startsWith(INPUT_PREFIX)) {
            label = header.substring(INPUT_PREFIX.length()).trim();
        } else if (upper.startsWith(OUTPUT_PREFIX)) {
            role = ColumnRole.OUTPUT;
            label = header.substring(OUTPUT_PREFIX.length()).trim();
        } else {
            warnings.add("Column \"" + header + "\" has no IN:/OUT: prefix, assuming input");
        }
        return new DecisionTableColumn("col_" + index, role, labelToField(label), label, DataType.STRING);
    }

    private static String printable(char delimiter) {
        return delimiter == '\t' ? "TAB" : String.valueOf(delimiter);
    }
}

package io.rulekit.core.definition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.rulekit.core.error.CellCompileException;
import io.rulekit.core.error.DefinitionParseException;
import io.rulekit.core.error.ExpressionSyntaxException;
import io.rulekit.core.error.WireFormatException;
import io.rulekit.core.expression.ExpressionParser;
import io.rulekit.core.expression.LogicJson;
import io.rulekit.core.model.ColumnRole;
import io.rulekit.core.model.DataType;
import io.rulekit.core.model.DecisionTable;
import io.rulekit.core.model.DecisionTableColumn;
import io.rulekit.core.model.DecisionTableRow;
import io.rulekit.core.model.HitPolicy;
import io.rulekit.core.model.LogicExpression;
import io.rulekit.core.model.Pipeline;
import io.rulekit.core.model.PipelineStep;
import io.rulekit.core.model.StepKind;
import io.rulekit.core.table.DecisionTableCompiler;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads decision-table and pipeline definition documents (YAML or JSON) into model objects.
 *
 * <p>
 * Documents are checked against the bundled JSON Schemas ({@code schemas/decision-table} and
 * {@code schemas/pipeline}), then against strict known-key sets so that typos fail at load time
 * instead of being ignored. Pipeline steps are authored in one of three forms, which also decides
 * the step's {@link StepKind}:
 *
 * <pre>
 * steps:
 *   - output: subtotal
 *     expr: price * quantity              # business text
 *   - output: discount
 *     table: { id: ..., columns: ..., rows: ... }   # inline decision table
 *   - output: total
 *     logic: {"-": [{"var": "$.subtotal"}, 5]}      # wire form
 * </pre>
 *
 * <p>
 * A textual {@code logic} value is read as JSON text. An inline table without rows compiles to
 * {@code null}.
 *
 * <p>
 * Thread-safe.
 */
public final class DefinitionParser {

    private static final Logger LOG = LoggerFactory.getLogger(DefinitionParser.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private static final JsonSchema TABLE_SCHEMA = loadSchema("/schemas/decision-table.schema.json");
    private static final JsonSchema PIPELINE_SCHEMA = loadSchema("/schemas/pipeline.schema.json");

    // ── Strict unknown-key detection ──

    private static final Set<String> KNOWN_TABLE_KEYS =
            Set.of("id", "name", "description", "hitPolicy", "columns", "rows");
    private static final Set<String> KNOWN_COLUMN_KEYS = Set.of("id", "role", "field", "label", "type");
    private static final Set<String> KNOWN_ROW_KEYS = Set.of("id", "cells");
    private static final Set<String> KNOWN_PIPELINE_KEYS = Set.of("id", "name", "description", "steps");
    private static final Set<String> KNOWN_STEP_KEYS =
            Set.of("id", "name", "output", "enabled", "expr", "table", "logic");

    private final ExpressionParser expressionParser;
    private final DecisionTableCompiler tableCompiler;

    public DefinitionParser() {
        this(new ExpressionParser(), new DecisionTableCompiler());
    }

    public DefinitionParser(ExpressionParser expressionParser, DecisionTableCompiler tableCompiler) {
        this.expressionParser = Objects.requireNonNull(expressionParser, "expressionParser must not be null");
        this.tableCompiler = Objects.requireNonNull(tableCompiler, "tableCompiler must not be null");
    }

    // ── Decision tables ──

    /**
     * Reads a decision-table document from a file.
     *
     * @throws DefinitionParseException if the document is malformed
     */
    public DecisionTable parseTable(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        return parseTable(readFile(path), path.toString());
    }

    /**
     * Reads a decision-table document.
     *
     * @param content YAML or JSON text
     * @param source  where the text came from, used in error messages
     * @throws DefinitionParseException if the document is malformed
     */
    public DecisionTable parseTable(String content, String source) {
        JsonNode root = readTree(content, source);
        DecisionTable table = readTable(root, source);
        LOG.debug(
                "Loaded decision table: id={}, columns={}, rows={}, source={}",
                table.id(),
                table.columns().size(),
                table.rows().size(),
                source);
        return table;
    }

    private DecisionTable readTable(JsonNode root, String source) {
        validateSchema(TABLE_SCHEMA, root, "decision table", source);
        String id = requireString(root, "id", source);
        rejectUnknownKeys(root, KNOWN_TABLE_KEYS, "table", id, source);

        List<DecisionTableColumn> columns = new ArrayList<>();
        for (JsonNode columnNode : root.path("columns")) {
            rejectUnknownKeys(columnNode, KNOWN_COLUMN_KEYS, "columns", id, source);
            columns.add(new DecisionTableColumn(
                    requireString(columnNode, "id", source),
                    ColumnRole.valueOf(columnNode.get("role").asText().toUpperCase(Locale.ROOT)),
                    requireString(columnNode, "field", source),
                    optionalString(columnNode, "label"),
                    columnNode.has("type")
                            ? DataType.valueOf(columnNode.get("type").asText().toUpperCase(Locale.ROOT))
                            : DataType.STRING));
        }

        List<DecisionTableRow> rows = new ArrayList<>();
        int rowNumber = 0;
        for (JsonNode rowNode : root.path("rows")) {
            rowNumber++;
            rejectUnknownKeys(rowNode, KNOWN_ROW_KEYS, "rows", id, source);
            String rowId = optionalString(rowNode, "id");
            Map<String, String> cells = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> entries = rowNode.path("cells").fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> cell = entries.next();
                cells.put(cell.getKey(), cell.getValue().isNull() ? "" : cell.getValue().asText());
            }
            rows.add(new DecisionTableRow(rowId != null ? rowId : "row_" + rowNumber, cells));
        }

        return new DecisionTable(
                id,
                optionalString(root, "name"),
                optionalString(root, "description"),
                hitPolicy(optionalString(root, "hitPolicy"), id, source),
                columns,
                rows);
    }

    // ── Pipelines ──

    /**
     * Reads and compiles a pipeline document from a file.
     *
     * @throws DefinitionParseException   if the document is malformed
     * @throws ExpressionSyntaxException  if a step's business text does not parse
     * @throws CellCompileException       if a cell of an inline table does not compile
     */
    public Pipeline parsePipeline(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        return parsePipeline(readFile(path), path.toString());
    }

    /**
     * Reads and compiles a pipeline document.
     *
     * @param content YAML or JSON text
     * @param source  where the text came from, used in error messages
     */
    public Pipeline parsePipeline(String content, String source) {
        JsonNode root = readTree(content, source);
        validateSchema(PIPELINE_SCHEMA, root, "pipeline", source);
        String id = requireString(root, "id", source);
        rejectUnknownKeys(root, KNOWN_PIPELINE_KEYS, "pipeline", id, source);

        List<PipelineStep> steps = new ArrayList<>();
        for (JsonNode stepNode : root.path("steps")) {
            steps.add(readStep(stepNode, id, source));
        }
        Pipeline pipeline = new Pipeline(id, optionalString(root, "name"), steps);
        LOG.debug("Loaded pipeline: id={}, steps={}, source={}", id, steps.size(), source);
        return pipeline;
    }

    private PipelineStep readStep(JsonNode node, String pipelineId, String source) {
        rejectUnknownKeys(node, KNOWN_STEP_KEYS, "steps", pipelineId, source);
        String outputKey = requireString(node, "output", source);
        String stepId = optionalString(node, "id");
        if (stepId == null) {
            stepId = outputKey;
        }
        boolean enabled = !node.has("enabled") || node.get("enabled").asBoolean(true);

        List<String> forms = new ArrayList<>();
        for (String form : List.of("expr", "table", "logic")) {
            if (node.has(form)) {
                forms.add(form);
            }
        }
        if (forms.size() != 1) {
            throw new DefinitionParseException(
                    "Step '" + stepId + "' must define exactly one of 'expr', 'table' or 'logic', found: " + forms,
                    pipelineId,
                    source);
        }

        StepKind kind;
        LogicExpression expression;
        switch (forms.get(0)) {
            case "expr" -> {
                kind = StepKind.EXPRESSION;
                expression = compileExpression(node.get("expr").asText(), stepId, pipelineId, source);
            }
            case "table" -> {
                kind = StepKind.DECISION_TABLE;
                expression = compileTable(node.get("table"), pipelineId, source);
            }
            default -> {
                kind = StepKind.LOGIC;
                expression = readLogic(node.get("logic"), stepId, pipelineId, source);
            }
        }
        return new PipelineStep(stepId, optionalString(node, "name"), outputKey, kind, expression, enabled);
    }

    private LogicExpression compileExpression(String text, String stepId, String pipelineId, String source) {
        try {
            return expressionParser.parse(text);
        } catch (ExpressionSyntaxException e) {
            throw new ExpressionSyntaxException(
                    "Failed to compile expression for step '" + stepId + "': " + e.getMessage(),
                    e.offset(),
                    pipelineId,
                    source);
        }
    }

    private LogicExpression compileTable(JsonNode tableNode, String pipelineId, String source) {
        DecisionTable table = readTable(tableNode, source);
        try {
            return tableCompiler.compile(table).orElse(LogicExpression.NULL);
        } catch (CellCompileException e) {
            throw new CellCompileException(
                    e.getMessage(), e.columnId(), e.rowId(), e.cellText(), pipelineId + "/" + table.id());
        }
    }

    private static LogicExpression readLogic(JsonNode logic, String stepId, String pipelineId, String source) {
        try {
            return logic.isTextual() ? LogicJson.parseJson(logic.textValue()) : LogicJson.fromJson(logic);
        } catch (WireFormatException e) {
            throw new DefinitionParseException(
                    "Invalid logic for step '" + stepId + "': " + e.getMessage(), e, pipelineId, source);
        }
    }

    // ── Helpers ──

    private static HitPolicy hitPolicy(String text, String id, String source) {
        if (text == null) {
            return HitPolicy.FIRST_MATCH;
        }
        switch (text.trim().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "first":
            case "first_match":
                return HitPolicy.FIRST_MATCH;
            case "collect":
            case "collect_all":
                return HitPolicy.COLLECT_ALL;
            default:
                throw new DefinitionParseException(
                        "Unknown hitPolicy '" + text + "', expected FIRST_MATCH or COLLECT_ALL", id, source);
        }
    }

    private static String readFile(Path path) {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new DefinitionParseException("Failed to read definition: " + e.getMessage(), e, null, path.toString());
        }
    }

    private static JsonNode readTree(String content, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(content);
        } catch (IOException e) {
            throw new DefinitionParseException("Failed to parse YAML/JSON: " + e.getMessage(), e, null, source);
        }
        if (root == null || !root.isObject()) {
            throw new DefinitionParseException("Definition document must be a mapping", null, source);
        }
        return root;
    }

    private static void validateSchema(JsonSchema schema, JsonNode root, String kind, String source) {
        Set<ValidationMessage> errors = schema.validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream().map(ValidationMessage::getMessage).sorted().collect(Collectors.joining("; "));
            throw new DefinitionParseException(
                    "Invalid " + kind + " definition: " + detail, extractIdSafe(root), source);
        }
    }

    private static JsonSchema loadSchema(String resource) {
        try (InputStream in = DefinitionParser.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled schema " + resource);
            }
            return SCHEMA_FACTORY.getSchema(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load bundled schema " + resource, e);
        }
    }

    private static String requireString(JsonNode node, String field, String source) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isTextual() || value.asText().isBlank()) {
            throw new DefinitionParseException(
                    "Missing or invalid required field: '" + field + "'", extractIdSafe(node), source);
        }
        return value.asText();
    }

    private static String optionalString(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static String extractIdSafe(JsonNode root) {
        JsonNode idNode = root.get("id");
        return idNode != null && idNode.isTextual() ? idNode.asText() : null;
    }

    private static void rejectUnknownKeys(
            JsonNode node, Set<String> knownKeys, String blockName, String definitionId, String source) {
        if (node == null || !node.isObject()) {
            return;
        }
        List<String> unknown = StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .filter(key -> !knownKeys.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new DefinitionParseException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in '" + blockName + "': " + unknown
                            + ", recognized keys are: " + knownKeys.stream().sorted().toList(),
                    definitionId,
                    source);
        }
    }
}

package io.rulekit.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.rulekit.core.error.ExpressionEvalException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.function.BiPredicate;
import java.util.function.UnaryOperator;

/**
 * The custom operators the rulekit compilers emit, beyond core JSONLogic:
 *
 * <ul>
 * <li>strings: {@code contains startsWith endsWith upper lower trim len}</li>
 * <li>math: {@code abs floor ceil round}</li>
 * <li>collections: {@code count sum avg}</li>
 * <li>dates: {@code now daysSince daysBetween}</li>
 * <li>nulls: {@code isEmpty coalesce}</li>
 * <li>ranges: {@code between} (inclusive)</li>
 * <li>decision tables: {@code collect}</li>
 * </ul>
 *
 * <p>
 * Dates are ISO-8601 dates ({@code 2024-03-01}) or date-times with an offset; date-times count by
 * their UTC date.
 */
public final class StandardOperators {

    private StandardOperators() {}

    /** Registry of the standard operators using the system UTC clock. */
    public static OperatorRegistry registry() {
        return registry(Clock.systemUTC());
    }

    /** Registry of the standard operators with the given clock for date helpers. */
    public static OperatorRegistry registry(Clock clock) {
        return register(OperatorRegistry.builder(), clock).build();
    }

    /** Adds the standard operators to an existing builder. */
    public static OperatorRegistry.Builder register(OperatorRegistry.Builder builder, Clock clock) {
        // ── strings ──
        builder.register("contains", args -> JsonValues.bool(contains(arg(args, 0), arg(args, 1))));
        builder.register("startsWith", args -> textTest(arg(args, 0), arg(args, 1), String::startsWith));
        builder.register("endsWith", args -> textTest(arg(args, 0), arg(args, 1), String::endsWith));
        builder.register("upper", args -> mapText(arg(args, 0), text -> text.toUpperCase(Locale.ROOT)));
        builder.register("lower", args -> mapText(arg(args, 0), text -> text.toLowerCase(Locale.ROOT)));
        builder.register("trim", args -> mapText(arg(args, 0), String::trim));
        builder.register("len", args -> JsonValues.number(BigDecimal.valueOf(length(arg(args, 0)))));

        // ── math ──
        builder.register("abs", args -> JsonValues.number(JsonValues.requireNumber(arg(args, 0), "abs").abs()));
        builder.register("floor", args ->
                JsonValues.number(JsonValues.requireNumber(arg(args, 0), "floor").setScale(0, RoundingMode.FLOOR)));
        builder.register("ceil", args ->
                JsonValues.number(JsonValues.requireNumber(arg(args, 0), "ceil").setScale(0, RoundingMode.CEILING)));
        builder.register("round", args -> {
            int digits = args.size() > 1 ? JsonValues.requireNumber(args.get(1), "round").intValue() : 0;
            BigDecimal value = JsonValues.requireNumber(arg(args, 0), "round");
            return JsonValues.number(value.setScale(digits, RoundingMode.HALF_UP));
        });

        // ── collections ──
        builder.register("count", args -> JsonValues.number(BigDecimal.valueOf(count(arg(args, 0)))));
        builder.register("sum", args -> JsonValues.number(sum(arg(args, 0))));
        builder.register("avg", args -> {
            long count = count(arg(args, 0));
            return count == 0
                    ? NullNode.getInstance()
                    : JsonValues.number(sum(arg(args, 0)).divide(BigDecimal.valueOf(count), MathContext.DECIMAL64));
        });

        // ── dates ──
        builder.register("now", args -> JsonValues.text(Instant.now(clock).toString()));
        builder.register("daysSince", args -> {
            LocalDate date = toDate(arg(args, 0), "daysSince");
            return JsonValues.number(BigDecimal.valueOf(ChronoUnit.DAYS.between(date, LocalDate.now(clock))));
        });
        builder.register("daysBetween", args -> {
            LocalDate from = toDate(arg(args, 0), "daysBetween");
            LocalDate to = toDate(arg(args, 1), "daysBetween");
            return JsonValues.number(BigDecimal.valueOf(ChronoUnit.DAYS.between(from, to)));
        });

        // ── nulls ──
        builder.register("isEmpty", args -> JsonValues.bool(isEmpty(arg(args, 0))));
        builder.register("coalesce", args -> {
            for (JsonNode value : args) {
                if (!JsonValues.isNull(value)) {
                    return value;
                }
            }
            return NullNode.getInstance();
        });

        // ── ranges ──
        builder.register("between", args -> {
            Integer low = JsonValues.compare(arg(args, 0), arg(args, 1));
            Integer high = JsonValues.compare(arg(args, 0), arg(args, 2));
            return JsonValues.bool(low != null && high != null && low >= 0 && high <= 0);
        });

        // ── decision tables ──
        builder.register("collect", StandardOperators::collect);
        return builder;
    }

    /**
     * Evaluates the {@code [condition, output]} pairs of a collect-all table and returns the
     * outputs whose condition holds, in row order.
     */
    static JsonNode collect(List<JsonNode> args) {
        JsonNode pairs = arg(args, 0);
        ArrayNode matches = JsonValues.NODES.arrayNode();
        if (!pairs.isArray()) {
            throw new ExpressionEvalException("Operator 'collect' expects a list of [condition, output] pairs");
        }
        for (JsonNode pair : pairs) {
            if (!pair.isArray() || pair.size() != 2) {
                throw new ExpressionEvalException("Operator 'collect' expects [condition, output] pairs, got " + pair);
            }
            if (JsonValues.isTruthy(pair.get(0))) {
                matches.add(pair.get(1));
            }
        }
        return matches;
    }

    private static JsonNode arg(List<JsonNode> args, int index) {
        return index < args.size() && args.get(index) != null ? args.get(index) : NullNode.getInstance();
    }

    static boolean contains(JsonNode haystack, JsonNode needle) {
        if (haystack.isArray()) {
            for (JsonNode element : haystack) {
                if (JsonValues.looseEquals(element, needle)) {
                    return true;
                }
            }
            return false;
        }
        if (JsonValues.isNull(haystack) || JsonValues.isNull(needle)) {
            return false;
        }
        return JsonValues.toText(haystack).contains(JsonValues.toText(needle));
    }

    private static JsonNode textTest(JsonNode value, JsonNode affix, BiPredicate<String, String> test) {
        if (JsonValues.isNull(value) || JsonValues.isNull(affix)) {
            return JsonValues.bool(false);
        }
        return JsonValues.bool(test.test(JsonValues.toText(value), JsonValues.toText(affix)));
    }

    private static JsonNode mapText(JsonNode value, UnaryOperator<String> mapper) {
        return JsonValues.isNull(value) ? NullNode.getInstance() : JsonValues.text(mapper.apply(JsonValues.toText(value)));
    }

    private static long length(JsonNode value) {
        if (JsonValues.isNull(value)) {
            return 0;
        }
        return value.isArray() || value.isObject() ? value.size() : JsonValues.toText(value).length();
    }

    private static long count(JsonNode value) {
        if (JsonValues.isNull(value)) {
            return 0;
        }
        return value.isArray() ? value.size() : 1;
    }

    private static BigDecimal sum(JsonNode value) {
        if (JsonValues.isNull(value)) {
            return BigDecimal.ZERO;
        }
        if (!value.isArray()) {
            return JsonValues.requireNumber(value, "sum");
        }
        BigDecimal total = BigDecimal.ZERO;
        for (JsonNode element : value) {
            if (!JsonValues.isNull(element)) {
                total = total.add(JsonValues.requireNumber(element, "sum"));
            }
        }
        return total;
    }

    private static boolean isEmpty(JsonNode value) {
        if (JsonValues.isNull(value)) {
            return true;
        }
        if (value.isTextual()) {
            return value.textValue().isBlank();
        }
        return (value.isArray() || value.isObject()) && value.size() == 0;
    }

    static LocalDate toDate(JsonNode value, String operator) {
        String text = JsonValues.toText(value).trim();
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text);
            }
            return OffsetDateTime.parse(text).atZoneSameInstant(ZoneOffset.UTC).toLocalDate();
        } catch (DateTimeParseException e) {
            throw new ExpressionEvalException(
                    "Operator '" + operator + "' expects an ISO-8601 date, got " + JsonValues.describe(value), e);
        }
    }
}

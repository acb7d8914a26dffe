package io.rulekit.core.table;

import io.rulekit.core.error.CellCompileException;
import io.rulekit.core.model.DataType;
import io.rulekit.core.model.LogicExpression.Literal;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Typed parsing of a single cell value. Every cell rule (comparison operand, range bound, list
 * item, equality value, output value) goes through {@link #parse}.
 *
 * <p>
 * Resolution order:
 *
 * <ol>
 * <li>Surrounding whitespace is trimmed.</li>
 * <li>A value wrapped in one matching pair of {@code "} or {@code '} quotes is the string
 * between them, whatever the column type.</li>
 * <li>{@link DataType#NUMBER}: must be a numeric literal.</li>
 * <li>{@link DataType#BOOLEAN}: must be {@code true} or {@code false}, case-insensitive.</li>
 * <li>{@link DataType#STRING}: numeric-looking text becomes a number; anything else stays a
 * string. Quote the value to keep it textual, e.g. {@code "007"}.</li>
 * </ol>
 */
public final class CellValues {

    private static final Pattern NUMBER = Pattern.compile("[-+]?\\d+(\\.\\d+)?([eE][-+]?\\d+)?");

    private CellValues() {}

    /**
     * Parses a value for a column of the given type.
     *
     * @throws CellCompileException if the text does not fit a NUMBER or BOOLEAN column
     */
    public static Literal parse(String text, DataType type) {
        return parse(text, type, null);
    }

    /**
     * Parses a value for a column of the given type, naming the column in any error.
     *
     * @throws CellCompileException if the text does not fit a NUMBER or BOOLEAN column
     */
    public static Literal parse(String text, DataType type, String columnId) {
        String value = text == null ? "" : text.trim();
        if (isQuoted(value)) {
            return new Literal(value.substring(1, value.length() - 1));
        }
        switch (type) {
            case NUMBER: {
                BigDecimal number = isNumeric(value) ? toNumber(value) : null;
                if (number == null) {
                    throw new CellCompileException(
                            "Invalid number \"" + value + "\"", columnId, null, text);
                }
                return new Literal(number);
            }
            case BOOLEAN: {
                String lower = value.toLowerCase(Locale.ROOT);
                if (!lower.equals("true") && !lower.equals("false")) {
                    throw new CellCompileException(
                            "Invalid boolean \"" + value + "\", expected true or false",
                            columnId,
                            null,
                            text);
                }
                return new Literal(Boolean.valueOf(lower));
            }
            default: {
                BigDecimal number = isNumeric(value) ? toNumber(value) : null;
                return number != null ? new Literal(number) : new Literal(value);
            }
        }
    }

    /** Returns {@code null} when the exponent does not fit a {@link BigDecimal} scale. */
    private static BigDecimal toNumber(String value) {
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Returns {@code true} if the trimmed text is a numeric literal. */
    public static boolean isNumeric(String text) {
        return text != null && NUMBER.matcher(text.trim()).matches();
    }

    static boolean isQuoted(String value) {
        if (value.length() < 2) {
            return false;
        }
        char first = value.charAt(0);
        return (first == '"' || first == '\'') && value.charAt(value.length() - 1) == first;
    }
}

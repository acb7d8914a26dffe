package io.rulekit.core.expression;

import io.rulekit.core.error.ExpressionSyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits business-language text into {@link Token}s, ending with a single {@link TokenType#EOF}
 * token.
 *
 * <p>
 * Recognition order: two-character operators ({@code == != >= <=}) before their one-character
 * prefixes, then single-character operators and punctuation, numbers (optional fraction and
 * exponent), quoted strings, identifiers. Identifiers may contain dots and {@code $}, so
 * {@code customer.tier} and {@code $.subtotal} are single tokens. Identifiers matching a keyword
 * case-insensitively become {@link TokenType#KEYWORD} tokens carrying the lower-cased text.
 *
 * <p>
 * Stateless; safe to share.
 */
public final class Lexer {

    static final Set<String> KEYWORDS = Set.of(
            "and", "or", "not", "in", "between", "contains", "startswith", "endswith", "true", "false", "null");

    private static final Set<String> TWO_CHAR_OPERATORS = Set.of("==", "!=", ">=", "<=");
    private static final String ONE_CHAR_OPERATORS = "><+-*/%";

    /**
     * Tokenizes the given text.
     *
     * @throws ExpressionSyntaxException on an unterminated string or an unrecognized character
     */
    public List<Token> tokenize(String input) {
        List<Token> tokens = new ArrayList<>();
        int pos = 0;
        int length = input.length();
        while (pos < length) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }
            if (pos + 1 < length && TWO_CHAR_OPERATORS.contains(input.substring(pos, pos + 2))) {
                tokens.add(new Token(TokenType.OPERATOR, input.substring(pos, pos + 2), pos));
                pos += 2;
                continue;
            }
            if (ONE_CHAR_OPERATORS.indexOf(c) >= 0) {
                tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c), pos++));
                continue;
            }
            TokenType punctuation = punctuation(c);
            if (punctuation != null) {
                tokens.add(new Token(punctuation, String.valueOf(c), pos++));
                continue;
            }
            if (isDigit(c)) {
                pos = readNumber(input, pos, tokens);
                continue;
            }
            if (c == '"' || c == '\'') {
                pos = readString(input, pos, tokens);
                continue;
            }
            if (isIdentifierStart(c)) {
                pos = readIdentifier(input, pos, tokens);
                continue;
            }
            throw new ExpressionSyntaxException("Unexpected character '" + c + "' at offset " + pos, pos);
        }
        tokens.add(new Token(TokenType.EOF, "", length));
        return tokens;
    }

    private static TokenType punctuation(char c) {
        return switch (c) {
            case '(' -> TokenType.LEFT_PAREN;
            case ')' -> TokenType.RIGHT_PAREN;
            case '[' -> TokenType.LEFT_BRACKET;
            case ']' -> TokenType.RIGHT_BRACKET;
            case ',' -> TokenType.COMMA;
            default -> null;
        };
    }

    private static int readNumber(String input, int start, List<Token> tokens) {
        int pos = start;
        int length = input.length();
        while (pos < length && isDigit(input.charAt(pos))) {
            pos++;
        }
        if (pos + 1 < length && input.charAt(pos) == '.' && isDigit(input.charAt(pos + 1))) {
            pos++;
            while (pos < length && isDigit(input.charAt(pos))) {
                pos++;
            }
        }
        if (pos < length && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
            int exponent = pos + 1;
            if (exponent < length && (input.charAt(exponent) == '+' || input.charAt(exponent) == '-')) {
                exponent++;
            }
            // Without digits the 'e' is left for the next token.
            if (exponent < length && isDigit(input.charAt(exponent))) {
                pos = exponent;
                while (pos < length && isDigit(input.charAt(pos))) {
                    pos++;
                }
            }
        }
        tokens.add(new Token(TokenType.NUMBER, input.substring(start, pos), start));
        return pos;
    }

    private static int readString(String input, int start, List<Token> tokens) {
        char quote = input.charAt(start);
        StringBuilder value = new StringBuilder();
        int pos = start + 1;
        int length = input.length();
        while (pos < length) {
            char c = input.charAt(pos);
            if (c == quote) {
                tokens.add(new Token(TokenType.STRING, value.toString(), start));
                return pos + 1;
            }
            if (c == '\\' && pos + 1 < length) {
                char escaped = input.charAt(pos + 1);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    default -> value.append(escaped);
                }
                pos += 2;
                continue;
            }
            value.append(c);
            pos++;
        }
        throw new ExpressionSyntaxException("Unterminated string starting at offset " + start, start);
    }

    private static int readIdentifier(String input, int start, List<Token> tokens) {
        int pos = start + 1;
        while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
            pos++;
        }
        String text = input.substring(start, pos);
        String lower = text.toLowerCase(Locale.ROOT);
        if (KEYWORDS.contains(lower)) {
            tokens.add(new Token(TokenType.KEYWORD, lower, start));
        } else {
            tokens.add(new Token(TokenType.IDENTIFIER, text, start));
        }
        return pos;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == '.';
    }
}

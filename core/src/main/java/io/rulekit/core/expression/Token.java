package io.rulekit.core.expression;

/**
 * A lexical token.
 *
 * @param type   lexical category
 * @param text   token text; keywords are lower-cased, strings are unescaped without quotes
 * @param offset zero-based offset of the token's first character in the source
 */
public record Token(TokenType type, String text, int offset) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equals(keyword);
    }

    public boolean isOperator(String operator) {
        return type == TokenType.OPERATOR && text.equals(operator);
    }

    /** Rendering used in error messages. */
    String describe() {
        return switch (type) {
            case EOF -> "end of input";
            case STRING -> "string \"" + text + "\"";
            default -> "'" + text + "'";
        };
    }
}

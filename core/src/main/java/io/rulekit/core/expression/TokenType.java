package io.rulekit.core.expression;

/** Lexical categories produced by {@link Lexer}. */
public enum TokenType {
    NUMBER,
    STRING,
    IDENTIFIER,
    /** {@code and or not in between contains startswith endswith true false null}, case-insensitive. */
    KEYWORD,
    /** {@code == != >= <= > < + - * / %}. */
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    COMMA,
    EOF
}

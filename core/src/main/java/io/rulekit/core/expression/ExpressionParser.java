package io.rulekit.core.expression;

import io.rulekit.core.error.ExpressionSyntaxException;
import io.rulekit.core.model.LogicExpression;
import io.rulekit.core.model.LogicExpression.BinaryOp;
import io.rulekit.core.model.LogicExpression.Call;
import io.rulekit.core.model.LogicExpression.ListExpr;
import io.rulekit.core.model.LogicExpression.Literal;
import io.rulekit.core.model.LogicExpression.NaryOp;
import io.rulekit.core.model.LogicExpression.UnaryOp;
import io.rulekit.core.model.LogicExpression.Variable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser from business-language text (e.g.
 * {@code age >= 18 and country in ["US", "CA"]}) to a {@link LogicExpression}.
 *
 * <p>
 * Grammar levels, lowest precedence first:
 *
 * <ol>
 * <li>{@code or}, flattened into one n-ary node per chain</li>
 * <li>{@code and}, flattened likewise</li>
 * <li>prefix {@code not}, right-associative</li>
 * <li>one optional, non-chaining comparison: {@code == != > >= < <= in between contains
 * startswith endswith}</li>
 * <li>{@code + -}, left-associative</li>
 * <li>{@code * / %}, left-associative</li>
 * <li>prefix {@code -}; a numeric literal operand is folded, anything else becomes
 * {@code 0 - x}</li>
 * <li>literals, parenthesised expressions, list literals, function calls, variables</li>
 * </ol>
 *
 * <p>
 * {@code x between lo and hi} compiles to {@code and(x >= lo, x <= hi)}. Blank input is the
 * always-match wildcard and yields {@link LogicExpression#TRUE}.
 *
 * <p>
 * Stateless and thread-safe: each call works on its own token cursor.
 */
public final class ExpressionParser {

    private final Lexer lexer = new Lexer();

    /**
     * Parses the given text.
     *
     * @param text business-language expression; {@code null} or blank means "always"
     * @return the compiled tree
     * @throws ExpressionSyntaxException with the offending offset if the text is malformed
     */
    public LogicExpression parse(String text) {
        if (text == null || text.isBlank()) {
            return LogicExpression.TRUE;
        }
        Cursor cursor = new Cursor(lexer.tokenize(text));
        LogicExpression expression = cursor.parseOr();
        Token trailing = cursor.peek();
        if (!trailing.is(TokenType.EOF)) {
            throw new ExpressionSyntaxException(
                    "Unexpected token " + trailing.describe() + " at offset " + trailing.offset(), trailing.offset());
        }
        return expression;
    }

    /** Parses the given text, reporting failure as a value instead of an exception. */
    public ParseResult tryParse(String text) {
        try {
            return ParseResult.success(parse(text));
        } catch (ExpressionSyntaxException e) {
            return ParseResult.failure(e.getMessage(), e.offset());
        }
    }

    /** Token cursor with one token of lookahead; one instance per parse call. */
    private static final class Cursor {

        private final List<Token> tokens;
        private int position;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(position);
        }

        private Token peekNext() {
            return tokens.get(Math.min(position + 1, tokens.size() - 1));
        }

        private Token advance() {
            Token token = tokens.get(position);
            if (!token.is(TokenType.EOF)) {
                position++;
            }
            return token;
        }

        private Token expect(TokenType type, String message) {
            Token token = peek();
            if (!token.is(type)) {
                throw error(message + ", found " + token.describe(), token);
            }
            return advance();
        }

        private static ExpressionSyntaxException error(String message, Token at) {
            return new ExpressionSyntaxException(message + " at offset " + at.offset(), at.offset());
        }

        // ── 1. or ──

        LogicExpression parseOr() {
            List<LogicExpression> operands = new ArrayList<>();
            operands.add(parseAnd());
            while (peek().isKeyword("or")) {
                advance();
                operands.add(parseAnd());
            }
            return operands.size() == 1 ? operands.get(0) : new NaryOp("or", operands);
        }

        // ── 2. and ──

        private LogicExpression parseAnd() {
            List<LogicExpression> operands = new ArrayList<>();
            operands.add(parseNot());
            while (peek().isKeyword("and")) {
                advance();
                operands.add(parseNot());
            }
            return operands.size() == 1 ? operands.get(0) : new NaryOp("and", operands);
        }

        // ── 3. not ──

        private LogicExpression parseNot() {
            if (peek().isKeyword("not")) {
                advance();
                return new UnaryOp(Operators.NOT_OPERATOR, parseNot());
            }
            return parseComparison();
        }

        // ── 4. comparison ──

        private LogicExpression parseComparison() {
            LogicExpression left = parseAdditive();
            Token token = peek();
            if (token.is(TokenType.OPERATOR) && Operators.COMPARISONS.contains(token.text())) {
                advance();
                return new BinaryOp(token.text(), left, parseAdditive());
            }
            if (!token.is(TokenType.KEYWORD)) {
                return left;
            }
            if (token.text().equals("between")) {
                advance();
                LogicExpression low = parseAdditive();
                if (!peek().isKeyword("and")) {
                    throw error("Expected 'and' after lower bound of between, found " + peek().describe(), peek());
                }
                advance();
                LogicExpression high = parseAdditive();
                return new NaryOp("and", List.of(new BinaryOp(">=", left, low), new BinaryOp("<=", left, high)));
            }
            if (token.text().equals("in")) {
                advance();
                if (!peek().is(TokenType.LEFT_BRACKET)) {
                    throw error("Expected '[' after 'in', found " + peek().describe(), peek());
                }
                return new BinaryOp("in", left, parseList());
            }
            String operator = Operators.COMPARISON_KEYWORDS.get(token.text());
            if (operator != null) {
                advance();
                return new BinaryOp(operator, left, parseAdditive());
            }
            return left;
        }

        // ── 5. additive ──

        private LogicExpression parseAdditive() {
            LogicExpression left = parseMultiplicative();
            while (peek().is(TokenType.OPERATOR) && Operators.ADDITIVE_OPERATORS.contains(peek().text())) {
                String operator = advance().text();
                left = new BinaryOp(operator, left, parseMultiplicative());
            }
            return left;
        }

        // ── 6. multiplicative ──

        private LogicExpression parseMultiplicative() {
            LogicExpression left = parseUnary();
            while (peek().is(TokenType.OPERATOR) && Operators.MULTIPLICATIVE_OPERATORS.contains(peek().text())) {
                String operator = advance().text();
                left = new BinaryOp(operator, left, parseUnary());
            }
            return left;
        }

        // ── 7. unary minus ──

        private LogicExpression parseUnary() {
            if (peek().isOperator("-")) {
                advance();
                LogicExpression operand = parseUnary();
                if (operand instanceof Literal literal && literal.isNumber()) {
                    return new Literal(literal.numberValue().negate());
                }
                return new BinaryOp("-", Literal.of(0), operand);
            }
            return parsePrimary();
        }

        // ── 8. primary ──

        private LogicExpression parsePrimary() {
            Token token = peek();
            switch (token.type()) {
                case NUMBER:
                    advance();
                    try {
                        return new Literal(new BigDecimal(token.text()));
                    } catch (NumberFormatException e) {
                        throw new ExpressionSyntaxException(
                                "Invalid number " + token.text() + " at offset " + token.offset(), token.offset());
                    }
                case STRING:
                    advance();
                    return new Literal(token.text());
                case LEFT_PAREN: {
                    advance();
                    LogicExpression inner = parseOr();
                    expect(TokenType.RIGHT_PAREN, "Expected ')'");
                    return inner;
                }
                case LEFT_BRACKET:
                    return parseList();
                case IDENTIFIER:
                    if (peekNext().is(TokenType.LEFT_PAREN)) {
                        return parseCall();
                    }
                    advance();
                    return new Variable(token.text());
                case KEYWORD:
                    switch (token.text()) {
                        case "true":
                            advance();
                            return LogicExpression.TRUE;
                        case "false":
                            advance();
                            return new Literal(Boolean.FALSE);
                        case "null":
                            advance();
                            return LogicExpression.NULL;
                        default:
                            throw error("Unexpected keyword '" + token.text() + "'", token);
                    }
                case EOF:
                    throw error("Unexpected end of input", token);
                default:
                    throw error("Unexpected token " + token.describe(), token);
            }
        }

        private LogicExpression parseList() {
            expect(TokenType.LEFT_BRACKET, "Expected '['");
            List<LogicExpression> elements = new ArrayList<>();
            if (!peek().is(TokenType.RIGHT_BRACKET)) {
                do {
                    elements.add(parseOr());
                } while (matchComma());
            }
            expect(TokenType.RIGHT_BRACKET, "Expected ']'");
            return new ListExpr(elements);
        }

        private LogicExpression parseCall() {
            Token name = advance();
            advance(); // '('
            List<LogicExpression> arguments = new ArrayList<>();
            if (!peek().is(TokenType.RIGHT_PAREN)) {
                do {
                    arguments.add(parseOr());
                } while (matchComma());
            }
            expect(TokenType.RIGHT_PAREN, "Expected ')' after arguments of " + name.text());
            Optional<Operators.FunctionSignature> known = Operators.function(name.text());
            if (known.isEmpty()) {
                return new Call(name.text(), arguments);
            }
            Operators.FunctionSignature signature = known.get();
            if (!signature.accepts(arguments.size())) {
                throw error(
                        "Function '" + signature.name() + "' expects " + signature.arityDescription() + ", got "
                                + arguments.size(),
                        name);
            }
            return new Call(signature.name(), arguments);
        }

        private boolean matchComma() {
            if (peek().is(TokenType.COMMA)) {
                advance();
                return true;
            }
            return false;
        }
    }
}

package io.safecalc.core.parse;

import io.safecalc.core.error.CalcException;
import io.safecalc.core.error.ExpressionLimitException;
import io.safecalc.core.error.ExpressionSyntaxException;
import io.safecalc.core.model.BinaryOperator;
import io.safecalc.core.model.ExpressionNode;
import io.safecalc.core.model.UnaryOperator;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the calculator grammar. The grammar is the safety boundary: there is
 * no production for assignment, attribute access, subscripting, strings, lists or statements, so
 * none of them can reach the evaluator.
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/' | '//' | '%') unary)*
 * unary      := ('+' | '-') unary | power
 * power      := primary ('**' unary)?
 * primary    := NUMBER | IDENT '(' [expression (',' expression)* [',']] ')' | IDENT | '(' expression ')'
 * </pre>
 *
 * <p>{@code **} binds tighter than a unary operator on its left and is right-associative, so
 * {@code -2**2} is {@code -4} and {@code 2**3**2} is {@code 512}.
 *
 * <p>Nesting of the descent (parentheses, unary signs, {@code **} exponents and call arguments)
 * is capped at {@code maxDepth}; operand chains at one level, such as {@code 1+1+...+1}, are
 * limited only by the input length. Instances are immutable and thread-safe; all parse state lives
 * in a per-call cursor.
 */
public final class ExpressionParser {

    private final int maxDepth;

    /**
     * @param maxDepth maximum syntactic nesting; must be positive
     */
    public ExpressionParser(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Parses a sanitized expression.
     *
     * @param sanitized expression text with keypad glyphs already replaced
     * @return the root of an immutable tree
     * @throws ExpressionSyntaxException if the text is not a sentence of the grammar
     * @throws ExpressionLimitException  if the expression nests deeper than {@code maxDepth}
     */
    public ExpressionNode parse(String sanitized) {
        List<Token> tokens = ExpressionLexer.tokenize(sanitized);
        if (tokens.get(0).type() == TokenType.EOF) {
            throw new ExpressionSyntaxException("Empty expression", 0);
        }
        return new Cursor(tokens).parseAll();
    }

    private final class Cursor {

        private final List<Token> tokens;
        private int index;
        private int nesting;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        ExpressionNode parseAll() {
            ExpressionNode result = expression();
            Token trailing = peek();
            if (trailing.type() == TokenType.RPAREN) {
                throw new ExpressionSyntaxException("Unbalanced parentheses: unexpected ')'", trailing.position());
            }
            if (trailing.type() != TokenType.EOF) {
                throw unexpected(trailing);
            }
            return result;
        }

        private ExpressionNode expression() {
            ExpressionNode left = term();
            while (peek().type() == TokenType.PLUS || peek().type() == TokenType.MINUS) {
                Token op = advance();
                ExpressionNode right = term();
                left = new ExpressionNode.BinaryOp(
                        op.type() == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUB, left, right);
            }
            return left;
        }

        private ExpressionNode term() {
            ExpressionNode left = unary();
            while (true) {
                BinaryOperator operator =
                        switch (peek().type()) {
                            case STAR -> BinaryOperator.MUL;
                            case SLASH -> BinaryOperator.DIV;
                            case DOUBLE_SLASH -> BinaryOperator.FLOORDIV;
                            case PERCENT -> BinaryOperator.MOD;
                            default -> null;
                        };
                if (operator == null) {
                    return left;
                }
                advance();
                ExpressionNode right = unary();
                left = new ExpressionNode.BinaryOp(operator, left, right);
            }
        }

        // every recursive production passes through here
        private ExpressionNode unary() {
            Token start = peek();
            if (++nesting > maxDepth) {
                throw tooDeep(start);
            }
            try {
                if (start.type() == TokenType.PLUS || start.type() == TokenType.MINUS) {
                    advance();
                    ExpressionNode operand = unary();
                    UnaryOperator operator =
                            start.type() == TokenType.MINUS ? UnaryOperator.NEGATE : UnaryOperator.IDENTITY;
                    return new ExpressionNode.UnaryOp(operator, operand);
                }
                return power();
            } finally {
                nesting--;
            }
        }

        private ExpressionNode power() {
            ExpressionNode base = primary();
            if (peek().type() != TokenType.DOUBLE_STAR) {
                return base;
            }
            advance();
            ExpressionNode exponent = unary();
            return new ExpressionNode.BinaryOp(BinaryOperator.POW, base, exponent);
        }

        private ExpressionNode primary() {
            Token token = advance();
            return switch (token.type()) {
                case NUMBER -> new ExpressionNode.Literal(token.value());
                case IDENTIFIER -> peek().type() == TokenType.LPAREN
                        ? call(token)
                        : new ExpressionNode.Identifier(token.text());
                case LPAREN -> {
                    ExpressionNode inner = expression();
                    expectClosing(token, "')'");
                    yield inner;
                }
                case RPAREN -> throw new ExpressionSyntaxException(
                        "Unbalanced parentheses: unexpected ')'", token.position());
                case EOF -> throw new ExpressionSyntaxException("Unexpected end of expression", token.position());
                default -> throw unexpected(token);
            };
        }

        private ExpressionNode call(Token name) {
            Token open = advance();
            List<ExpressionNode> args = new ArrayList<>();
            while (peek().type() != TokenType.RPAREN) {
                args.add(expression());
                if (peek().type() == TokenType.COMMA) {
                    advance();
                } else if (peek().type() != TokenType.RPAREN) {
                    break;
                }
            }
            expectClosing(open, "',' or ')'");
            return new ExpressionNode.Call(name.text(), args);
        }

        private void expectClosing(Token open, String expected) {
            Token token = peek();
            if (token.type() == TokenType.RPAREN) {
                advance();
                return;
            }
            if (token.type() == TokenType.EOF) {
                throw new ExpressionSyntaxException(
                        "Unbalanced parentheses: '(' at position " + open.position() + " is never closed",
                        token.position());
            }
            throw new ExpressionSyntaxException(
                    "Expected " + expected + " but found " + token.describe(), token.position());
        }

        private CalcException tooDeep(Token at) {
            return new ExpressionLimitException(
                    "Expression nests deeper than " + maxDepth + " levels (at position " + at.position() + ")",
                    ExpressionLimitException.Limit.DEPTH,
                    CalcException.Phase.PARSE);
        }

        private ExpressionSyntaxException unexpected(Token token) {
            if (token.type() == TokenType.EOF) {
                return new ExpressionSyntaxException("Unexpected end of expression", token.position());
            }
            return new ExpressionSyntaxException("Unexpected token " + token.describe(), token.position());
        }

        private Token peek() {
            return tokens.get(index);
        }

        private Token advance() {
            Token token = tokens.get(index);
            if (token.type() != TokenType.EOF) {
                index++;
            }
            return token;
        }
    }
}

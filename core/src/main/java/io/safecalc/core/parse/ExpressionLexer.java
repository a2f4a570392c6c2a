package io.safecalc.core.parse;

import io.safecalc.core.error.ExpressionSyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a sanitized expression into {@link Token}s. Anything that is not a number, an ASCII
 * identifier, one of the arithmetic operators, a parenthesis, a comma or whitespace is rejected
 * here, before a tree is ever built.
 */
public final class ExpressionLexer {

    private final String input;
    private int position;

    private ExpressionLexer(String input) {
        this.input = input;
    }

    /**
     * Tokenizes the input. The returned list always ends with a single {@link TokenType#EOF}.
     *
     * @throws ExpressionSyntaxException on malformed numbers or unrecognized characters
     */
    public static List<Token> tokenize(String input) {
        return new ExpressionLexer(input).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (position < input.length()) {
            char c = input.charAt(position);
            if (Character.isWhitespace(c)) {
                position++;
            } else if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
                tokens.add(number());
            } else if (isIdentifierStart(c)) {
                tokens.add(identifier());
            } else {
                tokens.add(operator(c));
            }
        }
        tokens.add(Token.of(TokenType.EOF, "", input.length()));
        return tokens;
    }

    private Token number() {
        int start = position;
        consumeDigits();
        if (peek(0) == '.') {
            position++;
            consumeDigits();
        }
        char e = peek(0);
        if (e == 'e' || e == 'E') {
            int signOffset = (peek(1) == '+' || peek(1) == '-') ? 2 : 1;
            if (!isDigit(peek(signOffset))) {
                throw malformedNumber(start);
            }
            position += signOffset;
            consumeDigits();
        }
        char next = peek(0);
        if (next == '.' || isIdentifierPart(next)) {
            throw malformedNumber(start);
        }
        String text = input.substring(start, position);
        try {
            return new Token(TokenType.NUMBER, text, start, Double.parseDouble(text));
        } catch (NumberFormatException ex) {
            throw new ExpressionSyntaxException("Malformed number '" + text + "'", ex, start);
        }
    }

    private ExpressionSyntaxException malformedNumber(int start) {
        int end = position;
        while (end < input.length() && (isIdentifierPart(input.charAt(end)) || input.charAt(end) == '.')) {
            end++;
        }
        return new ExpressionSyntaxException("Malformed number '" + input.substring(start, end) + "'", start);
    }

    private Token identifier() {
        int start = position;
        while (position < input.length() && isIdentifierPart(input.charAt(position))) {
            position++;
        }
        return Token.of(TokenType.IDENTIFIER, input.substring(start, position), start);
    }

    private Token operator(char c) {
        int start = position;
        TokenType type =
                switch (c) {
                    case '+' -> TokenType.PLUS;
                    case '-' -> TokenType.MINUS;
                    case '*' -> peek(1) == '*' ? TokenType.DOUBLE_STAR : TokenType.STAR;
                    case '/' -> peek(1) == '/' ? TokenType.DOUBLE_SLASH : TokenType.SLASH;
                    case '%' -> TokenType.PERCENT;
                    case '(' -> TokenType.LPAREN;
                    case ')' -> TokenType.RPAREN;
                    case ',' -> TokenType.COMMA;
                    default -> throw unrecognized(start);
                };
        position += (type == TokenType.DOUBLE_STAR || type == TokenType.DOUBLE_SLASH) ? 2 : 1;
        return Token.of(type, input.substring(start, position), start);
    }

    private ExpressionSyntaxException unrecognized(int at) {
        int codePoint = input.codePointAt(at);
        return new ExpressionSyntaxException(
                "Unrecognized character '" + new String(Character.toChars(codePoint)) + "'", at);
    }

    private void consumeDigits() {
        while (position < input.length() && isDigit(input.charAt(position))) {
            position++;
        }
    }

    private char peek(int offset) {
        int index = position + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}

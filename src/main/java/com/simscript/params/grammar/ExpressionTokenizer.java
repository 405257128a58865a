package com.simscript.params.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.simscript.params.exception.ExpressionSyntaxException;
import com.simscript.params.grammar.ExpressionToken.TokenType;

/**
 * Tokenizer for the arithmetic expression language.
 *
 * {@code ^} is read as the power operator, like {@code **}.
 */
public class ExpressionTokenizer {

    private static final Map<Character, TokenType> SINGLE_CHARS = Map.ofEntries(
        Map.entry('+', TokenType.PLUS),
        Map.entry('-', TokenType.MINUS),
        Map.entry('%', TokenType.PERCENT),
        Map.entry('@', TokenType.AT),
        Map.entry('^', TokenType.POWER),
        Map.entry('(', TokenType.LPAREN),
        Map.entry(')', TokenType.RPAREN),
        Map.entry('[', TokenType.LBRACKET),
        Map.entry(']', TokenType.RBRACKET),
        Map.entry(',', TokenType.COMMA),
        Map.entry(':', TokenType.COLON)
    );

    private final String source;
    private int pos = 0;

    public ExpressionTokenizer(String source) {
        this.source = source;
    }

    /**
     * Tokenize the entire expression; the list always ends with an EOF token.
     */
    public List<ExpressionToken> tokenize() {
        List<ExpressionToken> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                break;
            }
            tokens.add(nextToken());
        }
        tokens.add(new ExpressionToken(TokenType.EOF, "", pos));
        return tokens;
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private ExpressionToken nextToken() {
        char c = source.charAt(pos);
        int start = pos;

        if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length()
                && Character.isDigit(source.charAt(pos + 1)))) {
            return readNumber();
        }
        if (Character.isLetter(c) || c == '_') {
            while (pos < source.length()
                    && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
            return new ExpressionToken(TokenType.IDENTIFIER, source.substring(start, pos), start);
        }
        if (c == '"' || c == '\'') {
            return readString(c);
        }
        if (c == '*') {
            if (peekChar(1) == '*') {
                pos += 2;
                return new ExpressionToken(TokenType.POWER, "**", start);
            }
            pos++;
            return new ExpressionToken(TokenType.STAR, "*", start);
        }
        if (c == '/') {
            if (peekChar(1) == '/') {
                pos += 2;
                return new ExpressionToken(TokenType.DOUBLE_SLASH, "//", start);
            }
            pos++;
            return new ExpressionToken(TokenType.SLASH, "/", start);
        }
        if (c == '.') {
            pos++;
            return new ExpressionToken(TokenType.DOT, ".", start);
        }
        TokenType type = SINGLE_CHARS.get(c);
        if (type == null) {
            throw new ExpressionSyntaxException("unexpected character '" + c + "'", start);
        }
        pos++;
        return new ExpressionToken(type, String.valueOf(c), start);
    }

    private ExpressionToken readNumber() {
        int start = pos;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos < source.length() && source.charAt(pos) == '.') {
            // "1.T" is not a number followed by an attribute
            if (!Character.isLetter(peekChar(1)) || peekChar(1) == 'e' || peekChar(1) == 'E') {
                pos++;
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
            }
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = mark;
            }
        }
        if (pos < source.length() && (Character.isLetter(source.charAt(pos)) || source.charAt(pos) == '_')) {
            throw new ExpressionSyntaxException("invalid number literal '"
                    + source.substring(start, pos + 1) + "'", start);
        }
        return new ExpressionToken(TokenType.NUMBER, source.substring(start, pos), start);
    }

    private ExpressionToken readString(char quote) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length() && source.charAt(pos) != quote) {
            char c = source.charAt(pos);
            if (c == '\\' && pos + 1 < source.length()) {
                char next = source.charAt(pos + 1);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case '\\', '"', '\'' -> sb.append(next);
                    default -> sb.append(c).append(next);
                }
                pos += 2;
            } else {
                sb.append(c);
                pos++;
            }
        }
        if (pos >= source.length()) {
            throw new ExpressionSyntaxException("unterminated string literal", start);
        }
        pos++;
        return new ExpressionToken(TokenType.STRING, sb.toString(), start);
    }

    private char peekChar(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }
}

package com.simscript.params.grammar;

import java.util.ArrayList;
import java.util.List;

import com.simscript.params.exception.ExpressionSyntaxException;
import com.simscript.params.grammar.ExpressionToken.TokenType;
import com.simscript.params.grammar.ast.AttributeNode;
import com.simscript.params.grammar.ast.BinaryNode;
import com.simscript.params.grammar.ast.CallNode;
import com.simscript.params.grammar.ast.ExprNode;
import com.simscript.params.grammar.ast.IndexNode;
import com.simscript.params.grammar.ast.ListNode;
import com.simscript.params.grammar.ast.LiteralNode;
import com.simscript.params.grammar.ast.NameNode;
import com.simscript.params.grammar.ast.Operator;
import com.simscript.params.grammar.ast.SliceNode;
import com.simscript.params.grammar.ast.UnaryNode;

/**
 * Recursive-descent parser of the arithmetic expression language.
 *
 * Precedence, lowest first:
 * <pre>
 *   expression := additive (',' additive)*          top level only, yields a sequence
 *   additive   := term (('+' | '-') term)*
 *   term       := unary (('*' | '/' | '//' | '%' | '@') unary)*
 *   unary      := ('+' | '-') unary | power
 *   power      := postfix (('**' | '^') unary)?       right associative
 *   postfix    := primary ('[' subscripts ']' | '.' IDENTIFIER)*
 *   primary    := NUMBER | STRING | IDENTIFIER | IDENTIFIER '(' args ')'
 *               | '(' expression ')' | '[' items ']'
 * </pre>
 *
 * The syntax tree is at most {@value #MAX_DEPTH} levels deep; deeper input is a syntax error.
 */
public class ExpressionParser {

    static final int MAX_DEPTH = 500;

    private final List<ExpressionToken> tokens;
    private int pos = 0;
    private int depth = 0;

    public ExpressionParser(List<ExpressionToken> tokens) {
        this.tokens = tokens;
    }

    /**
     * Tokenizes and parses a complete expression.
     *
     * @throws ExpressionSyntaxException when the text is not a well-formed expression
     */
    public static ExprNode parse(String text) {
        return new ExpressionParser(new ExpressionTokenizer(text).tokenize()).parseExpression();
    }

    public ExprNode parseExpression() {
        if (isAtEnd()) {
            throw new ExpressionSyntaxException("empty expression", peek().getPosition());
        }
        int start = peek().getPosition();
        ExprNode first = parseAdditive();
        if (check(TokenType.COMMA)) {
            List<ExprNode> items = new ArrayList<>();
            items.add(first);
            while (match(TokenType.COMMA)) {
                if (isAtEnd()) {
                    break;
                }
                items.add(parseAdditive());
            }
            first = new ListNode(items, start);
        }
        if (!isAtEnd()) {
            throw new ExpressionSyntaxException("unexpected '" + peek().getValue() + "'", peek().getPosition());
        }
        return first;
    }

    private ExprNode parseAdditive() {
        int saved = depth;
        try {
            ExprNode left = parseTerm();
            while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
                ExpressionToken op = advance();
                descend(op);
                Operator operator = op.is(TokenType.PLUS) ? Operator.ADD : Operator.SUBTRACT;
                left = new BinaryNode(operator, left, parseTerm(), op.getPosition());
            }
            return left;
        } finally {
            depth = saved;
        }
    }

    private ExprNode parseTerm() {
        int saved = depth;
        try {
            ExprNode left = parseUnary();
            while (true) {
                Operator operator = termOperator(peek().getType());
                if (operator == null) {
                    return left;
                }
                ExpressionToken op = advance();
                descend(op);
                left = new BinaryNode(operator, left, parseUnary(), op.getPosition());
            }
        } finally {
            depth = saved;
        }
    }

    private static Operator termOperator(TokenType type) {
        return switch (type) {
            case STAR -> Operator.MULTIPLY;
            case SLASH -> Operator.DIVIDE;
            case DOUBLE_SLASH -> Operator.FLOOR_DIVIDE;
            case PERCENT -> Operator.MODULO;
            case AT -> Operator.MATMUL;
            default -> null;
        };
    }

    private ExprNode parseUnary() {
        int saved = depth;
        descend(peek());
        try {
            if (check(TokenType.MINUS) || check(TokenType.PLUS)) {
                ExpressionToken op = advance();
                Operator operator = op.is(TokenType.MINUS) ? Operator.NEGATE : Operator.IDENTITY;
                return new UnaryNode(operator, parseUnary(), op.getPosition());
            }
            return parsePower();
        } finally {
            depth = saved;
        }
    }

    private ExprNode parsePower() {
        ExprNode base = parsePostfix();
        if (check(TokenType.POWER)) {
            ExpressionToken op = advance();
            return new BinaryNode(Operator.POWER, base, parseUnary(), op.getPosition());
        }
        return base;
    }

    private ExprNode parsePostfix() {
        ExprNode node = parsePrimary();
        while (true) {
            if (check(TokenType.LBRACKET)) {
                ExpressionToken open = advance();
                descend(open);
                List<ExprNode> indices = new ArrayList<>();
                do {
                    indices.add(parseSubscript());
                } while (match(TokenType.COMMA) && !check(TokenType.RBRACKET));
                expect(TokenType.RBRACKET);
                node = new IndexNode(node, indices, open.getPosition());
            } else if (check(TokenType.DOT)) {
                ExpressionToken dot = advance();
                descend(dot);
                String attribute = expect(TokenType.IDENTIFIER).getValue();
                node = new AttributeNode(node, attribute, dot.getPosition());
            } else {
                return node;
            }
        }
    }

    private ExprNode parseSubscript() {
        int start = peek().getPosition();
        ExprNode first = null;
        if (!check(TokenType.COLON)) {
            first = parseAdditive();
            if (!check(TokenType.COLON)) {
                return first;
            }
        }
        expect(TokenType.COLON);
        ExprNode stop = isSliceBoundary() ? null : parseAdditive();
        ExprNode step = null;
        if (match(TokenType.COLON) && !isSliceBoundary()) {
            step = parseAdditive();
        }
        return new SliceNode(first, stop, step, start);
    }

    private boolean isSliceBoundary() {
        return check(TokenType.COLON) || check(TokenType.COMMA) || check(TokenType.RBRACKET);
    }

    private ExprNode parsePrimary() {
        ExpressionToken token = peek();
        switch (token.getType()) {
            case NUMBER -> {
                advance();
                return new LiteralNode(parseNumber(token), token.getPosition());
            }
            case STRING -> {
                advance();
                return new LiteralNode(token.getValue(), token.getPosition());
            }
            case IDENTIFIER -> {
                advance();
                if ("True".equals(token.getValue()) || "False".equals(token.getValue())) {
                    return new LiteralNode(Boolean.valueOf("True".equals(token.getValue())), token.getPosition());
                }
                if (check(TokenType.LPAREN)) {
                    advance();
                    List<ExprNode> arguments = parseItems(TokenType.RPAREN);
                    return new CallNode(token.getValue(), arguments, token.getPosition());
                }
                return new NameNode(token.getValue(), token.getPosition());
            }
            case LPAREN -> {
                advance();
                if (match(TokenType.RPAREN)) {
                    return new ListNode(List.of(), token.getPosition());
                }
                ExprNode inner = parseAdditive();
                if (check(TokenType.COMMA)) {
                    List<ExprNode> items = new ArrayList<>();
                    items.add(inner);
                    while (match(TokenType.COMMA) && !check(TokenType.RPAREN)) {
                        items.add(parseAdditive());
                    }
                    expect(TokenType.RPAREN);
                    return new ListNode(items, token.getPosition());
                }
                expect(TokenType.RPAREN);
                return inner;
            }
            case LBRACKET -> {
                advance();
                return new ListNode(parseItems(TokenType.RBRACKET), token.getPosition());
            }
            case EOF -> throw new ExpressionSyntaxException("unexpected end of expression", token.getPosition());
            default -> throw new ExpressionSyntaxException("unexpected '" + token.getValue() + "'",
                    token.getPosition());
        }
    }

    /**
     * Comma separated items up to {@code closing}; a trailing comma is accepted.
     */
    private List<ExprNode> parseItems(TokenType closing) {
        List<ExprNode> items = new ArrayList<>();
        while (!check(closing)) {
            items.add(parseAdditive());
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        expect(closing);
        return items;
    }

    private static Double parseNumber(ExpressionToken token) {
        try {
            return Double.valueOf(token.getValue());
        } catch (NumberFormatException e) {
            throw new ExpressionSyntaxException("invalid number '" + token.getValue() + "'", token.getPosition());
        }
    }

    private void descend(ExpressionToken token) {
        if (++depth > MAX_DEPTH) {
            throw new ExpressionSyntaxException("expression is nested deeper than " + MAX_DEPTH + " levels",
                    token.getPosition());
        }
    }

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private ExpressionToken peek() {
        return tokens.get(pos);
    }

    private ExpressionToken previous() {
        return tokens.get(pos - 1);
    }

    private boolean check(TokenType type) {
        return peek().getType() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private ExpressionToken advance() {
        if (!isAtEnd()) pos++;
        return previous();
    }

    private ExpressionToken expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        ExpressionToken found = peek();
        throw new ExpressionSyntaxException("expected " + type + " but found "
                + (found.is(TokenType.EOF) ? "end of expression" : "'" + found.getValue() + "'"),
                found.getPosition());
    }
}

package com.venn.expression;

import com.venn.exception.SetExpressionException;
import com.venn.expression.node.ComplementNode;
import com.venn.expression.node.DifferenceNode;
import com.venn.expression.node.EmptySetNode;
import com.venn.expression.node.IntersectionNode;
import com.venn.expression.node.SetNode;
import com.venn.expression.node.SetRefNode;
import com.venn.expression.node.SymmetricDifferenceNode;
import com.venn.expression.node.UnionNode;

import java.util.List;

/**
 * Parser for set expressions.
 * Converts tokens into a {@link SetNode} tree using recursive descent parsing.
 * Accepts the same grammar as {@link SetExpressionEvaluator} and reports the same
 * errors, except that unknown set names are only detected when the tree is evaluated.
 */
public final class SetExpressionParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    public SetExpressionParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse a formula into an expression tree.
     *
     * @param expression Formula
     * @return Root node; an empty-set node for a blank formula
     * @throws SetExpressionException if the formula is malformed
     */
    public static SetNode parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return new EmptySetNode();
        }
        List<Token> tokens = new SetExpressionTokenizer(expression).tokenize();
        return new SetExpressionParser(expression, tokens).parseTokens();
    }

    /**
     * Parse the token stream into a tree.
     *
     * @return Root node
     */
    public SetNode parseTokens() {
        SetNode result = parseExpression();
        if (!check(TokenType.EOF)) {
            throw ExpressionErrors.unexpected(input, peek());
        }
        return result;
    }

    private SetNode parseExpression() {
        return parseOr();
    }

    private SetNode parseOr() {
        SetNode left = parseDiff();
        while (match(TokenType.OR)) {
            left = new UnionNode(left, parseDiff());
        }
        return left;
    }

    private SetNode parseDiff() {
        SetNode left = parseXor();
        while (match(TokenType.DIFF)) {
            left = new DifferenceNode(left, parseXor());
        }
        return left;
    }

    private SetNode parseXor() {
        SetNode left = parseAnd();
        while (match(TokenType.XOR)) {
            left = new SymmetricDifferenceNode(left, parseAnd());
        }
        return left;
    }

    private SetNode parseAnd() {
        SetNode left = parseNot();
        while (match(TokenType.AND)) {
            left = new IntersectionNode(left, parseNot());
        }
        return left;
    }

    private SetNode parseNot() {
        SetNode operand = parseAtom();
        if (match(TokenType.NOT)) {
            return new ComplementNode(operand);
        }
        return operand;
    }

    private SetNode parseAtom() {
        Token token = peek();

        if (match(TokenType.LPAREN)) {
            SetNode group = parseExpression();
            if (!match(TokenType.RPAREN)) {
                throw ExpressionErrors.unclosed(input, token, peek());
            }
            return group;
        }

        if (match(TokenType.SET_REF)) {
            return new SetRefNode(token.text(), input, token.position());
        }

        throw ExpressionErrors.unexpected(input, token);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            index++;
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token peek() {
        return tokens.get(index);
    }
}

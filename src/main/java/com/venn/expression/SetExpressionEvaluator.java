package com.venn.expression;

import com.venn.exception.SetExpressionException;
import com.venn.exception.SetExpressionException.ErrorKind;
import com.venn.membership.MembershipMap;
import com.venn.membership.MembershipVector;

import java.util.List;

/**
 * Direct set expression evaluator.
 * Combines parsing and evaluation in one step - no intermediate syntax tree.
 * <p>
 * Grammar (precedence: NOT > AND > XOR > DIFF > OR):
 * <pre>
 * expression := or
 * or         := diff ('U' diff)*
 * diff       := xor ('-' xor)*
 * xor        := and ('^' and)*
 * and        := not ('&' not)*
 * not        := atom '.'?
 * atom       := SET | '(' expression ')'
 * </pre>
 * Complement is postfix and applies once, to the atom or group right before it.
 * <p>
 * Instances hold no state and can be shared between threads.
 */
public class SetExpressionEvaluator {

    /**
     * Evaluate a formula against a membership map.
     *
     * @param expression Formula (e.g., "(A U B) - C.")
     * @param membership Membership vectors of the named sets
     * @return Fresh vector over the map's universe; all-false for a blank formula
     * @throws SetExpressionException if the formula is malformed or names an unknown set
     */
    public MembershipVector evaluate(String expression, MembershipMap membership) {
        if (expression == null || expression.isBlank()) {
            return MembershipVector.allFalse(membership.universeSize());
        }

        List<Token> tokens = new SetExpressionTokenizer(expression).tokenize();
        Parser parser = new Parser(expression, tokens, membership);
        return parser.parse();
    }

    /**
     * Internal parser that folds membership vectors during parsing.
     */
    private static final class Parser {
        private final String input;
        private final List<Token> tokens;
        private final MembershipMap membership;
        private final MembershipVector universal;
        private int index;

        Parser(String input, List<Token> tokens, MembershipMap membership) {
            this.input = input;
            this.tokens = tokens;
            this.membership = membership;
            this.universal = MembershipVector.allTrue(membership.universeSize());
            this.index = 0;
        }

        MembershipVector parse() {
            MembershipVector result = parseExpression();
            if (!check(TokenType.EOF)) {
                throw unexpected(peek());
            }
            return result;
        }

        private MembershipVector parseExpression() {
            return parseOr();
        }

        private MembershipVector parseOr() {
            MembershipVector left = parseDiff();
            while (match(TokenType.OR)) {
                MembershipVector right = parseDiff();
                left = left.or(right);
            }
            return left;
        }

        private MembershipVector parseDiff() {
            MembershipVector left = parseXor();
            while (match(TokenType.DIFF)) {
                MembershipVector right = parseXor();
                left = left.andNot(right);
            }
            return left;
        }

        private MembershipVector parseXor() {
            MembershipVector left = parseAnd();
            while (match(TokenType.XOR)) {
                MembershipVector right = parseAnd();
                left = left.xor(right);
            }
            return left;
        }

        private MembershipVector parseAnd() {
            MembershipVector left = parseNot();
            while (match(TokenType.AND)) {
                MembershipVector right = parseNot();
                left = left.and(right);
            }
            return left;
        }

        private MembershipVector parseNot() {
            MembershipVector operand = parseAtom();
            if (match(TokenType.NOT)) {
                return universal.andNot(operand);
            }
            return operand;
        }

        private MembershipVector parseAtom() {
            Token token = peek();

            if (match(TokenType.LPAREN)) {
                MembershipVector group = parseExpression();
                if (!match(TokenType.RPAREN)) {
                    throw unclosed(token);
                }
                return group;
            }

            if (match(TokenType.SET_REF)) {
                return membership.get(token.text())
                        .orElseThrow(() -> new SetExpressionException(ErrorKind.UNKNOWN_SET, input,
                                token.position(), token.text(), "Unknown set '" + token.text() + "'"));
            }

            throw unexpected(token);
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

        private SetExpressionException unexpected(Token token) {
            return ExpressionErrors.unexpected(input, token);
        }

        private SetExpressionException unclosed(Token open) {
            return ExpressionErrors.unclosed(input, open, peek());
        }
    }
}

package com.venn.expression;

import java.util.Map;

/**
 * Operator symbols of the set expression language.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char UNION = 'U';
        public static final char INTERSECTION = '&';
        public static final char SYMMETRIC_DIFFERENCE = '^';
        public static final char DIFFERENCE = '-';
        public static final char COMPLEMENT = '.';
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';

        private Operators() {
        }
    }

    /**
     * Single-character symbols mapped to token types.
     */
    public static final Map<Character, TokenType> SYMBOLS = Map.of(
            Operators.UNION, TokenType.OR,
            Operators.INTERSECTION, TokenType.AND,
            Operators.SYMMETRIC_DIFFERENCE, TokenType.XOR,
            Operators.DIFFERENCE, TokenType.DIFF,
            Operators.COMPLEMENT, TokenType.NOT,
            Operators.LEFT_PAREN, TokenType.LPAREN,
            Operators.RIGHT_PAREN, TokenType.RPAREN
    );

    /**
     * Check whether a character names a set.
     * Any uppercase ASCII letter except the union operator qualifies.
     */
    public static boolean isSetName(char c) {
        return c >= 'A' && c <= 'Z' && c != Operators.UNION;
    }
}

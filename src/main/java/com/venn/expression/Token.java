package com.venn.expression;

/**
 * Represents a token in a set expression.
 *
 * @param type     Token type
 * @param text     Original text
 * @param position Position in the input string
 */
public record Token(TokenType type, String text, int position) {

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}

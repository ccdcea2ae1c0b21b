package com.venn.expression;

/**
 * Token types for set expression parsing.
 */
public enum TokenType {
    // Set reference
    SET_REF,

    // Delimiters
    LPAREN,
    RPAREN,

    // Set operators
    NOT,
    AND,
    OR,
    XOR,
    DIFF,

    // Special
    EOF
}

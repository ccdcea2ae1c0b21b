package com.venn.exception;

/**
 * Exception thrown when a set expression cannot be tokenized, parsed or resolved.
 * No partial result accompanies it.
 */
public class SetExpressionException extends VennException {

    /**
     * Kinds of set expression failures.
     */
    public enum ErrorKind {
        UNKNOWN_CHARACTER,
        UNKNOWN_SET,
        UNEXPECTED_TOKEN,
        UNEXPECTED_END_OF_INPUT,
        UNCLOSED_PARENTHESIS
    }

    private final ErrorKind kind;
    private final String expression;
    private final int position;
    private final String offendingText;

    public SetExpressionException(ErrorKind kind, String expression, int position,
                                  String offendingText, String detail) {
        super("Invalid set expression at position " + position + ": " + detail
                + " in '" + expression + "'");
        this.kind = kind;
        this.expression = expression;
        this.position = position;
        this.offendingText = offendingText;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getExpression() {
        return expression;
    }

    /**
     * Zero-based offset of the offending character or token, or the expression
     * length when input ended early.
     */
    public int getPosition() {
        return position;
    }

    /**
     * The offending character, set name or token text. Empty for end of input.
     */
    public String getOffendingText() {
        return offendingText;
    }
}

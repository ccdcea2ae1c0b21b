package com.venn.expression;

import com.venn.exception.SetExpressionException;
import com.venn.exception.SetExpressionException.ErrorKind;

/**
 * Builds the parse errors shared by the direct evaluator and the tree parser.
 */
final class ExpressionErrors {

    private ExpressionErrors() {
    }

    /**
     * Error for a token that cannot appear where it was found.
     * An EOF token means the input ended before an operand.
     */
    static SetExpressionException unexpected(String input, Token token) {
        if (token.type() == TokenType.EOF) {
            return new SetExpressionException(ErrorKind.UNEXPECTED_END_OF_INPUT, input,
                    token.position(), "", "Unexpected end of expression");
        }
        return new SetExpressionException(ErrorKind.UNEXPECTED_TOKEN, input,
                token.position(), token.text(), "Unexpected token '" + token.text() + "'");
    }

    /**
     * Error for a group whose closing parenthesis is not the next token.
     */
    static SetExpressionException unclosed(String input, Token open, Token found) {
        String detail = "Missing closing parenthesis for '(' at position " + open.position();
        if (found.type() != TokenType.EOF) {
            detail += ", found '" + found.text() + "'";
        }
        return new SetExpressionException(ErrorKind.UNCLOSED_PARENTHESIS, input,
                found.position(), found.text(), detail);
    }
}

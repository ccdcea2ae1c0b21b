package com.venn.expression;

import com.venn.exception.SetExpressionException;
import com.venn.exception.SetExpressionException.ErrorKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.venn.expression.ExpressionConfig.*;

/**
 * Tokenizer for set expressions.
 * Converts input string into a sequence of tokens terminated by {@link TokenType#EOF}.
 */
public final class SetExpressionTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public SetExpressionTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, the last one being EOF
     * @throws SetExpressionException with kind UNKNOWN_CHARACTER for a character outside the alphabet
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;
            TokenType symbol = SYMBOLS.get(c);
            if (symbol != null) {
                advance();
                tokens.add(new Token(symbol, String.valueOf(c), start));
            } else if (isSetName(c)) {
                advance();
                tokens.add(new Token(TokenType.SET_REF, String.valueOf(c), start));
            } else {
                throw new SetExpressionException(ErrorKind.UNKNOWN_CHARACTER, input, start,
                        String.valueOf(c), "Unknown character '" + c + "'");
            }
        }

        tokens.add(new Token(TokenType.EOF, "", pos));
        return tokens;
    }

    /**
     * Collect the set names a formula mentions, in order of first appearance.
     * Characters the tokenizer would reject are ignored.
     */
    public static Set<String> referencedSets(String input) {
        Set<String> names = new LinkedHashSet<>();
        if (input == null) {
            return names;
        }
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (isSetName(c)) {
                names.add(String.valueOf(c));
            }
        }
        return names;
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}

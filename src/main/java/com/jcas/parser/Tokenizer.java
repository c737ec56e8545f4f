package com.jcas.parser;

import com.jcas.error.ParityException;
import com.jcas.error.UnexpectedTokenException;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Left-to-right scanner. Bracket pairs become nested GROUP tokens, so the token list mirrors
 * the bracket structure of the input.
 */
public final class Tokenizer {
    private final ParserTables tables;
    private String input;
    private int pos;

    public Tokenizer(ParserTables tables) {
        this.tables = tables;
    }

    public MutableList<Token> tokenize(String text) {
        this.input = text;
        this.pos = 0;
        return scan(null, -1);
    }

    private MutableList<Token> scan(Bracket open, int openPosition) {
        MutableList<Token> tokens = Lists.mutable.empty();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (isNumberStart(input, pos)) {
                int end = scanNumber(input, pos);
                tokens.add(Token.number(input.substring(pos, end), pos));
                pos = end;
            } else if (isIdentifierStart(c)) {
                int end = scanIdentifier(input, pos);
                tokens.add(Token.identifier(input.substring(pos, end), pos));
                pos = end;
            } else if (tables.opening(c) != null) {
                Bracket bracket = tables.opening(c);
                int start = pos++;
                tokens.add(Token.group(bracket, scan(bracket, start), start));
            } else if (tables.closing(c) != null) {
                if (open == null) {
                    throw new ParityException("unmatched '" + c + "'", String.valueOf(c), pos);
                }
                if (c != open.close()) {
                    throw new ParityException("expected '" + open.close() + "' but found '" + c + "'",
                            String.valueOf(c), pos);
                }
                pos++;
                return tokens;
            } else if (c == ',') {
                tokens.add(Token.comma(pos++));
            } else {
                String symbol = tables.matchOperator(input, pos);
                if (symbol == null) {
                    throw new UnexpectedTokenException("unexpected character '" + c + "'", String.valueOf(c), pos);
                }
                tokens.add(Token.operator(symbol, pos));
                pos += symbol.length();
            }
        }
        if (open != null) {
            throw new ParityException("missing '" + open.close() + "' for '" + open.open() + "'",
                    String.valueOf(open.open()), openPosition);
        }
        return tokens;
    }

    // ========== lexical helpers shared with the preprocessors ==========

    static boolean isNumberStart(String text, int i) {
        char c = text.charAt(i);
        return Character.isDigit(c)
                || (c == '.' && i + 1 < text.length() && Character.isDigit(text.charAt(i + 1)));
    }

    /**
     * End of a decimal or scientific literal ({@code 12}, {@code 1.5}, {@code .5},
     * {@code 1.234e+1}). An {@code e} not followed by digits is left for the identifier scanner.
     */
    static int scanNumber(String text, int i) {
        int n = text.length();
        while (i < n && Character.isDigit(text.charAt(i))) {
            i++;
        }
        if (i < n && text.charAt(i) == '.') {
            i++;
            while (i < n && Character.isDigit(text.charAt(i))) {
                i++;
            }
        }
        if (i < n && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < n && (text.charAt(j) == '+' || text.charAt(j) == '-')) {
                j++;
            }
            if (j < n && Character.isDigit(text.charAt(j))) {
                while (j < n && Character.isDigit(text.charAt(j))) {
                    j++;
                }
                i = j;
            }
        }
        return i;
    }

    static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    static int scanIdentifier(String text, int i) {
        while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
            i++;
        }
        return i;
    }
}

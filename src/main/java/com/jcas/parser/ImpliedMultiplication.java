package com.jcas.parser;

/**
 * Inserts the {@code *} that juxtaposition implies: {@code 2x}, {@code 2(x+1)}, {@code (a)(b)},
 * {@code x(y)} when {@code x} is not a function, {@code 3asin(x)}, {@code 4!x}.
 */
public final class ImpliedMultiplication implements Preprocessor {

    private enum Previous {
        NOTHING,
        NUMBER,
        IDENTIFIER,
        CLOSE,
        OTHER
    }

    @Override
    public String apply(String text, ParserTables tables) {
        StringBuilder sb = new StringBuilder(text.length() + 8);
        Previous previous = Previous.NOTHING;
        String lastIdentifier = null;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                sb.append(c);
                i++;
                continue;
            }
            if (Tokenizer.isNumberStart(text, i)) {
                if (endsOperand(previous)) {
                    sb.append('*');
                }
                int end = Tokenizer.scanNumber(text, i);
                sb.append(text, i, end);
                i = end;
                previous = Previous.NUMBER;
            } else if (Tokenizer.isIdentifierStart(c)) {
                if (endsOperand(previous)) {
                    sb.append('*');
                }
                int end = Tokenizer.scanIdentifier(text, i);
                lastIdentifier = text.substring(i, end);
                sb.append(lastIdentifier);
                i = end;
                previous = Previous.IDENTIFIER;
            } else if (tables.opening(c) != null) {
                boolean call = previous == Previous.IDENTIFIER && tables.isFunction(lastIdentifier)
                        && tables.opening(c).kind() == Bracket.Kind.GROUP;
                if (endsOperand(previous) && !call) {
                    sb.append('*');
                }
                sb.append(c);
                i++;
                previous = Previous.OTHER;
            } else if (tables.closing(c) != null) {
                sb.append(c);
                i++;
                previous = Previous.CLOSE;
            } else {
                String symbol = tables.matchOperator(text, i);
                int length = symbol == null ? 1 : symbol.length();
                sb.append(text, i, i + length);
                i += length;
                boolean postfixOnly = symbol != null && tables.postfix(symbol) != null
                        && tables.infix(symbol) == null && tables.prefix(symbol) == null;
                previous = postfixOnly && endsOperand(previous) ? Previous.CLOSE : Previous.OTHER;
            }
        }
        return sb.toString();
    }

    private static boolean endsOperand(Previous previous) {
        return previous == Previous.NUMBER || previous == Previous.IDENTIFIER || previous == Previous.CLOSE;
    }
}

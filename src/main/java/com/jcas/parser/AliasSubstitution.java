package com.jcas.parser;

/**
 * Replaces aliased identifiers by their targets, e.g. {@code ln(x)} becomes {@code log(x)}.
 * Numeric literals are skipped whole so the exponent marker of {@code 1e5} is never touched.
 */
public final class AliasSubstitution implements Preprocessor {

    @Override
    public String apply(String text, ParserTables tables) {
        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            if (Tokenizer.isNumberStart(text, i)) {
                int end = Tokenizer.scanNumber(text, i);
                sb.append(text, i, end);
                i = end;
            } else if (Tokenizer.isIdentifierStart(text.charAt(i))) {
                int end = Tokenizer.scanIdentifier(text, i);
                sb.append(tables.resolveAlias(text.substring(i, end)));
                i = end;
            } else {
                sb.append(text.charAt(i++));
            }
        }
        return sb.toString();
    }
}

package com.jcas.parser;

/**
 * A function table entry. {@code maxArity} of -1 accepts any number of arguments.
 */
public record FunctionDefinition(String name, int minArity, int maxArity, FunctionBody body) {

    public boolean accepts(int count) {
        return count >= minArity && (maxArity < 0 || count <= maxArity);
    }

    public String arityDescription() {
        if (maxArity < 0) {
            return "at least " + minArity;
        }
        return minArity == maxArity ? String.valueOf(minArity) : minArity + " to " + maxArity;
    }
}

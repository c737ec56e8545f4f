package com.jcas.parser;

/**
 * A registered bracket pair. Grouping brackets only affect precedence; list brackets build a
 * vector of their comma-separated elements.
 */
public record Bracket(char open, char close, Kind kind) {
    public enum Kind {
        GROUP,
        LIST
    }

    public static final Bracket PARENTHESES = new Bracket('(', ')', Kind.GROUP);
    public static final Bracket SQUARE = new Bracket('[', ']', Kind.LIST);
}

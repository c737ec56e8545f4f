package com.jcas.parser;

import org.eclipse.collections.api.list.MutableList;

/**
 * A lexical token. GROUP tokens carry the tokens between a bracket pair.
 */
public record Token(Type type, String text, int position, Bracket bracket, MutableList<Token> children) {

    public enum Type {
        NUMBER,
        IDENTIFIER,
        OPERATOR,
        COMMA,
        GROUP
    }

    public static Token number(String text, int position) {
        return new Token(Type.NUMBER, text, position, null, null);
    }

    public static Token identifier(String text, int position) {
        return new Token(Type.IDENTIFIER, text, position, null, null);
    }

    public static Token operator(String symbol, int position) {
        return new Token(Type.OPERATOR, symbol, position, null, null);
    }

    public static Token comma(int position) {
        return new Token(Type.COMMA, ",", position, null, null);
    }

    public static Token group(Bracket bracket, MutableList<Token> children, int position) {
        return new Token(Type.GROUP, String.valueOf(bracket.open()), position, bracket, children);
    }

    public boolean isGroup(Bracket.Kind kind) {
        return type == Type.GROUP && bracket.kind() == kind;
    }
}

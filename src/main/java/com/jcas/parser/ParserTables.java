package com.jcas.parser;

import com.jcas.error.OperatorException;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MapIterable;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Mutable parser state of one session: operators, brackets, preprocessors and aliases. The
 * function table lives in {@link FunctionRegistry} and is consulted for implied multiplication
 * and call detection.
 */
public final class ParserTables {
    private final MutableMap<String, Operator> prefix = Maps.mutable.empty();
    private final MutableMap<String, Operator> infix = Maps.mutable.empty();
    private final MutableMap<String, Operator> postfix = Maps.mutable.empty();
    private final MutableMap<Character, Bracket> openers = Maps.mutable.empty();
    private final MutableMap<Character, Bracket> closers = Maps.mutable.empty();
    private final MutableList<Preprocessor> preprocessors = Lists.mutable.empty();
    private final MutableMap<String, String> aliases = Maps.mutable.empty();
    private final FunctionRegistry functions;

    public ParserTables(FunctionRegistry functions) {
        this.functions = functions;
    }

    // ========== operators ==========

    public void registerOperator(Operator operator) {
        String symbol = operator.symbol();
        if (symbol.isEmpty()) {
            throw new OperatorException("Operator symbol must not be empty");
        }
        for (int i = 0; i < symbol.length(); i++) {
            char c = symbol.charAt(i);
            if (Character.isLetterOrDigit(c) || Character.isWhitespace(c) || c == '_' || c == ','
                    || c == '.' || openers.containsKey(c) || closers.containsKey(c)) {
                throw new OperatorException("Invalid operator symbol '" + symbol + "'");
            }
        }
        switch (operator.fixity()) {
            case PREFIX -> prefix.put(symbol, operator);
            case INFIX -> infix.put(symbol, operator);
            case POSTFIX -> postfix.put(symbol, operator);
            default -> throw new IllegalStateException("Unknown fixity: " + operator.fixity());
        }
    }

    public Operator prefix(String symbol) {
        return prefix.get(symbol);
    }

    public Operator infix(String symbol) {
        return infix.get(symbol);
    }

    public Operator postfix(String symbol) {
        return postfix.get(symbol);
    }

    /**
     * The longest registered operator symbol starting at {@code index}, or null.
     */
    public String matchOperator(String text, int index) {
        String best = null;
        for (MapIterable<String, Operator> table : Lists.immutable.of(prefix, infix, postfix)) {
            for (String symbol : table.keysView()) {
                if (text.startsWith(symbol, index) && (best == null || symbol.length() > best.length())) {
                    best = symbol;
                }
            }
        }
        return best;
    }

    // ========== brackets ==========

    public void registerBracket(Bracket bracket) {
        openers.put(bracket.open(), bracket);
        closers.put(bracket.close(), bracket);
    }

    public Bracket opening(char c) {
        return openers.get(c);
    }

    public Bracket closing(char c) {
        return closers.get(c);
    }

    // ========== preprocessors and aliases ==========

    public void addPreprocessor(Preprocessor preprocessor) {
        preprocessors.add(preprocessor);
    }

    public boolean removePreprocessor(Preprocessor preprocessor) {
        return preprocessors.remove(preprocessor);
    }

    public ListIterable<Preprocessor> preprocessors() {
        return preprocessors.asUnmodifiable();
    }

    public void alias(String from, String to) {
        aliases.put(from, to);
    }

    public String resolveAlias(String name) {
        return aliases.getIfAbsentValue(name, name);
    }

    public boolean isFunction(String name) {
        return functions.contains(name);
    }
}

package com.jcas.parser;

import com.jcas.error.OutOfRangeException;
import com.jcas.error.UnexpectedTokenException;
import org.eclipse.collections.api.RichIterable;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Function table of one session. Registration replaces any earlier definition of the same
 * name.
 */
public final class FunctionRegistry {
    private final MutableMap<String, FunctionDefinition> definitions = Maps.mutable.empty();

    public void register(FunctionDefinition definition) {
        definitions.put(definition.name(), definition);
    }

    public void register(String name, int minArity, int maxArity, FunctionBody body) {
        register(new FunctionDefinition(name, minArity, maxArity, body));
    }

    public boolean remove(String name) {
        return definitions.remove(name) != null;
    }

    public boolean contains(String name) {
        return definitions.containsKey(name);
    }

    /**
     * The definition of {@code name}, or null.
     */
    public FunctionDefinition find(String name) {
        return definitions.get(name);
    }

    /**
     * The definition of {@code name}, checked against the number of arguments supplied.
     */
    public FunctionDefinition lookup(String name, int argumentCount) {
        FunctionDefinition definition = definitions.get(name);
        if (definition == null) {
            throw new UnexpectedTokenException("unknown function '" + name + "'", name, -1);
        }
        if (!definition.accepts(argumentCount)) {
            throw new OutOfRangeException("function '" + name + "' expects " + definition.arityDescription()
                    + " argument(s) but got " + argumentCount);
        }
        return definition;
    }

    public RichIterable<String> names() {
        return definitions.keysView().toSortedList();
    }
}

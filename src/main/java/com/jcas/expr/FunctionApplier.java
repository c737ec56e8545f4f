package com.jcas.expr;

import org.eclipse.collections.api.list.MutableList;

/**
 * Rebuilds a call from evaluated arguments, applying whatever simplifications the function
 * table knows.
 */
@FunctionalInterface
public interface FunctionApplier {
    ExprNode apply(String name, MutableList<ExprNode> args);
}

package com.jcas.parser;

import com.jcas.expr.ExprNode;
import org.eclipse.collections.api.list.ListIterable;

/**
 * Observes an operation before it runs. Receives copies of the operands, so it cannot affect
 * the result.
 */
@FunctionalInterface
public interface Peeker {
    void peek(String operation, ListIterable<ExprNode> operands);
}

package com.jcas.parser;

import com.jcas.expr.ExprNode;
import com.jcas.session.Session;
import org.eclipse.collections.api.list.MutableList;

/**
 * An operator table entry. {@code name} is the operation name peekers subscribe to.
 */
public record Operator(String symbol, String name, int precedence, Associativity associativity, Fixity fixity,
                       Action action) {

    public enum Associativity {
        LEFT,
        RIGHT
    }

    public enum Fixity {
        PREFIX,
        INFIX,
        POSTFIX
    }

    @FunctionalInterface
    public interface Action {
        ExprNode apply(Session session, MutableList<ExprNode> operands);
    }

    public int arity() {
        return fixity == Fixity.INFIX ? 2 : 1;
    }
}

package com.jcas.parser;

import com.jcas.expr.ExprNode;
import com.jcas.session.Session;
import org.eclipse.collections.api.list.MutableList;

@FunctionalInterface
public interface FunctionBody {
    ExprNode apply(Session session, MutableList<ExprNode> args);
}

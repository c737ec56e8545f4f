package com.jcas.transform;

import com.jcas.expr.ExprNode;
import com.jcas.math.Rational;
import com.jcas.session.DeadlineGuard;
import com.jcas.session.Session;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Shorthand over the session's arithmetic for building result trees.
 */
abstract class TransformSupport {
    protected final Session session;

    protected TransformSupport(Session session) {
        this.session = session;
    }

    protected DeadlineGuard deadline() {
        return session.deadline();
    }

    protected ExprNode add(ExprNode a, ExprNode b) {
        return session.arithmetic().add(owned(a), owned(b));
    }

    protected ExprNode sub(ExprNode a, ExprNode b) {
        return session.arithmetic().subtract(owned(a), owned(b));
    }

    protected ExprNode mul(ExprNode a, ExprNode b) {
        return session.arithmetic().multiply(owned(a), owned(b));
    }

    protected ExprNode div(ExprNode a, ExprNode b) {
        return session.arithmetic().divide(owned(a), owned(b));
    }

    protected ExprNode pow(ExprNode a, ExprNode b) {
        return session.arithmetic().pow(owned(a), owned(b));
    }

    protected ExprNode pow(ExprNode a, Rational b) {
        return session.arithmetic().pow(owned(a), ExprNode.constant(b));
    }

    protected ExprNode neg(ExprNode a) {
        return session.arithmetic().negate(owned(a));
    }

    protected ExprNode inv(ExprNode a) {
        return session.arithmetic().invert(owned(a));
    }

    /**
     * Fast mode lets arithmetic consume its operands; transforms keep reading their inputs, so
     * they hand over copies.
     */
    private ExprNode owned(ExprNode node) {
        return session.settings().isImmutable() ? node : node.copy();
    }

    protected static ExprNode num(long value) {
        return ExprNode.constant(value);
    }

    protected static ExprNode num(Rational value) {
        return ExprNode.constant(value);
    }

    protected static ExprNode var(String name) {
        return ExprNode.variable(name);
    }

    /**
     * A call through the function table, so exact special values apply.
     */
    protected ExprNode call(String name, ExprNode... args) {
        return session.call(name, Lists.mutable.with(args).collect(ExprNode::copy));
    }

    protected ExprNode substitute(ExprNode node, String variable, ExprNode value) {
        return session.substitute(node, variable, value);
    }

    /**
     * Sum of the given terms.
     */
    protected ExprNode sum(ExprNode... terms) {
        ExprNode result = ExprNode.zero();
        for (ExprNode term : terms) {
            result = add(result, term);
        }
        return result;
    }

    /**
     * Product of the given factors.
     */
    protected ExprNode product(ExprNode... factors) {
        ExprNode result = ExprNode.one();
        for (ExprNode factor : factors) {
            result = mul(result, factor);
        }
        return result;
    }
}

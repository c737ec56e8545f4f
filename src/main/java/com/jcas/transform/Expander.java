package com.jcas.transform;

import com.jcas.expr.ExprNode;
import com.jcas.math.Rational;
import com.jcas.session.Session;
import org.eclipse.collections.api.list.MutableList;

/**
 * Distributes products over sums and multiplies out positive integer powers of sums.
 * Denominators are expanded in place but never distributed over.
 */
public final class Expander extends TransformSupport {

    public Expander(Session session) {
        super(session);
    }

    public ExprNode expand(ExprNode node) {
        deadline().check();
        return switch (node.shape()) {
            case CONSTANT, MONOMIAL -> node.copy();
            case FUNCTION -> {
                MutableList<ExprNode> args = node.args().toList().collect(this::expand);
                ExprNode call = session.applyFunction(node.value(), args);
                ExprNode raised = pow(call, ExprNode.constant(node.power()));
                yield mul(ExprNode.constant(node.multiplier()), raised);
            }
            case SUM, POLYNOMIAL_LIST -> expandSum(node);
            case PRODUCT -> {
                ExprNode result = ExprNode.constant(node.multiplier());
                for (ExprNode factor : node.factors()) {
                    result = distribute(result, expand(factor));
                }
                yield result;
            }
            case EXPONENTIAL -> {
                ExprNode raised = pow(expand(node.base()), expand(node.exponent()));
                yield mul(ExprNode.constant(node.multiplier()), raised);
            }
            default -> throw new IllegalStateException("Unknown shape: " + node.shape());
        };
    }

    private ExprNode expandSum(ExprNode node) {
        ExprNode base = ExprNode.zero();
        for (ExprNode term : node.withMultiplier(Rational.ONE).withPower(Rational.ONE).terms()) {
            base = add(base, expand(term));
        }
        Rational power = node.power();
        ExprNode result;
        if (power.isInteger() && power.signum() > 0) {
            result = ExprNode.one();
            for (int i = 0; i < power.intValueExact(); i++) {
                result = distribute(result, base);
            }
        } else if (power.isInteger() && power.signum() < 0) {
            ExprNode positive = ExprNode.one();
            for (int i = 0; i < -power.intValueExact(); i++) {
                positive = distribute(positive, base);
            }
            result = inv(positive);
        } else {
            result = pow(base, ExprNode.constant(power));
        }
        return distribute(ExprNode.constant(node.multiplier()), result);
    }

    /**
     * Multiplies two expanded nodes, distributing over any sum of power 1.
     */
    ExprNode distribute(ExprNode a, ExprNode b) {
        MutableList<ExprNode> left = a.terms();
        MutableList<ExprNode> right = b.terms();
        if (left.size() == 1 && right.size() == 1) {
            return mul(a, b);
        }
        ExprNode sum = ExprNode.zero();
        for (ExprNode x : left) {
            for (ExprNode y : right) {
                deadline().check();
                sum = add(sum, mul(x, y));
            }
        }
        return sum;
    }
}

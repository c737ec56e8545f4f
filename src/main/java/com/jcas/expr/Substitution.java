package com.jcas.expr;

import com.jcas.error.DivisionByZeroException;
import com.jcas.math.Rational;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MapIterable;
import org.eclipse.collections.impl.factory.Maps;

import java.math.BigInteger;

/**
 * Rebuilds a tree bottom-up through {@link Arithmetic}, optionally replacing variables on the
 * way. All replacements happen in one pass, so {@code {x: y, y: 1}} never chains.
 */
public final class Substitution {
    private final Arithmetic arithmetic;
    private final FunctionApplier functions;

    public Substitution(Arithmetic arithmetic, FunctionApplier functions) {
        this.arithmetic = arithmetic;
        this.functions = functions;
    }

    public ExprNode canonicalize(ExprNode node) {
        return rebuild(node, Maps.immutable.empty());
    }

    public ExprNode substitute(ExprNode node, String variable, ExprNode value) {
        return rebuild(node, Maps.immutable.of(variable, value));
    }

    public ExprNode substituteAll(ExprNode node, MapIterable<String, ExprNode> values) {
        return rebuild(node, values);
    }

    private ExprNode rebuild(ExprNode node, MapIterable<String, ExprNode> values) {
        ExprNode multiplier = ExprNode.constant(node.multiplier());
        ExprNode power = ExprNode.constant(node.power());
        return switch (node.shape()) {
            case CONSTANT -> node.copy();
            case MONOMIAL -> {
                ExprNode base;
                if (node.isNumericBase()) {
                    base = ExprNode.constant(Rational.valueOf(new BigInteger(node.value())));
                } else {
                    ExprNode replacement = values.get(node.value());
                    base = replacement == null ? ExprNode.variable(node.value()) : replacement.copy();
                }
                yield arithmetic.multiply(multiplier, raise(base, power));
            }
            case FUNCTION -> {
                MutableList<ExprNode> args = node.args().toList().collect(a -> rebuild(a, values));
                ExprNode call = functions.apply(node.value(), args);
                yield arithmetic.multiply(multiplier, raise(call, power));
            }
            case SUM, POLYNOMIAL_LIST -> {
                ExprNode sum = ExprNode.zero();
                for (ExprNode term : NodeOrder.sortedChildren(node)) {
                    sum = arithmetic.add(sum, rebuild(term, values));
                }
                yield arithmetic.multiply(multiplier, raise(sum, power));
            }
            case PRODUCT -> {
                ExprNode product = multiplier;
                for (ExprNode factor : NodeOrder.sortedChildren(node)) {
                    product = arithmetic.multiply(product, rebuild(factor, values));
                }
                yield product;
            }
            case EXPONENTIAL -> {
                ExprNode result = arithmetic.pow(rebuild(node.base(), values), rebuild(node.exponent(), values));
                yield arithmetic.multiply(multiplier, result);
            }
            default -> throw new IllegalStateException("Unknown shape: " + node.shape());
        };
    }

    /**
     * A zero substituted under a negative power is a division by zero.
     */
    private ExprNode raise(ExprNode base, ExprNode power) {
        if (base.isZero() && power.multiplier().isNegative()) {
            throw new DivisionByZeroException("division by zero");
        }
        return arithmetic.pow(base, power);
    }
}

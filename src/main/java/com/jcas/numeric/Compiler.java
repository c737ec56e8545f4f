package com.jcas.numeric;

import com.jcas.error.DimensionException;
import com.jcas.error.DivisionByZeroException;
import com.jcas.error.OperatorException;
import com.jcas.error.UndefinedException;
import com.jcas.expr.ExprNode;
import com.jcas.expr.NodeOrder;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.impl.factory.Lists;

import java.util.function.DoubleUnaryOperator;

/**
 * Turns an expression tree into a closure over doubles. {@code pi} and {@code e} compile to
 * their values unless they are listed as variables.
 */
public final class Compiler {

    private interface Evaluable {
        double eval(double[] x);
    }

    private Compiler() {
    }

    public static CompiledFunction compile(ExprNode node, String... variables) {
        return compile(node, Lists.immutable.with(variables));
    }

    public static CompiledFunction compile(ExprNode node, ListIterable<String> variables) {
        ImmutableList<String> names = Lists.immutable.withAll(variables);
        Evaluable body = build(node, names);
        int arity = names.size();
        return values -> {
            if (values.length != arity) {
                throw new DimensionException("expected " + arity + " argument(s) but got " + values.length);
            }
            return body.eval(values);
        };
    }

    private static Evaluable build(ExprNode node, ImmutableList<String> names) {
        double m = node.multiplier().doubleValue();
        double p = node.power().doubleValue();
        switch (node.shape()) {
            case CONSTANT -> {
                return x -> m;
            }
            case MONOMIAL -> {
                Evaluable leaf = leaf(node.value(), names);
                return x -> m * power(leaf.eval(x), p);
            }
            case FUNCTION -> {
                DoubleUnaryOperator function = NumericFunctions.lookup(node.value());
                if (function == null || node.args().size() != 1) {
                    throw new OperatorException("cannot compile function '" + node.value() + "'");
                }
                Evaluable arg = build(node.arg(0), names);
                return x -> m * power(function.applyAsDouble(arg.eval(x)), p);
            }
            case SUM, POLYNOMIAL_LIST -> {
                Evaluable[] terms = NodeOrder.sortedChildren(node).collect(t -> build(t, names)).toArray(new Evaluable[0]);
                return x -> {
                    double sum = 0;
                    for (Evaluable term : terms) {
                        sum += term.eval(x);
                    }
                    return m * power(sum, p);
                };
            }
            case PRODUCT -> {
                Evaluable[] factors = NodeOrder.sortedChildren(node).collect(f -> build(f, names)).toArray(new Evaluable[0]);
                return x -> {
                    double product = m;
                    for (Evaluable factor : factors) {
                        product *= factor.eval(x);
                    }
                    return product;
                };
            }
            case EXPONENTIAL -> {
                Evaluable base = build(node.base(), names);
                Evaluable exponent = build(node.exponent(), names);
                return x -> m * power(base.eval(x), exponent.eval(x));
            }
            default -> throw new IllegalStateException("Unknown shape: " + node.shape());
        }
    }

    private static Evaluable leaf(String name, ImmutableList<String> names) {
        int index = names.indexOf(name);
        if (index >= 0) {
            return x -> x[index];
        }
        if (isInteger(name)) {
            double value = Double.parseDouble(name);
            return x -> value;
        }
        if (name.equals("pi")) {
            return x -> Math.PI;
        }
        if (name.equals("e")) {
            return x -> Math.E;
        }
        if (name.equals("Infinity")) {
            return x -> Double.POSITIVE_INFINITY;
        }
        throw new UndefinedException("free variable '" + name + "' is not among the arguments " + names);
    }

    private static double power(double base, double exponent) {
        if (exponent == 1) {
            return base;
        }
        if (base == 0 && exponent < 0) {
            throw new DivisionByZeroException("division by zero");
        }
        return Math.pow(base, exponent);
    }

    private static boolean isInteger(String name) {
        int start = name.startsWith("-") ? 1 : 0;
        return name.length() > start && name.chars().skip(start).allMatch(Character::isDigit);
    }
}

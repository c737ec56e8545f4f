package com.jcas.transform;

import com.jcas.expr.ExprNode;
import com.jcas.expr.Shape;
import com.jcas.math.Polynomial;
import com.jcas.math.Rational;
import com.jcas.session.Session;
import org.eclipse.collections.api.map.primitive.MutableIntObjectMap;
import org.eclipse.collections.impl.factory.primitive.IntObjectMaps;

/**
 * Structural views of an expression with respect to one variable: coefficient splits, linear
 * and polynomial coefficients, numerator/denominator.
 */
public final class Decomposition extends TransformSupport {
    private static final Rational MAX_DEGREE = Rational.valueOf(100_000);

    /**
     * {@code node = coefficient * rest}, with {@code coefficient} free of the variable.
     */
    public record Split(ExprNode coefficient, ExprNode rest) {}

    /**
     * {@code node = a * variable + b}.
     */
    public record Linear(ExprNode a, ExprNode b) {}

    public record Fraction(ExprNode numerator, ExprNode denominator) {}

    public Decomposition(Session session) {
        super(session);
    }

    /**
     * Pulls everything free of {@code variable} into the coefficient. Irrational constants such
     * as {@code pi} or {@code 2^(1/2)} are moved as symbols, never approximated.
     */
    public Split splitCoefficient(ExprNode node, String variable) {
        if (!node.contains(variable)) {
            return new Split(node.copy(), ExprNode.one());
        }
        ExprNode coefficient = ExprNode.constant(node.multiplier());
        if (node.shape() != Shape.PRODUCT) {
            return new Split(coefficient, node.withMultiplier(Rational.ONE));
        }
        ExprNode rest = ExprNode.one();
        for (ExprNode factor : node.factors()) {
            if (factor.contains(variable)) {
                rest = mul(rest, factor);
            } else {
                coefficient = mul(coefficient, factor);
            }
        }
        return new Split(coefficient, rest);
    }

    /**
     * The linear form of {@code node} in {@code variable}, or null when it is not linear.
     */
    public Linear linear(ExprNode node, String variable) {
        ExprNode a = ExprNode.zero();
        ExprNode b = ExprNode.zero();
        for (ExprNode term : node.terms()) {
            if (!term.contains(variable)) {
                b = add(b, term);
                continue;
            }
            Split split = splitCoefficient(term, variable);
            if (!split.rest().isVariable(variable)) {
                return null;
            }
            a = add(a, split.coefficient());
        }
        if (a.isZero()) {
            return null;
        }
        return new Linear(a, b);
    }

    /**
     * Coefficients by degree after expansion, or null when {@code node} is not a polynomial in
     * {@code variable}. Coefficients may be symbolic.
     */
    public MutableIntObjectMap<ExprNode> coefficients(ExprNode node, String variable) {
        MutableIntObjectMap<ExprNode> result = IntObjectMaps.mutable.empty();
        for (ExprNode term : session.expander().expand(node).terms()) {
            if (term.isZero()) {
                continue;
            }
            Split split = splitCoefficient(term, variable);
            ExprNode rest = split.rest();
            int degree;
            if (rest.isOne()) {
                degree = 0;
            } else if (rest.shape() == Shape.MONOMIAL && rest.value().equals(variable) && rest.multiplier().isOne()
                    && rest.power().isInteger() && rest.power().signum() > 0
                    && rest.power().compareTo(MAX_DEGREE) <= 0) {
                degree = rest.power().intValueExact();
            } else {
                return null;
            }
            ExprNode existing = result.get(degree);
            result.put(degree, existing == null ? split.coefficient() : add(existing, split.coefficient()));
        }
        return result;
    }

    /**
     * The polynomial with rational coefficients equal to {@code node}, or null.
     */
    public Polynomial toPolynomial(ExprNode node, String variable) {
        MutableIntObjectMap<ExprNode> coefficients = coefficients(node, variable);
        if (coefficients == null) {
            return null;
        }
        int degree = coefficients.isEmpty() ? 0 : coefficients.keySet().max();
        Rational[] values = new Rational[degree + 1];
        for (int i = 0; i <= degree; i++) {
            ExprNode c = coefficients.get(i);
            if (c == null) {
                values[i] = Rational.ZERO;
            } else if (c.isConstant()) {
                values[i] = c.multiplier();
            } else {
                return null;
            }
        }
        return Polynomial.of(values);
    }

    public ExprNode fromPolynomial(Polynomial polynomial, String variable) {
        ExprNode result = ExprNode.zero();
        for (int i = polynomial.degree(); i >= 0; i--) {
            Rational c = polynomial.coefficient(i);
            if (c.isZero()) {
                continue;
            }
            ExprNode term = pow(ExprNode.variable(variable), ExprNode.constant(i));
            result = add(result, mul(ExprNode.constant(c), term));
        }
        return result;
    }

    /**
     * Splits factors with negative powers, and the multiplier's denominator, into the
     * denominator. Exponentials always stay in the numerator.
     */
    public Fraction fraction(ExprNode node) {
        Rational m = node.multiplier();
        ExprNode numerator = ExprNode.constant(Rational.valueOf(m.numerator()));
        ExprNode denominator = ExprNode.constant(Rational.valueOf(m.denominator()));
        for (ExprNode factor : node.factors()) {
            if (factor.shape() != Shape.EXPONENTIAL && factor.power().isNegative()) {
                denominator = mul(denominator, inv(factor));
            } else {
                numerator = mul(numerator, factor);
            }
        }
        return new Fraction(numerator, denominator);
    }
}

package com.jcas.transform;

import com.jcas.expr.ExprNode;
import com.jcas.math.Polynomial;
import com.jcas.math.Rational;
import com.jcas.session.Session;
import org.eclipse.collections.api.list.MutableList;

/**
 * Factors univariate polynomials with rational coefficients into their content, rational
 * linear factors (repeated roots as powers) and an irreducible remainder. Rational functions
 * are factored in numerator and denominator separately; anything else is returned unchanged.
 */
public final class Factorizer extends TransformSupport {

    public Factorizer(Session session) {
        super(session);
    }

    public ExprNode factor(ExprNode node) {
        deadline().check();
        MutableList<String> variables = node.variables();
        if (variables.size() != 1) {
            return node.copy();
        }
        String variable = variables.getFirst();
        Decomposition.Fraction fraction = session.decomposition().fraction(node);
        ExprNode numerator = factorPolynomial(fraction.numerator(), variable);
        if (!fraction.denominator().contains(variable)) {
            return numerator == null ? node.copy() : div(numerator, fraction.denominator());
        }
        ExprNode denominator = factorPolynomial(fraction.denominator(), variable);
        if (numerator == null || denominator == null) {
            return node.copy();
        }
        return div(numerator, denominator);
    }

    private ExprNode factorPolynomial(ExprNode node, String variable) {
        Polynomial polynomial = session.decomposition().toPolynomial(node, variable);
        if (polynomial == null) {
            return null;
        }
        if (polynomial.degree() < 1) {
            return node.copy();
        }
        Rational content = polynomial.content();
        Polynomial rest = polynomial.multiply(content.invert());
        ExprNode result = num(content);
        for (Rational root : rest.rationalRoots()) {
            deadline().check();
            int multiplicity = rest.multiplicity(root);
            // integer form q*x - p of the root p/q
            Polynomial linear = Polynomial.of(Rational.valueOf(root.numerator().negate()), Rational.valueOf(root.denominator()));
            for (int i = 0; i < multiplicity; i++) {
                rest = rest.divide(linear)[0];
            }
            ExprNode factor = session.decomposition().fromPolynomial(linear, variable);
            result = mul(result, pow(factor, Rational.valueOf(multiplicity)));
        }
        Rational leftover = rest.content();
        result = mul(result, num(leftover));
        Polynomial primitive = rest.multiply(leftover.invert());
        if (primitive.degree() >= 1) {
            result = mul(result, session.decomposition().fromPolynomial(primitive, variable));
        }
        return result;
    }
}

package com.jcas.transform;

import com.jcas.expr.ExprNode;
import com.jcas.math.LinearSystem;
import com.jcas.math.Polynomial;
import com.jcas.math.Rational;
import com.jcas.session.Session;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partial fraction decomposition of rational functions with rational coefficients. The
 * denominator must split into rational linear factors and at most one irreducible quadratic.
 */
public final class PartialFractions extends TransformSupport {
    private static final Logger logger = LoggerFactory.getLogger(PartialFractions.class);

    /**
     * One factor of the denominator: a monic linear or quadratic polynomial with multiplicity.
     */
    private record Factor(Polynomial polynomial, int multiplicity) {}

    public PartialFractions(Session session) {
        super(session);
    }

    /**
     * The decomposition, or the input unchanged when it is not a rational function of
     * {@code variable} that can be split.
     */
    public ExprNode apply(ExprNode node, String variable) {
        ExprNode result = decompose(node, variable);
        return result == null ? node.copy() : result;
    }

    /**
     * The decomposition, or null when none applies.
     */
    ExprNode decompose(ExprNode node, String variable) {
        deadline().check();
        Decomposition decomposition = session.decomposition();
        Decomposition.Fraction fraction = decomposition.fraction(node);
        if (!fraction.denominator().contains(variable)) {
            return null;
        }
        Polynomial numerator = decomposition.toPolynomial(fraction.numerator(), variable);
        Polynomial denominator = decomposition.toPolynomial(fraction.denominator(), variable);
        if (numerator == null || denominator == null || denominator.degree() < 1) {
            return null;
        }

        Polynomial[] qr = numerator.divide(denominator);
        Polynomial quotient = qr[0];
        Polynomial remainder = qr[1];
        Rational lead = denominator.leading();
        Polynomial monic = denominator.monic();

        MutableList<Factor> factors = factorize(monic);
        if (factors == null) {
            logger.debug("Denominator {} does not split over the rationals", denominator);
            return null;
        }

        // one unknown per power of each linear factor, two for the quadratic
        MutableList<Polynomial> basis = Lists.mutable.empty();
        for (Factor factor : factors) {
            for (int k = 1; k <= factor.multiplicity(); k++) {
                Polynomial cofactor = monic.divide(factor.polynomial().pow(k))[0];
                if (factor.polynomial().degree() == 2) {
                    basis.add(cofactor.multiply(Polynomial.monomial(Rational.ONE, 1)));
                }
                basis.add(cofactor);
            }
        }
        int n = monic.degree();
        if (basis.size() != n) {
            return null;
        }
        Rational[][] matrix = new Rational[n][n];
        Rational[] rhs = new Rational[n];
        Polynomial target = remainder.multiply(lead.invert());
        for (int row = 0; row < n; row++) {
            for (int col = 0; col < n; col++) {
                matrix[row][col] = basis.get(col).coefficient(row);
            }
            rhs[row] = target.coefficient(row);
        }
        Rational[] unknowns = LinearSystem.solve(matrix, rhs);
        if (unknowns == null) {
            return null;
        }

        ExprNode result = decomposition.fromPolynomial(quotient, variable);
        int index = 0;
        for (Factor factor : factors) {
            ExprNode base = decomposition.fromPolynomial(factor.polynomial(), variable);
            for (int k = 1; k <= factor.multiplicity(); k++) {
                ExprNode denominatorTerm = pow(base, Rational.valueOf(-k));
                if (factor.polynomial().degree() == 2) {
                    result = add(result, quadraticTerm(factor.polynomial(), unknowns[index], unknowns[index + 1],
                            denominatorTerm, variable));
                    index += 2;
                } else {
                    result = add(result, mul(num(unknowns[index]), denominatorTerm));
                    index++;
                }
            }
        }
        return result;
    }

    /**
     * {@code (b*x + c)/(x^2 + p*x + q)} split so that one numerator is the derivative of the
     * denominator: {@code (b/2)*(2*x + p)/Q + (c - b*p/2)/Q}.
     */
    private ExprNode quadraticTerm(Polynomial quadratic, Rational b, Rational c, ExprNode inverse, String variable) {
        Rational p = quadratic.coefficient(1);
        ExprNode derivative = session.decomposition().fromPolynomial(quadratic.derivative(), variable);
        ExprNode first = mul(num(b.multiply(Rational.HALF)), mul(derivative, inverse));
        ExprNode second = mul(num(c.subtract(b.multiply(p).multiply(Rational.HALF))), inverse);
        return add(first, second);
    }

    /**
     * Monic irreducible factors with multiplicity, or null when something of degree above two
     * remains or more than one quadratic is left.
     */
    private MutableList<Factor> factorize(Polynomial monic) {
        MutableList<Factor> factors = Lists.mutable.empty();
        Polynomial rest = monic;
        for (Rational root : monic.rationalRoots()) {
            int multiplicity = rest.multiplicity(root);
            rest = rest.divide(Polynomial.linear(root).pow(multiplicity))[0];
            factors.add(new Factor(Polynomial.linear(root), multiplicity));
        }
        if (rest.degree() == 2) {
            factors.add(new Factor(rest.monic(), 1));
        } else if (rest.degree() > 2) {
            return null;
        }
        return factors;
    }
}

package com.jcas.transform;

import com.jcas.expr.ExprNode;
import com.jcas.expr.Shape;
import com.jcas.math.Polynomial;
import com.jcas.math.Rational;
import com.jcas.session.Session;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites an expression until its canonical text stops changing: folds
 * {@code r*sin(u)^2 + r*cos(u)^2} into {@code r}, cancels the polynomial gcd of univariate
 * rational functions and keeps an expansion whenever it is shorter.
 */
public final class Simplifier extends TransformSupport {
    private static final Logger logger = LoggerFactory.getLogger(Simplifier.class);

    /**
     * A term {@code rest * name(argument)^2}.
     */
    private record Square(String name, ExprNode argument, ExprNode rest) {
        String key(String function) {
            return function + ":" + argument + ":" + rest;
        }

        String partner() {
            return name.equals("sin") ? "cos" : "sin";
        }
    }

    public Simplifier(Session session) {
        super(session);
    }

    public ExprNode simplify(ExprNode node) {
        ExprNode current = node.copy();
        int limit = session.settings().maxSimplifyIterations();
        for (int i = 0; i < limit; i++) {
            deadline().check();
            ExprNode next = step(current);
            if (next.equals(current)) {
                return next;
            }
            logger.debug("Simplified {} to {}", current, next);
            current = next;
        }
        return current;
    }

    private ExprNode step(ExprNode node) {
        ExprNode inner = pythagorean(simplifyArguments(node));
        ExprNode cancelled = cancel(inner);
        if (cancelled != null) {
            return cancelled;
        }
        ExprNode expanded = session.expander().expand(inner);
        return expanded.toString().length() < inner.toString().length() ? expanded : inner;
    }

    private ExprNode simplifyArguments(ExprNode node) {
        if (node.shape() != Shape.FUNCTION) {
            return node;
        }
        MutableList<ExprNode> args = node.args().toList().collect(this::step);
        ExprNode call = session.applyFunction(node.value(), args);
        return mul(num(node.multiplier()), pow(call, node.power()));
    }

    /**
     * Replaces each pair {@code r*sin(u)^2}, {@code r*cos(u)^2} in a sum by {@code r}.
     */
    private ExprNode pythagorean(ExprNode node) {
        if ((node.shape() != Shape.SUM && node.shape() != Shape.POLYNOMIAL_LIST) || !node.power().isOne()) {
            return node;
        }
        MutableList<ExprNode> terms = node.terms();
        MutableMap<String, Integer> unmatched = Maps.mutable.empty();
        boolean changed = false;
        for (int i = 0; i < terms.size(); i++) {
            Square square = square(terms.get(i));
            if (square == null) {
                continue;
            }
            Integer partner = unmatched.remove(square.key(square.partner()));
            if (partner == null) {
                unmatched.put(square.key(square.name()), i);
                continue;
            }
            terms.set(partner, square.rest());
            terms.set(i, ExprNode.zero());
            changed = true;
        }
        if (!changed) {
            return node;
        }
        ExprNode result = ExprNode.zero();
        for (ExprNode term : terms) {
            result = add(result, term);
        }
        return result;
    }

    private Square square(ExprNode term) {
        for (ExprNode factor : term.factors()) {
            boolean trig = factor.isFunction("sin") || factor.isFunction("cos");
            if (trig && factor.args().size() == 1 && factor.power().equals(Rational.TWO)
                    && factor.multiplier().isOne()) {
                return new Square(factor.value(), factor.arg(0), div(term, factor));
            }
        }
        return null;
    }

    /**
     * The rational function with the gcd of numerator and denominator divided out, or null when
     * {@code node} is not a univariate rational function with a common factor.
     */
    private ExprNode cancel(ExprNode node) {
        MutableList<String> variables = node.variables();
        if (variables.size() != 1) {
            return null;
        }
        String x = variables.getFirst();
        Decomposition decomposition = session.decomposition();
        Decomposition.Fraction fraction = decomposition.fraction(node);
        if (!fraction.denominator().contains(x)) {
            return null;
        }
        Polynomial numerator = decomposition.toPolynomial(fraction.numerator(), x);
        Polynomial denominator = decomposition.toPolynomial(fraction.denominator(), x);
        if (numerator == null || denominator == null || numerator.isZero()) {
            return null;
        }
        Polynomial gcd = numerator.gcd(denominator);
        if (gcd.degree() < 1) {
            return null;
        }
        Polynomial reducedNumerator = numerator.divide(gcd)[0];
        Polynomial reducedDenominator = denominator.divide(gcd)[0];
        return div(decomposition.fromPolynomial(reducedNumerator, x),
                decomposition.fromPolynomial(reducedDenominator, x));
    }
}

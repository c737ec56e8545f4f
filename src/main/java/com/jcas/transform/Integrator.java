package com.jcas.transform;

import com.jcas.error.DivisionByZeroException;
import com.jcas.error.MaximumIterationsException;
import com.jcas.error.OperatorException;
import com.jcas.error.OutOfFunctionDomainException;
import com.jcas.error.UndefinedException;
import com.jcas.expr.ExprNode;
import com.jcas.expr.Shape;
import com.jcas.math.Polynomial;
import com.jcas.math.Rational;
import com.jcas.numeric.CompiledFunction;
import com.jcas.numeric.Compiler;
import com.jcas.numeric.NumericMethods;
import com.jcas.session.Session;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.map.primitive.MutableIntObjectMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.function.UnaryOperator;

/**
 * Symbolic antiderivatives. Rules are tried from the cheapest to the most speculative:
 * linearity, the power rule, a table of functions of linear arguments, exponentials, powers of
 * linear and quadratic bases, partial fractions, u-substitution by derivative matching,
 * expansion and finally integration by parts. When nothing applies within
 * {@code integrationDepth} levels of recursion the result is an inert {@code integrate(f, x)}.
 */
public final class Integrator extends TransformSupport {
    private static final Logger logger = LoggerFactory.getLogger(Integrator.class);
    private static final String SUBSTITUTION_PREFIX = "__u";
    private static final double QUADRATURE_TOLERANCE = 1e-10;
    private static final MathContext QUADRATURE_DIGITS = new MathContext(12);
    private static final int POLE_SCAN_STEPS = 64;
    private static final double POLE_TOLERANCE = 1e-9;

    /**
     * Raised inside the cascade when a rule set is exhausted; never escapes this class.
     */
    private static final class NoIntegralFoundException extends RuntimeException {
        NoIntegralFoundException(String message) {
            super(message, null, false, false);
        }
    }

    /**
     * Antiderivatives F(u) of f(u) for functions of a linear argument, keyed by name, or by
     * {@code name^2} for squares.
     */
    private final MutableMap<String, UnaryOperator<ExprNode>> table = Maps.mutable.empty();

    public Integrator(Session session) {
        super(session);
        table.put("sin", u -> neg(call("cos", u)));
        table.put("cos", u -> call("sin", u));
        table.put("tan", u -> neg(call("log", call("cos", u))));
        table.put("sec", u -> call("log", add(call("sec", u), call("tan", u))));
        table.put("csc", u -> neg(call("log", add(call("csc", u), call("cot", u)))));
        table.put("cot", u -> call("log", call("sin", u)));
        table.put("sinh", u -> call("cosh", u));
        table.put("cosh", u -> call("sinh", u));
        table.put("tanh", u -> call("log", call("cosh", u)));
        table.put("log", u -> sub(mul(u, call("log", u)), u));
        table.put("asin", u -> add(mul(u, call("asin", u)), pow(sub(num(1), pow(u, Rational.TWO)), Rational.HALF)));
        table.put("acos", u -> sub(mul(u, call("acos", u)), pow(sub(num(1), pow(u, Rational.TWO)), Rational.HALF)));
        table.put("atan", u -> sub(mul(u, call("atan", u)),
                mul(num(Rational.HALF), call("log", add(num(1), pow(u, Rational.TWO))))));
        table.put("sin^2", u -> sub(mul(num(Rational.HALF), u), mul(num(Rational.valueOf(1, 4)), call("sin", mul(num(2), u)))));
        table.put("cos^2", u -> add(mul(num(Rational.HALF), u), mul(num(Rational.valueOf(1, 4)), call("sin", mul(num(2), u)))));
        table.put("sec^2", u -> call("tan", u));
        table.put("csc^2", u -> neg(call("cot", u)));
        table.put("tan^2", u -> sub(call("tan", u), u));
        table.put("sech^2", u -> call("tanh", u));
    }

    /**
     * An antiderivative of {@code f}, or an inert {@code integrate(f, x)}.
     */
    public ExprNode integrate(ExprNode f, String x) {
        ExprNode result = antiderivative(f, x);
        return result == null ? ExprNode.function("integrate", f, var(x)) : result;
    }

    /**
     * An antiderivative of {@code f}, or null when none was found.
     */
    ExprNode antiderivative(ExprNode f, String x) {
        try {
            return integrate(f, x, 0);
        } catch (NoIntegralFoundException e) {
            logger.debug("No antiderivative of {} in {}: {}", f, x, e.getMessage());
            return null;
        }
    }

    /**
     * {@code F(b) - F(a)} when an antiderivative exists, taking a one-sided limit at a bound
     * where {@code F} cannot be evaluated directly; otherwise adaptive Simpson quadrature. An
     * integrand with a pole strictly inside numeric bounds, or one where both fail, gives an
     * inert {@code defint}.
     */
    public ExprNode definiteIntegral(ExprNode f, ExprNode from, ExprNode to, String x) {
        if (hasInteriorPole(f, from, to, x)) {
            logger.debug("{} has a pole between {} and {}", f, from, to);
            return ExprNode.function("defint", f, from, to, var(x));
        }
        ExprNode antiderivative = antiderivative(f, x);
        if (antiderivative != null) {
            ExprNode upper = valueAt(antiderivative, x, to);
            ExprNode lower = valueAt(antiderivative, x, from);
            if (upper != null && lower != null) {
                return sub(upper, lower);
            }
            logger.debug("Antiderivative {} is singular on the interval", antiderivative);
        }
        try {
            CompiledFunction integrand = Compiler.compile(f, x);
            double a = Compiler.compile(from).apply();
            double b = Compiler.compile(to).apply();
            double value = NumericMethods.simpson(t -> integrand.apply(t), a, b, QUADRATURE_TOLERANCE,
                    session.settings().maxQuadratureDepth(), deadline());
            return num(Rational.valueOf(BigDecimal.valueOf(value).round(QUADRATURE_DIGITS).stripTrailingZeros()));
        } catch (MaximumIterationsException | UndefinedException | OperatorException | DivisionByZeroException
                 | NumberFormatException e) {
            logger.debug("Quadrature of {} failed: {}", f, e.getMessage());
            return ExprNode.function("defint", f, from, to, var(x));
        }
    }

    private ExprNode valueAt(ExprNode antiderivative, String x, ExprNode bound) {
        if (Limit.infiniteDirection(bound) != 0) {
            return session.limits().finiteLimit(antiderivative, x, bound);
        }
        try {
            return substitute(antiderivative, x, bound);
        } catch (DivisionByZeroException | UndefinedException | OutOfFunctionDomainException e) {
            return session.limits().finiteLimit(antiderivative, x, bound);
        }
    }

    /**
     * True when the denominator of {@code f} vanishes strictly between numeric bounds at a point
     * the numerator does not cancel: an exact rational root, or a sign change of a polynomial
     * denominator located by bisection.
     */
    private boolean hasInteriorPole(ExprNode f, ExprNode from, ExprNode to, String x) {
        if (!from.isConstant() || !to.isConstant()) {
            return false;
        }
        Rational low = from.multiplier().min(to.multiplier());
        Rational high = from.multiplier().max(to.multiplier());
        Decomposition.Fraction fraction = session.decomposition().fraction(f);
        Polynomial denominator = session.decomposition().toPolynomial(fraction.denominator(), x);
        if (denominator == null || denominator.degree() < 1) {
            return false;
        }
        for (Rational root : denominator.rationalRoots()) {
            if (root.compareTo(low) > 0 && root.compareTo(high) < 0
                    && session.limits().finiteLimit(f, x, num(root)) == null) {
                return true;
            }
        }
        CompiledFunction numerator;
        try {
            numerator = Compiler.compile(fraction.numerator(), x);
        } catch (UndefinedException | OperatorException e) {
            return false;
        }
        double a = low.doubleValue();
        double step = (high.doubleValue() - a) / POLE_SCAN_STEPS;
        for (int i = 0; i < POLE_SCAN_STEPS; i++) {
            double left = a + i * step;
            double right = left + step;
            Rational leftValue = denominator.evaluate(Rational.fromDouble(left));
            Rational rightValue = denominator.evaluate(Rational.fromDouble(right));
            if (leftValue.signum() * rightValue.signum() >= 0) {
                continue;
            }
            double root = bisect(denominator, left, right);
            if (Math.abs(numerator.apply(root)) > POLE_TOLERANCE) {
                return true;
            }
        }
        return false;
    }

    private static double bisect(Polynomial p, double left, double right) {
        int leftSign = p.evaluate(Rational.fromDouble(left)).signum();
        for (int i = 0; i < 60; i++) {
            double middle = (left + right) / 2;
            int sign = p.evaluate(Rational.fromDouble(middle)).signum();
            if (sign == 0) {
                return middle;
            }
            if (sign == leftSign) {
                left = middle;
            } else {
                right = middle;
            }
        }
        return (left + right) / 2;
    }

    // ========== cascade ==========

    private ExprNode integrate(ExprNode f, String x, int depth) {
        deadline().check();
        if (depth > session.settings().integrationDepth()) {
            throw new NoIntegralFoundException("recursion depth exceeded");
        }
        if (!f.contains(x)) {
            return mul(f, var(x));
        }
        MutableList<ExprNode> terms = f.terms();
        if (terms.size() > 1) {
            ExprNode result = ExprNode.zero();
            for (ExprNode term : terms) {
                result = add(result, integrate(term, x, depth + 1));
            }
            return result;
        }
        Decomposition.Split split = session.decomposition().splitCoefficient(f, x);
        if (!split.coefficient().isOne()) {
            return mul(split.coefficient(), integrate(split.rest(), x, depth));
        }
        ExprNode g = split.rest();
        return switch (g.shape()) {
            case MONOMIAL -> powerRule(g, x);
            case FUNCTION -> integrateFunction(g, x, depth);
            case SUM, POLYNOMIAL_LIST -> integratePowerOfSum(g, x, depth);
            case EXPONENTIAL -> integrateExponential(g, x, depth);
            case PRODUCT -> integrateProduct(g, x, depth);
            default -> throw new NoIntegralFoundException("no rule for " + g);
        };
    }

    private ExprNode powerRule(ExprNode monomial, String x) {
        Rational p = monomial.power();
        if (p.equals(Rational.MINUS_ONE)) {
            return call("log", var(x));
        }
        Rational next = p.add(Rational.ONE);
        return mul(num(next.invert()), pow(var(x), next));
    }

    private ExprNode integrateFunction(ExprNode g, String x, int depth) {
        String key = g.power().isOne() ? g.value() : g.power().equals(Rational.TWO) ? g.value() + "^2" : null;
        UnaryOperator<ExprNode> rule = key == null ? null : table.get(key);
        if (rule != null && g.args().size() == 1) {
            Decomposition.Linear linear = session.decomposition().linear(g.arg(0), x);
            if (linear != null) {
                return div(rule.apply(g.arg(0).copy()), linear.a());
            }
        }
        try {
            return substitution(g, x, depth);
        } catch (NoIntegralFoundException e) {
            logger.debug("Substitution failed for {}, integrating by parts", g);
        }
        return byParts(g, x, depth);
    }

    private ExprNode integrateExponential(ExprNode g, String x, int depth) {
        ExprNode base = g.base();
        ExprNode exponent = g.exponent();
        if (!base.contains(x)) {
            Decomposition.Linear linear = session.decomposition().linear(exponent, x);
            if (linear != null) {
                return div(g, mul(linear.a(), call("log", base)));
            }
        } else if (base.isVariable(x) && !exponent.contains(x)) {
            ExprNode next = add(exponent, num(1));
            return div(pow(var(x), next), next);
        }
        return substitution(g, x, depth);
    }

    private ExprNode integratePowerOfSum(ExprNode g, String x, int depth) {
        Rational p = g.power();
        ExprNode base = g.withPower(Rational.ONE);
        Decomposition.Linear linear = session.decomposition().linear(base, x);
        if (linear != null) {
            if (p.equals(Rational.MINUS_ONE)) {
                return div(call("log", base), linear.a());
            }
            Rational next = p.add(Rational.ONE);
            return div(pow(base, next), mul(linear.a(), num(next)));
        }
        MutableIntObjectMap<ExprNode> coefficients = session.decomposition().coefficients(base, x);
        if (coefficients != null && coefficients.keySet().max() == 2 && coefficients.allSatisfy(ExprNode::isConstant)) {
            Rational a = constantAt(coefficients, 2);
            Rational b = constantAt(coefficients, 1);
            Rational c = constantAt(coefficients, 0);
            if (p.equals(Rational.MINUS_ONE)) {
                ExprNode result = inverseQuadratic(a, b, c, x);
                if (result != null) {
                    return result;
                }
            } else if (p.equals(Rational.valueOf(-1, 2))) {
                return inverseSqrtQuadratic(base, a, b, c, x);
            }
        }
        if (p.isInteger() && p.signum() > 0) {
            return integrateExpanded(g, x, depth);
        }
        if (p.isInteger()) {
            ExprNode decomposed = session.partialFractions().decompose(g, x);
            if (decomposed != null && !decomposed.equals(g)) {
                return integrate(decomposed, x, depth + 1);
            }
        }
        return substitution(g, x, depth);
    }

    /**
     * {@code 1/(a*x^2 + b*x + c)}: atan for a negative discriminant, the logarithmic form for a
     * positive one that is not a perfect square. Null when partial fractions apply instead.
     */
    private ExprNode inverseQuadratic(Rational a, Rational b, Rational c, String x) {
        Rational discriminant = b.multiply(b).subtract(Rational.valueOf(4).multiply(a).multiply(c));
        ExprNode inner = add(mul(num(a.multiply(Rational.TWO)), var(x)), num(b));
        if (discriminant.isNegative()) {
            ExprNode root = pow(num(discriminant.negate()), Rational.HALF);
            return mul(div(num(2), root), call("atan", div(inner, root)));
        }
        ExprNode root = pow(num(discriminant), Rational.HALF);
        if (root.isConstant()) {
            return null;
        }
        ExprNode ratio = div(sub(inner, root), add(inner, root));
        return div(call("log", ratio), root);
    }

    /**
     * {@code 1/sqrt(a*x^2 + b*x + c)}: asin for a negative leading coefficient, otherwise the
     * logarithmic form.
     */
    private ExprNode inverseSqrtQuadratic(ExprNode base, Rational a, Rational b, Rational c, String x) {
        ExprNode inner = add(mul(num(a.multiply(Rational.TWO)), var(x)), num(b));
        if (a.isNegative()) {
            Rational discriminant = b.multiply(b).subtract(Rational.valueOf(4).multiply(a).multiply(c));
            if (discriminant.signum() <= 0) {
                throw new NoIntegralFoundException("square root of a negative quadratic");
            }
            ExprNode scale = pow(num(a.negate()), Rational.valueOf(-1, 2));
            return neg(mul(scale, call("asin", div(inner, pow(num(discriminant), Rational.HALF)))));
        }
        ExprNode rootA = pow(num(a), Rational.HALF);
        ExprNode argument = add(mul(mul(num(2), rootA), pow(base, Rational.HALF)), inner);
        return div(call("log", argument), rootA);
    }

    private ExprNode integrateProduct(ExprNode g, String x, int depth) {
        Decomposition.Fraction fraction = session.decomposition().fraction(g);
        if (fraction.denominator().contains(x)) {
            ExprNode decomposed = session.partialFractions().decompose(g, x);
            if (decomposed != null && !decomposed.equals(g)) {
                return integrate(decomposed, x, depth + 1);
            }
        }
        try {
            return substitution(g, x, depth);
        } catch (NoIntegralFoundException e) {
            logger.debug("Substitution failed for {}, trying expansion and parts", g);
        }
        if (g.factors().anySatisfy(Integrator::isExpandableSum)) {
            try {
                return integrateExpanded(g, x, depth);
            } catch (NoIntegralFoundException e) {
                logger.debug("Expansion failed for {}", g);
            }
        }
        return byParts(g, x, depth);
    }

    private static boolean isExpandableSum(ExprNode factor) {
        return factor.shape().isComposite() && factor.power().isInteger() && factor.power().signum() > 0;
    }

    private ExprNode integrateExpanded(ExprNode g, String x, int depth) {
        ExprNode expanded = session.expander().expand(g);
        if (expanded.equals(g)) {
            throw new NoIntegralFoundException("expansion does not change " + g);
        }
        return integrate(expanded, x, depth + 1);
    }

    // ========== substitution ==========

    /**
     * Tries each inner expression {@code u(x)} of {@code g}: if {@code g / u'(x)} can be written
     * without {@code x} once {@code u(x)} is replaced by a fresh variable, integrates in that
     * variable and substitutes back.
     */
    private ExprNode substitution(ExprNode g, String x, int depth) {
        String u = SUBSTITUTION_PREFIX + depth;
        MutableList<ExprNode> candidates = Lists.mutable.empty();
        collectCandidates(g, x, candidates);
        for (ExprNode candidate : candidates.distinct()) {
            deadline().check();
            if (candidate.isVariable(x) || candidate.equals(g)) {
                continue;
            }
            ExprNode derivative = session.derivative().diff(candidate, x);
            if (derivative.isZero()) {
                continue;
            }
            ExprNode ratio = div(replace(g, candidate, var(u)), derivative);
            if (ratio.contains(x)) {
                continue;
            }
            try {
                return substitute(integrate(ratio, u, depth + 1), u, candidate);
            } catch (NoIntegralFoundException e) {
                logger.debug("Substitution {} = {} failed", u, candidate);
            }
        }
        throw new NoIntegralFoundException("no substitution for " + g);
    }

    private void collectCandidates(ExprNode node, String x, MutableList<ExprNode> candidates) {
        if (!node.contains(x)) {
            return;
        }
        switch (node.shape()) {
            case MONOMIAL -> {
                if (!node.power().isOne()) {
                    candidates.add(node.withMultiplier(Rational.ONE));
                }
            }
            case FUNCTION -> {
                candidates.add(node.withMultiplier(Rational.ONE).withPower(Rational.ONE));
                for (ExprNode arg : node.args()) {
                    candidates.add(arg.copy());
                    collectCandidates(arg, x, candidates);
                }
            }
            case SUM, POLYNOMIAL_LIST -> {
                ExprNode base = node.withMultiplier(Rational.ONE).withPower(Rational.ONE);
                if (!node.power().isOne()) {
                    candidates.add(base);
                }
                for (ExprNode term : base.terms()) {
                    collectCandidates(term, x, candidates);
                }
            }
            case PRODUCT -> {
                for (ExprNode factor : node.factors()) {
                    collectCandidates(factor, x, candidates);
                }
            }
            case EXPONENTIAL -> {
                candidates.add(node.exponent().copy());
                collectCandidates(node.exponent(), x, candidates);
                collectCandidates(node.base(), x, candidates);
            }
            default -> {
            }
        }
    }

    /**
     * Rebuilds {@code node} with every occurrence of {@code target}, including powers of it,
     * replaced by {@code u}.
     */
    private ExprNode replace(ExprNode node, ExprNode target, ExprNode u) {
        if (node.equals(target)) {
            return u.copy();
        }
        Rational m = node.multiplier();
        if (!node.isConstant() && node.withMultiplier(Rational.ONE).equals(target)) {
            return mul(num(m), u);
        }
        Rational p = node.power();
        return switch (node.shape()) {
            case CONSTANT -> node.copy();
            case MONOMIAL -> {
                if (node.withMultiplier(Rational.ONE).withPower(Rational.ONE).equals(target)) {
                    yield mul(num(m), pow(u, p));
                }
                yield node.copy();
            }
            case FUNCTION -> {
                ExprNode unit = node.withMultiplier(Rational.ONE).withPower(Rational.ONE);
                if (unit.equals(target)) {
                    yield mul(num(m), pow(u, p));
                }
                MutableList<ExprNode> args = node.args().toList().collect(a -> replace(a, target, u));
                yield mul(num(m), pow(session.applyFunction(node.value(), args), p));
            }
            case SUM, POLYNOMIAL_LIST -> {
                ExprNode unit = node.withMultiplier(Rational.ONE).withPower(Rational.ONE);
                if (unit.equals(target)) {
                    yield mul(num(m), pow(u, p));
                }
                ExprNode base = ExprNode.zero();
                for (ExprNode term : unit.terms()) {
                    base = add(base, replace(term, target, u));
                }
                yield mul(num(m), pow(base, p));
            }
            case PRODUCT -> {
                ExprNode result = num(m);
                for (ExprNode factor : node.factors()) {
                    result = mul(result, replace(factor, target, u));
                }
                yield result;
            }
            case EXPONENTIAL -> mul(num(m), pow(replace(node.base(), target, u), replace(node.exponent(), target, u)));
            default -> throw new IllegalStateException("Unknown shape: " + node.shape());
        };
    }

    // ========== integration by parts ==========

    /**
     * {@code integral(u dv) = u*v - integral(v du)} with u chosen by LIATE order: logarithms,
     * inverse trigonometric functions, algebraic factors. Trigonometric and exponential factors
     * are only ever integrated. A lone logarithm or inverse function is taken with
     * {@code dv = dx}.
     */
    private ExprNode byParts(ExprNode g, String x, int depth) {
        MutableList<ExprNode> factors = g.factors();
        ExprNode chosen = null;
        int best = Integer.MAX_VALUE;
        for (ExprNode factor : factors) {
            int rank = liateRank(factor, x);
            if (rank < best) {
                best = rank;
                chosen = factor;
            }
        }
        if (chosen == null) {
            throw new NoIntegralFoundException("no factor to differentiate in " + g);
        }
        ExprNode dv = div(g, chosen);
        ExprNode v = integrate(dv, x, depth + 1);
        ExprNode du = session.derivative().diff(chosen, x);
        return sub(mul(chosen, v), integrate(mul(v, du), x, depth + 1));
    }

    private static int liateRank(ExprNode factor, String x) {
        if (factor.shape() == Shape.FUNCTION && factor.power().isOne()) {
            return switch (factor.value()) {
                case "log", "log10" -> 0;
                case "asin", "acos", "atan" -> 1;
                default -> Integer.MAX_VALUE;
            };
        }
        if (factor.shape() == Shape.MONOMIAL && factor.value().equals(x)
                && factor.power().isInteger() && factor.power().signum() > 0) {
            return 2;
        }
        return Integer.MAX_VALUE;
    }

    private static Rational constantAt(MutableIntObjectMap<ExprNode> coefficients, int degree) {
        ExprNode c = coefficients.get(degree);
        return c == null ? Rational.ZERO : c.multiplier();
    }
}

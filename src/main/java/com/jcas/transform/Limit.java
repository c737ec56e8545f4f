package com.jcas.transform;

import com.jcas.error.DivisionByZeroException;
import com.jcas.error.OperatorException;
import com.jcas.error.OutOfFunctionDomainException;
import com.jcas.error.OutOfRangeException;
import com.jcas.error.UndefinedException;
import com.jcas.expr.ExprNode;
import com.jcas.expr.Shape;
import com.jcas.math.Polynomial;
import com.jcas.math.Rational;
import com.jcas.numeric.CompiledFunction;
import com.jcas.numeric.Compiler;
import com.jcas.session.Session;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Limits of a single variable. Tries direct substitution first, then splits the expression
 * into sums, quotients, products, powers and function calls, applying L'Hôpital's rule to the
 * indeterminate forms {@code 0/0}, {@code inf/inf} and {@code 0*inf}. Points at
 * {@code Infinity} compare degrees for rational functions and otherwise substitute
 * {@code x = 1/t} with {@code t -> 0+}. A pole of odd order is approached from the right.
 */
public final class Limit extends TransformSupport {
    private static final Logger logger = LoggerFactory.getLogger(Limit.class);
    public static final String INFINITY = "Infinity";
    private static final int MAX_DEPTH = 10;
    private static final String RECIPROCAL = "__t";
    private static final double[] SIDE_STEPS = {1e-4, 1e-7};

    enum Kind { FINITE, POSITIVE, NEGATIVE }

    /**
     * A finite value, or one of the two signed infinities.
     */
    record Value(Kind kind, ExprNode finite) {
        static Value of(ExprNode value) {
            return new Value(Kind.FINITE, value);
        }

        static Value infinite(int sign) {
            return new Value(sign > 0 ? Kind.POSITIVE : Kind.NEGATIVE, null);
        }

        boolean isFinite() {
            return kind == Kind.FINITE;
        }

        boolean isZero() {
            return isFinite() && finite.isZero();
        }

        int sign() {
            return kind == Kind.POSITIVE ? 1 : -1;
        }
    }

    /**
     * Values of functions at the infinities, keyed by {@code name+} and {@code name-}.
     */
    private final MutableMap<String, Value> atInfinity = Maps.mutable.empty();

    public Limit(Session session) {
        super(session);
        for (String grows : new String[]{"log", "log10", "sinh", "asinh", "cosh", "acosh", "abs"}) {
            atInfinity.put(grows + "+", Value.infinite(1));
        }
        atInfinity.put("sinh-", Value.infinite(-1));
        atInfinity.put("asinh-", Value.infinite(-1));
        atInfinity.put("cosh-", Value.infinite(1));
        atInfinity.put("abs-", Value.infinite(1));
        atInfinity.put("tanh+", Value.of(num(1)));
        atInfinity.put("tanh-", Value.of(num(-1)));
        atInfinity.put("erf+", Value.of(num(1)));
        atInfinity.put("erf-", Value.of(num(-1)));
    }

    /**
     * The limit of {@code f} as {@code x} approaches {@code point}; {@code Infinity},
     * {@code -Infinity} or an inert {@code limit(f, x, point)} otherwise.
     */
    public ExprNode limit(ExprNode f, String x, ExprNode point) {
        Value value = evaluate(f, x, point);
        if (value == null) {
            return ExprNode.function("limit", f.copy(), var(x), point.copy());
        }
        return switch (value.kind()) {
            case FINITE -> value.finite();
            case POSITIVE -> var(INFINITY);
            case NEGATIVE -> neg(var(INFINITY));
        };
    }

    /**
     * The limit when it is finite, otherwise null.
     */
    public ExprNode finiteLimit(ExprNode f, String x, ExprNode point) {
        Value value = evaluate(f, x, point);
        return value != null && value.isFinite() ? value.finite() : null;
    }

    private Value evaluate(ExprNode f, String x, ExprNode point) {
        int direction = infiniteDirection(point);
        if (direction == 0) {
            return limit(f, x, point, 0);
        }
        Value rational = rationalAtInfinity(f, x, direction);
        if (rational != null) {
            return rational;
        }
        ExprNode reciprocal = div(num(direction), var(RECIPROCAL));
        return limit(substitute(f, x, reciprocal), RECIPROCAL, ExprNode.zero(), 0);
    }

    /**
     * +1 for {@code Infinity}, -1 for {@code -Infinity}, 0 for a finite point.
     */
    static int infiniteDirection(ExprNode point) {
        if (point.shape() == Shape.MONOMIAL && point.value().equals(INFINITY) && point.power().isOne()) {
            return point.multiplier().signum();
        }
        return 0;
    }

    // ========== rules ==========

    private Value limit(ExprNode f, String x, ExprNode a, int depth) {
        deadline().check();
        if (depth > MAX_DEPTH) {
            return null;
        }
        if (!f.contains(x)) {
            return Value.of(f.copy());
        }
        ExprNode direct = directValue(f, x, a);
        if (direct != null) {
            return Value.of(direct);
        }
        Rational m = f.multiplier();
        if (!m.isOne()) {
            return scale(limit(f.withMultiplier(Rational.ONE), x, a, depth), num(m));
        }
        Decomposition.Fraction fraction = session.decomposition().fraction(f);
        if (fraction.denominator().contains(x)) {
            return quotient(fraction.numerator(), fraction.denominator(), x, a, depth);
        }
        return switch (f.shape()) {
            case SUM, POLYNOMIAL_LIST -> f.power().isOne() ? sum(f, x, a, depth) : power(f, x, a, depth);
            case PRODUCT -> product(f, x, a, depth);
            case FUNCTION -> f.power().isOne() ? function(f, x, a, depth) : power(f, x, a, depth);
            case EXPONENTIAL -> exponential(f, x, a, depth);
            case MONOMIAL -> power(f, x, a, depth);
            default -> null;
        };
    }

    private ExprNode directValue(ExprNode f, String x, ExprNode a) {
        try {
            return substitute(f, x, a);
        } catch (DivisionByZeroException | UndefinedException | OutOfFunctionDomainException e) {
            return null;
        }
    }

    private Value sum(ExprNode f, String x, ExprNode a, int depth) {
        ExprNode finite = ExprNode.zero();
        int infinite = 0;
        for (ExprNode term : f.terms()) {
            Value value = limit(term, x, a, depth + 1);
            if (value == null) {
                return null;
            }
            if (value.isFinite()) {
                finite = add(finite, value.finite());
            } else if (infinite == 0 || infinite == value.sign()) {
                infinite = value.sign();
            } else {
                return commonFraction(f, x, a, depth);
            }
        }
        return infinite == 0 ? Value.of(finite) : Value.infinite(infinite);
    }

    /**
     * {@code inf - inf}: brings the terms over one denominator.
     */
    private Value commonFraction(ExprNode f, String x, ExprNode a, int depth) {
        ExprNode numerator = ExprNode.zero();
        ExprNode denominator = ExprNode.one();
        for (ExprNode term : f.terms()) {
            Decomposition.Fraction fraction = session.decomposition().fraction(term);
            numerator = add(mul(numerator, fraction.denominator()), mul(fraction.numerator(), denominator));
            denominator = mul(denominator, fraction.denominator());
        }
        if (!denominator.contains(x)) {
            return null;
        }
        return quotient(session.expander().expand(numerator), denominator, x, a, depth + 1);
    }

    private Value quotient(ExprNode numerator, ExprNode denominator, String x, ExprNode a, int depth) {
        Value top = limit(numerator, x, a, depth + 1);
        Value bottom = limit(denominator, x, a, depth + 1);
        if (top == null || bottom == null) {
            return null;
        }
        if (!bottom.isFinite()) {
            return top.isFinite() ? Value.of(ExprNode.zero()) : lhopital(numerator, denominator, x, a, depth);
        }
        if (!bottom.isZero()) {
            if (top.isFinite()) {
                return Value.of(div(top.finite(), bottom.finite()));
            }
            int sign = signOf(bottom.finite());
            return sign == 0 ? null : Value.infinite(top.sign() * sign);
        }
        if (top.isZero()) {
            return lhopital(numerator, denominator, x, a, depth);
        }
        int topSign = top.isFinite() ? signOf(top.finite()) : top.sign();
        int poleSign = sideSign(denominator, x, a);
        if (topSign == 0 || poleSign == 0) {
            return null;
        }
        return Value.infinite(topSign * poleSign);
    }

    private Value lhopital(ExprNode numerator, ExprNode denominator, String x, ExprNode a, int depth) {
        if (depth >= MAX_DEPTH) {
            return null;
        }
        ExprNode top = session.derivative().diff(numerator, x, 1);
        ExprNode bottom = session.derivative().diff(denominator, x, 1);
        if (bottom.isZero()) {
            return null;
        }
        logger.debug("L'Hopital on ({})/({}) at {}", numerator, denominator, a);
        return limit(div(top, bottom), x, a, depth + 1);
    }

    private Value product(ExprNode f, String x, ExprNode a, int depth) {
        ExprNode finite = ExprNode.one();
        ExprNode zeros = ExprNode.one();
        ExprNode infinities = ExprNode.one();
        int sign = 1;
        boolean hasZero = false;
        boolean hasInfinity = false;
        for (ExprNode factor : f.factors()) {
            Value value = limit(factor, x, a, depth + 1);
            if (value == null) {
                return null;
            }
            if (value.isZero()) {
                hasZero = true;
                zeros = mul(zeros, factor);
            } else if (value.isFinite()) {
                finite = mul(finite, value.finite());
            } else {
                hasInfinity = true;
                sign *= value.sign();
                infinities = mul(infinities, factor);
            }
        }
        if (!hasInfinity) {
            return Value.of(hasZero ? ExprNode.zero() : finite);
        }
        if (!hasZero) {
            int finiteSign = signOf(finite);
            return finiteSign == 0 ? null : Value.infinite(sign * finiteSign);
        }
        ExprNode expanded = session.expander().expand(f);
        if (expanded.terms().size() > 1) {
            return limit(expanded, x, a, depth + 1);
        }
        return scale(lhopital(infinities, inv(zeros), x, a, depth), finite);
    }

    private Value power(ExprNode f, String x, ExprNode a, int depth) {
        Rational p = f.power();
        Value base = limit(f.withPower(Rational.ONE), x, a, depth + 1);
        if (base == null) {
            return null;
        }
        if (base.isFinite()) {
            if (base.isZero()) {
                return p.signum() > 0 ? Value.of(ExprNode.zero()) : null;
            }
            return Value.of(pow(base.finite(), p));
        }
        if (p.signum() < 0) {
            return Value.of(ExprNode.zero());
        }
        if (base.sign() > 0) {
            return Value.infinite(1);
        }
        if (!p.isInteger()) {
            return null;
        }
        return Value.infinite(p.numerator().testBit(0) ? -1 : 1);
    }

    private Value function(ExprNode f, String x, ExprNode a, int depth) {
        if (f.args().size() != 1) {
            return null;
        }
        String name = f.value();
        Value argument = limit(f.arg(0), x, a, depth + 1);
        if (argument == null) {
            return null;
        }
        if (argument.isFinite()) {
            try {
                return Value.of(session.applyFunction(name, Lists.mutable.with(argument.finite())));
            } catch (OutOfFunctionDomainException | DivisionByZeroException | UndefinedException e) {
                boolean logOfZero = (name.equals("log") || name.equals("log10")) && argument.isZero();
                return logOfZero ? Value.infinite(-1) : null;
            }
        }
        if (name.equals("atan")) {
            return Value.of(mul(num(Rational.valueOf(argument.sign(), 2)), var("pi")));
        }
        return atInfinity.get(name + (argument.sign() > 0 ? "+" : "-"));
    }

    /**
     * {@code b^u}: a constant base follows the exponent; otherwise {@code e^(u*log(b))}.
     */
    private Value exponential(ExprNode f, String x, ExprNode a, int depth) {
        ExprNode base = f.base();
        if (base.contains(x)) {
            ExprNode rewritten = pow(var("e"), mul(f.exponent(), call("log", base)));
            return limit(rewritten, x, a, depth + 1);
        }
        Value exponent = limit(f.exponent(), x, a, depth + 1);
        if (exponent == null) {
            return null;
        }
        if (exponent.isFinite()) {
            return Value.of(pow(base, exponent.finite()));
        }
        int growth = signOf(sub(base, num(1)));
        if (growth == 0 || signOf(base) <= 0) {
            return null;
        }
        return growth * exponent.sign() > 0 ? Value.infinite(1) : Value.of(ExprNode.zero());
    }

    // ========== infinity ==========

    /**
     * Rational functions at {@code +-Infinity} by comparing degrees, or null when {@code f} is
     * not a ratio of polynomials.
     */
    private Value rationalAtInfinity(ExprNode f, String x, int direction) {
        Decomposition decomposition = session.decomposition();
        Decomposition.Fraction fraction = decomposition.fraction(f);
        Polynomial numerator = decomposition.toPolynomial(fraction.numerator(), x);
        Polynomial denominator = decomposition.toPolynomial(fraction.denominator(), x);
        if (numerator == null || denominator == null || denominator.isZero()) {
            return null;
        }
        if (numerator.isZero()) {
            return Value.of(ExprNode.zero());
        }
        int excess = numerator.degree() - denominator.degree();
        Rational ratio = numerator.leading().divide(denominator.leading());
        if (excess < 0) {
            return Value.of(ExprNode.zero());
        }
        if (excess == 0) {
            return Value.of(num(ratio));
        }
        int sign = ratio.signum() * (direction < 0 && excess % 2 == 1 ? -1 : 1);
        return Value.infinite(sign);
    }

    // ========== signs ==========

    private Value scale(Value value, ExprNode factor) {
        if (value == null) {
            return null;
        }
        if (value.isFinite()) {
            return Value.of(mul(factor, value.finite()));
        }
        int sign = signOf(factor);
        return sign == 0 ? null : Value.infinite(value.sign() * sign);
    }

    /**
     * Sign of a closed-form value, 0 when it is zero or cannot be evaluated.
     */
    private static int signOf(ExprNode value) {
        if (value.isConstant()) {
            return value.multiplier().signum();
        }
        try {
            double approximation = Compiler.compile(value).apply();
            return Double.isNaN(approximation) ? 0 : (int) Math.signum(approximation);
        } catch (UndefinedException | OperatorException | DivisionByZeroException | OutOfRangeException e) {
            return 0;
        }
    }

    /**
     * Sign of {@code g} just to the right of {@code a}, or 0 when the samples disagree.
     */
    private static int sideSign(ExprNode g, String x, ExprNode a) {
        try {
            CompiledFunction compiled = Compiler.compile(g, x);
            double at = Compiler.compile(a).apply();
            int sign = 0;
            for (double step : SIDE_STEPS) {
                double sample = compiled.apply(at + step * Math.max(1, Math.abs(at)));
                int s = Double.isNaN(sample) ? 0 : (int) Math.signum(sample);
                if (s == 0 || (sign != 0 && s != sign)) {
                    return 0;
                }
                sign = s;
            }
            return sign;
        } catch (UndefinedException | OperatorException | DivisionByZeroException e) {
            return 0;
        }
    }
}

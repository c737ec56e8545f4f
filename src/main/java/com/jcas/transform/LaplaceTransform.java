package com.jcas.transform;

import com.jcas.expr.ExprNode;
import com.jcas.expr.Shape;
import com.jcas.math.Rational;
import com.jcas.session.Session;
import org.eclipse.collections.api.map.primitive.MutableIntObjectMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * The Laplace transform {@code F(s) = integral from 0 to infinity of e^(-s*t)*f(t) dt} and its
 * inverse. Both work from a table of standard pairs plus linearity; the forward transform falls
 * back to symbolic integration, the inverse to partial fractions. Anything else is returned as
 * an inert {@code laplace(f, t, s)} or {@code ilt(F, s, t)}.
 */
public final class LaplaceTransform extends TransformSupport {
    private static final Logger logger = LoggerFactory.getLogger(LaplaceTransform.class);

    /**
     * Raised when a term has no known pair; never escapes this class.
     */
    private static final class NoTransformFoundException extends RuntimeException {
        NoTransformFoundException(String message) {
            super(message, null, false, false);
        }
    }

    public LaplaceTransform(Session session) {
        super(session);
    }

    // ========== forward ==========

    public ExprNode laplace(ExprNode f, String t, String s) {
        try {
            return forward(f, t, s);
        } catch (NoTransformFoundException e) {
            logger.debug("No Laplace transform of {}: {}", f, e.getMessage());
            return ExprNode.function("laplace", f, var(t), var(s));
        }
    }

    private ExprNode forward(ExprNode f, String t, String s) {
        deadline().check();
        if (!f.contains(t)) {
            return div(f, var(s));
        }
        if (f.terms().size() > 1) {
            ExprNode result = ExprNode.zero();
            for (ExprNode term : f.terms()) {
                result = add(result, forward(term, t, s));
            }
            return result;
        }
        Decomposition.Split split = session.decomposition().splitCoefficient(f, t);
        ExprNode rest = split.rest();
        ExprNode transformed = tablePair(rest, t, s);
        if (transformed == null) {
            transformed = shifted(rest, t, s);
        }
        if (transformed == null) {
            transformed = byIntegration(rest, t, s);
        }
        return mul(split.coefficient(), transformed);
    }

    private ExprNode tablePair(ExprNode f, String t, String s) {
        return switch (f.shape()) {
            case MONOMIAL -> powerOfTime(f.power(), s);
            case EXPONENTIAL -> {
                if (f.base().contains(t)) {
                    yield null;
                }
                Decomposition.Linear linear = session.decomposition().linear(f.exponent(), t);
                if (linear == null) {
                    yield null;
                }
                // e^(a*t + b) = e^b * e^(a*t)
                ExprNode rate = mul(linear.a(), call("log", f.base()));
                yield div(pow(f.base(), linear.b()), sub(var(s), rate));
            }
            case FUNCTION -> {
                if (!f.power().isOne() || f.args().size() != 1) {
                    yield null;
                }
                Decomposition.Linear linear = session.decomposition().linear(f.arg(0), t);
                if (linear == null || !linear.b().isZero()) {
                    yield null;
                }
                ExprNode a = linear.a();
                ExprNode sSquared = pow(var(s), Rational.TWO);
                ExprNode aSquared = pow(a, Rational.TWO);
                yield switch (f.value()) {
                    case "sin" -> div(a, add(sSquared, aSquared));
                    case "cos" -> div(var(s), add(sSquared, aSquared));
                    case "sinh" -> div(a, sub(sSquared, aSquared));
                    case "cosh" -> div(var(s), sub(sSquared, aSquared));
                    default -> null;
                };
            }
            default -> null;
        };
    }

    /**
     * {@code t^p -> Gamma(p+1)/s^(p+1)} for non-negative integers and half-integers above -1.
     */
    private ExprNode powerOfTime(Rational p, String s) {
        Rational next = p.add(Rational.ONE);
        ExprNode gamma = gamma(next);
        if (gamma == null) {
            return null;
        }
        return div(gamma, pow(var(s), next));
    }

    /**
     * {@code Gamma(z)} for positive integers and positive half-integers, else null.
     */
    private ExprNode gamma(Rational z) {
        if (z.signum() <= 0) {
            return null;
        }
        if (z.isInteger()) {
            Rational result = Rational.ONE;
            for (int k = 2; k < z.intValueExact(); k++) {
                result = result.multiply(Rational.valueOf(k));
            }
            return num(result);
        }
        if (!z.denominator().equals(BigInteger.TWO)) {
            return null;
        }
        // Gamma(1/2) = sqrt(pi), Gamma(z + 1) = z * Gamma(z)
        Rational result = Rational.ONE;
        for (Rational k = Rational.HALF; k.compareTo(z) < 0; k = k.add(Rational.ONE)) {
            result = result.multiply(k);
        }
        return mul(num(result), pow(var("pi"), Rational.HALF));
    }

    /**
     * Frequency shift {@code e^(a*t)*g(t) -> G(s - a)} and multiplication by time
     * {@code t^n*g(t) -> (-1)^n * d^n/ds^n G(s)}.
     */
    private ExprNode shifted(ExprNode f, String t, String s) {
        if (f.shape() != Shape.PRODUCT) {
            return null;
        }
        for (ExprNode factor : f.factors()) {
            ExprNode others = div(f, factor);
            if (factor.shape() == Shape.EXPONENTIAL && factor.base().isVariable("e")) {
                Decomposition.Linear linear = session.decomposition().linear(factor.exponent(), t);
                if (linear != null && !linear.a().contains(s)) {
                    ExprNode inner = laplace(others, t, s);
                    if (inner.containsFunction("laplace")) {
                        return null;
                    }
                    ExprNode shift = sub(var(s), linear.a());
                    return mul(pow(var("e"), linear.b()), substitute(inner, s, shift));
                }
            }
            if (factor.shape() == Shape.MONOMIAL && factor.value().equals(t)
                    && factor.power().isInteger() && factor.power().signum() > 0) {
                ExprNode inner = laplace(others, t, s);
                if (inner.containsFunction("laplace")) {
                    return null;
                }
                int n = factor.power().intValueExact();
                ExprNode derivative = session.derivative().diff(inner, s, n);
                return n % 2 == 0 ? derivative : neg(derivative);
            }
        }
        return null;
    }

    /**
     * {@code -F(0)} where {@code F} is an antiderivative of {@code e^(-s*t)*f(t)}, assuming
     * {@code F} vanishes at infinity for large enough {@code s}.
     */
    private ExprNode byIntegration(ExprNode f, String t, String s) {
        int depth = Math.max(session.settings().integrationDepth(), session.settings().laplaceIntegrationDepth());
        ExprNode kernel = mul(pow(var("e"), neg(mul(var(s), var(t)))), f);
        ExprNode antiderivative = session.settings().override(
                settings -> settings.setIntegrationDepth(depth),
                () -> session.integrator().antiderivative(kernel, t));
        if (antiderivative == null) {
            throw new NoTransformFoundException("e^(-" + s + "*" + t + ")*" + f + " has no antiderivative");
        }
        return neg(substitute(antiderivative, t, ExprNode.zero()));
    }

    // ========== inverse ==========

    public ExprNode inverseLaplace(ExprNode transform, String s, String t) {
        try {
            return inverse(transform, s, t);
        } catch (NoTransformFoundException e) {
            logger.debug("No inverse Laplace transform of {}: {}", transform, e.getMessage());
            return ExprNode.function("ilt", transform, var(s), var(t));
        }
    }

    private ExprNode inverse(ExprNode transform, String s, String t) {
        deadline().check();
        if (!transform.contains(s)) {
            throw new NoTransformFoundException("constant " + transform + " is an impulse");
        }
        ExprNode decomposed = session.partialFractions().decompose(transform, s);
        ExprNode source = decomposed == null ? transform : decomposed;
        ExprNode result = ExprNode.zero();
        for (ExprNode term : source.terms()) {
            result = add(result, inverseTerm(term, s, t));
        }
        return result;
    }

    private ExprNode inverseTerm(ExprNode term, String s, String t) {
        deadline().check();
        if (!term.contains(s)) {
            throw new NoTransformFoundException("constant term " + term + " is an impulse");
        }
        Decomposition.Split split = session.decomposition().splitCoefficient(term, s);
        ExprNode rest = split.rest();
        ExprNode result = inversePower(rest, s, t);
        if (result == null) {
            result = inverseQuadratic(rest, s, t);
        }
        if (result == null) {
            throw new NoTransformFoundException("no pair for " + rest);
        }
        return mul(split.coefficient(), result);
    }

    /**
     * {@code 1/s^p -> t^(p-1)/Gamma(p)} and {@code 1/(a*s + b)^n} by the shift theorem.
     */
    private ExprNode inversePower(ExprNode rest, String s, String t) {
        Rational p = rest.power().negate();
        if (p.signum() <= 0 || rest.shape() == Shape.PRODUCT || rest.shape() == Shape.EXPONENTIAL) {
            return null;
        }
        ExprNode gamma = gamma(p);
        if (gamma == null) {
            return null;
        }
        ExprNode kernel = div(pow(var(t), p.subtract(Rational.ONE)), gamma);
        if (rest.shape() == Shape.MONOMIAL && rest.value().equals(s)) {
            return kernel;
        }
        if (!rest.shape().isComposite()) {
            return null;
        }
        Decomposition.Linear linear = session.decomposition().linear(rest.withPower(Rational.ONE), s);
        if (linear == null) {
            return null;
        }
        // (a*s + b)^-p = a^-p * (s + b/a)^-p
        ExprNode shift = div(linear.b(), linear.a());
        ExprNode decay = pow(var("e"), neg(mul(shift, var(t))));
        return mul(pow(linear.a(), p.negate()), mul(kernel, decay));
    }

    /**
     * {@code (p*s + q)/(a*s^2 + b*s + c)} by completing the square: with
     * {@code a*((s + h)^2 + k)} the result is {@code e^(-h*t)} times cos/sin of {@code sqrt(k)*t},
     * or cosh/sinh of {@code sqrt(-k)*t} when {@code k} is a negative constant.
     */
    private ExprNode inverseQuadratic(ExprNode rest, String s, String t) {
        Decomposition.Fraction fraction = session.decomposition().fraction(rest);
        MutableIntObjectMap<ExprNode> denominator = session.decomposition().coefficients(fraction.denominator(), s);
        MutableIntObjectMap<ExprNode> numerator = session.decomposition().coefficients(fraction.numerator(), s);
        if (denominator == null || numerator == null || denominator.isEmpty()
                || denominator.keySet().max() != 2 || (!numerator.isEmpty() && numerator.keySet().max() > 1)) {
            return null;
        }
        ExprNode a = coefficient(denominator, 2);
        ExprNode h = div(coefficient(denominator, 1), mul(num(2), a));
        ExprNode k = sub(div(coefficient(denominator, 0), a), pow(h, Rational.TWO));
        ExprNode p = div(coefficient(numerator, 1), a);
        ExprNode q = div(coefficient(numerator, 0), a);
        if (k.isZero()) {
            // (p*(s + h) + q - p*h)/(s + h)^2
            ExprNode linearPart = add(p, mul(sub(q, mul(p, h)), var(t)));
            return mul(linearPart, pow(var("e"), neg(mul(h, var(t)))));
        }
        boolean hyperbolic = k.isConstant() && k.multiplier().isNegative();
        ExprNode omega = pow(hyperbolic ? neg(k) : k, Rational.HALF);
        ExprNode angle = mul(omega, var(t));
        ExprNode even = call(hyperbolic ? "cosh" : "cos", angle);
        ExprNode odd = call(hyperbolic ? "sinh" : "sin", angle);
        ExprNode oscillation = add(mul(p, even), mul(div(sub(q, mul(p, h)), omega), odd));
        return mul(pow(var("e"), neg(mul(h, var(t)))), oscillation);
    }

    private static ExprNode coefficient(MutableIntObjectMap<ExprNode> coefficients, int degree) {
        ExprNode c = coefficients.get(degree);
        return c == null ? ExprNode.zero() : c;
    }
}
